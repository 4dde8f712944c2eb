package org.pdemeta.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * A nested group of conditions. Groups carry no meaning of their own; they are
 * flattened before any analysis runs.
 *
 * @param entries The grouped entries, in order.
 */
public record ConditionGroup(List<ConditionEntry> entries) implements ConditionEntry {

    public ConditionGroup {
        entries = List.copyOf(entries);
    }

    public static ConditionGroup of(ConditionEntry... entries) {
        return new ConditionGroup(List.of(entries));
    }

    /**
     * Flattens a list of entries depth-first into one ordered list of equations.
     *
     * @param entries The possibly nested entries.
     * @return All equations in their original order.
     */
    public static List<Equation> flatten(List<? extends ConditionEntry> entries) {
        List<Equation> result = new ArrayList<>();
        collect(entries, result);
        return result;
    }

    private static void collect(List<? extends ConditionEntry> entries, List<Equation> out) {
        for (ConditionEntry entry : entries) {
            if (entry instanceof Equation eq) {
                out.add(eq);
            } else if (entry instanceof ConditionGroup group) {
                collect(group.entries(), out);
            }
        }
    }
}
