package org.pdemeta.boundary.rules;

import org.pdemeta.api.UnclassifiableBoundaryException;
import org.pdemeta.api.UnclassifiableBoundaryException.Reason;
import org.pdemeta.boundary.Boundary;
import org.pdemeta.boundary.BoundaryEnd;
import org.pdemeta.boundary.HigherOrderInterfaceBoundary;
import org.pdemeta.boundary.InterfaceBoundary;
import org.pdemeta.expr.Symbol;
import org.pdemeta.varmap.VariableMap;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Two ends coupled across an interface, e.g. {@code u(t, 1) ~ v(t, 0)}, or the two ends of
 * one coordinate for a periodic pairing {@code u(t, 0) ~ u(t, 1)}.
 * <p>
 * Both unknowns must agree on their remaining coordinates once the fixed coordinate is
 * removed, and neither end may fix time.
 */
public class InterfaceRule implements IClassificationRule {

    @Override
    public Optional<Boundary> classify(ClassificationContext context) throws UnclassifiableBoundaryException {
        if (context.ends().size() != 2) {
            return Optional.empty();
        }
        BoundaryEnd first = context.ends().get(0);
        BoundaryEnd second = context.ends().get(1);

        if (context.isTime(first.coordinate()) || context.isTime(second.coordinate())) {
            throw context.unclassifiable(Reason.TIME_INTERFACE,
                    "interfaces cannot couple through the time coordinate (" + first + ", " + second + ")");
        }

        List<Symbol> firstFree = freeCoordinates(context.variableMap(), first);
        List<Symbol> secondFree = freeCoordinates(context.variableMap(), second);
        if (!firstFree.equals(secondFree)) {
            throw context.unclassifiable(Reason.SIGNATURE_MISMATCH,
                    first + " leaves " + firstFree + " free but " + second + " leaves " + secondFree + " free");
        }

        int order = Math.max(context.orderAlong(first.coordinate()), context.orderAlong(second.coordinate()));
        if (order == 0) {
            return Optional.of(new InterfaceBoundary(first, second, context.equation()));
        }
        LinkedHashSet<Symbol> coordinates = new LinkedHashSet<>(List.of(first.coordinate(), second.coordinate()));
        return Optional.of(new HigherOrderInterfaceBoundary(first, second,
                new LinkedHashSet<>(List.of(first.function(), second.function())),
                coordinates, order, context.equation()));
    }

    private static List<Symbol> freeCoordinates(VariableMap variableMap, BoundaryEnd end) {
        List<Symbol> free = new ArrayList<>(variableMap.signature(end.function()));
        free.remove(end.coordinate());
        return free;
    }
}
