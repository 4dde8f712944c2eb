package org.pdemeta.boundary;

import org.pdemeta.expr.FunctionTag;
import org.pdemeta.expr.Symbol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Periodicity flag per unknown and coordinate, plus whether any pair is periodic at all.
 */
public final class PeriodicMap {

    private final Map<FunctionTag, Map<Symbol, Boolean>> flags;
    private final boolean hasPeriodic;

    PeriodicMap(Map<FunctionTag, Map<Symbol, Boolean>> flags) {
        Map<FunctionTag, Map<Symbol, Boolean>> copy = new LinkedHashMap<>();
        flags.forEach((function, inner) -> copy.put(function, Collections.unmodifiableMap(new LinkedHashMap<>(inner))));
        this.flags = Collections.unmodifiableMap(copy);
        this.hasPeriodic = flags.values().stream().flatMap(m -> m.values().stream()).anyMatch(Boolean::booleanValue);
    }

    /**
     * @param function An unknown.
     * @param coordinate A coordinate.
     * @return {@code true} if the unknown wraps around along the coordinate.
     */
    public boolean isPeriodic(FunctionTag function, Symbol coordinate) {
        return flags.getOrDefault(function, Map.of()).getOrDefault(coordinate, false);
    }

    public boolean hasPeriodic() {
        return hasPeriodic;
    }

    public Map<FunctionTag, Map<Symbol, Boolean>> asMap() {
        return flags;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PeriodicMap that && flags.equals(that.flags);
    }

    @Override
    public int hashCode() {
        return flags.hashCode();
    }

    @Override
    public String toString() {
        return "PeriodicMap{hasPeriodic=" + hasPeriodic + ", " + flags + "}";
    }
}
