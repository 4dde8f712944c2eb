package org.pdemeta.boundary;

import org.pdemeta.expr.FunctionTag;
import org.pdemeta.expr.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classified boundaries grouped by unknown, then by coordinate (time included).
 * Every unknown has an entry for every coordinate; inner lists keep classification order.
 */
public final class BoundaryMap {

    private final Map<FunctionTag, Map<Symbol, List<Boundary>>> entries;

    BoundaryMap(Map<FunctionTag, Map<Symbol, List<Boundary>>> entries) {
        Map<FunctionTag, Map<Symbol, List<Boundary>>> copy = new LinkedHashMap<>();
        entries.forEach((function, byCoordinate) -> {
            Map<Symbol, List<Boundary>> inner = new LinkedHashMap<>();
            byCoordinate.forEach((x, list) -> inner.put(x, List.copyOf(list)));
            copy.put(function, Collections.unmodifiableMap(inner));
        });
        this.entries = Collections.unmodifiableMap(copy);
    }

    /**
     * @param function An unknown.
     * @param coordinate A coordinate.
     * @return The boundaries filed under the pair, empty if none.
     */
    public List<Boundary> get(FunctionTag function, Symbol coordinate) {
        Map<Symbol, List<Boundary>> byCoordinate = entries.get(function);
        if (byCoordinate == null) {
            return List.of();
        }
        return byCoordinate.getOrDefault(coordinate, List.of());
    }

    /**
     * @param function An unknown.
     * @return The coordinate-keyed lists of that unknown, empty if it is not an unknown.
     */
    public Map<Symbol, List<Boundary>> get(FunctionTag function) {
        return entries.getOrDefault(function, Map.of());
    }

    public List<FunctionTag> functions() {
        return List.copyOf(entries.keySet());
    }

    /**
     * @return Every boundary exactly once, grouped by unknown then coordinate.
     */
    public List<Boundary> all() {
        List<Boundary> all = new ArrayList<>();
        entries.values().forEach(byCoordinate -> byCoordinate.values().forEach(all::addAll));
        return all;
    }

    /**
     * @param coordinate A coordinate.
     * @return All boundaries filed under that coordinate, for every unknown.
     */
    public List<Boundary> onCoordinate(Symbol coordinate) {
        List<Boundary> result = new ArrayList<>();
        entries.values().forEach(byCoordinate -> result.addAll(byCoordinate.getOrDefault(coordinate, List.of())));
        return result;
    }

    public Map<FunctionTag, Map<Symbol, List<Boundary>>> asMap() {
        return entries;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BoundaryMap that && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "BoundaryMap" + entries;
    }
}
