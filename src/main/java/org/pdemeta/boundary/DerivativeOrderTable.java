package org.pdemeta.boundary;

import org.pdemeta.expr.Equation;
import org.pdemeta.expr.Symbol;
import org.pdemeta.inspect.ExpressionInspector;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Per coordinate, the distinct non-zero derivative orders found in a set of equations,
 * sorted descending. Coordinates without any derivative map to an empty list.
 */
public final class DerivativeOrderTable {

    private final Map<Symbol, List<Integer>> orders;

    private DerivativeOrderTable(Map<Symbol, List<Integer>> orders) {
        this.orders = Collections.unmodifiableMap(orders);
    }

    /**
     * @param equations The equations to scan.
     * @param coordinates The coordinates to build entries for.
     * @return The table.
     */
    public static DerivativeOrderTable of(Collection<Equation> equations, Collection<Symbol> coordinates) {
        Map<Symbol, List<Integer>> orders = new LinkedHashMap<>();
        for (Symbol x : coordinates) {
            orders.put(x, ExpressionInspector.derivativeOrders(equations, x));
        }
        return new DerivativeOrderTable(orders);
    }

    public static DerivativeOrderTable empty() {
        return new DerivativeOrderTable(new LinkedHashMap<>());
    }

    public boolean contains(Symbol coordinate) {
        return orders.containsKey(coordinate);
    }

    /**
     * @param coordinate A coordinate.
     * @return Its orders, descending; empty if the coordinate has no entry.
     */
    public List<Integer> orders(Symbol coordinate) {
        return orders.getOrDefault(coordinate, List.of());
    }

    /**
     * @param coordinate A coordinate.
     * @return The highest order, 0 if none.
     */
    public int maxOrder(Symbol coordinate) {
        List<Integer> list = orders(coordinate);
        return list.isEmpty() ? 0 : list.get(0);
    }

    /**
     * Merges two tables entry by entry.
     *
     * @param other The other table.
     * @return A table holding, per coordinate, the union of both order lists.
     */
    public DerivativeOrderTable union(DerivativeOrderTable other) {
        Map<Symbol, List<Integer>> merged = new LinkedHashMap<>();
        for (Map<Symbol, List<Integer>> source : List.of(orders, other.orders)) {
            source.forEach((x, list) -> {
                TreeSet<Integer> set = new TreeSet<>(Comparator.reverseOrder());
                set.addAll(merged.getOrDefault(x, List.of()));
                set.addAll(list);
                merged.put(x, List.copyOf(set));
            });
        }
        return new DerivativeOrderTable(merged);
    }

    public Map<Symbol, List<Integer>> asMap() {
        return orders;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DerivativeOrderTable that && orders.equals(that.orders);
    }

    @Override
    public int hashCode() {
        return orders.hashCode();
    }

    @Override
    public String toString() {
        return orders.toString();
    }
}
