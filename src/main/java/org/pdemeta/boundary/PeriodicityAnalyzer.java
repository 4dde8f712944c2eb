package org.pdemeta.boundary;

import org.pdemeta.expr.FunctionTag;
import org.pdemeta.expr.Symbol;
import org.pdemeta.varmap.VariableMap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the {@link PeriodicMap} of an assembled boundary map.
 * <p>
 * {@code (u, x)} is periodic if an interface filed under it joins the lower and the upper
 * bound of {@code x} on {@code u} itself. The free coordinates of both ends are then
 * identical since the classifier already required matching free signatures.
 */
public final class PeriodicityAnalyzer {

    private PeriodicityAnalyzer() {}

    public static PeriodicMap analyze(BoundaryMap boundaryMap, VariableMap variableMap) {
        Map<FunctionTag, Map<Symbol, Boolean>> flags = new LinkedHashMap<>();
        for (FunctionTag function : variableMap.functionTags()) {
            Map<Symbol, Boolean> byCoordinate = new LinkedHashMap<>();
            for (Symbol x : variableMap.allCoordinates()) {
                byCoordinate.put(x, isPeriodic(boundaryMap.get(function, x)));
            }
            flags.put(function, byCoordinate);
        }
        return new PeriodicMap(flags);
    }

    private static boolean isPeriodic(List<Boundary> boundaries) {
        for (Boundary boundary : boundaries) {
            if (boundary instanceof InterfaceBoundary ib && ib.first().isOppositeOf(ib.second())) {
                return true;
            }
            if (boundary instanceof HigherOrderInterfaceBoundary hb && hb.first().isOppositeOf(hb.second())) {
                return true;
            }
        }
        return false;
    }
}
