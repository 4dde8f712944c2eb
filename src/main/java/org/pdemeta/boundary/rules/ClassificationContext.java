package org.pdemeta.boundary.rules;

import org.pdemeta.api.UnclassifiableBoundaryException;
import org.pdemeta.boundary.BoundaryEnd;
import org.pdemeta.boundary.DerivativeOrderTable;
import org.pdemeta.expr.Apply;
import org.pdemeta.expr.Equation;
import org.pdemeta.expr.Symbol;
import org.pdemeta.inspect.ExpressionInspector;
import org.pdemeta.varmap.VariableMap;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * What the classifier found in one boundary equation: the distinct boundary ends it references
 * and the application that first referenced each end.
 *
 * @param equation The equation being classified.
 * @param ends The distinct ends in discovery order.
 * @param applications For every end, the first application that references it.
 * @param variableMap The variable map of the run.
 * @param orderTable The boundary derivative-order table.
 */
public record ClassificationContext(Equation equation,
                                    List<BoundaryEnd> ends,
                                    Map<BoundaryEnd, Apply> applications,
                                    VariableMap variableMap,
                                    DerivativeOrderTable orderTable) {

    public ClassificationContext {
        ends = List.copyOf(ends);
        applications = Collections.unmodifiableMap(applications);
    }

    /**
     * @return The single end of a one-ended condition.
     * @throws IllegalStateException if the equation references more than one end.
     */
    public BoundaryEnd singleEnd() {
        if (ends.size() != 1) {
            throw new IllegalStateException("Expected exactly one boundary end, got " + ends);
        }
        return ends.get(0);
    }

    public boolean isTime(Symbol coordinate) {
        return variableMap.isTime(coordinate);
    }

    /**
     * The highest derivative order of the equation with respect to {@code coordinate}.
     * Coordinates without an entry in the order table count as 0.
     *
     * @param coordinate The coordinate.
     * @return The order, 0 if none.
     */
    public int orderAlong(Symbol coordinate) {
        if (!orderTable.contains(coordinate)) {
            return 0;
        }
        return ExpressionInspector.allDerivativeOrders(equation, coordinate).stream()
                .mapToInt(Integer::intValue)
                .max()
                .orElse(0);
    }

    /**
     * @param reason The reason code.
     * @param detail A human-readable explanation.
     * @return An exception for this equation, to be thrown by the caller.
     */
    public UnclassifiableBoundaryException unclassifiable(UnclassifiableBoundaryException.Reason reason, String detail) {
        return new UnclassifiableBoundaryException(equation, reason, detail);
    }
}
