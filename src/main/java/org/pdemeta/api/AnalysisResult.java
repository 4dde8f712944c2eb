package org.pdemeta.api;

import org.pdemeta.boundary.BoundaryMap;
import org.pdemeta.boundary.DerivativeOrderTable;
import org.pdemeta.boundary.EdgeBoundary;
import org.pdemeta.boundary.PeriodicMap;
import org.pdemeta.problem.Interval;
import org.pdemeta.problem.PdeProblem;
import org.pdemeta.varmap.VariableMap;

import java.util.List;
import java.util.Optional;

/**
 * Everything a discretization backend needs from one analysis run. Read-only.
 *
 * @param problem The problem after any backend transformation.
 * @param variableMap The final variable map.
 * @param boundaryMap The validated boundary map.
 * @param periodicMap Periodicity per unknown and coordinate.
 * @param boundaryOrders Derivative orders found in the boundary conditions, per coordinate.
 * @param equationOrders Derivative orders of the governing equations per spatial coordinate,
 *                       merged with the boundary orders.
 * @param initialConditions The initial conditions, grouped by unknown in boundary-map order.
 * @param timeSpan The domain of the time coordinate, or {@code null} for steady-state problems.
 */
public record AnalysisResult(
        PdeProblem problem,
        VariableMap variableMap,
        BoundaryMap boundaryMap,
        PeriodicMap periodicMap,
        DerivativeOrderTable boundaryOrders,
        DerivativeOrderTable equationOrders,
        List<EdgeBoundary> initialConditions,
        Interval timeSpan
) {

    public AnalysisResult {
        initialConditions = List.copyOf(initialConditions);
    }

    public Optional<Interval> time() {
        return Optional.ofNullable(timeSpan);
    }

    public boolean isTimeDependent() {
        return timeSpan != null;
    }
}
