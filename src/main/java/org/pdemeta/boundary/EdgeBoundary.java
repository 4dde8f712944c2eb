package org.pdemeta.boundary;

import org.pdemeta.expr.Apply;
import org.pdemeta.expr.Equation;
import org.pdemeta.expr.FunctionTag;
import org.pdemeta.expr.Symbol;

import java.util.List;

/**
 * A condition on one end of one coordinate's domain, e.g. {@code u(t, 0) ~ 0}.
 * An edge on the time coordinate at its lower bound is an initial condition.
 *
 * @param unknown The genuine form of the constrained unknown, e.g. {@code u(t, x)}.
 * @param coordinate The fixed coordinate.
 * @param upper {@code true} if the condition sits on the upper bound.
 * @param order The highest derivative order with respect to {@code coordinate}.
 * @param equation The original equation.
 * @param initialCondition {@code true} if this is an initial condition.
 */
public record EdgeBoundary(Apply unknown, Symbol coordinate, boolean upper, int order, Equation equation,
                           boolean initialCondition) implements Boundary {

    @Override
    public FunctionTag function() {
        return unknown.function();
    }

    @Override
    public List<BoundaryEnd> ends() {
        return List.of(new BoundaryEnd(unknown.function(), coordinate, upper));
    }

    public boolean isInitialCondition() {
        return initialCondition;
    }

    @Override
    public String toString() {
        String kind = initialCondition ? "Initial" : (upper ? "Upper" : "Lower");
        return kind + "Boundary[" + unknown.render() + ", " + coordinate + ", order=" + order + ": " + equation.render() + "]";
    }
}
