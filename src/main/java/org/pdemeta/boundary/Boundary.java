package org.pdemeta.boundary;

import org.pdemeta.expr.Equation;
import org.pdemeta.expr.FunctionTag;
import org.pdemeta.expr.Symbol;

import java.util.List;

/**
 * A classified boundary or initial condition.
 * <p>
 * The taxonomy is closed. Consumers branch with {@code instanceof} over the permitted
 * records and end with an {@link IllegalStateException}.
 */
public sealed interface Boundary permits EdgeBoundary, InterfaceBoundary, HigherOrderInterfaceBoundary {

    /**
     * @return The unknown this boundary is filed under.
     */
    FunctionTag function();

    /**
     * @return The coordinate this boundary is filed under.
     */
    Symbol coordinate();

    /**
     * @return The original equation.
     */
    Equation equation();

    /**
     * @return The boundary ends, the filing end first.
     */
    List<BoundaryEnd> ends();

    /**
     * @return The highest derivative order with respect to a fixed coordinate.
     */
    int order();
}
