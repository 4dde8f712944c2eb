package org.pdemeta.boundary;

import org.pdemeta.expr.Equation;
import org.pdemeta.expr.FunctionTag;
import org.pdemeta.expr.Symbol;

import java.util.List;

/**
 * A value-continuity condition coupling two boundary ends, e.g. {@code u(t, 0) ~ v(t, 1)}.
 * Filed under {@code first}.
 *
 * @param first The first end in the equation.
 * @param second The other end.
 * @param equation The original equation.
 */
public record InterfaceBoundary(BoundaryEnd first, BoundaryEnd second, Equation equation) implements Boundary {

    @Override
    public FunctionTag function() {
        return first.function();
    }

    @Override
    public Symbol coordinate() {
        return first.coordinate();
    }

    @Override
    public List<BoundaryEnd> ends() {
        return List.of(first, second);
    }

    @Override
    public int order() {
        return 0;
    }

    @Override
    public String toString() {
        return "InterfaceBoundary[" + first + " <-> " + second + ": " + equation.render() + "]";
    }
}
