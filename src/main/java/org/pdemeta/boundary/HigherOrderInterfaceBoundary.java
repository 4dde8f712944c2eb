package org.pdemeta.boundary;

import org.pdemeta.expr.Equation;
import org.pdemeta.expr.FunctionTag;
import org.pdemeta.expr.Symbol;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An interface condition involving derivatives across the interface, e.g.
 * {@code Dx(u(t, 1)) ~ Dx(v(t, 0))}. Filed under {@code first}.
 *
 * @param first The first end in the equation.
 * @param second The other end.
 * @param functions Both unknowns involved.
 * @param coordinates Both fixed coordinates.
 * @param order The highest derivative order with respect to either fixed coordinate, at least 1.
 * @param equation The original equation.
 */
public record HigherOrderInterfaceBoundary(BoundaryEnd first, BoundaryEnd second, Set<FunctionTag> functions,
                                           Set<Symbol> coordinates, int order, Equation equation) implements Boundary {

    public HigherOrderInterfaceBoundary {
        functions = Collections.unmodifiableSet(new LinkedHashSet<>(functions));
        coordinates = Collections.unmodifiableSet(new LinkedHashSet<>(coordinates));
    }

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
    public String toString() {
        return "HigherOrderInterfaceBoundary[" + first + " <-> " + second + ", order=" + order + ": " + equation.render() + "]";
    }
}
