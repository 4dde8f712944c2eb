package org.pdemeta.expr;

import java.util.List;
import java.util.Objects;

/**
 * A first-order derivative operator with respect to one coordinate. Higher orders are
 * represented by nesting: {@code Dxx(u)} is {@code Dx(Dx(u))}.
 *
 * @param coordinate The coordinate the derivative is taken with respect to.
 * @param operand The differentiated expression.
 */
public record Differential(Symbol coordinate, Expr operand) implements Expr {

    public Differential {
        Objects.requireNonNull(coordinate, "coordinate");
        Objects.requireNonNull(operand, "operand");
    }

    /**
     * Builds an {@code order}-fold nested derivative.
     * @param coordinate The coordinate.
     * @param operand The innermost operand.
     * @param order The number of nested operators, at least 1.
     * @return The outermost differential.
     */
    public static Differential of(Symbol coordinate, Expr operand, int order) {
        if (order < 1) {
            throw new IllegalArgumentException("Derivative order must be at least 1, got " + order);
        }
        Expr result = operand;
        for (int i = 0; i < order; i++) {
            result = new Differential(coordinate, result);
        }
        return (Differential) result;
    }

    @Override
    public List<Expr> arguments() {
        return List.of(operand);
    }

    @Override
    public boolean isCompound() {
        return true;
    }

    @Override
    public Object head() {
        return coordinate;
    }

    @Override
    public boolean isDerivative() {
        return true;
    }

    @Override
    public int derivativeOrder(Symbol target) {
        return coordinate.equals(target) ? 1 : 0;
    }

    @Override
    public Expr reconstructWithArguments(List<Expr> newArguments) {
        return new Differential(coordinate, newArguments.get(0));
    }

    @Override
    public String render() {
        return "D" + coordinate.name() + "(" + operand.render() + ")";
    }

    @Override
    public String toString() {
        return render();
    }
}
