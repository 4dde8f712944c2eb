package org.pdemeta.expr;

import java.util.List;
import java.util.Objects;

/**
 * A symbolic equation {@code lhs ~ rhs}.
 *
 * @param lhs The left-hand side.
 * @param rhs The right-hand side.
 */
public record Equation(Expr lhs, Expr rhs) implements ConditionEntry {

    public Equation {
        Objects.requireNonNull(lhs, "lhs");
        Objects.requireNonNull(rhs, "rhs");
    }

    public static Equation of(Expr lhs, Expr rhs) {
        return new Equation(lhs, rhs);
    }

    /**
     * @return Both sides, left first.
     */
    public List<Expr> sides() {
        return List.of(lhs, rhs);
    }

    public String render() {
        return lhs.render() + " ~ " + rhs.render();
    }

    @Override
    public String toString() {
        return render();
    }
}
