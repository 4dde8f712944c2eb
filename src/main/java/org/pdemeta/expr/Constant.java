package org.pdemeta.expr;

/**
 * A numeric literal.
 *
 * @param value The value of the literal.
 */
public record Constant(double value) implements Expr {

    public static final Constant ZERO = new Constant(0.0);

    public static Constant of(double value) {
        return new Constant(value);
    }

    @Override
    public String render() {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    @Override
    public String toString() {
        return render();
    }
}
