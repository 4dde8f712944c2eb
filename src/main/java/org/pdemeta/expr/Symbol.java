package org.pdemeta.expr;

import java.util.Objects;

/**
 * A named atom: an independent coordinate, a problem parameter or a free symbol.
 *
 * @param name The symbol name.
 * @param kind What the name was declared as.
 */
public record Symbol(String name, Kind kind) implements Expr {

    /**
     * The declaration kind of a symbol.
     */
    public enum Kind {
        /** An independent variable of the problem (spatial or time). */
        COORDINATE,
        /** A named problem parameter. */
        PARAMETER,
        /** An undeclared name. */
        FREE
    }

    public Symbol {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }

    /**
     * @param name The coordinate name.
     * @return A coordinate symbol.
     */
    public static Symbol coordinate(String name) {
        return new Symbol(name, Kind.COORDINATE);
    }

    /**
     * @param name The parameter name.
     * @return A parameter symbol.
     */
    public static Symbol parameter(String name) {
        return new Symbol(name, Kind.PARAMETER);
    }

    public boolean isCoordinate() {
        return kind == Kind.COORDINATE;
    }

    @Override
    public String render() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
