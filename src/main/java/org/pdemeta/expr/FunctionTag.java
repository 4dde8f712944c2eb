package org.pdemeta.expr;

import java.util.Objects;

/**
 * Identity of an unknown function, independent of the arguments it is applied to.
 * {@code u(t, x)} and {@code u(t, 0)} share the same tag {@code u}.
 *
 * @param name The function name.
 */
public record FunctionTag(String name) {

    public FunctionTag {
        Objects.requireNonNull(name, "name");
    }

    public static FunctionTag of(String name) {
        return new FunctionTag(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
