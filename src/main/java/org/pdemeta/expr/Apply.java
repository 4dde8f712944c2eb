package org.pdemeta.expr;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An application of an unknown function to arguments, e.g. {@code u(t, x)} or {@code u(t, 0)}.
 *
 * @param function The tag of the applied function.
 * @param arguments The ordered arguments.
 */
public record Apply(FunctionTag function, List<Expr> arguments) implements Expr {

    public Apply {
        arguments = List.copyOf(arguments);
    }

    /**
     * Convenience factory.
     * @param function The function tag.
     * @param arguments The arguments.
     * @return The application.
     */
    public static Apply of(FunctionTag function, Expr... arguments) {
        return new Apply(function, List.of(arguments));
    }

    /**
     * @return {@code true} if every argument is a coordinate symbol.
     */
    public boolean isGenuine() {
        return arguments.stream().allMatch(a -> a instanceof Symbol s && s.isCoordinate());
    }

    /**
     * @return {@code true} if at least one argument is a numeric constant.
     */
    public boolean isBoundaryEvaluated() {
        return arguments.stream().anyMatch(a -> a instanceof Constant);
    }

    @Override
    public boolean isCompound() {
        return true;
    }

    @Override
    public Object head() {
        return function;
    }

    @Override
    public Expr reconstructWithArguments(List<Expr> newArguments) {
        return new Apply(function, newArguments);
    }

    @Override
    public String render() {
        return function.name() + arguments.stream().map(Expr::render).collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String toString() {
        return render();
    }
}
