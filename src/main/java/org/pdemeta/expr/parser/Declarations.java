package org.pdemeta.expr.parser;

import org.pdemeta.expr.FunctionTag;
import org.pdemeta.expr.Symbol;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The names a problem declares, used to resolve identifiers while parsing equation text.
 */
public final class Declarations {

    private final Map<String, Symbol> coordinates = new LinkedHashMap<>();
    private final Map<String, Symbol> parameters = new LinkedHashMap<>();
    private final Map<String, FunctionTag> functions = new LinkedHashMap<>();

    /**
     * @param coordinates Declared coordinate names (time included).
     * @param parameters Declared parameter names.
     * @param functions Declared unknown function names.
     */
    public Declarations(List<String> coordinates, List<String> parameters, List<String> functions) {
        coordinates.forEach(n -> this.coordinates.put(n, Symbol.coordinate(n)));
        parameters.forEach(n -> this.parameters.put(n, Symbol.parameter(n)));
        functions.forEach(n -> this.functions.put(n, FunctionTag.of(n)));
    }

    public Optional<Symbol> coordinate(String name) {
        return Optional.ofNullable(coordinates.get(name));
    }

    public Optional<Symbol> parameter(String name) {
        return Optional.ofNullable(parameters.get(name));
    }

    public Optional<FunctionTag> function(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public List<Symbol> coordinates() {
        return List.copyOf(coordinates.values());
    }

    public List<Symbol> parameters() {
        return List.copyOf(parameters.values());
    }

    public List<FunctionTag> functions() {
        return List.copyOf(functions.values());
    }

    /**
     * Resolves the suffix of a derivative shorthand: {@code x} in {@code Dx}, {@code xx} in
     * {@code Dxx}. The suffix must be one declared coordinate name repeated {@code n} times.
     *
     * @param suffix The name without the leading {@code D}.
     * @return The coordinate and order, or empty if the suffix is no such repetition.
     */
    public Optional<DerivativeShorthand> derivativeShorthand(String suffix) {
        if (suffix.isEmpty()) {
            return Optional.empty();
        }
        for (Symbol x : coordinates.values()) {
            String name = x.name();
            if (suffix.length() % name.length() != 0) {
                continue;
            }
            int order = suffix.length() / name.length();
            if (name.repeat(order).equals(suffix)) {
                return Optional.of(new DerivativeShorthand(x, order));
            }
        }
        return Optional.empty();
    }

    /**
     * @param coordinate The coordinate the derivative is taken in.
     * @param order The derivative order.
     */
    public record DerivativeShorthand(Symbol coordinate, int order) {}
}
