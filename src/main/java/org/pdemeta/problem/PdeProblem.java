package org.pdemeta.problem;

import org.pdemeta.expr.ConditionEntry;
import org.pdemeta.expr.ConditionGroup;
import org.pdemeta.expr.Equation;
import org.pdemeta.expr.FunctionTag;
import org.pdemeta.expr.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A declarative PDE problem as delivered by the problem loader: declared names, governing
 * equations, raw boundary conditions and the domain table.
 * <p>
 * Equations and boundary conditions may arrive nested in {@link ConditionGroup}s; use
 * {@link #flatEquations()} and {@link #flatBoundaryConditions()} for the ordered flat view.
 *
 * @param name A name for logs and reports.
 * @param coordinates The declared coordinates, time included when present.
 * @param time The time coordinate, or {@code null} for steady-state problems.
 * @param functions The declared unknown function tags.
 * @param parameters The declared parameters.
 * @param equations The governing equations.
 * @param boundaryConditions The raw boundary and initial conditions.
 * @param domains The domain table. Correspondence with {@code coordinates} is validated later.
 */
public record PdeProblem(
        String name,
        List<Symbol> coordinates,
        Symbol time,
        List<FunctionTag> functions,
        List<Symbol> parameters,
        List<ConditionEntry> equations,
        List<ConditionEntry> boundaryConditions,
        Map<Symbol, Interval> domains
) {

    public PdeProblem {
        Objects.requireNonNull(name, "name");
        coordinates = List.copyOf(coordinates);
        functions = List.copyOf(functions);
        parameters = List.copyOf(parameters);
        equations = List.copyOf(equations);
        boundaryConditions = List.copyOf(boundaryConditions);
        domains = Collections.unmodifiableMap(new LinkedHashMap<>(domains));
    }

    public Optional<Symbol> timeCoordinate() {
        return Optional.ofNullable(time);
    }

    public List<Equation> flatEquations() {
        return ConditionGroup.flatten(equations);
    }

    public List<Equation> flatBoundaryConditions() {
        return ConditionGroup.flatten(boundaryConditions);
    }

    /**
     * @param newEquations The replacement governing equations.
     * @param newBoundaryConditions The replacement boundary conditions.
     * @param newFunctions The replacement function tags.
     * @return A copy of this problem with the given equation sets.
     */
    public PdeProblem withEquations(List<? extends ConditionEntry> newEquations,
                                    List<? extends ConditionEntry> newBoundaryConditions,
                                    List<FunctionTag> newFunctions) {
        return new PdeProblem(name, coordinates, time, newFunctions, parameters,
                List.copyOf(newEquations), List.copyOf(newBoundaryConditions), domains);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Incremental construction, mostly for backends and tests that build problems in code.
     */
    public static final class Builder {
        private final String name;
        private final List<Symbol> coordinates = new ArrayList<>();
        private Symbol time;
        private final List<FunctionTag> functions = new ArrayList<>();
        private final List<Symbol> parameters = new ArrayList<>();
        private final List<ConditionEntry> equations = new ArrayList<>();
        private final List<ConditionEntry> boundaryConditions = new ArrayList<>();
        private final Map<Symbol, Interval> domains = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder coordinate(Symbol coordinate, double lower, double upper) {
            coordinates.add(coordinate);
            domains.put(coordinate, Interval.of(lower, upper));
            return this;
        }

        public Builder coordinate(Symbol coordinate) {
            coordinates.add(coordinate);
            return this;
        }

        public Builder time(Symbol time, double start, double end) {
            this.time = time;
            return coordinate(time, start, end);
        }

        public Builder domain(Symbol coordinate, Interval interval) {
            domains.put(coordinate, interval);
            return this;
        }

        public Builder function(FunctionTag function) {
            functions.add(function);
            return this;
        }

        public Builder parameter(Symbol parameter) {
            parameters.add(parameter);
            return this;
        }

        public Builder equation(ConditionEntry equation) {
            equations.add(equation);
            return this;
        }

        public Builder boundaryCondition(ConditionEntry condition) {
            boundaryConditions.add(condition);
            return this;
        }

        public PdeProblem build() {
            return new PdeProblem(name, coordinates, time, functions, parameters, equations, boundaryConditions, domains);
        }
    }
}
