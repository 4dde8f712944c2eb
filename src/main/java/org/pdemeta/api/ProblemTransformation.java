package org.pdemeta.api;

import org.pdemeta.problem.PdeProblem;
import org.pdemeta.varmap.VariableMap;

import java.util.Objects;

/**
 * The outcome of a backend's problem transformation.
 *
 * @param problem The rewritten problem.
 * @param variableMap The variable map of the rewritten problem, possibly extended through
 *                    {@link VariableMap#registerUnknown}.
 */
public record ProblemTransformation(PdeProblem problem, VariableMap variableMap) {

    public ProblemTransformation {
        Objects.requireNonNull(problem, "problem");
        Objects.requireNonNull(variableMap, "variableMap");
    }
}
