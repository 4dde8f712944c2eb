package org.pdemeta.api;

import org.pdemeta.boundary.BoundaryMap;
import org.pdemeta.boundary.validation.IBoundaryMapValidator;
import org.pdemeta.problem.PdeProblem;
import org.pdemeta.varmap.VariableMap;

/**
 * Hooks through which a discretization backend takes part in the analysis.
 * Every hook has a default that does nothing; a backend overrides only what it needs.
 */
public interface IDiscretizationBackend {

    /** A backend that uses every default. */
    IDiscretizationBackend DEFAULT = new IDiscretizationBackend() { };

    /**
     * Called right after the variable map is built. Throw to refuse problems the backend
     * cannot discretize.
     *
     * @param problem The problem.
     * @param variableMap Its variable map.
     * @throws AnalysisException typically with {@link AnalysisErrorCode#BACKEND_REJECTED}.
     */
    default void interfaceErrors(PdeProblem problem, VariableMap variableMap) throws AnalysisException {
    }

    /**
     * @return The validator run on every assembled boundary map.
     */
    default IBoundaryMapValidator boundaryMapValidator() {
        return IBoundaryMapValidator.NONE;
    }

    /**
     * @param problem The problem.
     * @param boundaryMap Its assembled boundary map.
     * @param variableMap Its variable map.
     * @return {@code true} if {@link #transform} should run.
     */
    default boolean shouldTransform(PdeProblem problem, BoundaryMap boundaryMap, VariableMap variableMap) {
        return false;
    }

    /**
     * Rewrites the problem before final assembly, e.g. to introduce auxiliary unknowns.
     * The boundary conditions of the returned problem are classified and assembled again.
     *
     * @param problem The problem.
     * @param boundaryMap Its assembled boundary map.
     * @param variableMap Its variable map.
     * @return The rewritten problem and its variable map.
     * @throws AnalysisException if the rewrite fails.
     */
    default ProblemTransformation transform(PdeProblem problem, BoundaryMap boundaryMap, VariableMap variableMap)
            throws AnalysisException {
        return new ProblemTransformation(problem, variableMap);
    }
}
