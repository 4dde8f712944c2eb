package org.pdemeta.api;

/**
 * A problem definition could not be read: missing keys, malformed equation text.
 */
public class ProblemDefinitionException extends AnalysisException {

    public ProblemDefinitionException(String message) {
        super(AnalysisErrorCode.PROBLEM_DEFINITION, message);
    }

    public ProblemDefinitionException(String message, Throwable cause) {
        super(AnalysisErrorCode.PROBLEM_DEFINITION, message, cause);
    }
}
