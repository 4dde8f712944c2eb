package org.pdemeta.api;

/**
 * Base of every error raised while analyzing a problem. All of them are fatal to the
 * current run; no partial result is ever returned.
 */
public class AnalysisException extends Exception {

    private final AnalysisErrorCode code;

    /**
     * @param code The error code.
     * @param message The detail message.
     */
    public AnalysisException(AnalysisErrorCode code, String message) {
        super(message, null);
        this.code = code;
    }

    /**
     * @param code The error code.
     * @param message The detail message.
     * @param cause The cause.
     */
    public AnalysisException(AnalysisErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * @return The code identifying the kind of failure.
     */
    public AnalysisErrorCode getCode() {
        return code;
    }
}
