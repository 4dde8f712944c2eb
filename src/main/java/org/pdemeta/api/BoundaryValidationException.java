package org.pdemeta.api;

/**
 * The backend's boundary-map validator rejected the assembled map.
 */
public class BoundaryValidationException extends AnalysisException {

    /**
     * @param message The validator-defined message.
     */
    public BoundaryValidationException(String message) {
        super(AnalysisErrorCode.BOUNDARY_MAP_INVALID, message);
    }
}
