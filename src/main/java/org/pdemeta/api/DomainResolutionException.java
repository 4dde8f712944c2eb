package org.pdemeta.api;

import org.pdemeta.expr.Symbol;

/**
 * A coordinate in use has no declared, finite, wide-enough domain.
 */
public class DomainResolutionException extends AnalysisException {

    private final Symbol coordinate;

    /**
     * @param code One of {@link AnalysisErrorCode#DOMAIN_MISSING},
     *             {@link AnalysisErrorCode#DOMAIN_NOT_FINITE}, {@link AnalysisErrorCode#DOMAIN_TOO_NARROW}.
     * @param coordinate The offending coordinate.
     * @param message The detail message.
     */
    public DomainResolutionException(AnalysisErrorCode code, Symbol coordinate, String message) {
        super(code, message);
        this.coordinate = coordinate;
    }

    public Symbol getCoordinate() {
        return coordinate;
    }
}
