package org.pdemeta.api;

/**
 * Defines unique, testable error codes for every failure of a problem analysis.
 * This decouples tests from the wording of error messages.
 */
public enum AnalysisErrorCode {
    // region Problem definition
    /** The problem definition could not be read or parsed. */
    PROBLEM_DEFINITION,
    // endregion

    // region Variable map
    /** A coordinate in use has no declared domain. */
    DOMAIN_MISSING,
    /** A coordinate's domain has a non-finite bound or lower >= upper. */
    DOMAIN_NOT_FINITE,
    /** A coordinate's domain is narrower than the configured minimum width. */
    DOMAIN_TOO_NARROW,
    /** A function was applied with two different coordinate signatures. */
    SIGNATURE_INCONSISTENT,
    // endregion

    // region Boundaries
    /** A boundary equation matched none of the classification rules. */
    BOUNDARY_UNCLASSIFIABLE,
    /** The assembled boundary map was rejected by the backend's validator. */
    BOUNDARY_MAP_INVALID,
    // endregion

    // region Backend
    /** The backend cannot handle the problem. */
    BACKEND_REJECTED
    // endregion
}
