package org.pdemeta.api;

import org.pdemeta.expr.Equation;

/**
 * A raw boundary equation matched none of the classification rules.
 */
public class UnclassifiableBoundaryException extends AnalysisException {

    /**
     * Why an equation could not be classified.
     */
    public enum Reason {
        /** No unknown function is referenced at all. */
        NO_UNKNOWN_REFERENCED,
        /** A declared function that is never applied to its own coordinates is referenced. */
        UNDETERMINED_FUNCTION,
        /** An unknown is referenced at interior coordinates only. */
        INTERIOR_CONDITION,
        /** A fixed value lies on neither bound of its coordinate. */
        NO_MATCHING_BOUND,
        /** A fixed value lies within tolerance of both bounds. */
        AMBIGUOUS_BOUND,
        /** A single application fixes more than one coordinate. */
        MULTIPLE_FIXED_COORDINATES,
        /** An argument is neither the signature's coordinate nor a number. */
        UNMATCHED_ARGUMENT,
        /** More than two boundary points or functions are referenced. */
        TOO_MANY_REFERENCES,
        /** The two ends of an interface have different free coordinates. */
        SIGNATURE_MISMATCH,
        /** An interface would couple through the time coordinate. */
        TIME_INTERFACE,
        /** No registered classification rule accepts the boundary ends. */
        NO_MATCHING_RULE
    }

    private final Equation equation;
    private final Reason reason;

    /**
     * @param equation The offending equation.
     * @param reason The reason code.
     * @param detail A human-readable explanation.
     */
    public UnclassifiableBoundaryException(Equation equation, Reason reason, String detail) {
        super(AnalysisErrorCode.BOUNDARY_UNCLASSIFIABLE,
                String.format("Cannot classify boundary condition '%s' (%s): %s", equation.render(), reason, detail));
        this.equation = equation;
        this.reason = reason;
    }

    public Equation getEquation() {
        return equation;
    }

    public Reason getReason() {
        return reason;
    }
}
