package org.pdemeta.expr;

/**
 * An element of a (possibly nested) list of conditions as delivered by upstream
 * pre-processing: either a single {@link Equation} or a {@link ConditionGroup}.
 */
public sealed interface ConditionEntry permits Equation, ConditionGroup {
}
