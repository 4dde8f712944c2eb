package org.pdemeta.boundary.rules;

import org.pdemeta.api.UnclassifiableBoundaryException;
import org.pdemeta.boundary.Boundary;

import java.util.Optional;

/**
 * One case of the boundary taxonomy. Rules are tried in registry order; the first rule that
 * returns a boundary wins.
 */
public interface IClassificationRule {

    /**
     * Classifies a boundary equation if this rule is responsible for it.
     *
     * @param context The ends found in the equation.
     * @return The classified boundary, or empty if the rule does not apply.
     * @throws UnclassifiableBoundaryException if the rule applies but the equation is malformed for it.
     */
    Optional<Boundary> classify(ClassificationContext context) throws UnclassifiableBoundaryException;
}
