package org.pdemeta.boundary.validation;

import org.pdemeta.api.BoundaryValidationException;
import org.pdemeta.boundary.Boundary;
import org.pdemeta.boundary.BoundaryEnd;
import org.pdemeta.boundary.BoundaryMap;
import org.pdemeta.expr.FunctionTag;
import org.pdemeta.expr.Symbol;
import org.pdemeta.varmap.VariableMap;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Requires a condition on both the lower and the upper bound of every spatial coordinate of
 * every unknown. An edge covers its own end; an interface covers both of its ends, so
 * periodic pairings and multi-region couplings count as covered.
 */
public class EdgeCoverageValidator implements IBoundaryMapValidator {

    @Override
    public void validate(BoundaryMap map, VariableMap variableMap) throws BoundaryValidationException {
        Set<BoundaryEnd> covered = new HashSet<>();
        for (Boundary boundary : map.all()) {
            covered.addAll(boundary.ends());
        }

        List<String> missing = new ArrayList<>();
        for (FunctionTag function : variableMap.functionTags()) {
            for (Symbol x : variableMap.spatialSignature(function)) {
                if (!covered.contains(new BoundaryEnd(function, x, false))) {
                    missing.add(function + " at lower bound of " + x);
                }
                if (!covered.contains(new BoundaryEnd(function, x, true))) {
                    missing.add(function + " at upper bound of " + x);
                }
            }
        }
        if (!missing.isEmpty()) {
            throw new BoundaryValidationException("Missing boundary conditions: " + String.join(", ", missing));
        }
    }
}
