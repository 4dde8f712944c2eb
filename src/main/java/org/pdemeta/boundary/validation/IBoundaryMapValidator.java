package org.pdemeta.boundary.validation;

import org.pdemeta.api.BoundaryValidationException;
import org.pdemeta.boundary.BoundaryMap;
import org.pdemeta.varmap.VariableMap;

/**
 * A backend-supplied check on an assembled boundary map.
 */
@FunctionalInterface
public interface IBoundaryMapValidator {

    /** Accepts every map. */
    IBoundaryMapValidator NONE = (map, variableMap) -> { };

    /**
     * @param map The assembled map.
     * @param variableMap The variable map of the run.
     * @throws BoundaryValidationException if the backend cannot work with the map.
     */
    void validate(BoundaryMap map, VariableMap variableMap) throws BoundaryValidationException;
}
