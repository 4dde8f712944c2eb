package org.pdemeta.boundary;

import org.pdemeta.api.BoundaryValidationException;
import org.pdemeta.boundary.validation.IBoundaryMapValidator;
import org.pdemeta.expr.FunctionTag;
import org.pdemeta.expr.Symbol;
import org.pdemeta.varmap.VariableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups classified boundaries into a {@link BoundaryMap} and runs a validator over the result.
 */
public class BoundaryMapAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(BoundaryMapAssembler.class);

    private final IBoundaryMapValidator validator;

    public BoundaryMapAssembler() {
        this(IBoundaryMapValidator.NONE);
    }

    public BoundaryMapAssembler(IBoundaryMapValidator validator) {
        this.validator = validator;
    }

    /**
     * Files every boundary under its first end, keeping input order within each list.
     *
     * @param boundaries The classified boundaries, in classification order.
     * @param variableMap The variable map of the run.
     * @return The validated map.
     * @throws BoundaryValidationException if the validator rejects the map.
     */
    public BoundaryMap assemble(List<Boundary> boundaries, VariableMap variableMap) throws BoundaryValidationException {
        Map<FunctionTag, Map<Symbol, List<Boundary>>> entries = new LinkedHashMap<>();
        for (FunctionTag function : variableMap.functionTags()) {
            Map<Symbol, List<Boundary>> byCoordinate = new LinkedHashMap<>();
            for (Symbol x : variableMap.allCoordinates()) {
                byCoordinate.put(x, new ArrayList<>());
            }
            entries.put(function, byCoordinate);
        }
        for (Boundary boundary : boundaries) {
            Map<Symbol, List<Boundary>> byCoordinate = entries.get(boundary.function());
            if (byCoordinate == null || !byCoordinate.containsKey(boundary.coordinate())) {
                throw new IllegalArgumentException("Boundary " + boundary + " does not belong to the variable map " + variableMap);
            }
            byCoordinate.get(boundary.coordinate()).add(boundary);
        }

        BoundaryMap map = new BoundaryMap(entries);
        validator.validate(map, variableMap);
        LOG.debug("Assembled {} boundaries for {} unknowns", boundaries.size(), entries.size());
        return map;
    }
}
