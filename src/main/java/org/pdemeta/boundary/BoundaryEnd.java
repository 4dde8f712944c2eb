package org.pdemeta.boundary;

import org.pdemeta.expr.FunctionTag;
import org.pdemeta.expr.Symbol;

/**
 * One side of a boundary: an unknown evaluated at the lower or upper bound of a coordinate.
 *
 * @param function The unknown.
 * @param coordinate The fixed coordinate.
 * @param upper {@code true} for the upper bound.
 */
public record BoundaryEnd(FunctionTag function, Symbol coordinate, boolean upper) {

    /**
     * @param other Another end.
     * @return {@code true} if both ends fix the same coordinate of the same unknown at opposite bounds.
     */
    public boolean isOppositeOf(BoundaryEnd other) {
        return function.equals(other.function) && coordinate.equals(other.coordinate) && upper != other.upper;
    }

    @Override
    public String toString() {
        return function + "@" + coordinate + (upper ? ".upper" : ".lower");
    }
}
