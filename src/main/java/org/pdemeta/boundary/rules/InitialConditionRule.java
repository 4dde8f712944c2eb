package org.pdemeta.boundary.rules;

import org.pdemeta.boundary.Boundary;
import org.pdemeta.boundary.BoundaryEnd;
import org.pdemeta.boundary.EdgeBoundary;

import java.util.Optional;

/**
 * A single end on the lower bound of the time coordinate, e.g. {@code u(0, x) ~ sin(x)}.
 */
public class InitialConditionRule implements IClassificationRule {

    @Override
    public Optional<Boundary> classify(ClassificationContext context) {
        if (context.ends().size() != 1) {
            return Optional.empty();
        }
        BoundaryEnd end = context.singleEnd();
        if (!context.isTime(end.coordinate()) || end.upper()) {
            return Optional.empty();
        }
        return Optional.of(new EdgeBoundary(
                context.variableMap().genuineForm(end.function()),
                end.coordinate(),
                false,
                context.orderAlong(end.coordinate()),
                context.equation(),
                true));
    }
}
