package org.pdemeta.boundary.rules;

import org.pdemeta.boundary.Boundary;
import org.pdemeta.boundary.BoundaryEnd;
import org.pdemeta.boundary.EdgeBoundary;

import java.util.Optional;

/**
 * A single end on a domain edge, e.g. {@code u(t, 0) ~ 0} or {@code Dx(u(t, 1)) ~ 0}.
 * Only derivatives along the fixed coordinate count towards the order.
 */
public class EdgeRule implements IClassificationRule {

    @Override
    public Optional<Boundary> classify(ClassificationContext context) {
        if (context.ends().size() != 1) {
            return Optional.empty();
        }
        BoundaryEnd end = context.singleEnd();
        return Optional.of(new EdgeBoundary(
                context.variableMap().genuineForm(end.function()),
                end.coordinate(),
                end.upper(),
                context.orderAlong(end.coordinate()),
                context.equation(),
                false));
    }
}
