package org.pdemeta.boundary;

import org.pdemeta.api.UnclassifiableBoundaryException;
import org.pdemeta.api.UnclassifiableBoundaryException.Reason;
import org.pdemeta.boundary.rules.ClassificationContext;
import org.pdemeta.boundary.rules.ClassificationRuleRegistry;
import org.pdemeta.boundary.rules.IClassificationRule;
import org.pdemeta.config.AnalysisSettings;
import org.pdemeta.expr.Apply;
import org.pdemeta.expr.Constant;
import org.pdemeta.expr.Equation;
import org.pdemeta.expr.Expr;
import org.pdemeta.expr.Symbol;
import org.pdemeta.inspect.ExpressionInspector;
import org.pdemeta.problem.Interval;
import org.pdemeta.varmap.VariableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies raw boundary equations into the {@link Boundary} taxonomy.
 * <p>
 * Every application of an unknown is compared position by position with the unknown's
 * signature. A signature coordinate in its own position is free, a number fixes that
 * coordinate, anything else cannot be classified. Each application must fix exactly one
 * coordinate at exactly one of its bounds; the resulting distinct {@link BoundaryEnd}s are
 * handed to the rules of a {@link ClassificationRuleRegistry}.
 */
public class BoundaryClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(BoundaryClassifier.class);

    private final VariableMap variableMap;
    private final DerivativeOrderTable orderTable;
    private final AnalysisSettings settings;
    private final ClassificationRuleRegistry registry;

    public BoundaryClassifier(VariableMap variableMap, DerivativeOrderTable orderTable, AnalysisSettings settings) {
        this(variableMap, orderTable, settings, ClassificationRuleRegistry.initializeWithDefaults());
    }

    public BoundaryClassifier(VariableMap variableMap, DerivativeOrderTable orderTable, AnalysisSettings settings,
                              ClassificationRuleRegistry registry) {
        this.variableMap = variableMap;
        this.orderTable = orderTable;
        this.settings = settings;
        this.registry = registry;
    }

    /**
     * Classifies all equations in order. The first failure aborts.
     *
     * @param equations The raw boundary equations.
     * @return The classified boundaries, in input order.
     * @throws UnclassifiableBoundaryException for the first equation that cannot be classified.
     */
    public List<Boundary> classifyAll(List<Equation> equations) throws UnclassifiableBoundaryException {
        List<Boundary> boundaries = new ArrayList<>(equations.size());
        for (Equation equation : equations) {
            boundaries.add(classify(equation));
        }
        return boundaries;
    }

    /**
     * @param equation A raw boundary equation.
     * @return Its classification.
     * @throws UnclassifiableBoundaryException if no rule accepts it.
     */
    public Boundary classify(Equation equation) throws UnclassifiableBoundaryException {
        Set<Apply> applications = ExpressionInspector.collectMatchingFunctionApplications(equation, variableMap.declaredFunctions());
        for (Apply application : applications) {
            if (!variableMap.isUnknown(application.function())) {
                throw new UnclassifiableBoundaryException(equation, Reason.UNDETERMINED_FUNCTION,
                        "'" + application.function() + "' is declared but never applied to coordinates only, so it is not an unknown");
            }
        }
        if (applications.isEmpty()) {
            throw new UnclassifiableBoundaryException(equation, Reason.NO_UNKNOWN_REFERENCED,
                    "none of the unknowns " + variableMap.functionTags() + " is referenced");
        }

        Map<BoundaryEnd, Apply> ends = new LinkedHashMap<>();
        for (Apply application : applications) {
            ends.putIfAbsent(locateEnd(equation, application), application);
        }
        if (ends.size() > 2) {
            throw new UnclassifiableBoundaryException(equation, Reason.TOO_MANY_REFERENCES,
                    ends.size() + " distinct boundary ends referenced: " + ends.keySet());
        }

        ClassificationContext context = new ClassificationContext(equation, new ArrayList<>(ends.keySet()), ends,
                variableMap, orderTable);
        for (IClassificationRule rule : registry.rules()) {
            Optional<Boundary> boundary = rule.classify(context);
            if (boundary.isPresent()) {
                LOG.debug("Classified '{}' as {}", equation.render(), boundary.get());
                return boundary.get();
            }
        }
        throw new UnclassifiableBoundaryException(equation, Reason.NO_MATCHING_RULE,
                "no classification rule accepts the ends " + ends.keySet());
    }

    private BoundaryEnd locateEnd(Equation equation, Apply application) throws UnclassifiableBoundaryException {
        List<Symbol> signature = variableMap.signature(application.function());
        List<Expr> args = application.arguments();
        if (args.size() != signature.size()) {
            throw new UnclassifiableBoundaryException(equation, Reason.UNMATCHED_ARGUMENT,
                    application.render() + " has " + args.size() + " arguments but its signature is " + signature);
        }

        Symbol fixedCoordinate = null;
        double fixedValue = 0.0;
        for (int i = 0; i < args.size(); i++) {
            Expr arg = args.get(i);
            Symbol expected = signature.get(i);
            if (arg.equals(expected)) {
                continue;
            }
            if (!(arg instanceof Constant constant)) {
                throw new UnclassifiableBoundaryException(equation, Reason.UNMATCHED_ARGUMENT,
                        "argument " + (i + 1) + " of " + application.render() + " is neither '" + expected + "' nor a number");
            }
            if (fixedCoordinate != null) {
                throw new UnclassifiableBoundaryException(equation, Reason.MULTIPLE_FIXED_COORDINATES,
                        application.render() + " fixes both '" + fixedCoordinate + "' and '" + expected + "'");
            }
            fixedCoordinate = expected;
            fixedValue = constant.value();
        }
        if (fixedCoordinate == null) {
            throw new UnclassifiableBoundaryException(equation, Reason.INTERIOR_CONDITION,
                    application.render() + " is evaluated inside the domain");
        }

        Interval interval = variableMap.interval(fixedCoordinate);
        boolean atLower = interval.isAtLower(fixedValue, settings.boundTolerance());
        boolean atUpper = interval.isAtUpper(fixedValue, settings.boundTolerance());
        if (atLower && atUpper) {
            throw new UnclassifiableBoundaryException(equation, Reason.AMBIGUOUS_BOUND,
                    "value " + fixedValue + " of '" + fixedCoordinate + "' matches both bounds of " + interval);
        }
        if (!atLower && !atUpper) {
            throw new UnclassifiableBoundaryException(equation, Reason.NO_MATCHING_BOUND,
                    "value " + fixedValue + " of '" + fixedCoordinate + "' is on neither bound of " + interval);
        }
        return new BoundaryEnd(application.function(), fixedCoordinate, atUpper);
    }
}
