package org.pdemeta.varmap;

import org.pdemeta.api.AnalysisErrorCode;
import org.pdemeta.api.DomainResolutionException;
import org.pdemeta.api.SignatureInconsistencyException;
import org.pdemeta.config.AnalysisSettings;
import org.pdemeta.expr.Apply;
import org.pdemeta.expr.Equation;
import org.pdemeta.expr.Expr;
import org.pdemeta.expr.ExpressionWalker;
import org.pdemeta.expr.FunctionTag;
import org.pdemeta.expr.Symbol;
import org.pdemeta.inspect.ExpressionInspector;
import org.pdemeta.problem.Interval;
import org.pdemeta.problem.PdeProblem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives the {@link VariableMap} of a problem from the function applications that occur in
 * its governing equations and boundary conditions.
 * <p>
 * Discovery order is governing equations first, then boundary conditions, each equation
 * left side before right side. The first coordinate discovered becomes dimension 1.
 */
public class VariableMapBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(VariableMapBuilder.class);

    private final AnalysisSettings settings;

    public VariableMapBuilder() {
        this(AnalysisSettings.DEFAULTS);
    }

    public VariableMapBuilder(AnalysisSettings settings) {
        this.settings = settings;
    }

    /**
     * Builds the variable map of a problem.
     *
     * @param problem The problem.
     * @return The variable map.
     * @throws DomainResolutionException if a coordinate in use has no usable domain.
     * @throws SignatureInconsistencyException if an unknown is applied genuinely with two different signatures.
     */
    public VariableMap build(PdeProblem problem) throws DomainResolutionException, SignatureInconsistencyException {
        List<Equation> equations = new ArrayList<>(problem.flatEquations());
        equations.addAll(problem.flatBoundaryConditions());

        Set<Apply> applications = new LinkedHashSet<>();
        for (Equation equation : equations) {
            applications.addAll(ExpressionInspector.collectMatchingFunctionApplications(equation, problem.functions()));
        }

        List<Apply> unknowns = new ArrayList<>();
        Map<FunctionTag, List<Symbol>> signatures = new LinkedHashMap<>();
        Set<Symbol> coordinatesInUse = new LinkedHashSet<>();
        for (Apply application : applications) {
            for (Expr arg : application.arguments()) {
                collectCoordinates(arg, coordinatesInUse);
            }
            if (!application.isGenuine()) {
                continue;
            }
            List<Symbol> signature = application.arguments().stream().map(Symbol.class::cast).toList();
            List<Symbol> known = signatures.get(application.function());
            if (known == null) {
                signatures.put(application.function(), signature);
                unknowns.add(application);
                LOG.debug("Discovered unknown {}", application.render());
            } else if (!known.equals(signature)) {
                throw new SignatureInconsistencyException(application.function(), known, signature);
            }
        }

        Symbol time = problem.time();
        List<Symbol> spatial = coordinatesInUse.stream().filter(x -> !x.equals(time)).toList();

        Map<Symbol, Interval> intervals = new LinkedHashMap<>();
        for (Symbol coordinate : coordinatesInUse) {
            intervals.put(coordinate, resolveDomain(problem, coordinate));
        }
        for (Symbol declared : problem.domains().keySet()) {
            if (!coordinatesInUse.contains(declared)) {
                LOG.warn("Ignoring domain of '{}' in problem '{}': no unknown depends on it", declared, problem.name());
            }
        }
        boolean timeInUse = time != null && coordinatesInUse.contains(time);

        VariableMap variableMap = new VariableMap(unknowns, problem.functions(), spatial, timeInUse ? time : null,
                problem.parameters(), intervals, signatures);
        LOG.debug("Built variable map for '{}': unknowns={}, spatial={}, time={}",
                problem.name(), unknowns, spatial, timeInUse ? time : "none");
        return variableMap;
    }

    private Interval resolveDomain(PdeProblem problem, Symbol coordinate) throws DomainResolutionException {
        Interval interval = problem.domains().get(coordinate);
        if (interval == null) {
            throw new DomainResolutionException(AnalysisErrorCode.DOMAIN_MISSING, coordinate,
                    "No domain declared for coordinate '" + coordinate + "'.");
        }
        if (!interval.isWellFormed()) {
            throw new DomainResolutionException(AnalysisErrorCode.DOMAIN_NOT_FINITE, coordinate,
                    "Domain of coordinate '" + coordinate + "' must have finite bounds with lower < upper, got " + interval + ".");
        }
        if (interval.width() < settings.minDomainWidth()) {
            throw new DomainResolutionException(AnalysisErrorCode.DOMAIN_TOO_NARROW, coordinate,
                    "Domain of coordinate '" + coordinate + "' is narrower than " + settings.minDomainWidth() + ": " + interval + ".");
        }
        // The bound tolerance is relative to the bound, so large offsets need a wider domain.
        double toleranceBand = 2.0 * settings.boundTolerance()
                * Math.max(1.0, Math.max(Math.abs(interval.lower()), Math.abs(interval.upper())));
        if (interval.width() <= toleranceBand) {
            throw new DomainResolutionException(AnalysisErrorCode.DOMAIN_TOO_NARROW, coordinate,
                    "Domain of coordinate '" + coordinate + "' is not wider than twice the bound tolerance at its bounds ("
                            + toleranceBand + "): " + interval + ". Lower pdemeta.analysis.bound-tolerance.");
        }
        return interval;
    }

    private static void collectCoordinates(Expr argument, Set<Symbol> into) {
        new ExpressionWalker(Map.of(Symbol.class, node -> {
            Symbol symbol = (Symbol) node;
            if (symbol.isCoordinate()) {
                into.add(symbol);
            }
        })).walk(argument);
    }
}
