package org.pdemeta;

import org.pdemeta.api.AnalysisException;
import org.pdemeta.api.AnalysisResult;
import org.pdemeta.api.IDiscretizationBackend;
import org.pdemeta.api.ProblemTransformation;
import org.pdemeta.boundary.Boundary;
import org.pdemeta.boundary.BoundaryClassifier;
import org.pdemeta.boundary.BoundaryMap;
import org.pdemeta.boundary.BoundaryMapAssembler;
import org.pdemeta.boundary.DerivativeOrderTable;
import org.pdemeta.boundary.EdgeBoundary;
import org.pdemeta.boundary.PeriodicMap;
import org.pdemeta.boundary.PeriodicityAnalyzer;
import org.pdemeta.config.AnalysisSettings;
import org.pdemeta.expr.Equation;
import org.pdemeta.problem.Interval;
import org.pdemeta.problem.PdeProblem;
import org.pdemeta.varmap.VariableMap;
import org.pdemeta.varmap.VariableMapBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the full analysis of a {@link PdeProblem}: variable map, boundary classification,
 * assembly, optional backend transformation and periodicity.
 * <p>
 * <b>Note:</b> This class is not thread-safe. Create one instance per run.
 */
public class ProblemAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ProblemAnalyzer.class);

    private final AnalysisSettings settings;
    private final IDiscretizationBackend backend;

    public ProblemAnalyzer() {
        this(AnalysisSettings.DEFAULTS, IDiscretizationBackend.DEFAULT);
    }

    public ProblemAnalyzer(AnalysisSettings settings, IDiscretizationBackend backend) {
        this.settings = settings;
        this.backend = backend;
    }

    /**
     * Analyzes a problem. Either every boundary condition is classified and the map validated,
     * or the run fails with the first error.
     *
     * @param problem The problem.
     * @return The analysis result.
     * @throws AnalysisException on the first failure.
     */
    public AnalysisResult analyze(PdeProblem problem) throws AnalysisException {
        VariableMap variableMap = new VariableMapBuilder(settings).build(problem);
        backend.interfaceErrors(problem, variableMap);

        DerivativeOrderTable boundaryOrders = boundaryOrders(problem, variableMap);
        BoundaryMap boundaryMap = classifyAndAssemble(problem, variableMap, boundaryOrders);

        if (backend.shouldTransform(problem, boundaryMap, variableMap)) {
            ProblemTransformation transformation = backend.transform(problem, boundaryMap, variableMap);
            problem = transformation.problem();
            variableMap = transformation.variableMap();
            LOG.debug("Backend transformed problem '{}', unknowns now {}", problem.name(), variableMap.unknowns());
            boundaryOrders = boundaryOrders(problem, variableMap);
            boundaryMap = classifyAndAssemble(problem, variableMap, boundaryOrders);
        }

        DerivativeOrderTable equationOrders = DerivativeOrderTable
                .of(problem.flatEquations(), variableMap.spatialCoordinates())
                .union(boundaryOrders);
        PeriodicMap periodicMap = PeriodicityAnalyzer.analyze(boundaryMap, variableMap);
        List<EdgeBoundary> initialConditions = initialConditions(boundaryMap, variableMap);
        Interval timeSpan = variableMap.time().map(variableMap::interval).orElse(null);

        LOG.info("Analyzed '{}': {} unknowns over {}, {} boundary conditions, {} initial conditions, periodic={}",
                problem.name(), variableMap.unknowns().size(), variableMap.allCoordinates(),
                boundaryMap.all().size(), initialConditions.size(), periodicMap.hasPeriodic());
        return new AnalysisResult(problem, variableMap, boundaryMap, periodicMap, boundaryOrders, equationOrders,
                initialConditions, timeSpan);
    }

    private BoundaryMap classifyAndAssemble(PdeProblem problem, VariableMap variableMap,
                                            DerivativeOrderTable boundaryOrders) throws AnalysisException {
        BoundaryClassifier classifier = new BoundaryClassifier(variableMap, boundaryOrders, settings);
        List<Boundary> boundaries = classifier.classifyAll(problem.flatBoundaryConditions());
        return new BoundaryMapAssembler(backend.boundaryMapValidator()).assemble(boundaries, variableMap);
    }

    private static DerivativeOrderTable boundaryOrders(PdeProblem problem, VariableMap variableMap) {
        List<Equation> bcs = problem.flatBoundaryConditions();
        return DerivativeOrderTable.of(bcs, variableMap.allCoordinates());
    }

    private static List<EdgeBoundary> initialConditions(BoundaryMap boundaryMap, VariableMap variableMap) {
        if (variableMap.time().isEmpty()) {
            return List.of();
        }
        return boundaryMap.onCoordinate(variableMap.time().get()).stream()
                .filter(b -> b instanceof EdgeBoundary edge && edge.isInitialCondition())
                .map(EdgeBoundary.class::cast)
                .toList();
    }
}
