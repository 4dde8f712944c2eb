package org.pdemeta;

import org.pdemeta.api.AnalysisErrorCode;
import org.pdemeta.api.AnalysisException;
import org.pdemeta.api.AnalysisResult;
import org.pdemeta.api.IDiscretizationBackend;
import org.pdemeta.api.ProblemTransformation;
import org.pdemeta.api.UnclassifiableBoundaryException;
import org.pdemeta.boundary.BoundaryMap;
import org.pdemeta.boundary.EdgeBoundary;
import org.pdemeta.boundary.validation.EdgeCoverageValidator;
import org.pdemeta.boundary.validation.IBoundaryMapValidator;
import org.pdemeta.config.AnalysisSettings;
import org.pdemeta.expr.Apply;
import org.pdemeta.expr.ConditionEntry;
import org.pdemeta.expr.Constant;
import org.pdemeta.expr.Equation;
import org.pdemeta.expr.FunctionTag;
import org.pdemeta.expr.Symbol;
import org.pdemeta.junit.extensions.logging.AllowLog;
import org.pdemeta.junit.extensions.logging.LogLevel;
import org.pdemeta.junit.extensions.logging.LogWatchExtension;
import org.pdemeta.problem.Interval;
import org.pdemeta.problem.PdeProblem;
import org.pdemeta.problem.ProblemLoader;
import org.pdemeta.varmap.VariableMap;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests of {@link ProblemAnalyzer}, including the backend hooks.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class ProblemAnalyzerTest {

    private static final Symbol T = Symbol.coordinate("t");
    private static final Symbol X = Symbol.coordinate("x");
    private static final FunctionTag U = FunctionTag.of("u");
    private static final FunctionTag W = FunctionTag.of("w");

    private static PdeProblem fixture(String name) throws AnalysisException {
        return ProblemLoader.load(Path.of("src/test/resources/problems", name));
    }

    @Test
    void testHeatProblemIsFullyAnalyzed() throws Exception {
        // Act
        AnalysisResult result = new ProblemAnalyzer().analyze(fixture("heat.conf"));

        // Assert
        assertThat(result.variableMap().unknowns()).extracting(Apply::render).containsExactly("u(t, x)");
        assertThat(result.variableMap().allCoordinates()).containsExactly(X, T);
        assertThat(result.boundaryMap().get(U, X)).hasSize(2);
        assertThat(result.boundaryMap().get(U, T)).hasSize(1);
        assertThat(result.initialConditions()).hasSize(1);
        assertThat(result.initialConditions().get(0).equation().render()).isEqualTo("u(0, x) ~ sin((3.141592653589793 * x))");
        assertThat(result.isTimeDependent()).isTrue();
        assertThat(result.time()).contains(Interval.of(0, 1));
        assertThat(result.periodicMap().hasPeriodic()).isFalse();
    }

    @Test
    void testOrderTablesCombineEquationsAndBoundaries() throws Exception {
        AnalysisResult result = new ProblemAnalyzer().analyze(fixture("heat.conf"));

        assertThat(result.boundaryOrders().orders(X)).containsExactly(1);
        assertThat(result.boundaryOrders().orders(T)).isEmpty();
        assertThat(result.equationOrders().orders(X)).containsExactly(2, 1);
        assertThat(result.equationOrders().maxOrder(X)).isEqualTo(2);
        assertThat(result.equationOrders().maxOrder(T)).isZero();
    }

    @Test
    void testPeriodicProblem() throws Exception {
        AnalysisResult result = new ProblemAnalyzer().analyze(fixture("periodic.conf"));

        assertThat(result.problem().name()).isEqualTo("advection");
        assertThat(result.periodicMap().isPeriodic(U, X)).isTrue();
        assertThat(result.time()).contains(Interval.of(0, 2));
    }

    @Test
    void testSteadyProblemHasNoTime() throws Exception {
        AnalysisResult result = new ProblemAnalyzer().analyze(ProblemFixtures.laplace("u(0, y) ~ 0", "u(x, 1) ~ x"));

        assertThat(result.isTimeDependent()).isFalse();
        assertThat(result.time()).isEmpty();
        assertThat(result.initialConditions()).isEmpty();
        assertThat(result.boundaryMap().get(U).keySet()).containsExactly(X, Symbol.coordinate("y"));
    }

    @Test
    void testFirstUnclassifiableConditionAbortsTheRun() throws Exception {
        PdeProblem problem = fixture("interior.conf");

        assertThatThrownBy(() -> new ProblemAnalyzer().analyze(problem))
                .isInstanceOf(UnclassifiableBoundaryException.class)
                .satisfies(e -> {
                    UnclassifiableBoundaryException ube = (UnclassifiableBoundaryException) e;
                    assertThat(ube.getCode()).isEqualTo(AnalysisErrorCode.BOUNDARY_UNCLASSIFIABLE);
                    assertThat(ube.getReason()).isEqualTo(UnclassifiableBoundaryException.Reason.NO_MATCHING_BOUND);
                    assertThat(ube.getEquation().render()).isEqualTo("u(t, 0.5) ~ 0");
                });
    }

    @Test
    void testBackendCanRejectTheProblem() {
        IDiscretizationBackend oneDimensionalOnly = new IDiscretizationBackend() {
            @Override
            public void interfaceErrors(PdeProblem problem, VariableMap variableMap) throws AnalysisException {
                if (variableMap.spatialCoordinates().size() > 1) {
                    throw new AnalysisException(AnalysisErrorCode.BACKEND_REJECTED, "Only 1D problems are supported.");
                }
            }
        };
        ProblemAnalyzer analyzer = new ProblemAnalyzer(AnalysisSettings.DEFAULTS, oneDimensionalOnly);

        assertThatThrownBy(() -> analyzer.analyze(ProblemFixtures.laplace("u(0, y) ~ 0")))
                .isInstanceOf(AnalysisException.class)
                .hasMessage("Only 1D problems are supported.")
                .satisfies(e -> assertThat(((AnalysisException) e).getCode()).isEqualTo(AnalysisErrorCode.BACKEND_REJECTED));
    }

    @Test
    void testBackendValidatorIsApplied() {
        IDiscretizationBackend strict = new IDiscretizationBackend() {
            @Override
            public IBoundaryMapValidator boundaryMapValidator() {
                return new EdgeCoverageValidator();
            }
        };
        ProblemAnalyzer analyzer = new ProblemAnalyzer(AnalysisSettings.DEFAULTS, strict);

        assertThatThrownBy(() -> analyzer.analyze(ProblemFixtures.heat("u(0, x) ~ 0", "u(t, 0) ~ 0")))
                .isInstanceOf(AnalysisException.class)
                .satisfies(e -> assertThat(((AnalysisException) e).getCode()).isEqualTo(AnalysisErrorCode.BOUNDARY_MAP_INVALID));
    }

    @Test
    void testTransformedProblemIsReassembledWithAuxiliaryUnknown() throws Exception {
        // Arrange
        AtomicInteger transforms = new AtomicInteger();
        IDiscretizationBackend auxiliary = new IDiscretizationBackend() {
            @Override
            public boolean shouldTransform(PdeProblem problem, BoundaryMap boundaryMap, VariableMap variableMap) {
                return !variableMap.isUnknown(W);
            }

            @Override
            public ProblemTransformation transform(PdeProblem problem, BoundaryMap boundaryMap, VariableMap variableMap) {
                transforms.incrementAndGet();
                Apply w = Apply.of(W, T, X);
                VariableMap extended = variableMap.registerUnknown(w);
                List<ConditionEntry> equations = new ArrayList<>(problem.equations());
                equations.add(Equation.of(w, Apply.of(U, T, X)));
                List<ConditionEntry> bcs = new ArrayList<>(problem.boundaryConditions());
                bcs.add(Equation.of(Apply.of(W, T, Constant.ZERO), Constant.ZERO));
                List<FunctionTag> functions = new ArrayList<>(problem.functions());
                functions.add(W);
                return new ProblemTransformation(problem.withEquations(equations, bcs, functions), extended);
            }
        };
        ProblemAnalyzer analyzer = new ProblemAnalyzer(AnalysisSettings.DEFAULTS, auxiliary);

        // Act
        AnalysisResult result = analyzer.analyze(ProblemFixtures.heat("u(0, x) ~ 0", "u(t, 0) ~ 0"));

        // Assert
        assertThat(transforms).hasValue(1);
        assertThat(result.variableMap().functionTags()).containsExactly(U, W);
        assertThat(result.variableMap().indexOf(X)).isEqualTo(1);
        assertThat(result.boundaryMap().functions()).containsExactly(U, W);
        assertThat(result.boundaryMap().get(W, X)).singleElement()
                .isInstanceOfSatisfying(EdgeBoundary.class, edge -> assertThat(edge.upper()).isFalse());
        assertThat(result.problem().flatEquations()).hasSize(2);
    }

    @Test
    void testDefaultBackendLeavesProblemUntouched() throws Exception {
        PdeProblem problem = ProblemFixtures.heat("u(0, x) ~ 0");

        AnalysisResult result = new ProblemAnalyzer().analyze(problem);

        assertThat(result.problem()).isSameAs(problem);
    }

    @Test
    @AllowLog(level = LogLevel.WARN, loggerPattern = ".*VariableMapBuilder", messagePattern = "Ignoring domain of 'y'.*")
    void testDomainWithoutDependentUnknownIsDropped() throws Exception {
        PdeProblem problem = ProblemFixtures.parse("""
                problem {
                  coordinates = [x, y]
                  functions = [u]
                  domains { x = [0, 1], y = [0, 5] }
                  equations = ["Dxx(u(x)) ~ 1"]
                  boundary-conditions = ["u(0) ~ 0", "u(1) ~ 0"]
                }
                """);

        AnalysisResult result = new ProblemAnalyzer().analyze(problem);

        assertThat(result.variableMap().intervals()).containsOnlyKeys(X);
        assertThat(result.boundaryMap().get(U).keySet()).containsExactly(X);
    }
}
