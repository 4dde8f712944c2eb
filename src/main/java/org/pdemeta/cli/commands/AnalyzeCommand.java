package org.pdemeta.cli.commands;

import com.typesafe.config.ConfigException;
import org.pdemeta.ProblemAnalyzer;
import org.pdemeta.api.AnalysisException;
import org.pdemeta.api.AnalysisResult;
import org.pdemeta.api.IDiscretizationBackend;
import org.pdemeta.boundary.validation.EdgeCoverageValidator;
import org.pdemeta.boundary.validation.IBoundaryMapValidator;
import org.pdemeta.cli.CommandLineInterface;
import org.pdemeta.cli.rendering.AnalysisReportRenderer;
import org.pdemeta.config.AnalysisSettings;
import org.pdemeta.problem.PdeProblem;
import org.pdemeta.problem.ProblemLoader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "analyze",
    description = "Builds the variable map of a problem file and classifies its boundary conditions"
)
public class AnalyzeCommand implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_ANALYSIS_FAILED = 1;
    public static final int EXIT_IO = 2;

    @Parameters(index = "0", paramLabel = "PROBLEM", description = "The HOCON problem file")
    private File problemFile;

    @Option(
        names = {"--require-edges"},
        description = "Reject problems where an unknown lacks a lower or upper condition on a spatial coordinate"
    )
    private boolean requireEdges;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (!problemFile.isFile()) {
            err.println("Problem file not found: " + problemFile.getAbsolutePath());
            return EXIT_IO;
        }

        final AnalysisSettings settings;
        try {
            settings = AnalysisSettings.fromConfig(parent.getConfig());
        } catch (ConfigException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_IO;
        }

        IDiscretizationBackend backend = requireEdges ? new EdgeCheckingBackend() : IDiscretizationBackend.DEFAULT;
        try {
            PdeProblem problem = ProblemLoader.load(problemFile.toPath());
            AnalysisResult result = new ProblemAnalyzer(settings, backend).analyze(problem);
            out.print(AnalysisReportRenderer.render(result));
            out.flush();
            return EXIT_OK;
        } catch (AnalysisException e) {
            err.println("[" + e.getCode() + "] " + e.getMessage());
            return EXIT_ANALYSIS_FAILED;
        }
    }

    private static final class EdgeCheckingBackend implements IDiscretizationBackend {
        private final IBoundaryMapValidator validator = new EdgeCoverageValidator();

        @Override
        public IBoundaryMapValidator boundaryMapValidator() {
            return validator;
        }
    }
}
