package org.pdemeta.problem;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigList;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.pdemeta.api.ProblemDefinitionException;
import org.pdemeta.diagnostics.DiagnosticsEngine;
import org.pdemeta.expr.ConditionEntry;
import org.pdemeta.expr.ConditionGroup;
import org.pdemeta.expr.Equation;
import org.pdemeta.expr.FunctionTag;
import org.pdemeta.expr.Symbol;
import org.pdemeta.expr.parser.Declarations;
import org.pdemeta.expr.parser.ExpressionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a {@link PdeProblem} from a HOCON document.
 * <pre>
 * problem {
 *   name = heat
 *   coordinates = [t, x]
 *   time = t
 *   functions = [u]
 *   parameters = [alpha]
 *   domains { t = [0, 1], x = [0, 1] }
 *   equations = ["Dt(u(t, x)) ~ alpha * Dxx(u(t, x))"]
 *   boundary-conditions = ["u(0, x) ~ sin(x)", ["u(t, 0) ~ 0", "u(t, 1) ~ 0"]]
 * }
 * </pre>
 * Nested lists become {@link ConditionGroup}s. Domain bounds may be numbers or strings such
 * as {@code "Infinity"}; whether they are usable is decided by the variable map builder.
 * All parse errors of a document are collected before failing.
 */
public final class ProblemLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ProblemLoader.class);

    public static final String ROOT = "problem";

    private ProblemLoader() {}

    /**
     * Loads a problem file.
     *
     * @param file The HOCON file.
     * @return The problem.
     * @throws ProblemDefinitionException if the file is missing or malformed.
     */
    public static PdeProblem load(Path file) throws ProblemDefinitionException {
        if (!Files.isRegularFile(file)) {
            throw new ProblemDefinitionException("Problem file not found: " + file.toAbsolutePath());
        }
        LOG.debug("Loading problem from {}", file.toAbsolutePath());
        final Config config;
        try {
            config = ConfigFactory.parseFile(file.toFile()).resolve();
        } catch (ConfigException e) {
            throw new ProblemDefinitionException("Cannot parse problem file " + file + ": " + e.getMessage(), e);
        }
        return parse(config, nameFallback(file.toFile()));
    }

    /**
     * Reads a problem from HOCON text.
     *
     * @param hocon The document.
     * @return The problem.
     * @throws ProblemDefinitionException if the document is malformed.
     */
    public static PdeProblem parseString(String hocon) throws ProblemDefinitionException {
        final Config config;
        try {
            config = ConfigFactory.parseString(hocon).resolve();
        } catch (ConfigException e) {
            throw new ProblemDefinitionException("Cannot parse problem definition: " + e.getMessage(), e);
        }
        return parse(config, "problem");
    }

    /**
     * Reads a problem from an already parsed configuration containing a {@code problem} block.
     *
     * @param config The configuration.
     * @param defaultName The name to use when {@code problem.name} is absent.
     * @return The problem.
     * @throws ProblemDefinitionException if a key is missing or an equation does not parse.
     */
    public static PdeProblem parse(Config config, String defaultName) throws ProblemDefinitionException {
        if (!config.hasPath(ROOT)) {
            throw new ProblemDefinitionException("Missing '" + ROOT + "' block.");
        }
        Config problem = config.getConfig(ROOT);
        try {
            String name = problem.hasPath("name") ? problem.getString("name") : defaultName;
            List<String> coordinateNames = problem.getStringList("coordinates");
            List<String> functionNames = problem.getStringList("functions");
            List<String> parameterNames = problem.hasPath("parameters") ? problem.getStringList("parameters") : List.of();
            Declarations declarations = new Declarations(coordinateNames, parameterNames, functionNames);

            Symbol time = null;
            if (problem.hasPath("time")) {
                String timeName = problem.getString("time");
                time = declarations.coordinate(timeName).orElseThrow(() -> new ProblemDefinitionException(
                        "Time coordinate '" + timeName + "' is not among the declared coordinates " + coordinateNames + "."));
            }

            Map<Symbol, Interval> domains = readDomains(problem);

            DiagnosticsEngine diagnostics = new DiagnosticsEngine();
            List<ConditionEntry> equations = readEntries(problem.getList("equations"), "equations", declarations, diagnostics);
            List<ConditionEntry> bcs = problem.hasPath("boundary-conditions")
                    ? readEntries(problem.getList("boundary-conditions"), "boundary-conditions", declarations, diagnostics)
                    : List.of();
            if (diagnostics.hasErrors()) {
                throw new ProblemDefinitionException(diagnostics.summary());
            }

            List<FunctionTag> functions = declarations.functions();
            LOG.debug("Loaded problem '{}': {} coordinates, {} functions, {} equations, {} boundary entries",
                    name, coordinateNames.size(), functions.size(), equations.size(), bcs.size());
            return new PdeProblem(name, declarations.coordinates(), time, functions, declarations.parameters(),
                    equations, bcs, domains);
        } catch (ConfigException e) {
            throw new ProblemDefinitionException("Invalid problem definition: " + e.getMessage(), e);
        }
    }

    private static Map<Symbol, Interval> readDomains(Config problem) throws ProblemDefinitionException {
        Map<Symbol, Interval> domains = new LinkedHashMap<>();
        if (!problem.hasPath("domains")) {
            return domains;
        }
        ConfigObject table = problem.getObject("domains");
        for (String key : table.keySet()) {
            ConfigValue value = table.get(key);
            if (value.valueType() != ConfigValueType.LIST || ((ConfigList) value).size() != 2) {
                throw new ProblemDefinitionException("Domain of '" + key + "' must be a two-element list [lower, upper].");
            }
            ConfigList bounds = (ConfigList) value;
            domains.put(Symbol.coordinate(key), Interval.of(bound(key, bounds.get(0)), bound(key, bounds.get(1))));
        }
        return domains;
    }

    private static double bound(String coordinate, ConfigValue value) throws ProblemDefinitionException {
        Object raw = value.unwrapped();
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        if (raw instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new ProblemDefinitionException("Domain bound of '" + coordinate + "' is not a number: '" + s + "'.", e);
            }
        }
        throw new ProblemDefinitionException("Domain bound of '" + coordinate + "' is not a number: " + value.render());
    }

    private static List<ConditionEntry> readEntries(ConfigList list, String path, Declarations declarations,
                                                    DiagnosticsEngine diagnostics) {
        List<ConditionEntry> entries = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            ConfigValue value = list.get(i);
            String source = path + "[" + i + "]";
            if (value.valueType() == ConfigValueType.LIST) {
                entries.add(new ConditionGroup(readEntries((ConfigList) value, source, declarations, diagnostics)));
            } else if (value.valueType() == ConfigValueType.STRING) {
                Equation eq = ExpressionParser.parseEquation((String) value.unwrapped(), source, declarations, diagnostics);
                if (eq != null) {
                    entries.add(eq);
                }
            } else {
                diagnostics.reportError("Expected an equation string or a nested list, got " + value.valueType(), source, 0);
            }
        }
        return entries;
    }

    private static String nameFallback(File file) {
        String fileName = file.getName();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
