package org.pdemeta.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Numeric settings of an analysis run, read from the {@code pdemeta.analysis} block.
 *
 * @param boundTolerance Relative tolerance for matching a boundary value against a domain bound,
 *                       scaled by {@code max(1, |bound|)}.
 * @param minDomainWidth Minimum width of every coordinate domain in use.
 */
public record AnalysisSettings(double boundTolerance, double minDomainWidth) {

    public static final String PATH = "pdemeta.analysis";
    public static final double DEFAULT_BOUND_TOLERANCE = 1e-9;
    public static final double DEFAULT_MIN_DOMAIN_WIDTH = 1e-6;

    public static final AnalysisSettings DEFAULTS = new AnalysisSettings(DEFAULT_BOUND_TOLERANCE, DEFAULT_MIN_DOMAIN_WIDTH);

    public AnalysisSettings {
        if (!(boundTolerance >= 0.0) || Double.isInfinite(boundTolerance)) {
            throw new IllegalArgumentException("bound-tolerance must be a finite value >= 0, got " + boundTolerance);
        }
        // A domain must be wide enough that no value can lie within tolerance of both bounds.
        if (!(minDomainWidth > 2.0 * boundTolerance) || Double.isInfinite(minDomainWidth)) {
            throw new IllegalArgumentException("min-domain-width must be finite and greater than 2 * bound-tolerance ("
                    + 2.0 * boundTolerance + "), got " + minDomainWidth);
        }
    }

    /**
     * Reads the settings, falling back to the defaults for absent keys.
     *
     * @param config The resolved application configuration.
     * @return The validated settings.
     * @throws ConfigException.BadValue if a value is out of range.
     */
    public static AnalysisSettings fromConfig(Config config) {
        if (!config.hasPath(PATH)) {
            return DEFAULTS;
        }
        Config analysis = config.getConfig(PATH);
        double tolerance = analysis.hasPath("bound-tolerance")
                ? analysis.getDouble("bound-tolerance") : DEFAULT_BOUND_TOLERANCE;
        double minWidth = analysis.hasPath("min-domain-width")
                ? analysis.getDouble("min-domain-width") : DEFAULT_MIN_DOMAIN_WIDTH;
        try {
            return new AnalysisSettings(tolerance, minWidth);
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(analysis.origin(), PATH, e.getMessage());
        }
    }
}
