package org.puneet.searchspace.util;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Centralized configuration for search space components.
 * Values are read from {@code searchspace.properties} on the classpath; every key
 * has a default so the file is optional.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class SearchSpaceConfig {

    private static final Logger logger = LoggerFactory.getLogger(SearchSpaceConfig.class);

    /** Classpath resource holding overrides */
    public static final String CONFIG_FILE = "searchspace.properties";

    // ===================================================================================
    // DEFAULTS
    // ===================================================================================

    /** Default seed for dummy value generation and digest samplers */
    public static final long DEFAULT_RANDOM_SEED = 123456L;

    /** Default absolute tolerance used when evaluating linear constraints */
    public static final double DEFAULT_CONSTRAINT_TOLERANCE = 1e-8;

    /** Whether hierarchy renderings inside error messages show names only */
    public static final boolean DEFAULT_NAMES_ONLY_IN_ERRORS = false;

    public static final String RANDOM_SEED_KEY = "searchspace.random.seed";
    public static final String CONSTRAINT_TOLERANCE_KEY = "searchspace.constraint.tolerance";
    public static final String NAMES_ONLY_KEY = "searchspace.hierarchy.names-only-in-errors";

    private static final Properties properties = new Properties();

    /** Read once; constraint checks run per candidate */
    private static final double constraintTolerance;

    static {
        try (InputStream input = SearchSpaceConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.debug("Loaded search space configuration from {}", CONFIG_FILE);
            } else {
                logger.debug("{} not found in classpath, using defaults", CONFIG_FILE);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + CONFIG_FILE, e);
        }
        constraintTolerance = readConstraintTolerance();
    }

    private SearchSpaceConfig() {
        throw new AssertionError("SearchSpaceConfig is a utility class and cannot be instantiated");
    }

    public static long getRandomSeed() {
        return getLongProperty(RANDOM_SEED_KEY, DEFAULT_RANDOM_SEED);
    }

    public static double getConstraintTolerance() {
        return constraintTolerance;
    }

    private static double readConstraintTolerance() {
        double tolerance = getDoubleProperty(CONSTRAINT_TOLERANCE_KEY, DEFAULT_CONSTRAINT_TOLERANCE);
        if (tolerance < 0.0) {
            throw new IllegalArgumentException(
                "Constraint tolerance must be non-negative, got: " + tolerance);
        }
        return tolerance;
    }

    public static boolean isNamesOnlyInErrors() {
        String value = properties.getProperty(NAMES_ONLY_KEY);
        if (value == null) return DEFAULT_NAMES_ONLY_IN_ERRORS;
        String trimmed = value.trim();
        if (!trimmed.equalsIgnoreCase("true") && !trimmed.equalsIgnoreCase("false")) {
            throw new IllegalArgumentException("Invalid value for '" + NAMES_ONLY_KEY + "' in "
                + CONFIG_FILE + ": " + value);
        }
        return Boolean.parseBoolean(trimmed);
    }

    /**
     * Creates a new random generator seeded with the configured seed, so that
     * repeated runs draw the same dummy values and samples.
     *
     * @return a freshly seeded generator
     */
    public static RandomGenerator newRandomGenerator() {
        return new Well19937c(getRandomSeed());
    }

    private static long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for '" + key + "' in " + CONFIG_FILE + ": " + value);
        }
    }

    private static double getDoubleProperty(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) return defaultValue;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for '" + key + "' in " + CONFIG_FILE + ": " + value);
        }
    }
}
