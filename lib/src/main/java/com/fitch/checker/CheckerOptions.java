package com.fitch.checker;

import java.util.Objects;
import java.util.Properties;

/**
 * Immutable settings for a {@link ProofChecker}. The only tunable today is the formula nesting
 * limit, which bounds the recursion of the formula parser on adversarial input.
 */
public final class CheckerOptions {
    public static final String MAX_DEPTH_PROPERTY = "fitch.checker.maxDepth";
    /** Environment fallback kept for convenience; prefer using system properties. */
    static final String MAX_DEPTH_ENV = "FITCH_CHECKER_MAX_DEPTH";
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    private static final CheckerOptions DEFAULTS = new CheckerOptions(DEFAULT_MAX_NESTING_DEPTH);

    private final int maxNestingDepth;

    private CheckerOptions(int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    public static CheckerOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Reads {@value #MAX_DEPTH_PROPERTY} from the given properties, keeping the default when the
     * key is absent.
     *
     * @throws IllegalArgumentException if the value is not a positive integer
     */
    public static CheckerOptions fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        return fromValue(properties.getProperty(MAX_DEPTH_PROPERTY), MAX_DEPTH_PROPERTY);
    }

    /** Like {@link #fromProperties}, reading system properties with an environment fallback. */
    public static CheckerOptions fromSystemProperties() {
        String value = System.getProperty(MAX_DEPTH_PROPERTY);
        if (value != null) {
            return fromValue(value, MAX_DEPTH_PROPERTY);
        }
        return fromValue(System.getenv(MAX_DEPTH_ENV), MAX_DEPTH_ENV);
    }

    private static CheckerOptions fromValue(String value, String source) {
        if (value == null || value.isBlank()) {
            return DEFAULTS;
        }
        int depth;
        try {
            depth = Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid " + source + ": " + value, ex);
        }
        return new CheckerOptions(depth);
    }

    public CheckerOptions withMaxNestingDepth(int depth) {
        return new CheckerOptions(depth);
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }
}
