package io.monitorselector.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Committee sizing
    public static final int DEFAULT_TARGET_ACTIVE = 7;
    public static final int DEFAULT_BASE_TESTING = 5;

    // Minimum telemetry samples before promotion
    public static final int DEFAULT_MIN_COUNT_FOR_TESTING = 9;
    public static final int DEFAULT_MIN_COUNT_FOR_ACTIVE = 32;

    // Performance replacement: candidate priority must be this much better (lower)
    public static final double DEFAULT_REPLACEMENT_MIN_PERCENT = 5.0;
    public static final double DEFAULT_REPLACEMENT_MIN_POINTS = 5.0;
    public static final boolean DEFAULT_ACTIVE_SWAP_ENABLED = false;

    // Network constraints
    public static final int SAME_SUBNET_PREFIX_V4 = 24;
    public static final int SAME_SUBNET_PREFIX_V6 = 48;
    public static final int DIVERSITY_PREFIX_V4 = 20;
    public static final int DIVERSITY_PREFIX_V6 = 44;

    // Account constraints
    public static final int DEFAULT_ACCOUNT_LIMIT_PER_SERVER = 2;

    // Review scheduling
    public static final long DEFAULT_CHANGED_REVIEW_MINUTES = 60L;
    public static final long DEFAULT_UNCHANGED_REVIEW_MINUTES = 20L;
    public static final int DEFAULT_REVIEW_BATCH_SIZE = 10;

    // Driver backoff when no servers are due
    public static final long DEFAULT_INITIAL_BACKOFF_SECONDS = 3L;
    public static final long DEFAULT_MAX_BACKOFF_SECONDS = 60L;

    // Paused assignments
    public static final long DEFAULT_RECHECK_PAUSED_MINUTES = 60L;

    // Telemetry window used for priority and health
    public static final long DEFAULT_TELEMETRY_WINDOW_HOURS = 24L;

    // Command line
    public static final int DEFAULT_METRICS_PORT = 9000;
    public static final String COMMAND_SERVER = "server";
    public static final String COMMAND_ONCE = "once";
    public static final String COMMAND_SIMULATE = "simulate";
}
