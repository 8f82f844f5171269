package io.monitorselector.util;

/**
 * Utility class for environment variable operations
 */
public final class EnvironmentUtils {

    public static final String INVOCATION_ID = "INVOCATION_ID";

    private EnvironmentUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Get environment variable with default value
     *
     * @param name the environment variable name
     * @param defaultValue the default value to return if not set or blank
     * @return the trimmed environment variable value or default if not set
     */
    public static String getEnv(String name, String defaultValue) {
        String value = System.getenv(name);
        return value != null && !value.trim().isEmpty() ? value.trim() : defaultValue;
    }

    /**
     * Whether the process was started by a service manager that records its own timestamps
     * (systemd sets INVOCATION_ID for every unit it starts).
     */
    public static boolean isManagedService() {
        return getEnv(INVOCATION_ID, null) != null;
    }
}
