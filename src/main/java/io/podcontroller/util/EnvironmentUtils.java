package io.podcontroller.util;

/**
 * Utility class for environment variable operations
 */
public final class EnvironmentUtils {

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
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return value.trim();
    }

    /**
     * Resolve an identifier for this controller process: the given value when present,
     * otherwise HOSTNAME, otherwise a fixed fallback.
     */
    public static String resolveControllerId(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        return getEnv("HOSTNAME", "replication-controller");
    }
}
