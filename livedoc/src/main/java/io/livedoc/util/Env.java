package io.livedoc.util;

/**
 * Environment variable utilities.
 * Falls back to JVM system properties so tests and local runs can use -Dkey=value.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for " + key + ": " + value, e);
        }
    }

    public static long getLong(String key, long defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid long for " + key + ": " + value, e);
        }
    }

    public static boolean getBool(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    private Env() {}
}
