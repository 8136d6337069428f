package io.livedoc.bootstrap;

/**
 * Which services this process runs. HTTP and SOCKET are the two deployable units;
 * ALL runs both in one JVM, still linked only through the store.
 */
public enum RunMode {
    HTTP,
    SOCKET,
    ALL;

    public boolean runsHttp() {
        return this != SOCKET;
    }

    public boolean runsSocket() {
        return this != HTTP;
    }

    /**
     * Command-line flags win over {@code RUN_MODE}.
     *
     * @throws IllegalStateException if both --http and --socket are given, or the value is unknown
     */
    public static RunMode resolve(String[] args, String envValue) {
        boolean http = false;
        boolean socket = false;
        for (String arg : args) {
            switch (arg) {
                case "--http" -> http = true;
                case "--socket" -> socket = true;
                default -> throw new IllegalStateException("Unknown argument: " + arg + " (expected --http or --socket)");
            }
        }
        if (http && socket) {
            throw new IllegalStateException("Specify only one of --http or --socket");
        }
        if (http) {
            return HTTP;
        }
        if (socket) {
            return SOCKET;
        }
        if (envValue == null || envValue.isBlank()) {
            return ALL;
        }
        try {
            return valueOf(envValue.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid RUN_MODE: " + envValue, e);
        }
    }
}
