package io.livedoc.bootstrap;

import io.livedoc.config.LiveDocConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup configuration validator.
 *
 * Validates configuration before anything binds a port or opens a store connection.
 * Throws IllegalStateException if configuration is invalid; App exits with status 1.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    private StartupConfigValidator() {
    }

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(LiveDocConfig config, RunMode mode) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation (mode={})...", mode);
        log.info("════════════════════════════════════════════════════════");

        if (!config.isValid()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: one or more settings are out of range\n" +
                "Check ports (0-65535), pool/batch/buffer sizes (> 0), timeouts (> 0)\n" +
                "and that STORE_RETRY_INITIAL_MS <= STORE_RETRY_MAX_MS."
            );
        }
        log.info("✓ Config values in range");

        if (mode == RunMode.ALL && config.httpPort() != 0 && config.httpPort() == config.socketPort()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: HTTP_PORT and SOCKET_PORT are both " + config.httpPort() + "\n" +
                "Both services run in this process and need separate listeners."
            );
        }

        if (config.store() == LiveDocConfig.StoreType.MEMORY) {
            if (mode != RunMode.ALL) {
                throw new IllegalStateException(
                    "❌ INVALID CONFIG: STORE=memory only works with RUN_MODE=ALL\n" +
                    "An in-memory store is private to one process, so a separate " + mode +
                    " process would never see the other service's writes."
                );
            }
            log.warn("⚠️ STORE=memory: state is lost on restart (local runs and tests only)");
        } else {
            log.info("✓ Store: MongoDB at {} (db={})", redact(config.dbUri()), config.dbName());
        }

        if (config.changeFeed() == LiveDocConfig.ChangeFeedType.CHANGESTREAM
            && config.store() != LiveDocConfig.StoreType.MONGO) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: CHANGE_FEED=changestream requires STORE=mongo"
            );
        }

        if (mode.runsSocket() && config.socketToken().isEmpty()) {
            log.warn("⚠️ SOCKET_TOKEN not set: socket handshakes are not authenticated");
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    /**
     * Hide credentials in a connection string for logging.
     */
    static String redact(String uri) {
        if (uri == null) {
            return null;
        }
        return uri.replaceAll("://[^@/]+@", "://***@");
    }
}
