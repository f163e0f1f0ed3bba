package com.ultron.common.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration paths: state directory and config file.
 */
public final class ConfigPaths {

    private ConfigPaths() {
    }

    // =========================================================================
    // Directory / file name constants
    // =========================================================================

    private static final String STATE_DIRNAME = ".ultron";
    private static final String CONFIG_FILENAME = "ultron.json";

    public static final String ENV_STATE_DIR = "ULTRON_STATE_DIR";
    public static final String ENV_CONFIG_PATH = "ULTRON_CONFIG_PATH";

    // =========================================================================
    // State directory
    // =========================================================================

    /**
     * State directory for mutable data (sessions, archives).
     * Can be overridden via ULTRON_STATE_DIR.
     * Default: ~/.ultron
     */
    public static Path resolveStateDir() {
        return resolveStateDir(System.getenv(), homeDir());
    }

    public static Path resolveStateDir(Map<String, String> env, String homedir) {
        String override = envTrimmed(env, ENV_STATE_DIR);
        if (override != null) {
            return resolveUserPath(override, homedir);
        }
        return Path.of(homedir, STATE_DIRNAME);
    }

    /**
     * Resolve the state directory, preferring the configured
     * {@code gateway.stateDir}.
     */
    public static Path resolveStateDir(UltronConfig config) {
        if (config != null && config.getGateway() != null) {
            String configured = config.getGateway().getStateDir();
            if (configured != null && !configured.isBlank()) {
                return resolveUserPath(configured.trim(), homeDir());
            }
        }
        return resolveStateDir();
    }

    // =========================================================================
    // Config file path
    // =========================================================================

    /**
     * Config file path; ULTRON_CONFIG_PATH wins over the state directory.
     */
    public static Path resolveConfigPath() {
        return resolveConfigPath(System.getenv(), homeDir());
    }

    public static Path resolveConfigPath(Map<String, String> env, String homedir) {
        String override = envTrimmed(env, ENV_CONFIG_PATH);
        if (override != null) {
            return resolveUserPath(override, homedir);
        }
        return resolveStateDir(env, homedir).resolve(CONFIG_FILENAME);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    public static Path resolveUserPath(String raw, String homedir) {
        String trimmed = raw.trim();
        if (trimmed.startsWith("~")) {
            return Path.of(homedir + trimmed.substring(1)).toAbsolutePath().normalize();
        }
        return Path.of(trimmed).toAbsolutePath().normalize();
    }

    private static String homeDir() {
        return System.getProperty("user.home");
    }

    private static String envTrimmed(Map<String, String> env, String key) {
        if (env == null) {
            return null;
        }
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
