package com.ultron.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads, validates and caches the gateway configuration.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, UltronConfig> cache;
    private final Path configPath;
    private final Map<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System.getenv());
    }

    public ConfigService(Path configPath, Duration cacheTtl, Map<String, String> env) {
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            configPath = Path.of(System.getProperty("user.home") + pathStr.substring(1));
        }
        this.configPath = configPath;
        this.env = env != null ? env : Map.of();
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching. A missing or unreadable file yields defaults.
     */
    public UltronConfig loadConfig() {
        return cache.get(configPath.toString(), key -> {
            try {
                return readConfig();
            } catch (InvalidConfigException e) {
                log.error("invalid config at {}: {}", configPath, e.getMessage());
                return applyDefaults(new UltronConfig());
            } catch (IOException e) {
                log.error("failed to load config from: {}", configPath, e);
                return applyDefaults(new UltronConfig());
            }
        });
    }

    /**
     * Force reload config, bypassing cache.
     */
    public UltronConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    /**
     * Read and validate the config file without falling back to defaults on
     * error. Used by hot reload, which keeps the previous config when this
     * throws.
     */
    public UltronConfig readConfig() throws IOException {
        if (!Files.exists(configPath)) {
            log.warn("config file not found: {}, using defaults", configPath);
            return applyDefaults(new UltronConfig());
        }
        String raw = substituteEnvVars(Files.readString(configPath));
        UltronConfig config = applyDefaults(objectMapper.readValue(raw, UltronConfig.class));

        ConfigValidation.ValidationResult result = ConfigValidation.validate(config);
        for (var warning : result.warnings()) {
            log.warn("config warning at {}: {}", warning.path(), warning.message());
        }
        if (!result.ok()) {
            throw new InvalidConfigException(result);
        }
        log.info("config loaded from: {}", configPath);
        return config;
    }

    /**
     * Get the config file path.
     */
    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Fill in missing sections so callers never null-check top-level blocks.
     */
    public static UltronConfig applyDefaults(UltronConfig config) {
        if (config.getAgents() == null) {
            config.setAgents(new UltronConfig.AgentsConfig());
        }
        if (config.getSession() == null) {
            config.setSession(new UltronConfig.SessionConfig());
        }
        if (config.getMessages() == null) {
            config.setMessages(new UltronConfig.MessagesConfig());
        }
        if (config.getMessages().getInbound() == null) {
            config.getMessages().setInbound(new UltronConfig.InboundConfig());
        }
        if (config.getQueue() == null) {
            config.setQueue(new UltronConfig.QueueConfig());
        }
        if (config.getGateway() == null) {
            config.setGateway(new UltronConfig.GatewayConfig());
        }
        if (config.getLogging() == null) {
            config.setLogging(new UltronConfig.LoggingConfig());
        }
        return config;
    }

    /**
     * Thrown when a config file parses but fails validation.
     */
    public static class InvalidConfigException extends IOException {
        private final ConfigValidation.ValidationResult result;

        public InvalidConfigException(ConfigValidation.ValidationResult result) {
            super(formatIssues(result));
            this.result = result;
        }

        public ConfigValidation.ValidationResult getResult() {
            return result;
        }

        private static String formatIssues(ConfigValidation.ValidationResult result) {
            StringBuilder sb = new StringBuilder();
            for (var issue : result.issues()) {
                if (sb.length() > 0)
                    sb.append("; ");
                sb.append(issue.path()).append(": ").append(issue.message());
            }
            return sb.toString();
        }
    }
}
