package com.ultron.common.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("ultron.json");
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "agents": {
                    "list": [
                      { "id": "Support", "sessionScope": "per-peer",
                        "bindings": { "channels": ["slack"] } },
                      { "id": "ops", "defaultAgent": true }
                    ]
                  },
                  "queue": { "mode": "followup", "cap": 5, "drop": "drop-old" },
                  "logging": { "level": "debug" }
                }
                """;
        Files.writeString(configPath, json);

        UltronConfig config = new ConfigService(configPath).loadConfig();

        assertEquals(2, config.getAgents().getEntries().size());
        assertEquals("per-peer", config.getAgents().getEntries().get(0).getSessionScope());
        assertEquals(5, config.getQueue().getCap());
        assertEquals("debug", config.getLogging().getLevel());
        assertNotNull(config.getMessages().getInbound());
        assertEquals("ops", AgentIds.resolveDefaultAgentId(config).orElseThrow());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        UltronConfig config = new ConfigService(tempDir.resolve("nonexistent.json")).loadConfig();

        assertNotNull(config.getSession());
        assertNotNull(config.getQueue());
        assertTrue(config.getAgents().getEntries().isEmpty());
    }

    @Test
    void loadConfig_invalid_fallsBackToDefaults() throws IOException {
        Files.writeString(configPath, """
                { "queue": { "mode": "shout" } }
                """);

        UltronConfig config = new ConfigService(configPath).loadConfig();

        assertNull(config.getQueue().getMode());
    }

    @Test
    void readConfig_invalid_throwsWithIssues() throws IOException {
        Files.writeString(configPath, """
                { "agents": { "list": [ { "id": "a" }, { "id": "A" } ] } }
                """);

        var service = new ConfigService(configPath);
        var ex = assertThrows(ConfigService.InvalidConfigException.class, service::readConfig);
        assertEquals("agents.list[1].id", ex.getResult().issues().get(0).path());
    }

    @Test
    void substituteEnvVars_usesEnvThenDefault() {
        var service = new ConfigService(configPath, Duration.ofMillis(200), Map.of("BOT_NAME", "ultron"));
        assertEquals("hello", service.substituteEnvVars("hello"));
        assertEquals("ultron", service.substituteEnvVars("${BOT_NAME}"));
        assertEquals("fallback", service.substituteEnvVars("${MISSING_VAR:-fallback}"));
    }

    @Test
    void loadConfig_isCached_reloadBypassesCache() throws IOException {
        Files.writeString(configPath, """
                { "queue": { "cap": 3 } }
                """);

        var service = new ConfigService(configPath, Duration.ofMinutes(5), Map.of());
        UltronConfig first = service.loadConfig();
        assertSame(first, service.loadConfig());

        Files.writeString(configPath, """
                { "queue": { "cap": 7 } }
                """);
        assertEquals(3, service.loadConfig().getQueue().getCap());
        assertEquals(7, service.reloadConfig().getQueue().getCap());
    }
}
