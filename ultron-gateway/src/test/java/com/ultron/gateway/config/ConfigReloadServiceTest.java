package com.ultron.gateway.config;

import com.ultron.common.config.ConfigService;
import com.ultron.common.config.UltronConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConfigReloadServiceTest {

    private static final String BASE = """
            {
              "agents": { "list": [ { "id": "main" } ] },
              "queue": { "mode": "collect", "cap": 10 }
            }
            """;

    @TempDir
    Path tempDir;

    private Path configFile;
    private ConfigReloadService reload;
    private final List<ConfigReloadService.ConfigDiff> diffs = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        configFile = tempDir.resolve("ultron.json");
        Files.writeString(configFile, BASE);
        var configService = new ConfigService(configFile, Duration.ZERO, Map.of());
        reload = new ConfigReloadService(configService, configService.readConfig());
        reload.addCallback((oldConfig, newConfig, diff) -> diffs.add(diff));
    }

    @AfterEach
    void tearDown() {
        reload.close();
    }

    @Nested
    class ReloadNow {
        @Test
        void validChange_appliedAndReported() throws Exception {
            Files.writeString(configFile, BASE.replace("\"collect\"", "\"steer\""));

            UltronConfig applied = reload.reloadNow().orElseThrow();

            assertEquals("steer", applied.getQueue().getMode());
            assertSame(applied, reload.getCurrent());
            assertEquals(1, diffs.size());
            assertTrue(diffs.get(0).hasChange("queue"));
            assertFalse(diffs.get(0).hasChange("agents"));
        }

        @Test
        void invalidValue_rejectedPreviousKept() throws Exception {
            UltronConfig before = reload.getCurrent();
            Files.writeString(configFile, BASE.replace("\"cap\": 10", "\"cap\": 0"));

            assertTrue(reload.reloadNow().isEmpty());

            assertSame(before, reload.getCurrent());
            assertTrue(diffs.isEmpty());
        }

        @Test
        void malformedJson_rejected() throws Exception {
            UltronConfig before = reload.getCurrent();
            Files.writeString(configFile, "{ \"queue\": ");

            assertTrue(reload.reloadNow().isEmpty());
            assertSame(before, reload.getCurrent());
        }

        @Test
        void failingCallback_doesNotBlockOthers() throws Exception {
            reload.addCallback((o, n, d) -> {
                throw new IllegalStateException("listener bug");
            });
            var after = new CopyOnWriteArrayList<String>();
            reload.addCallback((o, n, d) -> after.add("called"));

            assertTrue(reload.reloadNow().isPresent());
            assertEquals(List.of("called"), after);
        }
    }

    @Nested
    class Diff {
        @Test
        void identicalConfigs_noChanges() {
            UltronConfig cfg = reload.getCurrent();
            assertTrue(ConfigReloadService.computeDiff(cfg, cfg).isEmpty());
        }

        @Test
        void nullSide_reportsEverything() {
            var diff = ConfigReloadService.computeDiff(null, new UltronConfig());
            assertTrue(diff.hasChange("agents"));
            assertTrue(diff.hasChange("logging"));
        }

        @Test
        void agentChange_detected() {
            var a = new UltronConfig();
            var b = new UltronConfig();
            b.setAgents(new UltronConfig.AgentsConfig());
            assertEquals(List.of("agents"), ConfigReloadService.computeDiff(a, b).changedPaths());
        }
    }

    @Test
    void watcher_picksUpFileChange() throws Exception {
        CountDownLatch reloaded = new CountDownLatch(1);
        reload.addCallback((o, n, d) -> reloaded.countDown());
        reload.start();
        Thread.sleep(200);

        Files.writeString(configFile, BASE.replace("\"cap\": 10", "\"cap\": 15"));

        assertTrue(reloaded.await(10, TimeUnit.SECONDS));
        assertEquals(15, reload.getCurrent().getQueue().getCap());
    }
}
