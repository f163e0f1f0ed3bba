package com.ultron.gateway.queue;

import com.ultron.common.config.UltronConfig;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueueSettingsTest {

    @Nested
    class Normalization {
        @ParameterizedTest
        @CsvSource({
                "collect, COLLECT",
                "Coalesce, COLLECT",
                "follow-up, FOLLOWUP",
                "steering, STEER",
                "abort, INTERRUPT"
        })
        void modeAliases(String raw, QueueMode expected) {
            assertEquals(expected, QueueMode.normalize(raw));
        }

        @Test
        void unknownMode_isNull() {
            assertNull(QueueMode.normalize("sideways"));
            assertNull(QueueMode.normalize(" "));
        }

        @ParameterizedTest
        @CsvSource({
                "old, DROP_OLD",
                "drop-new, DROP_NEW",
                "summary, SUMMARIZE"
        })
        void overflowAliases(String raw, OverflowPolicy expected) {
            assertEquals(expected, OverflowPolicy.normalize(raw));
        }
    }

    @Nested
    class Resolve {
        private UltronConfig.QueueConfig config() {
            var cfg = new UltronConfig.QueueConfig();
            cfg.setMode("followup");
            cfg.setByChannel(Map.of("discord", "steer"));
            cfg.setCap(5);
            cfg.setDrop("old");
            return cfg;
        }

        @Test
        void sessionOverrideWins() {
            assertEquals(QueueMode.INTERRUPT, QueueSettings.resolve(config(), "discord", "interrupt").mode());
        }

        @Test
        void channelBeatsGlobalMode() {
            assertEquals(QueueMode.STEER, QueueSettings.resolve(config(), "Discord", null).mode());
            assertEquals(QueueMode.FOLLOWUP, QueueSettings.resolve(config(), "telegram", null).mode());
        }

        @Test
        void unknownSessionValue_fallsThrough() {
            assertEquals(QueueMode.STEER, QueueSettings.resolve(config(), "discord", "bogus").mode());
        }

        @Test
        void capAndOverflowFromConfig() {
            QueueSettings settings = QueueSettings.resolve(config(), "telegram", null);
            assertEquals(5, settings.cap());
            assertEquals(OverflowPolicy.DROP_OLD, settings.overflow());
        }

        @Test
        void noConfig_defaults() {
            assertEquals(QueueSettings.DEFAULT, QueueSettings.resolve(null, "telegram", null));
        }
    }

    @Test
    void laneCapacities() {
        assertEquals(1, Lanes.capacityFor(Lanes.sessionLane("agent:main:main"), Map.of()));
        assertEquals(4, Lanes.capacityFor(Lanes.MAIN, null));
        assertEquals(8, Lanes.capacityFor(Lanes.MAIN, Map.of(Lanes.MAIN, 8)));
        assertEquals(1, Lanes.capacityFor("custom", Map.of()));
        assertEquals("session:agent:main:main", Lanes.sessionLane("session:agent:main:main"));
    }
}
