package com.ultron.common.logging;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SubsystemLoggerTest {

    @Test
    void loggerName_usesDottedSubsystem() {
        SubsystemLogger log = SubsystemLogger.create("gateway/inbound");
        assertEquals("ultron.gateway.inbound", log.loggerName());
        assertEquals("gateway/inbound/debounce", log.child("debounce").getSubsystem());
        assertEquals("ultron.gateway.inbound.debounce", log.child("debounce").loggerName());
    }

    @Test
    void formatMessage_prefixesSubsystemAndMeta() {
        SubsystemLogger log = SubsystemLogger.create("gateway/inbound");
        assertEquals("[gateway/inbound] flushed", log.formatMessage("flushed", null));
        assertEquals("[gateway/inbound] dropped {provider=slack}",
                log.formatMessage("dropped", Map.of("provider", "slack")));
    }
}
