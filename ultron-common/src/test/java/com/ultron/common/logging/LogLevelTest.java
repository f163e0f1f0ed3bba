package com.ultron.common.logging;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogLevelTest {

    @ParameterizedTest
    @CsvSource({
            "info, INFO",
            "WARNING, WARN",
            " debug , DEBUG",
            "off, SILENT",
            "bogus, INFO"
    })
    void normalize(String raw, LogLevel expected) {
        assertEquals(expected, LogLevel.normalize(raw));
    }

    @Test
    void toSlf4jLevel_mapsSilentAndFatal() {
        assertEquals("OFF", LogLevel.SILENT.toSlf4jLevel());
        assertEquals("ERROR", LogLevel.FATAL.toSlf4jLevel());
        assertEquals("DEBUG", LogLevel.DEBUG.toSlf4jLevel());
    }
}
