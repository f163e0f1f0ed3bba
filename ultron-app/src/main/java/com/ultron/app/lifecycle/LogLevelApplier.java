package com.ultron.app.lifecycle;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.ultron.common.config.UltronConfig;
import com.ultron.common.logging.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps {@code logging.level} onto the root Logback logger.
 */
@Slf4j
@Component
public class LogLevelApplier {

    public LogLevel apply(UltronConfig config) {
        String raw = config != null && config.getLogging() != null ? config.getLogging().getLevel() : null;
        LogLevel level = LogLevel.normalize(raw);
        if (LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME) instanceof Logger root) {
            root.setLevel(Level.toLevel(level.toSlf4jLevel(), Level.INFO));
            log.debug("root log level set to {}", level);
        }
        return level;
    }
}
