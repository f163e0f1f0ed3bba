package com.ultron.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;

/**
 * Subsystem-aware logger that wraps SLF4J and adds structured subsystem
 * context.
 *
 * <p>
 * Usage:
 *
 * <pre>
 * SubsystemLogger log = SubsystemLogger.create("gateway/inbound");
 * log.debug("duplicate dropped", Map.of("provider", "telegram"));
 * SubsystemLogger child = log.child("debounce");
 * </pre>
 *
 * The SLF4J logger name is {@code ultron.<subsystem>} with slashes turned
 * into dots, so levels can be tuned per subsystem in logback.xml.
 */
public class SubsystemLogger {

    public static final String MDC_SUBSYSTEM = "subsystem";

    private final String subsystem;
    private final Logger logger;

    private SubsystemLogger(String subsystem) {
        this.subsystem = subsystem;
        this.logger = LoggerFactory.getLogger("ultron." + subsystem.replace('/', '.'));
    }

    public static SubsystemLogger create(String subsystem) {
        return new SubsystemLogger(subsystem);
    }

    /**
     * Create a child logger with extended subsystem path.
     */
    public SubsystemLogger child(String name) {
        return new SubsystemLogger(subsystem + "/" + name);
    }

    // -----------------------------------------------------------------------
    // Log methods
    // -----------------------------------------------------------------------

    public void debug(String message, Map<String, Object> meta) {
        if (logger.isDebugEnabled()) {
            emit(LogLevel.DEBUG, message, meta, null);
        }
    }

    public void warn(String message, Map<String, Object> meta) {
        emit(LogLevel.WARN, message, meta, null);
    }

    public void error(String message, Map<String, Object> meta) {
        emit(LogLevel.ERROR, message, meta, null);
    }

    public void error(String message, Map<String, Object> meta, Throwable t) {
        emit(LogLevel.ERROR, message, meta, t);
    }

    public String getSubsystem() {
        return subsystem;
    }

    String loggerName() {
        return logger.getName();
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    private void emit(LogLevel level, String message, Map<String, Object> meta, Throwable t) {
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            String formatted = formatMessage(message, meta);
            switch (level) {
                case DEBUG -> logger.debug(formatted, t);
                case WARN -> logger.warn(formatted, t);
                default -> logger.error(formatted, t);
            }
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    String formatMessage(String message, Map<String, Object> meta) {
        if (meta == null || meta.isEmpty()) {
            return "[" + subsystem + "] " + message;
        }
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(subsystem).append("] ").append(message);
        sb.append(" {");
        boolean first = true;
        for (var entry : meta.entrySet()) {
            if (!first)
                sb.append(", ");
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        sb.append("}");
        return sb.toString();
    }
}
