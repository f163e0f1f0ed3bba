package com.ultron.common.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Config validation: structural and semantic checks after deserialization.
 */
public final class ConfigValidation {

    private ConfigValidation() {
    }

    // =========================================================================
    // Types
    // =========================================================================

    public enum Severity {
        ERROR, WARNING
    }

    public record ValidationIssue(
            String path,
            String message,
            Severity severity) {
    }

    public record ValidationResult(
            boolean ok,
            UltronConfig config,
            List<ValidationIssue> issues,
            List<ValidationIssue> warnings) {
        public static ValidationResult success(UltronConfig config, List<ValidationIssue> warnings) {
            return new ValidationResult(true, config, List.of(), warnings);
        }

        public static ValidationResult failure(List<ValidationIssue> issues, List<ValidationIssue> warnings) {
            return new ValidationResult(false, null, issues, warnings);
        }
    }

    // =========================================================================
    // Constants
    // =========================================================================

    public static final Set<String> SESSION_SCOPES = Set.of(
            "main", "per-peer", "per-channel-peer", "per-account-channel-peer");

    public static final Set<String> QUEUE_MODES = Set.of(
            "collect", "coalesce", "followup", "follow-up", "steer", "interrupt", "abort");

    public static final Set<String> DROP_POLICIES = Set.of(
            "drop-old", "old", "oldest", "drop-new", "new", "newest", "summarize", "summary");

    private static final Set<String> RESET_MODES = Set.of("daily", "idle");

    // =========================================================================
    // Public API
    // =========================================================================

    /**
     * Validate a config object after deserialization.
     */
    public static ValidationResult validate(UltronConfig config) {
        List<ValidationIssue> issues = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();

        validateAgents(config, issues, warnings);
        validateSession(config, issues, warnings);
        validateInbound(config, issues);
        validateQueue(config, issues);

        if (!issues.isEmpty()) {
            return ValidationResult.failure(issues, warnings);
        }
        return ValidationResult.success(config, warnings);
    }

    // =========================================================================
    // Agents validation
    // =========================================================================

    private static void validateAgents(UltronConfig config,
            List<ValidationIssue> issues, List<ValidationIssue> warnings) {
        var agents = config.getAgents();
        if (agents == null)
            return;

        var entries = agents.getEntries();
        Set<String> seen = new HashSet<>();
        int defaults = 0;
        for (int i = 0; i < entries.size(); i++) {
            var agent = entries.get(i);
            String path = "agents.list[" + i + "]";
            if (agent == null || agent.getId() == null || agent.getId().isBlank()) {
                issues.add(new ValidationIssue(path + ".id", "Agent must have an id", Severity.ERROR));
                continue;
            }
            String id = AgentIds.normalizeAgentId(agent.getId());
            if (!seen.add(id)) {
                issues.add(new ValidationIssue(path + ".id",
                        "Duplicate agent id: \"" + id + "\"", Severity.ERROR));
            }
            if (id.contains(":")) {
                issues.add(new ValidationIssue(path + ".id",
                        "Agent id must not contain ':'", Severity.ERROR));
            }
            if (Boolean.TRUE.equals(agent.getDefaultAgent())) {
                defaults++;
            }
            checkOneOf(agent.getSessionScope(), SESSION_SCOPES, path + ".sessionScope", issues);
        }
        if (defaults > 1) {
            warnings.add(new ValidationIssue("agents.list",
                    "More than one agent flagged defaultAgent; the first one wins", Severity.WARNING));
        }
    }

    // =========================================================================
    // Session validation
    // =========================================================================

    private static void validateSession(UltronConfig config,
            List<ValidationIssue> issues, List<ValidationIssue> warnings) {
        var session = config.getSession();
        if (session == null)
            return;

        checkOneOf(session.getScope(), SESSION_SCOPES, "session.scope", issues);
        if (session.getMainKey() != null && session.getMainKey().contains(":")) {
            issues.add(new ValidationIssue("session.mainKey",
                    "mainKey must not contain ':'", Severity.ERROR));
        }
        validateReset(session.getReset(), "session.reset", issues, warnings);
        if (session.getResetByType() != null) {
            validateReset(session.getResetByType().getDm(), "session.resetByType.dm", issues, warnings);
            validateReset(session.getResetByType().getGroup(), "session.resetByType.group", issues, warnings);
            validateReset(session.getResetByType().getThread(), "session.resetByType.thread", issues, warnings);
        }
        if (session.getResetByChannel() != null) {
            for (Map.Entry<String, UltronConfig.SessionResetConfig> e : session.getResetByChannel().entrySet()) {
                validateReset(e.getValue(), "session.resetByChannel." + e.getKey(), issues, warnings);
            }
        }
        var pruning = session.getPruning();
        if (pruning != null) {
            if (pruning.getKeepRecentTurns() != null && pruning.getKeepRecentTurns() < 0) {
                issues.add(new ValidationIssue("session.pruning.keepRecentTurns",
                        "keepRecentTurns must be >= 0", Severity.ERROR));
            }
            if (pruning.getMaxTurns() != null && pruning.getMaxTurns() < 1) {
                issues.add(new ValidationIssue("session.pruning.maxTurns",
                        "maxTurns must be >= 1", Severity.ERROR));
            }
        }
    }

    private static void validateReset(UltronConfig.SessionResetConfig reset, String path,
            List<ValidationIssue> issues, List<ValidationIssue> warnings) {
        if (reset == null)
            return;
        checkOneOf(reset.getMode(), RESET_MODES, path + ".mode", issues);
        if (reset.getAtHour() != null && (reset.getAtHour() < 0 || reset.getAtHour() > 23)) {
            warnings.add(new ValidationIssue(path + ".atHour",
                    "atHour should be 0-23, got " + reset.getAtHour() + " (clamped)", Severity.WARNING));
        }
        if (reset.getIdleMinutes() != null && reset.getIdleMinutes() < 1) {
            warnings.add(new ValidationIssue(path + ".idleMinutes",
                    "idleMinutes should be >= 1, got " + reset.getIdleMinutes(), Severity.WARNING));
        }
    }

    // =========================================================================
    // Inbound / queue validation
    // =========================================================================

    private static void validateInbound(UltronConfig config, List<ValidationIssue> issues) {
        if (config.getMessages() == null || config.getMessages().getInbound() == null)
            return;
        var inbound = config.getMessages().getInbound();
        if (inbound.getDebounceMs() != null && inbound.getDebounceMs() < 0) {
            issues.add(new ValidationIssue("messages.inbound.debounceMs",
                    "debounceMs must be >= 0", Severity.ERROR));
        }
        if (inbound.getByChannel() != null) {
            inbound.getByChannel().forEach((channel, ms) -> {
                if (ms == null || ms < 0) {
                    issues.add(new ValidationIssue("messages.inbound.byChannel." + channel,
                            "debounce window must be >= 0", Severity.ERROR));
                }
            });
        }
        if (inbound.getDedupeTtlMs() != null && inbound.getDedupeTtlMs() <= 0) {
            issues.add(new ValidationIssue("messages.inbound.dedupeTtlMs",
                    "dedupeTtlMs must be > 0", Severity.ERROR));
        }
        if (inbound.getIngestCapacity() != null && inbound.getIngestCapacity() < 1) {
            issues.add(new ValidationIssue("messages.inbound.ingestCapacity",
                    "ingestCapacity must be >= 1", Severity.ERROR));
        }
    }

    private static void validateQueue(UltronConfig config, List<ValidationIssue> issues) {
        var queue = config.getQueue();
        if (queue == null)
            return;
        checkOneOf(queue.getMode(), QUEUE_MODES, "queue.mode", issues);
        checkOneOf(queue.getDrop(), DROP_POLICIES, "queue.drop", issues);
        if (queue.getByChannel() != null) {
            queue.getByChannel().forEach((channel, mode) -> checkOneOf(mode, QUEUE_MODES,
                    "queue.byChannel." + channel, issues));
        }
        if (queue.getCap() != null && queue.getCap() < 1) {
            issues.add(new ValidationIssue("queue.cap", "cap must be >= 1", Severity.ERROR));
        }
        if (queue.getLanes() != null) {
            queue.getLanes().forEach((lane, capacity) -> {
                if (lane.startsWith("session:")) {
                    issues.add(new ValidationIssue("queue.lanes." + lane,
                            "session lanes have a fixed capacity of 1", Severity.ERROR));
                } else if (capacity == null || capacity < 1) {
                    issues.add(new ValidationIssue("queue.lanes." + lane,
                            "lane capacity must be >= 1", Severity.ERROR));
                }
            });
        }
    }

    private static void checkOneOf(String value, Set<String> allowed, String path,
            List<ValidationIssue> issues) {
        if (value == null || value.isBlank())
            return;
        if (!allowed.contains(value.trim().toLowerCase(Locale.ROOT))) {
            issues.add(new ValidationIssue(path,
                    "Unknown value \"" + value + "\"", Severity.ERROR));
        }
    }
}
