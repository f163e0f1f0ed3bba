package com.ultron.common.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Root configuration type for the Ultron gateway.
 * Loaded from {@code ultron.json} by {@link ConfigService}.
 */
@Data
public class UltronConfig {

    /** Agent definitions and their routing bindings. */
    private AgentsConfig agents;

    /** Session scoping, reset and pruning settings. */
    private SessionConfig session;

    /** Inbound message handling and error replies. */
    private MessagesConfig messages;

    /** Lane queue behaviour. */
    private QueueConfig queue;

    /** Gateway process settings. */
    private GatewayConfig gateway;

    /** Logging settings. */
    private LoggingConfig logging;

    // --- Nested config types ---

    @Data
    public static class AgentsConfig {
        private List<AgentEntry> list;

        /** Convenience: returns list or empty. */
        @JsonIgnore
        public List<AgentEntry> getEntries() {
            return list != null ? list : List.of();
        }
    }

    @Data
    public static class AgentEntry {
        private String id;
        private String name;
        /** Marks the fallback agent; the first registered agent otherwise. */
        @JsonAlias("default")
        private Boolean defaultAgent;
        /** main | per-peer | per-channel-peer | per-account-channel-peer */
        private String sessionScope;
        private AgentBindings bindings;
    }

    /**
     * Routing rules for one agent. Tiers are checked peer, group, account,
     * channel across all agents.
     */
    @Data
    public static class AgentBindings {
        /** Peer ids, bare or {@code provider:peerId}. */
        private List<String> peers;
        /** Guild/team/group ids, bare or {@code provider:groupId}. */
        private List<String> groups;
        /** Account ids, bare or {@code provider:accountId}. */
        private List<String> accounts;
        /** Provider names. */
        private List<String> channels;
    }

    @Data
    public static class SessionConfig {
        /** main | per-peer | per-channel-peer | per-account-channel-peer */
        private String scope;
        /** Main session key token. */
        private String mainKey;
        private SessionResetConfig reset;
        private SessionResetByTypeConfig resetByType;
        private Map<String, SessionResetConfig> resetByChannel;
        private PruningConfig pruning;
        /** Session store directory override; may contain {agentId}. */
        private String store;
    }

    @Data
    public static class SessionResetConfig {
        /** daily | idle */
        private String mode;
        private Integer atHour;
        private Integer idleMinutes;
    }

    @Data
    public static class SessionResetByTypeConfig {
        private SessionResetConfig dm;
        private SessionResetConfig group;
        private SessionResetConfig thread;
    }

    @Data
    public static class PruningConfig {
        /** Most recent user/assistant turns kept intact. */
        private Integer keepRecentTurns;
        /** Upper bound on turns handed to the agent. */
        private Integer maxTurns;
    }

    @Data
    public static class MessagesConfig {
        private InboundConfig inbound;
        /** Send an apology to the sender when a run fails (default true). */
        private Boolean errorReplies;
        private String errorReplyText;
    }

    @Data
    public static class InboundConfig {
        private Long dedupeTtlMs;
        private Integer dedupeMaxEntries;
        /** Global debounce window; 0 disables debouncing. */
        private Long debounceMs;
        /** Per-provider debounce windows. */
        private Map<String, Long> byChannel;
        private Integer ingestCapacity;
    }

    @Data
    public static class QueueConfig {
        /** collect | followup | steer | interrupt */
        private String mode;
        /** Per-provider queue mode overrides. */
        private Map<String, String> byChannel;
        /** Max pending units per session lane. */
        private Integer cap;
        /** drop-old | drop-new | summarize */
        private String drop;
        /** Global lane name to capacity. */
        private Map<String, Integer> lanes;
    }

    @Data
    public static class GatewayConfig {
        /** State directory override (sessions, archives). */
        private String stateDir;
        /** Worker threads running agent dispatches. */
        private Integer workerThreads;
        /** Milliseconds to wait for lanes to drain on shutdown. */
        private Long shutdownDrainMs;
    }

    @Data
    public static class LoggingConfig {
        private String level = "info";
    }
}
