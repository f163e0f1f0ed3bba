package com.ultron.common.config;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Agent id normalization and default-agent resolution.
 */
public final class AgentIds {

    private AgentIds() {
    }

    public static final String DEFAULT_AGENT_ID = "default";

    /**
     * Lower-case and trim an agent id; blank ids collapse to
     * {@link #DEFAULT_AGENT_ID}.
     */
    public static String normalizeAgentId(String id) {
        if (id == null)
            return DEFAULT_AGENT_ID;
        String trimmed = id.trim().toLowerCase(Locale.ROOT);
        return trimmed.isEmpty() ? DEFAULT_AGENT_ID : trimmed;
    }

    /**
     * Configured agents in registration order, skipping entries without an id.
     */
    public static List<UltronConfig.AgentEntry> listAgents(UltronConfig cfg) {
        if (cfg == null || cfg.getAgents() == null) {
            return List.of();
        }
        List<UltronConfig.AgentEntry> result = new ArrayList<>();
        for (var entry : cfg.getAgents().getEntries()) {
            if (entry != null && entry.getId() != null && !entry.getId().isBlank()) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * Normalized ids of all configured agents, registration order, no
     * duplicates.
     */
    public static List<String> listAgentIds(UltronConfig cfg) {
        Set<String> ids = new LinkedHashSet<>();
        for (var entry : listAgents(cfg)) {
            ids.add(normalizeAgentId(entry.getId()));
        }
        return new ArrayList<>(ids);
    }

    /**
     * The agent flagged {@code defaultAgent}, else the first registered one.
     */
    public static Optional<String> resolveDefaultAgentId(UltronConfig cfg) {
        List<UltronConfig.AgentEntry> agents = listAgents(cfg);
        if (agents.isEmpty()) {
            return Optional.empty();
        }
        String id = agents.stream()
                .filter(a -> Boolean.TRUE.equals(a.getDefaultAgent()))
                .map(UltronConfig.AgentEntry::getId)
                .findFirst()
                .orElse(agents.get(0).getId());
        return Optional.of(normalizeAgentId(id));
    }

    /**
     * Look up an agent entry by (normalized) id.
     */
    public static Optional<UltronConfig.AgentEntry> findAgent(UltronConfig cfg, String agentId) {
        String id = normalizeAgentId(agentId);
        return listAgents(cfg).stream()
                .filter(a -> id.equals(normalizeAgentId(a.getId())))
                .findFirst();
    }
}
