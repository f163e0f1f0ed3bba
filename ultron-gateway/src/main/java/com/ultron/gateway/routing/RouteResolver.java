package com.ultron.gateway.routing;

import com.ultron.common.config.AgentIds;
import com.ultron.common.config.UltronConfig;
import com.ultron.gateway.inbound.InboundMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Resolves which agent handles an inbound message and which session it
 * lands in.
 *
 * <p>
 * Matching priority order: peer → group/team → account → channel → default.
 * Within a tier the first agent in registration order wins. The binding
 * table is rebuilt on every {@link #loadFromConfig} and swapped in as a
 * whole.
 * </p>
 */
@Slf4j
public class RouteResolver {

    public enum MatchTier {
        PEER, GROUP, ACCOUNT, CHANNEL, DEFAULT
    }

    public record ResolvedRoute(
            String agentId,
            String sessionKey,
            MatchTier matchedBy,
            SessionScope scope) {
    }

    /** One agent's bindings, lower-cased. */
    record AgentBinding(
            String agentId,
            SessionScope scope,
            Set<String> peers,
            Set<String> groups,
            Set<String> accounts,
            Set<String> channels) {
    }

    record RoutingTable(
            List<AgentBinding> agents,
            String defaultAgentId,
            SessionScope defaultScope,
            String mainKey) {
    }

    private volatile RoutingTable table = new RoutingTable(List.of(), null, SessionScope.MAIN,
            SessionKeys.DEFAULT_MAIN_KEY);

    public RouteResolver() {
    }

    public RouteResolver(UltronConfig config) {
        loadFromConfig(config);
    }

    /**
     * Rebuild the binding table from config.
     */
    public void loadFromConfig(UltronConfig config) {
        List<AgentBinding> agents = new ArrayList<>();
        SessionScope defaultScope = SessionScope.MAIN;
        String mainKey = SessionKeys.DEFAULT_MAIN_KEY;
        if (config.getSession() != null) {
            defaultScope = SessionScope.parse(config.getSession().getScope());
            mainKey = SessionKeys.normalizeMainKey(config.getSession().getMainKey());
        }

        Set<String> seen = new HashSet<>();
        for (UltronConfig.AgentEntry entry : AgentIds.listAgents(config)) {
            String id = AgentIds.normalizeAgentId(entry.getId());
            if (!seen.add(id)) {
                continue;
            }
            SessionScope scope = entry.getSessionScope() != null && !entry.getSessionScope().isBlank()
                    ? SessionScope.parse(entry.getSessionScope())
                    : defaultScope;
            UltronConfig.AgentBindings b = entry.getBindings();
            agents.add(new AgentBinding(id, scope,
                    lower(b != null ? b.getPeers() : null),
                    lower(b != null ? b.getGroups() : null),
                    lower(b != null ? b.getAccounts() : null),
                    lower(b != null ? b.getChannels() : null)));
        }

        String defaultAgentId = AgentIds.resolveDefaultAgentId(config).orElse(null);
        this.table = new RoutingTable(List.copyOf(agents), defaultAgentId, defaultScope, mainKey);
        log.debug("routing table rebuilt: {} agents, default={}", agents.size(), defaultAgentId);
    }

    /**
     * Resolve the route for a message.
     *
     * @throws NoAgentConfiguredException when no agent is configured
     */
    public ResolvedRoute resolve(InboundMessage message) {
        RoutingTable current = this.table;
        if (current.defaultAgentId() == null) {
            throw new NoAgentConfiguredException(message.provider());
        }

        String provider = norm(message.provider());
        String peer = norm(message.peerId());
        String account = norm(message.accountId());
        String group = norm(message.groupId());

        AgentBinding match = null;
        MatchTier tier = MatchTier.DEFAULT;

        if (!peer.isEmpty()) {
            match = firstMatch(current, b -> matches(b.peers(), provider, peer));
            tier = MatchTier.PEER;
        }
        if (match == null && message.chatType().isGroupLike()) {
            match = firstMatch(current, b -> (!group.isEmpty() && matches(b.groups(), provider, group))
                    || (!peer.isEmpty() && matches(b.groups(), provider, peer)));
            tier = MatchTier.GROUP;
        }
        if (match == null && !account.isEmpty()) {
            match = firstMatch(current, b -> matches(b.accounts(), provider, account));
            tier = MatchTier.ACCOUNT;
        }
        if (match == null && !provider.isEmpty()) {
            match = firstMatch(current, b -> b.channels().contains(provider));
            tier = MatchTier.CHANNEL;
        }
        if (match == null) {
            match = current.agents().stream()
                    .filter(b -> b.agentId().equals(current.defaultAgentId()))
                    .findFirst()
                    .orElseThrow(() -> new NoAgentConfiguredException(message.provider()));
            tier = MatchTier.DEFAULT;
        }

        String sessionKey = SessionKeys.buildAgentSessionKey(new SessionKeys.KeyInput(
                match.agentId(),
                match.scope(),
                current.mainKey(),
                message.provider(),
                message.accountId(),
                message.peerId(),
                message.chatType(),
                message.groupId(),
                message.threadId()));
        return new ResolvedRoute(match.agentId(), sessionKey, tier, match.scope());
    }

    /** Default agent id, if any agent is configured. */
    public String getDefaultAgentId() {
        return table.defaultAgentId();
    }

    /** Bare id or {@code provider:id}. */
    private static boolean matches(Set<String> entries, String provider, String id) {
        return entries.contains(id) || entries.contains(provider + ":" + id);
    }

    private static AgentBinding firstMatch(RoutingTable table, Predicate<AgentBinding> test) {
        for (AgentBinding binding : table.agents()) {
            if (test.test(binding)) {
                return binding;
            }
        }
        return null;
    }

    private static Set<String> lower(List<String> values) {
        if (values == null) {
            return Set.of();
        }
        Set<String> result = new HashSet<>();
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                result.add(v.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Set.copyOf(result);
    }

    private static String norm(String value) {
        return value != null ? value.trim().toLowerCase(Locale.ROOT) : "";
    }
}
