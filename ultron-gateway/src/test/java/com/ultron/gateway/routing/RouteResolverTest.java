package com.ultron.gateway.routing;

import com.ultron.common.config.UltronConfig;
import com.ultron.gateway.inbound.ChatType;
import com.ultron.gateway.inbound.InboundMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RouteResolverTest {

    private static UltronConfig.AgentEntry agent(String id, UltronConfig.AgentBindings bindings) {
        var entry = new UltronConfig.AgentEntry();
        entry.setId(id);
        entry.setBindings(bindings);
        return entry;
    }

    private static UltronConfig config(UltronConfig.AgentEntry... agents) {
        var cfg = new UltronConfig();
        var list = new UltronConfig.AgentsConfig();
        list.setList(List.of(agents));
        cfg.setAgents(list);
        var session = new UltronConfig.SessionConfig();
        session.setScope("per-peer");
        cfg.setSession(session);
        return cfg;
    }

    private static InboundMessage.InboundMessageBuilder msg() {
        return InboundMessage.builder().provider("telegram").accountId("bot1").peerId("alice").senderId("alice");
    }

    @Nested
    class Priority {
        private RouteResolver resolver;

        @BeforeEach
        void setUp() {
            var channelBound = new UltronConfig.AgentBindings();
            channelBound.setChannels(List.of("telegram"));
            var accountBound = new UltronConfig.AgentBindings();
            accountBound.setAccounts(List.of("telegram:bot1"));
            var peerBound = new UltronConfig.AgentBindings();
            peerBound.setPeers(List.of("Alice"));
            var groupBound = new UltronConfig.AgentBindings();
            groupBound.setGroups(List.of("team-x"));

            resolver = new RouteResolver(config(
                    agent("main", null),
                    agent("by-channel", channelBound),
                    agent("by-account", accountBound),
                    agent("by-peer", peerBound),
                    agent("by-group", groupBound)));
        }

        @Test
        void peerBeatsAccountAndChannel() {
            var route = resolver.resolve(msg().build());
            assertEquals("by-peer", route.agentId());
            assertEquals(RouteResolver.MatchTier.PEER, route.matchedBy());
            assertEquals("agent:by-peer:dm:alice", route.sessionKey());
        }

        @Test
        void groupBeatsAccount() {
            var route = resolver.resolve(msg().peerId("room").chatType(ChatType.GROUP).groupId("team-x").build());
            assertEquals("by-group", route.agentId());
            assertEquals("agent:by-group:telegram:group:room", route.sessionKey());
        }

        @Test
        void accountBeatsChannel() {
            var route = resolver.resolve(msg().peerId("bob").build());
            assertEquals("by-account", route.agentId());
            assertEquals(RouteResolver.MatchTier.ACCOUNT, route.matchedBy());
        }

        @Test
        void channelMatch() {
            var route = resolver.resolve(msg().peerId("bob").accountId("bot2").build());
            assertEquals("by-channel", route.agentId());
        }

        @Test
        void noBindingMatches_usesDefault() {
            var route = resolver.resolve(msg().provider("slack").peerId("bob").accountId(null).build());
            assertEquals("main", route.agentId());
            assertEquals(RouteResolver.MatchTier.DEFAULT, route.matchedBy());
        }
    }

    @Test
    void explicitDefaultFlag_wins() {
        var ops = agent("ops", null);
        ops.setDefaultAgent(true);
        var resolver = new RouteResolver(config(agent("main", null), ops));
        assertEquals("ops", resolver.getDefaultAgentId());
        assertEquals("ops", resolver.resolve(msg().build()).agentId());
    }

    @Test
    void agentScopeOverride() {
        var entry = agent("main", null);
        entry.setSessionScope("per-channel-peer");
        var resolver = new RouteResolver(config(entry));
        assertEquals("agent:main:telegram:dm:alice", resolver.resolve(msg().build()).sessionKey());
    }

    @Test
    void noAgents_throws() {
        var resolver = new RouteResolver(new UltronConfig());
        assertThrows(NoAgentConfiguredException.class, () -> resolver.resolve(msg().build()));
    }

    @Test
    void reload_swapsTable() {
        var resolver = new RouteResolver(config(agent("main", null)));
        resolver.loadFromConfig(config(agent("other", null)));
        assertEquals("other", resolver.resolve(msg().build()).agentId());
    }
}
