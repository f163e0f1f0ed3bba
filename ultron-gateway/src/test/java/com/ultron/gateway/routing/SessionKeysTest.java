package com.ultron.gateway.routing;

import com.ultron.gateway.inbound.ChatType;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class SessionKeysTest {

    private static SessionKeys.KeyInput dm(SessionScope scope, String provider, String account, String peer) {
        return new SessionKeys.KeyInput("main", scope, null, provider, account, peer, ChatType.DM, null, null);
    }

    @Nested
    class DirectMessages {
        @ParameterizedTest
        @CsvSource({
                "MAIN, agent:main:main",
                "PER_PEER, agent:main:dm:alice",
                "PER_CHANNEL_PEER, agent:main:telegram:dm:alice",
                "PER_ACCOUNT_CHANNEL_PEER, agent:main:telegram:bot1:dm:alice"
        })
        void scopeShapes(SessionScope scope, String expected) {
            assertEquals(expected, SessionKeys.buildAgentSessionKey(dm(scope, "Telegram", "Bot1", "Alice")));
        }

        @Test
        void sameInputs_giveIdenticalKeys() {
            var input = dm(SessionScope.PER_CHANNEL_PEER, "slack", "a", "u1");
            assertEquals(SessionKeys.buildAgentSessionKey(input), SessionKeys.buildAgentSessionKey(input));
        }

        @Test
        void missingAccount_usesDefault() {
            assertEquals("agent:main:slack:default:dm:u1",
                    SessionKeys.buildAgentSessionKey(dm(SessionScope.PER_ACCOUNT_CHANNEL_PEER, "slack", null, "u1")));
        }

        @Test
        void customMainKey_isNormalized() {
            var input = new SessionKeys.KeyInput("Ops", SessionScope.MAIN, " Home ", "slack", null, "u1",
                    ChatType.DM, null, null);
            assertEquals("agent:ops:home", SessionKeys.buildAgentSessionKey(input));
        }
    }

    @Nested
    class GroupLike {
        @Test
        void group_ignoresDmScope() {
            var input = new SessionKeys.KeyInput("main", SessionScope.MAIN, null, "discord", null, "G1",
                    ChatType.GROUP, "guild", null);
            assertEquals("agent:main:discord:group:g1", SessionKeys.buildAgentSessionKey(input));
        }

        @Test
        void channel_shape() {
            var input = new SessionKeys.KeyInput("main", SessionScope.PER_PEER, null, "slack", null, "C1",
                    ChatType.CHANNEL, null, null);
            assertEquals("agent:main:slack:channel:c1", SessionKeys.buildAgentSessionKey(input));
        }

        @Test
        void thread_nestsUnderConversation() {
            var input = new SessionKeys.KeyInput("main", SessionScope.MAIN, null, "slack", null, "C1",
                    ChatType.THREAD, null, "T1");
            assertEquals("agent:main:slack:group:c1:thread:t1", SessionKeys.buildAgentSessionKey(input));
        }
    }

    @Test
    void keys_ignoreDefaultLocale() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            var input = new SessionKeys.KeyInput("MAIN", SessionScope.PER_CHANNEL_PEER, null, "DISCORD", null,
                    "USERID", ChatType.DM, null, null);
            assertEquals("agent:main:discord:dm:userid", SessionKeys.buildAgentSessionKey(input));
            assertEquals("cron:digit", SessionKeys.cronKey("DIGIT"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void cronAndHookKeys() {
        assertEquals("cron:nightly", SessionKeys.cronKey(" Nightly "));
        assertEquals("hook:gmail", SessionKeys.hookKey("gmail"));
    }

    @Test
    void parseAgentId() {
        assertEquals("ops", SessionKeys.parseAgentId("agent:ops:dm:u1").orElseThrow());
        assertTrue(SessionKeys.parseAgentId("cron:nightly").isEmpty());
        assertFalse(SessionKeys.isAgentKey("agent:"));
    }
}
