package com.ultron.gateway.routing;

import com.ultron.common.config.AgentIds;
import com.ultron.gateway.inbound.ChatType;

import java.util.Locale;
import java.util.Optional;

/**
 * Session key derivation. Every function here is pure: the same inputs give
 * byte-identical keys across calls and restarts.
 *
 * <pre>
 *   agent:{agentId}:{scopeKey}
 *   cron:{jobId}
 *   hook:{hookId}
 * </pre>
 */
public final class SessionKeys {

    private SessionKeys() {
    }

    public static final String AGENT_PREFIX = "agent:";
    public static final String CRON_PREFIX = "cron:";
    public static final String HOOK_PREFIX = "hook:";
    public static final String DEFAULT_MAIN_KEY = "main";
    public static final String DEFAULT_ACCOUNT_ID = "default";

    /**
     * Inputs to session key derivation.
     */
    public record KeyInput(
            String agentId,
            SessionScope scope,
            String mainKey,
            String provider,
            String accountId,
            String peerId,
            ChatType chatType,
            String groupId,
            String threadId) {
    }

    /**
     * Build the full session key for a conversational message.
     */
    public static String buildAgentSessionKey(KeyInput input) {
        return AGENT_PREFIX + AgentIds.normalizeAgentId(input.agentId()) + ":" + buildScopeKey(input);
    }

    /**
     * Scope part of the key. Group, channel and thread chats ignore the DM
     * scope mode.
     */
    public static String buildScopeKey(KeyInput input) {
        String channel = normalizeToken(input.provider());
        ChatType chatType = input.chatType() != null ? input.chatType() : ChatType.DM;
        String conversation = firstNonEmpty(normalizeToken(input.peerId()), normalizeToken(input.groupId()));

        switch (chatType) {
            case GROUP:
                return channel + ":group:" + conversation;
            case CHANNEL:
                return channel + ":channel:" + conversation;
            case THREAD: {
                String thread = normalizeToken(input.threadId());
                if (conversation.isEmpty()) {
                    return channel + ":thread:" + thread;
                }
                return channel + ":group:" + conversation + ":thread:" + thread;
            }
            default:
                break;
        }

        String peer = normalizeToken(input.peerId());
        SessionScope scope = input.scope() != null ? input.scope() : SessionScope.MAIN;
        return switch (scope) {
            case MAIN -> normalizeMainKey(input.mainKey());
            case PER_PEER -> "dm:" + peer;
            case PER_CHANNEL_PEER -> channel + ":dm:" + peer;
            case PER_ACCOUNT_CHANNEL_PEER -> {
                String account = normalizeToken(input.accountId());
                yield channel + ":" + (account.isEmpty() ? DEFAULT_ACCOUNT_ID : account) + ":dm:" + peer;
            }
        };
    }

    public static String cronKey(String jobId) {
        return CRON_PREFIX + normalizeToken(jobId);
    }

    public static String hookKey(String hookId) {
        return HOOK_PREFIX + normalizeToken(hookId);
    }

    /**
     * Agent id embedded in an {@code agent:} key.
     */
    public static Optional<String> parseAgentId(String sessionKey) {
        if (sessionKey == null || !sessionKey.startsWith(AGENT_PREFIX)) {
            return Optional.empty();
        }
        String rest = sessionKey.substring(AGENT_PREFIX.length());
        int colon = rest.indexOf(':');
        if (colon <= 0) {
            return Optional.empty();
        }
        return Optional.of(rest.substring(0, colon));
    }

    public static boolean isAgentKey(String sessionKey) {
        return parseAgentId(sessionKey).isPresent();
    }

    public static String normalizeMainKey(String mainKey) {
        String token = normalizeToken(mainKey);
        return token.isEmpty() ? DEFAULT_MAIN_KEY : token;
    }

    public static String normalizeToken(String value) {
        return value != null ? value.trim().toLowerCase(Locale.ROOT) : "";
    }

    private static String firstNonEmpty(String a, String b) {
        return !a.isEmpty() ? a : b;
    }
}
