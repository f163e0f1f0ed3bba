package com.ultron.gateway.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TurnRole {
    USER("user"),
    ASSISTANT("assistant"),
    TOOL_RESULT("tool_result");

    private final String wireName;

    TurnRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static TurnRole fromWire(String value) {
        for (TurnRole role : values()) {
            if (role.wireName.equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("unknown turn role: " + value);
    }

    /** User and assistant turns; tool results are not conversational. */
    public boolean isConversational() {
        return this != TOOL_RESULT;
    }
}
