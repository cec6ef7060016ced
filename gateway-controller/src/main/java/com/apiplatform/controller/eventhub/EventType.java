package com.apiplatform.controller.eventhub;

/**
 * Kind of resource an event refers to.
 * Persisted by {@link #getValue()}; values not known to this build map to {@link #UNKNOWN}.
 */
public enum EventType {

    API("API"),
    POLICY("POLICY"),
    CERTIFICATE("CERTIFICATE"),
    LLM_TEMPLATE("LLM_TEMPLATE"),
    LLM_PROVIDER("LLM_PROVIDER"),
    LLM_PROXY("LLM_PROXY"),
    MCP_PROXY("MCP_PROXY"),
    UNKNOWN("UNKNOWN");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static EventType fromValue(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
