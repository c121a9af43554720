package com.hivewatch.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Matcher families supported by the correlation engine.
 */
public enum RuleKind {

    COMMAND_PATTERN("command-pattern"),

    IP_MEMBERSHIP("ip-membership"),

    RATE_THRESHOLD("rate-threshold"),

    COMPOSITE("composite"),

    EVENT_MATCH("event-match");

    private final String value;

    RuleKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Rate and composite rules carry state across events and are switched off
     * together when correlation is disabled.
     */
    public boolean isStateful() {
        return this == RATE_THRESHOLD || this == COMPOSITE;
    }

    @JsonCreator
    public static RuleKind fromValue(String value) {
        for (RuleKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown rule kind: " + value);
    }
}
