package com.hivewatch.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Alert severity, derived from the session risk score band.
 */
public enum Severity {

    LOW("low"),

    MEDIUM("medium"),

    HIGH("high"),

    CRITICAL("critical");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
