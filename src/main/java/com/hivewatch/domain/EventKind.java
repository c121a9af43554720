package com.hivewatch.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Canonical kinds of honeypot occurrences.
 * Records whose source kind is not recognized are kept as {@link #UNCLASSIFIED}
 * so rules can still match on their raw payload.
 */
public enum EventKind {

    CONNECT("connect"),

    LOGIN_ATTEMPT("login_attempt"),

    LOGIN_SUCCESS("login_success"),

    LOGIN_FAILED("login_failed"),

    KEY_AUTH("key_auth"),

    COMMAND("command"),

    FILE_DOWNLOAD("file_download"),

    FILE_UPLOAD("file_upload"),

    TCP_FORWARD("tcp_forward"),

    TTY_OPEN("tty_open"),

    TTY_DATA("tty_data"),

    TTY_CLOSE("tty_close"),

    DISCONNECT("disconnect"),

    /**
     * Source kind not mapped; the original kind is preserved in the payload
     * under {@code raw_kind}.
     */
    UNCLASSIFIED("unclassified");

    private final String value;

    EventKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * True for the three login outcomes.
     */
    public boolean isLogin() {
        return this == LOGIN_ATTEMPT || this == LOGIN_SUCCESS || this == LOGIN_FAILED;
    }

    /**
     * Parse a string value to EventKind
     */
    public static EventKind fromValue(String value) {
        for (EventKind kind : EventKind.values()) {
            if (kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown EventKind value: " + value);
    }
}
