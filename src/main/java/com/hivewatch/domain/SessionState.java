package com.hivewatch.domain;

/**
 * Lifecycle of a reconstructed session.
 *
 * OPEN and IDLE move freely between each other as events arrive or stop
 * arriving; CLOSED is reached on disconnect or idle timeout.
 */
public enum SessionState {
    OPEN,
    IDLE,
    CLOSED
}
