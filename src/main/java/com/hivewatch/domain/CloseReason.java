package com.hivewatch.domain;

/**
 * Why a session reached {@link SessionState#CLOSED}.
 */
public enum CloseReason {
    DISCONNECT,
    IDLE_TIMEOUT
}
