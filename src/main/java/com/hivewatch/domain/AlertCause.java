package com.hivewatch.domain;

/**
 * What produced an alert. Rule matches carry rule ids; synthetic causes do not.
 */
public enum AlertCause {

    /** One or more rules matched and raised the session score over the gate. */
    RULE_MATCH,

    /** Summary emitted when a session above the gate closes. */
    SESSION_CLOSED
}
