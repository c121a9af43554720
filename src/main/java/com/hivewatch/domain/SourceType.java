package com.hivewatch.domain;

/**
 * Physical shape of a configured log source.
 */
public enum SourceType {

    /** Line-delimited JSON event log, possibly rotated. */
    JSON_LOG,

    /** Plain-text audit log, possibly rotated. */
    TEXT_LOG,

    /** Directory of TTY session captures. */
    TTY_CAPTURE,

    /** Directory the honeypot drops downloaded artifacts into. */
    DOWNLOAD_DIR
}
