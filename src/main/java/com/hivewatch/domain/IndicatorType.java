package com.hivewatch.domain;

/**
 * Kind of threat indicator held in the reputation index.
 */
public enum IndicatorType {
    IP,
    CIDR,
    HASH,
    DOMAIN
}
