package com.awardengine.contract;

/**
 * The single value field a metric is allowed to use.
 */
public enum MetricKind {
    COUNT,
    TIMER,
    LABEL
}
