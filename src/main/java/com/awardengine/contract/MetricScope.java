package com.awardengine.contract;

/**
 * GLOBAL metrics persist across levels and are sourced from progress storage.
 * INSTANCE metrics only describe the current level run and are wiped at level start.
 */
public enum MetricScope {
    GLOBAL,
    INSTANCE
}
