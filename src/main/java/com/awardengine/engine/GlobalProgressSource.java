package com.awardengine.engine;

import com.awardengine.contract.MetricId;

import java.util.Map;

/**
 * Progress storage that owns GLOBAL key figures (total wipeouts, levels
 * completed, gold chests, total score). The heartbeat pulls current totals
 * from every registered source before evaluating awards.
 */
public interface GlobalProgressSource {

    /** Current totals, keyed by GLOBAL count metrics. */
    Map<MetricId, Integer> globalTotals();
}
