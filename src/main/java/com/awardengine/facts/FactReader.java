package com.awardengine.facts;

import com.awardengine.contract.MetricId;

/**
 * Read-only view of the key figures. This is all an award condition gets to see.
 * Every accessor fails with {@link com.awardengine.contract.MetricKindMismatchException}
 * when the metric is of a different kind.
 */
public interface FactReader {

    int count(MetricId id);

    double timer(MetricId id);

    /** The label, or null when none has been set. */
    String label(MetricId id);
}
