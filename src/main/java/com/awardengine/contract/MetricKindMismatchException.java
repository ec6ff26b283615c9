package com.awardengine.contract;

/**
 * Thrown when a metric is read or written through an operation meant for
 * another kind, e.g. adding a delta to a label metric. Always a programming error.
 */
public class MetricKindMismatchException extends RuntimeException {

    private final MetricId metric;
    private final MetricKind requested;

    public MetricKindMismatchException(MetricId metric, MetricKind requested) {
        super("metric " + metric.getValue() + " is " + metric.kind()
            + " but was used as " + requested);
        this.metric = metric;
        this.requested = requested;
    }

    public MetricId getMetric() {
        return metric;
    }

    public MetricKind getRequested() {
        return requested;
    }
}
