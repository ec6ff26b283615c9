package com.awardengine.facts;

import com.awardengine.contract.MetricId;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Flat copy of every key figure, taken when the process is suspended and
 * restored on resume. Serializing it is left to the host.
 */
public record FactSnapshot(
    @JsonProperty("catalog_loaded") boolean catalogLoaded,
    @JsonProperty("slots") List<Slot> slots
) {

    public FactSnapshot {
        slots = slots == null ? List.of() : List.copyOf(slots);
    }

    public record Slot(
        @JsonProperty("metric") MetricId metric,
        @JsonProperty("count") int count,
        @JsonProperty("timer") double timer,
        @JsonProperty("label") String label
    ) {
        public Slot {
            Objects.requireNonNull(metric, "metric is required");
        }
    }
}
