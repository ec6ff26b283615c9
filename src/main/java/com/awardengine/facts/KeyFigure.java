package com.awardengine.facts;

import com.awardengine.contract.MetricId;
import com.awardengine.contract.MetricKind;
import com.awardengine.contract.MetricScope;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Debug listing entry: one metric and the rendering of its current value.
 */
public record KeyFigure(
    @JsonProperty("metric") MetricId metric,
    @JsonProperty("kind") MetricKind kind,
    @JsonProperty("scope") MetricScope scope,
    @JsonProperty("value") String value
) {}
