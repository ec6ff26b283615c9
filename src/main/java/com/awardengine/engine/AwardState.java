package com.awardengine.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Evaluation view of one catalog entry at a point in time.
 */
public record AwardState(
    @JsonProperty("achievement_key") String achievementKey,
    @JsonProperty("condition") String condition,
    @JsonProperty("satisfied") boolean satisfied,
    @JsonProperty("awarded_this_session") boolean awardedThisSession
) {}
