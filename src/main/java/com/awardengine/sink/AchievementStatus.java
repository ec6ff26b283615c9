package com.awardengine.sink;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * An achievement as displayed to the player: its description plus whether
 * and when it was earned.
 */
public record AchievementStatus(
    @JsonProperty("key") String key,
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("how_to_earn") String howToEarn,
    @JsonProperty("gamer_score") int gamerScore,
    @JsonProperty("earned") boolean earned,
    @JsonProperty("earned_at") Instant earnedAt
) {

    static AchievementStatus of(AchievementDescriptor descriptor, Instant earnedAt) {
        return new AchievementStatus(
            descriptor.key(),
            descriptor.name(),
            descriptor.description(),
            descriptor.howToEarn(),
            descriptor.gamerScore(),
            earnedAt != null,
            earnedAt
        );
    }
}
