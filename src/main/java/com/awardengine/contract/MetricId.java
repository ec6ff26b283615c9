package com.awardengine.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Closed set of gameplay key figures tracked for award detection.
 * Each metric is bound to exactly one {@link MetricKind}.
 */
public enum MetricId {
    /** Total wipeouts received across all levels. */
    WIPEOUTS_COUNT("WipeoutsCount", MetricKind.COUNT, MetricScope.GLOBAL),
    /** Total levels completed across all levels. */
    LEVELS_COMPLETED_COUNT("LevelsCompletedCount", MetricKind.COUNT, MetricScope.GLOBAL),
    /** Name of the level just successfully completed. */
    LEVEL_COMPLETED_NAME("LevelCompletedName", MetricKind.LABEL, MetricScope.INSTANCE),
    /** Name of the level currently being played, completed or not. */
    LEVEL_PLAYING_NAME("LevelPlayingName", MetricKind.LABEL, MetricScope.INSTANCE),
    /** Seconds it took to complete the level. */
    LEVEL_COMPLETED_TIMER("LevelCompletedTimer", MetricKind.TIMER, MetricScope.INSTANCE),
    RED_GERBILS_POPPED_COUNT("RedGerbilsPoppedCount", MetricKind.COUNT, MetricScope.INSTANCE),
    RED_GERBILS_DISINTEGRATED_COUNT("RedGerbilsDisintegratedCount", MetricKind.COUNT, MetricScope.INSTANCE),
    /**
     * Top speed of any one gerbil, in world units per second. Stored as a count.
     * A gerbil launched by a bomb from high up reaches about 2000.
     */
    FLYING_MAX_SPEED_FOR_SINGLE_GERBIL_COUNT("FlyingMaxSpeedForSingleGerbilCount", MetricKind.COUNT, MetricScope.INSTANCE),
    /** Longest flight of any one gerbil, in seconds. */
    FLYING_MAX_TIME_FOR_SINGLE_GERBIL_TIMER("FlyingMaxTimeForSingleGerbilTimer", MetricKind.TIMER, MetricScope.INSTANCE),
    PENGUINS_EXPLODED_COUNT("PenguinsExplodedCount", MetricKind.COUNT, MetricScope.INSTANCE),
    /** Gold chests earned across all levels. */
    GOLD_CHESTS_COUNT("GoldChestsCount", MetricKind.COUNT, MetricScope.GLOBAL),
    WEAPONS_USED_COUNT("WeaponsUsedCount", MetricKind.COUNT, MetricScope.INSTANCE),
    WEAPONS_USED_BOMB_COUNT("WeaponsUsedBombCount", MetricKind.COUNT, MetricScope.INSTANCE),
    WEAPONS_USED_DISINTEGRATOR_COUNT("WeaponsUsedDisintegratorCount", MetricKind.COUNT, MetricScope.INSTANCE),
    WEAPONS_USED_EXPLODER_COUNT("WeaponsUsedExploderCount", MetricKind.COUNT, MetricScope.INSTANCE),
    /** Pickups collected in total, across all gerbils. */
    PICKUPS_COLLECTED_COUNT("PickupsCollectedCount", MetricKind.COUNT, MetricScope.INSTANCE),
    /** Most pickups collected by any one gerbil. */
    PICKUPS_MAX_FOR_SINGLE_GERBIL_COUNT("PickupsMaxForSingleGerbilCount", MetricKind.COUNT, MetricScope.INSTANCE),
    /** Most rotations made by any one gerbil. */
    ROTATIONS_MAX_FOR_SINGLE_GERBIL_COUNT("RotationsMaxForSingleGerbilCount", MetricKind.COUNT, MetricScope.INSTANCE),
    /** Total score earned across all levels. */
    TOTAL_SCORE_COUNT("TotalScoreCount", MetricKind.COUNT, MetricScope.GLOBAL);

    private final String value;
    private final MetricKind kind;
    private final MetricScope scope;

    MetricId(String value, MetricKind kind, MetricScope scope) {
        this.value = value;
        this.kind = kind;
        this.scope = scope;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public MetricKind kind() {
        return kind;
    }

    public MetricScope scope() {
        return scope;
    }

    /**
     * Fails with {@link MetricKindMismatchException} unless this metric is of the given kind.
     */
    public void requireKind(MetricKind expected) {
        if (kind != expected) {
            throw new MetricKindMismatchException(this, expected);
        }
    }

    @JsonCreator
    public static MetricId fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw) || v.name().equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown metric: " + raw));
    }
}
