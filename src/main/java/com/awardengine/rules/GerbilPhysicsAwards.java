package com.awardengine.rules;

import com.awardengine.contract.AchievementKeys;
import com.awardengine.contract.LevelNames;

import java.util.List;

import static com.awardengine.contract.MetricId.GOLD_CHESTS_COUNT;
import static com.awardengine.contract.MetricId.LEVELS_COMPLETED_COUNT;
import static com.awardengine.contract.MetricId.LEVEL_COMPLETED_NAME;
import static com.awardengine.contract.MetricId.LEVEL_COMPLETED_TIMER;
import static com.awardengine.contract.MetricId.LEVEL_PLAYING_NAME;
import static com.awardengine.contract.MetricId.PENGUINS_EXPLODED_COUNT;
import static com.awardengine.contract.MetricId.PICKUPS_COLLECTED_COUNT;
import static com.awardengine.contract.MetricId.PICKUPS_MAX_FOR_SINGLE_GERBIL_COUNT;
import static com.awardengine.contract.MetricId.RED_GERBILS_DISINTEGRATED_COUNT;
import static com.awardengine.contract.MetricId.ROTATIONS_MAX_FOR_SINGLE_GERBIL_COUNT;
import static com.awardengine.contract.MetricId.TOTAL_SCORE_COUNT;
import static com.awardengine.contract.MetricId.WEAPONS_USED_BOMB_COUNT;
import static com.awardengine.contract.MetricId.WEAPONS_USED_COUNT;
import static com.awardengine.contract.MetricId.WEAPONS_USED_DISINTEGRATOR_COUNT;
import static com.awardengine.contract.MetricId.WEAPONS_USED_EXPLODER_COUNT;
import static com.awardengine.contract.MetricId.WIPEOUTS_COUNT;
import static com.awardengine.rules.AwardCondition.allOf;
import static com.awardengine.rules.AwardCondition.countAtLeast;
import static com.awardengine.rules.AwardCondition.countEquals;
import static com.awardengine.rules.AwardCondition.labelEquals;
import static com.awardengine.rules.AwardCondition.timerBelow;

/**
 * The Gerbil Physics award catalog, in evaluation order.
 */
public final class GerbilPhysicsAwards {

    private GerbilPhysicsAwards() {
    }

    public static List<AwardDefinition> definitions() {
        return List.of(
            // Wipeouts, across all levels
            AwardDefinition.of(AchievementKeys.WIPEOUT_PROGRESS_00, countAtLeast(WIPEOUTS_COUNT, 1)),
            AwardDefinition.of(AchievementKeys.WIPEOUT_PROGRESS_01, countAtLeast(WIPEOUTS_COUNT, 8)),
            AwardDefinition.of(AchievementKeys.WIPEOUT_PROGRESS_02, countAtLeast(WIPEOUTS_COUNT, 16)),

            // Levels completed
            AwardDefinition.of(AchievementKeys.GAME_PROGRESS_01, countAtLeast(LEVELS_COMPLETED_COUNT, 36)),
            AwardDefinition.of(AchievementKeys.GAME_PROGRESS_02, countAtLeast(LEVELS_COMPLETED_COUNT, 72)),

            // Zap a red alarm gerbil
            AwardDefinition.of(AchievementKeys.DISINTEGRATION_MAD,
                countAtLeast(RED_GERBILS_DISINTEGRATED_COUNT, 1)),

            // Complete Spooky using only one exploder
            AwardDefinition.of(AchievementKeys.ONE_HIT_WONDER_EXPLODER, allOf(
                labelEquals(LEVEL_COMPLETED_NAME, LevelNames.SPOOKY),
                countEquals(WEAPONS_USED_EXPLODER_COUNT, 1))),

            // Complete Be Decisive using only one disintegrator
            AwardDefinition.of(AchievementKeys.ONE_HIT_WONDER_DISINTEGRATOR, allOf(
                labelEquals(LEVEL_COMPLETED_NAME, LevelNames.BE_DECISIVE),
                countEquals(WEAPONS_USED_DISINTEGRATOR_COUNT, 1))),

            // Complete Bad Neighbors without detonating a penguin
            AwardDefinition.of(AchievementKeys.PENGUIN_LOVER, allOf(
                countEquals(PENGUINS_EXPLODED_COUNT, 0),
                labelEquals(LEVEL_COMPLETED_NAME, LevelNames.BAD_NEIGHBORS))),

            // Gold chests
            AwardDefinition.of(AchievementKeys.GOLD_PROGRESS_00, countAtLeast(GOLD_CHESTS_COUNT, 1)),
            AwardDefinition.of(AchievementKeys.GOLD_PROGRESS_01, countAtLeast(GOLD_CHESTS_COUNT, 36)),
            AwardDefinition.of(AchievementKeys.GOLD_PROGRESS_02, countAtLeast(GOLD_CHESTS_COUNT, 72)),

            // Two Seasons in under 32 seconds
            AwardDefinition.of(AchievementKeys.SPEED_FREAK_01, allOf(
                timerBelow(LEVEL_COMPLETED_TIMER, 32.0),
                labelEquals(LEVEL_COMPLETED_NAME, LevelNames.TWO_SEASONS))),

            // All pickups on Sink with one gerbil and one bomb
            AwardDefinition.of(AchievementKeys.EINSTEIN, allOf(
                labelEquals(LEVEL_COMPLETED_NAME, LevelNames.SINK),
                countEquals(WEAPONS_USED_COUNT, 1),
                countAtLeast(PICKUPS_MAX_FOR_SINGLE_GERBIL_COUNT, 7))),

            // One gerbil rotating 12 times on Newton's Gerbil, awarded mid-level
            AwardDefinition.of(AchievementKeys.SPIN_CYCLE, allOf(
                countAtLeast(ROTATIONS_MAX_FOR_SINGLE_GERBIL_COUNT, 12),
                labelEquals(LEVEL_PLAYING_NAME, LevelNames.NEWTONS_GERBIL))),

            AwardDefinition.of(AchievementKeys.BOMB_PARTY, countAtLeast(WEAPONS_USED_BOMB_COUNT, 10)),

            AwardDefinition.of(AchievementKeys.FIRST_PICKUP, countAtLeast(PICKUPS_COLLECTED_COUNT, 1)),

            // Got past the first level with alarm gerbils
            AwardDefinition.of(AchievementKeys.FIRST_ALARM_GERBILS,
                labelEquals(LEVEL_COMPLETED_NAME, LevelNames.COLLATERAL)),

            // Total score
            AwardDefinition.of(AchievementKeys.SCORE_PROGRESS_00, countAtLeast(TOTAL_SCORE_COUNT, 20000)),
            AwardDefinition.of(AchievementKeys.SCORE_PROGRESS_01, countAtLeast(TOTAL_SCORE_COUNT, 40000))
        );
    }
}
