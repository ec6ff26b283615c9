package com.awardengine.rules;

import com.awardengine.contract.AchievementKeys;
import com.awardengine.contract.MetricId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.awardengine.rules.AwardCondition.allOf;
import static com.awardengine.rules.AwardCondition.countAtLeast;
import static com.awardengine.rules.AwardCondition.labelEquals;
import static org.junit.jupiter.api.Assertions.*;

class AwardCatalogTest {

    private AwardCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new AwardCatalog();
    }

    @Test
    void newCatalog_isEmptyUntilLoaded() {
        assertFalse(catalog.isLoaded());
        assertEquals(0, catalog.size());
        assertTrue(catalog.find(AchievementKeys.EINSTEIN).isEmpty());
    }

    @Test
    void load_isIdempotent() {
        assertTrue(catalog.load(List.of(
            AwardDefinition.of("First", countAtLeast(MetricId.WIPEOUTS_COUNT, 1)))));
        assertFalse(catalog.load(GerbilPhysicsAwards.definitions()));

        assertTrue(catalog.isLoaded());
        assertEquals(1, catalog.size());
        assertEquals("First", catalog.definitions().get(0).achievementKey());
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void duplicateKey_isRejected() {
            CatalogConfigurationException ex = assertThrows(CatalogConfigurationException.class,
                () -> catalog.load(List.of(
                    AwardDefinition.of("Twice", countAtLeast(MetricId.WIPEOUTS_COUNT, 1)),
                    AwardDefinition.of("Twice", countAtLeast(MetricId.WIPEOUTS_COUNT, 2)))));
            assertTrue(ex.getMessage().contains("Twice"));
            assertFalse(catalog.isLoaded());
        }

        @Test
        void blankKey_isRejected() {
            assertThrows(CatalogConfigurationException.class,
                () -> catalog.load(List.of(
                    AwardDefinition.of(" ", countAtLeast(MetricId.WIPEOUTS_COUNT, 1)))));
        }

        @Test
        void missingCondition_isRejected() {
            assertThrows(CatalogConfigurationException.class,
                () -> catalog.load(List.of(AwardDefinition.of("NoCondition", null))));
        }

        @Test
        void nullEntry_isRejected() {
            assertThrows(CatalogConfigurationException.class,
                () -> catalog.load(Arrays.asList((AwardDefinition) null)));
            assertThrows(CatalogConfigurationException.class, () -> catalog.load(null));
        }

        @Test
        void conditionReadingMetricAsWrongKind_isRejected() {
            CatalogConfigurationException ex = assertThrows(CatalogConfigurationException.class,
                () -> catalog.load(List.of(
                    AwardDefinition.of("Confused", allOf(
                        countAtLeast(MetricId.WIPEOUTS_COUNT, 1),
                        labelEquals(MetricId.LEVEL_COMPLETED_TIMER, "Sink"))))));
            assertTrue(ex.getMessage().contains("LevelCompletedTimer"));
        }

        @Test
        void failedLoad_leavesCatalogLoadable() {
            assertThrows(CatalogConfigurationException.class,
                () -> catalog.load(List.of(AwardDefinition.of("", countAtLeast(MetricId.WIPEOUTS_COUNT, 1)))));
            assertTrue(catalog.load(GerbilPhysicsAwards.definitions()));
        }
    }

    @Nested
    @DisplayName("Gerbil Physics catalog")
    class GerbilPhysicsCatalog {

        @Test
        void loadsAllTwentyAwardsInEvaluationOrder() {
            assertTrue(catalog.load(GerbilPhysicsAwards.definitions()));

            List<String> keys = catalog.definitions().stream()
                .map(AwardDefinition::achievementKey)
                .toList();
            assertEquals(List.of(
                AchievementKeys.WIPEOUT_PROGRESS_00,
                AchievementKeys.WIPEOUT_PROGRESS_01,
                AchievementKeys.WIPEOUT_PROGRESS_02,
                AchievementKeys.GAME_PROGRESS_01,
                AchievementKeys.GAME_PROGRESS_02,
                AchievementKeys.DISINTEGRATION_MAD,
                AchievementKeys.ONE_HIT_WONDER_EXPLODER,
                AchievementKeys.ONE_HIT_WONDER_DISINTEGRATOR,
                AchievementKeys.PENGUIN_LOVER,
                AchievementKeys.GOLD_PROGRESS_00,
                AchievementKeys.GOLD_PROGRESS_01,
                AchievementKeys.GOLD_PROGRESS_02,
                AchievementKeys.SPEED_FREAK_01,
                AchievementKeys.EINSTEIN,
                AchievementKeys.SPIN_CYCLE,
                AchievementKeys.BOMB_PARTY,
                AchievementKeys.FIRST_PICKUP,
                AchievementKeys.FIRST_ALARM_GERBILS,
                AchievementKeys.SCORE_PROGRESS_00,
                AchievementKeys.SCORE_PROGRESS_01), keys);
        }

        @Test
        void find_returnsDefinitionByKey() {
            catalog.load(GerbilPhysicsAwards.definitions());

            AwardDefinition speedFreak = catalog.find(AchievementKeys.SPEED_FREAK_01).orElseThrow();
            assertEquals("(LevelCompletedTimer < 32.00 AND LevelCompletedName == 'TwoSeasons')",
                speedFreak.condition().describe());
        }
    }
}
