package com.awardengine.sink;

import com.awardengine.contract.AchievementKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LocalAchievementSinkTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private LocalAchievementSink sink;

    @BeforeEach
    void setUp() {
        sink = new LocalAchievementSink(GerbilPhysicsAchievements.descriptors(),
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void freshSink_summaryShowsNothingEarned() {
        assertEquals("0 of 200 (G), 0 of 20 Achievements", sink.summary());
        assertTrue(sink.earnedKeys().isEmpty());
    }

    @Test
    void award_recordsEarnedTimeAndUpdatesSummary() {
        sink.award(AchievementKeys.WIPEOUT_PROGRESS_00);

        assertTrue(sink.isEarned(AchievementKeys.WIPEOUT_PROGRESS_00));
        assertEquals("10 of 200 (G), 1 of 20 Achievements", sink.summary());

        AchievementStatus status = sink.achievements().stream()
            .filter(a -> a.key().equals(AchievementKeys.WIPEOUT_PROGRESS_00))
            .findFirst()
            .orElseThrow();
        assertTrue(status.earned());
        assertEquals(NOW, status.earnedAt());
    }

    @Test
    void achievements_listEveryDescriptorInDisplayOrder() {
        List<AchievementStatus> all = sink.achievements();

        assertEquals(20, all.size());
        assertEquals(AchievementKeys.ONE_HIT_WONDER_EXPLODER, all.get(0).key());
        assertEquals(AchievementKeys.SCORE_PROGRESS_01, all.get(19).key());
        assertTrue(all.stream().noneMatch(AchievementStatus::earned));
    }

    @Test
    void duplicateDescriptor_isRejected() {
        AchievementDescriptor descriptor = new AchievementDescriptor("Dup", "Dup", "d", "h", 5);
        assertThrows(IllegalArgumentException.class,
            () -> new LocalAchievementSink(List.of(descriptor, descriptor), Clock.systemUTC()));
    }

    @Nested
    @DisplayName("Listeners")
    class Listeners {

        private final List<AchievementStatus> received = new ArrayList<>();

        @BeforeEach
        void subscribe() {
            sink.subscribe(received::add);
        }

        @Test
        void repeatedAward_notifiesOnce() {
            sink.award(AchievementKeys.FIRST_PICKUP);
            sink.award(AchievementKeys.FIRST_PICKUP);

            assertEquals(1, received.size());
            assertEquals(AchievementKeys.FIRST_PICKUP, received.get(0).key());
            assertEquals(5, received.get(0).gamerScore());
        }

        @Test
        void failingListener_doesNotBlockOthers() {
            sink.subscribe(status -> {
                throw new IllegalStateException("toast layer gone");
            });

            assertDoesNotThrow(() -> sink.award(AchievementKeys.BOMB_PARTY));
            assertEquals(1, received.size());
            assertTrue(sink.isEarned(AchievementKeys.BOMB_PARTY));
        }

        @Test
        void unsubscribedListener_isNotNotified() {
            List<AchievementStatus> other = new ArrayList<>();
            String id = sink.subscribe(other::add);
            sink.unsubscribe(id);

            sink.award(AchievementKeys.EINSTEIN);

            assertTrue(other.isEmpty());
            assertEquals(1, received.size());
        }

        @Test
        void unknownKey_isRecordedButNotDisplayed() {
            sink.award("NotInTheGame");

            assertTrue(sink.isEarned("NotInTheGame"));
            assertTrue(received.isEmpty());
            assertEquals("0 of 200 (G), 0 of 20 Achievements", sink.summary());
        }
    }

    @Test
    void clearEarned_allowsEarningAgain() {
        List<AchievementStatus> received = new ArrayList<>();
        sink.subscribe(received::add);
        sink.award(AchievementKeys.GOLD_PROGRESS_00);

        sink.clearEarned();

        assertEquals(Set.of(), sink.earnedKeys());
        sink.award(AchievementKeys.GOLD_PROGRESS_00);
        assertEquals(2, received.size());
    }
}
