package com.awardengine.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Achievement sink that keeps earned achievements locally, for hosts without
 * an online achievement service.
 *
 * Maintains the displayed achievement list, de-duplicates repeated awards and
 * notifies subscribers (e.g. a toast notification layer) once per newly earned
 * achievement. Storage of the earned set is left to the host.
 */
public class LocalAchievementSink implements AchievementSink {

    private static final Logger log = LoggerFactory.getLogger(LocalAchievementSink.class);

    private final Map<String, AchievementDescriptor> descriptors = new LinkedHashMap<>();
    private final ConcurrentHashMap<String, Instant> earned = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Consumer<AchievementStatus>> subscribers = new ConcurrentHashMap<>();
    private final Clock clock;

    public LocalAchievementSink(List<AchievementDescriptor> descriptors, Clock clock) {
        for (AchievementDescriptor descriptor : descriptors) {
            if (this.descriptors.putIfAbsent(descriptor.key(), descriptor) != null) {
                throw new IllegalArgumentException("duplicate achievement descriptor: " + descriptor.key());
            }
        }
        this.clock = clock;
        log.info("Using LocalAchievementSink with {} achievements", this.descriptors.size());
    }

    @Override
    public void award(String achievementKey) {
        log.info("Received request to award {}", achievementKey);

        Instant now = clock.instant();
        if (earned.putIfAbsent(achievementKey, now) != null) {
            log.info("Achievement {} already earned, nothing to do", achievementKey);
            return;
        }

        AchievementDescriptor descriptor = descriptors.get(achievementKey);
        if (descriptor == null) {
            log.warn("Awarded achievement {} has no descriptor, it will not be displayed", achievementKey);
            return;
        }

        log.info("Achievement earned: {} ({}G)", descriptor.name(), descriptor.gamerScore());
        notifySubscribers(AchievementStatus.of(descriptor, now));
    }

    public boolean isEarned(String achievementKey) {
        return earned.containsKey(achievementKey);
    }

    public Set<String> earnedKeys() {
        return Set.copyOf(earned.keySet());
    }

    /** Every described achievement, earned or not, in display order. */
    public List<AchievementStatus> achievements() {
        List<AchievementStatus> out = new ArrayList<>(descriptors.size());
        for (AchievementDescriptor descriptor : descriptors.values()) {
            out.add(AchievementStatus.of(descriptor, earned.get(descriptor.key())));
        }
        return out;
    }

    /**
     * Header line for an achievements screen, e.g. {@code "15 of 200 (G), 2 of 20 Achievements"}.
     */
    public String summary() {
        int earnedPoints = 0;
        int totalPoints = 0;
        int earnedCount = 0;
        for (AchievementDescriptor descriptor : descriptors.values()) {
            if (earned.containsKey(descriptor.key())) {
                earnedPoints += descriptor.gamerScore();
                earnedCount++;
            }
            totalPoints += descriptor.gamerScore();
        }
        return String.format("%d of %d (G), %d of %d Achievements",
            earnedPoints, totalPoints, earnedCount, descriptors.size());
    }

    /** Forgets every earned achievement. */
    public void clearEarned() {
        log.info("Clearing {} earned achievements", earned.size());
        earned.clear();
    }

    public String subscribe(Consumer<AchievementStatus> listener) {
        String id = UUID.randomUUID().toString();
        subscribers.put(id, listener);
        return id;
    }

    public void unsubscribe(String id) {
        subscribers.remove(id);
    }

    private void notifySubscribers(AchievementStatus status) {
        subscribers.values().forEach(listener -> {
            try {
                listener.accept(status);
            } catch (Exception ex) {
                log.warn("Achievement listener failed for {}: {}", status.key(), ex.getMessage());
            }
        });
    }
}
