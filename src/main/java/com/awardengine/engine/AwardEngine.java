package com.awardengine.engine;

import com.awardengine.contract.MetricId;
import com.awardengine.contract.MetricKind;
import com.awardengine.contract.MetricScope;
import com.awardengine.facts.FactSnapshot;
import com.awardengine.facts.FactStore;
import com.awardengine.facts.KeyFigure;
import com.awardengine.rules.AwardCatalog;
import com.awardengine.rules.AwardDefinition;
import com.awardengine.sink.AchievementSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Award Engine: owns the key figures and the per-session award flags,
 * evaluates the award catalog and reports newly satisfied awards to the
 * {@link AchievementSink}, exactly once per award per session.
 *
 * Gameplay code pushes key figures through the typed mutators; the heartbeat
 * (or a caller wanting an award right away) triggers evaluation.
 *
 * One monitor guards the fact store and the session flags. It is held for a
 * single mutation or a single rule evaluation and released before every sink
 * call, so a sink that calls back into the engine cannot deadlock it.
 */
@Service
public class AwardEngine {

    private static final Logger log = LoggerFactory.getLogger(AwardEngine.class);

    private final Object lock = new Object();
    private final FactStore facts = new FactStore();
    private final AwardSessionState session = new AwardSessionState();
    private final AwardCatalog catalog;
    private final AchievementSink sink;

    public AwardEngine(AwardCatalog catalog, AchievementSink sink) {
        this.catalog = catalog;
        this.sink = sink;
    }

    // ---- key figure mutators ----

    public void setCountAbsolute(MetricId id, int value) {
        synchronized (lock) {
            facts.setCountAbsolute(id, value);
        }
    }

    public void addCountDelta(MetricId id, int delta) {
        synchronized (lock) {
            facts.addCountDelta(id, delta);
        }
    }

    public void keepMaximumCount(MetricId id, int candidate) {
        synchronized (lock) {
            facts.keepMaximumCount(id, candidate);
        }
    }

    public void setTimerAbsolute(MetricId id, double seconds) {
        synchronized (lock) {
            facts.setTimerAbsolute(id, seconds);
        }
    }

    public void keepMaximumTimer(MetricId id, double candidate) {
        synchronized (lock) {
            facts.keepMaximumTimer(id, candidate);
        }
    }

    public void setLabel(MetricId id, String text) {
        synchronized (lock) {
            facts.setLabel(id, text);
        }
    }

    public void wipe(MetricId id) {
        synchronized (lock) {
            facts.wipe(id);
        }
    }

    public void wipeAllInstanceMetrics() {
        synchronized (lock) {
            facts.wipeAllInstanceMetrics();
        }
    }

    /**
     * Overwrites GLOBAL counters with totals read from progress storage.
     * Validates every entry before writing any of them.
     */
    public void refreshGlobalMetrics(Map<MetricId, Integer> totals) {
        totals.forEach((id, value) -> {
            if (id.scope() != MetricScope.GLOBAL) {
                throw new IllegalArgumentException(id.getValue() + " is not a global metric");
            }
            id.requireKind(MetricKind.COUNT);
            if (value == null || value < 0) {
                throw new IllegalArgumentException("invalid total for " + id.getValue() + ": " + value);
            }
        });
        synchronized (lock) {
            totals.forEach(facts::setCountAbsolute);
        }
    }

    // ---- level lifecycle ----

    /** Level start: wipes instance metrics and records the level being played. */
    public void startLevel(String levelName) {
        synchronized (lock) {
            facts.wipeAllInstanceMetrics();
            facts.setLabel(MetricId.LEVEL_PLAYING_NAME, levelName);
        }
        log.info("Level started: {}", levelName);
    }

    /** Level completion: records the completed level and how long it took. */
    public void completeLevel(String levelName, double seconds) {
        synchronized (lock) {
            facts.setTimerAbsolute(MetricId.LEVEL_COMPLETED_TIMER, seconds);
            facts.setLabel(MetricId.LEVEL_COMPLETED_NAME, levelName);
        }
        log.info("Level completed: {} in {}s", levelName, seconds);
    }

    // ---- evaluation ----

    /**
     * Evaluates every pending award in catalog order and sends each newly
     * satisfied one to the sink.
     *
     * An award is marked as awarded before its sink call. If the sink throws,
     * the exception propagates: that award stays marked and the awards after it
     * are left for the next evaluation.
     *
     * @return keys sent to the sink, in firing order
     */
    public List<String> evaluateAndFire() {
        List<String> fired = new ArrayList<>();
        for (AwardDefinition definition : catalog.definitions()) {
            if (claimIfSatisfied(definition)) {
                fire(definition);
                fired.add(definition.achievementKey());
            }
        }
        return fired;
    }

    /**
     * Evaluates a single award right away instead of waiting for the next
     * heartbeat, e.g. straight after the pickup that completes it.
     *
     * Only awards that do not read LevelCompletedName can fire mid-level this
     * way (SpinCycle, BombParty, FirstPickup and the counter thresholds).
     * Einstein and the other level-completion awards stay false until
     * {@link #completeLevel} has run.
     *
     * @return true if the award fired on this call
     * @throws UnknownAchievementException if the key is not in the catalog
     */
    public boolean evaluateNow(String achievementKey) {
        AwardDefinition definition = catalog.find(achievementKey)
            .orElseThrow(() -> new UnknownAchievementException(achievementKey));
        if (!claimIfSatisfied(definition)) {
            return false;
        }
        fire(definition);
        return true;
    }

    /**
     * Clears every awarded flag and wipes instance metrics. Awards whose
     * condition still holds will fire again on the next evaluation.
     * Meant for test and cheat tooling.
     */
    public void resetSession() {
        synchronized (lock) {
            session.clear();
            facts.wipeAllInstanceMetrics();
        }
        log.info("Award session reset");
    }

    private boolean claimIfSatisfied(AwardDefinition definition) {
        synchronized (lock) {
            String key = definition.achievementKey();
            if (session.isAwarded(key)) {
                return false;
            }
            if (!definition.condition().test(facts)) {
                return false;
            }
            return session.markAwarded(key);
        }
    }

    private void fire(AwardDefinition definition) {
        log.info("Award condition met: {} [{}]",
            definition.achievementKey(), definition.condition().describe());
        sink.award(definition.achievementKey());
    }

    // ---- reads ----

    public int count(MetricId id) {
        synchronized (lock) {
            return facts.count(id);
        }
    }

    public double timer(MetricId id) {
        synchronized (lock) {
            return facts.timer(id);
        }
    }

    public String label(MetricId id) {
        synchronized (lock) {
            return facts.label(id);
        }
    }

    public boolean isAwardedThisSession(String achievementKey) {
        synchronized (lock) {
            return session.isAwarded(achievementKey);
        }
    }

    public List<KeyFigure> keyFigures() {
        synchronized (lock) {
            return facts.keyFigures();
        }
    }

    public List<AwardState> sessionState() {
        synchronized (lock) {
            List<AwardState> states = new ArrayList<>(catalog.size());
            for (AwardDefinition definition : catalog.definitions()) {
                states.add(new AwardState(
                    definition.achievementKey(),
                    definition.condition().describe(),
                    definition.condition().test(facts),
                    session.isAwarded(definition.achievementKey())
                ));
            }
            return states;
        }
    }

    // ---- suspend / resume ----

    public FactSnapshot snapshot() {
        synchronized (lock) {
            return facts.snapshot(catalog.isLoaded());
        }
    }

    public void restore(FactSnapshot snapshot) {
        synchronized (lock) {
            facts.restore(snapshot);
        }
        log.info("Restored {} key figures from snapshot", snapshot.slots().size());
    }
}
