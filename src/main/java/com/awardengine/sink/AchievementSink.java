package com.awardengine.sink;

/**
 * Receives achievements unlocked by the award engine and takes care of
 * persisting or syncing them.
 *
 * The engine calls {@link #award(String)} at most once per key per session,
 * but implementations must still tolerate repeats (for example after a session
 * reset). Implementations must not call back into award evaluation.
 */
public interface AchievementSink {

    /**
     * @param achievementKey one of {@link com.awardengine.contract.AchievementKeys}
     */
    void award(String achievementKey);
}
