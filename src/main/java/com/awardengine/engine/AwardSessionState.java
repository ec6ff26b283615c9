package com.awardengine.engine;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Which awards have already been sent to the sink this session, keyed by
 * achievement key. Kept apart from the catalog so the catalog stays read-only
 * configuration. Not thread-safe; guarded by the engine.
 */
class AwardSessionState {

    private final Set<String> awarded = new LinkedHashSet<>();

    boolean isAwarded(String achievementKey) {
        return awarded.contains(achievementKey);
    }

    /**
     * @return true if the key was not yet marked
     */
    boolean markAwarded(String achievementKey) {
        return awarded.add(achievementKey);
    }

    void clear() {
        awarded.clear();
    }
}
