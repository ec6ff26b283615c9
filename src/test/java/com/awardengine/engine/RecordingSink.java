package com.awardengine.engine;

import com.awardengine.sink.AchievementSink;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Sink that records every award call, optionally failing or running a
 * callback for chosen keys.
 */
class RecordingSink implements AchievementSink {

    private final List<String> awarded = new ArrayList<>();
    private final Set<String> failOn = new HashSet<>();
    private Consumer<String> onAward = key -> { };

    @Override
    public synchronized void award(String achievementKey) {
        awarded.add(achievementKey);
        onAward.accept(achievementKey);
        if (failOn.contains(achievementKey)) {
            throw new IllegalStateException("sink unavailable for " + achievementKey);
        }
    }

    RecordingSink failOn(String achievementKey) {
        failOn.add(achievementKey);
        return this;
    }

    RecordingSink recover() {
        failOn.clear();
        return this;
    }

    RecordingSink onAward(Consumer<String> callback) {
        this.onAward = callback;
        return this;
    }

    synchronized List<String> awarded() {
        return List.copyOf(awarded);
    }
}
