package com.awardengine.engine;

/**
 * Thrown when an operation names an achievement key that is not in the award catalog.
 */
public class UnknownAchievementException extends RuntimeException {

    public UnknownAchievementException(String achievementKey) {
        super("no award defined for achievement key: " + achievementKey);
    }
}
