package com.awardengine.rules;

/**
 * Immutable pairing of an achievement key with the condition that unlocks it.
 * Whether it has fired this session is tracked by the engine, not here.
 */
public record AwardDefinition(String achievementKey, AwardCondition condition) {

    public static AwardDefinition of(String achievementKey, AwardCondition condition) {
        return new AwardDefinition(achievementKey, condition);
    }
}
