package com.awardengine.sink;

/**
 * Platform-independent description of one achievement.
 *
 * @param description shown after the achievement is earned
 * @param howToEarn   shown before it is earned
 */
public record AchievementDescriptor(
    String key,
    String name,
    String description,
    String howToEarn,
    int gamerScore
) {}
