package com.awardengine.contract;

/**
 * Level names referenced by level-specific awards.
 */
public final class LevelNames {

    public static final String COLLATERAL = "Collateral";
    public static final String BE_DECISIVE = "BeDecisive";
    public static final String SINK = "Sink";
    public static final String SPOOKY = "Spooky";
    public static final String NEWTONS_GERBIL = "NewtonsGerbil";
    public static final String TWO_SEASONS = "TwoSeasons";
    public static final String BAD_NEIGHBORS = "BadNeighbors";

    private LevelNames() {
    }
}
