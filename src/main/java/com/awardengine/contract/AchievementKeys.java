package com.awardengine.contract;

/**
 * Achievement keys shared by the award catalog and the achievement sinks.
 * They must match the keys registered with the achievement platform.
 */
public final class AchievementKeys {

    public static final String WIPEOUT_PROGRESS_00 = "WipeoutProgress00";
    public static final String WIPEOUT_PROGRESS_01 = "WipeoutProgress01";
    public static final String WIPEOUT_PROGRESS_02 = "WipeoutProgress02";
    public static final String GAME_PROGRESS_01 = "GameProgress01";
    public static final String GAME_PROGRESS_02 = "GameProgress02";
    public static final String DISINTEGRATION_MAD = "DisintegrationMad";
    public static final String ONE_HIT_WONDER_EXPLODER = "OneHitWonderExploder";
    public static final String ONE_HIT_WONDER_DISINTEGRATOR = "OneHitWonderDisintegrator";
    public static final String PENGUIN_LOVER = "PenguinLover";
    public static final String GOLD_PROGRESS_00 = "GoldProgress00";
    public static final String GOLD_PROGRESS_01 = "GoldProgress01";
    public static final String GOLD_PROGRESS_02 = "GoldProgress02";
    public static final String SPEED_FREAK_01 = "SpeedFreak01";
    public static final String EINSTEIN = "Einstein";
    public static final String SPIN_CYCLE = "SpinCycle";
    public static final String BOMB_PARTY = "BombParty";
    public static final String FIRST_PICKUP = "FirstPickup";
    public static final String FIRST_ALARM_GERBILS = "FirstAlarmGerbils";
    public static final String SCORE_PROGRESS_00 = "ScoreProgress00";
    public static final String SCORE_PROGRESS_01 = "ScoreProgress01";

    private AchievementKeys() {
    }
}
