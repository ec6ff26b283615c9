package com.awardengine.sink;

import com.awardengine.contract.AchievementKeys;

import java.util.List;

/**
 * Display list of the Gerbil Physics achievements. Gamer scores add up to 200.
 */
public final class GerbilPhysicsAchievements {

    private GerbilPhysicsAchievements() {
    }

    public static List<AchievementDescriptor> descriptors() {
        return List.of(
            new AchievementDescriptor(AchievementKeys.ONE_HIT_WONDER_EXPLODER,
                "One Hit Wonder Exploder",
                "Completed the site 25. Spooky using only one Exploder",
                "Complete the site 25. Spooky using only one Exploder", 5),
            new AchievementDescriptor(AchievementKeys.EINSTEIN,
                "Einstein was a Physicist",
                "Collected all pickup items with a single gerbil and a single bomb on the site 10. Sink.",
                "Collect all pickup items with a single gerbil and a single bomb on the site 10. Sink.", 10),
            new AchievementDescriptor(AchievementKeys.WIPEOUT_PROGRESS_01,
                "8 Wipeouts",
                "Collected 8 Wipeouts by being fast or frugal with weapon usage.",
                "Collect 8 Wipeouts by being fast or frugal with weapon usage.", 5),
            new AchievementDescriptor(AchievementKeys.SPIN_CYCLE,
                "Spin Cycle",
                "Made a gerbil rotate 12 times on site 35. Newton's Gerbil.",
                "Make a gerbil rotate 12 times on site 35. Newton's Gerbil.", 5),
            new AchievementDescriptor(AchievementKeys.ONE_HIT_WONDER_DISINTEGRATOR,
                "One Hit Wonder Disintegrator",
                "Completed the site 9. Be Decisive using only one Disintegrator",
                "Complete the site 9. Be Decisive using only one Disintegrator", 10),
            new AchievementDescriptor(AchievementKeys.GAME_PROGRESS_01,
                "36 Sites Demolished",
                "Demolished 36 Gerbil Sites.",
                "Demolish 36 Gerbil Sites.", 15),
            new AchievementDescriptor(AchievementKeys.DISINTEGRATION_MAD,
                "Disintegration Mad",
                "Disintegrated a Red Alarm Gerbil.",
                "Disintegrate something you think you shouldn't touch!", 5),
            new AchievementDescriptor(AchievementKeys.WIPEOUT_PROGRESS_02,
                "16 Wipeouts",
                "Collected 16 Wipeouts by being fast or frugal with weapon usage.",
                "Collect 16 Wipeouts by being fast or frugal with weapon usage.", 10),
            new AchievementDescriptor(AchievementKeys.PENGUIN_LOVER,
                "Penguin Lover",
                "Avoided detonating any penguins on level 72. Bad Neighbors",
                "Avoid detonating any penguins on level 72. Bad Neighbors", 5),
            new AchievementDescriptor(AchievementKeys.GAME_PROGRESS_02,
                "72 Sites Demolished",
                "Demolished 72 Gerbil Sites.",
                "Demolish 72 Gerbil Sites.", 20),
            new AchievementDescriptor(AchievementKeys.GOLD_PROGRESS_01,
                "36 Gold Chests",
                "Got 36 Gold Chests.",
                "Get 36 Gold Chests.", 10),
            new AchievementDescriptor(AchievementKeys.SPEED_FREAK_01,
                "Speed Freak",
                "Completed site 41. Two Seasons in under 32 seconds.",
                "Complete site 41. Two Seasons in under 32 seconds.", 5),
            new AchievementDescriptor(AchievementKeys.GOLD_PROGRESS_02,
                "72 Gold Chests",
                "Got 72 Gold Chests.",
                "Get 72 Gold Chests.", 15),
            new AchievementDescriptor(AchievementKeys.BOMB_PARTY,
                "Bomb Party",
                "Used at least 10 bombs on any site.",
                "Use at least 10 bombs on any site.", 10),
            new AchievementDescriptor(AchievementKeys.FIRST_PICKUP,
                "First Pickup",
                "Got any pickup on any site.",
                "Get any pickup on any site.", 5),
            new AchievementDescriptor(AchievementKeys.GOLD_PROGRESS_00,
                "First Gold Chest",
                "Got one Gold Chest by scoring highly on any site.",
                "Get one Gold Chest by scoring highly on any site.", 10),
            new AchievementDescriptor(AchievementKeys.WIPEOUT_PROGRESS_00,
                "First Wipeout",
                "Collected one Wipeout by being fast or frugal with weapon usage.",
                "Collect one Wipeout by being fast or frugal with weapon usage.", 10),
            new AchievementDescriptor(AchievementKeys.FIRST_ALARM_GERBILS,
                "First Alarm Gerbils",
                "Avoided the Red Alarm Gerbils on site 4. Collateral.",
                "Avoid the Red Alarm Gerbils on site 4. Collateral.", 10),
            new AchievementDescriptor(AchievementKeys.SCORE_PROGRESS_00,
                "Score 20,000",
                "Scored 20,000 points.",
                "Score 20,000 points.", 15),
            new AchievementDescriptor(AchievementKeys.SCORE_PROGRESS_01,
                "Score 40,000",
                "Scored 40,000 points.",
                "Score 40,000 points.", 20)
        );
    }
}
