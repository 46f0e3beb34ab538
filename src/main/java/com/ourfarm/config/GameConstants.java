package com.ourfarm.config;

/** Game-rule constants shared by the simulation services. */
public final class GameConstants {

    private GameConstants() {}

    public static final int WORLD_SIZE = 64;

    // 1 real second = 1 game minute
    public static final double TIME_SCALE = 60.0;
    public static final int HOURS_PER_DAY = 24;
    public static final int DAYS_PER_SEASON = 28;
    public static final double START_HOUR = 6.0;

    public static final int SKILL_MAX_LEVEL = 10;
    public static final int MAX_ENERGY_PER_LEVEL = 2;
    public static final int STARTING_ENERGY = 100;

    public static final double HEARTS_MAX = 10.0;
    public static final double TALK_HEARTS = 0.2;

    public static final int TILL_ENERGY = 2;
    public static final int WATER_ENERGY = 1;
    public static final int CAST_ENERGY = 5;

    public static final int MAX_TOOL_TIER = 3;

    // Largest quantity a single shop:buy or shop:sell may move
    public static final int MAX_TRADE_QUANTITY = 999;

    public static int xpForSkillLevel(int level) {
        return level * 100;
    }
}
