package com.ourfarm.model;

/** A skill level that unlocked a profession choice the player has not made yet. */
public class ProfessionCheckpoint {
    private final String skill;
    private final int level;

    public ProfessionCheckpoint(String skill, int level) {
        this.skill = skill;
        this.level = level;
    }

    public String getSkill() { return skill; }
    public int getLevel() { return level; }
}
