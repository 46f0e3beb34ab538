package com.ourfarm.model;

import java.util.Locale;

public enum Skill {
    FARMING, FISHING, MINING, FORAGING, COMBAT;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** @return the skill for a lowercase id, or null if unknown */
    public static Skill fromId(String id) {
        if (id == null) return null;
        for (Skill s : values()) {
            if (s.id().equals(id)) return s;
        }
        return null;
    }
}
