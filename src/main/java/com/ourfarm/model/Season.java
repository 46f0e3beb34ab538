package com.ourfarm.model;

import java.util.Locale;

public enum Season {
    SPRING, SUMMER, FALL, WINTER;

    public Season next() {
        return values()[(ordinal() + 1) % values().length];
    }

    public static Season fromIndex(int index) {
        return values()[Math.floorMod(index, values().length)];
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
