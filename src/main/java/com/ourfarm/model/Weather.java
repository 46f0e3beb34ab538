package com.ourfarm.model;

public enum Weather {
    SUNNY, CLOUDY, RAINY, STORMY, SNOWY;

    public boolean isRaining() {
        return this == RAINY || this == STORMY;
    }

    public static Weather fromIndex(int index) {
        if (index < 0 || index >= values().length) return SUNNY;
        return values()[index];
    }
}
