package com.ourfarm.model;

public enum TileType {
    GRASS, DIRT, WATER, STONE, PATH, SAND, TILLED;

    public boolean isTillable() {
        return this == GRASS || this == DIRT;
    }
}
