package com.ourfarm.model;

import java.util.UUID;

public class Sprinkler {
    private final String id;
    private final String type;
    private final int tileX;
    private final int tileZ;

    public Sprinkler(String type, int tileX, int tileZ) {
        this.id = UUID.randomUUID().toString();
        this.type = type;
        this.tileX = tileX;
        this.tileZ = tileZ;
    }

    public String getId() { return id; }
    public String getType() { return type; }
    public int getTileX() { return tileX; }
    public int getTileZ() { return tileZ; }
}
