package com.ourfarm.model;

public class ForageSpawn {
    private final String id;
    private final String itemId;
    private final int tileX;
    private final int tileZ;

    public ForageSpawn(String id, String itemId, int tileX, int tileZ) {
        this.id = id;
        this.itemId = itemId;
        this.tileX = tileX;
        this.tileZ = tileZ;
    }

    public String getId() { return id; }
    public String getItemId() { return itemId; }
    public int getTileX() { return tileX; }
    public int getTileZ() { return tileZ; }
}
