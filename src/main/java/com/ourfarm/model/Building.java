package com.ourfarm.model;

public class Building {
    private String id;
    private String type;
    private int tileX;
    private int tileZ;
    private int width = 1;
    private int depth = 1;

    public Building() {}

    public boolean covers(int x, int z) {
        return x >= tileX && x < tileX + width && z >= tileZ && z < tileZ + depth;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public int getTileX() { return tileX; }
    public void setTileX(int tileX) { this.tileX = tileX; }
    public int getTileZ() { return tileZ; }
    public void setTileZ(int tileZ) { this.tileZ = tileZ; }
    public int getWidth() { return width; }
    public void setWidth(int width) { this.width = width; }
    public int getDepth() { return depth; }
    public void setDepth(int depth) { this.depth = depth; }
}
