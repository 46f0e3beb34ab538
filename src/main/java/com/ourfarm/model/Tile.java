package com.ourfarm.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"x", "z", "type", "height"})
public class Tile {
    private final int x;
    private final int z;
    private TileType type;
    private final double height;

    public Tile(int x, int z, TileType type, double height) {
        this.x = x;
        this.z = z;
        this.type = type;
        this.height = height;
    }

    public int getX() { return x; }
    public int getZ() { return z; }
    public TileType getType() { return type; }
    public double getHeight() { return height; }

    public void setType(TileType type) { this.type = type; }
}
