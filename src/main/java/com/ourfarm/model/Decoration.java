package com.ourfarm.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Advisory scenery object. Never mutated after world generation. */
@JsonPropertyOrder({"type", "x", "z", "variant", "rotation"})
public final class Decoration {
    private final String type;
    private final int x;
    private final int z;
    private final int variant;
    private final double rotation;

    public Decoration(String type, int x, int z, int variant, double rotation) {
        this.type = type;
        this.x = x;
        this.z = z;
        this.variant = variant;
        this.rotation = rotation;
    }

    public String getType() { return type; }
    public int getX() { return x; }
    public int getZ() { return z; }
    public int getVariant() { return variant; }
    public double getRotation() { return rotation; }
}
