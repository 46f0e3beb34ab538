package com.ourfarm.model.data;

public class CropDefinition {
    public String id;
    public String name;
    /** Days from seed to harvestable. */
    public double growthTime;
    public boolean regrows;
    public int buyPrice;
    public int sellPrice;
    public int xp;
}
