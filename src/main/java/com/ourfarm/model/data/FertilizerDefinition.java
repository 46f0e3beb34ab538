package com.ourfarm.model.data;

public class FertilizerDefinition {
    public String id;
    public double speedBonus;
}
