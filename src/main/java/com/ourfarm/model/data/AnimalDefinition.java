package com.ourfarm.model.data;

public class AnimalDefinition {
    public String type;
    public String product;
    /** Game-hours of being fed before a product is ready. */
    public double productInterval;
    public int buyPrice;
}
