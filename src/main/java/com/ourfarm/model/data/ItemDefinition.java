package com.ourfarm.model.data;

public class ItemDefinition {
    public String id;
    public String name;
    public String category;
    public int sellPrice;
    /** Shop price; 0 when the shop does not stock it. */
    public int buyPrice;
}
