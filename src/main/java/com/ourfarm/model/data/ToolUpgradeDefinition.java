package com.ourfarm.model.data;

/** Cost of raising a tool to {@code tier}. */
public class ToolUpgradeDefinition {
    public int tier;
    public int coins;
    public String bar;
    public int bars;
}
