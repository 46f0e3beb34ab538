package com.ourfarm.model.data;

import java.util.LinkedHashMap;
import java.util.Map;

/** A crafting recipe; a null machine means it is crafted instantly by hand. */
public class RecipeDefinition {
    public String id;
    public String machine;
    public Map<String, Integer> inputs = new LinkedHashMap<>();
    public String output;
    public int outputQuantity = 1;
    public double hours;
    public int xp;
}
