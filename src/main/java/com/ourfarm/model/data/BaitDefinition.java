package com.ourfarm.model.data;

public class BaitDefinition {
    public static final BaitDefinition NONE = new BaitDefinition();

    public String id;
    /** Multiplies the weight of uncommon and rarer fish. */
    public double rarityBoost = 1.0;
    /** Lets any fish of the location bite, regardless of season or time. */
    public boolean ignoreRestrictions = false;

    /** Copy with {@code extra} added to the rarity boost. */
    public BaitDefinition withExtraBoost(double extra) {
        BaitDefinition copy = new BaitDefinition();
        copy.id = id;
        copy.rarityBoost = rarityBoost + extra;
        copy.ignoreRestrictions = ignoreRestrictions;
        return copy;
    }
}
