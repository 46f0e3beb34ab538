package com.ourfarm.model.data;

import java.util.List;

public class FishDefinition {
    public String id;
    public String name;
    public String location;
    /** 0 common, 1 uncommon, 2 rare, 3 legendary. */
    public int rarity;
    public int minLevel;
    public List<String> seasons = List.of();
    public FishTime time = FishTime.ANY;
    public int sellPrice;

    public enum FishTime { ANY, DAY, NIGHT, RAIN }
}
