package com.ourfarm.model.data;

import com.ourfarm.model.Building;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Fixed placements created together with a new world. */
public class WorldLayout {
    public List<Building> buildings = new ArrayList<>();
    public List<Placement> machines = new ArrayList<>();
    public List<Placement> animals = new ArrayList<>();
    public String starterPet = "dog";
    public Map<String, List<String>> forage = Map.of();

    public static class Placement {
        public String id;
        public String type;
        public int x;
        public int z;
    }
}
