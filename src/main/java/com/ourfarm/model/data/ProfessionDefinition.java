package com.ourfarm.model.data;

import java.util.LinkedHashMap;
import java.util.Map;

public class ProfessionDefinition {
    public String id;
    public String name;
    public String skill;
    /** 5 or 10. */
    public int level;
    /** Level-5 profession a level-10 choice branches from. */
    public String requires;
    public Map<String, Double> bonus = new LinkedHashMap<>();
}
