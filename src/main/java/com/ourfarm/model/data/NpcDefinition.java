package com.ourfarm.model.data;

import java.util.List;

public class NpcDefinition {
    public String id;
    public String name;
    public String role;
    public String personality;
    public int homeX;
    public int homeZ;
    public int shopX;
    public int shopZ;
    public Dialogue dialogue = new Dialogue();
    public List<String> loves = List.of();
    public List<String> likes = List.of();
    public List<String> hates = List.of();

    public static class Dialogue {
        public String intro = "";
        public String low = "";
        public String mid = "";
        public String high = "";
    }
}
