package com.ourfarm.model;

import com.ourfarm.model.data.NpcDefinition;

public class Npc {
    private final NpcDefinition definition;
    private int x;
    private int z;

    public Npc(NpcDefinition definition) {
        this.definition = definition;
        this.x = definition.homeX;
        this.z = definition.homeZ;
    }

    /** Works at the shop from 8 to 18, home otherwise. */
    public void updateSchedule(double hour) {
        if (hour >= 8 && hour < 18) {
            x = definition.shopX;
            z = definition.shopZ;
        } else {
            x = definition.homeX;
            z = definition.homeZ;
        }
    }

    public String getDialogue(double hearts) {
        NpcDefinition.Dialogue d = definition.dialogue;
        if (hearts >= 8) return d.high;
        if (hearts >= 4) return d.mid;
        if (hearts >= 1) return d.low;
        return d.intro;
    }

    /** Heart change for a gift of {@code itemId}. */
    public double giftDelta(String itemId) {
        if (definition.loves.contains(itemId)) return 0.8;
        if (definition.likes.contains(itemId)) return 0.4;
        if (definition.hates.contains(itemId)) return -0.4;
        return 0.2;
    }

    public String getId() { return definition.id; }
    public String getName() { return definition.name; }
    public String getRole() { return definition.role; }
    public String getPersonality() { return definition.personality; }
    public int getX() { return x; }
    public int getZ() { return z; }
}
