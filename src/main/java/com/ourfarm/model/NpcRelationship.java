package com.ourfarm.model;

import com.ourfarm.config.GameConstants;

public class NpcRelationship {
    private final String playerId;
    private final String npcId;
    private double hearts;
    private boolean talkedToday;
    private boolean giftedToday;

    public NpcRelationship(String playerId, String npcId, double hearts, boolean talkedToday, boolean giftedToday) {
        this.playerId = playerId;
        this.npcId = npcId;
        this.hearts = hearts;
        this.talkedToday = talkedToday;
        this.giftedToday = giftedToday;
    }

    public void addHearts(double delta) {
        hearts = Math.max(0, Math.min(GameConstants.HEARTS_MAX, hearts + delta));
    }

    public String getPlayerId() { return playerId; }
    public String getNpcId() { return npcId; }
    public double getHearts() { return hearts; }
    public boolean isTalkedToday() { return talkedToday; }
    public boolean isGiftedToday() { return giftedToday; }
    public void setTalkedToday(boolean talkedToday) { this.talkedToday = talkedToday; }
    public void setGiftedToday(boolean giftedToday) { this.giftedToday = giftedToday; }
}
