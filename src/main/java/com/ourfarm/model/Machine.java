package com.ourfarm.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/** A processing machine; work is measured in game-hours. */
public class Machine {
    private final String id;
    private final String type;
    private final int tileX;
    private final int tileZ;
    private Processing processing;

    public Machine(String id, String type, int tileX, int tileZ) {
        this.id = id;
        this.type = type;
        this.tileX = tileX;
        this.tileZ = tileZ;
    }

    public void startProcessing(String recipeId, String outputItem, int outputQuantity, double hours) {
        this.processing = new Processing(recipeId, outputItem, outputQuantity, hours);
    }

    public void tickHours(double hours) {
        if (processing != null && processing.hoursRemaining > 0) {
            processing.hoursRemaining = Math.max(0, processing.hoursRemaining - hours);
        }
    }

    @JsonIgnore
    public boolean isIdle() { return processing == null; }

    @JsonIgnore
    public boolean isReady() { return processing != null && processing.hoursRemaining <= 0; }

    /** @return the finished work, or null if nothing is ready */
    public Processing collect() {
        if (!isReady()) return null;
        Processing done = processing;
        processing = null;
        return done;
    }

    public String getId() { return id; }
    public String getType() { return type; }
    public int getTileX() { return tileX; }
    public int getTileZ() { return tileZ; }
    public Processing getProcessing() { return processing; }

    public static class Processing {
        private final String recipeId;
        private final String outputItem;
        private final int outputQuantity;
        private double hoursRemaining;

        Processing(String recipeId, String outputItem, int outputQuantity, double hoursRemaining) {
            this.recipeId = recipeId;
            this.outputItem = outputItem;
            this.outputQuantity = outputQuantity;
            this.hoursRemaining = hoursRemaining;
        }

        public String getRecipeId() { return recipeId; }
        public String getOutputItem() { return outputItem; }
        public int getOutputQuantity() { return outputQuantity; }
        public double getHoursRemaining() { return hoursRemaining; }
        public boolean isReady() { return hoursRemaining <= 0; }
    }
}
