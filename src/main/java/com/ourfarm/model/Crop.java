package com.ourfarm.model;

import java.util.UUID;

public class Crop {
    private final String id;
    private final int tileX;
    private final int tileZ;
    private final String cropType;
    private CropStage stage = CropStage.SEED;
    private double growth = 0;
    private boolean watered = false;
    private String fertilizer;

    public Crop(int tileX, int tileZ, String cropType) {
        this(UUID.randomUUID().toString(), tileX, tileZ, cropType);
    }

    public Crop(String id, int tileX, int tileZ, String cropType) {
        this.id = id;
        this.tileX = tileX;
        this.tileZ = tileZ;
        this.cropType = cropType;
    }

    /**
     * Adds growth progress. Crossing 1.0 advances exactly one stage, resets
     * growth to 0 and dries the crop; any excess progress is discarded.
     *
     * @return true if the stage advanced
     */
    public boolean grow(double progress) {
        if (stage == CropStage.HARVESTABLE) return false;
        growth += progress;
        if (growth >= 1.0) {
            growth = 0;
            watered = false;
            stage = stage.next();
            return true;
        }
        return false;
    }

    /** Harvest of a regrowable crop: back to MATURE with fresh progress. */
    public void resetForRegrow() {
        stage = CropStage.MATURE;
        growth = 0;
        watered = false;
    }

    public boolean isHarvestable() { return stage == CropStage.HARVESTABLE; }

    public String getId() { return id; }
    public int getTileX() { return tileX; }
    public int getTileZ() { return tileZ; }
    public String getCropType() { return cropType; }
    public CropStage getStage() { return stage; }
    public double getGrowth() { return growth; }
    public boolean isWatered() { return watered; }
    public String getFertilizer() { return fertilizer; }

    public void setWatered(boolean watered) { this.watered = watered; }
    public void setFertilizer(String fertilizer) { this.fertilizer = fertilizer; }
}
