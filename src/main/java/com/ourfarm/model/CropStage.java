package com.ourfarm.model;

public enum CropStage {
    SEED, SPROUT, MATURE, HARVESTABLE;

    /** Next stage, or this one when already harvestable. */
    public CropStage next() {
        return this == HARVESTABLE ? HARVESTABLE : values()[ordinal() + 1];
    }
}
