package com.ourfarm.service;

import com.ourfarm.model.Crop;
import com.ourfarm.model.CropStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GrowthSimulatorTest {

    private final GrowthSimulator growth = new GrowthSimulator(new ItemRegistry());

    @Test
    @DisplayName("Watered wheat sprouts within a third of its growth time")
    void wheatSprouts() {
        Crop crop = new Crop(35, 32, "wheat");
        crop.setWatered(true);
        // wheat: 4 days, 3 stage transitions -> 32 game-hours per stage unwatered
        for (int hour = 0; hour < 32; hour++) {
            growth.tick(List.of(crop), 1.0);
        }
        assertEquals(CropStage.SPROUT, crop.getStage());
        assertTrue(crop.getGrowth() <= 1.0 / 3 + 1e-9);
        assertFalse(crop.isWatered(), "stage change dries the crop");
    }

    @Test
    void unwateredWheatTakesFullStageTime() {
        Crop crop = new Crop(35, 32, "wheat");
        for (int hour = 0; hour < 31; hour++) growth.tick(List.of(crop), 1.0);
        assertEquals(CropStage.SEED, crop.getStage());
        growth.tick(List.of(crop), 1.0);
        assertEquals(CropStage.SPROUT, crop.getStage());
        assertEquals(0.0, crop.getGrowth(), 1e-9);
    }

    @Test
    void stageNeverGoesBackAndStopsAtHarvestable() {
        Crop crop = new Crop(35, 32, "carrot");
        CropStage previous = crop.getStage();
        for (int i = 0; i < 500; i++) {
            crop.setWatered(i % 3 == 0);
            growth.tick(List.of(crop), 0.5);
            assertTrue(crop.getStage().ordinal() >= previous.ordinal());
            assertTrue(crop.getGrowth() >= 0 && crop.getGrowth() < 1.0);
            previous = crop.getStage();
        }
        assertEquals(CropStage.HARVESTABLE, crop.getStage());
    }

    @Test
    void fertilizerSpeedsGrowth() {
        Crop plain = new Crop(1, 1, "potato");
        Crop fed = new Crop(2, 2, "potato");
        fed.setFertilizer("deluxe_speed_gro");
        growth.tick(List.of(plain, fed), 10);
        assertTrue(fed.getGrowth() > plain.getGrowth());
        assertEquals(plain.getGrowth() * 1.25, fed.getGrowth(), 1e-9);
    }

    @Test
    void reportsAdvancedCrops() {
        Crop crop = new Crop(3, 3, "wheat");
        assertTrue(growth.tick(List.of(crop), 31).isEmpty());
        assertEquals(List.of(crop), growth.tick(List.of(crop), 1));
    }

    @Test
    void regrowResetsToMature() {
        Crop crop = new Crop(3, 3, "corn");
        crop.grow(1);
        crop.grow(1);
        crop.grow(1);
        assertTrue(crop.isHarvestable());
        crop.resetForRegrow();
        assertEquals(CropStage.MATURE, crop.getStage());
        assertEquals(0.0, crop.getGrowth());
    }
}
