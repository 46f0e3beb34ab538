package com.ourfarm.service;

import com.ourfarm.model.Crop;
import com.ourfarm.model.data.CropDefinition;
import com.ourfarm.model.data.FertilizerDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Advances crop growth. Three stage transitions separate SEED from
 * HARVESTABLE, so a crop gains 3 / (growthTime * 24) progress per game-hour
 * before watering and fertilizer multipliers.
 */
@Service
public class GrowthSimulator {

    private static final Logger log = LoggerFactory.getLogger(GrowthSimulator.class);

    private static final double STAGE_TRANSITIONS = 3.0;
    private static final double WATERED_RATE = 1.5;

    private final ItemRegistry registry;

    public GrowthSimulator(ItemRegistry registry) {
        this.registry = registry;
    }

    /** @return the crops whose stage advanced during this pass */
    public List<Crop> tick(Collection<Crop> crops, double gameHoursElapsed) {
        List<Crop> advanced = new ArrayList<>();
        for (Crop crop : crops) {
            CropDefinition def = registry.getCrop(crop.getCropType());
            if (def == null) {
                log.warn("Crop {} has unknown type {}", crop.getId(), crop.getCropType());
                continue;
            }
            if (crop.grow(progressFor(crop, def, gameHoursElapsed))) {
                advanced.add(crop);
            }
        }
        return advanced;
    }

    double progressFor(Crop crop, CropDefinition def, double gameHours) {
        double rate = crop.isWatered() ? WATERED_RATE : 1.0;
        double speedMult = 1.0;
        if (crop.getFertilizer() != null) {
            FertilizerDefinition fert = registry.getFertilizer(crop.getFertilizer());
            if (fert != null) speedMult += fert.speedBonus;
        }
        double totalGrowthHours = def.growthTime * 24;
        double progressPerHour = STAGE_TRANSITIONS / totalGrowthHours;
        return gameHours * progressPerHour * rate * speedMult;
    }
}
