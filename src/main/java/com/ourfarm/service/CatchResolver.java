package com.ourfarm.service;

import com.ourfarm.model.Season;
import com.ourfarm.model.data.BaitDefinition;
import com.ourfarm.model.data.FishDefinition;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Decides which fish bites. Candidates are filtered by location, fishing
 * level, season and time of day, then drawn by rarity weight.
 */
@Service
public class CatchResolver {

    private static final double[] RARITY_WEIGHTS = {1.0, 0.3, 0.1, 0.02};
    private static final double ROD_TIER_BONUS = 0.1;

    private final ItemRegistry registry;
    private final RandomGenerator random;

    public CatchResolver(ItemRegistry registry, RandomGenerator random) {
        this.registry = registry;
        this.random = random;
    }

    /**
     * @param playerLevel overall level; kept for callers, the roll itself gates on the fishing level
     * @return the caught fish, or null when nothing can bite here
     */
    public FishDefinition rollCatch(String location, int playerLevel, int fishingLevel, int rodTier,
                                    BaitDefinition bait, Season season, double hour, boolean isRaining) {
        BaitDefinition b = bait != null ? bait : BaitDefinition.NONE;
        List<FishDefinition> candidates = candidates(location, fishingLevel, b, season, hour, isRaining);
        if (candidates.isEmpty()) return null;

        double[] weights = new double[candidates.size()];
        double total = 0;
        for (int i = 0; i < candidates.size(); i++) {
            weights[i] = weightOf(candidates.get(i), b, rodTier);
            total += weights[i];
        }

        double roll = random.nextDouble() * total;
        for (int i = 0; i < candidates.size(); i++) {
            roll -= weights[i];
            if (roll <= 0) return candidates.get(i);
        }
        return candidates.get(0);
    }

    List<FishDefinition> candidates(String location, int fishingLevel, BaitDefinition bait,
                                    Season season, double hour, boolean isRaining) {
        List<FishDefinition> result = new ArrayList<>();
        for (FishDefinition fish : registry.getFish()) {
            if (!fish.location.equals(location)) continue;
            if (fish.minLevel > fishingLevel) continue;
            if (!bait.ignoreRestrictions) {
                if (!fish.seasons.contains(season.id())) continue;
                if (!matchesTime(fish.time, hour, isRaining)) continue;
            }
            result.add(fish);
        }
        return result;
    }

    static boolean matchesTime(FishDefinition.FishTime time, double hour, boolean isRaining) {
        switch (time) {
            case DAY:
                return hour >= 6 && hour < 20;
            case NIGHT:
                return hour < 6 || hour >= 20;
            case RAIN:
                return isRaining;
            default:
                return true;
        }
    }

    private static double weightOf(FishDefinition fish, BaitDefinition bait, int rodTier) {
        int rarity = Math.max(0, Math.min(RARITY_WEIGHTS.length - 1, fish.rarity));
        double w = RARITY_WEIGHTS[rarity];
        if (rarity >= 1) {
            w *= bait.rarityBoost;
            w *= 1 + ROD_TIER_BONUS * rodTier;
        }
        return w;
    }

    /** Timing for the client's bite mini-game. */
    public BiteParams rollBiteParams(int rarity) {
        double waitTime = 2 + rarity * 0.5 + (1 + random.nextDouble() * 2);
        int nibbles = 1 + (int) Math.floor(random.nextDouble() * (1 + rarity));
        return new BiteParams(waitTime, nibbles);
    }

    public static class BiteParams {
        private final double waitTime;
        private final int nibbles;

        public BiteParams(double waitTime, int nibbles) {
            this.waitTime = waitTime;
            this.nibbles = nibbles;
        }

        public double getWaitTime() { return waitTime; }
        public int getNibbles() { return nibbles; }
    }
}
