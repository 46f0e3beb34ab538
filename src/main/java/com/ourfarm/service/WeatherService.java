package com.ourfarm.service;

import com.ourfarm.model.Season;
import com.ourfarm.model.Weather;

import java.util.EnumMap;
import java.util.Map;
import java.util.SplittableRandom;

/**
 * Rolls one weather per day. The draw depends only on the world seed and the
 * number of rolls so far, so a restored world replays the same forecast.
 */
public class WeatherService {

    private static final Map<Season, double[]> PROBABILITIES = new EnumMap<>(Season.class);

    static {
        // sunny, cloudy, rainy, stormy, snowy
        PROBABILITIES.put(Season.SPRING, new double[]{0.40, 0.25, 0.30, 0.05, 0.00});
        PROBABILITIES.put(Season.SUMMER, new double[]{0.60, 0.20, 0.15, 0.05, 0.00});
        PROBABILITIES.put(Season.FALL,   new double[]{0.35, 0.30, 0.25, 0.10, 0.00});
        PROBABILITIES.put(Season.WINTER, new double[]{0.25, 0.25, 0.10, 0.05, 0.35});
    }

    private final long seed;
    private long rollCount;
    private Weather current;

    public WeatherService(long seed, long rollCount, Weather current) {
        this.seed = seed;
        this.rollCount = rollCount;
        this.current = current;
    }

    public Weather onNewDay(Season season) {
        rollCount++;
        double rand = new SplittableRandom(seed + rollCount).nextDouble();
        double[] p = PROBABILITIES.get(season);

        double cumulative = 0;
        Weather[] kinds = Weather.values();
        for (int i = 0; i < kinds.length; i++) {
            cumulative += p[i];
            if (rand < cumulative) {
                current = kinds[i];
                break;
            }
        }
        return current;
    }

    public boolean isRaining() {
        return current.isRaining();
    }

    public Weather getCurrent() { return current; }
    public long getRollCount() { return rollCount; }
}
