package com.ourfarm.util;

/**
 * Stateless per-coordinate hashing on top of the splitmix64 finalizer.
 * Used wherever a generator needs an independent, reproducible value for a
 * tile without carrying generator state between tiles.
 */
public final class SeededHash {

    private SeededHash() {}

    public static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }

    /** Uniform value in [0, 1) for (seed, x, z, salt). */
    public static double unit(long seed, int x, int z, int salt) {
        long h = mix(seed + 0x9e3779b97f4a7c15L * (salt + 1));
        h = mix(h ^ ((long) x * 0x632be59bd9b4e019L));
        h = mix(h ^ ((long) z * 0x85157af5L));
        return (h >>> 11) * 0x1.0p-53;
    }
}
