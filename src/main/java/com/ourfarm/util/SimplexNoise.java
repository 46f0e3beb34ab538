package com.ourfarm.util;

import java.util.SplittableRandom;

/**
 * Seeded 2D simplex noise. The permutation table is shuffled with a
 * splitmix64 generator so the same seed always yields the same field.
 * Output is roughly in [-1, 1].
 */
public class SimplexNoise {

    private static final double F2 = 0.5 * (Math.sqrt(3.0) - 1.0);
    private static final double G2 = (3.0 - Math.sqrt(3.0)) / 6.0;

    private static final int[][] GRAD = {
            {1, 1}, {-1, 1}, {1, -1}, {-1, -1},
            {1, 0}, {-1, 0}, {0, 1}, {0, -1}
    };

    private final int[] perm = new int[512];

    public SimplexNoise(long seed) {
        int[] p = new int[256];
        for (int i = 0; i < 256; i++) p[i] = i;

        SplittableRandom random = new SplittableRandom(seed);
        for (int i = 255; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = p[i];
            p[i] = p[j];
            p[j] = tmp;
        }
        for (int i = 0; i < 512; i++) perm[i] = p[i & 255];
    }

    public double noise(double xin, double yin) {
        double s = (xin + yin) * F2;
        int i = fastFloor(xin + s);
        int j = fastFloor(yin + s);
        double t = (i + j) * G2;
        double x0 = xin - (i - t);
        double y0 = yin - (j - t);

        int i1, j1;
        if (x0 > y0) { i1 = 1; j1 = 0; }
        else { i1 = 0; j1 = 1; }

        double x1 = x0 - i1 + G2;
        double y1 = y0 - j1 + G2;
        double x2 = x0 - 1.0 + 2.0 * G2;
        double y2 = y0 - 1.0 + 2.0 * G2;

        int ii = i & 255;
        int jj = j & 255;
        int gi0 = perm[ii + perm[jj]] & 7;
        int gi1 = perm[ii + i1 + perm[jj + j1]] & 7;
        int gi2 = perm[ii + 1 + perm[jj + 1]] & 7;

        double n0 = corner(gi0, x0, y0);
        double n1 = corner(gi1, x1, y1);
        double n2 = corner(gi2, x2, y2);

        // Scaled so the result stays close to [-1, 1]
        return 70.0 * (n0 + n1 + n2);
    }

    private double corner(int gi, double x, double y) {
        double t = 0.5 - x * x - y * y;
        if (t < 0) return 0.0;
        t *= t;
        return t * t * (GRAD[gi][0] * x + GRAD[gi][1] * y);
    }

    private static int fastFloor(double x) {
        int xi = (int) x;
        return x < xi ? xi - 1 : xi;
    }
}
