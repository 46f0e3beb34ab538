package com.ourfarm.service;

import com.ourfarm.model.Tile;
import com.ourfarm.model.TileType;
import com.ourfarm.util.SimplexNoise;

import java.util.ArrayList;
import java.util.List;

import static com.ourfarm.config.GameConstants.WORLD_SIZE;

/**
 * Builds the tile grid from the world seed. Pure: the same seed always
 * produces the same grid, so tiles never need to be stored.
 */
public class TerrainGenerator {

    public static final int POND_X = 20;
    public static final int POND_Z = 44;
    private static final double POND_RADIUS = 3.5;

    // Region boundaries in tiles
    private static final int NORTH_BAND = WORLD_SIZE / 4;
    private static final int EAST_BAND = (int) (WORLD_SIZE * 0.7);
    private static final int WEST_BAND = (int) (WORLD_SIZE * 0.2);

    private final SimplexNoise noise;
    private final SimplexNoise pondNoise;

    public TerrainGenerator(long seed) {
        this.noise = new SimplexNoise(seed);
        this.pondNoise = new SimplexNoise(seed ^ 0x5DEECE66DL);
    }

    public List<Tile> generate() {
        List<Tile> tiles = new ArrayList<>(WORLD_SIZE * WORLD_SIZE);
        double center = WORLD_SIZE / 2.0;

        for (int z = 0; z < WORLD_SIZE; z++) {
            for (int x = 0; x < WORLD_SIZE; x++) {
                double h = heightAt(x, z);

                double dx = (x - center) / center;
                double dz = (z - center) / center;
                double distFromCenter = Math.sqrt(dx * dx + dz * dz);

                TileType type = baseType(x, z, h, distFromCenter);

                // Fixed zones override the noise
                TileType pond = pondType(x, z);
                if (pond != null) {
                    type = pond;
                } else if (isCorridor(x, z, distFromCenter)) {
                    type = TileType.PATH;
                }

                double height = Math.max(type == TileType.WATER ? -0.3 : 0, h * 0.5);
                tiles.add(new Tile(x, z, type, height));
            }
        }
        return tiles;
    }

    /** Three octaves of simplex noise, normalised to roughly [-1, 1]. */
    double heightAt(int x, int z) {
        double nx = (double) x / WORLD_SIZE;
        double nz = (double) z / WORLD_SIZE;
        double h = 0;
        h += 1.0 * noise.noise(nx * 8, nz * 8);
        h += 0.5 * noise.noise(2 * nx * 8, 2 * nz * 8);
        h += 0.25 * noise.noise(4 * nx * 8, 4 * nz * 8);
        return h / 1.75;
    }

    private TileType baseType(int x, int z, double h, double distFromCenter) {
        if (distFromCenter < 0.25) {
            // Farm clearing is always workable ground
            return h < 0.1 ? TileType.DIRT : TileType.GRASS;
        }
        if (h < -0.3) return TileType.WATER;
        if (h < -0.15) return TileType.SAND;
        if (z < NORTH_BAND) return TileType.PATH;
        if (x > EAST_BAND) return h < 0.2 ? TileType.WATER : TileType.GRASS;
        if (x < WEST_BAND) return h > 0.2 ? TileType.STONE : TileType.GRASS;
        return TileType.GRASS;
    }

    /** WATER inside the perturbed pond, SAND on its shore, null elsewhere. */
    private TileType pondType(int x, int z) {
        double dx = x - POND_X;
        double dz = z - POND_Z;
        double dist = Math.sqrt(dx * dx + dz * dz);
        double radius = POND_RADIUS + pondNoise.noise(x * 0.3, z * 0.3) * 1.2;
        if (dist <= 0.5 || dist < radius) return TileType.WATER;
        if (dist < radius + 1.0) return TileType.SAND;
        return null;
    }

    /** North corridor to town and east corridor to the river band. */
    private boolean isCorridor(int x, int z, double distFromCenter) {
        if (distFromCenter < 0.25) return false;
        int c = WORLD_SIZE / 2;
        boolean north = (x == c - 1 || x == c) && z >= NORTH_BAND && z < c;
        boolean east = (z == c - 1 || z == c) && x > c && x <= EAST_BAND;
        return north || east;
    }

    /** Water tiles east of the river boundary count as river, the rest as pond. */
    public static String fishingLocation(int x, int z) {
        return x > EAST_BAND ? "river" : "pond";
    }
}
