package com.ourfarm.service;

import com.ourfarm.model.Building;
import com.ourfarm.model.Decoration;
import com.ourfarm.model.Tile;
import com.ourfarm.model.TileType;
import com.ourfarm.util.SeededHash;

import java.util.ArrayList;
import java.util.List;

import static com.ourfarm.config.GameConstants.WORLD_SIZE;

/**
 * Places trees, rocks, flowers, bushes, reeds and the farm fence. Each tile
 * gets its own hashed value, independent from the terrain noise, so the list
 * can be regenerated on every boot instead of being stored.
 */
public class DecorationGenerator {

    private final long seed;

    public DecorationGenerator(long seed) {
        this.seed = seed;
    }

    private double rand(int x, int z, int salt) {
        return SeededHash.unit(seed, x, z, salt);
    }

    public List<Decoration> generate(List<Tile> tiles, List<Building> buildings) {
        List<Decoration> decorations = new ArrayList<>();
        int cx = WORLD_SIZE / 2, cz = WORLD_SIZE / 2;

        // Farm zone, buildings and crops live here
        int farmLeft = cx - 7, farmRight = cx + 7;
        int farmTop = cz - 6, farmBottom = cz + 6;

        // Town zone
        int townLeft = 24, townRight = 50;
        int townTop = 2, townBottom = 16;

        for (Tile tile : tiles) {
            int x = tile.getX(), z = tile.getZ();
            TileType type = tile.getType();

            if (x >= farmLeft && x <= farmRight && z >= farmTop && z <= farmBottom) continue;
            if (x >= townLeft && x <= townRight && z >= townTop && z <= townBottom) continue;
            if (isBuilding(buildings, x, z)) continue;

            double r = rand(x, z, 0);
            double dx = (x - cx) / (double) cx;
            double dz = (z - cz) / (double) cz;
            double dist = Math.sqrt(dx * dx + dz * dz);

            if (type == TileType.GRASS) {
                // Denser forest toward the edges
                double treeDensity = dist > 0.6 ? 0.25 : 0.08;
                if (r < treeDensity) {
                    int variant = (int) Math.floor(rand(x, z, 1) * 3);
                    decorations.add(new Decoration("tree", x, z, variant, r * Math.PI * 2));
                } else if (r < treeDensity + 0.08) {
                    decorations.add(new Decoration("flower", x, z, 0, r * Math.PI));
                } else if (r < treeDensity + 0.12) {
                    decorations.add(new Decoration("bush", x, z, 0, r * Math.PI * 2));
                }
            } else if (type == TileType.STONE) {
                if (r < 0.4) decorations.add(new Decoration("rock", x, z, 0, r * Math.PI * 2));
            } else if (type == TileType.SAND) {
                if (r < 0.15) decorations.add(new Decoration("reeds", x, z, 0, r * Math.PI * 2));
            }
        }

        // Fence around the crop plot
        int fenceMinX = cx + 1, fenceMaxX = cx + 7;
        int fenceMinZ = cz - 3, fenceMaxZ = cz + 3;
        for (int fx = fenceMinX; fx <= fenceMaxX; fx++) {
            decorations.add(new Decoration("fence", fx, fenceMinZ, 0, 0));
            decorations.add(new Decoration("fence", fx, fenceMaxZ, 0, 0));
        }
        for (int fz = fenceMinZ + 1; fz < fenceMaxZ; fz++) {
            decorations.add(new Decoration("fence", fenceMinX, fz, 0, Math.PI / 2));
            decorations.add(new Decoration("fence", fenceMaxX, fz, 0, Math.PI / 2));
        }

        // Signpost where the north corridor leaves the farm
        decorations.add(new Decoration("signpost", cx - 2, farmTop - 1, 0, 0));

        return decorations;
    }

    private static boolean isBuilding(List<Building> buildings, int x, int z) {
        for (Building b : buildings) {
            if (b.covers(x, z)) return true;
        }
        return false;
    }
}
