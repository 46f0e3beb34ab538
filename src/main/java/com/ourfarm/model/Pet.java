package com.ourfarm.model;

import java.util.random.RandomGenerator;

public class Pet {
    private final String id;
    private final String ownerId;
    private final String type;
    private final String name;
    private double energy = 100;
    private double happiness = 50;
    private double loyalty = 0;
    private double skill = 0;
    private final double bodySize;
    private final double earSize;
    private final double tailLength;
    private final int color;
    private final double x;
    private final double z;

    public Pet(String id, String ownerId, String type, String name, double x, double z, RandomGenerator random) {
        this.id = id;
        this.ownerId = ownerId;
        this.type = type;
        this.name = name != null ? name : type;
        this.x = x;
        this.z = z;
        this.bodySize = 0.2 + random.nextDouble() * 0.1;
        this.earSize = 0.08 + random.nextDouble() * 0.05;
        this.tailLength = 0.15 + random.nextDouble() * 0.1;
        this.color = random.nextInt(0x1000000);
    }

    public void feed() {
        energy = Math.min(100, energy + 30);
        happiness = Math.min(100, happiness + 10);
    }

    public void pet() {
        happiness = Math.min(100, happiness + 15);
        loyalty = Math.min(100, loyalty + 0.5);
    }

    /** @return false when the pet is too tired to train */
    public boolean train(RandomGenerator random) {
        if (energy < 20) return false;
        energy -= 20;
        skill = Math.min(100, skill + 2 + random.nextDouble() * 3);
        loyalty = Math.min(100, loyalty + 1);
        return true;
    }

    public void tickDaily() {
        energy = Math.max(0, energy - 10);
        happiness = Math.max(0, happiness - 5);
    }

    public String getId() { return id; }
    public String getOwnerId() { return ownerId; }
    public String getType() { return type; }
    public String getName() { return name; }
    public double getEnergy() { return energy; }
    public double getHappiness() { return happiness; }
    public double getLoyalty() { return loyalty; }
    public double getSkill() { return skill; }
    public double getBodySize() { return bodySize; }
    public double getEarSize() { return earSize; }
    public double getTailLength() { return tailLength; }
    public int getColor() { return color; }
    public double getX() { return x; }
    public double getZ() { return z; }
}
