package com.ourfarm.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public class Animal {
    private final String id;
    private final String type;
    private final double x;
    private final double z;
    private double happiness = 50;
    private boolean fedToday = false;
    private boolean productReady = false;
    private double hoursSinceProduct = 0;

    public Animal(String id, String type, double x, double z) {
        this.id = id;
        this.type = type;
        this.x = x;
        this.z = z;
    }

    public void feed() {
        fedToday = true;
        happiness = Math.min(100, happiness + 20);
    }

    /** Only fed animals work toward their next product. */
    public void tickHours(double hours, double productInterval) {
        if (!fedToday || productReady) return;
        hoursSinceProduct += hours;
        if (hoursSinceProduct >= productInterval) {
            productReady = true;
        }
    }

    public void tickDaily() {
        if (!fedToday) happiness = Math.max(0, happiness - 15);
        fedToday = false;
    }

    /** @return the quality of the collected product, or null if none was ready */
    public Quality collectProduct() {
        if (!productReady) return null;
        productReady = false;
        hoursSinceProduct = 0;
        return happiness > 80 ? Quality.SILVER : Quality.NORMAL;
    }

    public String getId() { return id; }
    public String getType() { return type; }
    public double getX() { return x; }
    public double getZ() { return z; }
    public double getHappiness() { return happiness; }
    public boolean isFedToday() { return fedToday; }
    public boolean isProductReady() { return productReady; }
    @JsonIgnore
    public double getHoursSinceProduct() { return hoursSinceProduct; }

    public void setHappiness(double happiness) { this.happiness = Math.max(0, Math.min(100, happiness)); }
}
