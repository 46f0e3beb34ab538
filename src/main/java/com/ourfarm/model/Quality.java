package com.ourfarm.model;

/** Product quality tier; the multiplier scales sell price. */
public enum Quality {
    NORMAL(1.0), SILVER(1.25), GOLD(1.5), IRIDIUM(2.0);

    private final double priceMultiplier;

    Quality(double priceMultiplier) {
        this.priceMultiplier = priceMultiplier;
    }

    public double getPriceMultiplier() { return priceMultiplier; }
}
