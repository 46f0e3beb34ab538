package com.ourfarm.model.item;

import com.ourfarm.model.Quality;

public class ItemStack {
    private String itemId;
    private int quantity;
    private Quality quality;

    public ItemStack() {}

    public ItemStack(String itemId, int quantity, Quality quality) {
        this.itemId = itemId;
        this.quantity = quantity;
        this.quality = quality;
    }

    public String getItemId() { return itemId; }
    public int getQuantity() { return quantity; }
    public Quality getQuality() { return quality; }

    public boolean matches(String itemId, Quality quality) {
        return this.itemId.equals(itemId) && this.quality == quality;
    }

    public void add(int amount) {
        this.quantity += amount;
    }

    public void remove(int amount) {
        this.quantity -= amount;
    }
}
