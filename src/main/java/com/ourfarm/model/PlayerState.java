package com.ourfarm.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.ourfarm.config.GameConstants;
import com.ourfarm.model.item.ItemStack;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class PlayerState {
    private final String id;
    private final String name;
    private String connectionId;
    private double x = GameConstants.WORLD_SIZE / 2.0;
    private double z = GameConstants.WORLD_SIZE / 2.0;

    // --- PLAYER STATS ---
    private int coins;
    private int energy = GameConstants.STARTING_ENERGY;
    private int maxEnergy = GameConstants.STARTING_ENERGY;

    private final List<ItemStack> inventory = new ArrayList<>();
    private final Map<String, SkillProgress> skills = new LinkedHashMap<>();
    private final Map<String, List<String>> professions = new LinkedHashMap<>();
    private final Map<String, Integer> toolTiers = new LinkedHashMap<>();

    // Set when a skill reaches a profession level; cleared once a profession is chosen
    private ProfessionCheckpoint pendingProfession;

    public PlayerState(String id, String name, int coins) {
        this.id = id;
        this.name = name;
        this.coins = coins;
        for (Skill skill : Skill.values()) {
            skills.put(skill.id(), new SkillProgress(0, 0));
        }
        for (String tool : new String[]{"hoe", "watering_can", "pickaxe", "axe", "fishing_rod"}) {
            toolTiers.put(tool, 0);
        }
    }

    public void giveStarterKit() {
        addItem("hoe", 1, Quality.NORMAL);
        addItem("watering_can", 1, Quality.NORMAL);
        addItem("pickaxe", 1, Quality.NORMAL);
        addItem("axe", 1, Quality.NORMAL);
        addItem("fishing_rod", 1, Quality.NORMAL);
        addItem("wheat_seed", 15, Quality.NORMAL);
        addItem("carrot_seed", 10, Quality.NORMAL);
    }

    // --- INVENTORY ---

    public List<ItemStack> getInventory() { return Collections.unmodifiableList(inventory); }

    public void addItem(String itemId, int quantity, Quality quality) {
        if (quantity <= 0) return;
        for (ItemStack stack : inventory) {
            if (stack.matches(itemId, quality)) {
                stack.add(quantity);
                return;
            }
        }
        inventory.add(new ItemStack(itemId, quantity, quality));
    }

    /** Removes from the first stack of any quality holding at least {@code quantity}. */
    public boolean removeItem(String itemId, int quantity) {
        return removeItem(itemId, quantity, null);
    }

    /**
     * Removes {@code quantity} from a single stack. A null quality matches any.
     * Stacks that reach zero are pruned.
     */
    public boolean removeItem(String itemId, int quantity, Quality quality) {
        if (quantity <= 0) return false;
        for (ItemStack stack : inventory) {
            if (stack.getItemId().equals(itemId)
                    && stack.getQuantity() >= quantity
                    && (quality == null || stack.getQuality() == quality)) {
                stack.remove(quantity);
                if (stack.getQuantity() <= 0) inventory.remove(stack);
                return true;
            }
        }
        return false;
    }

    public boolean hasItem(String itemId, int quantity) {
        return hasItem(itemId, quantity, null);
    }

    public boolean hasItem(String itemId, int quantity, Quality quality) {
        for (ItemStack stack : inventory) {
            if (stack.getItemId().equals(itemId)
                    && stack.getQuantity() >= quantity
                    && (quality == null || stack.getQuality() == quality)) {
                return true;
            }
        }
        return false;
    }

    public int countItem(String itemId) {
        int total = 0;
        for (ItemStack stack : inventory) {
            if (stack.getItemId().equals(itemId)) total += stack.getQuantity();
        }
        return total;
    }

    // --- ENERGY ---

    /** @return false, leaving energy untouched, when there is not enough */
    public boolean useEnergy(int amount) {
        if (amount < 0 || amount > energy) return false;
        energy -= amount;
        return true;
    }

    public void restoreEnergy() {
        energy = maxEnergy;
    }

    public void increaseMaxEnergy(int amount) {
        maxEnergy += amount;
    }

    // --- COINS ---

    public boolean spendCoins(int amount) {
        if (amount < 0 || amount > coins) return false;
        coins -= amount;
        return true;
    }

    /** Saturates at {@link Integer#MAX_VALUE}; negative amounts are ignored. */
    public void earnCoins(long amount) {
        if (amount <= 0) return;
        coins = (int) Math.min(Integer.MAX_VALUE, coins + amount);
    }

    // --- SKILLS & PROFESSIONS ---

    public SkillProgress getSkill(Skill skill) {
        return skills.get(skill.id());
    }

    public int getSkillLevel(Skill skill) {
        return skills.get(skill.id()).getLevel();
    }

    public Map<String, SkillProgress> getSkills() { return skills; }

    /** Overall level is the sum of skill levels, never stored. */
    public int getLevel() {
        int total = 0;
        for (SkillProgress s : skills.values()) total += s.getLevel();
        return total;
    }

    public Map<String, List<String>> getProfessions() { return professions; }

    public List<String> getProfessions(Skill skill) {
        return professions.getOrDefault(skill.id(), Collections.emptyList());
    }

    public void addProfession(Skill skill, String professionId) {
        professions.computeIfAbsent(skill.id(), k -> new ArrayList<>()).add(professionId);
    }

    public boolean hasProfession(String professionId) {
        for (List<String> ids : professions.values()) {
            if (ids.contains(professionId)) return true;
        }
        return false;
    }

    public ProfessionCheckpoint getPendingProfession() { return pendingProfession; }
    public void setPendingProfession(ProfessionCheckpoint pendingProfession) { this.pendingProfession = pendingProfession; }

    public Map<String, Integer> getToolTiers() { return toolTiers; }

    public int getToolTier(String tool) {
        return toolTiers.getOrDefault(tool, 0);
    }

    public void setToolTier(String tool, int tier) {
        toolTiers.put(tool, tier);
    }

    // Getters & Setters
    public String getId() { return id; }
    public String getName() { return name; }
    @JsonIgnore
    public String getConnectionId() { return connectionId; }
    public void setConnectionId(String connectionId) { this.connectionId = connectionId; }
    public double getX() { return x; }
    public double getZ() { return z; }
    public void setX(double x) { this.x = x; }
    public void setZ(double z) { this.z = z; }
    public int getCoins() { return coins; }
    public int getEnergy() { return energy; }
    public int getMaxEnergy() { return maxEnergy; }
    public void setEnergy(int energy) { this.energy = Math.max(0, Math.min(maxEnergy, energy)); }
}
