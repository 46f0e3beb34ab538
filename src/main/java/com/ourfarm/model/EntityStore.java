package com.ourfarm.model;

import com.ourfarm.config.GameConstants;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every mutable world collection. Only the tick thread writes here, so
 * apart from the player map (read by the health endpoint) nothing is
 * synchronized.
 */
public class EntityStore {

    private final Tile[] tiles;
    private final List<Decoration> decorations;

    private final Map<String, Crop> crops = new LinkedHashMap<>();
    private final Map<Integer, Crop> cropsByTile = new HashMap<>();
    private final Map<String, PlayerState> players = new ConcurrentHashMap<>();
    private final Map<String, Animal> animals = new LinkedHashMap<>();
    private final Map<String, Pet> pets = new LinkedHashMap<>();
    private final List<Npc> npcs = new ArrayList<>();
    private final Map<String, Sprinkler> sprinklers = new LinkedHashMap<>();
    private final Map<String, Machine> machines = new LinkedHashMap<>();
    private final List<Building> buildings = new ArrayList<>();
    private final Map<String, ForageSpawn> forage = new LinkedHashMap<>();
    private final Map<String, NpcRelationship> relationships = new HashMap<>();

    public EntityStore(List<Tile> generatedTiles, List<Decoration> decorations) {
        int size = GameConstants.WORLD_SIZE;
        if (generatedTiles.size() != size * size) {
            throw new IllegalArgumentException("Expected " + size * size + " tiles, got " + generatedTiles.size());
        }
        this.tiles = new Tile[size * size];
        for (Tile t : generatedTiles) {
            int idx = index(t.getX(), t.getZ());
            if (tiles[idx] != null) {
                throw new IllegalArgumentException("Duplicate tile at " + t.getX() + "," + t.getZ());
            }
            tiles[idx] = t;
        }
        this.decorations = Collections.unmodifiableList(new ArrayList<>(decorations));
    }

    // --- TILES ---

    public static boolean isValidTile(int x, int z) {
        return x >= 0 && x < GameConstants.WORLD_SIZE && z >= 0 && z < GameConstants.WORLD_SIZE;
    }

    private static int index(int x, int z) {
        return z * GameConstants.WORLD_SIZE + x;
    }

    /** @return the tile, or null outside the grid */
    public Tile getTile(int x, int z) {
        if (!isValidTile(x, z)) return null;
        return tiles[index(x, z)];
    }

    public List<Tile> getTiles() { return List.of(tiles); }
    public List<Decoration> getDecorations() { return decorations; }

    // --- CROPS ---

    public Crop cropAt(int x, int z) {
        return cropsByTile.get(index(x, z));
    }

    public void addCrop(Crop crop) {
        if (cropAt(crop.getTileX(), crop.getTileZ()) != null) {
            throw new IllegalStateException("Tile already hosts a crop: " + crop.getTileX() + "," + crop.getTileZ());
        }
        crops.put(crop.getId(), crop);
        cropsByTile.put(index(crop.getTileX(), crop.getTileZ()), crop);
    }

    public void removeCrop(Crop crop) {
        crops.remove(crop.getId());
        cropsByTile.remove(index(crop.getTileX(), crop.getTileZ()));
    }

    public Collection<Crop> getCrops() { return crops.values(); }

    // --- PLAYERS ---

    public PlayerState getPlayer(String connectionId) { return players.get(connectionId); }
    public void addPlayer(PlayerState player) { players.put(player.getConnectionId(), player); }
    public PlayerState removePlayer(String connectionId) { return players.remove(connectionId); }
    public Collection<PlayerState> getPlayers() { return players.values(); }
    public int getPlayerCount() { return players.size(); }

    // --- ANIMALS & PETS ---

    public void addAnimal(Animal animal) { animals.put(animal.getId(), animal); }
    public Animal getAnimal(String id) { return animals.get(id); }
    public Collection<Animal> getAnimals() { return animals.values(); }

    public void addPet(Pet pet) { pets.put(pet.getId(), pet); }
    public Pet getPet(String id) { return pets.get(id); }
    public Collection<Pet> getPets() { return pets.values(); }

    public boolean hasPet(String ownerId) {
        for (Pet p : pets.values()) {
            if (p.getOwnerId().equals(ownerId)) return true;
        }
        return false;
    }

    // --- NPCS ---

    public void addNpc(Npc npc) { npcs.add(npc); }
    public List<Npc> getNpcs() { return npcs; }

    public Npc getNpc(String id) {
        for (Npc n : npcs) {
            if (n.getId().equals(id)) return n;
        }
        return null;
    }

    public NpcRelationship getRelationship(String playerId, String npcId) {
        return relationships.get(playerId + "|" + npcId);
    }

    public void putRelationship(NpcRelationship rel) {
        relationships.put(rel.getPlayerId() + "|" + rel.getNpcId(), rel);
    }

    public Collection<NpcRelationship> getRelationships() { return relationships.values(); }

    // --- PLACEABLES ---

    public void addSprinkler(Sprinkler s) { sprinklers.put(s.getId(), s); }
    public Collection<Sprinkler> getSprinklers() { return sprinklers.values(); }

    public Sprinkler sprinklerAt(int x, int z) {
        for (Sprinkler s : sprinklers.values()) {
            if (s.getTileX() == x && s.getTileZ() == z) return s;
        }
        return null;
    }

    public void addMachine(Machine m) { machines.put(m.getId(), m); }
    public Machine getMachine(String id) { return machines.get(id); }
    public Collection<Machine> getMachines() { return machines.values(); }

    public Machine machineAt(int x, int z) {
        for (Machine m : machines.values()) {
            if (m.getTileX() == x && m.getTileZ() == z) return m;
        }
        return null;
    }

    public void addBuilding(Building b) { buildings.add(b); }
    public List<Building> getBuildings() { return buildings; }

    public boolean isBuildingAt(int x, int z) {
        for (Building b : buildings) {
            if (b.covers(x, z)) return true;
        }
        return false;
    }

    // --- FORAGE ---

    public void clearForage() { forage.clear(); }
    public void addForage(ForageSpawn spawn) { forage.put(spawn.getId(), spawn); }
    public Collection<ForageSpawn> getForage() { return forage.values(); }

    /** Removes and returns the spawn on this tile, if any. */
    public ForageSpawn takeForageAt(int x, int z) {
        for (ForageSpawn spawn : forage.values()) {
            if (spawn.getTileX() == x && spawn.getTileZ() == z) {
                forage.remove(spawn.getId());
                return spawn;
            }
        }
        return null;
    }
}
