package com.ourfarm.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ourfarm.model.data.AnimalDefinition;
import com.ourfarm.model.data.BaitDefinition;
import com.ourfarm.model.data.CropDefinition;
import com.ourfarm.model.data.FertilizerDefinition;
import com.ourfarm.model.data.FishDefinition;
import com.ourfarm.model.data.ItemDefinition;
import com.ourfarm.model.data.NpcDefinition;
import com.ourfarm.model.data.ProfessionDefinition;
import com.ourfarm.model.data.RecipeDefinition;
import com.ourfarm.model.data.SprinklerDefinition;
import com.ourfarm.model.data.ToolUpgradeDefinition;
import com.ourfarm.model.data.WorldLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Static game definitions (crops, fish, items, recipes, ...) loaded from the
 * JSON files under {@code data/} on the classpath.
 */
@Service
public class ItemRegistry {

    private static final Logger log = LoggerFactory.getLogger(ItemRegistry.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Map<String, ItemDefinition> items;
    private final Map<String, CropDefinition> crops;
    private final List<FishDefinition> fish;
    private final Map<String, AnimalDefinition> animals;
    private final List<NpcDefinition> npcs;
    private final Map<String, RecipeDefinition> recipes;
    private final Map<String, FertilizerDefinition> fertilizers;
    private final Map<String, SprinklerDefinition> sprinklers;
    private final Map<String, BaitDefinition> baits;
    private final Map<String, ProfessionDefinition> professions;
    private final Map<String, ToolUpgradeDefinition> toolUpgrades;
    private final WorldLayout layout;

    public ItemRegistry() {
        this.items = index(read("items.json", new TypeReference<List<ItemDefinition>>() {}), d -> d.id);
        this.crops = index(read("crops.json", new TypeReference<List<CropDefinition>>() {}), d -> d.id);
        this.fish = Collections.unmodifiableList(read("fish.json", new TypeReference<List<FishDefinition>>() {}));
        this.animals = index(read("animals.json", new TypeReference<List<AnimalDefinition>>() {}), d -> d.type);
        this.npcs = Collections.unmodifiableList(read("npcs.json", new TypeReference<List<NpcDefinition>>() {}));
        this.recipes = index(read("recipes.json", new TypeReference<List<RecipeDefinition>>() {}), d -> d.id);
        this.fertilizers = index(read("fertilizers.json", new TypeReference<List<FertilizerDefinition>>() {}), d -> d.id);
        this.sprinklers = index(read("sprinklers.json", new TypeReference<List<SprinklerDefinition>>() {}), d -> d.id);
        this.baits = index(read("baits.json", new TypeReference<List<BaitDefinition>>() {}), d -> d.id);
        this.professions = index(read("professions.json", new TypeReference<List<ProfessionDefinition>>() {}), d -> d.id);
        this.toolUpgrades = index(read("tool_upgrades.json", new TypeReference<List<ToolUpgradeDefinition>>() {}), d -> String.valueOf(d.tier));
        this.layout = read("layout.json", new TypeReference<WorldLayout>() {});

        log.info("Loaded game data: {} items, {} crops, {} fish, {} recipes, {} npcs",
                items.size(), crops.size(), fish.size(), recipes.size(), npcs.size());
    }

    private <T> T read(String file, TypeReference<T> type) {
        String path = "/data/" + file;
        try (InputStream in = ItemRegistry.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Missing game data resource " + path);
            }
            return mapper.readValue(in, type);
        } catch (IOException e) {
            throw new IllegalStateException("Unreadable game data resource " + path, e);
        }
    }

    private static <T> Map<String, T> index(List<T> defs, Function<T, String> key) {
        Map<String, T> map = new LinkedHashMap<>();
        for (T def : defs) map.put(key.apply(def), def);
        return Collections.unmodifiableMap(map);
    }

    public CropDefinition getCrop(String id) { return crops.get(id); }
    public List<FishDefinition> getFish() { return fish; }
    public AnimalDefinition getAnimal(String type) { return animals.get(type); }
    public List<NpcDefinition> getNpcs() { return npcs; }
    public RecipeDefinition getRecipe(String id) { return recipes.get(id); }
    public FertilizerDefinition getFertilizer(String id) { return fertilizers.get(id); }
    public SprinklerDefinition getSprinkler(String id) { return sprinklers.get(id); }
    public BaitDefinition getBait(String id) { return baits.get(id); }
    public ProfessionDefinition getProfession(String id) { return professions.get(id); }
    public Map<String, ProfessionDefinition> getProfessions() { return professions; }
    public ToolUpgradeDefinition getToolUpgrade(int tier) { return toolUpgrades.get(String.valueOf(tier)); }
    public WorldLayout getLayout() { return layout; }

    public FishDefinition getFishById(String id) {
        for (FishDefinition f : fish) {
            if (f.id.equals(id)) return f;
        }
        return null;
    }

    /**
     * Base sell price: crops, fish and items each carry their own; anything
     * unknown sells for 10.
     */
    public int getSellPrice(String itemId) {
        CropDefinition crop = crops.get(itemId);
        if (crop != null) return crop.sellPrice;
        FishDefinition f = getFishById(itemId);
        if (f != null) return f.sellPrice;
        ItemDefinition item = items.get(itemId);
        if (item != null) return item.sellPrice;
        return 10;
    }

    /**
     * Shop price of one unit, or -1 when the shop does not sell it. Seeds
     * take the price of their crop.
     */
    public int getBuyPrice(String itemId) {
        if (itemId.endsWith("_seed")) {
            CropDefinition crop = crops.get(itemId.substring(0, itemId.length() - "_seed".length()));
            if (crop != null) return crop.buyPrice;
        }
        ItemDefinition item = items.get(itemId);
        if (item != null && item.buyPrice > 0) return item.buyPrice;
        return -1;
    }

    /** Item category used for sell bonuses: crop, fish, animal_product, ... */
    public String getCategory(String itemId) {
        if (crops.containsKey(itemId)) return "crop";
        if (getFishById(itemId) != null) return "fish";
        ItemDefinition item = items.get(itemId);
        return item != null ? item.category : "misc";
    }
}
