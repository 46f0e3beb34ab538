package com.ourfarm.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ourfarm.config.GameConstants;
import com.ourfarm.model.Animal;
import com.ourfarm.model.Crop;
import com.ourfarm.model.CropStage;
import com.ourfarm.model.EntityStore;
import com.ourfarm.model.ForageSpawn;
import com.ourfarm.model.Machine;
import com.ourfarm.model.Npc;
import com.ourfarm.model.NpcRelationship;
import com.ourfarm.model.Pet;
import com.ourfarm.model.PlayerState;
import com.ourfarm.model.Quality;
import com.ourfarm.model.Skill;
import com.ourfarm.model.SkillProgress;
import com.ourfarm.model.Sprinkler;
import com.ourfarm.model.Tile;
import com.ourfarm.model.TileType;
import com.ourfarm.model.data.AnimalDefinition;
import com.ourfarm.model.data.BaitDefinition;
import com.ourfarm.model.data.CropDefinition;
import com.ourfarm.model.data.FishDefinition;
import com.ourfarm.model.data.RecipeDefinition;
import com.ourfarm.model.data.ToolUpgradeDefinition;
import com.ourfarm.model.item.ItemStack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.util.HashMap;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Validates and applies player commands. Every handler follows the same
 * shape: check the guards, mutate the {@link EntityStore}, then tell the
 * clients. A failed guard drops the command with a debug log line and
 * leaves the world untouched.
 *
 * <p>Runs only on the tick thread.
 */
public class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    static final int SELL_XP_PER_UNIT = 2;
    static final int ANIMAL_PRODUCT_XP = 5;

    private static final Map<String, String> SELL_BONUS_BY_CATEGORY = Map.of(
            "crop", "cropSellBonus",
            "fish", "fishSellBonus",
            "animal_product", "animalSellBonus",
            "processed", "processedSellBonus",
            "forage", "forageSellBonus",
            "bar", "barSellBonus",
            "ore", "oreSellBonus");

    @FunctionalInterface
    interface Handler {
        void handle(String connectionId, JsonNode payload);
    }

    private final String worldId;
    private final int startingCoins;
    private final EntityStore store;
    private final ItemRegistry registry;
    private final ProgressionService progression;
    private final CatchResolver catchResolver;
    private final ForagingService foraging;
    private final PersistenceService persistence;
    private final TimeService time;
    private final WeatherService weather;
    private final SyncBroadcaster broadcaster;
    private final RandomGenerator random;
    private final ObjectMapper mapper;

    private final Map<String, Handler> handlers = new HashMap<>();

    public ActionDispatcher(String worldId, int startingCoins, EntityStore store, ItemRegistry registry,
                            ProgressionService progression, CatchResolver catchResolver, ForagingService foraging,
                            PersistenceService persistence, TimeService time, WeatherService weather,
                            SyncBroadcaster broadcaster, RandomGenerator random, ObjectMapper mapper) {
        this.worldId = worldId;
        this.startingCoins = startingCoins;
        this.store = store;
        this.registry = registry;
        this.progression = progression;
        this.catchResolver = catchResolver;
        this.foraging = foraging;
        this.persistence = persistence;
        this.time = time;
        this.weather = weather;
        this.broadcaster = broadcaster;
        this.random = random;
        this.mapper = mapper;

        handlers.put("player:join", this::join);
        handlers.put("player:move", this::move);
        handlers.put("farm:till", this::till);
        handlers.put("farm:plant", this::plant);
        handlers.put("farm:water", this::water);
        handlers.put("farm:harvest", this::harvest);
        handlers.put("farm:fertilize", this::fertilize);
        handlers.put("farm:placeSprinkler", this::placeSprinkler);
        handlers.put("fish:cast", this::fishCast);
        handlers.put("fish:reel", this::fishReel);
        handlers.put("shop:buy", this::shopBuy);
        handlers.put("shop:sell", this::shopSell);
        handlers.put("npc:talk", this::npcTalk);
        handlers.put("npc:gift", this::npcGift);
        handlers.put("craft:start", this::craftStart);
        handlers.put("craft:collect", this::craftCollect);
        handlers.put("tool:upgrade", this::toolUpgrade);
        handlers.put("animal:feed", this::animalFeed);
        handlers.put("animal:collect", this::animalCollect);
        handlers.put("pet:interact", this::petInteract);
        handlers.put("profession:choose", this::chooseProfession);
    }

    /** Runs one command to completion. Unknown actions are dropped. */
    public void dispatch(PlayerCommand command) {
        Handler handler = handlers.get(command.getAction());
        if (handler == null) {
            log.debug("Unknown action '{}' from {}", command.getAction(), command.getConnectionId());
            return;
        }
        handler.handle(command.getConnectionId(), command.getPayload());
    }

    // --- CONNECTION ---

    void join(String connectionId, JsonNode p) {
        if (store.getPlayer(connectionId) != null) {
            reject("player:join", connectionId, "already joined");
            return;
        }
        String name = text(p, "name");
        if (name == null || name.isBlank()) name = "Farmer";
        for (PlayerState other : store.getPlayers()) {
            if (other.getName().equals(name)) {
                reject("player:join", connectionId, "name " + name + " is already online");
                return;
            }
        }

        PersistenceService.PlayerRecord record = persistence.loadOrCreatePlayer(worldId, name);
        PlayerState player = new PlayerState(record.getId(), name, startingCoins);
        player.setConnectionId(connectionId);
        player.getProfessions().putAll(record.getProfessions());
        for (Map.Entry<String, SkillProgress> e : persistence.loadSkills(record.getId()).entrySet()) {
            player.getSkills().put(e.getKey(), e.getValue());
        }
        player.increaseMaxEnergy(GameConstants.MAX_ENERGY_PER_LEVEL * player.getLevel());
        player.increaseMaxEnergy((int) progression.getProfessionBonus(player, "maxEnergy"));
        player.restoreEnergy();
        progression.refreshPendingProfession(player);
        player.giveStarterKit();
        store.addPlayer(player);

        if (!store.hasPet(player.getId())) {
            String petType = registry.getLayout().starterPet;
            store.addPet(new Pet("pet_" + player.getId(), player.getId(), petType, null,
                    player.getX() + 1, player.getZ() + 1, random));
        }

        broadcaster.toPlayer(connectionId, "world:state", snapshot(player.getId()));
        ObjectNode joined = mapper.createObjectNode();
        joined.set("player", mapper.valueToTree(player));
        broadcaster.toOthers(connectionId, "player:join", joined);
        sendInventory(player);

        log.info("{} joined ({} players online)", name, store.getPlayerCount());
    }

    /** Removes the player and checkpoints their progress. */
    public void leave(String connectionId) {
        PlayerState player = store.removePlayer(connectionId);
        if (player == null) return;
        try {
            persistence.savePlayerProgress(player);
        } catch (DataAccessException e) {
            log.error("Failed to save progress of {} on disconnect", player.getName(), e);
        }
        ObjectNode left = mapper.createObjectNode();
        left.put("playerId", player.getId());
        broadcaster.toOthers(connectionId, "player:leave", left);
        log.info("{} left ({} players online)", player.getName(), store.getPlayerCount());
    }

    // --- MOVEMENT ---

    void move(String connectionId, JsonNode p) {
        PlayerState player = store.getPlayer(connectionId);
        if (player == null || !has(p, "x", "z")) {
            reject("player:move", connectionId, "no player or position");
            return;
        }
        double x = p.get("x").asDouble();
        double z = p.get("z").asDouble();
        int tx = (int) Math.floor(x);
        int tz = (int) Math.floor(z);
        if (!EntityStore.isValidTile(tx, tz)) {
            reject("player:move", connectionId, "outside the world");
            return;
        }
        player.setX(x);
        player.setZ(z);

        ObjectNode update = update("playerMove");
        update.put("playerId", player.getId());
        update.put("x", x);
        update.put("z", z);
        broadcaster.toAll("world:update", update);

        ForageSpawn picked = foraging.collectAt(store, player, tx, tz);
        if (picked != null) {
            ObjectNode collected = update("forageCollected");
            collected.put("forageId", picked.getId());
            collected.put("playerId", player.getId());
            collected.put("itemId", picked.getItemId());
            broadcaster.toAll("world:update", collected);
            sendInventory(player);
        }
    }

    // --- FARMING ---

    void till(String connectionId, JsonNode p) {
        PlayerState player = store.getPlayer(connectionId);
        Tile tile = player == null ? null : tileAt(p);
        if (tile == null) {
            reject("farm:till", connectionId, "no player or tile");
            return;
        }
        int x = tile.getX(), z = tile.getZ();
        if (!tile.getType().isTillable() || isOccupied(x, z)) {
            reject("farm:till", connectionId, "tile " + x + "," + z + " cannot be tilled");
            return;
        }
        if (!player.useEnergy(GameConstants.TILL_ENERGY)) {
            reject("farm:till", connectionId, "not enough energy");
            return;
        }
        tile.setType(TileType.TILLED);

        ObjectNode update = update("tileChange");
        update.put("x", x);
        update.put("z", z);
        update.put("tileType", TileType.TILLED.name());
        broadcaster.toAll("world:update", update);
        sendInventory(player);
    }

    void plant(String connectionId, JsonNode p) {
        PlayerState player = store.getPlayer(connectionId);
        Tile tile = player == null ? null : tileAt(p);
        String cropType = text(p, "cropType");
        if (tile == null || cropType == null || registry.getCrop(cropType) == null) {
            reject("farm:plant", connectionId, "no player, tile or known crop");
            return;
        }
        int x = tile.getX(), z = tile.getZ();
        if (tile.getType() != TileType.TILLED || store.cropAt(x, z) != null || store.sprinklerAt(x, z) != null) {
            reject("farm:plant", connectionId, "tile " + x + "," + z + " is not free tilled soil");
            return;
        }
        if (!player.removeItem(cropType + "_seed", 1)) {
            reject("farm:plant", connectionId, "no " + cropType + " seeds");
            return;
        }
        Crop crop = new Crop(x, z, cropType);
        store.addCrop(crop);

        ObjectNode update = update("cropPlanted");
        update.set("crop", mapper.valueToTree(crop));
        broadcaster.toAll("world:update", update);
        sendInventory(player);
    }

    void water(String connectionId, JsonNode p) {
        PlayerState player = store.getPlayer(connectionId);
        Tile tile = player == null ? null : tileAt(p);
        Crop crop = tile == null ? null : store.cropAt(tile.getX(), tile.getZ());
        if (crop == null) {
            reject("farm:water", connectionId, "no crop there");
            return;
        }
        if (!player.useEnergy(GameConstants.WATER_ENERGY)) {
            reject("farm:water", connectionId, "not enough energy");
            return;
        }
        crop.setWatered(true);

        ObjectNode update = update("cropWatered");
        update.put("cropId", crop.getId());
        update.put("x", crop.getTileX());
        update.put("z", crop.getTileZ());
        broadcaster.toAll("world:update", update);
        sendInventory(player);
    }

    void harvest(String connectionId, JsonNode p) {
        PlayerState player = store.getPlayer(connectionId);
        Tile tile = player == null ? null : tileAt(p);
        Crop crop = tile == null ? null : store.cropAt(tile.getX(), tile.getZ());
        if (crop == null || !crop.isHarvestable()) {
            reject("farm:harvest", connectionId, "nothing harvestable there");
            return;
        }
        CropDefinition def = registry.getCrop(crop.getCropType());
        if (def == null) {
            throw new IllegalArgumentException("Unknown crop type " + crop.getCropType());
        }

        Quality quality = rollHarvestQuality(player.getSkillLevel(Skill.FARMING));
        int quantity = 1 + random.nextInt(2);
        player.addItem(crop.getCropType(), quantity, quality);
        progression.addSkillXP(player, Skill.FARMING, def.xp);

        ObjectNode update;
        if (def.regrows) {
            crop.resetForRegrow();
            update = update("cropRegrow");
            update.set("crop", mapper.valueToTree(crop));
        } else {
            store.removeCrop(crop);
            update = update("cropHarvested");
            update.put("cropId", crop.getId());
        }
        update.put("x", crop.getTileX());
        update.put("z", crop.getTileZ());
        update.put("quality", quality.name());
        update.put("quantity", quantity);
        broadcaster.toAll("world:update", update);
        sendInventory(player);
    }

    /** One uniform draw against gold, then silver, chances that grow with farming level. */
    Quality rollHarvestQuality(int farmingLevel) {
        double gold = farmingLevel * 0.015;
        double silver = farmingLevel * 0.03;
        double r = random.nextDouble();
        if (r < gold) return Quality.GOLD;
        if (r < silver) return Quality.SILVER;
        return Quality.NORMAL;
    }

    void fertilize(String connectionId, JsonNode p) {
        PlayerState player = store.getPlayer(connectionId);
        Tile tile = player == null ? null : tileAt(p);
        Crop crop = tile == null ? null : store.cropAt(tile.getX(), tile.getZ());
        String fertilizerId = text(p, "fertilizerId");
        if (crop == null || fertilizerId == null || registry.getFertilizer(fertilizerId) == null) {
            reject("farm:fertilize", connectionId, "no crop or unknown fertilizer");
            return;
        }
        if (crop.getFertilizer() != null || crop.getStage() != CropStage.SEED) {
            reject("farm:fertilize", connectionId, "crop already fertilized or past seed");
            return;
        }
        if (!player.removeItem(fertilizerId, 1)) {
            reject("farm:fertilize", connectionId, "no " + fertilizerId);
            return;
        }
        crop.setFertilizer(fertilizerId);

        ObjectNode update = update("cropFertilized");
        update.put("cropId", crop.getId());
        update.put("fertilizer", fertilizerId);
        broadcaster.toAll("world:update", update);
        sendInventory(player);
    }

    void placeSprinkler(String connectionId, JsonNode p) {
        PlayerState player = store.getPlayer(connectionId);
        Tile tile = player == null ? null : tileAt(p);
        String type = text(p, "sprinklerType");
        if (tile == null || type == null || registry.getSprinkler(type) == null) {
            reject("farm:placeSprinkler", connectionId, "no tile or unknown sprinkler");
            return;
        }
        int x = tile.getX(), z = tile.getZ();
        if (tile.getType() == TileType.WATER || isOccupied(x, z) || store.cropAt(x, z) != null) {
            reject("farm:placeSprinkler", connectionId, "tile " + x + "," + z + " is taken");
            return;
        }
        if (!player.removeItem(type, 1)) {
            reject("farm:placeSprinkler", connectionId, "no " + type);
            return;
        }
        Sprinkler sprinkler = new Sprinkler(type, x, z);
        store.addSprinkler(sprinkler);

        ObjectNode update = update("sprinklerPlaced");
        update.set("sprinkler", mapper.valueToTree(sprinkler));
        broadcaster.toAll("world:update", update);
        sendInventory(player);
    }

    // --- FISHING ---

    void fishCast(String connectionId, JsonNode p) {
        PlayerState player = store.getPlayer(connectionId);
        if (player == null || !has(p, "x", "z")) {
            reject("fish:cast", connectionId, "no player or target");
            return;
        }
        int x = (int) Math.floor(p.get("x").asDouble());
        int z = (int) Math.floor(p.get("z").asDouble());
        Tile tile = store.getTile(x, z);
        if (tile == null || tile.getType() != TileType.WATER) {
            reject("fish:cast", connectionId, "not water");
            return;
        }
        if (!player.useEnergy(GameConstants.CAST_ENERGY)) {
            reject("fish:cast", connectionId, "not enough energy");
            return;
        }

        BaitDefinition bait = BaitDefinition.NONE;
        String baitId = text(p, "baitId");
        if (baitId != null && registry.getBait(baitId) != null && player.hasItem(baitId, 1)) {
            bait = registry.getBait(baitId);
            if (random.nextDouble() >= progression.getProfessionBonus(player, "baitSaveChance")) {
                player.removeItem(baitId, 1);
            }
        }
        double professionBoost = progression.getProfessionBonus(player, "rarityBoost");
        if (professionBoost > 0) bait = bait.withExtraBoost(professionBoost);

        FishDefinition fish = catchResolver.rollCatch(TerrainGenerator.fishingLocation(x, z),
                player.getLevel(), player.getSkillLevel(Skill.FISHING), player.getToolTier("fishing_rod"),
                bait, time.getSeason(), time.getHour(), weather.isRaining());

        if (fish != null) {
            player.addItem(fish.id, 1, Quality.NORMAL);
            progression.addSkillXP(player, Skill.FISHING, 5 + fish.rarity * 10);
            CatchResolver.BiteParams bite = catchResolver.rollBiteParams(fish.rarity);

            ObjectNode update = update("fishCaught");
            update.put("playerId", player.getId());
            update.set("fish", mapper.valueToTree(fish));
            update.put("waitTime", bite.getWaitTime());
            update.put("nibbles", bite.getNibbles());
            broadcaster.toAll("world:update", update);
        } else {
            ObjectNode update = update("fishMiss");
            update.put("playerId", player.getId());
            broadcaster.toAll("world:update", update);
        }
        sendInventory(player);
    }

    void fishReel(String connectionId, JsonNode p) {
        PlayerState player = store.getPlayer(connectionId);
        if (player == null) {
            reject("fish:reel", connectionId, "no player");
            return;
        }
        sendInventory(player);
    }

    // --- SHOP ---

    void shopBuy(String connectionId, JsonNode p) {
        PlayerState player = store.getPlayer(connectionId);
        String itemId = text(p, "itemId");
        int quantity = p != null && p.has("quantity") ? p.get("quantity").asInt() : 1;
        if (player == null || itemId == null || quantity < 1 || quantity > GameConstants.MAX_TRADE_QUANTITY) {
            reject("shop:buy", connectionId, "bad request");
            return;
        }
        int price = registry.getBuyPrice(itemId);
        if (price < 0) {
            reject("shop:buy", connectionId, itemId + " is not sold");
            return;
        }
        long cost = (long) price * quantity;
        if (cost > player.getCoins() || !player.spendCoins((int) cost)) {
            reject("shop:buy", connectionId, "not enough coins");
            return;
        }
        player.addItem(itemId, quantity, Quality.NORMAL);
        sendInventory(player);
    }

    void shopSell(String connectionId, JsonNode p) {
        PlayerState player = store.getPlayer(connectionId);
        String itemId = text(p, "itemId");
        int quantity = p != null && p.has("quantity") ? p.get("quantity").asInt() : 1;
        if (player == null || itemId == null || quantity < 1 || quantity > GameConstants.MAX_TRADE_QUANTITY) {
            reject("shop:sell", connectionId, "bad request");
            return;
        }
        Quality quality = null;
        String q = text(p, "quality");
        if (q != null) {
            try {
                quality = Quality.valueOf(q.toUpperCase());
            } catch (IllegalArgumentException e) {
                reject("shop:sell", connectionId, "unknown quality " + q);
                return;
            }
        }
        Quality sold = stackQuality(player, itemId, quantity, quality);
        if (sold == null || !player.removeItem(itemId, quantity, sold)) {
            reject("shop:sell", connectionId, "does not hold " + quantity + " " + itemId);
            return;
        }

        long unitPrice = unitSellPrice(player, itemId, sold);
        player.earnCoins(unitPrice * quantity);
        progression.addSkillXP(player, Skill.FARMING, SELL_XP_PER_UNIT * quantity);
        sendInventory(player);
    }

    int unitSellPrice(PlayerState player, String itemId, Quality quality) {
        String bonusKey = SELL_BONUS_BY_CATEGORY.get(registry.getCategory(itemId));
        double bonus = bonusKey == null ? 0 : progression.getProfessionBonus(player, bonusKey);
        return (int) Math.floor(registry.getSellPrice(itemId) * quality.getPriceMultiplier() * (1 + bonus));
    }

    /** The quality of the first stack that can cover the sale, or null. */
    private static Quality stackQuality(PlayerState player, String itemId, int quantity, Quality wanted) {
        for (ItemStack stack : player.getInventory()) {
            if (stack.getItemId().equals(itemId) && stack.getQuantity() >= quantity
                    && (wanted == null || stack.getQuality() == wanted)) {
                return stack.getQuality();
            }
        }
        return null;
    }

    // --- NPCS ---

    void npcTalk(String connectionId, JsonNode p) {
        PlayerState player = store.getPlayer(connectionId);
        Npc npc = store.getNpc(text(p, "npcId"));
        if (player == null || npc == null) {
            reject("npc:talk", connectionId, "no player or npc");
            return;
        }
        NpcRelationship rel = relationship(player, npc);
        if (!rel.isTalkedToday()) {
            rel.addHearts(GameConstants.TALK_HEARTS);
            rel.setTalkedToday(true);
            flush(rel);
        }

        ObjectNode update = update("npcDialogue");
        update.put("npcId", npc.getId());
        update.put("npcName", npc.getName());
        update.put("text", npc.getDialogue(rel.getHearts()));
        update.put("hearts", rel.getHearts());
        broadcaster.toPlayer(connectionId, "world:update", update);
    }

    void npcGift(String connectionId, JsonNode p) {
        PlayerState player = store.getPlayer(connectionId);
        Npc npc = store.getNpc(text(p, "npcId"));
        String itemId = text(p, "itemId");
        if (player == null || npc == null || itemId == null) {
            reject("npc:gift", connectionId, "no player, npc or item");
            return;
        }
        NpcRelationship rel = relationship(player, npc);
        if (rel.isGiftedToday()) {
            reject("npc:gift", connectionId, "already gifted " + npc.getId() + " today");
            return;
        }
        if (!player.removeItem(itemId, 1)) {
            reject("npc:gift", connectionId, "does not hold " + itemId);
            return;
        }
        double delta = npc.giftDelta(itemId);
        rel.addHearts(delta);
        rel.setGiftedToday(true);
        flush(rel);

        ObjectNode update = update("npcGift");
        update.put("npcId", npc.getId());
        update.put("itemId", itemId);
        update.put("delta", delta);
        update.put("hearts", rel.getHearts());
        broadcaster.toPlayer(connectionId, "world:update", update);
        sendInventory(player);
    }

    /** Memory first, then the database, else a fresh acquaintance. */
    private NpcRelationship relationship(PlayerState player, Npc npc) {
        NpcRelationship rel = store.getRelationship(player.getId(), npc.getId());
        if (rel != null) return rel;
        rel = persistence.loadRelationship(player.getId(), npc.getId());
        if (rel == null) rel = new NpcRelationship(player.getId(), npc.getId(), 0, false, false);
        store.putRelationship(rel);
        return rel;
    }

    private void flush(NpcRelationship rel) {
        try {
            persistence.saveRelationship(rel);
        } catch (DataAccessException e) {
            log.error("Failed to save relationship {} / {}", rel.getPlayerId(), rel.getNpcId(), e);
        }
    }

    // --- CRAFTING ---

    void craftStart(String connectionId, JsonNode p) {
        PlayerState player = store.getPlayer(connectionId);
        RecipeDefinition recipe = registry.getRecipe(text(p, "recipeId"));
        if (player == null || recipe == null) {
            reject("craft:start", connectionId, "no player or recipe");
            return;
        }
        Machine machine = null;
        if (recipe.machine != null) {
            machine = store.getMachine(text(p, "machineId"));
            if (machine == null || !machine.isIdle() || !machine.getType().equals(recipe.machine)) {
                reject("craft:start", connectionId, recipe.id + " needs an idle " + recipe.machine);
                return;
            }
        }
        for (Map.Entry<String, Integer> input : recipe.inputs.entrySet()) {
            if (player.countItem(input.getKey()) < input.getValue()) {
                reject("craft:start", connectionId, "missing " + input.getKey());
                return;
            }
        }
        for (Map.Entry<String, Integer> input : recipe.inputs.entrySet()) {
            consumeAcrossStacks(player, input.getKey(), input.getValue());
        }

        if (machine == null) {
            player.addItem(recipe.output, recipe.outputQuantity, Quality.NORMAL);
            progression.addSkillXP(player, Skill.FARMING, recipe.xp);
        } else {
            machine.startProcessing(recipe.id, recipe.output, recipe.outputQuantity, recipe.hours);
            ObjectNode update = update("machineStarted");
            update.set("machine", mapper.valueToTree(machine));
            broadcaster.toAll("world:update", update);
        }
        sendInventory(player);
    }

    /** Inputs may be spread over several quality stacks. */
    private static void consumeAcrossStacks(PlayerState player, String itemId, int quantity) {
        int remaining = quantity;
        while (remaining > 0) {
            ItemStack stack = null;
            for (ItemStack s : player.getInventory()) {
                if (s.getItemId().equals(itemId)) {
                    stack = s;
                    break;
                }
            }
            if (stack == null) {
                throw new IllegalStateException("Ran out of " + itemId + " while consuming inputs");
            }
            int take = Math.min(remaining, stack.getQuantity());
            player.removeItem(itemId, take, stack.getQuality());
            remaining -= take;
        }
    }

    void craftCollect(String connectionId, JsonNode p) {
        PlayerState player = store.getPlayer(connectionId);
        Machine machine = store.getMachine(text(p, "machineId"));
        if (player == null || machine == null || !machine.isReady()) {
            reject("craft:collect", connectionId, "no finished machine");
            return;
        }
        Machine.Processing done = machine.collect();
        player.addItem(done.getOutputItem(), done.getOutputQuantity(), Quality.NORMAL);
        RecipeDefinition recipe = registry.getRecipe(done.getRecipeId());
        if (recipe != null) progression.addSkillXP(player, Skill.FARMING, recipe.xp);

        ObjectNode update = update("machineCollected");
        update.put("machineId", machine.getId());
        update.put("playerId", player.getId());
        broadcaster.toAll("world:update", update);
        sendInventory(player);
    }

    void toolUpgrade(String connectionId, JsonNode p) {
        PlayerState player = store.getPlayer(connectionId);
        String tool = text(p, "tool");
        if (player == null || tool == null || !player.getToolTiers().containsKey(tool)) {
            reject("tool:upgrade", connectionId, "unknown tool");
            return;
        }
        int next = player.getToolTier(tool) + 1;
        ToolUpgradeDefinition cost = registry.getToolUpgrade(next);
        if (next > GameConstants.MAX_TOOL_TIER || cost == null) {
            reject("tool:upgrade", connectionId, tool + " is fully upgraded");
            return;
        }
        if (player.getCoins() < cost.coins || player.countItem(cost.bar) < cost.bars) {
            reject("tool:upgrade", connectionId, "cannot afford tier " + next);
            return;
        }
        player.spendCoins(cost.coins);
        consumeAcrossStacks(player, cost.bar, cost.bars);
        player.setToolTier(tool, next);
        sendInventory(player);
    }

    // --- ANIMALS & PETS ---

    void animalFeed(String connectionId, JsonNode p) {
        PlayerState player = store.getPlayer(connectionId);
        Animal animal = store.getAnimal(text(p, "animalId"));
        if (player == null || animal == null || animal.isFedToday()) {
            reject("animal:feed", connectionId, "no animal or already fed");
            return;
        }
        animal.feed();

        ObjectNode update = update("animalFed");
        update.set("animal", mapper.valueToTree(animal));
        broadcaster.toAll("world:update", update);
    }

    void animalCollect(String connectionId, JsonNode p) {
        PlayerState player = store.getPlayer(connectionId);
        Animal animal = store.getAnimal(text(p, "animalId"));
        if (player == null || animal == null || !animal.isProductReady()) {
            reject("animal:collect", connectionId, "nothing to collect");
            return;
        }
        AnimalDefinition def = registry.getAnimal(animal.getType());
        if (def == null) {
            throw new IllegalArgumentException("Unknown animal type " + animal.getType());
        }
        Quality quality = animal.collectProduct();
        player.addItem(def.product, 1, quality);
        progression.addSkillXP(player, Skill.FARMING, ANIMAL_PRODUCT_XP);

        ObjectNode update = update("animalCollected");
        update.set("animal", mapper.valueToTree(animal));
        update.put("product", def.product);
        update.put("quality", quality.name());
        broadcaster.toAll("world:update", update);
        sendInventory(player);
    }

    void petInteract(String connectionId, JsonNode p) {
        PlayerState player = store.getPlayer(connectionId);
        Pet pet = store.getPet(text(p, "petId"));
        String interaction = text(p, "interaction");
        if (player == null || pet == null || !pet.getOwnerId().equals(player.getId()) || interaction == null) {
            reject("pet:interact", connectionId, "not the owner's pet");
            return;
        }
        switch (interaction) {
            case "feed":
                pet.feed();
                break;
            case "pet":
                pet.pet();
                break;
            case "train":
                if (!pet.train(random)) {
                    reject("pet:interact", connectionId, "pet too tired to train");
                    return;
                }
                break;
            default:
                reject("pet:interact", connectionId, "unknown pet interaction " + interaction);
                return;
        }
        ObjectNode update = update("petUpdate");
        update.set("pet", mapper.valueToTree(pet));
        broadcaster.toAll("world:update", update);
    }

    void chooseProfession(String connectionId, JsonNode p) {
        PlayerState player = store.getPlayer(connectionId);
        Skill skill = Skill.fromId(text(p, "skill"));
        String professionId = text(p, "professionId");
        if (player == null || skill == null || professionId == null) {
            reject("profession:choose", connectionId, "bad request");
            return;
        }
        if (!progression.chooseProfession(player, skill, professionId)) {
            reject("profession:choose", connectionId, professionId + " is not available");
            return;
        }
        sendInventory(player);
    }

    // --- SYNC ---

    /** Everything a joining client needs to render the world. */
    public ObjectNode snapshot(String playerId) {
        ObjectNode state = mapper.createObjectNode();
        state.put("playerId", playerId);
        state.set("tiles", mapper.valueToTree(store.getTiles()));
        state.set("decorations", mapper.valueToTree(store.getDecorations()));
        state.set("crops", mapper.valueToTree(store.getCrops()));
        state.set("animals", mapper.valueToTree(store.getAnimals()));
        state.set("pets", mapper.valueToTree(store.getPets()));
        state.set("npcs", mapper.valueToTree(store.getNpcs()));
        state.set("players", mapper.valueToTree(store.getPlayers()));
        state.set("buildings", mapper.valueToTree(store.getBuildings()));
        state.set("sprinklers", mapper.valueToTree(store.getSprinklers()));
        state.set("machines", mapper.valueToTree(store.getMachines()));
        state.set("forage", mapper.valueToTree(store.getForage()));
        ObjectNode clock = state.putObject("time");
        clock.put("season", time.getSeason().ordinal());
        clock.put("day", time.getDay());
        clock.put("hour", time.getHour());
        state.putObject("weather").put("weather", weather.getCurrent().name());
        return state;
    }

    public void sendInventory(PlayerState player) {
        ObjectNode inv = mapper.createObjectNode();
        inv.set("inventory", mapper.valueToTree(player.getInventory()));
        inv.put("coins", player.getCoins());
        inv.put("level", player.getLevel());
        inv.set("skills", mapper.valueToTree(player.getSkills()));
        inv.put("energy", player.getEnergy());
        inv.put("maxEnergy", player.getMaxEnergy());
        inv.set("toolTiers", mapper.valueToTree(player.getToolTiers()));
        inv.set("professions", mapper.valueToTree(player.getProfessions()));
        inv.set("pendingProfession", mapper.valueToTree(player.getPendingProfession()));
        broadcaster.toPlayer(player.getConnectionId(), "inventory:update", inv);
    }

    // --- HELPERS ---

    private ObjectNode update(String type) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", type);
        return node;
    }

    private Tile tileAt(JsonNode p) {
        if (!has(p, "x", "z")) return null;
        return store.getTile(p.get("x").asInt(), p.get("z").asInt());
    }

    /** Buildings, machines and sprinklers block the tile. */
    private boolean isOccupied(int x, int z) {
        return store.isBuildingAt(x, z) || store.machineAt(x, z) != null || store.sprinklerAt(x, z) != null;
    }

    private static boolean has(JsonNode p, String... fields) {
        if (p == null) return false;
        for (String f : fields) {
            if (!p.hasNonNull(f)) return false;
        }
        return true;
    }

    private static String text(JsonNode p, String field) {
        if (p == null || !p.hasNonNull(field)) return null;
        return p.get(field).asText();
    }

    private static void reject(String action, String connectionId, String reason) {
        log.debug("Rejected {} from {}: {}", action, connectionId, reason);
    }
}
