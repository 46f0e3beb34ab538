package com.ourfarm.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ourfarm.config.GameProperties;
import com.ourfarm.model.Animal;
import com.ourfarm.model.Crop;
import com.ourfarm.model.CropStage;
import com.ourfarm.model.EntityStore;
import com.ourfarm.model.ForageSpawn;
import com.ourfarm.model.NpcRelationship;
import com.ourfarm.model.PlayerState;
import com.ourfarm.model.Quality;
import com.ourfarm.model.Skill;
import com.ourfarm.model.Tile;
import com.ourfarm.model.TileType;
import com.ourfarm.model.item.ItemStack;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.util.List;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;

/** Drives the whole server through queued commands, the way socket frames arrive. */
class GameServiceTest {

    // Inside the farm clearing, clear of buildings and machines
    private static final int FX = 35;
    private static final int FZ = 32;

    private final ObjectMapper mapper = new ObjectMapper();

    private EmbeddedDatabase db;
    private PersistenceService persistence;
    private CommandQueue queue;
    private RecordingBroadcaster broadcaster;
    private GameService game;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        persistence = new PersistenceService(db);
        game = newGame();
        game.init();
    }

    private GameService newGame() {
        GameProperties props = new GameProperties();
        props.setSeed(42L);
        ItemRegistry registry = new ItemRegistry();
        RandomGenerator random = new SplittableRandom(7);
        ProgressionService progression = new ProgressionService(registry);
        queue = new CommandQueue(props);
        broadcaster = new RecordingBroadcaster();
        return new GameService(props, registry, persistence, new TimeService(), new GrowthSimulator(registry),
                progression, new CatchResolver(registry, random), new ForagingService(registry, progression, random),
                queue, broadcaster, random);
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    private void send(String connectionId, String json) {
        ObjectNode node;
        try {
            node = (ObjectNode) mapper.readTree(json);
        } catch (Exception e) {
            throw new IllegalArgumentException(json, e);
        }
        queue.offer(new PlayerCommand(connectionId, node.get("action").asText(), node));
        game.advance(0.1);
    }

    private PlayerState join(String connectionId, String name) {
        send(connectionId, "{\"action\":\"player:join\",\"name\":\"" + name + "\"}");
        return game.getStore().getPlayer(connectionId);
    }

    private String at(String action, int x, int z, String extra) {
        return "{\"action\":\"" + action + "\",\"x\":" + x + ",\"z\":" + z + extra + "}";
    }

    @Test
    @DisplayName("Joining sends the snapshot to the joiner and announces them to others")
    void joinSendsSnapshot() {
        PlayerState ann = join("c1", "Ann");
        assertNotNull(ann);

        RecordingBroadcaster.Sent state = broadcaster.last("world:state");
        assertEquals("c1", state.target);
        assertEquals(64 * 64, state.payload.get("tiles").size());
        assertEquals(ann.getId(), state.payload.get("playerId").asText());
        assertTrue(state.payload.get("decorations").size() > 0);
        assertEquals(3, state.payload.get("npcs").size());
        assertEquals(0, state.payload.get("time").get("season").asInt());
        assertEquals(500, broadcaster.last("inventory:update").payload.get("coins").asInt());

        join("c2", "Bob");
        RecordingBroadcaster.Sent announced = broadcaster.last("player:join");
        assertEquals("c2", announced.except);
        assertEquals("Bob", announced.payload.get("player").get("name").asText());
        assertEquals(2, game.getPlayerCount());
        assertEquals(2, game.getStore().getPets().size());
    }

    @Test
    void sameNameCannotJoinTwice() {
        join("c1", "Ann");
        assertNull(join("c2", "Ann"));
        assertEquals(1, game.getPlayerCount());
    }

    @Test
    @DisplayName("Till, plant, water and harvest wheat at farming level 0")
    void wheatFromSeedToHarvest() {
        PlayerState ann = join("c1", "Ann");
        EntityStore store = game.getStore();

        send("c1", at("farm:till", FX, FZ, ""));
        assertEquals(TileType.TILLED, store.getTile(FX, FZ).getType());
        assertEquals(98, ann.getEnergy());
        assertEquals(1, broadcaster.updates("tileChange").size());

        send("c1", at("farm:plant", FX, FZ, ",\"cropType\":\"wheat\""));
        Crop crop = store.cropAt(FX, FZ);
        assertNotNull(crop);
        assertEquals(CropStage.SEED, crop.getStage());
        assertEquals(0.0, crop.getGrowth(), 1e-3);
        assertEquals(14, ann.countItem("wheat_seed"));

        send("c1", at("farm:water", FX, FZ, ""));
        assertTrue(crop.isWatered());
        assertEquals(97, ann.getEnergy());

        crop.grow(1.0);
        crop.grow(1.0);
        crop.grow(1.0);
        assertTrue(crop.isHarvestable());

        send("c1", at("farm:harvest", FX, FZ, ""));
        assertNull(store.cropAt(FX, FZ));
        assertEquals(TileType.TILLED, store.getTile(FX, FZ).getType());
        int wheat = ann.countItem("wheat");
        assertTrue(wheat == 1 || wheat == 2);
        assertTrue(ann.hasItem("wheat", wheat, Quality.NORMAL));
        assertEquals(8, ann.getSkill(Skill.FARMING).getXp());

        RecordingBroadcaster.Sent harvested = broadcaster.updates("cropHarvested").get(0);
        assertEquals("NORMAL", harvested.payload.get("quality").asText());
    }

    @Test
    void regrowableCropReturnsToMature() {
        join("c1", "Ann");
        EntityStore store = game.getStore();
        store.getTile(FX, FZ).setType(TileType.TILLED);
        Crop corn = new Crop(FX, FZ, "corn");
        store.addCrop(corn);
        corn.grow(1);
        corn.grow(1);
        corn.grow(1);

        send("c1", at("farm:harvest", FX, FZ, ""));
        assertSame(corn, store.cropAt(FX, FZ));
        assertEquals(CropStage.MATURE, corn.getStage());
        assertEquals(1, broadcaster.updates("cropRegrow").size());
    }

    @Test
    @DisplayName("Rejected commands change nothing")
    void guardsRejectQuietly() {
        PlayerState ann = join("c1", "Ann");
        broadcaster.clear();

        // Water cannot be tilled
        send("c1", at("farm:till", TerrainGenerator.POND_X, TerrainGenerator.POND_Z, ""));
        // Untilled ground cannot be planted
        send("c1", at("farm:plant", FX, FZ, ",\"cropType\":\"wheat\""));
        // No pumpkin seeds in the starter kit
        send("c1", at("farm:till", FX, FZ, ""));
        send("c1", at("farm:plant", FX, FZ, ",\"cropType\":\"pumpkin\""));
        // Outside the grid
        send("c1", at("farm:till", -1, 70, ""));
        send("c1", "{\"action\":\"no:such\"}");

        assertNull(game.getStore().cropAt(FX, FZ));
        assertEquals(1, broadcaster.updates("tileChange").size());
        assertEquals(98, ann.getEnergy());
        assertEquals(15, ann.countItem("wheat_seed"));
    }

    @Test
    void tillingNeedsEnergy() {
        PlayerState ann = join("c1", "Ann");
        ann.setEnergy(1);
        send("c1", at("farm:till", FX, FZ, ""));
        assertNotEquals(TileType.TILLED, game.getStore().getTile(FX, FZ).getType());
        assertEquals(1, ann.getEnergy());
    }

    @Test
    @DisplayName("A failing handler does not stop the rest of the tick")
    void handlerFailureIsContained() {
        PlayerState ann = join("c1", "Ann");
        EntityStore store = game.getStore();
        store.getTile(FX, FZ).setType(TileType.TILLED);
        Crop mystery = new Crop(FX, FZ, "mystery");
        store.addCrop(mystery);
        mystery.grow(1);
        mystery.grow(1);
        mystery.grow(1);

        queue.offer(new PlayerCommand("c1", "farm:harvest", mapper.createObjectNode().put("x", FX).put("z", FZ)));
        queue.offer(new PlayerCommand("c1", "shop:buy", mapper.createObjectNode().put("itemId", "wheat_seed").put("quantity", 1)));
        game.advance(0.1);

        assertEquals(16, ann.countItem("wheat_seed"));
        assertEquals(490, ann.getCoins());
    }

    @Test
    void shopBuyAndSellWithQuality() {
        PlayerState ann = join("c1", "Ann");

        send("c1", "{\"action\":\"shop:buy\",\"itemId\":\"wheat_seed\",\"quantity\":2}");
        assertEquals(480, ann.getCoins());
        assertEquals(17, ann.countItem("wheat_seed"));

        send("c1", "{\"action\":\"shop:buy\",\"itemId\":\"legend\",\"quantity\":1}");
        send("c1", "{\"action\":\"shop:buy\",\"itemId\":\"wheat_seed\",\"quantity\":1000}");
        assertEquals(480, ann.getCoins());

        ann.addItem("wheat", 2, Quality.GOLD);
        send("c1", "{\"action\":\"shop:sell\",\"itemId\":\"wheat\",\"quantity\":2,\"quality\":\"GOLD\"}");
        // floor(25 * 1.5) per unit
        assertEquals(480 + 37 * 2, ann.getCoins());
        assertEquals(0, ann.countItem("wheat"));
        assertEquals(4, ann.getSkill(Skill.FARMING).getXp());

        send("c1", "{\"action\":\"shop:sell\",\"itemId\":\"wheat\",\"quantity\":1}");
        assertEquals(554, ann.getCoins());
    }

    @Test
    void professionBonusRaisesSellPrice() {
        PlayerState ann = join("c1", "Ann");
        ann.addProfession(Skill.FARMING, "tiller");
        ann.addItem("carrot", 1, Quality.NORMAL);
        int before = ann.getCoins();
        send("c1", "{\"action\":\"shop:sell\",\"itemId\":\"carrot\",\"quantity\":1}");
        int carrotPrice = new ItemRegistry().getCrop("carrot").sellPrice;
        assertEquals(before + (int) Math.floor(carrotPrice * 1.1), ann.getCoins());
    }

    @Test
    @DisplayName("Talking raises hearts once per day and is stored immediately")
    void npcTalkIsPersisted() {
        PlayerState ann = join("c1", "Ann");
        join("c2", "Bob");
        broadcaster.clear();

        send("c1", "{\"action\":\"npc:talk\",\"npcId\":\"lily\"}");
        send("c1", "{\"action\":\"npc:talk\",\"npcId\":\"lily\"}");

        NpcRelationship stored = persistence.loadRelationship(ann.getId(), "lily");
        assertEquals(0.2, stored.getHearts(), 1e-9);
        assertTrue(stored.isTalkedToday());

        List<RecordingBroadcaster.Sent> dialogue = broadcaster.updates("npcDialogue");
        assertEquals(2, dialogue.size());
        assertTrue(dialogue.stream().allMatch(s -> s.target.equals("c1")));
        assertEquals("Oh, you must be the new farmer! Welcome to town.", dialogue.get(0).payload.get("text").asText());
    }

    @Test
    void giftsOncePerDay() {
        PlayerState ann = join("c1", "Ann");
        ann.addItem("strawberry", 2, Quality.NORMAL);

        send("c1", "{\"action\":\"npc:gift\",\"npcId\":\"lily\",\"itemId\":\"strawberry\"}");
        send("c1", "{\"action\":\"npc:gift\",\"npcId\":\"lily\",\"itemId\":\"strawberry\"}");

        assertEquals(1, ann.countItem("strawberry"));
        assertEquals(0.8, persistence.loadRelationship(ann.getId(), "lily").getHearts(), 1e-9);
    }

    @Test
    void castingIntoThePond() {
        PlayerState ann = join("c1", "Ann");
        broadcaster.clear();
        send("c1", at("fish:cast", TerrainGenerator.POND_X, TerrainGenerator.POND_Z, ""));

        assertEquals(95, ann.getEnergy());
        int outcomes = broadcaster.updates("fishCaught").size() + broadcaster.updates("fishMiss").size();
        assertEquals(1, outcomes);

        // Dry land is not a fishing spot
        send("c1", at("fish:cast", FX, FZ, ""));
        assertEquals(95, ann.getEnergy());
    }

    @Test
    void baitIsConsumedOnCast() {
        PlayerState ann = join("c1", "Ann");
        ann.addItem("bait", 3, Quality.NORMAL);
        send("c1", at("fish:cast", TerrainGenerator.POND_X, TerrainGenerator.POND_Z, ",\"baitId\":\"bait\""));
        assertEquals(2, ann.countItem("bait"));
    }

    @Test
    void instantAndMachineCrafting() {
        PlayerState ann = join("c1", "Ann");

        send("c1", "{\"action\":\"shop:buy\",\"itemId\":\"sap\",\"quantity\":1}");
        send("c1", "{\"action\":\"craft:start\",\"recipeId\":\"bait\"}");
        assertEquals(5, ann.countItem("bait"));
        assertEquals(0, ann.countItem("sap"));

        ann.addItem("wheat", 1, Quality.NORMAL);
        ann.addItem("wheat", 1, Quality.SILVER);
        // Wrong machine type
        send("c1", "{\"action\":\"craft:start\",\"recipeId\":\"flour\",\"machineId\":\"oven_1\"}");
        assertEquals(2, ann.countItem("wheat"));

        send("c1", "{\"action\":\"craft:start\",\"recipeId\":\"flour\",\"machineId\":\"mill_1\"}");
        assertEquals(0, ann.countItem("wheat"));
        assertEquals(1, broadcaster.updates("machineStarted").size());

        // Not ready yet
        send("c1", "{\"action\":\"craft:collect\",\"machineId\":\"mill_1\"}");
        assertEquals(0, ann.countItem("flour"));

        game.advance(2 * 60);
        send("c1", "{\"action\":\"craft:collect\",\"machineId\":\"mill_1\"}");
        assertEquals(1, ann.countItem("flour"));
        assertTrue(game.getStore().getMachine("mill_1").isIdle());
    }

    @Test
    void toolUpgradeCostsCoinsAndBars() {
        PlayerState ann = join("c1", "Ann");
        ann.addItem("copper_bar", 5, Quality.NORMAL);

        send("c1", "{\"action\":\"tool:upgrade\",\"tool\":\"hoe\"}");
        assertEquals(0, ann.getToolTier("hoe"));

        ann.earnCoins(2000);
        send("c1", "{\"action\":\"tool:upgrade\",\"tool\":\"hoe\"}");
        assertEquals(1, ann.getToolTier("hoe"));
        assertEquals(500, ann.getCoins());
        assertEquals(0, ann.countItem("copper_bar"));
    }

    @Test
    void animalsAndPets() {
        PlayerState ann = join("c1", "Ann");
        PlayerState bob = join("c2", "Bob");
        Animal chicken = game.getStore().getAnimal("chicken_1");

        send("c1", "{\"action\":\"animal:feed\",\"animalId\":\"chicken_1\"}");
        assertTrue(chicken.isFedToday());
        assertEquals(70, chicken.getHappiness(), 1e-9);

        chicken.tickHours(24, 24);
        send("c1", "{\"action\":\"animal:collect\",\"animalId\":\"chicken_1\"}");
        assertTrue(ann.hasItem("egg", 1, Quality.NORMAL));
        assertFalse(chicken.isProductReady());
        assertEquals(5, ann.getSkill(Skill.FARMING).getXp());

        String annPet = "pet_" + ann.getId();
        double loyalty = game.getStore().getPet(annPet).getLoyalty();
        send("c2", "{\"action\":\"pet:interact\",\"petId\":\"" + annPet + "\",\"interaction\":\"pet\"}");
        assertEquals(loyalty, game.getStore().getPet(annPet).getLoyalty(), 1e-9);
        assertNotNull(bob);
    }

    @Test
    void ownerCanPetTheirPet() {
        PlayerState ann = join("c1", "Ann");
        String petId = "pet_" + ann.getId();
        send("c1", "{\"action\":\"pet:interact\",\"petId\":\"" + petId + "\",\"interaction\":\"pet\"}");
        assertEquals(0.5, game.getStore().getPet(petId).getLoyalty(), 1e-9);
        assertEquals(1, broadcaster.updates("petUpdate").size());
    }

    @Test
    void choosingAProfession() {
        PlayerState ann = join("c1", "Ann");
        send("c1", "{\"action\":\"profession:choose\",\"skill\":\"farming\",\"professionId\":\"tiller\"}");
        assertFalse(ann.hasProfession("tiller"));

        new ProgressionService(new ItemRegistry()).addSkillXP(ann, Skill.FARMING, 1500);
        send("c1", "{\"action\":\"profession:choose\",\"skill\":\"farming\",\"professionId\":\"tiller\"}");
        assertTrue(ann.hasProfession("tiller"));
        assertTrue(broadcaster.last("inventory:update").payload.get("pendingProfession").isNull());
    }

    @Test
    void walkingOverForagePicksItUp() {
        PlayerState ann = join("c1", "Ann");
        ForageSpawn spawn = game.getStore().getForage().iterator().next();

        send("c1", "{\"action\":\"player:move\",\"x\":" + (spawn.getTileX() + 0.5) + ",\"z\":" + (spawn.getTileZ() + 0.5) + "}");
        assertEquals(spawn.getTileX() + 0.5, ann.getX(), 1e-9);
        assertTrue(ann.hasItem(spawn.getItemId(), 1));
        assertEquals(7, ann.getSkill(Skill.FORAGING).getXp());
        assertEquals(1, broadcaster.updates("forageCollected").size());
    }

    @Test
    void movingOffTheGridIsRejected() {
        PlayerState ann = join("c1", "Ann");
        send("c1", "{\"action\":\"player:move\",\"x\":-3,\"z\":10}");
        assertEquals(32, ann.getX(), 1e-9);
    }

    @Test
    @DisplayName("Day rollover restores energy, waters by sprinkler and checkpoints the world")
    void dayRollover() {
        PlayerState ann = join("c1", "Ann");
        EntityStore store = game.getStore();

        store.getTile(FX, FZ).setType(TileType.TILLED);
        Crop crop = new Crop(FX, FZ, "pumpkin");
        store.addCrop(crop);
        ann.addItem("sprinkler", 1, Quality.NORMAL);
        send("c1", at("farm:placeSprinkler", FX + 1, FZ, ",\"sprinklerType\":\"sprinkler\""));
        assertNotNull(store.sprinklerAt(FX + 1, FZ));

        send("c1", "{\"action\":\"npc:talk\",\"npcId\":\"lily\"}");
        ann.useEnergy(50);
        broadcaster.clear();

        // 18 game-hours from 06:00 reaches midnight
        game.advance(18 * 60);

        assertEquals(1, broadcaster.events("weather:update").size());
        List<RecordingBroadcaster.Sent> sync = broadcaster.updates("fullSync");
        assertEquals(1, sync.size());
        assertEquals(1, sync.get(0).payload.get("sprinklers").size());
        assertTrue(crop.isWatered());
        assertEquals(ann.getMaxEnergy(), ann.getEnergy());

        assertEquals(2, new PersistenceService(db).loadOrCreateWorld("world_main", 0).getDay());
        assertFalse(persistence.loadRelationship(ann.getId(), "lily").isTalkedToday());
        assertFalse(store.getRelationship(ann.getId(), "lily").isTalkedToday());
    }

    @Test
    void clockPausesWithNobodyOnline() {
        game.advance(600);
        assertTrue(broadcaster.events("time:update").isEmpty());

        join("c1", "Ann");
        game.advance(1.0);
        assertFalse(broadcaster.events("time:update").isEmpty());
    }

    @Test
    void leavingSavesProgressAndNotifiesOthers() {
        PlayerState ann = join("c1", "Ann");
        join("c2", "Bob");
        ann.getSkill(Skill.FISHING).setXp(42);

        queue.markClosed("c1");
        game.advance(0.1);

        assertEquals(1, game.getPlayerCount());
        RecordingBroadcaster.Sent left = broadcaster.last("player:leave");
        assertEquals("c1", left.except);
        assertEquals(ann.getId(), left.payload.get("playerId").asText());
        assertEquals(42, persistence.loadSkills(ann.getId()).get("fishing").getXp());
    }

    @Test
    @DisplayName("A restarted server finds the same world and player progress")
    void restartRestoresWorld() {
        PlayerState ann = join("c1", "Ann");
        ann.getSkill(Skill.FARMING).setLevel(2);
        long seed = game.getSeed();
        TileType farmTile = game.getStore().getTile(FX, FZ).getType();
        game.cleanup();

        GameService restarted = newGame();
        restarted.init();
        assertEquals(seed, restarted.getSeed());
        assertEquals(64 * 64, restarted.getStore().getTiles().size());
        assertEquals(farmTile, restarted.getStore().getTile(FX, FZ).getType());

        game = restarted;
        PlayerState again = join("c1", "Ann");
        assertEquals(ann.getId(), again.getId());
        assertEquals(2, again.getSkillLevel(Skill.FARMING));
        assertEquals(104, again.getMaxEnergy());
        List<ItemStack> inventory = again.getInventory();
        assertEquals(15, inventory.stream().filter(s -> s.getItemId().equals("wheat_seed")).mapToInt(ItemStack::getQuantity).sum());
    }

    @Test
    @DisplayName("Huge trade quantities are refused instead of wrapping the coin total")
    void tradeQuantityCannotOverflowCoins() {
        PlayerState ann = join("c1", "Ann");

        send("c1", "{\"action\":\"shop:buy\",\"itemId\":\"wheat_seed\",\"quantity\":429496730}");
        assertEquals(500, ann.getCoins());
        assertEquals(15, ann.countItem("wheat_seed"));

        // Within the trade limit but unaffordable
        send("c1", "{\"action\":\"shop:buy\",\"itemId\":\"wheat_seed\",\"quantity\":999}");
        assertEquals(500, ann.getCoins());

        ann.addItem("pumpkin", 400_000_000, Quality.NORMAL);
        send("c1", "{\"action\":\"shop:sell\",\"itemId\":\"pumpkin\",\"quantity\":400000000}");
        assertEquals(500, ann.getCoins());
        assertEquals(400_000_000, ann.countItem("pumpkin"));

        ann.earnCoins(Integer.MAX_VALUE);
        send("c1", "{\"action\":\"shop:sell\",\"itemId\":\"pumpkin\",\"quantity\":999}");
        assertEquals(Integer.MAX_VALUE, ann.getCoins());
    }

    @Test
    @DisplayName("A profession earned before disconnecting is offered again on rejoin")
    void pendingProfessionSurvivesReconnect() {
        PlayerState ann = join("c1", "Ann");
        new ProgressionService(new ItemRegistry()).addSkillXP(ann, Skill.FARMING, 1500);
        queue.markClosed("c1");
        game.advance(0.1);

        PlayerState again = join("c3", "Ann");
        assertEquals("farming", again.getPendingProfession().getSkill());
        assertEquals("farming", broadcaster.last("inventory:update").payload.get("pendingProfession").get("skill").asText());

        send("c3", "{\"action\":\"profession:choose\",\"skill\":\"farming\",\"professionId\":\"tiller\"}");
        assertTrue(again.hasProfession("tiller"));
        assertNull(again.getPendingProfession());
    }

    @Test
    void forecastPositionSurvivesRestart() {
        join("c1", "Ann");
        game.advance(18 * 60);
        long rolls = game.getWeatherService().getRollCount();
        assertEquals(1, rolls);
        game.cleanup();

        GameService restarted = newGame();
        restarted.init();
        assertEquals(rolls, restarted.getWeatherService().getRollCount());
        assertEquals(game.getWeatherService().getCurrent(), restarted.getWeatherService().getCurrent());
    }

    @Test
    @DisplayName("Seed 42: wheat planted beside open water sprouts and harvests at NORMAL quality")
    void wheatBesideWater() {
        PlayerState ann = join("c1", "Ann");
        EntityStore store = game.getStore();
        Tile field = null;
        for (Tile t : store.getTiles()) {
            if (t.getType().isTillable() && !store.isBuildingAt(t.getX(), t.getZ())
                    && store.machineAt(t.getX(), t.getZ()) == null && besideWater(store, t.getX(), t.getZ())) {
                field = t;
                break;
            }
        }
        assertNotNull(field);
        int x = field.getX(), z = field.getZ();

        send("c1", at("farm:till", x, z, ""));
        send("c1", at("farm:plant", x, z, ",\"cropType\":\"wheat\""));
        Crop crop = store.cropAt(x, z);
        assertEquals(CropStage.SEED, crop.getStage());
        assertEquals(0.0, crop.getGrowth(), 1e-9);

        // growthTime * 24 / 3 game-hours covers one stage
        crop.setWatered(true);
        new GrowthSimulator(new ItemRegistry()).tick(List.of(crop), 4 * 24 / 3.0);
        assertEquals(CropStage.SPROUT, crop.getStage());
        assertEquals(0.0, crop.getGrowth(), 1e-9);

        crop.grow(1);
        crop.grow(1);
        send("c1", at("farm:harvest", x, z, ""));
        assertNull(store.cropAt(x, z));
        assertTrue(ann.hasItem("wheat", 1, Quality.NORMAL));
    }

    private static boolean besideWater(EntityStore store, int x, int z) {
        int[][] around = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};
        for (int[] d : around) {
            Tile n = store.getTile(x + d[0], z + d[1]);
            if (n != null && n.getType() == TileType.WATER) return true;
        }
        return false;
    }
}
