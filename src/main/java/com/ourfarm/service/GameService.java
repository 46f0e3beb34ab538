package com.ourfarm.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ourfarm.config.GameProperties;
import com.ourfarm.model.Animal;
import com.ourfarm.model.Building;
import com.ourfarm.model.Crop;
import com.ourfarm.model.Decoration;
import com.ourfarm.model.EntityStore;
import com.ourfarm.model.Machine;
import com.ourfarm.model.Npc;
import com.ourfarm.model.NpcRelationship;
import com.ourfarm.model.Pet;
import com.ourfarm.model.PlayerState;
import com.ourfarm.model.Sprinkler;
import com.ourfarm.model.Tile;
import com.ourfarm.model.Weather;
import com.ourfarm.model.data.AnimalDefinition;
import com.ourfarm.model.data.NpcDefinition;
import com.ourfarm.model.data.SprinklerDefinition;
import com.ourfarm.model.data.WorldLayout;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Owns the world and its tick loop. Spring runs {@link #gameLoop()} on its
 * single scheduler thread; that thread is the only one that touches the
 * {@link EntityStore}. Socket threads just queue commands.
 */
@Service
public class GameService {

    private static final Logger log = LoggerFactory.getLogger(GameService.class);

    private static final double TIME_UPDATE_INTERVAL = 1.0;

    private final GameProperties properties;
    private final ItemRegistry registry;
    private final PersistenceService persistenceService;
    private final TimeService timeService;
    private final GrowthSimulator growthSimulator;
    private final ProgressionService progressionService;
    private final CatchResolver catchResolver;
    private final ForagingService foragingService;
    private final CommandQueue commandQueue;
    private final SyncBroadcaster broadcaster;
    private final RandomGenerator random;
    private final ObjectMapper mapper = new ObjectMapper();

    private long seed;
    private EntityStore store;
    private WeatherService weatherService;
    private ActionDispatcher dispatcher;

    private long lastTickNanos;
    private double sinceTimeUpdate = 0;

    public GameService(GameProperties properties, ItemRegistry registry, PersistenceService persistenceService,
                       TimeService timeService, GrowthSimulator growthSimulator, ProgressionService progressionService,
                       CatchResolver catchResolver, ForagingService foragingService, CommandQueue commandQueue,
                       SyncBroadcaster broadcaster, RandomGenerator random) {
        this.properties = properties;
        this.registry = registry;
        this.persistenceService = persistenceService;
        this.timeService = timeService;
        this.growthSimulator = growthSimulator;
        this.progressionService = progressionService;
        this.catchResolver = catchResolver;
        this.foragingService = foragingService;
        this.commandQueue = commandQueue;
        this.broadcaster = broadcaster;
        this.random = random;
    }

    /** Loads or creates the world row. A storage failure here aborts startup. */
    @PostConstruct
    public void init() {
        long newSeed = properties.getSeed() != null ? properties.getSeed() : random.nextLong();
        PersistenceService.WorldRecord world = persistenceService.loadOrCreateWorld(properties.getWorldId(), newSeed);
        this.seed = world.getSeed();

        timeService.restore(world.getSeason(), world.getDay(), world.getHour());
        timeService.setPaused(true);
        weatherService = new WeatherService(seed, world.getWeatherRolls(), world.getWeather());

        WorldLayout layout = registry.getLayout();
        List<Tile> tiles = new TerrainGenerator(seed).generate();
        List<Decoration> decorations = new DecorationGenerator(seed).generate(tiles, layout.buildings);
        store = new EntityStore(tiles, decorations);
        populate(layout);
        foragingService.spawnDaily(store, timeService.getSeason());

        dispatcher = new ActionDispatcher(properties.getWorldId(), properties.getStartingCoins(), store, registry,
                progressionService, catchResolver, foragingService, persistenceService, timeService, weatherService,
                broadcaster, random, mapper);

        lastTickNanos = System.nanoTime();
        log.info("World {} ready: seed {}, {} day {}, {}, {} decorations",
                properties.getWorldId(), seed, timeService.getSeason().id(), timeService.getDay(),
                weatherService.getCurrent(), decorations.size());
    }

    private void populate(WorldLayout layout) {
        for (Building b : layout.buildings) store.addBuilding(b);
        for (WorldLayout.Placement m : layout.machines) {
            store.addMachine(new Machine(m.id, m.type, m.x, m.z));
        }
        for (WorldLayout.Placement a : layout.animals) {
            store.addAnimal(new Animal(a.id, a.type, a.x, a.z));
        }
        for (NpcDefinition def : registry.getNpcs()) {
            Npc npc = new Npc(def);
            npc.updateSchedule(timeService.getHour());
            store.addNpc(npc);
        }
    }

    @PreDestroy
    public void cleanup() {
        checkpoint();
        log.info("World {} saved on shutdown", properties.getWorldId());
    }

    @Scheduled(fixedRateString = "${ourfarm.tick-interval-ms:100}")
    public void gameLoop() {
        long now = System.nanoTime();
        double delta = (now - lastTickNanos) / 1_000_000_000.0;
        lastTickNanos = now;
        advance(delta);
    }

    /** One tick: apply queued commands, then move the simulation forward by {@code deltaSeconds} of real time. */
    void advance(double deltaSeconds) {
        for (PlayerCommand command : commandQueue.drainAll()) {
            try {
                dispatcher.dispatch(command);
            } catch (RuntimeException e) {
                log.error("Command {} from {} failed", command.getAction(), command.getConnectionId(), e);
            }
        }
        for (String connectionId : commandQueue.drainClosed()) {
            dispatcher.leave(connectionId);
        }

        // Nobody online: the clock stands still
        timeService.setPaused(store.getPlayerCount() == 0);
        if (timeService.isPaused()) return;

        for (TimeEvent event : timeService.tick(deltaSeconds)) {
            if (event.getType() == TimeEvent.Type.NEW_DAY) {
                onNewDay();
            } else {
                log.info("New season: {}", event.getSeason().id());
            }
        }

        double gameHours = TimeService.toGameHours(deltaSeconds);
        growthSimulator.tick(store.getCrops(), gameHours);
        for (Animal animal : store.getAnimals()) {
            AnimalDefinition def = registry.getAnimal(animal.getType());
            if (def != null) animal.tickHours(gameHours, def.productInterval);
        }
        for (Machine machine : store.getMachines()) machine.tickHours(gameHours);
        for (Npc npc : store.getNpcs()) npc.updateSchedule(timeService.getHour());

        sinceTimeUpdate += deltaSeconds;
        if (sinceTimeUpdate >= TIME_UPDATE_INTERVAL) {
            sinceTimeUpdate = 0;
            broadcastTime();
        }
    }

    void onNewDay() {
        Weather weather = weatherService.onNewDay(timeService.getSeason());
        ObjectNode weatherMsg = mapper.createObjectNode();
        weatherMsg.put("weather", weather.name());
        broadcaster.toAll("weather:update", weatherMsg);

        if (weather.isRaining()) {
            for (Crop crop : store.getCrops()) crop.setWatered(true);
        }
        for (Sprinkler sprinkler : store.getSprinklers()) {
            SprinklerDefinition def = registry.getSprinkler(sprinkler.getType());
            if (def == null) continue;
            for (int[] offset : def.tiles) {
                Crop crop = store.cropAt(sprinkler.getTileX() + offset[0], sprinkler.getTileZ() + offset[1]);
                if (crop != null) crop.setWatered(true);
            }
        }

        for (Animal animal : store.getAnimals()) animal.tickDaily();
        for (Pet pet : store.getPets()) pet.tickDaily();
        for (PlayerState player : store.getPlayers()) player.restoreEnergy();
        for (NpcRelationship rel : store.getRelationships()) {
            rel.setTalkedToday(false);
            rel.setGiftedToday(false);
        }
        try {
            persistenceService.resetDailyRelationships(properties.getWorldId());
        } catch (DataAccessException e) {
            log.error("Failed to reset daily NPC flags", e);
        }

        foragingService.spawnDaily(store, timeService.getSeason());
        checkpoint();

        ObjectNode sync = mapper.createObjectNode();
        sync.put("type", "fullSync");
        sync.set("crops", mapper.valueToTree(store.getCrops()));
        sync.set("animals", mapper.valueToTree(store.getAnimals()));
        sync.set("pets", mapper.valueToTree(store.getPets()));
        sync.set("sprinklers", mapper.valueToTree(store.getSprinklers()));
        sync.set("machines", mapper.valueToTree(store.getMachines()));
        sync.set("forage", mapper.valueToTree(store.getForage()));
        broadcaster.toAll("world:update", sync);
        for (PlayerState player : store.getPlayers()) dispatcher.sendInventory(player);

        log.info("Day {} of {} begins ({})", timeService.getDay(), timeService.getSeason().id(), weather);
    }

    /** Calendar, weather and every online player's progress. Failures are logged and not retried. */
    private void checkpoint() {
        try {
            persistenceService.saveWorld(properties.getWorldId(), timeService.getSeason(), timeService.getDay(),
                    timeService.getHour(), weatherService.getCurrent(), weatherService.getRollCount());
        } catch (DataAccessException e) {
            log.error("Failed to save world {}", properties.getWorldId(), e);
        }
        for (PlayerState player : store.getPlayers()) {
            try {
                persistenceService.savePlayerProgress(player);
            } catch (DataAccessException e) {
                log.error("Failed to save progress of {}", player.getName(), e);
            }
        }
    }

    private void broadcastTime() {
        ObjectNode msg = mapper.createObjectNode();
        msg.put("season", timeService.getSeason().ordinal());
        msg.put("day", timeService.getDay());
        msg.put("hour", timeService.getHour());
        msg.put("isNight", timeService.isNight());
        broadcaster.toAll("time:update", msg);
    }

    public int getPlayerCount() { return store == null ? 0 : store.getPlayerCount(); }
    public long getSeed() { return seed; }
    EntityStore getStore() { return store; }
    WeatherService getWeatherService() { return weatherService; }
}
