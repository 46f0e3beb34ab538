package com.ourfarm.service;

import com.ourfarm.model.EntityStore;
import com.ourfarm.model.ForageSpawn;
import com.ourfarm.model.PlayerState;
import com.ourfarm.model.Quality;
import com.ourfarm.model.Season;
import com.ourfarm.model.Skill;
import com.ourfarm.model.Tile;
import com.ourfarm.model.TileType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

/** Seasonal wild items that appear each morning and are picked up by walking over them. */
@Service
public class ForagingService {

    private static final Logger log = LoggerFactory.getLogger(ForagingService.class);

    static final int SPAWNS_PER_DAY = 6;
    static final int FORAGE_XP = 7;

    private final ItemRegistry registry;
    private final ProgressionService progression;
    private final RandomGenerator random;

    public ForagingService(ItemRegistry registry, ProgressionService progression, RandomGenerator random) {
        this.registry = registry;
        this.progression = progression;
        this.random = random;
    }

    /** Replaces yesterday's spawns with fresh ones on free grass tiles. */
    public void spawnDaily(EntityStore store, Season season) {
        store.clearForage();
        List<String> pool = registry.getLayout().forage.get(season.id());
        if (pool == null || pool.isEmpty()) return;

        List<Tile> free = new ArrayList<>();
        for (Tile t : store.getTiles()) {
            if (t.getType() != TileType.GRASS) continue;
            if (store.isBuildingAt(t.getX(), t.getZ())) continue;
            free.add(t);
        }
        if (free.isEmpty()) return;

        for (int i = 0; i < SPAWNS_PER_DAY; i++) {
            Tile tile = free.remove(random.nextInt(free.size()));
            String itemId = pool.get(random.nextInt(pool.size()));
            store.addForage(new ForageSpawn("forage_" + i + "_" + tile.getX() + "_" + tile.getZ(),
                    itemId, tile.getX(), tile.getZ()));
            if (free.isEmpty()) break;
        }
        log.debug("Spawned {} forage items for {}", store.getForage().size(), season.id());
    }

    /** @return the spawn the player picked up, or null if the tile is empty */
    public ForageSpawn collectAt(EntityStore store, PlayerState player, int x, int z) {
        ForageSpawn spawn = store.takeForageAt(x, z);
        if (spawn == null) return null;
        int quantity = random.nextDouble() < progression.getProfessionBonus(player, "forageDoubleChance") ? 2 : 1;
        player.addItem(spawn.getItemId(), quantity, Quality.NORMAL);
        progression.addSkillXP(player, Skill.FORAGING, FORAGE_XP);
        return spawn;
    }
}
