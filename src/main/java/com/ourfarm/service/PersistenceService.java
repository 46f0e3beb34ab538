package com.ourfarm.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ourfarm.model.NpcRelationship;
import com.ourfarm.model.PlayerState;
import com.ourfarm.model.Season;
import com.ourfarm.model.SkillProgress;
import com.ourfarm.model.Weather;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Durable state: the world row (seed, calendar, weather), player identities
 * with their skills and professions, and NPC relationships. Crops, animals
 * and inventories live only in memory.
 *
 * <p>All calls are synchronous and run on the tick thread. Failures surface
 * as Spring {@code DataAccessException}s; callers decide whether they are
 * fatal.
 */
@Service
public class PersistenceService {

    private static final Logger log = LoggerFactory.getLogger(PersistenceService.class);

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;
    private final ObjectMapper mapper = new ObjectMapper();

    public PersistenceService(DataSource dataSource) {
        this.jdbc = new JdbcTemplate(dataSource);
        this.tx = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    // --- WORLD ---

    /** Loads the world row, creating it with {@code newSeed} on first boot. */
    public WorldRecord loadOrCreateWorld(String worldId, long newSeed) {
        return tx.execute(status -> {
            List<WorldRecord> rows = jdbc.query(
                    "SELECT seed, season, game_day, game_hour, weather, weather_rolls FROM worlds WHERE id = ?",
                    (rs, i) -> new WorldRecord(worldId, rs.getLong("seed"),
                            Season.fromIndex(rs.getInt("season")), rs.getInt("game_day"),
                            rs.getDouble("game_hour"), Weather.valueOf(rs.getString("weather")),
                            rs.getLong("weather_rolls")),
                    worldId);
            if (!rows.isEmpty()) {
                log.info("Loaded world {} (seed {})", worldId, rows.get(0).getSeed());
                return rows.get(0);
            }
            WorldRecord created = new WorldRecord(worldId, newSeed, Season.SPRING, 1, 6.0, Weather.SUNNY, 0);
            jdbc.update("INSERT INTO worlds (id, seed, season, game_day, game_hour, weather) VALUES (?, ?, ?, ?, ?, ?)",
                    worldId, newSeed, 0, 1, 6.0, Weather.SUNNY.name());
            log.info("Created world {} with seed {}", worldId, newSeed);
            return created;
        });
    }

    /** Calendar, weather and the forecast position; the seed never changes. */
    public void saveWorld(String worldId, Season season, int day, double hour, Weather weather, long weatherRolls) {
        jdbc.update("UPDATE worlds SET season = ?, game_day = ?, game_hour = ?, weather = ?, weather_rolls = ? WHERE id = ?",
                season.ordinal(), day, hour, weather.name(), weatherRolls, worldId);
    }

    // --- PLAYERS ---

    /**
     * Finds a player by name in this world or registers a new one.
     *
     * @return the durable identity with professions; {@code created} tells a first join
     */
    public PlayerRecord loadOrCreatePlayer(String worldId, String name) {
        return tx.execute(status -> {
            List<PlayerRecord> rows = jdbc.query(
                    "SELECT id, professions FROM players WHERE world_id = ? AND name = ?",
                    (rs, i) -> new PlayerRecord(rs.getString("id"), readProfessions(rs.getString("professions")), false),
                    worldId, name);
            if (!rows.isEmpty()) return rows.get(0);

            String id = UUID.randomUUID().toString();
            jdbc.update("INSERT INTO players (id, world_id, name, professions) VALUES (?, ?, ?, ?)",
                    id, worldId, name, "{}");
            log.info("Registered player {} as {}", name, id);
            return new PlayerRecord(id, new LinkedHashMap<>(), true);
        });
    }

    public Map<String, SkillProgress> loadSkills(String playerId) {
        Map<String, SkillProgress> skills = new LinkedHashMap<>();
        jdbc.query("SELECT skill, level, xp FROM player_skills WHERE player_id = ?",
                rs -> {
                    skills.put(rs.getString("skill"), new SkillProgress(rs.getInt("level"), rs.getInt("xp")));
                },
                playerId);
        return skills;
    }

    /** Skills and professions in one transaction. */
    public void savePlayerProgress(PlayerState player) {
        String professions = writeProfessions(player.getProfessions());
        tx.executeWithoutResult(status -> {
            jdbc.update("UPDATE players SET professions = ? WHERE id = ?", professions, player.getId());
            for (Map.Entry<String, SkillProgress> e : player.getSkills().entrySet()) {
                int updated = jdbc.update("UPDATE player_skills SET level = ?, xp = ? WHERE player_id = ? AND skill = ?",
                        e.getValue().getLevel(), e.getValue().getXp(), player.getId(), e.getKey());
                if (updated == 0) {
                    jdbc.update("INSERT INTO player_skills (player_id, skill, level, xp) VALUES (?, ?, ?, ?)",
                            player.getId(), e.getKey(), e.getValue().getLevel(), e.getValue().getXp());
                }
            }
        });
    }

    // --- NPC RELATIONSHIPS ---

    /** @return the stored relationship, or null if the player never met this NPC */
    public NpcRelationship loadRelationship(String playerId, String npcId) {
        List<NpcRelationship> rows = jdbc.query(
                "SELECT hearts, talked_today, gifted_today FROM npc_relationships WHERE player_id = ? AND npc_id = ?",
                (rs, i) -> new NpcRelationship(playerId, npcId, rs.getDouble("hearts"),
                        rs.getBoolean("talked_today"), rs.getBoolean("gifted_today")),
                playerId, npcId);
        return rows.isEmpty() ? null : rows.get(0);
    }

    public void saveRelationship(NpcRelationship rel) {
        tx.executeWithoutResult(status -> {
            int updated = jdbc.update(
                    "UPDATE npc_relationships SET hearts = ?, talked_today = ?, gifted_today = ? WHERE player_id = ? AND npc_id = ?",
                    rel.getHearts(), rel.isTalkedToday(), rel.isGiftedToday(), rel.getPlayerId(), rel.getNpcId());
            if (updated == 0) {
                jdbc.update("INSERT INTO npc_relationships (player_id, npc_id, hearts, talked_today, gifted_today) VALUES (?, ?, ?, ?, ?)",
                        rel.getPlayerId(), rel.getNpcId(), rel.getHearts(), rel.isTalkedToday(), rel.isGiftedToday());
            }
        });
    }

    /** Clears the once-per-day flags of every player in the world. */
    public int resetDailyRelationships(String worldId) {
        return jdbc.update("UPDATE npc_relationships SET talked_today = FALSE, gifted_today = FALSE "
                + "WHERE player_id IN (SELECT id FROM players WHERE world_id = ?)", worldId);
    }

    // --- JSON COLUMNS ---

    private Map<String, List<String>> readProfessions(String json) {
        if (json == null || json.isEmpty()) return new LinkedHashMap<>();
        try {
            return mapper.readValue(json, new TypeReference<LinkedHashMap<String, List<String>>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Unreadable professions column '{}', starting empty", json);
            return new LinkedHashMap<>();
        }
    }

    private String writeProfessions(Map<String, List<String>> professions) {
        try {
            return mapper.writeValueAsString(professions);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize professions", e);
        }
    }

    public static class WorldRecord {
        private final String id;
        private final long seed;
        private final Season season;
        private final int day;
        private final double hour;
        private final Weather weather;
        private final long weatherRolls;

        public WorldRecord(String id, long seed, Season season, int day, double hour, Weather weather,
                           long weatherRolls) {
            this.id = id;
            this.seed = seed;
            this.season = season;
            this.day = day;
            this.hour = hour;
            this.weather = weather;
            this.weatherRolls = weatherRolls;
        }

        public String getId() { return id; }
        public long getSeed() { return seed; }
        public Season getSeason() { return season; }
        public int getDay() { return day; }
        public double getHour() { return hour; }
        public Weather getWeather() { return weather; }
        public long getWeatherRolls() { return weatherRolls; }
    }

    public static class PlayerRecord {
        private final String id;
        private final Map<String, List<String>> professions;
        private final boolean created;

        public PlayerRecord(String id, Map<String, List<String>> professions, boolean created) {
            this.id = id;
            this.professions = professions;
            this.created = created;
        }

        public String getId() { return id; }
        public Map<String, List<String>> getProfessions() { return professions; }
        public boolean isCreated() { return created; }
    }
}
