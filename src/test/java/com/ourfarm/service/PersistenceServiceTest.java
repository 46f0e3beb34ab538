package com.ourfarm.service;

import com.ourfarm.model.NpcRelationship;
import com.ourfarm.model.PlayerState;
import com.ourfarm.model.Season;
import com.ourfarm.model.Skill;
import com.ourfarm.model.SkillProgress;
import com.ourfarm.model.Weather;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PersistenceServiceTest {

    private EmbeddedDatabase db;
    private PersistenceService persistence;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        persistence = new PersistenceService(db);
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    @Test
    void worldSeedIsCreatedOnceAndNeverChanges() {
        PersistenceService.WorldRecord created = persistence.loadOrCreateWorld("w1", 42);
        assertEquals(42, created.getSeed());
        assertEquals(Season.SPRING, created.getSeason());
        assertEquals(1, created.getDay());
        assertEquals(0, created.getWeatherRolls());

        PersistenceService.WorldRecord loaded = persistence.loadOrCreateWorld("w1", 99);
        assertEquals(42, loaded.getSeed());
    }

    @Test
    void calendarAndWeatherSurviveRestart() {
        persistence.loadOrCreateWorld("w1", 7);
        persistence.saveWorld("w1", Season.FALL, 12, 14.5, Weather.RAINY, 487);

        PersistenceService.WorldRecord loaded = new PersistenceService(db).loadOrCreateWorld("w1", 0);
        assertEquals(Season.FALL, loaded.getSeason());
        assertEquals(12, loaded.getDay());
        assertEquals(14.5, loaded.getHour(), 1e-9);
        assertEquals(Weather.RAINY, loaded.getWeather());
        assertEquals(487, loaded.getWeatherRolls());
    }

    @Test
    void playersAreFoundAgainByName() {
        persistence.loadOrCreateWorld("w1", 1);
        PersistenceService.PlayerRecord first = persistence.loadOrCreatePlayer("w1", "Ann");
        assertTrue(first.isCreated());

        PersistenceService.PlayerRecord again = persistence.loadOrCreatePlayer("w1", "Ann");
        assertFalse(again.isCreated());
        assertEquals(first.getId(), again.getId());
        assertNotEquals(first.getId(), persistence.loadOrCreatePlayer("w1", "Bob").getId());
    }

    @Test
    void skillsAndProfessionsRoundTrip() {
        persistence.loadOrCreateWorld("w1", 1);
        PersistenceService.PlayerRecord record = persistence.loadOrCreatePlayer("w1", "Ann");
        PlayerState player = new PlayerState(record.getId(), "Ann", 0);
        player.getSkill(Skill.FARMING).setLevel(5);
        player.getSkill(Skill.FARMING).setXp(40);
        player.addProfession(Skill.FARMING, "tiller");

        persistence.savePlayerProgress(player);
        player.getSkill(Skill.FARMING).setXp(80);
        persistence.savePlayerProgress(player);

        Map<String, SkillProgress> skills = persistence.loadSkills(record.getId());
        assertEquals(5, skills.get("farming").getLevel());
        assertEquals(80, skills.get("farming").getXp());
        assertEquals(Skill.values().length, skills.size());

        PersistenceService.PlayerRecord reloaded = persistence.loadOrCreatePlayer("w1", "Ann");
        assertEquals(List.of("tiller"), reloaded.getProfessions().get("farming"));
    }

    @Test
    void relationshipsUpsertAndResetDaily() {
        persistence.loadOrCreateWorld("w1", 1);
        String playerId = persistence.loadOrCreatePlayer("w1", "Ann").getId();
        assertNull(persistence.loadRelationship(playerId, "lily"));

        NpcRelationship rel = new NpcRelationship(playerId, "lily", 0.2, true, false);
        persistence.saveRelationship(rel);
        rel.addHearts(0.8);
        rel.setGiftedToday(true);
        persistence.saveRelationship(rel);

        NpcRelationship loaded = persistence.loadRelationship(playerId, "lily");
        assertEquals(1.0, loaded.getHearts(), 1e-9);
        assertTrue(loaded.isTalkedToday());
        assertTrue(loaded.isGiftedToday());

        assertEquals(1, persistence.resetDailyRelationships("w1"));
        loaded = persistence.loadRelationship(playerId, "lily");
        assertFalse(loaded.isTalkedToday());
        assertFalse(loaded.isGiftedToday());
        assertEquals(1.0, loaded.getHearts(), 1e-9);
    }
}
