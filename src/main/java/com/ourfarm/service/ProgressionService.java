package com.ourfarm.service;

import com.ourfarm.config.GameConstants;
import com.ourfarm.model.PlayerState;
import com.ourfarm.model.ProfessionCheckpoint;
import com.ourfarm.model.Skill;
import com.ourfarm.model.SkillProgress;
import com.ourfarm.model.data.ProfessionDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Skill experience, level-ups and profession checkpoints. A player's overall
 * level is never stored: {@link PlayerState#getLevel()} sums skill levels.
 */
@Service
public class ProgressionService {

    private static final Logger log = LoggerFactory.getLogger(ProgressionService.class);

    private static final int[] PROFESSION_LEVELS = {5, 10};

    private final ItemRegistry registry;

    public ProgressionService(ItemRegistry registry) {
        this.registry = registry;
    }

    /** @return true if at least one level was gained */
    public boolean addSkillXP(PlayerState player, Skill skill, int amount) {
        SkillProgress progress = player.getSkill(skill);
        if (amount <= 0 || progress.getLevel() >= GameConstants.SKILL_MAX_LEVEL) return false;

        progress.setXp(progress.getXp() + amount);
        boolean leveled = false;

        while (progress.getLevel() < GameConstants.SKILL_MAX_LEVEL
                && progress.getXp() >= GameConstants.xpForSkillLevel(progress.getLevel() + 1)) {
            progress.setXp(progress.getXp() - GameConstants.xpForSkillLevel(progress.getLevel() + 1));
            progress.setLevel(progress.getLevel() + 1);
            player.increaseMaxEnergy(GameConstants.MAX_ENERGY_PER_LEVEL);
            leveled = true;
            log.debug("{} reached {} level {}", player.getName(), skill.id(), progress.getLevel());
        }
        if (leveled) refreshPendingProfession(player);
        return leveled;
    }

    /**
     * Profession choices the player has earned but not made, at most one per
     * skill. A skill past level 10 still offers its level-5 choice first.
     */
    public List<ProfessionCheckpoint> openCheckpoints(PlayerState player) {
        List<ProfessionCheckpoint> open = new ArrayList<>();
        for (Skill skill : Skill.values()) {
            int level = player.getSkillLevel(skill);
            for (int checkpoint : PROFESSION_LEVELS) {
                if (level < checkpoint) break;
                if (!holdsProfessionAt(player, skill, checkpoint)) {
                    open.add(new ProfessionCheckpoint(skill.id(), checkpoint));
                    break;
                }
            }
        }
        return open;
    }

    /** Offers the first open checkpoint, or clears the offer. */
    public void refreshPendingProfession(PlayerState player) {
        List<ProfessionCheckpoint> open = openCheckpoints(player);
        player.setPendingProfession(open.isEmpty() ? null : open.get(0));
    }

    private boolean holdsProfessionAt(PlayerState player, Skill skill, int level) {
        for (String id : player.getProfessions(skill)) {
            ProfessionDefinition def = registry.getProfession(id);
            if (def != null && def.level == level) return true;
        }
        return false;
    }

    /**
     * Takes the skill's open checkpoint. The profession must belong to that
     * skill and level; level-10 choices must branch from the level-5
     * profession already taken.
     */
    public boolean chooseProfession(PlayerState player, Skill skill, String professionId) {
        ProfessionCheckpoint pending = null;
        for (ProfessionCheckpoint checkpoint : openCheckpoints(player)) {
            if (checkpoint.getSkill().equals(skill.id())) {
                pending = checkpoint;
                break;
            }
        }
        if (pending == null) return false;

        ProfessionDefinition def = registry.getProfession(professionId);
        if (def == null || !skill.id().equals(def.skill) || def.level != pending.getLevel()) return false;

        List<String> owned = player.getProfessions(skill);
        if (def.level == 10 && (def.requires == null || !owned.contains(def.requires))) return false;
        if (owned.contains(professionId)) return false;

        player.addProfession(skill, professionId);
        refreshPendingProfession(player);

        Double energy = def.bonus.get("maxEnergy");
        if (energy != null) player.increaseMaxEnergy(energy.intValue());
        return true;
    }

    /** Sum of a named bonus across all professions the player holds. */
    public double getProfessionBonus(PlayerState player, String bonusKey) {
        double total = 0;
        for (Map.Entry<String, List<String>> entry : player.getProfessions().entrySet()) {
            for (String id : entry.getValue()) {
                ProfessionDefinition def = registry.getProfession(id);
                if (def == null) continue;
                Double value = def.bonus.get(bonusKey);
                if (value != null) total += value;
            }
        }
        return total;
    }
}
