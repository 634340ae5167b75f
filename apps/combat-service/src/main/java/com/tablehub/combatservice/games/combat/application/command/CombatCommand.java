package com.tablehub.combatservice.games.combat.application.command;

import com.tablehub.combatservice.engine.core.Command;
import com.tablehub.combatservice.games.combat.domain.dto.CombatantEntry;
import com.tablehub.combatservice.games.combat.domain.dto.PartyInitiative;

import java.util.List;

/**
 * 作用于战斗引擎的命令（封闭集合）。
 * 每个 record 对应一个引擎操作，name() 与工具调用名一致。
 */
public interface CombatCommand extends Command {

    record StartCombat(List<PartyInitiative> party, List<CombatantEntry> enemies) implements CombatCommand {
        @Override public String name() { return "start_combat"; }
    }

    record AdvanceTurn() implements CombatCommand {
        @Override public String name() { return "advance_turn"; }
    }

    record EndCombat() implements CombatCommand {
        @Override public String name() { return "end_combat"; }
    }

    record GetCombatState() implements CombatCommand {
        @Override public String name() { return "get_combat_state"; }
    }

    record ApplyDamage(String combatantId, int amount, boolean critical) implements CombatCommand {
        @Override public String name() { return "apply_damage"; }
    }

    record ApplyHealing(String combatantId, int amount) implements CombatCommand {
        @Override public String name() { return "apply_healing"; }
    }

    record SetCurrentHp(String combatantId, int value) implements CombatCommand {
        @Override public String name() { return "update_character_state"; }
    }

    record SetInitiative(String combatantId, int value) implements CombatCommand {
        @Override public String name() { return "set_initiative"; }
    }

    record RecordDeathSave(String characterId, int roll) implements CombatCommand {
        @Override public String name() { return "record_death_save"; }
    }

    record SetCondition(String characterId, String condition, boolean on) implements CombatCommand {
        @Override public String name() { return "set_condition"; }
    }

    record ReplaceConditions(String characterId, List<String> conditions) implements CombatCommand {
        @Override public String name() { return "update_character_state"; }
    }

    record SetStatusNotes(String characterId, String notes) implements CombatCommand {
        @Override public String name() { return "update_character_state"; }
    }

    record AddCombatant(CombatantEntry entry) implements CombatCommand {
        @Override public String name() { return "add_combatant"; }
    }

    record RemoveCombatant(String combatantId) implements CombatCommand {
        @Override public String name() { return "remove_combatant"; }
    }
}
