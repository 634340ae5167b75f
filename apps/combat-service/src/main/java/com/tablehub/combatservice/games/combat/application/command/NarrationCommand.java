package com.tablehub.combatservice.games.combat.application.command;

import com.tablehub.combatservice.engine.core.Command;

import java.util.List;

/**
 * 叙事类命令：不改动战斗状态，直接交给通知路由推送。
 */
public interface NarrationCommand extends Command {

    record UpdateGameLog(String entry, String importance) implements NarrationCommand {
        @Override public String name() { return "update_game_log"; }
    }

    record ReadAloud(String text, String tone, String pacing) implements NarrationCommand {
        @Override public String name() { return "display_read_aloud_text"; }
    }

    record PresentChoices(List<String> choices) implements NarrationCommand {
        @Override public String name() { return "present_player_choices"; }
    }

    record LogPlayerRoll(String characterId, String characterName, String checkType, int result, String outcome)
            implements NarrationCommand {
        @Override public String name() { return "log_player_roll"; }
    }

    record UpdateSceneImage(String description, String imageUrl) implements NarrationCommand {
        @Override public String name() { return "update_scene_image"; }
    }

    record AtmospherePulse(String text, String intensity, String sensoryType) implements NarrationCommand {
        @Override public String name() { return "broadcast_atmosphere_pulse"; }
    }

    record NarrativeAnchor(String shortText, String moodCategory) implements NarrationCommand {
        @Override public String name() { return "set_narrative_anchor"; }
    }

    record GroupInsight(String text, String relevantSkill, boolean highlightEffect) implements NarrationCommand {
        @Override public String name() { return "trigger_group_insight"; }
    }
}
