package com.tablehub.combatservice.games.combat.application.command;

import com.tablehub.combatservice.engine.core.Command;
import com.tablehub.combatservice.games.combat.domain.dto.CombatantEntry;
import com.tablehub.combatservice.games.combat.domain.dto.PartyInitiative;
import com.tablehub.combatservice.games.combat.domain.enums.CombatantKind;
import com.tablehub.combatservice.games.combat.domain.error.CombatErrorCode;
import com.tablehub.combatservice.games.combat.domain.error.CombatException;
import com.tablehub.combatservice.games.combat.domain.model.NarrativeLogEntry;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 工具调用解析器：把 (工具名, snake_case 参数 Map) 转成强类型命令。
 *
 * - 未知工具、未声明的参数、缺失的必填参数、类型不符一律 INVALID_COMMAND；
 * - 解析完成后，下游只会看到 CombatCommand / NarrationCommand，不再接触 Map。
 */
@Component
public class ToolCallParser {

    /** 敌人未给出护甲等级时的默认值 */
    static final int DEFAULT_AC = 10;

    public Command parse(String toolName, Map<String, Object> arguments) {
        if (StringUtils.isBlank(toolName)) {
            throw new CombatException(CombatErrorCode.INVALID_COMMAND, "missing tool name");
        }
        String tool = toolName.trim();
        ToolArgs a = new ToolArgs(tool, arguments);
        return switch (tool) {
            // ---- 战斗 ----
            case "start_combat" -> startCombat(a.allow("party", "pc_initiatives", "enemies"));
            case "advance_turn" -> {
                a.allow();
                yield new CombatCommand.AdvanceTurn();
            }
            case "end_combat" -> {
                a.allow();
                yield new CombatCommand.EndCombat();
            }
            case "get_combat_state" -> {
                a.allow();
                yield new CombatCommand.GetCombatState();
            }
            case "apply_damage" -> {
                a.allow("combatant_id", "amount", "critical");
                yield new CombatCommand.ApplyDamage(a.requireString("combatant_id"), a.requireInt("amount"),
                        a.optBool("critical", false));
            }
            case "apply_healing" -> {
                a.allow("combatant_id", "amount");
                yield new CombatCommand.ApplyHealing(a.requireString("combatant_id"), a.requireInt("amount"));
            }
            case "set_initiative" -> {
                a.allow("combatant_id", "value");
                yield new CombatCommand.SetInitiative(a.requireString("combatant_id"), a.requireInt("value"));
            }
            case "record_death_save" -> {
                a.allow("character_id", "roll");
                yield new CombatCommand.RecordDeathSave(a.requireString("character_id"), a.requireInt("roll"));
            }
            case "set_condition" -> {
                a.allow("character_id", "condition", "on");
                yield new CombatCommand.SetCondition(a.requireString("character_id"), a.requireString("condition"),
                        a.optBool("on", true));
            }
            case "add_combatant" -> new CombatCommand.AddCombatant(combatant(a.allow(
                    "id", "character_id", "name", "kind", "is_enemy", "initiative", "initiative_modifier",
                    "max_hp", "current_hp", "ac", "surprised")));
            case "remove_combatant" -> {
                a.allow("combatant_id", "reason");
                yield new CombatCommand.RemoveCombatant(a.requireString("combatant_id"));
            }
            case "update_character_state" -> updateCharacterState(a.allow("character_id", "key", "value"));

            // ---- 叙事 ----
            case "update_game_log" -> {
                a.allow("entry", "importance");
                yield new NarrationCommand.UpdateGameLog(a.requireString("entry"), importance(a));
            }
            case "display_read_aloud_text" -> {
                a.allow("text", "tone", "pacing");
                yield new NarrationCommand.ReadAloud(a.requireString("text"), a.optString("tone"), a.optString("pacing"));
            }
            case "present_player_choices" -> {
                a.allow("choices");
                yield new NarrationCommand.PresentChoices(List.copyOf(a.stringList("choices")));
            }
            case "log_player_roll" -> {
                a.allow("character_id", "character_name", "check_type", "result", "outcome");
                yield new NarrationCommand.LogPlayerRoll(a.requireString("character_id"), a.optString("character_name"),
                        a.requireString("check_type"), a.requireInt("result"), a.requireString("outcome"));
            }
            case "update_scene_image" -> {
                a.allow("description", "image_url");
                String description = a.requireString("description");
                String url = StringUtils.defaultIfBlank(a.optString("image_url"), placeholderImage(description));
                yield new NarrationCommand.UpdateSceneImage(description, url);
            }
            case "broadcast_atmosphere_pulse" -> {
                a.allow("text", "intensity", "sensory_type");
                yield new NarrationCommand.AtmospherePulse(a.requireString("text"), a.optString("intensity"),
                        a.optString("sensory_type"));
            }
            case "set_narrative_anchor" -> {
                a.allow("short_text", "mood_category");
                yield new NarrationCommand.NarrativeAnchor(a.requireString("short_text"), a.optString("mood_category"));
            }
            case "trigger_group_insight" -> {
                a.allow("text", "relevant_skill", "highlight_effect");
                yield new NarrationCommand.GroupInsight(a.requireString("text"), a.requireString("relevant_skill"),
                        a.optBool("highlight_effect", false));
            }
            default -> throw new CombatException(CombatErrorCode.INVALID_COMMAND, "unknown tool: " + tool);
        };
    }

    /**
     * 队伍两种写法都接受：
     *   party: [{character_id, initiative?, surprised?}]
     *   pc_initiatives: {character_id: initiative}
     */
    private CombatCommand.StartCombat startCombat(ToolArgs a) {
        List<PartyInitiative> party = new ArrayList<>();
        for (ToolArgs p : a.objectList("party")) {
            p.allow("character_id", "initiative", "surprised");
            party.add(new PartyInitiative(p.requireString("character_id"), p.optInt("initiative"),
                    p.optBool("surprised", false)));
        }
        for (Map.Entry<String, Object> e : a.object("pc_initiatives").entrySet()) {
            party.add(new PartyInitiative(e.getKey(), a.toInt("pc_initiatives." + e.getKey(), e.getValue()), false));
        }
        List<CombatantEntry> enemies = new ArrayList<>();
        for (ToolArgs e : a.objectList("enemies")) {
            enemies.add(combatant(e.allow("id", "name", "kind", "is_enemy", "initiative", "initiative_modifier",
                    "max_hp", "current_hp", "ac", "surprised")));
        }
        return new CombatCommand.StartCombat(party, enemies);
    }

    private CombatantEntry combatant(ToolArgs a) {
        CombatantKind kind = kind(a);
        if (kind == CombatantKind.PC) {
            String id = a.has("character_id") ? a.requireString("character_id") : a.requireString("id");
            return new CombatantEntry(id, null, kind, a.optInt("initiative"), 0, 0, null, 0,
                    a.optBool("surprised", false));
        }
        return new CombatantEntry(
                a.optString("id"),
                a.requireString("name"),
                kind,
                a.optInt("initiative"),
                a.optInt("initiative_modifier", 0),
                a.requireInt("max_hp"),
                a.optInt("current_hp"),
                a.optInt("ac", DEFAULT_AC),
                a.optBool("surprised", false));
    }

    private CombatantKind kind(ToolArgs a) {
        String k = a.optString("kind");
        if (k != null) {
            for (CombatantKind c : CombatantKind.values()) {
                if (c.label().equalsIgnoreCase(k.trim()) || c.name().equalsIgnoreCase(k.trim())) {
                    return c;
                }
            }
            throw a.invalid("unknown kind '" + k + "'");
        }
        if (a.has("character_id")) {
            return CombatantKind.PC;
        }
        return a.optBool("is_enemy", true) ? CombatantKind.ENEMY : CombatantKind.NPC;
    }

    /**
     * 兼容旧工具：update_character_state(character_id, key, value)。
     * current_hp 换算为伤害 / 治疗；conditions 整体替换；status_notes 改备注；initiative 修改先攻。
     */
    private CombatCommand updateCharacterState(ToolArgs a) {
        String id = a.requireString("character_id");
        String key = a.requireString("key");
        return switch (key) {
            case "current_hp" -> new CombatCommand.SetCurrentHp(id, a.requireInt("value"));
            case "conditions" -> new CombatCommand.ReplaceConditions(id, List.copyOf(a.stringList("value")));
            case "status_notes" -> {
                if (!a.has("value")) {
                    throw a.invalid("missing required argument 'value'");
                }
                yield new CombatCommand.SetStatusNotes(id, a.optString("value"));
            }
            case "initiative" -> new CombatCommand.SetInitiative(id, a.requireInt("value"));
            default -> throw a.invalid("unsupported key '" + key + "' (current_hp, conditions, status_notes, initiative)");
        };
    }

    private static String importance(ToolArgs a) {
        String v = StringUtils.defaultIfBlank(a.optString("importance"), NarrativeLogEntry.STANDARD).trim();
        for (String ok : List.of(NarrativeLogEntry.MINOR, NarrativeLogEntry.STANDARD, NarrativeLogEntry.CRITICAL)) {
            if (ok.equalsIgnoreCase(v)) {
                return ok;
            }
        }
        throw a.invalid("unknown importance '" + v + "' (minor, standard, critical)");
    }

    private static String placeholderImage(String description) {
        return "/images/scenes/placeholder_" + Math.abs(description.hashCode() % 10) + ".png";
    }
}
