package com.tablehub.combatservice.games.combat.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tablehub.combatservice.engine.core.GameState;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 一个战役当前的遭遇战聚合。
 *
 * 持久化形态（Redis String，JSON）：
 * {isActive, roundNumber, turnOrder[], currentTurnIndex, surprisedIds[], combatants{id -> snapshot}}
 * 另外带 id / version / startedAt 三个字段，version 每次变更 +1，用作广播信封的 seq。
 *
 * 每次操作都是：读出一次 -> 内存中修改 -> 整体保存一次。
 */
@Data
@NoArgsConstructor
public class Encounter implements GameState {

    private String id;

    @JsonProperty("isActive")
    private boolean active;

    private int roundNumber = 1;
    private List<String> turnOrder = new ArrayList<>();
    private int currentTurnIndex;
    private Set<String> surprisedIds = new LinkedHashSet<>();
    private Map<String, CombatantSnapshot> combatants = new LinkedHashMap<>();

    private long version;
    private long startedAt;

    /** 当前行动者 id；索引越界时返回 null（由完整性校验兜底） */
    public String currentCombatantId() {
        if (currentTurnIndex < 0 || currentTurnIndex >= turnOrder.size()) {
            return null;
        }
        return turnOrder.get(currentTurnIndex);
    }

    public CombatantSnapshot combatant(String combatantId) {
        return combatantId == null ? null : combatants.get(combatantId);
    }

    public long nextVersion() {
        return ++version;
    }

    @Override
    public Encounter copy() {
        Encounter c = new Encounter();
        c.id = id;
        c.active = active;
        c.roundNumber = roundNumber;
        c.turnOrder = new ArrayList<>(turnOrder);
        c.currentTurnIndex = currentTurnIndex;
        c.surprisedIds = new LinkedHashSet<>(surprisedIds);
        Map<String, CombatantSnapshot> m = new LinkedHashMap<>();
        combatants.forEach((k, v) -> m.put(k, v.copy()));
        c.combatants = m;
        c.version = version;
        c.startedAt = startedAt;
        return c;
    }
}
