package com.tablehub.combatservice.games.combat.domain.rule;

import com.tablehub.combatservice.games.combat.domain.model.Encounter;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 遭遇战结构完整性校验。返回第一个发现的问题；没有问题返回 empty。
 */
public final class EncounterIntegrity {

    private EncounterIntegrity() {}

    public static Optional<String> check(Encounter e) {
        if (e.getCombatants() == null || e.getTurnOrder() == null) {
            return Optional.of("missing turn order or combatants");
        }
        if (!e.isActive()) {
            return Optional.empty();
        }
        List<String> order = e.getTurnOrder();
        if (order.isEmpty()) {
            return Optional.of("active encounter with empty turn order");
        }
        if (e.getCurrentTurnIndex() < 0 || e.getCurrentTurnIndex() >= order.size()) {
            return Optional.of("turn index " + e.getCurrentTurnIndex() + " out of range");
        }
        if (e.getRoundNumber() < 1) {
            return Optional.of("round number " + e.getRoundNumber());
        }
        Set<String> seen = new HashSet<>();
        for (String id : order) {
            if (!seen.add(id)) {
                return Optional.of("duplicate combatant " + id);
            }
            if (!e.getCombatants().containsKey(id)) {
                return Optional.of("turn order references missing combatant " + id);
            }
        }
        return Optional.empty();
    }
}
