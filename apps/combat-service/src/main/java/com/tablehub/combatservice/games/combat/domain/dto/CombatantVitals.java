package com.tablehub.combatservice.games.combat.domain.dto;

import java.util.Set;

/**
 * 一次伤害 / 治疗 / 状态变更之后的单位生命状况。非 PC 单位的 conditions 为空集合。
 */
public record CombatantVitals(
        String id,
        int currentHp,
        int maxHp,
        int tempHp,
        boolean isDefeated,
        Set<String> conditions,
        int deathSaveSuccesses,
        int deathSaveFailures
) {
}
