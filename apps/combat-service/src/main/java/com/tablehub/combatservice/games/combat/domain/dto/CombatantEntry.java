package com.tablehub.combatservice.games.combat.domain.dto;

import com.tablehub.combatservice.games.combat.domain.enums.CombatantKind;

/**
 * 开战或中途加入的非名册单位（敌人 / NPC）；kind = PC 时 id 必须指向名册角色，其余数值从名册读取。
 *
 * @param id                 为空时自动生成
 * @param initiative         为 null 时掷 d20 + initiativeModifier
 * @param currentHp          为 null 时等于 maxHp
 */
public record CombatantEntry(
        String id,
        String name,
        CombatantKind kind,
        Integer initiative,
        int initiativeModifier,
        int maxHp,
        Integer currentHp,
        int armorClass,
        boolean surprised
) {
}
