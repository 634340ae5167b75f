package com.tablehub.combatservice.games.combat.domain.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 参战单位类型。只有 PC 会走濒死检定流程，并且与角色名册双写。
 */
public enum CombatantKind {
    @JsonProperty("PC")
    PC,
    @JsonProperty("NPC")
    NPC,
    @JsonProperty("Enemy")
    ENEMY;

    public boolean isPlayerCharacter() {
        return this == PC;
    }

    /** 客户端展示用：PC / NPC / Enemy */
    public String label() {
        return this == ENEMY ? "Enemy" : name();
    }
}
