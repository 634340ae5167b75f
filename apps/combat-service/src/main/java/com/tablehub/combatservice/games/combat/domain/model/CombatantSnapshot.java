package com.tablehub.combatservice.games.combat.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tablehub.combatservice.games.combat.domain.enums.CombatantKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 遭遇战内的参战单位快照。
 * PC 的 currentHp 是名册的一份副本，每次变更都要与名册同步写入。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CombatantSnapshot {

    private String id;
    private String name;
    private CombatantKind kind;
    private int initiative;
    /** 先攻同分时的第二排序键（敏捷调整值） */
    private int initiativeModifier;
    private int currentHp;
    private int maxHp;
    private int armorClass;

    @JsonProperty("isDefeated")
    private boolean defeated;

    public CombatantSnapshot copy() {
        return toBuilder().build();
    }
}
