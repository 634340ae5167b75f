package com.tablehub.combatservice.games.combat.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.tablehub.combatservice.engine.core.GameState;
import com.tablehub.combatservice.games.combat.domain.constants.Conditions;
import com.tablehub.combatservice.games.combat.domain.enums.CombatantKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 角色名册条目（权威数据，战斗结束后仍然保留）。
 * 存储在 Redis Hash：tablehub:campaign:{id}:roster，field = 角色 id。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CharacterRecord implements GameState {

    private String id;
    private String name;
    private CombatantKind kind;
    private int maxHp;
    private int currentHp;
    private int tempHp;
    private int armorClass;
    /** 先攻调整值，用于掷先攻和同分排序 */
    private int initiativeModifier;

    @Builder.Default
    private Set<String> conditions = new LinkedHashSet<>();

    private int deathSaveSuccesses;
    private int deathSaveFailures;

    /** DM / 模型写给这个角色的自由备注，不参与规则计算 */
    private String statusNotes;

    /** 控制该角色的玩家 userId，可为空 */
    private String controllingPlayerId;

    @JsonIgnore
    public boolean isDead() {
        return conditions != null && conditions.contains(Conditions.DEAD);
    }

    @Override
    public CharacterRecord copy() {
        return toBuilder()
                .conditions(conditions == null ? new LinkedHashSet<>() : new LinkedHashSet<>(conditions))
                .build();
    }
}
