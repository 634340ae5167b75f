package com.tablehub.combatservice.games.combat.domain.rule;

import com.tablehub.combatservice.games.combat.domain.constants.Conditions;
import com.tablehub.combatservice.games.combat.domain.model.CharacterRecord;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 濒死检定规则所需的最小生命状态（不可变）。
 */
public record VitalState(int currentHp, int maxHp, int tempHp, Set<String> conditions,
                         int successes, int failures) {

    public VitalState {
        conditions = Collections.unmodifiableSet(new LinkedHashSet<>(conditions == null ? Set.of() : conditions));
    }

    public static VitalState of(CharacterRecord r) {
        return new VitalState(r.getCurrentHp(), r.getMaxHp(), r.getTempHp(), r.getConditions(),
                r.getDeathSaveSuccesses(), r.getDeathSaveFailures());
    }

    /** 把结果写回名册条目 */
    public void applyTo(CharacterRecord r) {
        r.setCurrentHp(currentHp);
        r.setTempHp(tempHp);
        r.setConditions(new LinkedHashSet<>(conditions));
        r.setDeathSaveSuccesses(successes);
        r.setDeathSaveFailures(failures);
    }

    public boolean unconscious() {
        return conditions.contains(Conditions.UNCONSCIOUS);
    }

    public boolean stable() {
        return conditions.contains(Conditions.STABLE);
    }

    public boolean dead() {
        return conditions.contains(Conditions.DEAD);
    }

    VitalState with(int hp, int temp, Set<String> conds, int s, int f) {
        return new VitalState(hp, maxHp, temp, conds, s, f);
    }
}
