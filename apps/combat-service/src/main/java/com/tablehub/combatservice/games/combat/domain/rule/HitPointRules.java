package com.tablehub.combatservice.games.combat.domain.rule;

/**
 * 生命值加减的基础算式（所有单位通用）。
 * 伤害先扣临时生命，剩余部分扣当前生命，下限 0；治疗上限为最大生命，不影响临时生命。
 */
public final class HitPointRules {

    private HitPointRules() {}

    /**
     * @param currentHp 扣除后的当前生命
     * @param tempHp    扣除后的临时生命
     * @param overflow  当前生命归零后仍未抵消的伤害（用于巨额伤害判定）
     */
    public record DamageSplit(int currentHp, int tempHp, int overflow) {}

    public static DamageSplit damage(int currentHp, int tempHp, int amount) {
        int fromTemp = Math.min(Math.max(tempHp, 0), amount);
        int rest = amount - fromTemp;
        int hp = Math.max(0, currentHp - rest);
        int overflow = Math.max(0, rest - currentHp);
        return new DamageSplit(hp, tempHp - fromTemp, overflow);
    }

    public static int heal(int currentHp, int maxHp, int amount) {
        return Math.min(maxHp, currentHp + amount);
    }
}
