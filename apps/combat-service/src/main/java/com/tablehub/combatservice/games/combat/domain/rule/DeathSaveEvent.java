package com.tablehub.combatservice.games.combat.domain.rule;

/**
 * 作用于 PC 生命状态的事件：伤害 / 治疗 / 濒死检定掷骰。
 */
public record DeathSaveEvent(Type type, int value, boolean critical) {

    public enum Type { DAMAGE, HEALING, ROLL }

    public static DeathSaveEvent damage(int amount, boolean critical) {
        return new DeathSaveEvent(Type.DAMAGE, amount, critical);
    }

    public static DeathSaveEvent healing(int amount) {
        return new DeathSaveEvent(Type.HEALING, amount, false);
    }

    public static DeathSaveEvent roll(int d20) {
        return new DeathSaveEvent(Type.ROLL, d20, false);
    }
}
