package com.tablehub.combatservice.games.combat.domain.constants;

/**
 * 规则引擎直接读写的几个状态名。
 * 其余状态（Poisoned、Prone 等）只作为普通字符串存进名册，不参与计算。
 */
public final class Conditions {

    private Conditions() {}

    public static final String UNCONSCIOUS = "Unconscious";
    public static final String STABLE = "Stable";
    public static final String DEAD = "Dead";
}
