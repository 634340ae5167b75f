package com.tablehub.combatservice.games.combat.service;

/**
 * 掷骰来源。测试中替换为固定值实现。
 */
public interface DiceRoller {

    /** 返回 1..sides */
    int roll(int sides);

    default int d20() {
        return roll(20);
    }
}
