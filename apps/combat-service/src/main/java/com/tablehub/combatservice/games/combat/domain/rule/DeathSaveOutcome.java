package com.tablehub.combatservice.games.combat.domain.rule;

/** 一次规则计算的结论，主要用于日志 */
public enum DeathSaveOutcome {
    UNCHANGED,
    HP_CHANGED,
    DROPPED,
    SUCCESS,
    FAILURE,
    STABILIZED,
    REVIVED,
    DIED
}
