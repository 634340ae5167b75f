package com.tablehub.combatservice.games.combat.domain.rule;

import com.tablehub.combatservice.games.combat.domain.constants.Conditions;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * PC 濒死检定规则。
 * 纯函数：(当前生命状态, 事件) -> 新生命状态，不读写任何存储，也不关心是否在战斗中。
 *
 * 规则要点：
 * - 生命降到 0：获得 Unconscious，两个计数器清零；
 * - 掷骰只在 Unconscious 且非 Stable、非 Dead 时有效：20 复苏（hp=1），1 记两次失败，>=10 成功，其余失败；
 * - 3 次成功 -> Stable（仍然 Unconscious）；3 次失败 -> Dead；
 * - 0 生命时受伤记 1 次失败，暴击记 2 次；
 * - 生命归零后溢出伤害 >= 最大生命 -> 直接死亡；
 * - 昏迷中受到治疗：清除 Unconscious / Stable 并清零计数；治疗量为 0 视为“只稳定”，设置 Stable 不回血。
 */
public final class DeathSaveRules {

    public static final int MAX_MARKS = 3;

    private DeathSaveRules() {}

    /** 当前是否允许掷濒死检定 */
    public static boolean canRoll(VitalState s) {
        return s.currentHp() == 0 && s.unconscious() && !s.stable() && !s.dead();
    }

    public static DeathSaveResult apply(VitalState s, DeathSaveEvent e) {
        if (e.value() < 0) {
            throw new IllegalArgumentException("negative value: " + e.value());
        }
        if (s.dead()) {
            // 死亡是终态，伤害对其无意义；治疗/掷骰由调用方提前拒绝
            if (e.type() == DeathSaveEvent.Type.DAMAGE) {
                return new DeathSaveResult(s, DeathSaveOutcome.UNCHANGED);
            }
            throw new IllegalStateException("character is dead");
        }
        return switch (e.type()) {
            case DAMAGE -> damage(s, e.value(), e.critical());
            case HEALING -> heal(s, e.value());
            case ROLL -> roll(s, e.value());
        };
    }

    private static DeathSaveResult damage(VitalState s, int amount, boolean critical) {
        if (amount == 0) {
            return new DeathSaveResult(s, DeathSaveOutcome.UNCHANGED);
        }
        HitPointRules.DamageSplit d = HitPointRules.damage(s.currentHp(), s.tempHp(), amount);

        if (s.currentHp() > 0) {
            if (d.currentHp() > 0) {
                return new DeathSaveResult(s.with(d.currentHp(), d.tempHp(), s.conditions(), 0, 0),
                        DeathSaveOutcome.HP_CHANGED);
            }
            if (d.overflow() >= s.maxHp()) {
                return die(s, d.tempHp(), 0);
            }
            Set<String> c = new LinkedHashSet<>(s.conditions());
            c.add(Conditions.UNCONSCIOUS);
            c.remove(Conditions.STABLE);
            return new DeathSaveResult(s.with(0, d.tempHp(), c, 0, 0), DeathSaveOutcome.DROPPED);
        }

        // 已经是 0 生命
        if (d.overflow() == 0) {
            // 全部被临时生命吸收
            return new DeathSaveResult(s.with(0, d.tempHp(), s.conditions(), s.successes(), s.failures()),
                    DeathSaveOutcome.HP_CHANGED);
        }
        if (d.overflow() >= s.maxHp()) {
            return die(s, d.tempHp(), s.failures());
        }
        int failures = s.failures() + (critical ? 2 : 1);
        if (failures >= MAX_MARKS) {
            return die(s, d.tempHp(), MAX_MARKS);
        }
        Set<String> c = new LinkedHashSet<>(s.conditions());
        c.add(Conditions.UNCONSCIOUS);
        c.remove(Conditions.STABLE);
        return new DeathSaveResult(s.with(0, d.tempHp(), c, s.successes(), failures), DeathSaveOutcome.FAILURE);
    }

    private static DeathSaveResult heal(VitalState s, int amount) {
        boolean down = s.currentHp() == 0 || s.unconscious();
        if (amount == 0) {
            if (!down || s.stable()) {
                return new DeathSaveResult(s, DeathSaveOutcome.UNCHANGED);
            }
            Set<String> c = new LinkedHashSet<>(s.conditions());
            c.add(Conditions.UNCONSCIOUS);
            c.add(Conditions.STABLE);
            return new DeathSaveResult(s.with(s.currentHp(), s.tempHp(), c, 0, 0), DeathSaveOutcome.STABILIZED);
        }
        int hp = HitPointRules.heal(s.currentHp(), s.maxHp(), amount);
        if (!down) {
            return new DeathSaveResult(s.with(hp, s.tempHp(), s.conditions(), 0, 0), DeathSaveOutcome.HP_CHANGED);
        }
        Set<String> c = new LinkedHashSet<>(s.conditions());
        c.remove(Conditions.UNCONSCIOUS);
        c.remove(Conditions.STABLE);
        return new DeathSaveResult(s.with(hp, s.tempHp(), c, 0, 0), DeathSaveOutcome.REVIVED);
    }

    private static DeathSaveResult roll(VitalState s, int d20) {
        if (d20 < 1 || d20 > 20) {
            throw new IllegalArgumentException("d20 out of range: " + d20);
        }
        if (!canRoll(s)) {
            throw new IllegalStateException("death save not allowed in current state");
        }
        if (d20 == 20) {
            Set<String> c = new LinkedHashSet<>(s.conditions());
            c.remove(Conditions.UNCONSCIOUS);
            c.remove(Conditions.STABLE);
            return new DeathSaveResult(s.with(1, s.tempHp(), c, 0, 0), DeathSaveOutcome.REVIVED);
        }
        if (d20 >= 10) {
            int successes = s.successes() + 1;
            if (successes >= MAX_MARKS) {
                Set<String> c = new LinkedHashSet<>(s.conditions());
                c.add(Conditions.STABLE);
                return new DeathSaveResult(s.with(0, s.tempHp(), c, MAX_MARKS, s.failures()),
                        DeathSaveOutcome.STABILIZED);
            }
            return new DeathSaveResult(s.with(0, s.tempHp(), s.conditions(), successes, s.failures()),
                    DeathSaveOutcome.SUCCESS);
        }
        int failures = s.failures() + (d20 == 1 ? 2 : 1);
        if (failures >= MAX_MARKS) {
            return die(s, s.tempHp(), MAX_MARKS);
        }
        return new DeathSaveResult(s.with(0, s.tempHp(), s.conditions(), s.successes(), failures),
                DeathSaveOutcome.FAILURE);
    }

    private static DeathSaveResult die(VitalState s, int tempHp, int failures) {
        Set<String> c = new LinkedHashSet<>(s.conditions());
        c.remove(Conditions.UNCONSCIOUS);
        c.remove(Conditions.STABLE);
        c.add(Conditions.DEAD);
        return new DeathSaveResult(s.with(0, tempHp, c, 0, Math.min(failures, MAX_MARKS)), DeathSaveOutcome.DIED);
    }
}
