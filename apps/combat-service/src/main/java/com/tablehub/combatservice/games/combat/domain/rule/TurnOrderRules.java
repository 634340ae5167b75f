package com.tablehub.combatservice.games.combat.domain.rule;

import com.tablehub.combatservice.games.combat.domain.model.CombatantSnapshot;

import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * 先攻顺序与回合推进的纯计算。
 */
public final class TurnOrderRules {

    private TurnOrderRules() {}

    /**
     * 开战排序：先攻降序 -> 调整值降序 -> 名字升序（忽略大小写）-> id 升序。
     * 得到一个确定的全序，便于复现。
     */
    public static final Comparator<CombatantSnapshot> INITIATIVE_ORDER =
            Comparator.comparingInt(CombatantSnapshot::getInitiative).reversed()
                    .thenComparing(Comparator.comparingInt(CombatantSnapshot::getInitiativeModifier).reversed())
                    .thenComparing(CombatantSnapshot::getName, String.CASE_INSENSITIVE_ORDER)
                    .thenComparing(CombatantSnapshot::getId);

    /**
     * @param index   下一个行动者的下标
     * @param wrapped 是否越过了队尾（回合数 +1）
     */
    public record TurnStep(int index, boolean wrapped) {}

    /**
     * 从 current 往后循环找第一个不被跳过的单位。
     * 全部都被跳过时，退化为简单地前进一格。
     */
    public static TurnStep next(List<String> order, int current, Predicate<String> skipped) {
        int n = order.size();
        if (n == 0) {
            throw new IllegalArgumentException("empty turn order");
        }
        int i = current;
        boolean wrapped = false;
        for (int step = 0; step < n; step++) {
            i++;
            if (i >= n) {
                i = 0;
                wrapped = true;
            }
            if (!skipped.test(order.get(i))) {
                return new TurnStep(i, wrapped);
            }
        }
        int j = current + 1;
        return j >= n ? new TurnStep(0, true) : new TurnStep(j, false);
    }

    /**
     * 新单位的插入位置：排在所有先攻 >= 它的单位之后。
     */
    public static int insertionIndex(List<CombatantSnapshot> ordered, int initiative) {
        int pos = 0;
        for (int i = 0; i < ordered.size(); i++) {
            if (ordered.get(i).getInitiative() >= initiative) {
                pos = i + 1;
            }
        }
        return pos;
    }
}
