package com.tablehub.combatservice.support;

import com.tablehub.combatservice.games.combat.service.DiceRoller;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 按预设顺序出点数；用完后一直返回最后一个值。
 */
public class FixedDiceRoller implements DiceRoller {

    private final Deque<Integer> queue = new ArrayDeque<>();
    private int last = 10;

    public FixedDiceRoller(int... values) {
        for (int v : values) {
            queue.add(v);
        }
    }

    @Override
    public int roll(int sides) {
        if (!queue.isEmpty()) {
            last = queue.poll();
        }
        return last;
    }
}
