package com.tablehub.combatservice.games.combat.service.impl;

import com.tablehub.combatservice.games.combat.service.DiceRoller;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;

@Component
public class RandomDiceRoller implements DiceRoller {

    @Override
    public int roll(int sides) {
        return ThreadLocalRandom.current().nextInt(1, sides + 1);
    }
}
