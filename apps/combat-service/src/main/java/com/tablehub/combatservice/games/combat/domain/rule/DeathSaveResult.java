package com.tablehub.combatservice.games.combat.domain.rule;

public record DeathSaveResult(VitalState state, DeathSaveOutcome outcome) {

    public boolean died() {
        return outcome == DeathSaveOutcome.DIED;
    }
}
