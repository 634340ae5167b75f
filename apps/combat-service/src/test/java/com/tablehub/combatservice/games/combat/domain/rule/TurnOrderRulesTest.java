package com.tablehub.combatservice.games.combat.domain.rule;

import com.tablehub.combatservice.games.combat.domain.enums.CombatantKind;
import com.tablehub.combatservice.games.combat.domain.model.CombatantSnapshot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TurnOrderRulesTest {

    private static CombatantSnapshot c(String id, String name, int init, int mod) {
        return CombatantSnapshot.builder().id(id).name(name).kind(CombatantKind.ENEMY)
                .initiative(init).initiativeModifier(mod).currentHp(5).maxHp(5).build();
    }

    @Test
    void sortsByInitiativeThenModifierThenName() {
        List<CombatantSnapshot> list = new ArrayList<>(List.of(
                c("a", "zed", 12, 1),
                c("b", "Amy", 12, 1),
                c("c", "Bob", 12, 3),
                c("d", "Cat", 18, 0)));

        list.sort(TurnOrderRules.INITIATIVE_ORDER);

        assertThat(list).extracting(CombatantSnapshot::getId).containsExactly("d", "c", "b", "a");
    }

    @Test
    void nextSkipsAndReportsWrap() {
        List<String> order = List.of("a", "b", "c");
        Set<String> skipped = Set.of("a");

        TurnOrderRules.TurnStep step = TurnOrderRules.next(order, 2, skipped::contains);

        assertThat(step.index()).isEqualTo(1);
        assertThat(step.wrapped()).isTrue();
    }

    @Test
    void fullCycleReturnsToStartWithOneWrap() {
        List<String> order = List.of("a", "b", "c", "d");
        for (int start = 0; start < order.size(); start++) {
            int idx = start;
            int wraps = 0;
            for (int i = 0; i < order.size(); i++) {
                TurnOrderRules.TurnStep step = TurnOrderRules.next(order, idx, id -> false);
                idx = step.index();
                wraps += step.wrapped() ? 1 : 0;
            }
            assertThat(idx).isEqualTo(start);
            assertThat(wraps).isEqualTo(1);
        }
    }

    @Test
    void allSkippedFallsBackToNextSlot() {
        TurnOrderRules.TurnStep step = TurnOrderRules.next(List.of("a", "b"), 0, id -> true);

        assertThat(step.index()).isEqualTo(1);
        assertThat(step.wrapped()).isFalse();
    }

    @Test
    void insertionGoesAfterEqualInitiative() {
        List<CombatantSnapshot> ordered = List.of(c("a", "A", 18, 0), c("b", "B", 12, 0), c("c", "C", 7, 0));

        assertThat(TurnOrderRules.insertionIndex(ordered, 12)).isEqualTo(2);
        assertThat(TurnOrderRules.insertionIndex(ordered, 20)).isZero();
        assertThat(TurnOrderRules.insertionIndex(ordered, 1)).isEqualTo(3);
    }
}
