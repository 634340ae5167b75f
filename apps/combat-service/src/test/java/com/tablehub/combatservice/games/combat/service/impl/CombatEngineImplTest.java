package com.tablehub.combatservice.games.combat.service.impl;

import com.tablehub.combatservice.engine.core.CampaignRoomActor;
import com.tablehub.combatservice.games.combat.domain.constants.Conditions;
import com.tablehub.combatservice.games.combat.domain.dto.CampaignSnapshot;
import com.tablehub.combatservice.games.combat.domain.dto.CombatantEntry;
import com.tablehub.combatservice.games.combat.domain.dto.CombatantVitals;
import com.tablehub.combatservice.games.combat.domain.dto.PartyInitiative;
import com.tablehub.combatservice.games.combat.domain.enums.CombatantKind;
import com.tablehub.combatservice.games.combat.domain.error.CombatErrorCode;
import com.tablehub.combatservice.games.combat.domain.error.CombatException;
import com.tablehub.combatservice.games.combat.domain.model.CharacterRecord;
import com.tablehub.combatservice.games.combat.domain.model.CombatantSnapshot;
import com.tablehub.combatservice.games.combat.domain.model.Encounter;
import com.tablehub.combatservice.platform.config.CombatProperties;
import com.tablehub.combatservice.platform.notify.HubPayloads.CharacterStatePayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.CombatStatePayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.CombatantInfo;
import com.tablehub.combatservice.platform.notify.HubPayloads.DeathSavePayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.InitiativeSetPayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.TurnAdvancedPayload;
import com.tablehub.combatservice.platform.notify.NotificationRouter;
import com.tablehub.combatservice.support.FixedDiceRoller;
import com.tablehub.combatservice.support.InMemoryEncounterRepository;
import com.tablehub.combatservice.support.InMemoryRosterRepository;
import com.tablehub.combatservice.support.RecordingHubTransport;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CombatEngineImplTest {

    private static final String CID = "c1";

    private InMemoryEncounterRepository encounters;
    private InMemoryRosterRepository roster;
    private RecordingHubTransport transport;
    private FixedDiceRoller dice;
    private CombatEngineImpl engine;

    @BeforeEach
    void setUp() {
        encounters = new InMemoryEncounterRepository();
        roster = new InMemoryRosterRepository();
        transport = new RecordingHubTransport();
        dice = new FixedDiceRoller(10);
        engine = new CombatEngineImpl(encounters, roster, new NotificationRouter(transport),
                new CampaignRoomActor(new CombatProperties()), dice);
        roster.save(CID, pc("thorin", "Thorin", 12, 12));
    }

    private static CharacterRecord pc(String id, String name, int hp, int max) {
        return CharacterRecord.builder().id(id).name(name).kind(CombatantKind.PC)
                .currentHp(hp).maxHp(max).armorClass(16).build();
    }

    private static CombatantEntry enemy(String id, String name, int init, int hp) {
        return new CombatantEntry(id, name, CombatantKind.ENEMY, init, 0, hp, null, 13, false);
    }

    private CombatStatePayload startThorinVsGoblin() {
        return engine.startCombat(CID, List.of(new PartyInitiative("thorin", 15, false)),
                List.of(enemy("goblin", "Goblin", 16, 7)));
    }

    private static void expectCode(ThrowingCallable call, CombatErrorCode code) {
        assertThatThrownBy(call).isInstanceOfSatisfying(CombatException.class,
                e -> assertThat(e.getCode()).isEqualTo(code));
    }

    private Encounter stored() {
        return encounters.peek(CID);
    }

    @Test
    void thorinAndGoblinScenario() {
        CombatStatePayload started = startThorinVsGoblin();

        assertThat(started.turnOrder()).extracting(CombatantInfo::id).containsExactly("goblin", "thorin");
        assertThat(started.roundNumber()).isEqualTo(1);
        assertThat(started.currentCombatantId()).isEqualTo("goblin");

        CombatantVitals goblin = engine.applyDamage(CID, "goblin", 7, false);
        assertThat(goblin.currentHp()).isZero();
        assertThat(goblin.isDefeated()).isTrue();

        TurnAdvancedPayload turn = engine.advanceTurn(CID);
        assertThat(turn.currentCombatantId()).isEqualTo("thorin");
        assertThat(turn.roundNumber()).isEqualTo(1);

        assertThat(transport.events()).containsExactly("CombatStarted", "CharacterStateUpdated",
                "CharacterStateUpdated", "TurnAdvanced");
        assertThat(transport.sent()).allMatch(s -> s.group().equals("campaign.c1.all"));
    }

    @Test
    void startTwiceIsAlreadyActive() {
        startThorinVsGoblin();

        expectCode(this::startThorinVsGoblin, CombatErrorCode.ALREADY_ACTIVE);
    }

    @Test
    void startRollsMissingInitiativeAndBreaksTiesByModifierThenName() {
        roster.save(CID, pc("aria", "Aria", 10, 10).toBuilder().initiativeModifier(3).build());
        dice = new FixedDiceRoller(9);
        engine = new CombatEngineImpl(encounters, roster, new NotificationRouter(transport),
                new CampaignRoomActor(new CombatProperties()), dice);

        CombatStatePayload s = engine.startCombat(CID,
                List.of(new PartyInitiative("aria", null, false), new PartyInitiative("thorin", 12, false)),
                List.of(enemy("b", "Bandit", 12, 5), enemy("a", "Archer", 12, 5)));

        // aria: 9 + 3 = 12，调整值最高排第一；其余同分按名字
        assertThat(s.turnOrder()).extracting(CombatantInfo::id).containsExactly("aria", "a", "b", "thorin");
    }

    @Test
    void startRejectsUnknownPartyMemberAndDuplicates() {
        expectCode(() -> engine.startCombat(CID, List.of(new PartyInitiative("nobody", 10, false)), List.of()),
                CombatErrorCode.UNKNOWN_COMBATANT);
        expectCode(() -> engine.startCombat(CID, List.of(new PartyInitiative("thorin", 10, false)),
                List.of(enemy("thorin", "Impostor", 3, 4))), CombatErrorCode.INVALID_COMMAND);
        assertThat(stored()).isNull();
    }

    @Test
    void fullCycleOfAdvancesIncrementsRoundExactlyOnce() {
        engine.startCombat(CID, List.of(new PartyInitiative("thorin", 15, false)),
                List.of(enemy("g1", "Goblin A", 18, 7), enemy("g2", "Goblin B", 4, 7)));
        engine.advanceTurn(CID);
        int startIndex = stored().getCurrentTurnIndex();
        int startRound = stored().getRoundNumber();

        for (int i = 0; i < 3; i++) {
            engine.advanceTurn(CID);
        }

        assertThat(stored().getCurrentTurnIndex()).isEqualTo(startIndex);
        assertThat(stored().getRoundNumber()).isEqualTo(startRound + 1);
    }

    @Test
    void defeatedCombatantsAreSkippedButKept() {
        engine.startCombat(CID, List.of(new PartyInitiative("thorin", 15, false)),
                List.of(enemy("g1", "Goblin A", 18, 7), enemy("g2", "Goblin B", 4, 7)));
        engine.applyDamage(CID, "g2", 30, false);

        engine.advanceTurn(CID); // g1 -> thorin
        TurnAdvancedPayload t = engine.advanceTurn(CID); // thorin -> (g2 跳过) -> g1

        assertThat(t.currentCombatantId()).isEqualTo("g1");
        assertThat(t.roundNumber()).isEqualTo(2);
        assertThat(stored().getTurnOrder()).containsExactly("g1", "thorin", "g2");
    }

    @Test
    void hpIsFlooredAtZeroAndCappedAtMax() {
        startThorinVsGoblin();

        assertThat(engine.applyDamage(CID, "goblin", 100, false).currentHp()).isZero();
        assertThat(engine.applyHealing(CID, "goblin", 100).currentHp()).isEqualTo(7);
        assertThat(engine.applyDamage(CID, "thorin", 4, false).currentHp()).isEqualTo(8);
        assertThat(engine.applyHealing(CID, "thorin", 100).currentHp()).isEqualTo(12);
    }

    @Test
    void negativeAmountAndUnknownTargetAreRejectedWithoutWrites() {
        startThorinVsGoblin();
        int saves = encounters.saves();

        expectCode(() -> engine.applyDamage(CID, "goblin", -1, false), CombatErrorCode.INVALID_AMOUNT);
        expectCode(() -> engine.applyHealing(CID, "ghost", 3), CombatErrorCode.UNKNOWN_COMBATANT);
        assertThat(encounters.saves()).isEqualTo(saves);
    }

    @Test
    void damageToPcWritesRosterAndEncounterIdentically() {
        startThorinVsGoblin();

        engine.applyDamage(CID, "thorin", 5, false);

        assertThat(roster.peek(CID, "thorin").getCurrentHp()).isEqualTo(7);
        assertThat(stored().combatant("thorin").getCurrentHp()).isEqualTo(7);
        CharacterStatePayload p = (CharacterStatePayload) transport.ofEvent("CharacterStateUpdated")
                .get(0).envelope().getPayload();
        assertThat(p.key()).isEqualTo("currentHp");
        assertThat(p.value()).isEqualTo(7);
    }

    @Test
    void massiveDamageKillsPcWithoutDeathSaves() {
        roster.save(CID, pc("thorin", "Thorin", 5, 8));
        startThorinVsGoblin();

        CombatantVitals v = engine.applyDamage(CID, "thorin", 15, false);

        assertThat(v.conditions()).contains(Conditions.DEAD);
        assertThat(v.isDefeated()).isTrue();
        assertThat(roster.peek(CID, "thorin").isDead()).isTrue();
        assertThat(stored().combatant("thorin").isDefeated()).isTrue();
        DeathSavePayload ds = (DeathSavePayload) transport.ofEvent("DeathSaveUpdated").get(0).envelope().getPayload();
        assertThat(ds.isDead()).isTrue();
    }

    @Test
    void secondWriteFailureReportsPartialUpdateAndDoesNotBroadcast() {
        startThorinVsGoblin();
        transport.clear();
        encounters.failSaves(true);

        assertThatThrownBy(() -> engine.applyDamage(CID, "thorin", 5, false))
                .isInstanceOfSatisfying(CombatException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(CombatErrorCode.PARTIAL_UPDATE);
                    assertThat(e.isRetryable()).isTrue();
                });
        assertThat(roster.peek(CID, "thorin").getCurrentHp()).isEqualTo(7);
        assertThat(stored().combatant("thorin").getCurrentHp()).isEqualTo(12);
        assertThat(transport.sent()).isEmpty();
    }

    @Test
    void deathSaveFlowAndDeadPcLeavesTurnOrder() {
        roster.save(CID, pc("thorin", "Thorin", 1, 12));
        engine.startCombat(CID, List.of(new PartyInitiative("thorin", 15, false)),
                List.of(enemy("goblin", "Goblin", 16, 7), enemy("orc", "Orc", 10, 15)));

        engine.applyDamage(CID, "thorin", 1, false);
        assertThat(roster.peek(CID, "thorin").getConditions()).contains(Conditions.UNCONSCIOUS);
        assertThat(stored().combatant("thorin").isDefeated()).isFalse();

        DeathSavePayload first = engine.recordDeathSave(CID, "thorin", 1);
        assertThat(first.failures()).isEqualTo(2);
        DeathSavePayload second = engine.recordDeathSave(CID, "thorin", 5);
        assertThat(second.isDead()).isTrue();
        assertThat(stored().combatant("thorin").isDefeated()).isTrue();

        TurnAdvancedPayload t = engine.advanceTurn(CID);

        assertThat(t.currentCombatantId()).isEqualTo("orc");
        assertThat(stored().getTurnOrder()).containsExactly("goblin", "orc");
        assertThat(t.currentTurnIndex()).isEqualTo(1);
        assertThat(transport.events()).contains("CombatantRemoved");
    }

    @Test
    void natural20RevivesInCombat() {
        roster.save(CID, pc("thorin", "Thorin", 3, 12));
        startThorinVsGoblin();
        engine.applyDamage(CID, "thorin", 3, false);
        engine.recordDeathSave(CID, "thorin", 4);

        DeathSavePayload p = engine.recordDeathSave(CID, "thorin", 20);

        assertThat(p.currentHp()).isEqualTo(1);
        assertThat(p.isUnconscious()).isFalse();
        assertThat(p.failures()).isZero();
        assertThat(stored().combatant("thorin").getCurrentHp()).isEqualTo(1);
    }

    @Test
    void deathSaveRejectedForConsciousOrNonPlayerTargets() {
        startThorinVsGoblin();

        expectCode(() -> engine.recordDeathSave(CID, "thorin", 12), CombatErrorCode.INVALID_DEATH_SAVE);
        expectCode(() -> engine.recordDeathSave(CID, "thorin", 0), CombatErrorCode.INVALID_DEATH_SAVE);
        expectCode(() -> engine.recordDeathSave(CID, "goblin", 12), CombatErrorCode.UNKNOWN_COMBATANT);
    }

    @Test
    void healingADeadCharacterIsRejected() {
        roster.save(CID, pc("thorin", "Thorin", 0, 12).toBuilder()
                .conditions(new LinkedHashSet<>(Set.of(Conditions.DEAD))).build());

        expectCode(() -> engine.applyHealing(CID, "thorin", 5), CombatErrorCode.TARGET_DEAD);
    }

    @Test
    void surpriseFlagClearsAfterFirstRound() {
        engine.startCombat(CID, List.of(new PartyInitiative("thorin", 15, true)),
                List.of(enemy("goblin", "Goblin", 16, 7)));

        TurnAdvancedPayload first = engine.advanceTurn(CID);
        assertThat(first.currentIsSurprised()).isTrue();
        assertThat(stored().getTurnOrder()).contains("thorin");

        engine.advanceTurn(CID);
        TurnAdvancedPayload again = engine.advanceTurn(CID);
        assertThat(again.currentCombatantId()).isEqualTo("thorin");
        assertThat(again.currentIsSurprised()).isFalse();
    }

    @Test
    void setInitiativeResortsAndKeepsCurrentCombatant() {
        startThorinVsGoblin();

        InitiativeSetPayload p = engine.setInitiative(CID, "thorin", 20);

        assertThat(p.turnOrder()).containsExactly("thorin", "goblin");
        assertThat(p.turnOrder().get(p.currentTurnIndex())).isEqualTo("goblin");
        expectCode(() -> engine.setInitiative(CID, "ghost", 3), CombatErrorCode.UNKNOWN_COMBATANT);
    }

    @Test
    void setInitiativeTieUsesSameOrderAsStart() {
        engine.startCombat(CID, List.of(new PartyInitiative("thorin", 15, false)),
                List.of(enemy("goblin", "Goblin", 16, 7), enemy("archer", "Archer", 10, 5)));

        InitiativeSetPayload p = engine.setInitiative(CID, "archer", 15);

        // 同分 15：名字 Archer 排在 Thorin 之前，与之前的相对位置无关
        assertThat(p.turnOrder()).containsExactly("goblin", "archer", "thorin");
        assertThat(p.turnOrder().get(p.currentTurnIndex())).isEqualTo("goblin");
    }

    @Test
    void statusNotesUpdateRosterOnly() {
        startThorinVsGoblin();
        long version = stored().getVersion();
        transport.clear();

        engine.setStatusNotes(CID, "thorin", "  cursed by the lich  ");

        assertThat(roster.peek(CID, "thorin").getStatusNotes()).isEqualTo("cursed by the lich");
        assertThat(stored().getVersion()).isEqualTo(version);
        assertThat(transport.ofEvent("CharacterStateUpdated")).singleElement().satisfies(s -> {
            CharacterStatePayload payload = (CharacterStatePayload) s.envelope().getPayload();
            assertThat(payload.key()).isEqualTo("statusNotes");
            assertThat(payload.value()).isEqualTo("cursed by the lich");
        });

        transport.clear();
        engine.setStatusNotes(CID, "thorin", "cursed by the lich");
        assertThat(transport.sent()).isEmpty();
        expectCode(() -> engine.setStatusNotes(CID, "ghost", "x"), CombatErrorCode.UNKNOWN_COMBATANT);
    }

    @Test
    void addAndRemoveCombatantMidFight() {
        startThorinVsGoblin();
        engine.advanceTurn(CID); // 当前 thorin

        CombatStatePayload added = engine.addCombatant(CID, enemy("wolf", "Wolf", 15, 11));
        assertThat(added.turnOrder()).extracting(CombatantInfo::id).containsExactly("goblin", "thorin", "wolf");
        assertThat(added.currentCombatantId()).isEqualTo("thorin");

        CombatStatePayload removed = engine.removeCombatant(CID, "goblin");
        assertThat(removed.turnOrder()).extracting(CombatantInfo::id).containsExactly("thorin", "wolf");
        assertThat(removed.currentCombatantId()).isEqualTo("thorin");

        engine.removeCombatant(CID, "wolf");
        expectCode(() -> engine.removeCombatant(CID, "thorin"), CombatErrorCode.INVALID_COMMAND);
    }

    @Test
    void removingCurrentCombatantAtTailHandsTurnToHead() {
        startThorinVsGoblin();
        engine.advanceTurn(CID);

        CombatStatePayload s = engine.removeCombatant(CID, "thorin");

        assertThat(s.currentTurnIndex()).isZero();
        assertThat(s.currentCombatantId()).isEqualTo("goblin");
        assertThat(s.roundNumber()).isEqualTo(1);
    }

    @Test
    void endCombatDropsEncounterButKeepsRoster() {
        startThorinVsGoblin();
        engine.applyDamage(CID, "thorin", 4, false);
        engine.setCondition(CID, "thorin", "Poisoned", true);

        engine.endCombat(CID);

        assertThat(stored()).isNull();
        assertThat(roster.peek(CID, "thorin").getCurrentHp()).isEqualTo(8);
        assertThat(roster.peek(CID, "thorin").getConditions()).contains("Poisoned");
        assertThat(engine.getCombatState(CID)).isEmpty();
        expectCode(() -> engine.endCombat(CID), CombatErrorCode.NO_ACTIVE_COMBAT);
        expectCode(() -> engine.advanceTurn(CID), CombatErrorCode.NO_ACTIVE_COMBAT);
    }

    @Test
    void outsideCombatOnlyRosterChanges() {
        engine.applyDamage(CID, "thorin", 5, false);

        assertThat(roster.peek(CID, "thorin").getCurrentHp()).isEqualTo(7);
        assertThat(stored()).isNull();
        assertThat(transport.ofEvent("CharacterStateUpdated")).singleElement()
                .satisfies(s -> assertThat(s.envelope().getSeq()).isZero());
    }

    @Test
    void setCurrentHpGoesThroughDamageRules() {
        roster.save(CID, pc("thorin", "Thorin", 10, 12).toBuilder().tempHp(3).build());

        CombatantVitals v = engine.setCurrentHp(CID, "thorin", 6);

        assertThat(v.tempHp()).isZero();
        assertThat(v.currentHp()).isEqualTo(9);
        assertThat(engine.setCurrentHp(CID, "thorin", 12).currentHp()).isEqualTo(12);
    }

    @Test
    void markingDeadByConditionDefeatsSnapshot() {
        startThorinVsGoblin();

        engine.setCondition(CID, "thorin", Conditions.DEAD, true);

        assertThat(stored().combatant("thorin").isDefeated()).isTrue();
        assertThat(transport.ofEvent("CharacterStateUpdated"))
                .extracting(s -> ((CharacterStatePayload) s.envelope().getPayload()).key())
                .containsExactly("conditions", "isDefeated");
    }

    @Test
    void replaceConditionsAppliesOnlyTheDifference() {
        engine.setCondition(CID, "thorin", "Prone", true);

        CombatantVitals v = engine.replaceConditions(CID, "thorin", List.of("Blinded", " "));

        assertThat(v.conditions()).containsExactly("Blinded");
    }

    @Test
    void corruptEncounterIsForceEnded() {
        Encounter broken = new Encounter();
        broken.setId("e1");
        broken.setActive(true);
        broken.getTurnOrder().add("ghost");
        encounters.putRaw(CID, broken);

        expectCode(() -> engine.advanceTurn(CID), CombatErrorCode.CORRUPT_STATE);

        assertThat(stored()).isNull();
        assertThat(transport.events()).containsExactly("CombatEnded");
        assertThat(engine.snapshot(CID).combat()).isNull();
    }

    @Test
    void undecodableEncounterCanStillBeEnded() {
        encounters.corrupt(true);

        engine.endCombat(CID);

        assertThat(transport.events()).containsExactly("CombatEnded");
    }

    @Test
    void freshSnapshotMatchesLiveState() {
        startThorinVsGoblin();
        engine.applyDamage(CID, "goblin", 3, false);
        engine.advanceTurn(CID);

        CampaignSnapshot snap = engine.snapshot(CID);

        assertThat(snap.combat()).isEqualTo(engine.getCombatState(CID).orElseThrow());
        assertThat(snap.combat().version()).isEqualTo(stored().getVersion());
        assertThat(snap.roster()).extracting(CharacterRecord::getId).containsExactly("thorin");
        CombatantSnapshot goblin = stored().combatant("goblin");
        assertThat(snap.combat().turnOrder().get(0).currentHp()).isEqualTo(goblin.getCurrentHp());
    }

    @Nested
    class Versions {

        @Test
        void everyMutationBumpsVersionAndStampsEnvelopes() {
            startThorinVsGoblin();
            engine.applyDamage(CID, "goblin", 2, false);
            engine.advanceTurn(CID);

            assertThat(stored().getVersion()).isEqualTo(3);
            assertThat(transport.sent()).extracting(s -> s.envelope().getSeq()).containsExactly(1L, 2L, 3L);
        }
    }
}
