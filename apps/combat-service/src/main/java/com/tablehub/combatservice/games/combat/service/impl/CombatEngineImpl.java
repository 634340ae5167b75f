package com.tablehub.combatservice.games.combat.service.impl;

import com.tablehub.combatservice.engine.core.CampaignRoomActor;
import com.tablehub.combatservice.engine.core.OperationContext;
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
import com.tablehub.combatservice.games.combat.domain.repository.EncounterRepository;
import com.tablehub.combatservice.games.combat.domain.repository.RosterRepository;
import com.tablehub.combatservice.games.combat.domain.rule.DeathSaveEvent;
import com.tablehub.combatservice.games.combat.domain.rule.DeathSaveResult;
import com.tablehub.combatservice.games.combat.domain.rule.DeathSaveRules;
import com.tablehub.combatservice.games.combat.domain.rule.EncounterIntegrity;
import com.tablehub.combatservice.games.combat.domain.rule.HitPointRules;
import com.tablehub.combatservice.games.combat.domain.rule.TurnOrderRules;
import com.tablehub.combatservice.games.combat.domain.rule.VitalState;
import com.tablehub.combatservice.games.combat.service.CombatEngine;
import com.tablehub.combatservice.games.combat.service.DiceRoller;
import com.tablehub.combatservice.platform.notify.HubPayloads.CharacterStatePayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.CombatStatePayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.CombatantInfo;
import com.tablehub.combatservice.platform.notify.HubPayloads.DeathSavePayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.InitiativeSetPayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.TurnAdvancedPayload;
import com.tablehub.combatservice.platform.notify.NotificationRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * 战斗引擎实现。
 *
 * 每个操作的固定套路：
 *   1) 进入战役串行区（CampaignRoomActor）；
 *   2) 读出遭遇战 / 名册条目（各读一次），完成全部校验；
 *   3) 内存中修改；
 *   4) checkpoint -> 第一次写入 -> commit；涉及 PC 时先写名册、再写遭遇战；
 *   5) 两次写入都成功后才广播。
 *
 * 第二次写入失败时抛 PARTIAL_UPDATE，不广播，也不自动重试。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CombatEngineImpl implements CombatEngine {

    private final EncounterRepository encounterRepo;
    private final RosterRepository rosterRepo;
    private final NotificationRouter router;
    private final CampaignRoomActor roomActor;
    private final DiceRoller dice;

    // ==================== 开战 / 回合 / 结束 ====================

    @Override
    public CombatStatePayload startCombat(String campaignId, List<PartyInitiative> party, List<CombatantEntry> others) {
        return roomActor.execute(campaignId, ctx -> {
            if (loadEncounter(campaignId).isPresent()) {
                throw new CombatException(CombatErrorCode.ALREADY_ACTIVE, "combat already active in campaign " + campaignId);
            }

            Map<String, CombatantSnapshot> byId = new LinkedHashMap<>();
            Set<String> surprised = new LinkedHashSet<>();
            for (PartyInitiative p : party == null ? List.<PartyInitiative>of() : party) {
                if (p == null || StringUtils.isBlank(p.characterId())) {
                    throw new CombatException(CombatErrorCode.INVALID_COMMAND, "party entry without characterId");
                }
                CharacterRecord rec = requireCharacter(campaignId, p.characterId());
                if (!kindOf(rec).isPlayerCharacter()) {
                    throw new CombatException(CombatErrorCode.INVALID_COMMAND,
                            "party entry " + rec.getId() + " is not a player character");
                }
                int init = p.initiative() != null ? p.initiative() : rollInitiative(rec.getInitiativeModifier());
                putUnique(byId, fromRecord(rec, init));
                if (p.surprised()) {
                    surprised.add(rec.getId());
                }
            }
            for (CombatantEntry e : others == null ? List.<CombatantEntry>of() : others) {
                CombatantSnapshot s = toSnapshot(campaignId, e);
                putUnique(byId, s);
                if (e.surprised()) {
                    surprised.add(s.getId());
                }
            }
            if (byId.isEmpty()) {
                throw new CombatException(CombatErrorCode.INVALID_COMMAND, "combat needs at least one combatant");
            }

            List<CombatantSnapshot> sorted = new ArrayList<>(byId.values());
            sorted.sort(TurnOrderRules.INITIATIVE_ORDER);

            Encounter enc = new Encounter();
            enc.setId(UUID.randomUUID().toString());
            enc.setActive(true);
            enc.setRoundNumber(1);
            enc.setCurrentTurnIndex(0);
            sorted.forEach(s -> {
                enc.getTurnOrder().add(s.getId());
                enc.getCombatants().put(s.getId(), s);
            });
            enc.getSurprisedIds().addAll(surprised);
            enc.setVersion(1);
            enc.setStartedAt(System.currentTimeMillis());

            ctx.checkpoint();
            encounterRepo.save(campaignId, enc);
            ctx.commit();

            log.info("开战 campaign={} combat={} order={} surprised={}",
                    campaignId, enc.getId(), enc.getTurnOrder(), enc.getSurprisedIds());
            CombatStatePayload state = toState(enc);
            router.combatStarted(campaignId, state);
            return state;
        });
    }

    @Override
    public TurnAdvancedPayload advanceTurn(String campaignId) {
        return roomActor.execute(campaignId, ctx -> {
            Encounter enc = requireActive(campaignId);
            List<String> order = enc.getTurnOrder();

            TurnOrderRules.TurnStep step = TurnOrderRules.next(order, enc.getCurrentTurnIndex(),
                    id -> enc.combatant(id).isDefeated());
            String nextId = order.get(step.index());
            int round = enc.getRoundNumber() + (step.wrapped() ? 1 : 0);

            // 死亡的 PC 在这里移出先攻表；其余被击败单位保留，只是跳过
            List<String> dead = new ArrayList<>();
            for (String id : order) {
                CombatantSnapshot s = enc.combatant(id);
                if (!id.equals(nextId) && s.getKind().isPlayerCharacter() && s.isDefeated()) {
                    dead.add(id);
                }
            }
            order.removeAll(dead);
            dead.forEach(id -> {
                enc.getCombatants().remove(id);
                enc.getSurprisedIds().remove(id);
            });

            enc.setCurrentTurnIndex(order.indexOf(nextId));
            enc.setRoundNumber(round);
            if (step.wrapped()) {
                // 突袭只影响第一轮
                enc.getSurprisedIds().clear();
            }
            long seq = enc.nextVersion();

            ctx.checkpoint();
            encounterRepo.save(campaignId, enc);
            ctx.commit();

            log.info("回合推进 campaign={} round={} index={} current={} removedDead={}",
                    campaignId, round, enc.getCurrentTurnIndex(), nextId, dead);
            if (!dead.isEmpty()) {
                router.combatantRemoved(campaignId, toState(enc));
            }
            TurnAdvancedPayload payload = new TurnAdvancedPayload(enc.getId(), enc.getCurrentTurnIndex(), nextId,
                    round, enc.getSurprisedIds().contains(nextId));
            router.turnAdvanced(campaignId, payload, seq);
            return payload;
        });
    }

    @Override
    public void endCombat(String campaignId) {
        roomActor.run(campaignId, ctx -> {
            Optional<Encounter> current;
            boolean corrupt = false;
            try {
                current = encounterRepo.find(campaignId).filter(Encounter::isActive);
            } catch (CombatException e) {
                if (e.getCode() != CombatErrorCode.CORRUPT_STATE) {
                    throw e;
                }
                // 数据已损坏：照常结束即可
                current = Optional.empty();
                corrupt = true;
            }
            if (current.isEmpty() && !corrupt) {
                throw new CombatException(CombatErrorCode.NO_ACTIVE_COMBAT, "no active combat in campaign " + campaignId);
            }
            long seq = current.map(Encounter::getVersion).orElse(0L) + 1;

            ctx.checkpoint();
            encounterRepo.delete(campaignId);
            ctx.commit();

            log.info("结束战斗 campaign={} combat={}", campaignId, current.map(Encounter::getId).orElse("<corrupt>"));
            router.combatEnded(campaignId, seq);
        });
    }

    // ==================== 生命值 ====================

    @Override
    public CombatantVitals applyDamage(String campaignId, String combatantId, int amount, boolean critical) {
        return changeHp(campaignId, combatantId, amount, critical, false);
    }

    @Override
    public CombatantVitals applyHealing(String campaignId, String combatantId, int amount) {
        return changeHp(campaignId, combatantId, amount, false, true);
    }

    private CombatantVitals changeHp(String campaignId, String targetId, int amount, boolean critical, boolean healing) {
        if (amount < 0) {
            throw new CombatException(CombatErrorCode.INVALID_AMOUNT, "amount must not be negative: " + amount);
        }
        if (StringUtils.isBlank(targetId)) {
            throw new CombatException(CombatErrorCode.UNKNOWN_COMBATANT, "missing combatant id");
        }
        return roomActor.execute(campaignId, ctx -> {
            Encounter enc = loadEncounter(campaignId).orElse(null);
            CombatantSnapshot snap = enc == null ? null : enc.combatant(targetId);
            if (snap != null && !snap.getKind().isPlayerCharacter()) {
                return changeSnapshotHp(ctx, campaignId, enc, snap, amount, healing);
            }
            // PC（在战斗中）或名册角色（不在战斗中）
            CharacterRecord rec = requireCharacter(campaignId, targetId);
            if (healing && rec.isDead()) {
                throw new CombatException(CombatErrorCode.TARGET_DEAD, "character " + targetId + " is dead");
            }
            DeathSaveEvent event = healing ? DeathSaveEvent.healing(amount) : DeathSaveEvent.damage(amount, critical);
            return changeCharacter(ctx, campaignId, enc, snap, rec, event);
        });
    }

    @Override
    public CombatantVitals setCurrentHp(String campaignId, String combatantId, int value) {
        if (value < 0) {
            throw new CombatException(CombatErrorCode.INVALID_AMOUNT, "hp must not be negative: " + value);
        }
        // 串行区可重入：读当前值与后续伤害 / 治疗在同一次持锁内完成
        return roomActor.execute(campaignId, ctx -> {
            Encounter enc = loadEncounter(campaignId).orElse(null);
            CombatantSnapshot snap = enc == null ? null : enc.combatant(combatantId);
            int current = snap != null && !snap.getKind().isPlayerCharacter()
                    ? snap.getCurrentHp()
                    : requireCharacter(campaignId, combatantId).getCurrentHp();
            int delta = value - current;
            return delta <= 0
                    ? applyDamage(campaignId, combatantId, -delta, false)
                    : applyHealing(campaignId, combatantId, delta);
        });
    }

    /** 敌人 / NPC：只存在于遭遇战中，0 生命即被击败 */
    private CombatantVitals changeSnapshotHp(OperationContext ctx, String campaignId, Encounter enc,
                                             CombatantSnapshot snap, int amount, boolean healing) {
        int before = snap.getCurrentHp();
        boolean wasDefeated = snap.isDefeated();
        int after = healing
                ? HitPointRules.heal(before, snap.getMaxHp(), amount)
                : HitPointRules.damage(before, 0, amount).currentHp();
        if (after == before && wasDefeated == (after == 0)) {
            return vitals(snap);
        }
        snap.setCurrentHp(after);
        snap.setDefeated(after == 0);
        long seq = enc.nextVersion();

        ctx.checkpoint();
        encounterRepo.save(campaignId, enc);
        ctx.commit();

        log.info("{} campaign={} target={} hp {} -> {} defeated={}",
                healing ? "治疗" : "伤害", campaignId, snap.getId(), before, after, snap.isDefeated());
        if (after != before) {
            router.characterStateUpdated(campaignId, new CharacterStatePayload(snap.getId(), "currentHp", after), seq);
        }
        if (wasDefeated != snap.isDefeated()) {
            router.characterStateUpdated(campaignId,
                    new CharacterStatePayload(snap.getId(), "isDefeated", snap.isDefeated()), seq);
        }
        return vitals(snap);
    }

    /**
     * 名册角色的生命变化。PC 走濒死检定规则；名册中的其他类型只做加减。
     * snap 不为 null 表示该角色正在战斗中，需要双写。
     */
    private CombatantVitals changeCharacter(OperationContext ctx, String campaignId, Encounter enc,
                                            CombatantSnapshot snap, CharacterRecord rec, DeathSaveEvent event) {
        VitalState before = VitalState.of(rec);
        VitalState after;
        if (kindOf(rec).isPlayerCharacter()) {
            DeathSaveResult r = DeathSaveRules.apply(before, event);
            after = r.state();
            log.debug("濒死规则 campaign={} character={} outcome={}", campaignId, rec.getId(), r.outcome());
        } else {
            after = plainHp(before, event);
        }
        if (after.equals(before)) {
            return vitals(rec);
        }
        after.applyTo(rec);
        long seq = 0;
        if (snap != null) {
            snap.setCurrentHp(after.currentHp());
            snap.setDefeated(after.dead());
            seq = enc.nextVersion();
        }
        persist(ctx, campaignId, rec, snap != null ? enc : null);

        log.info("生命变化 campaign={} character={} hp {} -> {} temp {} -> {} conditions={} saves={}/{}",
                campaignId, rec.getId(), before.currentHp(), after.currentHp(), before.tempHp(), after.tempHp(),
                after.conditions(), after.successes(), after.failures());
        publishVitalChanges(campaignId, rec.getId(), before, after, snap != null, seq);
        return vitals(rec);
    }

    private static VitalState plainHp(VitalState s, DeathSaveEvent e) {
        if (e.type() == DeathSaveEvent.Type.HEALING) {
            return new VitalState(HitPointRules.heal(s.currentHp(), s.maxHp(), e.value()), s.maxHp(), s.tempHp(),
                    s.conditions(), 0, 0);
        }
        HitPointRules.DamageSplit d = HitPointRules.damage(s.currentHp(), s.tempHp(), e.value());
        return new VitalState(d.currentHp(), s.maxHp(), d.tempHp(), s.conditions(), 0, 0);
    }

    // ==================== 先攻 ====================

    @Override
    public InitiativeSetPayload setInitiative(String campaignId, String combatantId, int value) {
        return roomActor.execute(campaignId, ctx -> {
            Encounter enc = requireActive(campaignId);
            CombatantSnapshot snap = requireCombatant(enc, combatantId);
            String current = enc.currentCombatantId();

            snap.setInitiative(value);
            // 与开战时相同的全序，同分时按调整值 / 名字 / id
            enc.getTurnOrder().sort(Comparator.comparing(enc::combatant, TurnOrderRules.INITIATIVE_ORDER));
            enc.setCurrentTurnIndex(enc.getTurnOrder().indexOf(current));
            long seq = enc.nextVersion();

            ctx.checkpoint();
            encounterRepo.save(campaignId, enc);
            ctx.commit();

            log.info("设置先攻 campaign={} combatant={} initiative={} order={}",
                    campaignId, combatantId, value, enc.getTurnOrder());
            InitiativeSetPayload payload = new InitiativeSetPayload(combatantId, value,
                    List.copyOf(enc.getTurnOrder()), enc.getCurrentTurnIndex());
            router.initiativeSet(campaignId, payload, seq);
            return payload;
        });
    }

    // ==================== 濒死检定 / 状态 ====================

    @Override
    public DeathSavePayload recordDeathSave(String campaignId, String characterId, int roll) {
        if (roll < 1 || roll > 20) {
            throw new CombatException(CombatErrorCode.INVALID_DEATH_SAVE, "death save roll must be 1..20: " + roll);
        }
        return roomActor.execute(campaignId, ctx -> {
            Encounter enc = loadEncounter(campaignId).orElse(null);
            CharacterRecord rec = requireCharacter(campaignId, characterId);
            if (!kindOf(rec).isPlayerCharacter()) {
                throw new CombatException(CombatErrorCode.INVALID_DEATH_SAVE, characterId + " is not a player character");
            }
            VitalState before = VitalState.of(rec);
            if (!DeathSaveRules.canRoll(before)) {
                throw new CombatException(CombatErrorCode.INVALID_DEATH_SAVE,
                        characterId + " cannot roll a death save (hp=" + before.currentHp()
                                + ", conditions=" + before.conditions() + ")");
            }
            CombatantSnapshot snap = enc == null ? null : enc.combatant(characterId);
            changeCharacter(ctx, campaignId, enc, snap, rec, DeathSaveEvent.roll(roll));
            log.info("濒死检定 campaign={} character={} roll={}", campaignId, characterId, roll);
            return deathSavePayload(rec.getId(), VitalState.of(rec));
        });
    }

    @Override
    public CombatantVitals setCondition(String campaignId, String characterId, String condition, boolean on) {
        if (StringUtils.isBlank(condition)) {
            throw new CombatException(CombatErrorCode.INVALID_COMMAND, "condition must not be blank");
        }
        String cond = condition.trim();
        return roomActor.execute(campaignId, ctx -> {
            Encounter enc = loadEncounter(campaignId).orElse(null);
            CharacterRecord rec = requireCharacter(campaignId, characterId);
            Set<String> conds = new LinkedHashSet<>(rec.getConditions() == null ? Set.of() : rec.getConditions());
            boolean changed = on ? conds.add(cond) : conds.remove(cond);
            if (!changed) {
                return vitals(rec);
            }
            rec.setConditions(conds);

            // 手动标记 / 取消 Dead 会影响遭遇战中的 isDefeated，需要双写
            CombatantSnapshot snap = enc == null ? null : enc.combatant(characterId);
            boolean syncDefeated = snap != null && Conditions.DEAD.equals(cond) && snap.isDefeated() != on;
            long seq = 0;
            if (syncDefeated) {
                snap.setDefeated(on);
                seq = enc.nextVersion();
            }
            persist(ctx, campaignId, rec, syncDefeated ? enc : null);

            log.info("状态变更 campaign={} character={} {}{}", campaignId, characterId, on ? "+" : "-", cond);
            router.characterStateUpdated(campaignId,
                    new CharacterStatePayload(characterId, "conditions", List.copyOf(conds)), seq);
            if (syncDefeated) {
                router.characterStateUpdated(campaignId, new CharacterStatePayload(characterId, "isDefeated", on), seq);
            }
            return vitals(rec);
        });
    }

    @Override
    public CombatantVitals replaceConditions(String campaignId, String characterId, Collection<String> conditions) {
        Set<String> target = new LinkedHashSet<>();
        if (conditions != null) {
            conditions.stream().filter(StringUtils::isNotBlank).map(String::trim).forEach(target::add);
        }
        return roomActor.execute(campaignId, ctx -> {
            CharacterRecord rec = requireCharacter(campaignId, characterId);
            Set<String> current = new LinkedHashSet<>(rec.getConditions() == null ? Set.of() : rec.getConditions());
            CombatantVitals result = vitals(rec);
            for (String c : current) {
                if (!target.contains(c)) {
                    result = setCondition(campaignId, characterId, c, false);
                }
            }
            for (String c : target) {
                if (!current.contains(c)) {
                    result = setCondition(campaignId, characterId, c, true);
                }
            }
            return result;
        });
    }

    @Override
    public CombatantVitals setStatusNotes(String campaignId, String characterId, String notes) {
        String value = StringUtils.trimToNull(notes);
        return roomActor.execute(campaignId, ctx -> {
            CharacterRecord rec = requireCharacter(campaignId, characterId);
            if (Objects.equals(rec.getStatusNotes(), value)) {
                return vitals(rec);
            }
            rec.setStatusNotes(value);
            persist(ctx, campaignId, rec, null);

            log.info("备注更新 campaign={} character={} notes={}", campaignId, characterId, value);
            router.characterStateUpdated(campaignId, new CharacterStatePayload(characterId, "statusNotes", value), 0);
            return vitals(rec);
        });
    }

    // ==================== 中途加入 / 移除 ====================

    @Override
    public CombatStatePayload addCombatant(String campaignId, CombatantEntry entry) {
        if (entry == null) {
            throw new CombatException(CombatErrorCode.INVALID_COMMAND, "missing combatant");
        }
        return roomActor.execute(campaignId, ctx -> {
            Encounter enc = requireActive(campaignId);
            CombatantSnapshot s = toSnapshot(campaignId, entry);
            if (enc.getCombatants().containsKey(s.getId())) {
                throw new CombatException(CombatErrorCode.INVALID_COMMAND, "combatant already present: " + s.getId());
            }
            String current = enc.currentCombatantId();
            List<CombatantSnapshot> ordered = enc.getTurnOrder().stream().map(enc::combatant).toList();
            int pos = TurnOrderRules.insertionIndex(ordered, s.getInitiative());
            enc.getTurnOrder().add(pos, s.getId());
            enc.getCombatants().put(s.getId(), s);
            enc.setCurrentTurnIndex(enc.getTurnOrder().indexOf(current));
            if (entry.surprised() && enc.getRoundNumber() == 1) {
                enc.getSurprisedIds().add(s.getId());
            }
            enc.nextVersion();

            ctx.checkpoint();
            encounterRepo.save(campaignId, enc);
            ctx.commit();

            log.info("加入战斗 campaign={} combatant={} initiative={} position={}",
                    campaignId, s.getId(), s.getInitiative(), pos);
            CombatStatePayload state = toState(enc);
            router.combatantAdded(campaignId, state);
            return state;
        });
    }

    @Override
    public CombatStatePayload removeCombatant(String campaignId, String combatantId) {
        return roomActor.execute(campaignId, ctx -> {
            Encounter enc = requireActive(campaignId);
            requireCombatant(enc, combatantId);
            List<String> order = enc.getTurnOrder();
            if (order.size() == 1) {
                throw new CombatException(CombatErrorCode.INVALID_COMMAND,
                        "cannot remove the last combatant; end combat instead");
            }
            int pos = order.indexOf(combatantId);
            int idx = enc.getCurrentTurnIndex();
            order.remove(pos);
            if (pos < idx) {
                idx--;
            } else if (pos == idx && idx >= order.size()) {
                // 移除的是队尾的当前行动者：轮到队首，回合数不变
                idx = 0;
            }
            enc.setCurrentTurnIndex(idx);
            enc.getCombatants().remove(combatantId);
            enc.getSurprisedIds().remove(combatantId);
            enc.nextVersion();

            ctx.checkpoint();
            encounterRepo.save(campaignId, enc);
            ctx.commit();

            log.info("移出战斗 campaign={} combatant={} index={}", campaignId, combatantId, idx);
            CombatStatePayload state = toState(enc);
            router.combatantRemoved(campaignId, state);
            return state;
        });
    }

    // ==================== 查询 ====================

    @Override
    public Optional<CombatStatePayload> getCombatState(String campaignId) {
        return roomActor.execute(campaignId, ctx -> loadEncounter(campaignId).map(this::toState));
    }

    @Override
    public CampaignSnapshot snapshot(String campaignId) {
        return roomActor.execute(campaignId, ctx -> {
            CombatStatePayload combat;
            try {
                combat = loadEncounter(campaignId).map(this::toState).orElse(null);
            } catch (CombatException e) {
                if (e.getCode() != CombatErrorCode.CORRUPT_STATE) {
                    throw e;
                }
                // 已被强制结束，快照里按“无战斗”返回
                combat = null;
            }
            return new CampaignSnapshot(campaignId, combat, rosterRepo.findAll(campaignId), System.currentTimeMillis());
        });
    }

    // ==================== 内部：读取与校验 ====================

    /**
     * 读出当前进行中的遭遇战；结构损坏时强制结束并抛 CORRUPT_STATE。
     */
    private Optional<Encounter> loadEncounter(String campaignId) {
        Optional<Encounter> found;
        try {
            found = encounterRepo.find(campaignId);
        } catch (CombatException e) {
            if (e.getCode() == CombatErrorCode.CORRUPT_STATE) {
                forceEnd(campaignId, e.getMessage());
            }
            throw e;
        }
        if (found.isEmpty() || !found.get().isActive()) {
            return Optional.empty();
        }
        Optional<String> problem = EncounterIntegrity.check(found.get());
        if (problem.isPresent()) {
            forceEnd(campaignId, problem.get());
            throw new CombatException(CombatErrorCode.CORRUPT_STATE,
                    "encounter state is corrupt (" + problem.get() + "); combat ended, please start again");
        }
        return found;
    }

    private void forceEnd(String campaignId, String reason) {
        log.error("遭遇战数据损坏，强制结束 campaign={} reason={}", campaignId, reason);
        encounterRepo.delete(campaignId);
        router.combatEnded(campaignId, 0);
    }

    private Encounter requireActive(String campaignId) {
        return loadEncounter(campaignId).orElseThrow(() ->
                new CombatException(CombatErrorCode.NO_ACTIVE_COMBAT, "no active combat in campaign " + campaignId));
    }

    private static CombatantSnapshot requireCombatant(Encounter enc, String combatantId) {
        CombatantSnapshot s = enc.combatant(combatantId);
        if (s == null) {
            throw new CombatException(CombatErrorCode.UNKNOWN_COMBATANT, "unknown combatant: " + combatantId);
        }
        return s;
    }

    private CharacterRecord requireCharacter(String campaignId, String characterId) {
        if (StringUtils.isBlank(characterId)) {
            throw new CombatException(CombatErrorCode.UNKNOWN_COMBATANT, "missing character id");
        }
        return rosterRepo.find(campaignId, characterId).orElseThrow(() ->
                new CombatException(CombatErrorCode.UNKNOWN_COMBATANT, "unknown combatant: " + characterId));
    }

    // ==================== 内部：写入 ====================

    /**
     * 名册优先、遭遇战其次的双写。
     * 名册写成功即越过“不可回头点”；遭遇战写失败抛 PARTIAL_UPDATE（可整体重试，但这里不自动重试）。
     */
    private void persist(OperationContext ctx, String campaignId, CharacterRecord rec, Encounter enc) {
        ctx.checkpoint();
        rosterRepo.save(campaignId, rec);
        ctx.commit();
        if (enc == null) {
            return;
        }
        try {
            encounterRepo.save(campaignId, enc);
        } catch (RuntimeException e) {
            log.error("双写只完成一半：名册已更新，遭遇战写入失败 campaign={} character={}", campaignId, rec.getId(), e);
            throw new CombatException(CombatErrorCode.PARTIAL_UPDATE,
                    "roster updated but encounter write failed for " + rec.getId() + "; retry the whole operation", e);
        }
    }

    // ==================== 内部：广播与转换 ====================

    private void publishVitalChanges(String campaignId, String id, VitalState before, VitalState after,
                                     boolean inCombat, long seq) {
        if (before.currentHp() != after.currentHp()) {
            router.characterStateUpdated(campaignId, new CharacterStatePayload(id, "currentHp", after.currentHp()), seq);
        }
        if (before.tempHp() != after.tempHp()) {
            router.characterStateUpdated(campaignId, new CharacterStatePayload(id, "tempHp", after.tempHp()), seq);
        }
        if (!before.conditions().equals(after.conditions())) {
            router.characterStateUpdated(campaignId,
                    new CharacterStatePayload(id, "conditions", List.copyOf(after.conditions())), seq);
        }
        if (inCombat && before.dead() != after.dead()) {
            router.characterStateUpdated(campaignId, new CharacterStatePayload(id, "isDefeated", after.dead()), seq);
        }
        boolean deathSaveChanged = before.successes() != after.successes()
                || before.failures() != after.failures()
                || before.unconscious() != after.unconscious()
                || before.stable() != after.stable()
                || before.dead() != after.dead();
        if (deathSaveChanged) {
            router.deathSaveUpdated(campaignId, deathSavePayload(id, after), seq);
        }
    }

    private static DeathSavePayload deathSavePayload(String id, VitalState s) {
        return new DeathSavePayload(id, s.successes(), s.failures(), s.stable(), s.dead(), s.unconscious(),
                s.currentHp());
    }

    private CombatStatePayload toState(Encounter enc) {
        List<CombatantInfo> infos = new ArrayList<>();
        for (String id : enc.getTurnOrder()) {
            CombatantSnapshot s = enc.combatant(id);
            infos.add(new CombatantInfo(s.getId(), s.getName(), s.getKind().label(), s.getInitiative(),
                    s.getCurrentHp(), s.getMaxHp(), s.getArmorClass(), s.isDefeated(),
                    enc.getSurprisedIds().contains(id)));
        }
        return new CombatStatePayload(enc.getId(), enc.isActive(), enc.getRoundNumber(), infos,
                enc.getCurrentTurnIndex(), enc.currentCombatantId(), enc.getVersion());
    }

    private static CombatantVitals vitals(CombatantSnapshot s) {
        return new CombatantVitals(s.getId(), s.getCurrentHp(), s.getMaxHp(), 0, s.isDefeated(), Set.of(), 0, 0);
    }

    private static CombatantVitals vitals(CharacterRecord r) {
        return new CombatantVitals(r.getId(), r.getCurrentHp(), r.getMaxHp(), r.getTempHp(), r.isDead(),
                Set.copyOf(r.getConditions() == null ? Set.of() : r.getConditions()),
                r.getDeathSaveSuccesses(), r.getDeathSaveFailures());
    }

    // ==================== 内部：构造参战单位 ====================

    private CombatantSnapshot toSnapshot(String campaignId, CombatantEntry e) {
        if (e == null) {
            throw new CombatException(CombatErrorCode.INVALID_COMMAND, "missing combatant entry");
        }
        CombatantKind kind = e.kind() == null ? CombatantKind.ENEMY : e.kind();
        if (kind.isPlayerCharacter()) {
            CharacterRecord rec = requireCharacter(campaignId, e.id());
            int init = e.initiative() != null ? e.initiative() : rollInitiative(rec.getInitiativeModifier());
            return fromRecord(rec, init);
        }
        if (StringUtils.isBlank(e.name())) {
            throw new CombatException(CombatErrorCode.INVALID_COMMAND, "combatant name must not be blank");
        }
        if (e.maxHp() < 1) {
            throw new CombatException(CombatErrorCode.INVALID_AMOUNT, "maxHp must be positive: " + e.maxHp());
        }
        int hp = e.currentHp() == null ? e.maxHp() : e.currentHp();
        if (hp < 0 || hp > e.maxHp()) {
            throw new CombatException(CombatErrorCode.INVALID_AMOUNT, "currentHp out of range: " + hp);
        }
        String id = StringUtils.isBlank(e.id())
                ? kind.label().toLowerCase() + "-" + UUID.randomUUID().toString().substring(0, 8)
                : e.id();
        int init = e.initiative() != null ? e.initiative() : rollInitiative(e.initiativeModifier());
        return CombatantSnapshot.builder()
                .id(id)
                .name(e.name())
                .kind(kind)
                .initiative(init)
                .initiativeModifier(e.initiativeModifier())
                .currentHp(hp)
                .maxHp(e.maxHp())
                .armorClass(e.armorClass())
                .defeated(hp == 0)
                .build();
    }

    private static CombatantSnapshot fromRecord(CharacterRecord rec, int initiative) {
        return CombatantSnapshot.builder()
                .id(rec.getId())
                .name(rec.getName())
                .kind(kindOf(rec))
                .initiative(initiative)
                .initiativeModifier(rec.getInitiativeModifier())
                .currentHp(rec.getCurrentHp())
                .maxHp(rec.getMaxHp())
                .armorClass(rec.getArmorClass())
                .defeated(rec.isDead())
                .build();
    }

    private static CombatantKind kindOf(CharacterRecord rec) {
        return rec.getKind() == null ? CombatantKind.PC : rec.getKind();
    }

    private static void putUnique(Map<String, CombatantSnapshot> byId, CombatantSnapshot s) {
        if (byId.putIfAbsent(s.getId(), s) != null) {
            throw new CombatException(CombatErrorCode.INVALID_COMMAND, "duplicate combatant id: " + s.getId());
        }
    }

    private int rollInitiative(int modifier) {
        return dice.d20() + modifier;
    }
}
