package com.tablehub.combatservice.games.combat.service;

import com.tablehub.combatservice.games.combat.domain.dto.CampaignSnapshot;
import com.tablehub.combatservice.games.combat.domain.dto.CombatantEntry;
import com.tablehub.combatservice.games.combat.domain.dto.CombatantVitals;
import com.tablehub.combatservice.games.combat.domain.dto.PartyInitiative;
import com.tablehub.combatservice.platform.notify.HubPayloads.CombatStatePayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.DeathSavePayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.InitiativeSetPayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.TurnAdvancedPayload;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 战斗状态机：NoCombat -> CombatActive(round, turnIndex) -> NoCombat。
 *
 * 所有写操作都在战役串行区内执行，校验全部在第一次写入之前完成；
 * 失败时抛 CombatException，聚合保持原样。广播在写入成功之后发出。
 */
public interface CombatEngine {

    /** 开战；已有遭遇战时 ALREADY_ACTIVE */
    CombatStatePayload startCombat(String campaignId, List<PartyInitiative> party, List<CombatantEntry> others);

    /** 推进到下一个未被击败的单位；越过队尾回合数 +1 */
    TurnAdvancedPayload advanceTurn(String campaignId);

    /** 结束战斗：只丢弃遭遇战，名册保持不变 */
    void endCombat(String campaignId);

    CombatantVitals applyDamage(String campaignId, String combatantId, int amount, boolean critical);

    CombatantVitals applyHealing(String campaignId, String combatantId, int amount);

    /**
     * 把当前生命设为指定值：换算成伤害 / 治疗差值，仍然经过临时生命与濒死检定规则。
     */
    CombatantVitals setCurrentHp(String campaignId, String combatantId, int value);

    /** 修改先攻并重新排序，当前行动者保持不变 */
    InitiativeSetPayload setInitiative(String campaignId, String combatantId, int value);

    /** 记录一次濒死检定（1..20） */
    DeathSavePayload recordDeathSave(String campaignId, String characterId, int roll);

    /** 添加 / 移除名册角色的状态，有无战斗均可 */
    CombatantVitals setCondition(String campaignId, String characterId, String condition, boolean on);

    /** 用给定集合整体替换名册角色的状态 */
    CombatantVitals replaceConditions(String campaignId, String characterId, Collection<String> conditions);

    /** 修改名册角色的备注（只写名册，不影响遭遇战） */
    CombatantVitals setStatusNotes(String campaignId, String characterId, String notes);

    /** 战斗中途加入 */
    CombatStatePayload addCombatant(String campaignId, CombatantEntry entry);

    /** 逃跑 / 撤出：从先攻表中移除 */
    CombatStatePayload removeCombatant(String campaignId, String combatantId);

    Optional<CombatStatePayload> getCombatState(String campaignId);

    /** 重连后的完整快照 */
    CampaignSnapshot snapshot(String campaignId);
}
