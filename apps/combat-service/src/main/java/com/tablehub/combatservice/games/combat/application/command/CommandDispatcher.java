package com.tablehub.combatservice.games.combat.application.command;

import com.tablehub.combatservice.engine.core.Command;
import com.tablehub.combatservice.games.combat.domain.error.CombatErrorCode;
import com.tablehub.combatservice.games.combat.domain.error.CombatException;
import com.tablehub.combatservice.games.combat.domain.model.NarrativeLogEntry;
import com.tablehub.combatservice.games.combat.domain.repository.NarrativeLogRepository;
import com.tablehub.combatservice.games.combat.service.CombatEngine;
import com.tablehub.combatservice.platform.notify.HubPayloads;
import com.tablehub.combatservice.platform.notify.NotificationRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * 命令调度器：DM 界面操作与模型工具调用的统一入口。
 *
 * Responsibilities:
 * - 工具调用先经 ToolCallParser 解析成强类型命令；
 * - 战斗命令转给 CombatEngine，叙事命令直接交给 NotificationRouter（叙事日志只落库，不推送）；
 * - 所有失败都转换为 CommandResult，调用方拿到的是结果而不是异常。
 *
 * 不做任何自动重试：PARTIAL_UPDATE 只告知调用方“可以整体重试”。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandDispatcher {

    private final CombatEngine engine;
    private final NotificationRouter router;
    private final ToolCallParser parser;
    private final NarrativeLogRepository narrativeLog;

    /** 解析并执行一次工具调用 */
    public CommandResult dispatchToolCall(String campaignId, String toolName, Map<String, Object> arguments) {
        Command command;
        try {
            command = parser.parse(toolName, arguments);
        } catch (CombatException e) {
            log.warn("工具调用解析失败 campaign={} tool={} reason={}", campaignId, toolName, e.getMessage());
            return CommandResult.failure(toolName, e.getCode(), e.getMessage());
        }
        return dispatch(campaignId, command);
    }

    public CommandResult dispatch(String campaignId, Command command) {
        if (StringUtils.isBlank(campaignId)) {
            return CommandResult.failure(command == null ? null : command.name(),
                    CombatErrorCode.INVALID_COMMAND, "missing campaignId");
        }
        if (command == null) {
            return CommandResult.failure(null, CombatErrorCode.INVALID_COMMAND, "missing command");
        }
        try {
            Object data;
            if (command instanceof CombatCommand c) {
                data = execute(campaignId, c);
            } else if (command instanceof NarrationCommand n) {
                data = narrate(campaignId, n);
            } else {
                throw new CombatException(CombatErrorCode.INVALID_COMMAND, "unsupported command: " + command.name());
            }
            return CommandResult.ok(command.name(), data);
        } catch (CombatException e) {
            if (e.getCode() == CombatErrorCode.PARTIAL_UPDATE || e.getCode() == CombatErrorCode.CORRUPT_STATE) {
                log.error("命令失败 campaign={} command={} code={} msg={}",
                        campaignId, command.name(), e.getCode(), e.getMessage());
            } else {
                log.info("命令被拒绝 campaign={} command={} code={} msg={}",
                        campaignId, command.name(), e.getCode(), e.getMessage());
            }
            return CommandResult.failure(command.name(), e.getCode(), e.getMessage());
        } catch (DataAccessException e) {
            // 首次写入之前的存储异常：什么都没写，可以重试
            log.error("存储不可用 campaign={} command={}", campaignId, command.name(), e);
            return CommandResult.failure(command.name(), CombatErrorCode.STORE_UNAVAILABLE, "state store unavailable");
        }
    }

    private Object execute(String campaignId, CombatCommand command) {
        if (command instanceof CombatCommand.StartCombat c) {
            return engine.startCombat(campaignId, c.party(), c.enemies());
        }
        if (command instanceof CombatCommand.AdvanceTurn) {
            return engine.advanceTurn(campaignId);
        }
        if (command instanceof CombatCommand.EndCombat) {
            engine.endCombat(campaignId);
            return null;
        }
        if (command instanceof CombatCommand.GetCombatState) {
            return engine.getCombatState(campaignId).orElse(null);
        }
        if (command instanceof CombatCommand.ApplyDamage c) {
            return engine.applyDamage(campaignId, c.combatantId(), c.amount(), c.critical());
        }
        if (command instanceof CombatCommand.ApplyHealing c) {
            return engine.applyHealing(campaignId, c.combatantId(), c.amount());
        }
        if (command instanceof CombatCommand.SetCurrentHp c) {
            return engine.setCurrentHp(campaignId, c.combatantId(), c.value());
        }
        if (command instanceof CombatCommand.SetInitiative c) {
            return engine.setInitiative(campaignId, c.combatantId(), c.value());
        }
        if (command instanceof CombatCommand.RecordDeathSave c) {
            return engine.recordDeathSave(campaignId, c.characterId(), c.roll());
        }
        if (command instanceof CombatCommand.SetCondition c) {
            return engine.setCondition(campaignId, c.characterId(), c.condition(), c.on());
        }
        if (command instanceof CombatCommand.ReplaceConditions c) {
            return engine.replaceConditions(campaignId, c.characterId(), c.conditions());
        }
        if (command instanceof CombatCommand.SetStatusNotes c) {
            return engine.setStatusNotes(campaignId, c.characterId(), c.notes());
        }
        if (command instanceof CombatCommand.AddCombatant c) {
            return engine.addCombatant(campaignId, c.entry());
        }
        if (command instanceof CombatCommand.RemoveCombatant c) {
            return engine.removeCombatant(campaignId, c.combatantId());
        }
        throw new CombatException(CombatErrorCode.INVALID_COMMAND, "unsupported command: " + command.name());
    }

    private Object narrate(String campaignId, NarrationCommand command) {
        if (command instanceof NarrationCommand.UpdateGameLog c) {
            NarrativeLogEntry entry = NarrativeLogEntry.builder()
                    .id(UUID.randomUUID().toString())
                    .entry(c.entry())
                    .importance(c.importance())
                    .createdAt(System.currentTimeMillis())
                    .build();
            narrativeLog.append(campaignId, entry);
            log.info("叙事日志 campaign={} importance={} entry={}", campaignId, entry.getImportance(),
                    StringUtils.abbreviate(entry.getEntry(), 50));
            return entry;
        }
        if (command instanceof NarrationCommand.ReadAloud c) {
            HubPayloads.ReadAloudPayload p = new HubPayloads.ReadAloudPayload(c.text(), c.tone(), c.pacing());
            router.readAloudText(campaignId, p);
            return p;
        }
        if (command instanceof NarrationCommand.PresentChoices c) {
            HubPayloads.PlayerChoicesPayload p = new HubPayloads.PlayerChoicesPayload(c.choices());
            router.playerChoices(campaignId, p);
            return p;
        }
        if (command instanceof NarrationCommand.LogPlayerRoll c) {
            HubPayloads.PlayerRollPayload p = new HubPayloads.PlayerRollPayload(c.characterId(),
                    StringUtils.defaultIfBlank(c.characterName(), c.characterId()), c.checkType(), c.result(), c.outcome());
            router.playerRoll(campaignId, p);
            return p;
        }
        if (command instanceof NarrationCommand.UpdateSceneImage c) {
            HubPayloads.SceneImagePayload p = new HubPayloads.SceneImagePayload(c.imageUrl(), c.description());
            router.sceneImage(campaignId, p);
            return p;
        }
        if (command instanceof NarrationCommand.AtmospherePulse c) {
            HubPayloads.AtmospherePulsePayload p =
                    new HubPayloads.AtmospherePulsePayload(c.text(), c.intensity(), c.sensoryType());
            router.atmospherePulse(campaignId, p);
            return p;
        }
        if (command instanceof NarrationCommand.NarrativeAnchor c) {
            HubPayloads.NarrativeAnchorPayload p = new HubPayloads.NarrativeAnchorPayload(c.shortText(), c.moodCategory());
            router.narrativeAnchor(campaignId, p);
            return p;
        }
        if (command instanceof NarrationCommand.GroupInsight c) {
            HubPayloads.GroupInsightPayload p =
                    new HubPayloads.GroupInsightPayload(c.text(), c.relevantSkill(), c.highlightEffect());
            router.groupInsight(campaignId, p);
            return p;
        }
        throw new CombatException(CombatErrorCode.INVALID_COMMAND, "unsupported command: " + command.name());
    }
}
