package com.tablehub.combatservice.platform.notify;

import com.tablehub.combatservice.platform.notify.HubPayloads.AtmospherePulsePayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.CharacterStatePayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.CombatStatePayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.DeathSavePayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.GroupInsightPayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.InitiativeSetPayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.NarrativeAnchorPayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.PlayerChoicePayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.PlayerChoicesPayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.PlayerConnectionPayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.PlayerRollPayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.ReadAloudPayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.SceneImagePayload;
import com.tablehub.combatservice.platform.notify.HubPayloads.TurnAdvancedPayload;
import com.tablehub.combatservice.platform.transport.Envelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 通知路由（无状态）。
 *
 * Responsibilities:
 * - 根据事件类型确定受众分组（固定映射，见 GameEventType）；
 * - 把载荷包装成统一的 Envelope 后交给 HubTransport 发送；
 * - 发送是“发出即忘”：任何投递异常都在这里止步，不影响已提交的状态。
 *
 * 分组成员关系由 ConnectionRegistry 与订阅拦截器维护，路由本身不持有任何可变状态。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationRouter {

    private final HubTransport transport;

    public void publish(String campaignId, GameEventType type, Object payload) {
        publish(campaignId, type, payload, 0L);
    }

    /**
     * @param seq 遭遇战 version；与战斗无关的事件传 0
     */
    public void publish(String campaignId, GameEventType type, Object payload, long seq) {
        String group = type.audience().groupOf(campaignId);
        Envelope<Object> env = Envelope.event(type.name(), campaignId, payload, seq);
        try {
            transport.sendToGroup(group, env);
            log.debug("广播 {} -> {} seq={}", type, group, seq);
        } catch (RuntimeException e) {
            log.warn("广播异常已忽略 {} -> {}", type, group, e);
        }
    }

    // ---------- 战斗 ----------

    public void combatStarted(String campaignId, CombatStatePayload state) {
        publish(campaignId, GameEventType.CombatStarted, state, state.version());
    }

    public void turnAdvanced(String campaignId, TurnAdvancedPayload payload, long seq) {
        publish(campaignId, GameEventType.TurnAdvanced, payload, seq);
    }

    public void initiativeSet(String campaignId, InitiativeSetPayload payload, long seq) {
        publish(campaignId, GameEventType.InitiativeSet, payload, seq);
    }

    public void combatantAdded(String campaignId, CombatStatePayload state) {
        publish(campaignId, GameEventType.CombatantAdded, state, state.version());
    }

    public void combatantRemoved(String campaignId, CombatStatePayload state) {
        publish(campaignId, GameEventType.CombatantRemoved, state, state.version());
    }

    /** 无载荷：客户端丢弃本地战斗状态 */
    public void combatEnded(String campaignId, long seq) {
        publish(campaignId, GameEventType.CombatEnded, null, seq);
    }

    public void characterStateUpdated(String campaignId, CharacterStatePayload payload, long seq) {
        publish(campaignId, GameEventType.CharacterStateUpdated, payload, seq);
    }

    public void deathSaveUpdated(String campaignId, DeathSavePayload payload, long seq) {
        publish(campaignId, GameEventType.DeathSaveUpdated, payload, seq);
    }

    // ---------- 连接 ----------

    public void playerConnected(String campaignId, PlayerConnectionPayload payload) {
        publish(campaignId, GameEventType.PlayerConnected, payload);
    }

    public void playerDisconnected(String campaignId, PlayerConnectionPayload payload) {
        publish(campaignId, GameEventType.PlayerDisconnected, payload);
    }

    // ---------- 叙事 ----------

    public void readAloudText(String campaignId, ReadAloudPayload payload) {
        publish(campaignId, GameEventType.ReadAloudTextReceived, payload);
    }

    public void playerChoiceSubmitted(String campaignId, PlayerChoicePayload payload) {
        publish(campaignId, GameEventType.PlayerChoiceSubmitted, payload);
    }

    public void playerChoices(String campaignId, PlayerChoicesPayload payload) {
        publish(campaignId, GameEventType.PlayerChoicesReceived, payload);
    }

    public void atmospherePulse(String campaignId, AtmospherePulsePayload payload) {
        publish(campaignId, GameEventType.AtmospherePulseReceived, payload);
    }

    public void narrativeAnchor(String campaignId, NarrativeAnchorPayload payload) {
        publish(campaignId, GameEventType.NarrativeAnchorUpdated, payload);
    }

    public void groupInsight(String campaignId, GroupInsightPayload payload) {
        publish(campaignId, GameEventType.GroupInsightTriggered, payload);
    }

    public void sceneImage(String campaignId, SceneImagePayload payload) {
        publish(campaignId, GameEventType.SceneImageUpdated, payload);
    }

    public void playerRoll(String campaignId, PlayerRollPayload payload) {
        publish(campaignId, GameEventType.PlayerRollLogged, payload);
    }
}
