package com.tablehub.combatservice.platform.notify;

import com.tablehub.combatservice.platform.connection.Audience;

/**
 * 推送事件类型及其固定受众。受众不可配置，新增事件时在这里一并决定。
 */
public enum GameEventType {

    // 战斗
    CombatStarted(Audience.ALL),
    TurnAdvanced(Audience.ALL),
    InitiativeSet(Audience.ALL),
    CombatantAdded(Audience.ALL),
    CombatantRemoved(Audience.ALL),
    CombatEnded(Audience.ALL),

    // 角色状态
    CharacterStateUpdated(Audience.ALL),
    DeathSaveUpdated(Audience.ALL),

    // 连接
    PlayerConnected(Audience.DM),
    PlayerDisconnected(Audience.DM),

    // 叙事（DM 专属提示）
    ReadAloudTextReceived(Audience.DM),
    PlayerChoiceSubmitted(Audience.DM),

    // 玩家屏幕氛围
    PlayerChoicesReceived(Audience.PLAYERS),
    AtmospherePulseReceived(Audience.PLAYERS),
    NarrativeAnchorUpdated(Audience.PLAYERS),
    GroupInsightTriggered(Audience.PLAYERS),

    // 公共展示
    SceneImageUpdated(Audience.ALL),
    PlayerRollLogged(Audience.ALL);

    private final Audience audience;

    GameEventType(Audience audience) {
        this.audience = audience;
    }

    public Audience audience() {
        return audience;
    }
}
