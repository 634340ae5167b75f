package com.tablehub.combatservice.platform.notify;

import java.util.List;

/**
 * 所有推送事件的载荷定义。每个事件恰好一个结构化 record。
 */
public final class HubPayloads {

    private HubPayloads() {}

    /** 先攻列表中的一个单位 */
    public record CombatantInfo(String id, String name, String type, int initiative, int currentHp, int maxHp,
                                int armorClass, boolean isDefeated, boolean isSurprised) {}

    /** 完整战斗状态（开战、增删单位、拉取快照时使用） */
    public record CombatStatePayload(String combatId, boolean isActive, int roundNumber,
                                     List<CombatantInfo> turnOrder, int currentTurnIndex,
                                     String currentCombatantId, long version) {}

    public record TurnAdvancedPayload(String combatId, int currentTurnIndex, String currentCombatantId,
                                      int roundNumber, boolean currentIsSurprised) {}

    public record InitiativeSetPayload(String combatantId, int initiative, List<String> turnOrder,
                                       int currentTurnIndex) {}

    /** key 统一使用 lowerCamelCase：currentHp / tempHp / conditions / initiative / isDefeated */
    public record CharacterStatePayload(String characterId, String key, Object value) {}

    public record DeathSavePayload(String characterId, int successes, int failures, boolean isStable,
                                   boolean isDead, boolean isUnconscious, int currentHp) {}

    public record PlayerConnectionPayload(String playerId, String playerName, String characterId,
                                          boolean isOnline) {}

    public record ReadAloudPayload(String text, String tone, String pacing) {}

    public record PlayerChoicesPayload(List<String> choices) {}

    public record PlayerChoicePayload(String playerId, String characterId, String characterName, String choice,
                                      long timestamp) {}

    public record AtmospherePulsePayload(String text, String intensity, String sensoryType) {}

    public record NarrativeAnchorPayload(String shortText, String moodCategory) {}

    public record GroupInsightPayload(String text, String relevantSkill, boolean highlightEffect) {}

    public record SceneImagePayload(String imageUrl, String description) {}

    public record PlayerRollPayload(String characterId, String characterName, String checkType, int result,
                                    String outcome) {}
}
