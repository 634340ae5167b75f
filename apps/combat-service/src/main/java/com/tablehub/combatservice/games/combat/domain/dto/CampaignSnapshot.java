package com.tablehub.combatservice.games.combat.domain.dto;

import com.tablehub.combatservice.games.combat.domain.model.CharacterRecord;
import com.tablehub.combatservice.platform.notify.HubPayloads.CombatStatePayload;

import java.util.List;

/**
 * 断线重连后客户端拉取的完整快照：遭遇战（可能为 null）+ 名册。
 * 客户端用它整体替换本地状态，不依赖错过的增量事件。
 */
public record CampaignSnapshot(
        String campaignId,
        CombatStatePayload combat,
        List<CharacterRecord> roster,
        long serverTime
) {
}
