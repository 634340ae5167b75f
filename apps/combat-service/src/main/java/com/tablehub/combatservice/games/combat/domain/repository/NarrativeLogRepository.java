package com.tablehub.combatservice.games.combat.domain.repository;

import com.tablehub.combatservice.games.combat.domain.model.NarrativeLogEntry;

import java.util.List;

/**
 * 叙事日志仓储：只追加，按时间顺序读取最近的若干条。
 */
public interface NarrativeLogRepository {

    void append(String campaignId, NarrativeLogEntry entry);

    /** 最近 limit 条，旧的在前 */
    List<NarrativeLogEntry> recent(String campaignId, int limit);
}
