package com.tablehub.combatservice.games.combat.infrastructure.redis.repo;

import com.tablehub.combatservice.games.combat.domain.error.CombatErrorCode;
import com.tablehub.combatservice.games.combat.domain.error.CombatException;
import com.tablehub.combatservice.games.combat.domain.model.NarrativeLogEntry;
import com.tablehub.combatservice.games.combat.domain.repository.NarrativeLogRepository;
import com.tablehub.combatservice.games.combat.infrastructure.redis.RedisKeys;
import com.tablehub.combatservice.infrastructure.redis.RedisOps;
import com.tablehub.combatservice.platform.config.CombatProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 叙事日志的 Redis 仓储实现：一个战役一个 List，超出上限时丢弃最旧的条目。
 */
@Repository
@RequiredArgsConstructor
public class RedisNarrativeLogRepository implements NarrativeLogRepository {

    private final RedisOps ops;
    private final CombatProperties properties;

    @Override
    public void append(String campaignId, NarrativeLogEntry entry) {
        ops.rPushCapped(RedisKeys.narrativeLog(campaignId), entry,
                Math.max(1, properties.getNarrativeLogLimit()), properties.getStateTtl());
    }

    @Override
    public List<NarrativeLogEntry> recent(String campaignId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        try {
            return ops.lRange(RedisKeys.narrativeLog(campaignId), -limit, -1, NarrativeLogEntry.class);
        } catch (SerializationException e) {
            throw new CombatException(CombatErrorCode.CORRUPT_STATE,
                    "stored narrative log cannot be read for campaign " + campaignId, e);
        }
    }
}
