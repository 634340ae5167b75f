package com.tablehub.combatservice.games.combat.infrastructure.redis.repo;

import com.tablehub.combatservice.games.combat.domain.error.CombatErrorCode;
import com.tablehub.combatservice.games.combat.domain.error.CombatException;
import com.tablehub.combatservice.games.combat.domain.model.Encounter;
import com.tablehub.combatservice.games.combat.domain.repository.EncounterRepository;
import com.tablehub.combatservice.games.combat.infrastructure.redis.RedisKeys;
import com.tablehub.combatservice.infrastructure.redis.RedisOps;
import com.tablehub.combatservice.platform.config.CombatProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * 遭遇战的 Redis 仓储实现：一个 JSON String，每次保存续期 TTL。
 */
@Repository
@RequiredArgsConstructor
public class RedisEncounterRepository implements EncounterRepository {

    private final RedisOps ops;
    private final CombatProperties properties;

    /**
     * 读取遭遇战。JSON 无法还原时抛 CORRUPT_STATE，由上层强制结束战斗。
     */
    @Override
    public Optional<Encounter> find(String campaignId) {
        try {
            return Optional.ofNullable(ops.get(RedisKeys.encounter(campaignId), Encounter.class));
        } catch (SerializationException e) {
            throw new CombatException(CombatErrorCode.CORRUPT_STATE,
                    "stored encounter cannot be read for campaign " + campaignId, e);
        }
    }

    @Override
    public void save(String campaignId, Encounter encounter) {
        ops.setEx(RedisKeys.encounter(campaignId), encounter, properties.getStateTtl());
    }

    @Override
    public void delete(String campaignId) {
        ops.del(RedisKeys.encounter(campaignId));
    }
}
