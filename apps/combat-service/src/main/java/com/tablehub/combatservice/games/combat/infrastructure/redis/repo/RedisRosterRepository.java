package com.tablehub.combatservice.games.combat.infrastructure.redis.repo;

import com.tablehub.combatservice.games.combat.domain.error.CombatErrorCode;
import com.tablehub.combatservice.games.combat.domain.error.CombatException;
import com.tablehub.combatservice.games.combat.domain.model.CharacterRecord;
import com.tablehub.combatservice.games.combat.domain.repository.RosterRepository;
import com.tablehub.combatservice.games.combat.infrastructure.redis.RedisKeys;
import com.tablehub.combatservice.infrastructure.redis.RedisOps;
import com.tablehub.combatservice.platform.config.CombatProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 角色名册的 Redis 仓储实现：一个战役一个 Hash。
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RedisRosterRepository implements RosterRepository {

    private final RedisOps ops;
    private final CombatProperties properties;

    /**
     * 读取单个角色。字段无法还原时抛 CORRUPT_STATE（只影响该角色，遭遇战不受牵连）。
     */
    @Override
    public Optional<CharacterRecord> find(String campaignId, String characterId) {
        try {
            return Optional.ofNullable(ops.hGet(RedisKeys.roster(campaignId), characterId, CharacterRecord.class));
        } catch (SerializationException e) {
            throw new CombatException(CombatErrorCode.CORRUPT_STATE,
                    "stored roster entry " + characterId + " cannot be read for campaign " + campaignId, e);
        }
    }

    @Override
    public List<CharacterRecord> findAll(String campaignId) {
        List<CharacterRecord> out = new ArrayList<>();
        ops.hGetAll(RedisKeys.roster(campaignId)).forEach((field, v) -> {
            if (v instanceof CharacterRecord r) {
                out.add(r);
            } else {
                log.warn("名册字段无法解析，已跳过 campaign={} field={}", campaignId, field);
            }
        });
        out.sort(Comparator.comparing(CharacterRecord::getName, Comparator.nullsLast(String::compareTo)));
        return out;
    }

    @Override
    public void save(String campaignId, CharacterRecord record) {
        // 字段与 TTL 同一事务提交：失败时名册保持原样
        ops.hSetWithTtl(RedisKeys.roster(campaignId), record.getId(), record, properties.getStateTtl());
    }
}
