package com.tablehub.combatservice.games.combat.domain.repository;

import com.tablehub.combatservice.games.combat.domain.model.CharacterRecord;

import java.util.List;
import java.util.Optional;

/**
 * 角色名册仓储（权威数据源）。
 * 名册条目的创建与编辑由外部系统负责，这里只读取和回写战斗相关字段。
 */
public interface RosterRepository {

    Optional<CharacterRecord> find(String campaignId, String characterId);

    List<CharacterRecord> findAll(String campaignId);

    void save(String campaignId, CharacterRecord record);
}
