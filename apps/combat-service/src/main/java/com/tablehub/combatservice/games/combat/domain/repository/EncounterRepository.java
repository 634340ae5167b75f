package com.tablehub.combatservice.games.combat.domain.repository;

import com.tablehub.combatservice.games.combat.domain.model.Encounter;

import java.util.Optional;

/**
 * 遭遇战仓储：每个战役最多一个。
 */
public interface EncounterRepository {

    Optional<Encounter> find(String campaignId);

    /** 整体覆盖写入 */
    void save(String campaignId, Encounter encounter);

    void delete(String campaignId);
}
