package com.tablehub.combatservice.support;

import com.tablehub.combatservice.games.combat.domain.error.CombatErrorCode;
import com.tablehub.combatservice.games.combat.domain.error.CombatException;
import com.tablehub.combatservice.games.combat.domain.model.Encounter;
import com.tablehub.combatservice.games.combat.domain.repository.EncounterRepository;
import org.springframework.dao.QueryTimeoutException;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 测试用遭遇战仓储：读写都做深拷贝，模拟“序列化后落库”的效果。
 */
public class InMemoryEncounterRepository implements EncounterRepository {

    private final Map<String, Encounter> store = new ConcurrentHashMap<>();
    private volatile boolean failSaves;
    private volatile boolean corrupt;
    private int saves;

    @Override
    public Optional<Encounter> find(String campaignId) {
        if (corrupt) {
            throw new CombatException(CombatErrorCode.CORRUPT_STATE, "cannot decode encounter");
        }
        Encounter e = store.get(campaignId);
        return e == null ? Optional.empty() : Optional.of(e.copy());
    }

    @Override
    public void save(String campaignId, Encounter encounter) {
        if (failSaves) {
            throw new QueryTimeoutException("redis timeout");
        }
        saves++;
        store.put(campaignId, encounter.copy());
    }

    @Override
    public void delete(String campaignId) {
        store.remove(campaignId);
        corrupt = false;
    }

    /** 直接放入原始数据（可以是不合法的结构） */
    public void putRaw(String campaignId, Encounter encounter) {
        store.put(campaignId, encounter);
    }

    public Encounter peek(String campaignId) {
        return store.get(campaignId);
    }

    public void failSaves(boolean fail) {
        this.failSaves = fail;
    }

    public void corrupt(boolean corrupt) {
        this.corrupt = corrupt;
    }

    public int saves() {
        return saves;
    }
}
