package com.tablehub.combatservice.platform.connection;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 在线连接注册表（进程内，不持久化）。
 *
 * Responsibilities:
 * - connectionId -> ConnectionRecord；
 * - 每个战役的分组成员：dm / players / all；
 * - 重连视为一次全新的 join，不做任何事件补发。
 *
 * 写操作整体加锁，保证记录表与分组表同时更新；读操作直接走并发容器。
 */
@Slf4j
@Component
public class ConnectionRegistry {

    private final Map<String, ConnectionRecord> connections = new ConcurrentHashMap<>();
    private final Map<String, Map<Audience, Set<String>>> groups = new ConcurrentHashMap<>();

    /**
     * 登记连接并加入分组。同一个 connectionId 重复 join 时先移除旧记录。
     */
    public synchronized ConnectionRecord join(String connectionId, String campaignId, String userId,
                                              String userName, String characterId, boolean isDm) {
        if (StringUtils.isAnyBlank(connectionId, campaignId, userId)) {
            throw new IllegalArgumentException("connectionId / campaignId / userId 不能为空");
        }
        leave(connectionId);
        ConnectionRecord rec = new ConnectionRecord(connectionId, campaignId, userId,
                StringUtils.defaultIfBlank(userName, userId), StringUtils.trimToNull(characterId),
                isDm, System.currentTimeMillis());
        connections.put(connectionId, rec);
        Map<Audience, Set<String>> g = groups.computeIfAbsent(campaignId, k -> newGroupTable());
        g.get(rec.roleAudience()).add(connectionId);
        g.get(Audience.ALL).add(connectionId);
        log.info("连接加入战役: conn={}, campaign={}, user={}, dm={}, character={}",
                connectionId, campaignId, userId, isDm, rec.characterId());
        return rec;
    }

    /**
     * 移除连接及其分组成员关系；战役下无人时清理该战役的分组表。
     *
     * @return 被移除的记录；连接未登记时为 empty
     */
    public synchronized Optional<ConnectionRecord> leave(String connectionId) {
        if (connectionId == null) {
            return Optional.empty();
        }
        ConnectionRecord rec = connections.remove(connectionId);
        if (rec == null) {
            return Optional.empty();
        }
        Map<Audience, Set<String>> g = groups.get(rec.campaignId());
        if (g != null) {
            g.values().forEach(s -> s.remove(connectionId));
            if (g.get(Audience.ALL).isEmpty()) {
                groups.remove(rec.campaignId());
            }
        }
        log.info("连接离开战役: conn={}, campaign={}, user={}", connectionId, rec.campaignId(), rec.userId());
        return Optional.of(rec);
    }

    public Optional<ConnectionRecord> find(String connectionId) {
        return connectionId == null ? Optional.empty() : Optional.ofNullable(connections.get(connectionId));
    }

    /** 分组成员的快照（不可变） */
    public Set<String> members(String campaignId, Audience audience) {
        Map<Audience, Set<String>> g = groups.get(campaignId);
        if (g == null) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(g.get(audience)));
    }

    public boolean isMember(String connectionId, String campaignId, Audience audience) {
        Map<Audience, Set<String>> g = groups.get(campaignId);
        return g != null && g.get(audience).contains(connectionId);
    }

    /** 某战役当前在线的玩家连接（不含 DM），按连接时间排序 */
    public List<ConnectionRecord> connectedPlayers(String campaignId) {
        List<ConnectionRecord> out = new ArrayList<>();
        for (String id : members(campaignId, Audience.PLAYERS)) {
            ConnectionRecord r = connections.get(id);
            if (r != null) {
                out.add(r);
            }
        }
        out.sort(Comparator.comparingLong(ConnectionRecord::connectedAt));
        return out;
    }

    public boolean isUserOnline(String campaignId, String userId) {
        return connectionIdOf(campaignId, userId).isPresent();
    }

    /** 用户在该战役中最近建立的连接 */
    public Optional<String> connectionIdOf(String campaignId, String userId) {
        return members(campaignId, Audience.ALL).stream()
                .map(connections::get)
                .filter(r -> r != null && r.userId().equals(userId))
                .max(Comparator.comparingLong(ConnectionRecord::connectedAt))
                .map(ConnectionRecord::connectionId);
    }

    private static Map<Audience, Set<String>> newGroupTable() {
        Map<Audience, Set<String>> g = new EnumMap<>(Audience.class);
        for (Audience a : Audience.values()) {
            g.put(a, ConcurrentHashMap.newKeySet());
        }
        return g;
    }
}
