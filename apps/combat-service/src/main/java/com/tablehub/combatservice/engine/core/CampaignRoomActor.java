package com.tablehub.combatservice.engine.core;

import com.tablehub.combatservice.games.combat.domain.error.CombatErrorCode;
import com.tablehub.combatservice.games.combat.domain.error.CombatException;
import com.tablehub.combatservice.platform.config.CombatProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 战役级串行边界（每个战役一个逻辑“房间 actor”）。
 *
 * Responsibilities:
 * - 同一战役的所有读-改-写操作按到达顺序串行执行（公平锁）；
 * - DM 界面操作与模型工具调用可能并发到达，这里保证不会互相覆盖；
 * - 等锁超过 combat.operation-timeout 视为取消，不写任何数据。
 *
 * 锁本身只在进程内有效，数据全部落在 Redis，重启不会丢失进行中的遭遇战。
 * 每把锁带一个使用计数（等待中 + 持有中），计数归零时从表中移除，空闲战役不占内存。
 */
@Slf4j
@Component
public class CampaignRoomActor {

    private final ConcurrentMap<String, CampaignLock> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public CampaignRoomActor(CombatProperties properties) {
        this.timeout = properties.getOperationTimeout();
    }

    public <T> T execute(String campaignId, Function<OperationContext, T> operation) {
        long start = System.currentTimeMillis();
        OperationContext ctx = new OperationContext(campaignId, start + timeout.toMillis());
        CampaignLock lock = acquireRef(campaignId);
        try {
            boolean acquired;
            try {
                acquired = lock.mutex.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CombatException(CombatErrorCode.CANCELLED, "interrupted while waiting for campaign " + campaignId);
            }
            if (!acquired) {
                log.warn("等待战役串行区超时 campaign={} timeout={}ms", campaignId, timeout.toMillis());
                throw new CombatException(CombatErrorCode.CANCELLED, "timed out waiting for campaign " + campaignId);
            }
            try {
                return operation.apply(ctx);
            } finally {
                lock.mutex.unlock();
            }
        } finally {
            releaseRef(campaignId);
        }
    }

    public void run(String campaignId, Consumer<OperationContext> operation) {
        execute(campaignId, ctx -> {
            operation.accept(ctx);
            return null;
        });
    }

    /** 当前仍有等待者或持有者的战役数 */
    int trackedCampaigns() {
        return locks.size();
    }

    private CampaignLock acquireRef(String campaignId) {
        return locks.compute(campaignId, (k, v) -> {
            CampaignLock l = v == null ? new CampaignLock() : v;
            l.users++;
            return l;
        });
    }

    private void releaseRef(String campaignId) {
        locks.computeIfPresent(campaignId, (k, v) -> --v.users == 0 ? null : v);
    }

    /** users 只在 ConcurrentHashMap 的 compute 内修改 */
    private static final class CampaignLock {
        private final ReentrantLock mutex = new ReentrantLock(true);
        private int users;
    }
}
