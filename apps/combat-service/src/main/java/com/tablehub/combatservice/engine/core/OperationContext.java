package com.tablehub.combatservice.engine.core;

import com.tablehub.combatservice.games.combat.domain.error.CombatErrorCode;
import com.tablehub.combatservice.games.combat.domain.error.CombatException;

/**
 * 一次串行操作的上下文：协作式取消 + “不可回头点”。
 *
 * - 第一次写入之前调用 checkpoint()：已取消 / 已超时 / 线程被中断时抛 CANCELLED，此时什么都没写；
 * - 第一个写入成功后调用 commit()：此后取消请求一律忽略，操作必须跑完（第二次写入与广播）。
 */
public final class OperationContext {

    private final String campaignId;
    private final long deadlineMillis;
    private volatile boolean cancelled;
    private volatile boolean committed;

    public OperationContext(String campaignId, long deadlineMillis) {
        this.campaignId = campaignId;
        this.deadlineMillis = deadlineMillis;
    }

    public String campaignId() {
        return campaignId;
    }

    /** 请求取消；提交之后调用无效果 */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled && !committed;
    }

    public boolean isCommitted() {
        return committed;
    }

    public void checkpoint() {
        if (committed) {
            return;
        }
        if (cancelled || Thread.currentThread().isInterrupted()) {
            throw new CombatException(CombatErrorCode.CANCELLED, "operation cancelled before write");
        }
        if (System.currentTimeMillis() > deadlineMillis) {
            throw new CombatException(CombatErrorCode.CANCELLED, "operation timed out before write");
        }
    }

    public void commit() {
        committed = true;
    }
}
