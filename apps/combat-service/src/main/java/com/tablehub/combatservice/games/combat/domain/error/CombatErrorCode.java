package com.tablehub.combatservice.games.combat.domain.error;

/**
 * 战斗领域错误码。
 * retryable 固定：只有 PARTIAL_UPDATE（双写只完成一半）和 STORE_UNAVAILABLE（首个写入前存储不可用）
 * 允许调用方整体重试；服务端自身从不自动重试。
 */
public enum CombatErrorCode {

    ALREADY_ACTIVE(409, false),
    NO_ACTIVE_COMBAT(409, false),
    UNKNOWN_COMBATANT(404, false),
    INVALID_AMOUNT(400, false),
    INVALID_DEATH_SAVE(409, false),
    TARGET_DEAD(409, false),
    INVALID_COMMAND(400, false),
    NOT_PERMITTED(403, false),
    CANCELLED(503, false),
    CORRUPT_STATE(500, false),
    PARTIAL_UPDATE(500, true),
    STORE_UNAVAILABLE(503, true);

    private final int httpStatus;
    private final boolean retryable;

    CombatErrorCode(int httpStatus, boolean retryable) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public boolean retryable() {
        return retryable;
    }
}
