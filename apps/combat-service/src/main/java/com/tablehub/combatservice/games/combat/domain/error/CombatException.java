package com.tablehub.combatservice.games.combat.domain.error;

/**
 * 战斗领域异常（非受检）。
 * 在调度层被统一转换为 CommandResult，不会直接穿透到 WebSocket 层。
 */
public class CombatException extends RuntimeException {

    private final CombatErrorCode code;

    public CombatException(CombatErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public CombatException(CombatErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public CombatErrorCode getCode() {
        return code;
    }

    public boolean isRetryable() {
        return code.retryable();
    }
}
