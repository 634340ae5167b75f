package com.tablehub.combatservice.games.combat.application.command;

import com.tablehub.combatservice.games.combat.domain.error.CombatErrorCode;

/**
 * 命令执行结果。领域失败也以结果形式返回，不抛到传输层。
 *
 * @param command   命令名（解析失败时为原始工具名）
 * @param errorCode 失败时的领域错误码
 * @param retryable 失败时调用方是否可以整体重试
 * @param data      成功时的返回数据
 */
public record CommandResult(
        boolean success,
        String command,
        String errorCode,
        String message,
        boolean retryable,
        Object data
) {

    public static CommandResult ok(String command, Object data) {
        return new CommandResult(true, command, null, null, false, data);
    }

    public static CommandResult failure(String command, CombatErrorCode code, String message) {
        return new CommandResult(false, command, code.name(), message, code.retryable(), null);
    }

    public CombatErrorCode code() {
        return errorCode == null ? null : CombatErrorCode.valueOf(errorCode);
    }
}
