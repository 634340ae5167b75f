package com.tablehub.combatservice.common;

import com.tablehub.combatservice.games.combat.domain.error.CombatException;
import com.tablehub.web.common.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常映射处理器。
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    /**
     * 领域异常：HTTP 状态、错误码、是否可重试都由错误码决定。
     */
    @ExceptionHandler(CombatException.class)
    public ResponseEntity<ApiResponse<Object>> combat(CombatException e) {
        return ResponseEntity.status(e.getCode().httpStatus())
                .body(ApiResponse.failure(e.getCode().httpStatus(), e.getCode().name(), e.getMessage(), e.isRetryable()));
    }

    /**
     * 处理参数不合法异常（IllegalArgumentException）。
     * @return HTTP 400（Bad Request），响应体为异常信息
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiResponse<Object>> storeUnavailable(DataAccessException e) {
        log.error("状态存储访问失败", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiResponse.failure(503, "STORE_UNAVAILABLE", "state store unavailable", true));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> serverError(Exception e) {
        log.error("未处理的异常", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.serverError(e.getMessage()));
    }
}
