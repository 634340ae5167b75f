package com.tablehub.web.common;

import java.io.Serializable;

/**
 * 统一 API 响应格式
 *
 * 失败时除了 HTTP 语义的 code 之外，还带上领域错误码 errorCode，
 * 以及 retryable 标记：调用方据此决定是否可以整体重试这次操作。
 *
 * @param <T> 响应数据类型
 */
public record ApiResponse<T>(
    /**
     * 响应状态码
     * 200: 成功
     * 400: 参数错误
     * 404: 资源不存在（如未知的战斗单位）
     * 409: 状态冲突（如战斗已开始 / 未在战斗中）
     * 500: 服务器错误（如双写只完成一半）
     */
    int code,

    /**
     * 响应消息
     */
    String message,

    /**
     * 领域错误码，例如 ALREADY_ACTIVE / PARTIAL_UPDATE；成功时为 null
     */
    String errorCode,

    /**
     * 是否允许调用方整体重试
     */
    boolean retryable,

    /**
     * 响应数据
     */
    T data
) implements Serializable {

    /**
     * 成功响应（无数据）
     */
    public static <T> ApiResponse<T> success() {
        return new ApiResponse<>(200, "success", null, false, null);
    }

    /**
     * 成功响应（带数据）
     */
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", null, false, data);
    }

    /**
     * 失败响应（带领域错误码）
     */
    public static <T> ApiResponse<T> failure(int code, String errorCode, String message, boolean retryable) {
        return new ApiResponse<>(code, message, errorCode, retryable, null);
    }

    /**
     * 失败响应（400 Bad Request）
     */
    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(400, message, "BAD_REQUEST", false, null);
    }

    /**
     * 失败响应（500 Internal Server Error）
     */
    public static <T> ApiResponse<T> serverError(String message) {
        return new ApiResponse<>(500, message, "SERVER_ERROR", false, null);
    }

    /**
     * 是否成功
     */
    public boolean ok() {
        return code == 200;
    }
}
