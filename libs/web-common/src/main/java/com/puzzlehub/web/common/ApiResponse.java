package com.puzzlehub.web.common;

import java.io.Serializable;

/**
 * 统一 API 响应格式
 *
 * @param <T> 响应数据类型
 */
public record ApiResponse<T>(
    /**
     * 响应状态码
     * 200: 成功
     * 400: 客户端错误（参数错误、会话不存在等）
     * 409: 冲突（会话阶段不允许、非房主操作）
     * 503: 共享存储暂不可用（客户端应稍后重试）
     */
    int code,

    /**
     * 响应消息
     */
    String message,

    /**
     * 响应数据
     */
    T data
) implements Serializable {

    /**
     * 成功响应（无数据）
     */
    public static <T> ApiResponse<T> success() {
        return new ApiResponse<>(200, "success", null);
    }

    /**
     * 成功响应（带数据）
     */
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", data);
    }

    /**
     * 失败响应（400 Bad Request）
     */
    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(400, message, null);
    }

    /**
     * 失败响应（404 Not Found）
     */
    public static <T> ApiResponse<T> notFound(String message) {
        return new ApiResponse<>(404, message, null);
    }

    /**
     * 失败响应（409 Conflict）
     */
    public static <T> ApiResponse<T> conflict(String message) {
        return new ApiResponse<>(409, message, null);
    }

    /**
     * 失败响应（503 Service Unavailable），用于共享存储不可达
     */
    public static <T> ApiResponse<T> unavailable(String message) {
        return new ApiResponse<>(503, message, null);
    }
}
