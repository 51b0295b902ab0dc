package com.boardhub.web.common;

import java.io.Serializable;

/**
 * 统一 API 响应格式
 *
 * @param code    状态码：200 成功；400 参数错误；404 会话/存档不存在；409 状态冲突（如会话已结束）
 * @param message 提示消息
 * @param data    响应数据
 * @param <T>     响应数据类型
 */
public record ApiResponse<T>(int code, String message, T data) implements Serializable {

    /** 成功响应（带数据） */
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", data);
    }

    /** 成功响应（带消息和数据） */
    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(200, message, data);
    }

    /** 400：命令参数非法（坐标解析失败、未知参与者等） */
    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(400, message, null);
    }

    /** 404：会话或存档不存在 */
    public static <T> ApiResponse<T> notFound(String message) {
        return new ApiResponse<>(404, message, null);
    }

    /** 409：会话状态不允许该操作 */
    public static <T> ApiResponse<T> conflict(String message) {
        return new ApiResponse<>(409, message, null);
    }
}
