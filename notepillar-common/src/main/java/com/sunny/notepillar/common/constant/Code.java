package com.sunny.notepillar.common.constant;

/**
 * 统一错误码常量
 * 错误码与HTTP状态码保持一致
 *
 * @author Sunny
 * @date 2026-03-02
 */
public final class Code {

    public static final int OK = 0;
    public static final int BAD_REQUEST = 400;
    public static final int UNAUTHORIZED = 401;
    public static final int FORBIDDEN = 403;
    public static final int NOT_FOUND = 404;
    public static final int CONFLICT = 409;
    public static final int INTERNAL_ERROR = 500;
    public static final int BAD_GATEWAY = 502;
    public static final int SERVICE_UNAVAILABLE = 503;
    public static final int GATEWAY_TIMEOUT = 504;

    private Code() {
    }
}
