package com.sunny.notepillar.common.constant;

/**
 * 统一错误类型常量
 * 业务语义统一通过 type 字段传递
 *
 * @author Sunny
 * @date 2026-03-02
 */
public final class ErrorType {

    public static final String BAD_REQUEST = "BAD_REQUEST";
    public static final String UNAUTHORIZED = "UNAUTHORIZED";
    public static final String FORBIDDEN = "FORBIDDEN";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String ALREADY_EXISTS = "ALREADY_EXISTS";
    public static final String CONFLICT = "CONFLICT";
    public static final String BAD_GATEWAY = "BAD_GATEWAY";
    public static final String SERVICE_UNAVAILABLE = "SERVICE_UNAVAILABLE";
    public static final String GATEWAY_TIMEOUT = "GATEWAY_TIMEOUT";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    public static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";
    public static final String INACTIVE_IDENTITY = "INACTIVE_IDENTITY";
    public static final String TOKEN_EXPIRED = "TOKEN_EXPIRED";
    public static final String TOKEN_MALFORMED = "TOKEN_MALFORMED";
    public static final String TOKEN_INVALID = "TOKEN_INVALID";

    public static final String WEAK_PRODUCTION_KEY = "WEAK_PRODUCTION_KEY";
    public static final String PASSWORD_HASH_INVALID = "PASSWORD_HASH_INVALID";

    public static final String NOTE_NOT_FOUND = "NOTE_NOT_FOUND";
    public static final String NOTE_MODIFIED = "NOTE_MODIFIED";
    public static final String TRANSLATION_IN_PROGRESS = "TRANSLATION_IN_PROGRESS";
    public static final String TRANSLATION_UNAVAILABLE = "TRANSLATION_UNAVAILABLE";
    public static final String TRANSLATION_TIMEOUT = "TRANSLATION_TIMEOUT";
    public static final String TRANSLATION_MALFORMED_RESPONSE = "TRANSLATION_MALFORMED_RESPONSE";

    private ErrorType() {
    }
}
