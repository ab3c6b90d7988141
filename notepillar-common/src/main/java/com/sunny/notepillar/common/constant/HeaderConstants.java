package com.sunny.notepillar.common.constant;

/**
 * 请求头常量
 *
 * @author Sunny
 * @date 2026-03-02
 */
public final class HeaderConstants {

    public static final String HEADER_TRACE_ID = "X-Trace-Id";
    public static final String BEARER_PREFIX = "Bearer ";

    private HeaderConstants() {
    }
}
