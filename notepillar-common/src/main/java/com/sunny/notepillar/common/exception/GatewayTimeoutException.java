package com.sunny.notepillar.common.exception;

import com.sunny.notepillar.common.constant.Code;
import com.sunny.notepillar.common.constant.ErrorType;
import java.util.Map;

/**
 * GatewayTimeout异常
 * 依赖服务响应超时，可重试
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class GatewayTimeoutException extends NotepillarRuntimeException {

    public GatewayTimeoutException(String message, Object... args) {
        super(Code.GATEWAY_TIMEOUT, ErrorType.GATEWAY_TIMEOUT, null, true, message, args);
    }

    public GatewayTimeoutException(Throwable cause, String message, Object... args) {
        super(cause, Code.GATEWAY_TIMEOUT, ErrorType.GATEWAY_TIMEOUT, null, true, message, args);
    }

    public GatewayTimeoutException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.GATEWAY_TIMEOUT, type, context, true, message, args);
    }

    public GatewayTimeoutException(Throwable cause,
                                   String type,
                                   Map<String, String> context,
                                   String message,
                                   Object... args) {
        super(cause, Code.GATEWAY_TIMEOUT, type, context, true, message, args);
    }
}
