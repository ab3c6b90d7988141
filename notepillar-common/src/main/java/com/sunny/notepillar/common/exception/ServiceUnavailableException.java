package com.sunny.notepillar.common.exception;

import com.sunny.notepillar.common.constant.Code;
import com.sunny.notepillar.common.constant.ErrorType;
import java.util.Map;

/**
 * ServiceUnavailable异常
 * 依赖服务暂不可用，可重试
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class ServiceUnavailableException extends NotepillarRuntimeException {

    public ServiceUnavailableException(String message, Object... args) {
        super(Code.SERVICE_UNAVAILABLE, ErrorType.SERVICE_UNAVAILABLE, null, true, message, args);
    }

    public ServiceUnavailableException(Throwable cause, String message, Object... args) {
        super(cause, Code.SERVICE_UNAVAILABLE, ErrorType.SERVICE_UNAVAILABLE, null, true, message, args);
    }

    public ServiceUnavailableException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.SERVICE_UNAVAILABLE, type, context, true, message, args);
    }

    public ServiceUnavailableException(Throwable cause,
                                       String type,
                                       Map<String, String> context,
                                       String message,
                                       Object... args) {
        super(cause, Code.SERVICE_UNAVAILABLE, type, context, true, message, args);
    }
}
