package com.sunny.notepillar.common.exception;

import com.sunny.notepillar.common.constant.Code;
import com.sunny.notepillar.common.constant.ErrorType;
import java.util.Map;

/**
 * Unauthorized异常
 * 身份认证失败，对应HTTP 401
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class UnauthorizedException extends NotepillarRuntimeException {

    public UnauthorizedException(String message, Object... args) {
        super(Code.UNAUTHORIZED, ErrorType.UNAUTHORIZED, null, false, message, args);
    }

    public UnauthorizedException(Throwable cause, String message, Object... args) {
        super(cause, Code.UNAUTHORIZED, ErrorType.UNAUTHORIZED, null, false, message, args);
    }

    public UnauthorizedException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.UNAUTHORIZED, type, context, false, message, args);
    }

    public UnauthorizedException(Throwable cause,
                                 String type,
                                 Map<String, String> context,
                                 String message,
                                 Object... args) {
        super(cause, Code.UNAUTHORIZED, type, context, false, message, args);
    }
}
