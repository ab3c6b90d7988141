package com.sunny.notepillar.common.exception;

import com.sunny.notepillar.common.constant.Code;
import com.sunny.notepillar.common.constant.ErrorType;
import java.util.Map;

/**
 * Internal异常
 * 服务内部错误
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class InternalException extends NotepillarRuntimeException {

    public InternalException(String message, Object... args) {
        super(Code.INTERNAL_ERROR, ErrorType.INTERNAL_ERROR, null, false, message, args);
    }

    public InternalException(Throwable cause, String message, Object... args) {
        super(cause, Code.INTERNAL_ERROR, ErrorType.INTERNAL_ERROR, null, false, message, args);
    }

    public InternalException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.INTERNAL_ERROR, type, context, false, message, args);
    }

    public InternalException(Throwable cause,
                             String type,
                             Map<String, String> context,
                             String message,
                             Object... args) {
        super(cause, Code.INTERNAL_ERROR, type, context, false, message, args);
    }
}
