package com.sunny.notepillar.common.exception;

import com.sunny.notepillar.common.constant.Code;
import com.sunny.notepillar.common.constant.ErrorType;
import java.util.Map;

/**
 * Conflict异常
 * 并发修改或状态冲突
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class ConflictException extends NotepillarRuntimeException {

    public ConflictException(String message, Object... args) {
        super(Code.CONFLICT, ErrorType.CONFLICT, null, false, message, args);
    }

    public ConflictException(Throwable cause, String message, Object... args) {
        super(cause, Code.CONFLICT, ErrorType.CONFLICT, null, false, message, args);
    }

    public ConflictException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.CONFLICT, type, context, false, message, args);
    }

    public ConflictException(Throwable cause,
                             String type,
                             Map<String, String> context,
                             String message,
                             Object... args) {
        super(cause, Code.CONFLICT, type, context, false, message, args);
    }
}
