package com.sunny.notepillar.common.exception;

import com.sunny.notepillar.common.constant.Code;
import com.sunny.notepillar.common.constant.ErrorType;
import java.util.Map;

/**
 * NotFound异常
 * 资源不存在或对当前身份不可见
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class NotFoundException extends NotepillarRuntimeException {

    public NotFoundException(String message, Object... args) {
        super(Code.NOT_FOUND, ErrorType.NOT_FOUND, null, false, message, args);
    }

    public NotFoundException(Throwable cause, String message, Object... args) {
        super(cause, Code.NOT_FOUND, ErrorType.NOT_FOUND, null, false, message, args);
    }

    public NotFoundException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.NOT_FOUND, type, context, false, message, args);
    }

    public NotFoundException(Throwable cause,
                             String type,
                             Map<String, String> context,
                             String message,
                             Object... args) {
        super(cause, Code.NOT_FOUND, type, context, false, message, args);
    }
}
