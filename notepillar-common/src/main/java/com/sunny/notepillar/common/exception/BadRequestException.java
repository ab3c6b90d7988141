package com.sunny.notepillar.common.exception;

import com.sunny.notepillar.common.constant.Code;
import com.sunny.notepillar.common.constant.ErrorType;
import java.util.Map;

/**
 * BadRequest异常
 * 请求参数不合法
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class BadRequestException extends NotepillarRuntimeException {

    public BadRequestException(String message, Object... args) {
        super(Code.BAD_REQUEST, ErrorType.BAD_REQUEST, null, false, message, args);
    }

    public BadRequestException(Throwable cause, String message, Object... args) {
        super(cause, Code.BAD_REQUEST, ErrorType.BAD_REQUEST, null, false, message, args);
    }

    public BadRequestException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.BAD_REQUEST, type, context, false, message, args);
    }

    public BadRequestException(Throwable cause,
                               String type,
                               Map<String, String> context,
                               String message,
                               Object... args) {
        super(cause, Code.BAD_REQUEST, type, context, false, message, args);
    }
}
