package com.sunny.notepillar.common.exception;

import com.sunny.notepillar.common.constant.Code;
import com.sunny.notepillar.common.constant.ErrorType;
import java.util.Map;

/**
 * AlreadyExists异常
 * 唯一性约束冲突
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class AlreadyExistsException extends NotepillarRuntimeException {

    public AlreadyExistsException(String message, Object... args) {
        super(Code.CONFLICT, ErrorType.ALREADY_EXISTS, null, false, message, args);
    }

    public AlreadyExistsException(Throwable cause, String message, Object... args) {
        super(cause, Code.CONFLICT, ErrorType.ALREADY_EXISTS, null, false, message, args);
    }

    public AlreadyExistsException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.CONFLICT, type, context, false, message, args);
    }

    public AlreadyExistsException(Throwable cause,
                                  String type,
                                  Map<String, String> context,
                                  String message,
                                  Object... args) {
        super(cause, Code.CONFLICT, type, context, false, message, args);
    }
}
