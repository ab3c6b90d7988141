package com.sunny.notepillar.common.exception;

import com.sunny.notepillar.common.constant.Code;
import com.sunny.notepillar.common.constant.ErrorType;
import java.util.Map;

/**
 * BadGateway异常
 * 上游服务返回了无法识别的响应
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class BadGatewayException extends NotepillarRuntimeException {

    public BadGatewayException(String message, Object... args) {
        super(Code.BAD_GATEWAY, ErrorType.BAD_GATEWAY, null, false, message, args);
    }

    public BadGatewayException(Throwable cause, String message, Object... args) {
        super(cause, Code.BAD_GATEWAY, ErrorType.BAD_GATEWAY, null, false, message, args);
    }

    public BadGatewayException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.BAD_GATEWAY, type, context, false, message, args);
    }

    public BadGatewayException(Throwable cause,
                               String type,
                               Map<String, String> context,
                               String message,
                               Object... args) {
        super(cause, Code.BAD_GATEWAY, type, context, false, message, args);
    }
}
