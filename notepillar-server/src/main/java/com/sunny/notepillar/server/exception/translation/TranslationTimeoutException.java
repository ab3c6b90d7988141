package com.sunny.notepillar.server.exception.translation;

import com.sunny.notepillar.common.constant.ErrorType;
import com.sunny.notepillar.common.exception.GatewayTimeoutException;
import java.util.Map;

/**
 * 翻译服务超时异常
 *
 * @author Sunny
 * @date 2026-03-04
 */
public class TranslationTimeoutException extends GatewayTimeoutException {

    public TranslationTimeoutException(String message, Object... args) {
        super(ErrorType.TRANSLATION_TIMEOUT, Map.of(), message, args);
    }

    public TranslationTimeoutException(Throwable cause, String message, Object... args) {
        super(cause, ErrorType.TRANSLATION_TIMEOUT, Map.of(), message, args);
    }
}
