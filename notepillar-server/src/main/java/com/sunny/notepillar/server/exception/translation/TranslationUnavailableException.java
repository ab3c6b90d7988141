package com.sunny.notepillar.server.exception.translation;

import com.sunny.notepillar.common.constant.ErrorType;
import com.sunny.notepillar.common.exception.ServiceUnavailableException;
import java.util.Map;

/**
 * 翻译服务不可用异常
 *
 * @author Sunny
 * @date 2026-03-04
 */
public class TranslationUnavailableException extends ServiceUnavailableException {

    public TranslationUnavailableException(String message, Object... args) {
        super(ErrorType.TRANSLATION_UNAVAILABLE, Map.of(), message, args);
    }

    public TranslationUnavailableException(Throwable cause, String message, Object... args) {
        super(cause, ErrorType.TRANSLATION_UNAVAILABLE, Map.of(), message, args);
    }
}
