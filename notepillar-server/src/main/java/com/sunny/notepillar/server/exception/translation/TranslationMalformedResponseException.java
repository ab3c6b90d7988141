package com.sunny.notepillar.server.exception.translation;

import com.sunny.notepillar.common.constant.ErrorType;
import com.sunny.notepillar.common.exception.BadGatewayException;
import java.util.Map;

/**
 * 翻译响应格式异常
 * 服务返回成功但无法解析出译文
 *
 * @author Sunny
 * @date 2026-03-04
 */
public class TranslationMalformedResponseException extends BadGatewayException {

    public TranslationMalformedResponseException(String message, Object... args) {
        super(ErrorType.TRANSLATION_MALFORMED_RESPONSE, Map.of(), message, args);
    }

    public TranslationMalformedResponseException(Throwable cause, String message, Object... args) {
        super(cause, ErrorType.TRANSLATION_MALFORMED_RESPONSE, Map.of(), message, args);
    }
}
