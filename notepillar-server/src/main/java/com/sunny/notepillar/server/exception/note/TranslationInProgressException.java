package com.sunny.notepillar.server.exception.note;

import com.sunny.notepillar.common.constant.ErrorType;
import com.sunny.notepillar.common.exception.ConflictException;
import java.util.Map;

/**
 * 笔记翻译进行中异常
 *
 * @author Sunny
 * @date 2026-03-04
 */
public class TranslationInProgressException extends ConflictException {

    public TranslationInProgressException(String message, Object... args) {
        super(ErrorType.TRANSLATION_IN_PROGRESS, Map.of(), message, args);
    }
}
