package com.sunny.notepillar.server.exception.note;

import com.sunny.notepillar.common.constant.ErrorType;
import com.sunny.notepillar.common.exception.NotFoundException;
import java.util.Map;

/**
 * 笔记不存在异常
 * 非所有者访问同样返回该异常
 *
 * @author Sunny
 * @date 2026-03-04
 */
public class NoteNotFoundException extends NotFoundException {

    public NoteNotFoundException(String message, Object... args) {
        super(ErrorType.NOTE_NOT_FOUND, Map.of(), message, args);
    }
}
