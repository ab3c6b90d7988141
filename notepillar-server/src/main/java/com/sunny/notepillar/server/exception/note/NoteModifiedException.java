package com.sunny.notepillar.server.exception.note;

import com.sunny.notepillar.common.constant.ErrorType;
import com.sunny.notepillar.common.exception.ConflictException;
import java.util.Map;

/**
 * 笔记并发修改异常
 * 翻译期间内容被编辑
 *
 * @author Sunny
 * @date 2026-03-04
 */
public class NoteModifiedException extends ConflictException {

    public NoteModifiedException(String message, Object... args) {
        super(ErrorType.NOTE_MODIFIED, Map.of(), message, args);
    }
}
