package com.sunny.notepillar.server.service;

import com.sunny.notepillar.server.entity.Note;
import com.sunny.notepillar.server.translation.TranslationResult;

/**
 * 笔记翻译服务
 *
 * @author Sunny
 * @date 2026-03-05
 */
public interface NoteTranslationService {

    /**
     * 翻译并持久化，已翻译或不含源语言文字时原样返回
     */
    Note translateAndPersist(Long ownerId, Long noteId);

    /**
     * 仅预览译文，不写库
     */
    TranslationPreview translatePreview(Long ownerId, Long noteId);

    record TranslationPreview(TranslationResult result, Note note) {
    }
}
