package com.sunny.notepillar.server.service.impl;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.locks.ReentrantLock;

import org.springframework.stereotype.Service;

import com.sunny.notepillar.server.config.NotepillarProperties;
import com.sunny.notepillar.server.entity.Note;
import com.sunny.notepillar.server.exception.note.NoteModifiedException;
import com.sunny.notepillar.server.exception.note.NoteNotFoundException;
import com.sunny.notepillar.server.exception.note.TranslationInProgressException;
import com.sunny.notepillar.server.mapper.NoteMapper;
import com.sunny.notepillar.server.service.NoteTranslationService;
import com.sunny.notepillar.server.translation.NoteLockRegistry;
import com.sunny.notepillar.server.translation.TextTranslator;
import com.sunny.notepillar.server.translation.TranslationResult;

import lombok.extern.slf4j.Slf4j;

/**
 * 笔记翻译服务实现
 * 同一笔记的翻译持久化在进程内串行执行，写入使用版本号条件更新
 *
 * @author Sunny
 * @date 2026-03-05
 */
@Slf4j
@Service
public class NoteTranslationServiceImpl implements NoteTranslationService {

    private final NoteMapper noteMapper;
    private final TextTranslator textTranslator;
    private final NoteLockRegistry noteLockRegistry;
    private final Clock clock;
    private final Duration lockWait;

    public NoteTranslationServiceImpl(NoteMapper noteMapper,
                                      TextTranslator textTranslator,
                                      NoteLockRegistry noteLockRegistry,
                                      Clock clock,
                                      NotepillarProperties properties) {
        this.noteMapper = noteMapper;
        this.textTranslator = textTranslator;
        this.noteLockRegistry = noteLockRegistry;
        this.clock = clock;
        this.lockWait = Duration.ofMillis(Math.max(1, properties.getTranslation().getLockWaitMs()));
    }

    @Override
    public Note translateAndPersist(Long ownerId, Long noteId) {
        Note note = loadOwned(ownerId, noteId);
        if (!needsTranslation(note)) {
            return note;
        }

        ReentrantLock lock = noteLockRegistry.tryLock(noteId, lockWait);
        if (lock == null) {
            throw new TranslationInProgressException("笔记正在翻译中，请稍后重试: %s", noteId);
        }
        try {
            Note current = loadOwned(ownerId, noteId);
            if (!needsTranslation(current)) {
                return current;
            }

            TranslationResult result = textTranslator.translate(current.getContent());
            int rows = noteMapper.markTranslated(
                    noteId,
                    ownerId,
                    current.getVersion(),
                    current.getContent(),
                    result.translatedText(),
                    LocalDateTime.now(clock));
            if (rows == 0) {
                Note latest = loadOwned(ownerId, noteId);
                if (latest.isTranslatedState()) {
                    return latest;
                }
                log.warn("笔记翻译期间内容已变更，放弃写入: noteId={}, expectedVersion={}, actualVersion={}",
                        noteId, current.getVersion(), latest.getVersion());
                throw new NoteModifiedException("笔记在翻译期间被修改，请重试: %s", noteId);
            }
            log.info("笔记翻译完成: noteId={}, ownerId={}", noteId, ownerId);
            return loadOwned(ownerId, noteId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public TranslationPreview translatePreview(Long ownerId, Long noteId) {
        Note note = loadOwned(ownerId, noteId);
        return new TranslationPreview(textTranslator.translate(note.getContent()), note);
    }

    private boolean needsTranslation(Note note) {
        return !note.isTranslatedState() && textTranslator.isTranslatable(note.getContent());
    }

    private Note loadOwned(Long ownerId, Long noteId) {
        Note note = noteMapper.selectOwned(noteId, ownerId);
        if (note == null) {
            throw new NoteNotFoundException("笔记不存在: %s", noteId);
        }
        return note;
    }
}
