package com.sunny.notepillar.server.service.impl;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.stereotype.Service;

import com.sunny.notepillar.common.exception.BadRequestException;
import com.sunny.notepillar.server.dto.NoteDto;
import com.sunny.notepillar.server.entity.Note;
import com.sunny.notepillar.server.exception.note.NoteNotFoundException;
import com.sunny.notepillar.server.mapper.NoteMapper;
import com.sunny.notepillar.server.service.NoteService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 笔记服务实现
 *
 * @author Sunny
 * @date 2026-03-05
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NoteServiceImpl implements NoteService {

    private static final int MAX_PAGE_SIZE = 100;

    private final NoteMapper noteMapper;
    private final Clock clock;

    @Override
    public List<Note> listNotes(Long ownerId, int offset, int limit) {
        if (offset < 0) {
            throw new BadRequestException("offset 不能为负数");
        }
        return noteMapper.selectByOwner(ownerId, resolvePageSize(limit), offset);
    }

    @Override
    public int resolvePageSize(int limit) {
        return limit <= 0 ? MAX_PAGE_SIZE : Math.min(limit, MAX_PAGE_SIZE);
    }

    @Override
    public Note createNote(Long ownerId, NoteDto.CreateRequest request) {
        LocalDateTime now = LocalDateTime.now(clock);
        Note note = new Note();
        note.setTitle(request.getTitle());
        note.setContent(request.getContent());
        note.setTranslated(false);
        note.setOriginalContent(null);
        note.setOwnerId(ownerId);
        note.setVersion(0);
        note.setCreatedAt(now);
        note.setUpdatedAt(now);
        noteMapper.insert(note);
        return note;
    }

    @Override
    public Note getNote(Long ownerId, Long noteId) {
        Note note = noteMapper.selectOwned(noteId, ownerId);
        if (note == null) {
            throw new NoteNotFoundException("笔记不存在: %s", noteId);
        }
        return note;
    }

    /**
     * 内容变更与翻译状态重置在同一条语句中完成，仅修改标题不影响翻译状态
     */
    @Override
    public Note updateNote(Long ownerId, Long noteId, NoteDto.UpdateRequest request) {
        getNote(ownerId, noteId);
        LocalDateTime now = LocalDateTime.now(clock);
        int rows;
        if (request.getContent() != null) {
            rows = noteMapper.updateContent(noteId, ownerId, request.getTitle(), request.getContent(), now);
        } else if (request.getTitle() != null) {
            rows = noteMapper.updateTitle(noteId, ownerId, request.getTitle(), now);
        } else {
            rows = 1;
        }
        if (rows == 0) {
            throw new NoteNotFoundException("笔记不存在: %s", noteId);
        }
        if (request.getContent() != null) {
            log.debug("笔记内容已更新，翻译状态已重置: noteId={}", noteId);
        }
        return getNote(ownerId, noteId);
    }

    @Override
    public void deleteNote(Long ownerId, Long noteId) {
        if (noteMapper.deleteOwned(noteId, ownerId) == 0) {
            throw new NoteNotFoundException("笔记不存在: %s", noteId);
        }
    }
}
