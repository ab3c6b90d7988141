package com.sunny.notepillar.server.service;

import java.util.List;

import com.sunny.notepillar.server.dto.NoteDto;
import com.sunny.notepillar.server.entity.Note;

/**
 * 笔记服务
 * 所有操作都限定在所有者范围内
 *
 * @author Sunny
 * @date 2026-03-05
 */
public interface NoteService {

    List<Note> listNotes(Long ownerId, int offset, int limit);

    /**
     * 实际生效的分页大小，非正数或超过上限时取上限
     */
    int resolvePageSize(int limit);

    Note createNote(Long ownerId, NoteDto.CreateRequest request);

    Note getNote(Long ownerId, Long noteId);

    Note updateNote(Long ownerId, Long noteId, NoteDto.UpdateRequest request);

    void deleteNote(Long ownerId, Long noteId);
}
