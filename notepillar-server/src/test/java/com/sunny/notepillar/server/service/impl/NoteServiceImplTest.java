package com.sunny.notepillar.server.service.impl;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import com.sunny.notepillar.common.exception.BadRequestException;
import com.sunny.notepillar.server.dto.NoteDto;
import com.sunny.notepillar.server.entity.Note;
import com.sunny.notepillar.server.exception.note.NoteNotFoundException;
import com.sunny.notepillar.server.mapper.NoteMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NoteServiceImplTest {

    private static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");

    @Mock
    private NoteMapper noteMapper;

    private NoteServiceImpl noteService;

    @BeforeEach
    void setUp() {
        noteService = new NoteServiceImpl(noteMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void createNote_shouldStartUntranslated() {
        NoteDto.CreateRequest request = new NoteDto.CreateRequest();
        request.setTitle("Заметка");
        request.setContent("Привет");

        noteService.createNote(7L, request);

        ArgumentCaptor<Note> captor = ArgumentCaptor.forClass(Note.class);
        verify(noteMapper).insert(captor.capture());
        Note saved = captor.getValue();
        assertEquals(7L, saved.getOwnerId());
        assertFalse(saved.isTranslatedState());
        assertNull(saved.getOriginalContent());
        assertEquals(0, saved.getVersion());
        assertEquals(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC), saved.getCreatedAt());
    }

    @Test
    void updateNote_shouldResetTranslationWhenContentChanges() {
        when(noteMapper.selectOwned(1L, 7L)).thenReturn(note(1L, true), note(1L, false));
        when(noteMapper.updateContent(eq(1L), eq(7L), isNull(), eq("Новый текст"), any(LocalDateTime.class)))
                .thenReturn(1);
        NoteDto.UpdateRequest request = new NoteDto.UpdateRequest();
        request.setContent("Новый текст");

        Note updated = noteService.updateNote(7L, 1L, request);

        assertFalse(updated.isTranslatedState());
        verify(noteMapper, never()).updateTitle(anyLong(), anyLong(), anyString(), any(LocalDateTime.class));
    }

    @Test
    void updateNote_shouldKeepTranslationWhenOnlyTitleChanges() {
        when(noteMapper.selectOwned(1L, 7L)).thenReturn(note(1L, true));
        when(noteMapper.updateTitle(eq(1L), eq(7L), eq("Renamed"), any(LocalDateTime.class))).thenReturn(1);
        NoteDto.UpdateRequest request = new NoteDto.UpdateRequest();
        request.setTitle("Renamed");

        noteService.updateNote(7L, 1L, request);

        verify(noteMapper, never()).updateContent(anyLong(), anyLong(), any(), anyString(), any(LocalDateTime.class));
    }

    @Test
    void getNote_shouldHideNotesOfOtherOwners() {
        when(noteMapper.selectOwned(1L, 8L)).thenReturn(null);

        assertThrows(NoteNotFoundException.class, () -> noteService.getNote(8L, 1L));
    }

    @Test
    void deleteNote_shouldFailWhenNothingDeleted() {
        when(noteMapper.deleteOwned(1L, 8L)).thenReturn(0);

        assertThrows(NoteNotFoundException.class, () -> noteService.deleteNote(8L, 1L));
    }

    @Test
    void listNotes_shouldClampPageSize() {
        when(noteMapper.selectByOwner(7L, 100, 0)).thenReturn(List.of(note(1L, false)));

        assertEquals(1, noteService.listNotes(7L, 0, 500).size());
        assertThrows(BadRequestException.class, () -> noteService.listNotes(7L, -1, 10));
    }

    @Test
    void resolvePageSize_shouldFallBackToUpperBound() {
        assertEquals(100, noteService.resolvePageSize(500));
        assertEquals(100, noteService.resolvePageSize(0));
        assertEquals(20, noteService.resolvePageSize(20));
    }

    private static Note note(Long id, boolean translated) {
        Note note = new Note();
        note.setId(id);
        note.setOwnerId(7L);
        note.setTitle("Заметка");
        note.setContent(translated ? "Hello" : "Привет");
        note.setOriginalContent(translated ? "Привет" : null);
        note.setTranslated(translated);
        note.setVersion(translated ? 1 : 0);
        return note;
    }
}
