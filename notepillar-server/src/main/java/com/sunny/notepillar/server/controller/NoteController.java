package com.sunny.notepillar.server.controller;

import java.util.List;

import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.sunny.notepillar.common.response.ApiResponse;
import com.sunny.notepillar.server.dto.NoteDto;
import com.sunny.notepillar.server.entity.Note;
import com.sunny.notepillar.server.security.AuthenticatedIdentity;
import com.sunny.notepillar.server.security.CurrentIdentity;
import com.sunny.notepillar.server.service.NoteService;
import com.sunny.notepillar.server.service.NoteTranslationService;
import com.sunny.notepillar.server.translation.TextTranslator;
import com.sunny.notepillar.server.translation.TranslationResult;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 笔记控制器
 *
 * @author Sunny
 * @date 2026-03-06
 */
@Tag(name = "笔记", description = "笔记管理与翻译")
@RestController
@RequestMapping("/notes")
@RequiredArgsConstructor
public class NoteController {

    private final NoteService noteService;
    private final NoteTranslationService noteTranslationService;
    private final TextTranslator textTranslator;

    @Operation(summary = "笔记列表")
    @GetMapping
    public ApiResponse<List<NoteDto.Response>> list(@CurrentIdentity AuthenticatedIdentity identity,
                                                    @RequestParam(defaultValue = "0") int offset,
                                                    @RequestParam(defaultValue = "100") int limit) {
        int pageSize = noteService.resolvePageSize(limit);
        List<NoteDto.Response> notes = noteService.listNotes(identity.userId(), offset, pageSize).stream()
                .map(this::toResponse)
                .toList();
        return ApiResponse.page(notes, pageSize, offset);
    }

    @Operation(summary = "创建笔记")
    @PostMapping
    public ApiResponse<NoteDto.Response> create(@CurrentIdentity AuthenticatedIdentity identity,
                                                @Valid @RequestBody NoteDto.CreateRequest request) {
        return ApiResponse.ok(toResponse(noteService.createNote(identity.userId(), request)));
    }

    @Operation(summary = "笔记详情")
    @GetMapping("/{id}")
    public ApiResponse<NoteDto.Response> get(@CurrentIdentity AuthenticatedIdentity identity,
                                             @PathVariable("id") Long id) {
        return ApiResponse.ok(toResponse(noteService.getNote(identity.userId(), id)));
    }

    @Operation(summary = "更新笔记", description = "修改内容会重置翻译状态")
    @PutMapping("/{id}")
    public ApiResponse<NoteDto.Response> update(@CurrentIdentity AuthenticatedIdentity identity,
                                                @PathVariable("id") Long id,
                                                @Valid @RequestBody NoteDto.UpdateRequest request) {
        return ApiResponse.ok(toResponse(noteService.updateNote(identity.userId(), id, request)));
    }

    @Operation(summary = "删除笔记")
    @DeleteMapping("/{id}")
    public ApiResponse<Void> delete(@CurrentIdentity AuthenticatedIdentity identity,
                                    @PathVariable("id") Long id) {
        noteService.deleteNote(identity.userId(), id);
        return ApiResponse.ok();
    }

    @Operation(summary = "翻译笔记", description = "preview=true 时仅返回译文，不修改笔记")
    @PostMapping("/{id}/translate")
    public ApiResponse<NoteDto.TranslateResponse> translate(@CurrentIdentity AuthenticatedIdentity identity,
                                                            @PathVariable("id") Long id,
                                                            @RequestParam(defaultValue = "false") boolean preview) {
        if (preview) {
            NoteTranslationService.TranslationPreview result = noteTranslationService.translatePreview(identity.userId(), id);
            TranslationResult translation = result.result();
            return ApiResponse.ok(NoteDto.TranslateResponse.builder()
                    .preview(true)
                    .translatedText(translation.translatedText())
                    .originalText(translation.originalText())
                    .sourceLanguage(translation.sourceLanguage())
                    .targetLanguage(translation.targetLanguage())
                    .note(toResponse(result.note()))
                    .build());
        }
        Note note = noteTranslationService.translateAndPersist(identity.userId(), id);
        return ApiResponse.ok(NoteDto.TranslateResponse.builder()
                .preview(false)
                .translatedText(note.getContent())
                .originalText(note.getOriginalContent() == null ? note.getContent() : note.getOriginalContent())
                .sourceLanguage(textTranslator.getSourceLanguage())
                .targetLanguage(textTranslator.getTargetLanguage())
                .note(toResponse(note))
                .build());
    }

    private NoteDto.Response toResponse(Note note) {
        boolean translated = note.isTranslatedState();
        return NoteDto.Response.builder()
                .id(note.getId())
                .title(note.getTitle())
                .content(note.getContent())
                .translated(translated)
                .originalContent(note.getOriginalContent())
                .translatable(!translated && textTranslator.isTranslatable(note.getContent()))
                .ownerId(note.getOwnerId())
                .createdAt(note.getCreatedAt())
                .updatedAt(note.getUpdatedAt())
                .build();
    }
}
