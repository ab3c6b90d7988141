package com.sunny.notepillar.server.dto;

import java.time.LocalDateTime;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 笔记 DTO
 *
 * @author Sunny
 * @date 2026-03-05
 */
public class NoteDto {

    @Data
    @Schema(name = "NoteCreateRequest")
    public static class CreateRequest {

        @NotBlank(message = "标题不能为空")
        @Size(max = 100, message = "标题长度不能超过100")
        private String title;

        @NotBlank(message = "内容不能为空")
        private String content;
    }

    /**
     * 字段为空表示不修改
     */
    @Data
    @Schema(name = "NoteUpdateRequest")
    public static class UpdateRequest {

        @Size(min = 1, max = 100, message = "标题长度需在1到100之间")
        private String title;

        @Size(min = 1, message = "内容不能为空")
        private String content;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(name = "NoteResponse")
    public static class Response {
        private Long id;
        private String title;
        private String content;
        private Boolean translated;
        private String originalContent;
        /** 内容含源语言文字且尚未翻译 */
        private Boolean translatable;
        private Long ownerId;
        private LocalDateTime createdAt;
        private LocalDateTime updatedAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(name = "NoteTranslateResponse")
    public static class TranslateResponse {
        private Boolean preview;
        private String translatedText;
        private String originalText;
        private String sourceLanguage;
        private String targetLanguage;
        private Response note;
    }
}
