package com.sunny.notepillar.server.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 会话恢复 DTO
 *
 * @author Sunny
 * @date 2026-03-05
 */
public class SessionDto {

    @Data
    @Schema(name = "SessionViewStateRequest")
    public static class ViewStateRequest {
        private Long openNoteId;
        private Boolean createNoteInProgress = false;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ViewStateResponse {
        private Long openNoteId;
        private Boolean createNoteInProgress;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(name = "SessionRestoreResponse")
    public static class RestoreResponse {
        private Boolean authenticated;
        /** ABSENT / TAMPERED / EXPIRED / INCOMPLETE / REJECTED / UNVERIFIED / AUTHENTICATED */
        private String outcome;
        private String accessToken;
        private AuthDto.IdentityResponse identity;
        private ViewStateResponse viewState;
    }
}
