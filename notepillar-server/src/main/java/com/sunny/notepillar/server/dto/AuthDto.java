package com.sunny.notepillar.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 认证 DTO
 *
 * @author Sunny
 * @date 2026-03-05
 */
public class AuthDto {

    // ==================== 注册 ====================

    @Data
    @Schema(name = "AuthRegisterRequest")
    public static class RegisterRequest {

        @NotBlank(message = "用户名不能为空")
        @Size(min = 3, max = 50, message = "用户名长度需在3到50之间")
        private String username;

        @NotBlank(message = "邮箱不能为空")
        @Email(message = "邮箱格式不正确")
        private String email;

        @NotBlank(message = "密码不能为空")
        @Size(min = 8, message = "密码长度至少8位")
        @Pattern(regexp = "^(?=.*\\d)(?=.*[a-z])(?=.*[A-Z]).+$", message = "密码需包含数字、大写字母和小写字母")
        private String password;
    }

    // ==================== 登录 ====================

    @Data
    @Schema(name = "AuthLoginRequest")
    public static class LoginRequest {

        @NotBlank(message = "用户名不能为空")
        private String username;

        @NotBlank(message = "密码不能为空")
        private String password;

        /** 记住我，写入重认证Cookie */
        private Boolean rememberMe = false;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(name = "AuthTokenResponse")
    public static class TokenResponse {

        @JsonProperty("access_token")
        private String accessToken;

        @JsonProperty("token_type")
        private String tokenType;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(name = "AuthIdentityResponse")
    public static class IdentityResponse {
        private Long id;
        private String username;
        private String email;
        private Boolean active;
    }
}
