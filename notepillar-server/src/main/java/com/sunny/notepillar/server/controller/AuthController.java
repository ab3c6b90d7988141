package com.sunny.notepillar.server.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.sunny.notepillar.common.response.ApiResponse;
import com.sunny.notepillar.server.dto.AuthDto;
import com.sunny.notepillar.server.entity.User;
import com.sunny.notepillar.server.security.AuthenticatedIdentity;
import com.sunny.notepillar.server.security.CurrentIdentity;
import com.sunny.notepillar.server.service.AuthService;
import com.sunny.notepillar.server.service.SessionService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 认证控制器
 *
 * @author Sunny
 * @date 2026-03-06
 */
@Tag(name = "认证", description = "注册、登录与身份查询")
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;
    private final SessionService sessionService;

    @Operation(summary = "注册")
    @PostMapping("/register")
    public ApiResponse<AuthDto.IdentityResponse> register(@Valid @RequestBody AuthDto.RegisterRequest request) {
        User user = authService.register(request);
        return ApiResponse.ok(new AuthDto.IdentityResponse(user.getId(), user.getUsername(), user.getEmail(), user.getActive()));
    }

    @Operation(summary = "登录")
    @PostMapping("/login")
    public ApiResponse<AuthDto.TokenResponse> login(@Valid @RequestBody AuthDto.LoginRequest request,
                                                    HttpServletResponse response) {
        AuthService.LoginResult result = authService.login(request);
        if (Boolean.TRUE.equals(request.getRememberMe())) {
            sessionService.rememberLogin(result.accessToken(), result.identity(), response);
        }
        return ApiResponse.ok(new AuthDto.TokenResponse(result.accessToken(), result.tokenType()));
    }

    @Operation(summary = "当前身份")
    @GetMapping("/me")
    public ApiResponse<AuthDto.IdentityResponse> me(@CurrentIdentity AuthenticatedIdentity identity) {
        return ApiResponse.ok(new AuthDto.IdentityResponse(identity.userId(), identity.username(), identity.email(), true));
    }

    @Operation(summary = "登出")
    @PostMapping("/logout")
    public ApiResponse<Void> logout(HttpServletResponse response) {
        sessionService.forget(response);
        return ApiResponse.ok();
    }
}
