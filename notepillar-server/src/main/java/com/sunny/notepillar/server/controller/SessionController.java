package com.sunny.notepillar.server.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.sunny.notepillar.common.response.ApiResponse;
import com.sunny.notepillar.server.dto.SessionDto;
import com.sunny.notepillar.server.security.AuthenticatedIdentity;
import com.sunny.notepillar.server.security.CurrentIdentity;
import com.sunny.notepillar.server.service.SessionService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 会话延续控制器
 *
 * @author Sunny
 * @date 2026-03-06
 */
@Tag(name = "会话", description = "基于重认证Cookie的登录恢复")
@RestController
@RequestMapping("/session")
@RequiredArgsConstructor
public class SessionController {

    private final SessionService sessionService;

    @Operation(summary = "恢复会话")
    @GetMapping
    public ApiResponse<SessionDto.RestoreResponse> restore(HttpServletRequest request, HttpServletResponse response) {
        return ApiResponse.ok(sessionService.restore(request, response));
    }

    @Operation(summary = "保存视图状态")
    @PutMapping("/view-state")
    public ApiResponse<SessionDto.ViewStateResponse> saveViewState(@CurrentIdentity AuthenticatedIdentity identity,
                                                                   @RequestBody SessionDto.ViewStateRequest request,
                                                                   HttpServletResponse response) {
        return ApiResponse.ok(sessionService.saveViewState(identity, request, response));
    }
}
