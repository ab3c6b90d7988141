package com.sunny.notepillar.server.security;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import com.sunny.notepillar.server.config.NotepillarProperties;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 重认证Cookie读写组件
 *
 * @author Sunny
 * @date 2026-03-04
 */
@Component
@RequiredArgsConstructor
public class ReauthCookieWriter {

    private static final long SECONDS_PER_DAY = 24L * 60 * 60;

    private final NotepillarProperties properties;

    public String read(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        String name = properties.getCookie().getName();
        for (Cookie cookie : cookies) {
            if (name.equals(cookie.getName())) {
                return cookie.getValue();
            }
        }
        return null;
    }

    public void write(HttpServletResponse response, String cookieValue) {
        long maxAge = properties.getCookie().getTtlDays() * SECONDS_PER_DAY;
        addCookieHeader(response, buildCookie(cookieValue, maxAge));
    }

    public void clear(HttpServletResponse response) {
        addCookieHeader(response, buildCookie("", 0));
    }

    public void apply(ReauthOutcome outcome, HttpServletResponse response) {
        if (outcome.isDeleteCookie()) {
            clear(response);
        }
    }

    private ResponseCookie buildCookie(String value, long maxAgeSeconds) {
        return ResponseCookie.from(properties.getCookie().getName(), value)
                .httpOnly(true)
                .secure(properties.getCookie().isSecure())
                .path("/")
                .maxAge(maxAgeSeconds)
                .sameSite("Strict")
                .build();
    }

    private void addCookieHeader(HttpServletResponse response, ResponseCookie cookie) {
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }
}
