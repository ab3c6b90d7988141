package com.sunny.notepillar.server.security;

/**
 * 身份摘要
 *
 * @author Sunny
 * @date 2026-03-04
 */
public record IdentitySummary(Long id, String username, String email) {
}
