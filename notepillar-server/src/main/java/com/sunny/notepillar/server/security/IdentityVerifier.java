package com.sunny.notepillar.server.security;

/**
 * 身份实时复核
 * 实现方需自带超时，且调用期间不得持有锁
 *
 * @author Sunny
 * @date 2026-03-04
 */
public interface IdentityVerifier {

    IdentityVerification verify(String accessToken);
}
