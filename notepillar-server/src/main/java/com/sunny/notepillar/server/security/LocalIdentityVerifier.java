package com.sunny.notepillar.server.security;

import com.sunny.notepillar.common.exception.UnauthorizedException;
import com.sunny.notepillar.server.service.AuthService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

/**
 * 进程内身份复核
 * 直接校验令牌并查询身份库
 *
 * @author Sunny
 * @date 2026-03-04
 */
@Slf4j
public class LocalIdentityVerifier implements IdentityVerifier {

    private final AuthService authService;

    public LocalIdentityVerifier(AuthService authService) {
        this.authService = authService;
    }

    @Override
    public IdentityVerification verify(String accessToken) {
        try {
            AuthenticatedIdentity identity = authService.authenticate(accessToken);
            return IdentityVerification.verified(identity.toSummary());
        } catch (UnauthorizedException e) {
            return IdentityVerification.rejected(e.getType());
        } catch (DataAccessException e) {
            log.warn("身份库暂不可用: {}", e.getMessage());
            return IdentityVerification.unavailable("identity_store_unavailable");
        }
    }
}
