package com.sunny.notepillar.server.service.impl;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sunny.notepillar.common.exception.AlreadyExistsException;
import com.sunny.notepillar.common.exception.token.TokenInvalidException;
import com.sunny.notepillar.server.dto.AuthDto;
import com.sunny.notepillar.server.entity.User;
import com.sunny.notepillar.server.exception.auth.InactiveIdentityException;
import com.sunny.notepillar.server.exception.auth.InvalidCredentialsException;
import com.sunny.notepillar.server.mapper.UserMapper;
import com.sunny.notepillar.server.security.AccessTokenService;
import com.sunny.notepillar.server.security.AuthenticatedIdentity;
import com.sunny.notepillar.server.security.CredentialService;
import com.sunny.notepillar.server.security.IdentitySummary;
import com.sunny.notepillar.server.service.AuthService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 认证服务实现
 * 实现注册、密码登录与访问令牌到身份的解析
 *
 * @author Sunny
 * @date 2026-03-05
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthServiceImpl implements AuthService {

    private static final String TOKEN_TYPE = "bearer";

    private final UserMapper userMapper;
    private final CredentialService credentialService;
    private final AccessTokenService accessTokenService;
    private final Clock clock;

    @Override
    @Transactional(rollbackFor = Exception.class)
    public User register(AuthDto.RegisterRequest request) {
        if (userMapper.selectByUsername(request.getUsername()) != null) {
            throw new AlreadyExistsException("用户名已存在");
        }
        if (userMapper.selectByEmail(request.getEmail()) != null) {
            throw new AlreadyExistsException("邮箱已被注册");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        User user = new User();
        user.setUsername(request.getUsername());
        user.setEmail(request.getEmail());
        user.setPasswordHash(credentialService.hash(request.getPassword()));
        user.setActive(true);
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        userMapper.insert(user);

        log.info("security_event event=register_success user_id={}", user.getId());
        return user;
    }

    @Override
    public LoginResult login(AuthDto.LoginRequest request) {
        User user = userMapper.selectByUsername(request.getUsername());
        boolean matched = user == null
                ? credentialService.verifyAgainstDummy(request.getPassword())
                : credentialService.verify(request.getPassword(), user.getPasswordHash());
        if (!matched) {
            log.warn("security_event event=login_failed reason=invalid_credentials username={}", request.getUsername());
            throw new InvalidCredentialsException("用户名或密码错误");
        }
        if (!user.isEnabled()) {
            log.warn("security_event event=login_failed reason=inactive user_id={}", user.getId());
            throw new InactiveIdentityException("用户已被禁用");
        }

        String accessToken = accessTokenService.issue(user.getId());
        log.info("security_event event=login_success user_id={}", user.getId());
        return new LoginResult(accessToken, TOKEN_TYPE,
                new IdentitySummary(user.getId(), user.getUsername(), user.getEmail()));
    }

    @Override
    public AuthenticatedIdentity authenticate(String accessToken) {
        AccessTokenService.AccessTokenClaims claims = accessTokenService.verify(accessToken);
        Long userId;
        try {
            userId = Long.parseLong(claims.subject());
        } catch (NumberFormatException e) {
            throw new TokenInvalidException(e, "Token主体格式非法");
        }

        User user = userMapper.selectById(userId);
        if (user == null) {
            throw new TokenInvalidException("Token对应的用户不存在");
        }
        if (!user.isEnabled()) {
            throw new InactiveIdentityException("用户已被禁用");
        }
        return new AuthenticatedIdentity(user.getId(), user.getUsername(), user.getEmail(), accessToken);
    }
}
