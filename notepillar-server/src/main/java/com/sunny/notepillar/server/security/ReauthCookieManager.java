package com.sunny.notepillar.server.security;

import com.sunny.notepillar.common.exception.BadRequestException;
import com.sunny.notepillar.common.exception.UnauthorizedException;
import com.sunny.notepillar.common.exception.token.TokenExpiredException;
import com.sunny.notepillar.common.utils.JwtUtil;
import io.jsonwebtoken.Claims;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * 重认证Cookie管理组件
 * 负责重认证Cookie的编码、校验与会话恢复
 *
 * <p>Cookie内容为使用独立密钥签名的JWT，仅签名不加密。恢复出的访问令牌必须再经过
 * {@link IdentityVerifier} 实时复核后才视为已认证。</p>
 *
 * @author Sunny
 * @date 2026-03-04
 */
@Slf4j
public class ReauthCookieManager {

    static final String CLAIM_TOKEN = "token";
    static final String CLAIM_USER_ID = "user_id";
    static final String CLAIM_NAME = "name";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_EXP_DATE = "exp_date";
    static final String CLAIM_VIEW_STATE = "view_state";
    static final String VIEW_CURRENT_NOTE_ID = "current_note_id";
    static final String VIEW_SHOW_CREATE_NOTE = "show_create_note";

    private static final List<String> REQUIRED_CLAIMS = List.of(CLAIM_TOKEN, CLAIM_EXP_DATE, CLAIM_USER_ID, CLAIM_NAME);

    private final JwtUtil jwtUtil;
    private final Duration ttl;
    private final IdentityVerifier identityVerifier;

    public ReauthCookieManager(JwtUtil jwtUtil, Duration ttl, IdentityVerifier identityVerifier) {
        this.jwtUtil = jwtUtil;
        this.ttl = ttl;
        this.identityVerifier = identityVerifier;
    }

    public String encode(String bearerToken, IdentitySummary identity, ViewState viewState) {
        return encode(bearerToken, jwtUtil.getClock().instant().plus(ttl), identity, viewState);
    }

    public String encode(String bearerToken, Instant expiry, IdentitySummary identity, ViewState viewState) {
        if (bearerToken == null || bearerToken.isBlank() || identity == null || identity.id() == null) {
            throw new BadRequestException("重认证Cookie缺少令牌或身份信息");
        }
        ViewState state = viewState == null ? ViewState.empty() : viewState;
        Map<String, Object> view = new LinkedHashMap<>();
        view.put(VIEW_CURRENT_NOTE_ID, state.openNoteId());
        view.put(VIEW_SHOW_CREATE_NOTE, state.createNoteInProgress());

        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put(CLAIM_TOKEN, bearerToken);
        claims.put(CLAIM_USER_ID, identity.id());
        claims.put(CLAIM_NAME, identity.username());
        if (identity.email() != null) {
            claims.put(CLAIM_EMAIL, identity.email());
        }
        claims.put(CLAIM_EXP_DATE, expiry.getEpochSecond());
        claims.put(CLAIM_VIEW_STATE, view);
        return jwtUtil.sign(claims, null, jwtUtil.getClock().instant(), expiry);
    }

    /**
     * 校验Cookie并尝试恢复会话，返回值决定是否删除Cookie
     */
    public ReauthOutcome validate(String cookieValue, SessionContext session) {
        if (cookieValue == null || cookieValue.isBlank()) {
            return ReauthOutcome.ABSENT;
        }

        Claims claims;
        try {
            claims = jwtUtil.parseToken(cookieValue);
        } catch (TokenExpiredException e) {
            log.info("security_event event=reauth_cookie_expired");
            return ReauthOutcome.EXPIRED;
        } catch (UnauthorizedException e) {
            log.warn("security_event event=reauth_cookie_rejected reason={}", e.getType());
            return ReauthOutcome.TAMPERED;
        }

        List<String> missing = REQUIRED_CLAIMS.stream()
                .filter(name -> isBlank(claims.get(name)))
                .toList();
        Long userId = toLong(claims.get(CLAIM_USER_ID));
        Long expDate = toLong(claims.get(CLAIM_EXP_DATE));
        if (!missing.isEmpty() || userId == null || expDate == null) {
            log.warn("security_event event=reauth_cookie_incomplete missing={}", missing);
            return ReauthOutcome.INCOMPLETE;
        }
        if (!jwtUtil.getClock().instant().isBefore(Instant.ofEpochSecond(expDate))) {
            log.info("security_event event=reauth_cookie_expired source=exp_date");
            return ReauthOutcome.EXPIRED;
        }

        String token = String.valueOf(claims.get(CLAIM_TOKEN));
        IdentitySummary identity = new IdentitySummary(
                userId,
                String.valueOf(claims.get(CLAIM_NAME)),
                claims.get(CLAIM_EMAIL, String.class));
        session.restore(token, identity, readViewState(claims.get(CLAIM_VIEW_STATE)));

        IdentityVerification verification = identityVerifier.verify(token);
        switch (verification.status()) {
            case VERIFIED -> {
                IdentitySummary live = verification.identity();
                if (live == null || !Objects.equals(live.id(), userId)) {
                    session.clearAuthentication();
                    log.warn("security_event event=reauth_identity_mismatch user_id={}", userId);
                    return ReauthOutcome.REJECTED;
                }
                session.refreshIdentity(live);
                log.info("security_event event=reauth_restored user_id={}", userId);
                return ReauthOutcome.AUTHENTICATED;
            }
            case REJECTED -> {
                session.clearAuthentication();
                log.warn("security_event event=reauth_verification_rejected user_id={} reason={}",
                        userId, verification.reason());
                return ReauthOutcome.REJECTED;
            }
            default -> {
                session.clearAuthentication();
                log.warn("security_event event=reauth_verification_unavailable user_id={} reason={}",
                        userId, verification.reason());
                return ReauthOutcome.UNVERIFIED;
            }
        }
    }

    public Duration getTtl() {
        return ttl;
    }

    private ViewState readViewState(Object value) {
        if (!(value instanceof Map<?, ?> view)) {
            return ViewState.empty();
        }
        Long openNoteId = toLong(view.get(VIEW_CURRENT_NOTE_ID));
        boolean createNoteInProgress = Boolean.TRUE.equals(view.get(VIEW_SHOW_CREATE_NOTE));
        return new ViewState(openNoteId, createNoteInProgress);
    }

    private static boolean isBlank(Object value) {
        return value == null || (value instanceof String text && text.isBlank());
    }

    private static Long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
