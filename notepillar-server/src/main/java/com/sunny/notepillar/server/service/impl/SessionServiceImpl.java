package com.sunny.notepillar.server.service.impl;

import org.springframework.stereotype.Service;

import com.sunny.notepillar.server.dto.AuthDto;
import com.sunny.notepillar.server.dto.SessionDto;
import com.sunny.notepillar.server.security.AuthenticatedIdentity;
import com.sunny.notepillar.server.security.IdentitySummary;
import com.sunny.notepillar.server.security.ReauthCookieManager;
import com.sunny.notepillar.server.security.ReauthCookieWriter;
import com.sunny.notepillar.server.security.ReauthOutcome;
import com.sunny.notepillar.server.security.SessionContext;
import com.sunny.notepillar.server.security.ViewState;
import com.sunny.notepillar.server.service.SessionService;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 会话延续服务实现
 *
 * @author Sunny
 * @date 2026-03-05
 */
@Service
@RequiredArgsConstructor
public class SessionServiceImpl implements SessionService {

    private final ReauthCookieManager reauthCookieManager;
    private final ReauthCookieWriter reauthCookieWriter;

    @Override
    public SessionDto.RestoreResponse restore(HttpServletRequest request, HttpServletResponse response) {
        SessionContext session = new SessionContext();
        ReauthOutcome outcome = reauthCookieManager.validate(reauthCookieWriter.read(request), session);
        reauthCookieWriter.apply(outcome, response);

        SessionDto.RestoreResponse.RestoreResponseBuilder builder = SessionDto.RestoreResponse.builder()
                .authenticated(outcome.isAuthenticated())
                .outcome(outcome.name());
        if (outcome.isAuthenticated()) {
            IdentitySummary identity = session.getIdentity();
            builder.accessToken(session.getAccessToken())
                    .identity(new AuthDto.IdentityResponse(identity.id(), identity.username(), identity.email(), true))
                    .viewState(toResponse(session.getViewState()));
        }
        return builder.build();
    }

    @Override
    public void rememberLogin(String accessToken, IdentitySummary identity, HttpServletResponse response) {
        reauthCookieWriter.write(response, reauthCookieManager.encode(accessToken, identity, ViewState.empty()));
    }

    @Override
    public SessionDto.ViewStateResponse saveViewState(AuthenticatedIdentity identity,
                                                      SessionDto.ViewStateRequest request,
                                                      HttpServletResponse response) {
        ViewState viewState = new ViewState(request.getOpenNoteId(), Boolean.TRUE.equals(request.getCreateNoteInProgress()));
        String cookieValue = reauthCookieManager.encode(identity.accessToken(), identity.toSummary(), viewState);
        reauthCookieWriter.write(response, cookieValue);
        return toResponse(viewState);
    }

    @Override
    public void forget(HttpServletResponse response) {
        reauthCookieWriter.clear(response);
    }

    private SessionDto.ViewStateResponse toResponse(ViewState viewState) {
        return new SessionDto.ViewStateResponse(viewState.openNoteId(), viewState.createNoteInProgress());
    }
}
