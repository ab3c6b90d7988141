package com.sunny.notepillar.server.service.impl;

import com.sunny.notepillar.server.dto.SessionDto;
import com.sunny.notepillar.server.security.AuthenticatedIdentity;
import com.sunny.notepillar.server.security.IdentitySummary;
import com.sunny.notepillar.server.security.ReauthCookieManager;
import com.sunny.notepillar.server.security.ReauthCookieWriter;
import com.sunny.notepillar.server.security.ReauthOutcome;
import com.sunny.notepillar.server.security.SessionContext;
import com.sunny.notepillar.server.security.ViewState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionServiceImplTest {

    private static final IdentitySummary ALICE = new IdentitySummary(7L, "alice", "alice@example.com");

    @Mock
    private ReauthCookieManager reauthCookieManager;
    @Mock
    private ReauthCookieWriter reauthCookieWriter;

    private SessionServiceImpl sessionService;

    @BeforeEach
    void setUp() {
        sessionService = new SessionServiceImpl(reauthCookieManager, reauthCookieWriter);
    }

    @Test
    void restore_shouldReturnTokenIdentityAndViewState() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        MockHttpServletResponse response = new MockHttpServletResponse();
        when(reauthCookieWriter.read(request)).thenReturn("cookie-value");
        doAnswer(invocation -> {
            SessionContext session = invocation.getArgument(1);
            session.restore("access-token-1", ALICE, new ViewState(42L, false));
            return ReauthOutcome.AUTHENTICATED;
        }).when(reauthCookieManager).validate(eq("cookie-value"), any(SessionContext.class));

        SessionDto.RestoreResponse result = sessionService.restore(request, response);

        assertTrue(result.getAuthenticated());
        assertEquals("AUTHENTICATED", result.getOutcome());
        assertEquals("access-token-1", result.getAccessToken());
        assertEquals("alice", result.getIdentity().getUsername());
        assertEquals(42L, result.getViewState().getOpenNoteId());
        verify(reauthCookieWriter).apply(ReauthOutcome.AUTHENTICATED, response);
    }

    @Test
    void restore_shouldNotLeakStateWhenUnverified() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        MockHttpServletResponse response = new MockHttpServletResponse();
        when(reauthCookieWriter.read(request)).thenReturn("cookie-value");
        when(reauthCookieManager.validate(eq("cookie-value"), any(SessionContext.class)))
                .thenReturn(ReauthOutcome.UNVERIFIED);

        SessionDto.RestoreResponse result = sessionService.restore(request, response);

        assertFalse(result.getAuthenticated());
        assertEquals("UNVERIFIED", result.getOutcome());
        assertNull(result.getAccessToken());
        assertNull(result.getIdentity());
        verify(reauthCookieWriter).apply(ReauthOutcome.UNVERIFIED, response);
    }

    @Test
    void saveViewState_shouldReissueCookieWithCurrentToken() {
        MockHttpServletResponse response = new MockHttpServletResponse();
        AuthenticatedIdentity identity = new AuthenticatedIdentity(7L, "alice", "alice@example.com", "access-token-1");
        SessionDto.ViewStateRequest request = new SessionDto.ViewStateRequest();
        request.setOpenNoteId(42L);
        request.setCreateNoteInProgress(true);
        when(reauthCookieManager.encode("access-token-1", ALICE, new ViewState(42L, true))).thenReturn("cookie-value");

        SessionDto.ViewStateResponse result = sessionService.saveViewState(identity, request, response);

        assertEquals(42L, result.getOpenNoteId());
        assertTrue(result.getCreateNoteInProgress());
        verify(reauthCookieWriter).write(response, "cookie-value");
    }

    @Test
    void rememberLogin_shouldWriteCookieWithEmptyViewState() {
        MockHttpServletResponse response = new MockHttpServletResponse();
        when(reauthCookieManager.encode("access-token-1", ALICE, ViewState.empty())).thenReturn("cookie-value");

        sessionService.rememberLogin("access-token-1", ALICE, response);

        verify(reauthCookieWriter).write(response, "cookie-value");
    }
}
