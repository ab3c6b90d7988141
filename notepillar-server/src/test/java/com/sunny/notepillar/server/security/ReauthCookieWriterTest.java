package com.sunny.notepillar.server.security;

import com.sunny.notepillar.server.config.NotepillarProperties;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReauthCookieWriterTest {

    private final NotepillarProperties properties = new NotepillarProperties();
    private final ReauthCookieWriter writer = new ReauthCookieWriter(properties);

    @Test
    void write_shouldEmitHardenedCookie() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        writer.write(response, "signed-value");

        String header = response.getHeader(HttpHeaders.SET_COOKIE);
        assertTrue(header.startsWith("notes_auth=signed-value"));
        assertTrue(header.contains("HttpOnly"));
        assertTrue(header.contains("SameSite=Strict"));
        assertTrue(header.contains("Max-Age=2592000"));
        assertFalse(header.contains("Secure"));
    }

    @Test
    void write_shouldMarkSecureWhenConfigured() {
        properties.getCookie().setSecure(true);
        MockHttpServletResponse response = new MockHttpServletResponse();

        writer.write(response, "signed-value");

        assertTrue(response.getHeader(HttpHeaders.SET_COOKIE).contains("Secure"));
    }

    @Test
    void apply_shouldClearOnlyWhenOutcomeRequiresDeletion() {
        MockHttpServletResponse kept = new MockHttpServletResponse();
        writer.apply(ReauthOutcome.UNVERIFIED, kept);
        assertNull(kept.getHeader(HttpHeaders.SET_COOKIE));

        MockHttpServletResponse cleared = new MockHttpServletResponse();
        writer.apply(ReauthOutcome.TAMPERED, cleared);
        assertTrue(cleared.getHeader(HttpHeaders.SET_COOKIE).contains("Max-Age=0"));
    }

    @Test
    void read_shouldFindCookieByName() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setCookies(new Cookie("other", "x"), new Cookie("notes_auth", "signed-value"));

        assertEquals("signed-value", writer.read(request));
        assertNull(writer.read(new MockHttpServletRequest()));
    }
}
