package com.sunny.notepillar.server.security;

import java.net.SocketTimeoutException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RemoteIdentityVerifierTest {

    private static final String ENDPOINT = "http://identity.local/auth/me";

    @Mock
    private RestTemplate restTemplate;

    private RemoteIdentityVerifier verifier;

    @BeforeEach
    void setUp() {
        verifier = new RemoteIdentityVerifier(restTemplate, ENDPOINT);
    }

    @Test
    @SuppressWarnings("unchecked")
    void verify_shouldReturnLiveIdentity() throws Exception {
        JsonNode body = new ObjectMapper().readTree(
                "{\"code\":0,\"data\":{\"id\":7,\"username\":\"alice\",\"email\":\"alice@example.com\"}}");
        when(restTemplate.exchange(eq(ENDPOINT), eq(HttpMethod.GET), any(HttpEntity.class), eq(JsonNode.class)))
                .thenReturn(ResponseEntity.ok(body));

        IdentityVerification result = verifier.verify("access-token-1");

        assertEquals(IdentityVerification.Status.VERIFIED, result.status());
        assertEquals(new IdentitySummary(7L, "alice", "alice@example.com"), result.identity());
        ArgumentCaptor<HttpEntity<?>> captor = ArgumentCaptor.forClass(HttpEntity.class);
        verify(restTemplate).exchange(eq(ENDPOINT), eq(HttpMethod.GET), captor.capture(), eq(JsonNode.class));
        assertEquals("Bearer access-token-1", captor.getValue().getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void verify_shouldRejectOnUnauthorized() {
        when(restTemplate.exchange(eq(ENDPOINT), eq(HttpMethod.GET), any(HttpEntity.class), eq(JsonNode.class)))
                .thenThrow(new HttpClientErrorException(HttpStatus.UNAUTHORIZED));

        assertEquals(IdentityVerification.Status.REJECTED, verifier.verify("revoked").status());
    }

    @Test
    void verify_shouldReportUnavailableOnServerError() {
        when(restTemplate.exchange(eq(ENDPOINT), eq(HttpMethod.GET), any(HttpEntity.class), eq(JsonNode.class)))
                .thenThrow(new HttpServerErrorException(HttpStatus.SERVICE_UNAVAILABLE));

        assertEquals(IdentityVerification.Status.UNAVAILABLE, verifier.verify("access-token-1").status());
    }

    @Test
    void verify_shouldReportUnavailableOnTimeout() {
        when(restTemplate.exchange(eq(ENDPOINT), eq(HttpMethod.GET), any(HttpEntity.class), eq(JsonNode.class)))
                .thenThrow(new ResourceAccessException("Read timed out", new SocketTimeoutException("Read timed out")));

        assertEquals(IdentityVerification.Status.UNAVAILABLE, verifier.verify("access-token-1").status());
    }

    @Test
    void verify_shouldReportUnavailableOnUnreadableBody() throws Exception {
        when(restTemplate.exchange(eq(ENDPOINT), eq(HttpMethod.GET), any(HttpEntity.class), eq(JsonNode.class)))
                .thenReturn(ResponseEntity.ok(new ObjectMapper().readTree("{\"data\":{}}")));

        assertEquals(IdentityVerification.Status.UNAVAILABLE, verifier.verify("access-token-1").status());
    }
}
