package com.sunny.notepillar.server.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.sunny.notepillar.common.constant.HeaderConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * 远程身份复核
 * 调用身份服务 /auth/me，超时由 RestTemplate 的连接与读取超时约束
 *
 * @author Sunny
 * @date 2026-03-04
 */
@Slf4j
public class RemoteIdentityVerifier implements IdentityVerifier {

    private final RestTemplate restTemplate;
    private final String identityEndpoint;

    public RemoteIdentityVerifier(RestTemplate restTemplate, String identityEndpoint) {
        this.restTemplate = restTemplate;
        this.identityEndpoint = identityEndpoint;
    }

    @Override
    public IdentityVerification verify(String accessToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, HeaderConstants.BEARER_PREFIX + accessToken);
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    identityEndpoint, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class);
            IdentitySummary identity = readIdentity(response.getBody());
            if (identity == null) {
                return IdentityVerification.unavailable("identity_response_unreadable");
            }
            return IdentityVerification.verified(identity);
        } catch (HttpStatusCodeException e) {
            if (isDefinitive(e.getStatusCode().value())) {
                return IdentityVerification.rejected("status_" + e.getStatusCode().value());
            }
            log.warn("身份服务异常: status={}", e.getStatusCode().value());
            return IdentityVerification.unavailable("status_" + e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            log.warn("身份服务不可达: {}", e.getMessage());
            return IdentityVerification.unavailable("identity_service_unreachable");
        } catch (RestClientException e) {
            log.warn("身份服务响应无法解析: {}", e.getMessage());
            return IdentityVerification.unavailable("identity_response_unreadable");
        }
    }

    private boolean isDefinitive(int status) {
        return status == HttpStatus.UNAUTHORIZED.value()
                || status == HttpStatus.FORBIDDEN.value()
                || status == HttpStatus.NOT_FOUND.value();
    }

    private IdentitySummary readIdentity(JsonNode body) {
        if (body == null) {
            return null;
        }
        JsonNode data = body.path("data");
        if (!data.path("id").canConvertToLong()) {
            return null;
        }
        return new IdentitySummary(
                data.path("id").asLong(),
                data.path("username").asText(null),
                data.path("email").asText(null));
    }
}
