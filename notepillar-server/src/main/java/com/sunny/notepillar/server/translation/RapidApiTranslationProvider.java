package com.sunny.notepillar.server.translation;

import java.net.SocketTimeoutException;
import java.util.Map;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.sunny.notepillar.server.exception.translation.TranslationMalformedResponseException;
import com.sunny.notepillar.server.exception.translation.TranslationTimeoutException;
import com.sunny.notepillar.server.exception.translation.TranslationUnavailableException;

import lombok.extern.slf4j.Slf4j;

/**
 * RapidAPI 翻译服务
 *
 * @author Sunny
 * @date 2026-03-05
 */
@Slf4j
public class RapidApiTranslationProvider implements TranslationProvider {

    private static final String HEADER_API_KEY = "x-rapidapi-key";
    private static final String HEADER_API_HOST = "x-rapidapi-host";

    private final RestTemplate restTemplate;
    private final String apiUrl;
    private final String apiKey;
    private final String apiHost;

    public RapidApiTranslationProvider(RestTemplate restTemplate, String apiUrl, String apiKey, String apiHost) {
        this.restTemplate = restTemplate;
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.apiHost = apiHost;
    }

    @Override
    public String translate(String text, String sourceLanguage, String targetLanguage) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HEADER_API_KEY, apiKey == null ? "" : apiKey);
        headers.set(HEADER_API_HOST, apiHost);
        Map<String, String> payload = Map.of("q", text, "source", sourceLanguage, "target", targetLanguage);

        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.postForEntity(apiUrl, new HttpEntity<>(payload, headers), JsonNode.class);
        } catch (HttpStatusCodeException e) {
            log.warn("翻译服务返回错误状态: status={}", e.getStatusCode().value());
            throw new TranslationUnavailableException(e, "翻译服务不可用: status=%s", e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                log.warn("翻译服务请求超时: {}", e.getMessage());
                throw new TranslationTimeoutException(e, "翻译服务请求超时");
            }
            log.warn("翻译服务不可达: {}", e.getMessage());
            throw new TranslationUnavailableException(e, "翻译服务不可达");
        } catch (RestClientException e) {
            throw new TranslationMalformedResponseException(e, "翻译服务响应无法解析");
        }

        JsonNode translated = response.getBody() == null
                ? null
                : response.getBody().path("data").path("translations").path("translatedText");
        if (translated == null || !translated.isTextual() || translated.asText().isBlank()) {
            throw new TranslationMalformedResponseException("翻译服务响应缺少译文");
        }
        return translated.asText();
    }

    @Override
    public String name() {
        return "rapidapi";
    }
}
