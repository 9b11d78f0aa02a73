package com.newsrelay.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.newsrelay.exception.RephraseException;
import com.newsrelay.model.Item;
import com.newsrelay.model.RephrasedContent;
import com.newsrelay.service.ApiKeyPool;
import com.newsrelay.util.FeedText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rewrites an item into a short social post through an OpenAI-compatible
 * chat-completions endpoint, rotating over the configured API keys.
 */
@Component
@Slf4j
public class RephraseClient {

    static final String SYSTEM_PROMPT = "Rewrite the following news article into a concise, engaging social media post. "
            + "Include emojis only if appropriate. Keep URLs intact.";

    private final RestTemplate restTemplate;
    private final ApiKeyPool keyPool;
    private final String baseUrl;
    private final String model;
    private final int maxTokens;

    public RephraseClient(RestTemplate restTemplate,
                          Clock clock,
                          @Value("${relay.rephrase.base-url:https://api.groq.com}") String baseUrl,
                          @Value("${relay.rephrase.api-keys:}") String[] apiKeys,
                          @Value("${relay.rephrase.model:llama-3.3-70b-versatile}") String model,
                          @Value("${relay.rephrase.max-tokens:220}") int maxTokens,
                          @Value("${relay.rephrase.cooldown-base:30s}") Duration cooldownBase,
                          @Value("${relay.rephrase.cooldown-max:15m}") Duration cooldownMax) {
        this.restTemplate = restTemplate;
        this.keyPool = new ApiKeyPool(Arrays.asList(apiKeys), clock, cooldownBase, cooldownMax);
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
        this.maxTokens = maxTokens;
        if (keyPool.size() == 0) {
            log.warn("No rephrase API keys configured (relay.rephrase.api-keys); every rewrite will fail");
        } else {
            log.info("Rephrase client ready: {} key(s), model {}", keyPool.size(), model);
        }
    }

    public RephrasedContent rewrite(Item item) {
        String input = buildInput(item);
        int attempts = Math.max(keyPool.size(), 1);

        for (int attempt = 1; attempt <= attempts; attempt++) {
            Optional<ApiKeyPool.Lease> acquired = keyPool.acquire();
            if (acquired.isEmpty()) {
                break;
            }
            ApiKeyPool.Lease lease = acquired.get();
            try {
                ResponseEntity<JsonNode> response = restTemplate.postForEntity(
                        baseUrl + "/openai/v1/chat/completions", buildRequest(lease, input), JsonNode.class);
                keyPool.markSuccess(lease);
                String text = extractText(response.getBody());
                if (FeedText.isBlank(text)) {
                    throw new RephraseException("Empty completion for item " + item.id());
                }
                log.debug("Rewrote item {} with key slot {}", item.id(), lease.index());
                return new RephrasedContent(text.trim(), item.id());
            } catch (HttpStatusCodeException e) {
                HttpStatusCode status = e.getStatusCode();
                if (status.value() == 429 || status.is5xxServerError()) {
                    keyPool.markTransientFailure(lease);
                } else if (status.value() == 401 || status.value() == 403) {
                    keyPool.markExhausted(lease);
                } else {
                    throw new RephraseException("Rephrase request rejected: " + status.value() + " "
                            + FeedText.truncate(e.getResponseBodyAsString(), 300), e);
                }
            } catch (ResourceAccessException e) {
                log.warn("Rephrase request failed with key {}: {}", lease.maskedKey(), e.getMessage());
                keyPool.markTransientFailure(lease);
            }
        }
        throw RephraseException.noKeyAvailable(keyPool.size());
    }

    ApiKeyPool keyPool() {
        return keyPool;
    }

    private HttpEntity<Map<String, Object>> buildRequest(ApiKeyPool.Lease lease, String input) {
        Map<String, Object> requestBody = Map.of(
                "model", model,
                "max_tokens", maxTokens,
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", input)));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(lease.key());
        return new HttpEntity<>(requestBody, headers);
    }

    private String buildInput(Item item) {
        StringBuilder input = new StringBuilder(item.title());
        if (!item.summary().isEmpty()) {
            input.append("\n\n").append(item.summary());
        }
        if (item.hasLink()) {
            input.append("\n\nRead more: ").append(item.link());
        }
        return input.toString();
    }

    private String extractText(JsonNode body) {
        if (body == null) {
            return null;
        }
        JsonNode content = body.path("choices").path(0).path("message").path("content");
        return content.isTextual() ? content.asText() : null;
    }
}
