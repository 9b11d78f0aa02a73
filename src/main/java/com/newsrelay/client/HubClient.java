package com.newsrelay.client;

import com.newsrelay.exception.SubscriptionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Sends subscribe / unsubscribe requests to the WebSub hub. Verification is
 * asynchronous: the hub answers 202 and later calls our callback with a challenge.
 */
@Component
@Slf4j
public class HubClient {

    static final int MAX_ATTEMPTS = 3;

    private final RestTemplate restTemplate;
    private final String hubUrl;
    private final String user;
    private final String password;
    private final Duration retryBackoff;

    public HubClient(RestTemplate restTemplate,
                     @Value("${relay.websub.hub-url:https://push.superfeedr.com}") String hubUrl,
                     @Value("${relay.websub.user:}") String user,
                     @Value("${relay.websub.password:}") String password,
                     @Value("${relay.websub.retry-backoff:1s}") Duration retryBackoff) {
        this.restTemplate = restTemplate;
        this.hubUrl = hubUrl;
        this.user = user;
        this.password = password;
        this.retryBackoff = retryBackoff;
    }

    public void send(String mode, String topicUrl, String callbackUrl, String secret, long leaseSeconds) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("hub.mode", mode);
        form.add("hub.topic", topicUrl);
        form.add("hub.callback", callbackUrl);
        form.add("hub.verify", "async");
        if ("subscribe".equals(mode)) {
            form.add("hub.lease_seconds", Long.toString(leaseSeconds));
            if (secret != null && !secret.isBlank()) {
                form.add("hub.secret", secret);
            }
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        if (!user.isBlank()) {
            headers.setBasicAuth(user, password);
        }
        HttpEntity<MultiValueMap<String, String>> entity = new HttpEntity<>(form, headers);

        for (int attempt = 1; ; attempt++) {
            try {
                ResponseEntity<String> response = restTemplate.postForEntity(hubUrl, entity, String.class);
                int status = response.getStatusCode().value();
                if (status == 202 || status == 204) {
                    log.info("Hub accepted {} for {} (HTTP {})", mode, topicUrl, status);
                    return;
                }
                throw new SubscriptionException("Unexpected hub response " + status + " for " + mode + " " + topicUrl,
                        status, false);
            } catch (HttpStatusCodeException e) {
                int status = e.getStatusCode().value();
                SubscriptionException failure = new SubscriptionException(
                        "Hub rejected " + mode + " for " + topicUrl + ": " + status + " " + e.getResponseBodyAsString(),
                        status, e.getStatusCode().is5xxServerError());
                if (!failure.isRetryable() || attempt >= MAX_ATTEMPTS) {
                    throw failure;
                }
                log.warn("Hub returned {} for {} {} (attempt {}/{})", status, mode, topicUrl, attempt, MAX_ATTEMPTS);
            } catch (ResourceAccessException e) {
                if (attempt >= MAX_ATTEMPTS) {
                    throw new SubscriptionException("Hub unreachable for " + mode + " " + topicUrl + ": " + e.getMessage(), e);
                }
                log.warn("Hub unreachable for {} {} (attempt {}/{}): {}", mode, topicUrl, attempt, MAX_ATTEMPTS, e.getMessage());
            }
            pause(attempt);
        }
    }

    private void pause(int attempt) {
        long base = retryBackoff.toMillis() * (1L << (attempt - 1));
        long jitter = base > 0 ? ThreadLocalRandom.current().nextLong(base / 2 + 1) : 0;
        try {
            Thread.sleep(base + jitter);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SubscriptionException("Interrupted while retrying hub request", e);
        }
    }
}
