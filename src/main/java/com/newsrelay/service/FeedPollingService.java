package com.newsrelay.service;

import com.newsrelay.config.RelayProperties;
import com.newsrelay.exception.FeedParseException;
import com.newsrelay.model.DeliveryReceipt;
import com.newsrelay.model.ParsedFeed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Pull fallback for feeds whose hub does not push: fetches every configured feed
 * on a fixed delay and sends the entries through the same claim and relay path
 * as a webhook delivery.
 */
@Service
@ConditionalOnProperty(name = "relay.polling.enabled", havingValue = "true")
@Slf4j
public class FeedPollingService {

    private static final String USER_AGENT = "Mozilla/5.0 (compatible; NewsRelay/1.0)";

    private final RestTemplate restTemplate;
    private final FeedParser feedParser;
    private final WebhookReceiver webhookReceiver;
    private final RelayProperties relayProperties;

    public FeedPollingService(RestTemplate restTemplate,
                              FeedParser feedParser,
                              WebhookReceiver webhookReceiver,
                              RelayProperties relayProperties) {
        this.restTemplate = restTemplate;
        this.feedParser = feedParser;
        this.webhookReceiver = webhookReceiver;
        this.relayProperties = relayProperties;
    }

    @Scheduled(fixedDelayString = "${relay.polling.interval-ms:300000}", initialDelay = 10000)
    public void pollAll() {
        int accepted = 0;
        for (String feedUrl : relayProperties.getFeeds()) {
            try {
                accepted += poll(feedUrl).accepted();
            } catch (RestClientException | FeedParseException e) {
                log.error("Polling {} failed: {}", feedUrl, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Relaying polled items from {} failed", feedUrl, e);
            }
        }
        log.info("Polled {} feed(s), {} new item(s)", relayProperties.getFeeds().size(), accepted);
    }

    public DeliveryReceipt poll(String feedUrl) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
        ResponseEntity<byte[]> response = restTemplate.exchange(
                feedUrl, HttpMethod.GET, new HttpEntity<>(headers), byte[].class);
        byte[] body = response.getBody();
        if (body == null || body.length == 0) {
            throw new FeedParseException("Empty response from " + feedUrl);
        }
        ParsedFeed feed = feedParser.parse(body, feedUrl);
        return webhookReceiver.ingest(feed);
    }
}
