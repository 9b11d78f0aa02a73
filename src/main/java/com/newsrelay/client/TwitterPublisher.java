package com.newsrelay.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.newsrelay.exception.PublishException;
import com.newsrelay.model.Destination;
import com.newsrelay.model.Item;
import com.newsrelay.model.RephrasedContent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

@Component
@Slf4j
public class TwitterPublisher implements SocialPublisher {

    static final int MAX_TWEET_LENGTH = 280;

    private final RestTemplate restTemplate;
    private final String apiUrl;

    public TwitterPublisher(RestTemplate restTemplate,
                            @Value("${relay.twitter.api-url:https://api.twitter.com/2/tweets}") String apiUrl) {
        this.restTemplate = restTemplate;
        this.apiUrl = apiUrl;
    }

    @Override
    public Destination.Platform platform() {
        return Destination.Platform.TWITTER;
    }

    @Override
    public String publish(Destination destination, RephrasedContent content, Item item) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(destination.credential());
        HttpEntity<Map<String, Object>> entity = new HttpEntity<>(Map.of("text", tweetText(content, item)), headers);

        try {
            ResponseEntity<JsonNode> response = restTemplate.postForEntity(apiUrl, entity, JsonNode.class);
            JsonNode id = response.getBody() != null ? response.getBody().path("data").path("id") : null;
            if (id == null || id.isMissingNode() || id.asText().isEmpty()) {
                throw new PublishException("Tweet created but no id returned", response.getStatusCode().value(), false);
            }
            log.info("Tweeted item {} to {} (tweet {})", item.id(), destination.label(), id.asText());
            return id.asText();
        } catch (HttpStatusCodeException e) {
            throw PublishException.fromStatus(e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (ResourceAccessException e) {
            throw new PublishException("X/Twitter unreachable: " + e.getMessage(), e);
        }
    }

    /**
     * Rewritten text plus the item link, trimmed so the whole post fits in one tweet.
     */
    static String tweetText(RephrasedContent content, Item item) {
        String text = content.text().trim();
        if (!item.hasLink() || text.contains(item.link())) {
            return trim(text, MAX_TWEET_LENGTH);
        }
        String suffix = "\n\n" + item.link();
        int room = MAX_TWEET_LENGTH - suffix.length();
        if (room <= 0) {
            return trim(text, MAX_TWEET_LENGTH);
        }
        return trim(text, room) + suffix;
    }

    private static String trim(String text, int max) {
        if (text.length() <= max) {
            return text;
        }
        int end = max - 1;
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;  // never split a surrogate pair
        }
        return text.substring(0, end).trim() + "…";
    }
}
