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
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Graph API page posts: a photo with caption when the item carries an image,
 * a plain feed post with the link otherwise.
 */
@Component
@Slf4j
public class FacebookPublisher implements SocialPublisher {

    private final RestTemplate restTemplate;
    private final String graphUrl;

    public FacebookPublisher(RestTemplate restTemplate,
                             @Value("${relay.facebook.graph-url:https://graph.facebook.com/v19.0}") String graphUrl) {
        this.restTemplate = restTemplate;
        this.graphUrl = graphUrl.endsWith("/") ? graphUrl.substring(0, graphUrl.length() - 1) : graphUrl;
    }

    @Override
    public Destination.Platform platform() {
        return Destination.Platform.FACEBOOK;
    }

    @Override
    public String publish(Destination destination, RephrasedContent content, Item item) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        String endpoint;
        if (item.hasImage()) {
            endpoint = "/photos";
            form.add("url", item.imageUrl());
            form.add("caption", captionWithLink(content, item));
        } else {
            endpoint = "/feed";
            form.add("message", content.text());
            if (item.hasLink()) {
                form.add("link", item.link());
            }
        }
        form.add("access_token", destination.credential());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        try {
            ResponseEntity<JsonNode> response = restTemplate.postForEntity(
                    graphUrl + "/" + destination.accountRef() + endpoint, new HttpEntity<>(form, headers), JsonNode.class);
            JsonNode body = response.getBody();
            String postId = body == null ? "" : body.hasNonNull("post_id") ? body.get("post_id").asText() : body.path("id").asText();
            if (postId.isEmpty()) {
                throw new PublishException("Facebook accepted the post but returned no id", response.getStatusCode().value(), false);
            }
            log.info("Posted item {} to {} via {} (post {})", item.id(), destination.label(), endpoint, postId);
            return postId;
        } catch (HttpStatusCodeException e) {
            throw PublishException.fromStatus(e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (ResourceAccessException e) {
            throw new PublishException("Facebook unreachable: " + e.getMessage(), e);
        }
    }

    private String captionWithLink(RephrasedContent content, Item item) {
        if (!item.hasLink() || content.text().contains(item.link())) {
            return content.text();
        }
        return content.text() + "\n\n" + item.link();
    }
}
