package com.newsrelay.config;

import com.newsrelay.model.Destination;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Destination accounts and topic feeds, bound from {@code relay.*}.
 *
 * <pre>
 * relay.feeds[0]=https://techcrunch.com/feed/
 * relay.destinations[0].platform=twitter
 * relay.destinations[0].account-ref=main
 * relay.destinations[0].credential=${TWITTER_BEARER_TOKEN}
 * </pre>
 */
@ConfigurationProperties(prefix = "relay")
@Validated
@Data
public class RelayProperties {

    /**
     * Topic feed URLs to subscribe to (and to poll when polling is enabled)
     */
    private List<String> feeds = new ArrayList<>();

    /**
     * Publish targets, attempted in declaration order
     */
    @Valid
    private List<DestinationEntry> destinations = new ArrayList<>();

    public List<Destination> toDestinations() {
        return destinations.stream()
                .map(d -> new Destination(d.getPlatform(), d.getAccountRef(), d.getCredential(), d.isEnabled()))
                .toList();
    }

    @Data
    public static class DestinationEntry {
        @NotNull
        private Destination.Platform platform;

        /**
         * Facebook page id, or a label for an X/Twitter account
         */
        @NotBlank
        private String accountRef;

        /**
         * Page access token or bearer token
         */
        @NotBlank
        private String credential;

        private boolean enabled = true;
    }
}
