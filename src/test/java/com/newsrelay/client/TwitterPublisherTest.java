package com.newsrelay.client;

import com.newsrelay.exception.PublishException;
import com.newsrelay.model.Destination;
import com.newsrelay.model.Item;
import com.newsrelay.model.RephrasedContent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("TwitterPublisher")
class TwitterPublisherTest {

    private static final String URL = "http://twitter.test/2/tweets";

    private MockRestServiceServer server;
    private TwitterPublisher publisher;

    private final Destination destination = new Destination(Destination.Platform.TWITTER, "main", "bearer-token", true);
    private final Item item = new Item("id-1", "Title", "https://example.com/a", "", null, null, null);

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        publisher = new TwitterPublisher(restTemplate, URL);
    }

    @Test
    @DisplayName("should post text with the item link and return the tweet id")
    void shouldTweet() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer bearer-token"))
                .andExpect(jsonPath("$.text").value("Big news\n\nhttps://example.com/a"))
                .andRespond(withSuccess("{\"data\":{\"id\":\"1789\",\"text\":\"Big news\"}}", MediaType.APPLICATION_JSON));

        String id = publisher.publish(destination, new RephrasedContent("Big news", "id-1"), item);

        assertThat(id).isEqualTo("1789");
        server.verify();
    }

    @Test
    @DisplayName("should keep tweets within 280 characters including the link")
    void shouldTrimToLimit() {
        String text = TwitterPublisher.tweetText(new RephrasedContent("x".repeat(400), "id-1"), item);

        assertThat(text).hasSize(TwitterPublisher.MAX_TWEET_LENGTH).endsWith("\n\nhttps://example.com/a");
    }

    @Test
    @DisplayName("should not cut an emoji in half when trimming")
    void shouldTrimOnCodePointBoundary() {
        Item withoutLink = new Item("id-2", "Title", null, "", null, null, null);
        String rocket = new String(Character.toChars(0x1F680));
        String longText = "x".repeat(278) + rocket.repeat(10);

        String text = TwitterPublisher.tweetText(new RephrasedContent(longText, "id-2"), withoutLink);

        assertThat(text).isEqualTo("x".repeat(278) + "…");
        assertThat(text.codePoints().noneMatch(cp -> Character.getType(cp) == Character.SURROGATE)).isTrue();
    }

    @Test
    @DisplayName("should not repeat a link already in the text")
    void shouldNotDuplicateLink() {
        String text = TwitterPublisher.tweetText(new RephrasedContent("Read https://example.com/a", "id-1"), item);

        assertThat(text).isEqualTo("Read https://example.com/a");
    }

    @Test
    @DisplayName("should report server errors as transient")
    void shouldMarkServerErrorTransient() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> publisher.publish(destination, new RephrasedContent("t", "id-1"), item))
                .isInstanceOfSatisfying(PublishException.class, e -> {
                    assertThat(e.isTransientFailure()).isTrue();
                    assertThat(e.getStatusCode()).isEqualTo(503);
                });
    }

    @Test
    @DisplayName("should report client errors as permanent")
    void shouldMarkClientErrorPermanent() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.FORBIDDEN).body("{\"detail\":\"duplicate\"}"));

        assertThatThrownBy(() -> publisher.publish(destination, new RephrasedContent("t", "id-1"), item))
                .isInstanceOfSatisfying(PublishException.class, e -> {
                    assertThat(e.isTransientFailure()).isFalse();
                    assertThat(e.getMessage()).contains("duplicate");
                });
    }
}
