package com.newsrelay.service;

import com.newsrelay.client.HubClient;
import com.newsrelay.config.RelayProperties;
import com.newsrelay.exception.SubscriptionException;
import com.newsrelay.model.SubscriptionEntity;
import com.newsrelay.repository.SubscriptionRepository;
import com.newsrelay.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SubscriptionService")
class SubscriptionServiceTest {

    private static final String TOPIC = "https://example.com/feed.xml";
    private static final String CALLBACK = "http://relay.test/webhook";
    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @Mock
    private HubClient hubClient;

    @Mock
    private SubscriptionRepository repository;

    private RelayProperties relayProperties;
    private SubscriptionService service;

    @BeforeEach
    void setUp() {
        relayProperties = new RelayProperties();
        relayProperties.setFeeds(List.of(TOPIC));
        service = new SubscriptionService(hubClient, repository, relayProperties, new MutableClock(NOW));
        ReflectionTestUtils.setField(service, "defaultCallbackUrl", CALLBACK);
        ReflectionTestUtils.setField(service, "leaseSeconds", 86400L);
        ReflectionTestUtils.setField(service, "renewBefore", Duration.ofHours(1));
    }

    @Nested
    @DisplayName("subscribe()")
    class Subscribe {

        @Test
        @DisplayName("should store a pending subscription with a fresh secret and call the hub")
        void shouldStoreAndRequest() {
            when(repository.findByTopicUrl(TOPIC)).thenReturn(Optional.empty());

            service.subscribe(TOPIC);

            ArgumentCaptor<SubscriptionEntity> saved = ArgumentCaptor.forClass(SubscriptionEntity.class);
            verify(repository).save(saved.capture());
            assertThat(saved.getValue().getStatus()).isEqualTo(SubscriptionEntity.Status.PENDING);
            assertThat(saved.getValue().getSecret()).matches("[0-9a-f]{32}");
            verify(hubClient).send("subscribe", TOPIC, CALLBACK, saved.getValue().getSecret(), 86400L);
        }

        @Test
        @DisplayName("should keep the existing secret on renewal")
        void shouldReuseSecret() {
            SubscriptionEntity existing = new SubscriptionEntity(TOPIC, CALLBACK, "existing-secret", 86400,
                    LocalDateTime.of(2024, 12, 31, 0, 0));
            existing.setStatus(SubscriptionEntity.Status.ACTIVE);
            when(repository.findByTopicUrl(TOPIC)).thenReturn(Optional.of(existing));

            service.subscribe(TOPIC);

            assertThat(existing.getStatus()).isEqualTo(SubscriptionEntity.Status.ACTIVE);
            verify(hubClient).send("subscribe", TOPIC, CALLBACK, "existing-secret", 86400L);
        }

        @Test
        @DisplayName("should surface hub rejection")
        void shouldPropagateRejection() {
            when(repository.findByTopicUrl(TOPIC)).thenReturn(Optional.empty());
            doThrow(new SubscriptionException("Hub rejected subscribe", 401, false))
                    .when(hubClient).send(anyString(), anyString(), anyString(), anyString(), anyLong());

            assertThatThrownBy(() -> service.subscribe(TOPIC)).isInstanceOf(SubscriptionException.class);
        }

        @Test
        @DisplayName("should refuse to subscribe without a callback URL")
        void shouldRequireCallback() {
            assertThatThrownBy(() -> service.subscribe(TOPIC, " ")).isInstanceOf(SubscriptionException.class);
            verify(hubClient, never()).send(any(), any(), any(), any(), anyLong());
        }
    }

    @Nested
    @DisplayName("unsubscribe()")
    class Unsubscribe {

        @Test
        @DisplayName("should mark the subscription as unsubscribing before calling the hub")
        void shouldMarkUnsubscribing() {
            SubscriptionEntity active = new SubscriptionEntity(TOPIC, CALLBACK, "s", 86400, LocalDateTime.of(2024, 12, 31, 0, 0));
            active.setStatus(SubscriptionEntity.Status.ACTIVE);
            when(repository.findByTopicUrl(TOPIC)).thenReturn(Optional.of(active));

            service.unsubscribe(TOPIC);

            assertThat(active.getStatus()).isEqualTo(SubscriptionEntity.Status.UNSUBSCRIBING);
            InOrder order = inOrder(repository, hubClient);
            order.verify(repository).save(active);
            order.verify(hubClient).send("unsubscribe", TOPIC, CALLBACK, null, 0);
        }

        @Test
        @DisplayName("should restore the previous state when the hub rejects the request")
        void shouldRestoreOnRejection() {
            SubscriptionEntity active = new SubscriptionEntity(TOPIC, CALLBACK, "s", 86400, LocalDateTime.of(2024, 12, 31, 0, 0));
            active.setStatus(SubscriptionEntity.Status.ACTIVE);
            when(repository.findByTopicUrl(TOPIC)).thenReturn(Optional.of(active));
            doThrow(new SubscriptionException("Hub rejected unsubscribe", 400, false))
                    .when(hubClient).send(eq("unsubscribe"), eq(TOPIC), eq(CALLBACK), isNull(), eq(0L));

            assertThatThrownBy(() -> service.unsubscribe(TOPIC)).isInstanceOf(SubscriptionException.class);
            assertThat(active.getStatus()).isEqualTo(SubscriptionEntity.Status.ACTIVE);
        }
    }

    @Nested
    @DisplayName("verifyChallenge()")
    class VerifyChallenge {

        @Test
        @DisplayName("should echo the challenge and activate the subscription")
        void shouldActivate() {
            SubscriptionEntity pending = new SubscriptionEntity(TOPIC, CALLBACK, "s", 86400, LocalDateTime.of(2025, 1, 1, 0, 0));
            when(repository.findByTopicUrl(TOPIC)).thenReturn(Optional.of(pending));

            Optional<String> echoed = service.verifyChallenge("subscribe", TOPIC, "abc123", 3600L);

            assertThat(echoed).contains("abc123");
            assertThat(pending.getStatus()).isEqualTo(SubscriptionEntity.Status.ACTIVE);
            assertThat(pending.getLeaseSeconds()).isEqualTo(3600);
            assertThat(pending.getExpiresAt()).isEqualTo(LocalDateTime.of(2025, 1, 1, 1, 0));
            verify(repository).save(pending);
        }

        @Test
        @DisplayName("should accept a configured feed that has no stored row yet")
        void shouldAcceptConfiguredFeed() {
            when(repository.findByTopicUrl(TOPIC)).thenReturn(Optional.empty());

            assertThat(service.verifyChallenge("subscribe", TOPIC, "abc123", null)).contains("abc123");
            verify(repository).save(any(SubscriptionEntity.class));
        }

        @Test
        @DisplayName("should mark unsubscribed when we asked to unsubscribe")
        void shouldUnsubscribe() {
            SubscriptionEntity leaving = new SubscriptionEntity(TOPIC, CALLBACK, "s", 86400, LocalDateTime.of(2025, 1, 1, 0, 0));
            leaving.setStatus(SubscriptionEntity.Status.UNSUBSCRIBING);
            when(repository.findByTopicUrl(TOPIC)).thenReturn(Optional.of(leaving));

            assertThat(service.verifyChallenge("unsubscribe", TOPIC, "bye", null)).contains("bye");
            assertThat(leaving.getStatus()).isEqualTo(SubscriptionEntity.Status.UNSUBSCRIBED);
        }

        @Test
        @DisplayName("should refuse an unsubscribe verification nobody requested")
        void shouldRefuseUnrequestedUnsubscribe() {
            SubscriptionEntity active = new SubscriptionEntity(TOPIC, CALLBACK, "s", 86400, LocalDateTime.of(2025, 1, 1, 0, 0));
            active.setStatus(SubscriptionEntity.Status.ACTIVE);
            when(repository.findByTopicUrl(TOPIC)).thenReturn(Optional.of(active));

            assertThat(service.verifyChallenge("unsubscribe", TOPIC, "x", null)).isEmpty();
            assertThat(active.getStatus()).isEqualTo(SubscriptionEntity.Status.ACTIVE);
            verify(repository, never()).save(any());
        }

        @Test
        @DisplayName("should refuse unsubscribe verification for a configured feed with no stored row")
        void shouldRefuseUnsubscribeWithoutRow() {
            when(repository.findByTopicUrl(TOPIC)).thenReturn(Optional.empty());

            assertThat(service.verifyChallenge("unsubscribe", TOPIC, "x", null)).isEmpty();
            verify(repository, never()).save(any());
        }

        @Test
        @DisplayName("should accept a request without topic")
        void shouldAcceptMissingTopic() {
            assertThat(service.verifyChallenge("subscribe", null, "abc123", null)).contains("abc123");
        }

        @Test
        @DisplayName("should refuse unknown topics")
        void shouldRefuseUnknownTopic() {
            when(repository.findByTopicUrl("https://other.example.com/feed")).thenReturn(Optional.empty());

            assertThat(service.verifyChallenge("subscribe", "https://other.example.com/feed", "abc123", null)).isEmpty();
            verify(repository, never()).save(any());
        }

        @Test
        @DisplayName("should refuse other modes and blank challenges")
        void shouldRefuseBadRequests() {
            assertThat(service.verifyChallenge("denied", TOPIC, "abc123", null)).isEmpty();
            assertThat(service.verifyChallenge("subscribe", TOPIC, " ", null)).isEmpty();
        }
    }

    @Test
    @DisplayName("renewExpiring() should re-subscribe leases ending inside the window and survive failures")
    void shouldRenewExpiring() {
        SubscriptionEntity first = new SubscriptionEntity(TOPIC, CALLBACK, "s1", 86400, LocalDateTime.of(2024, 12, 31, 0, 0));
        SubscriptionEntity second = new SubscriptionEntity("https://example.com/other", CALLBACK, "s2", 86400,
                LocalDateTime.of(2024, 12, 31, 0, 0));
        when(repository.findByStatusAndExpiresAtLessThanEqual(
                SubscriptionEntity.Status.ACTIVE, LocalDateTime.of(2025, 1, 1, 1, 0))).thenReturn(List.of(first, second));
        when(repository.findByTopicUrl(TOPIC)).thenReturn(Optional.of(first));
        when(repository.findByTopicUrl("https://example.com/other")).thenReturn(Optional.of(second));
        lenient().doThrow(new SubscriptionException("hub down", 503, true))
                .when(hubClient).send(eq("subscribe"), eq("https://example.com/other"), anyString(), anyString(), anyLong());

        assertThat(service.renewExpiring()).isEqualTo(1);
        verify(hubClient).send("subscribe", TOPIC, CALLBACK, "s1", 86400L);
    }

    @Test
    @DisplayName("knownSecrets() should drop blank secrets")
    void shouldListSecrets() {
        SubscriptionEntity withSecret = new SubscriptionEntity(TOPIC, CALLBACK, "s1", 1, LocalDateTime.of(2025, 1, 1, 0, 0));
        SubscriptionEntity withoutSecret = new SubscriptionEntity("t2", CALLBACK, null, 1, LocalDateTime.of(2025, 1, 1, 0, 0));
        when(repository.findByStatusNot(SubscriptionEntity.Status.UNSUBSCRIBED)).thenReturn(List.of(withSecret, withoutSecret));

        assertThat(service.knownSecrets()).containsExactly("s1");
    }
}
