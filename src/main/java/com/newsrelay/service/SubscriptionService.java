package com.newsrelay.service;

import com.newsrelay.client.HubClient;
import com.newsrelay.config.RelayProperties;
import com.newsrelay.exception.SubscriptionException;
import com.newsrelay.model.SubscriptionEntity;
import com.newsrelay.repository.SubscriptionRepository;
import com.newsrelay.util.DigestUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Keeps our WebSub subscriptions alive: requests them from the hub, answers the
 * hub's verification challenges, and renews leases before they lapse.
 */
@Service
@Slf4j
public class SubscriptionService {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final HubClient hubClient;
    private final SubscriptionRepository repository;
    private final RelayProperties relayProperties;
    private final Clock clock;

    @Value("${relay.websub.callback-url:}")
    private String defaultCallbackUrl;

    @Value("${relay.websub.lease-seconds:86400}")
    private long leaseSeconds;

    @Value("${relay.websub.renew-before:1h}")
    private Duration renewBefore;

    public SubscriptionService(HubClient hubClient,
                               SubscriptionRepository repository,
                               RelayProperties relayProperties,
                               Clock clock) {
        this.hubClient = hubClient;
        this.repository = repository;
        this.relayProperties = relayProperties;
        this.clock = clock;
    }

    public void subscribe(String topicUrl) {
        subscribe(topicUrl, defaultCallbackUrl);
    }

    public void subscribe(String topicUrl, String callbackUrl) {
        if (callbackUrl == null || callbackUrl.isBlank()) {
            throw new SubscriptionException("No callback URL configured (relay.websub.callback-url)", 0, false);
        }
        LocalDateTime now = LocalDateTime.now(clock);
        SubscriptionEntity subscription = repository.findByTopicUrl(topicUrl)
                .orElseGet(() -> new SubscriptionEntity(topicUrl, callbackUrl, newSecret(), leaseSeconds, now));
        if (subscription.getSecret() == null) {
            subscription.setSecret(newSecret());
        }
        subscription.setCallbackUrl(callbackUrl);
        subscription.setLeaseSeconds(leaseSeconds);
        subscription.setRequestedAt(now);
        if (subscription.getStatus() != SubscriptionEntity.Status.ACTIVE) {
            subscription.setStatus(SubscriptionEntity.Status.PENDING);
        }
        // Stored before the hub call: async verification may arrive before the response does.
        repository.save(subscription);

        hubClient.send("subscribe", topicUrl, callbackUrl, subscription.getSecret(), leaseSeconds);
        log.info("Subscription requested for {} (callback {})", topicUrl, callbackUrl);
    }

    public void unsubscribe(String topicUrl) {
        unsubscribe(topicUrl, defaultCallbackUrl);
    }

    /**
     * Asks the hub to stop pushing {@code topicUrl}. Only a topic marked here as
     * unsubscribing will accept the hub's unsubscribe verification.
     */
    public void unsubscribe(String topicUrl, String callbackUrl) {
        if (callbackUrl == null || callbackUrl.isBlank()) {
            throw new SubscriptionException("No callback URL configured (relay.websub.callback-url)", 0, false);
        }
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<SubscriptionEntity> stored = repository.findByTopicUrl(topicUrl);
        SubscriptionEntity subscription = stored.orElseGet(
                () -> new SubscriptionEntity(topicUrl, callbackUrl, null, 0, now));
        SubscriptionEntity.Status previous = subscription.getStatus();
        subscription.setStatus(SubscriptionEntity.Status.UNSUBSCRIBING);
        subscription.setRequestedAt(now);
        repository.save(subscription);

        try {
            hubClient.send("unsubscribe", topicUrl, callbackUrl, null, 0);
        } catch (SubscriptionException e) {
            if (stored.isPresent()) {
                subscription.setStatus(previous);
                repository.save(subscription);
            } else {
                repository.delete(subscription);
            }
            throw e;
        }
        log.info("Unsubscribe requested for {}", topicUrl);
    }

    /**
     * Answers a hub verification request.
     *
     * @return the challenge to echo, or empty when the request must be refused
     */
    public Optional<String> verifyChallenge(String mode, String topic, String challenge, Long grantedLeaseSeconds) {
        if (challenge == null || challenge.isBlank()) {
            return Optional.empty();
        }
        boolean subscribing = "subscribe".equals(mode);
        if (!subscribing && !"unsubscribe".equals(mode)) {
            log.warn("Refusing verification with unsupported mode '{}'", mode);
            return Optional.empty();
        }
        if (topic == null || topic.isBlank()) {
            log.info("Verified {} without topic", mode);
            return Optional.of(challenge);
        }

        Optional<SubscriptionEntity> stored = repository.findByTopicUrl(topic);
        if (stored.isEmpty() && !relayProperties.getFeeds().contains(topic)) {
            log.warn("Refusing {} verification for unknown topic {}", mode, topic);
            return Optional.empty();
        }

        if (!subscribing && stored.map(SubscriptionEntity::getStatus).orElse(null) != SubscriptionEntity.Status.UNSUBSCRIBING) {
            log.warn("Refusing unsubscribe verification for {}: no unsubscribe was requested", topic);
            return Optional.empty();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        SubscriptionEntity subscription = stored.orElseGet(
                () -> new SubscriptionEntity(topic, defaultCallbackUrl, null, leaseSeconds, now));
        if (subscribing) {
            long lease = grantedLeaseSeconds != null && grantedLeaseSeconds > 0 ? grantedLeaseSeconds : subscription.getLeaseSeconds();
            subscription.setStatus(SubscriptionEntity.Status.ACTIVE);
            subscription.setLeaseSeconds(lease);
            subscription.setVerifiedAt(now);
            subscription.setExpiresAt(now.plusSeconds(lease));
            log.info("Subscription to {} verified, lease {}s", topic, lease);
        } else {
            subscription.setStatus(SubscriptionEntity.Status.UNSUBSCRIBED);
            subscription.setVerifiedAt(now);
            subscription.setExpiresAt(null);
            log.info("Unsubscription from {} verified", topic);
        }
        repository.save(subscription);
        return Optional.of(challenge);
    }

    @Scheduled(fixedDelayString = "${relay.websub.renew-check-interval-ms:600000}",
               initialDelayString = "${relay.websub.renew-check-interval-ms:600000}")
    public void scheduledRenewal() {
        renewExpiring();
    }

    /**
     * Re-subscribes every active subscription whose lease ends within the renewal window.
     *
     * @return number of renewals the hub accepted
     */
    public int renewExpiring() {
        LocalDateTime cutoff = LocalDateTime.now(clock).plus(renewBefore);
        List<SubscriptionEntity> expiring = repository.findByStatusAndExpiresAtLessThanEqual(
                SubscriptionEntity.Status.ACTIVE, cutoff);
        int renewed = 0;
        for (SubscriptionEntity subscription : expiring) {
            try {
                subscribe(subscription.getTopicUrl(), subscription.getCallbackUrl());
                renewed++;
            } catch (SubscriptionException e) {
                log.error("Failed to renew subscription for {}: {}", subscription.getTopicUrl(), e.getMessage());
            }
        }
        if (!expiring.isEmpty()) {
            log.info("Renewed {}/{} expiring subscription(s)", renewed, expiring.size());
        }
        return renewed;
    }

    public Optional<String> secretFor(String topicUrl) {
        return repository.findByTopicUrl(topicUrl).map(SubscriptionEntity::getSecret);
    }

    /** Secrets of every subscription not yet unsubscribed. */
    public List<String> knownSecrets() {
        return repository.findByStatusNot(SubscriptionEntity.Status.UNSUBSCRIBED).stream()
                .map(SubscriptionEntity::getSecret)
                .filter(secret -> secret != null && !secret.isBlank())
                .toList();
    }

    private static String newSecret() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return DigestUtils.toHex(bytes);
    }
}
