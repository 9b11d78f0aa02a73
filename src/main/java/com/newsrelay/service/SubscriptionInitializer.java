package com.newsrelay.service;

import com.newsrelay.config.RelayProperties;
import com.newsrelay.exception.SubscriptionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Subscribes every configured feed at startup when {@code relay.websub.subscribe-on-startup} is set.
 */
@Component
@ConditionalOnProperty(name = "relay.websub.subscribe-on-startup", havingValue = "true")
@Slf4j
public class SubscriptionInitializer implements ApplicationRunner {

    private final SubscriptionService subscriptionService;
    private final RelayProperties relayProperties;

    public SubscriptionInitializer(SubscriptionService subscriptionService, RelayProperties relayProperties) {
        this.subscriptionService = subscriptionService;
        this.relayProperties = relayProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        int succeeded = 0;
        int failed = 0;
        for (String feed : relayProperties.getFeeds()) {
            try {
                subscriptionService.subscribe(feed);
                succeeded++;
            } catch (SubscriptionException e) {
                failed++;
                log.error("Failed to subscribe to {}: {}", feed, e.getMessage());
            }
        }
        log.info("Startup subscription finished: {} succeeded, {} failed", succeeded, failed);
    }
}
