package com.newsrelay.service;

import com.newsrelay.client.RephraseClient;
import com.newsrelay.config.RelayProperties;
import com.newsrelay.exception.RephraseException;
import com.newsrelay.model.Destination;
import com.newsrelay.model.Item;
import com.newsrelay.model.PublishResult;
import com.newsrelay.model.RephrasedContent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Rewrite, fan out, commit. Runs on the relay executor for items that were
 * already claimed in the {@link DedupStore}.
 */
@Service
@Slf4j
public class RelayPipeline {

    public enum Outcome { PUBLISHED, REWRITE_FAILED, FAILED, CLAIM_LOST }

    private final RephraseClient rephraseClient;
    private final PublisherFanout publisherFanout;
    private final DedupStore dedupStore;
    private final List<Destination> destinations;

    @Value("${relay.process-delay:0s}")
    private Duration processDelay;

    public RelayPipeline(RephraseClient rephraseClient,
                         PublisherFanout publisherFanout,
                         DedupStore dedupStore,
                         RelayProperties relayProperties) {
        this.rephraseClient = rephraseClient;
        this.publisherFanout = publisherFanout;
        this.dedupStore = dedupStore;
        this.destinations = relayProperties.toDestinations();
        log.info("Loaded {} destination(s): {}", destinations.size(), destinations);
    }

    @Async("relayExecutor")
    public void dispatch(List<Item> claimedItems) {
        for (int i = 0; i < claimedItems.size(); i++) {
            if (i > 0 && processDelay != null && !processDelay.isZero()) {
                try {
                    Thread.sleep(processDelay.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted, releasing {} unprocessed item(s)", claimedItems.size() - i);
                    claimedItems.subList(i, claimedItems.size()).forEach(item -> dedupStore.release(item.id()));
                    return;
                }
            }
            process(claimedItems.get(i));
        }
    }

    public Outcome process(Item item) {
        // The item may have waited in the executor queue for longer than one claim lease.
        if (!dedupStore.renewClaim(item)) {
            log.warn("Item {} is published or claimed elsewhere, skipping", item.id());
            return Outcome.CLAIM_LOST;
        }
        RephrasedContent content;
        try {
            content = rephraseClient.rewrite(item);
        } catch (RephraseException e) {
            log.warn("Could not rewrite item {} ({}), leaving it for redelivery: {}", item.id(), item.title(), e.getMessage());
            dedupStore.release(item.id());
            return Outcome.REWRITE_FAILED;
        } catch (RuntimeException e) {
            log.error("Unexpected error rewriting item {}", item.id(), e);
            dedupStore.release(item.id());
            return Outcome.FAILED;
        }

        List<PublishResult> results = publisherFanout.publish(content, item, destinations);
        for (PublishResult result : results) {
            if (!result.success()) {
                log.warn("Item {} not published to {}: {}", item.id(), result.destination().label(), result.errorDetail());
            }
        }
        dedupStore.commit(item.id());
        return Outcome.PUBLISHED;
    }

    public List<Destination> getDestinations() {
        return destinations;
    }
}
