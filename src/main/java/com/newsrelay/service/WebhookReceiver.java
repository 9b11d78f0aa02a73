package com.newsrelay.service;

import com.newsrelay.model.DeliveryReceipt;
import com.newsrelay.model.DeliveryReceipt.DeliveryOutcome;
import com.newsrelay.model.Item;
import com.newsrelay.model.ParsedFeed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles one hub delivery: authenticate, parse, claim, hand off.
 * Returns once every claim is written; rewriting and posting continue on the relay executor.
 */
@Service
@Slf4j
public class WebhookReceiver {

    private final WebhookSignatureVerifier signatureVerifier;
    private final FeedParser feedParser;
    private final DedupStore dedupStore;
    private final RelayPipeline relayPipeline;

    public WebhookReceiver(WebhookSignatureVerifier signatureVerifier,
                           FeedParser feedParser,
                           DedupStore dedupStore,
                           RelayPipeline relayPipeline) {
        this.signatureVerifier = signatureVerifier;
        this.feedParser = feedParser;
        this.dedupStore = dedupStore;
        this.relayPipeline = relayPipeline;
    }

    public DeliveryReceipt receive(byte[] body, String signatureHeader, String linkHeader) {
        signatureVerifier.verify(body, signatureHeader, linkHeader);
        String topic = WebhookSignatureVerifier.topicFromLink(linkHeader).orElse(null);
        return ingest(feedParser.parse(body, topic));
    }

    /**
     * Claims every new item of an already trusted feed and dispatches the winners.
     */
    public DeliveryReceipt ingest(ParsedFeed feed) {
        List<Item> items = feed.items();
        List<Item> claimed = new ArrayList<>();
        int duplicates = 0;
        try {
            for (Item item : items) {
                if (dedupStore.claim(item)) {
                    claimed.add(item);
                } else {
                    duplicates++;
                    log.debug("Skipping already seen item {}", item.id());
                }
            }
        } catch (RuntimeException e) {
            log.error("Claiming failed after {} item(s), releasing them for redelivery", claimed.size());
            releaseAll(claimed);
            throw e;
        }

        DeliveryOutcome outcome;
        if (!claimed.isEmpty()) {
            outcome = DeliveryOutcome.ACCEPTED;
            dispatch(claimed);
        } else if (duplicates > 0) {
            outcome = DeliveryOutcome.DUPLICATE;
        } else {
            outcome = DeliveryOutcome.EMPTY;
        }

        DeliveryReceipt receipt = new DeliveryReceipt(outcome, claimed.size(), duplicates, feed.skippedCount());
        log.info("Delivery ({}{}): {}", feed.format(), feed.recovered() ? ", recovered" : "", receipt.summary());
        return receipt;
    }

    private void dispatch(List<Item> claimed) {
        try {
            relayPipeline.dispatch(List.copyOf(claimed));
        } catch (TaskRejectedException e) {
            log.error("Relay executor saturated, releasing {} claimed item(s) for redelivery", claimed.size());
            releaseAll(claimed);
            throw e;
        }
    }

    private void releaseAll(List<Item> claimed) {
        claimed.forEach(item -> dedupStore.release(item.id()));
    }
}
