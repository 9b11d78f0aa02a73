package com.newsrelay.model;

/**
 * What the webhook did with one hub delivery.
 */
public record DeliveryReceipt(
    DeliveryOutcome outcome,
    int accepted,
    int duplicates,
    int skipped
) {
    public enum DeliveryOutcome {
        /** At least one item was claimed and dispatched to the pipeline. */
        ACCEPTED,
        /** Every parsed item was already seen. */
        DUPLICATE,
        /** The document parsed but held no usable entries. */
        EMPTY
    }

    public String summary() {
        return "%s accepted=%d duplicates=%d skipped=%d".formatted(outcome, accepted, duplicates, skipped);
    }
}
