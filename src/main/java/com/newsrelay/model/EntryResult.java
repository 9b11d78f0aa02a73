package com.newsrelay.model;

/**
 * Outcome of parsing a single feed entry: either an {@link Item} or the reason it was skipped.
 */
public record EntryResult(Item item, String skipReason) {

    public static EntryResult parsed(Item item) {
        return new EntryResult(item, null);
    }

    public static EntryResult skipped(String reason) {
        return new EntryResult(null, reason);
    }

    public boolean isParsed() {
        return item != null;
    }
}
