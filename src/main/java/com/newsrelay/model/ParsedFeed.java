package com.newsrelay.model;

import java.util.List;

public record ParsedFeed(
    FeedFormat format,
    boolean recovered,
    List<EntryResult> entries
) {
    public enum FeedFormat { RSS, ATOM, RDF }

    public ParsedFeed {
        entries = List.copyOf(entries);
    }

    /** Successfully parsed items, in document order. */
    public List<Item> items() {
        return entries.stream()
                .filter(EntryResult::isParsed)
                .map(EntryResult::item)
                .toList();
    }

    public int skippedCount() {
        return (int) entries.stream().filter(e -> !e.isParsed()).count();
    }
}
