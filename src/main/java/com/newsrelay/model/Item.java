package com.newsrelay.model;

import java.time.Instant;

/**
 * A normalized feed entry. {@code id} is derived from the entry's own bytes, so
 * parsing the same payload twice yields the same id.
 */
public record Item(
    String id,
    String title,
    String link,
    String summary,
    Instant publishedAt,
    String imageUrl,
    String source
) {
    public Item {
        title = title != null ? title : "";
        summary = summary != null ? summary : "";
    }

    public Item withSource(String source) {
        return new Item(id, title, link, summary, publishedAt, imageUrl, source);
    }

    public boolean hasLink() {
        return link != null && !link.isBlank();
    }

    public boolean hasImage() {
        return imageUrl != null && !imageUrl.isBlank();
    }
}
