package com.newsrelay.model;

import com.newsrelay.util.DigestUtils;
import jakarta.persistence.*;
import java.time.LocalDateTime;

@Entity
@Table(name = "processed_items", indexes = {
    @Index(name = "idx_processed_item_id", columnList = "itemKey", unique = true),
    @Index(name = "idx_processed_expires_at", columnList = "expiresAt")
})
public class ProcessedItemEntity {

    public enum Status { CLAIMED, PUBLISHED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // sha256 of itemId; ids have no length bound
    @Column(nullable = false, unique = true, length = 64)
    private String itemKey;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String itemId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status;

    @Column(length = 1024)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String link;

    @Column(nullable = false)
    private LocalDateTime firstSeenAt;

    @Column(nullable = false)
    private LocalDateTime expiresAt;

    public ProcessedItemEntity() {
    }

    public ProcessedItemEntity(String itemId, Status status, String title, String link,
                               LocalDateTime firstSeenAt, LocalDateTime expiresAt) {
        this.itemKey = keyOf(itemId);
        this.itemId = itemId;
        this.status = status;
        this.title = title;
        this.link = link;
        this.firstSeenAt = firstSeenAt;
        this.expiresAt = expiresAt;
    }

    public static String keyOf(String itemId) {
        return DigestUtils.sha256Hex(itemId);
    }

    public boolean isLive(LocalDateTime now) {
        return expiresAt.isAfter(now);
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getItemKey() {
        return itemKey;
    }

    public String getItemId() {
        return itemId;
    }

    public void setItemId(String itemId) {
        this.itemKey = keyOf(itemId);
        this.itemId = itemId;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getLink() {
        return link;
    }

    public void setLink(String link) {
        this.link = link;
    }

    public LocalDateTime getFirstSeenAt() {
        return firstSeenAt;
    }

    public void setFirstSeenAt(LocalDateTime firstSeenAt) {
        this.firstSeenAt = firstSeenAt;
    }

    public LocalDateTime getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(LocalDateTime expiresAt) {
        this.expiresAt = expiresAt;
    }
}
