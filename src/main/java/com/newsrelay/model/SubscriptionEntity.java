package com.newsrelay.model;

import jakarta.persistence.*;
import java.time.LocalDateTime;

@Entity
@Table(name = "subscriptions", indexes = {
    @Index(name = "idx_subscription_topic", columnList = "topicUrl", unique = true),
    @Index(name = "idx_subscription_expires_at", columnList = "expiresAt")
})
public class SubscriptionEntity {

    public enum Status { PENDING, ACTIVE, UNSUBSCRIBING, UNSUBSCRIBED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 1024)
    private String topicUrl;

    @Column(nullable = false, length = 1024)
    private String callbackUrl;

    @Column(length = 128)
    private String secret;   // HMAC key the hub signs deliveries for this topic with

    @Column(nullable = false)
    private long leaseSeconds;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status;

    @Column(nullable = false)
    private LocalDateTime requestedAt;

    private LocalDateTime verifiedAt;

    private LocalDateTime expiresAt;

    public SubscriptionEntity() {
    }

    public SubscriptionEntity(String topicUrl, String callbackUrl, String secret, long leaseSeconds,
                              LocalDateTime requestedAt) {
        this.topicUrl = topicUrl;
        this.callbackUrl = callbackUrl;
        this.secret = secret;
        this.leaseSeconds = leaseSeconds;
        this.status = Status.PENDING;
        this.requestedAt = requestedAt;
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getTopicUrl() {
        return topicUrl;
    }

    public void setTopicUrl(String topicUrl) {
        this.topicUrl = topicUrl;
    }

    public String getCallbackUrl() {
        return callbackUrl;
    }

    public void setCallbackUrl(String callbackUrl) {
        this.callbackUrl = callbackUrl;
    }

    public String getSecret() {
        return secret;
    }

    public void setSecret(String secret) {
        this.secret = secret;
    }

    public long getLeaseSeconds() {
        return leaseSeconds;
    }

    public void setLeaseSeconds(long leaseSeconds) {
        this.leaseSeconds = leaseSeconds;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public LocalDateTime getRequestedAt() {
        return requestedAt;
    }

    public void setRequestedAt(LocalDateTime requestedAt) {
        this.requestedAt = requestedAt;
    }

    public LocalDateTime getVerifiedAt() {
        return verifiedAt;
    }

    public void setVerifiedAt(LocalDateTime verifiedAt) {
        this.verifiedAt = verifiedAt;
    }

    public LocalDateTime getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(LocalDateTime expiresAt) {
        this.expiresAt = expiresAt;
    }
}
