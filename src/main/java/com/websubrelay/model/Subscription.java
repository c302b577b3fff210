package com.websubrelay.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Hub subscription state for one source. Rows are created on the first
 * subscribe attempt and only ever updated afterwards; dashboards read them
 * to show subscription health.
 */
@Getter
@Setter
@Entity
@Table(name = "subscriptions")
public class Subscription {

    @Id
    @Column(name = "source_id", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String sourceId;

    @Column(name = "topic", nullable = false, columnDefinition = "TEXT")
    private String topic;

    @Column(name = "status", nullable = false, columnDefinition = "TEXT")
    private SubscriptionStatus status;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "last_renewed_at")
    private Instant lastRenewedAt;

    @Column(name = "renewal_attempts", nullable = false)
    private int renewalAttempts;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
