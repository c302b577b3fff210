package com.websubrelay.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * An item that passed every filter. Written once through an insert that
 * ignores conflicts on {@code item_id}, never updated afterwards.
 */
@Getter
@Setter
@Entity
@Table(name = "items")
public class ProcessedItem {

    @Id
    @Column(name = "item_id", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String itemId;

    @Column(name = "source_id", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String sourceId;

    @Column(name = "title", columnDefinition = "TEXT")
    private String title;

    @Column(name = "published_at", updatable = false)
    private Instant publishedAt;

    @Column(name = "received_at", updatable = false)
    private Instant receivedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
