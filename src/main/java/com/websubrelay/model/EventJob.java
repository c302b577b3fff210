package com.websubrelay.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/**
 * Unit of work on the event queue. Its identity is {@link #itemId}, which is
 * also the enqueue deduplication key.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class EventJob {

    private String itemId;
    private String sourceId;
    private String title;
    private Instant publishedAt;
    private Instant receivedAt;

    /**
     * Checks the required fields and coerces the optional ones, so that only
     * well-formed jobs enter or leave the queue.
     *
     * @return this job
     * @throws IllegalArgumentException if an identity field or the receive time is missing
     */
    public EventJob validate() {
        if (itemId == null || itemId.isBlank()) {
            throw new IllegalArgumentException("itemId is required");
        }
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId is required for item " + itemId);
        }
        if (receivedAt == null) {
            throw new IllegalArgumentException("receivedAt is required for item " + itemId);
        }
        if (title == null) {
            title = "";
        }
        if (publishedAt == null) {
            publishedAt = receivedAt;
        }
        return this;
    }
}
