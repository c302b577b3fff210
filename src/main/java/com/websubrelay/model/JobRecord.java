package com.websubrelay.model;

import java.time.Instant;

/**
 * Row of the {@code queue_jobs} ledger that backs the event queue.
 */
public record JobRecord(
        String itemId,
        String sourceId,
        String payload,
        JobStatus status,
        int attempts,
        int stallCount,
        Instant lockedUntil,
        String lastError,
        Instant createdAt,
        Instant updatedAt,
        Instant failedAt
) {
}
