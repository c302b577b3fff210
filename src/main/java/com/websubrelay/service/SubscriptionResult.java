package com.websubrelay.service;

import java.time.Instant;

/**
 * Result of one {@link SubscriptionManager#subscribe(String)} call, including
 * its retries.
 *
 * @param status    last HTTP status from the hub, {@code null} after a network error
 * @param expiresAt lease end on success
 */
public record SubscriptionResult(String sourceId, boolean ok, Integer status, Instant expiresAt, String error) {

    public static SubscriptionResult success(String sourceId, int status, Instant expiresAt) {
        return new SubscriptionResult(sourceId, true, status, expiresAt, null);
    }

    public static SubscriptionResult failure(String sourceId, Integer status, String error) {
        return new SubscriptionResult(sourceId, false, status, null, error);
    }
}
