package com.websubrelay.service;

/**
 * Per-delivery counters reported by the webhook receiver.
 */
public record DeliverySummary(int entries, int enqueued, int duplicates, int skipped, int failed) {
}
