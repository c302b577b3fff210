package com.websubrelay.service;

/**
 * Fields extracted from one {@code <entry>} of a delivered feed. Any field
 * may be {@code null}; timestamps are kept as delivered.
 */
public record FeedEntry(String itemId, String sourceId, String title, String published, String updated) {

    public boolean hasIdentity() {
        return itemId != null && !itemId.isBlank() && sourceId != null && !sourceId.isBlank();
    }
}
