package com.websubrelay.model;

/**
 * The accepted item as it is announced to messaging targets.
 */
public record NotificationItem(String itemId, String sourceId, String title) {

    private static final String WATCH_URL = "https://youtu.be/";

    public String link() {
        return WATCH_URL + itemId;
    }
}
