package com.websubrelay.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SubscriptionStatus {
    PENDING("pending"),
    ACTIVE("active"),
    EXPIRING("expiring"),
    EXPIRED("expired"),
    FAILED("failed");

    private final String value;

    SubscriptionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static SubscriptionStatus fromValue(String value) {
        for (SubscriptionStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown subscription status: " + value);
    }
}
