package com.websubrelay.service;

public enum EnqueueResult {
    ENQUEUED,
    /** A job for the same item is already queued, running or parked. */
    DUPLICATE
}
