package com.websubrelay.model;

public enum JobStatus {
    QUEUED,
    ACTIVE,
    FAILED
}
