package com.websubrelay.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every send for an item failed. Propagates to the queue so that the whole
 * job is retried.
 */
public class AllTargetsFailedException extends RuntimeException {

    private final String itemId;
    private final Map<String, String> failures;

    public AllTargetsFailedException(String itemId, Map<String, String> failures) {
        super("Failed to send item " + itemId + " to all " + failures.size() + " targets: "
                + failures.values().stream().findFirst().orElse("no targets"));
        this.itemId = itemId;
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public String getItemId() {
        return itemId;
    }

    /** Target id to error description. */
    public Map<String, String> getFailures() {
        return failures;
    }
}
