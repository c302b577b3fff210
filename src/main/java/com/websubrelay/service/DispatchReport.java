package com.websubrelay.service;

import java.util.List;
import java.util.Map;

/**
 * Outcome of fanning one item out to its targets.
 *
 * @param delivered targets that accepted the message
 * @param failures  target id to error description
 */
public record DispatchReport(List<String> delivered, Map<String, String> failures) {

    public static DispatchReport empty() {
        return new DispatchReport(List.of(), Map.of());
    }

    public DispatchReport {
        delivered = List.copyOf(delivered);
        failures = Map.copyOf(failures);
    }

    public boolean isPartial() {
        return !delivered.isEmpty() && !failures.isEmpty();
    }
}
