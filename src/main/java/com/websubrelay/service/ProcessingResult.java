package com.websubrelay.service;

/**
 * Terminal outcome of one pass of the item pipeline.
 */
public record ProcessingResult(Outcome outcome, String reason, int delivered, int failedTargets) {

    public enum Outcome {
        DUPLICATE,
        FILTERED,
        ACCEPTED,
        ACCEPTED_NO_RECIPIENTS
    }

    public static ProcessingResult duplicate(String reason) {
        return new ProcessingResult(Outcome.DUPLICATE, reason, 0, 0);
    }

    public static ProcessingResult filtered(String reason) {
        return new ProcessingResult(Outcome.FILTERED, reason, 0, 0);
    }

    public static ProcessingResult acceptedWithoutRecipients() {
        return new ProcessingResult(Outcome.ACCEPTED_NO_RECIPIENTS, "no interested accounts", 0, 0);
    }

    public static ProcessingResult accepted(DispatchReport report) {
        return new ProcessingResult(Outcome.ACCEPTED, "dispatched",
                report.delivered().size(), report.failures().size());
    }
}
