package com.websubrelay.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "app.queue")
public class JobQueueProperties {

    // SQS caps visibility timeouts at 12 hours.
    private static final Duration MAX_VISIBILITY = Duration.ofHours(12);

    private String url;

    /** FIFO queues get a group id per source and the item id as deduplication id. */
    private boolean fifo = false;

    private boolean listenerEnabled = true;

    private int concurrency = 5;

    private int waitTimeSeconds = 20;

    /** How long a claimed job stays locked without a heartbeat. */
    private Duration lockDuration = Duration.ofSeconds(60);

    private int maxStalledCount = 2;

    private int maxAttempts = 3;

    private Duration backoffBase = Duration.ofSeconds(2);

    private Duration backoffMax = Duration.ofMinutes(15);

    /** attempts=1 => base, attempts=2 => 2*base, ... */
    public Duration backoff(int attempts) {
        long baseMs = Math.max(1, backoffBase.toMillis());
        int pow = Math.max(0, attempts - 1);
        long ms = baseMs * (1L << Math.min(30, pow));
        long capMs = Math.min(backoffMax.toMillis(), MAX_VISIBILITY.toMillis());
        return Duration.ofMillis(Math.min(ms, capMs));
    }

    public int lockSeconds() {
        return (int) Math.max(1, Math.min(lockDuration.toSeconds(), MAX_VISIBILITY.toSeconds()));
    }
}
