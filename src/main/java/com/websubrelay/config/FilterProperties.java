package com.websubrelay.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Business rules applied by the item pipeline. Thresholds are policy, so the
 * upper duration bound and the HD requirement are both optional.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app.filter")
public class FilterProperties {

    /** Lower-cased substring denylist matched against the announced title. */
    private List<String> keywords = new ArrayList<>(List.of(
            "#short", "shorts", "trailer", "clip", "reaction", "livestream", "live stream"));

    /** Exclusive lower bound on the video length. */
    private long minSeconds = 210;

    /** Exclusive upper bound; {@code null} disables the check. */
    private Long maxSeconds;

    /** When set, both the {@code hd} definition and a maxres thumbnail are required. */
    private boolean requireHd = false;

    /** TTL of the per-item processing guard in the cache. */
    private Duration guardTtl = Duration.ofSeconds(300);
}
