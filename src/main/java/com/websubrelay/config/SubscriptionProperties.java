package com.websubrelay.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "app.subscription")
public class SubscriptionProperties {

    private String hubUrl = "https://pubsubhubbub.appspot.com/subscribe";

    /** Public base URL of this service; the hub calls back {@code <publicUrl>/webhook}. */
    private String publicUrl;

    private String topicTemplate = "https://www.youtube.com/xml/feeds/videos.xml?channel_id=%s";

    /** Lease the hub grants on a successful subscribe. */
    private Duration lease = Duration.ofDays(18);

    /** Delay before each retry; its size is the retry bound. */
    private List<Duration> retryDelays = new ArrayList<>(List.of(
            Duration.ofSeconds(1), Duration.ofSeconds(5), Duration.ofSeconds(15)));

    private Duration renewalLookahead = Duration.ofHours(48);

    private Duration renewalInterCallDelay = Duration.ofSeconds(1);

    public String topicFor(String sourceId) {
        return String.format(topicTemplate, sourceId);
    }

    public String callbackUrl() {
        String base = publicUrl == null ? "" : publicUrl.trim();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/webhook";
    }
}
