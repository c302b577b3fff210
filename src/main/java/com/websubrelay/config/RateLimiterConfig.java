package com.websubrelay.config;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimiterConfig {

    @Value("${app.ratelimit.youtubeQps:5.0}")
    private double youtubeRateLimit;
    @Value("${app.ratelimit.telegramQps:25.0}")
    private double telegramRateLimit;

    @Bean("youtubeRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter youtubeRateLimiter() {
        return createOptionalLimiter(youtubeRateLimit);
    }

    @Bean("telegramRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter telegramRateLimiter() {
        return createOptionalLimiter(telegramRateLimit);
    }

    private RateLimiter createOptionalLimiter(double qps) {
        double effectiveQps = qps > 0 ? qps : Double.MAX_VALUE;
        return RateLimiter.create(effectiveQps);
    }
}
