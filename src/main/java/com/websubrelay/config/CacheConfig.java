package com.websubrelay.config;

import com.websubrelay.service.CacheStore;
import com.websubrelay.service.InMemoryCacheStore;
import com.websubrelay.service.RedisCacheStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Configuration
public class CacheConfig {

    @Bean
    @ConditionalOnProperty(prefix = "app.cache", name = "type", havingValue = "redis", matchIfMissing = true)
    public CacheStore redisCacheStore(StringRedisTemplate redisTemplate,
                                      @Value("${app.cache.key-prefix:websub-relay}") String keyPrefix) {
        return new RedisCacheStore(redisTemplate, keyPrefix);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.cache", name = "type", havingValue = "memory")
    public CacheStore inMemoryCacheStore(Clock clock,
                                         @Value("${app.cache.max-entries:10000}") long maxEntries) {
        return new InMemoryCacheStore(clock, maxEntries);
    }
}
