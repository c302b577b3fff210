package com.websubrelay.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

public class RedisCacheStore implements CacheStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisCacheStore.class);

    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then return redis.call('DEL', KEYS[1]) end " +
                    "return 0",
            Long.class
    );

    private final StringRedisTemplate redis;
    private final String keyPrefix;

    public RedisCacheStore(StringRedisTemplate redis, String keyPrefix) {
        this.redis = redis;
        this.keyPrefix = normalizePrefix(keyPrefix);
    }

    @Override
    public boolean tryLock(String key, String token, Duration ttl) {
        try {
            Boolean ok = redis.opsForValue().setIfAbsent(keyPrefix + key, token, ttl);
            return Boolean.TRUE.equals(ok);
        } catch (DataAccessException e) {
            // The guard is an optimization; without Redis the durable dedup still decides.
            logger.warn("Redis unavailable while acquiring {}; proceeding without guard: {}", key, e.getMessage());
            return true;
        }
    }

    @Override
    public void unlock(String key, String token) {
        try {
            redis.execute(RELEASE_SCRIPT, List.of(keyPrefix + key), token);
        } catch (DataAccessException e) {
            logger.warn("Redis unavailable while releasing {}; it will expire on its own: {}", key, e.getMessage());
        }
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redis.opsForValue().get(keyPrefix + key));
        } catch (DataAccessException e) {
            logger.warn("Redis read failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        try {
            redis.opsForValue().set(keyPrefix + key, value, ttl);
        } catch (DataAccessException e) {
            logger.warn("Redis write failed for {}: {}", key, e.getMessage());
        }
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) return "";
        String p = prefix.trim();
        return p.endsWith(":") ? p : (p + ":");
    }
}
