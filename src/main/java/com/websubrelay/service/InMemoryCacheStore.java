package com.websubrelay.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-process cache backed by Caffeine. Suitable for tests and for running
 * one instance without Redis. Each entry expires after its own TTL and the
 * cache is bounded in size.
 */
public class InMemoryCacheStore implements CacheStore {

    public static final long DEFAULT_MAX_ENTRIES = 10_000;

    private record Entry(String value, Duration ttl) {
    }

    private static final Expiry<String, Entry> PER_ENTRY_TTL = new Expiry<>() {
        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    };

    private final Cache<String, Entry> cache;

    public InMemoryCacheStore(Clock clock) {
        this(clock, DEFAULT_MAX_ENTRIES);
    }

    public InMemoryCacheStore(Clock clock, long maxEntries) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(PER_ENTRY_TTL)
                .ticker(clockTicker(clock))
                .executor(Runnable::run)
                .build();
    }

    @Override
    public boolean tryLock(String key, String token, Duration ttl) {
        AtomicBoolean acquired = new AtomicBoolean(false);
        cache.asMap().computeIfAbsent(key, k -> {
            acquired.set(true);
            return new Entry(token, ttl);
        });
        return acquired.get();
    }

    @Override
    public void unlock(String key, String token) {
        cache.asMap().computeIfPresent(key, (k, current) -> current.value().equals(token) ? null : current);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key)).map(Entry::value);
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        cache.put(key, new Entry(value, ttl));
    }

    long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static Ticker clockTicker(Clock clock) {
        return () -> {
            Instant now = clock.instant();
            return now.getEpochSecond() * 1_000_000_000L + now.getNano();
        };
    }
}
