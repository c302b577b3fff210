package com.websubrelay.service;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived key/value store used for the per-item processing guard and for
 * metadata memoization.
 *
 * <p>Entries are never authoritative: losing one may cause redundant work but
 * must not change the outcome of processing. Implementations therefore favour
 * availability and report backend failures as a miss.
 */
public interface CacheStore {

    /**
     * Sets {@code key} to {@code token} only if it is absent.
     *
     * @return {@code true} if the caller now holds the key
     */
    boolean tryLock(String key, String token, Duration ttl);

    /**
     * Deletes {@code key} if it still holds {@code token}.
     */
    void unlock(String key, String token);

    Optional<String> get(String key);

    void put(String key, String value, Duration ttl);
}
