package com.websubrelay.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisCacheStoreTest {

    private static final Duration TTL = Duration.ofSeconds(300);

    @Mock
    private StringRedisTemplate redis;

    @Mock
    private ValueOperations<String, String> valueOps;

    private RedisCacheStore store;

    @BeforeEach
    void setUp() {
        store = new RedisCacheStore(redis, "websub-relay");
    }

    @Test
    void lockIsTakenWithSetIfAbsentUnderThePrefixedKey() {
        when(redis.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent("websub-relay:proc:v1", "tok", TTL)).thenReturn(true, false);

        assertThat(store.tryLock("proc:v1", "tok", TTL)).isTrue();
        assertThat(store.tryLock("proc:v1", "tok", TTL)).isFalse();
    }

    @Test
    void unlockRunsTheCompareAndDeleteScriptWithTheOwnerToken() {
        store.unlock("proc:v1", "tok");

        verify(redis).execute(any(RedisScript.class), eq(List.of("websub-relay:proc:v1")), eq("tok"));
    }

    @Test
    void lockIsGrantedWhenRedisIsDown() {
        when(redis.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent("websub-relay:proc:v1", "tok", TTL))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThat(store.tryLock("proc:v1", "tok", TTL)).isTrue();
    }

    @Test
    void readsMissAndWritesAreDroppedWhenRedisIsDown() {
        when(redis.opsForValue()).thenReturn(valueOps);
        when(valueOps.get("websub-relay:video:v1:false"))
                .thenThrow(new RedisConnectionFailureException("connection refused"));
        doThrow(new RedisConnectionFailureException("connection refused"))
                .when(valueOps).set("websub-relay:video:v1:false", "{}", Duration.ofHours(1));

        assertThat(store.get("video:v1:false")).isEmpty();
        assertThatCode(() -> store.put("video:v1:false", "{}", Duration.ofHours(1))).doesNotThrowAnyException();
    }

    @Test
    void unlockIgnoresRedisFailures() {
        doThrow(new RedisConnectionFailureException("connection refused"))
                .when(redis).execute(any(RedisScript.class), eq(List.of("websub-relay:proc:v1")), eq("tok"));

        assertThatCode(() -> store.unlock("proc:v1", "tok")).doesNotThrowAnyException();
    }

    @Test
    void prefixAlreadyEndingWithColonIsKept() {
        RedisCacheStore prefixed = new RedisCacheStore(redis, "relay:");
        when(redis.opsForValue()).thenReturn(valueOps);
        when(valueOps.get("relay:video:v1:false")).thenReturn("{}");

        assertThat(prefixed.get("video:v1:false")).contains("{}");
    }
}
