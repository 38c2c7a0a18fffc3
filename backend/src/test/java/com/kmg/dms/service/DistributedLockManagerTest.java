package com.kmg.dms.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class DistributedLockManagerTest {
    private static final Instant START = Instant.parse("2025-01-01T08:00:00Z");
    private static final Duration TTL = Duration.ofSeconds(60);

    @Mock
    private StringRedisTemplate redis;
    @Mock
    private ValueOperations<String, String> valueOps;
    @Mock
    private HashOperations<String, Object, Object> hashOps;

    private final Map<String, String> values = new ConcurrentHashMap<>();
    private final Map<String, Map<Object, Object>> hashes = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() {
        lenient().when(redis.opsForValue()).thenReturn(valueOps);
        lenient().when(redis.<Object, Object>opsForHash()).thenReturn(hashOps);

        lenient().when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class)))
                .thenAnswer(call -> values.putIfAbsent(call.getArgument(0), call.getArgument(1)) == null);
        lenient().when(hashOps.entries(anyString()))
                .thenAnswer(call -> new HashMap<>(hashes.getOrDefault(call.getArgument(0), Map.of())));
        lenient().doAnswer(call -> {
            hashes.computeIfAbsent(call.getArgument(0), key -> new ConcurrentHashMap<>())
                    .putAll(call.getArgument(1));
            return null;
        }).when(hashOps).putAll(anyString(), anyMap());
        lenient().when(redis.hasKey(anyString())).thenAnswer(call -> values.containsKey(call.<String>getArgument(0)));
        lenient().when(redis.expire(anyString(), any(Duration.class))).thenReturn(true);
        lenient().when(redis.delete(anyString())).thenAnswer(call -> remove(List.of(call.<String>getArgument(0))) > 0);
        lenient().when(redis.delete(anyCollection())).thenAnswer(call -> remove(call.getArgument(0)));
        lenient().when(redis.execute(any(RedisScript.class), anyList(), any())).thenAnswer(call -> {
            List<String> keys = call.getArgument(1);
            String token = call.getArgument(2);
            return values.remove(keys.get(0), token) ? 1L : 0L;
        });
    }

    @Test
    void secondAcquireFailsWhileLockIsHeld() {
        DistributedLockManager manager = manager(START);

        Optional<DistributedLockManager.LockHandle> first = manager.tryAcquire("scanner", TTL);
        Optional<DistributedLockManager.LockHandle> second = manager.tryAcquire("scanner", TTL);

        assertThat(first).isPresent();
        assertThat(first.get().degraded()).isFalse();
        assertThat(second).isEmpty();
        assertThat(hashes.get("dms:lock:scanner:meta")).containsKeys("hostname", "start_time", "ttl", "token");
    }

    @Test
    void releaseAllowsNextOwner() {
        DistributedLockManager manager = manager(START);

        manager.tryAcquire("scanner", TTL).orElseThrow().close();

        assertThat(values).doesNotContainKey("dms:lock:scanner");
        assertThat(manager.tryAcquire("scanner", TTL)).isPresent();
    }

    @Test
    void concurrentAcquireHasExactlyOneWinner() throws Exception {
        DistributedLockManager manager = manager(START);
        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return manager.tryAcquire("scanner", TTL).isPresent();
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void staleLockIsClearedAfterOneAndAHalfTtl() {
        manager(START).tryAcquire("scanner", TTL).orElseThrow();

        assertThat(manager(START.plusSeconds(89)).tryAcquire("scanner", TTL)).isEmpty();

        Optional<DistributedLockManager.LockHandle> takeover = manager(START.plusSeconds(91)).tryAcquire("scanner", TTL);
        assertThat(takeover).isPresent();
        assertThat(values.get("dms:lock:scanner")).isEqualTo(takeover.get().token());
    }

    @Test
    void releaseDoesNotRemoveLockOwnedByAnotherToken() {
        DistributedLockManager.LockHandle stale = manager(START).tryAcquire("scanner", TTL).orElseThrow();
        DistributedLockManager.LockHandle current =
                manager(START.plusSeconds(120)).tryAcquire("scanner", TTL).orElseThrow();

        stale.close();

        assertThat(values.get("dms:lock:scanner")).isEqualTo(current.token());
    }

    @Test
    void backendOutageFailsOpen() {
        lenient().doThrow(new RedisConnectionFailureException("down")).when(hashOps).entries(anyString());
        lenient().doThrow(new RedisConnectionFailureException("down"))
                .when(valueOps).setIfAbsent(anyString(), anyString(), any(Duration.class));
        DistributedLockManager manager = manager(START);

        Optional<DistributedLockManager.LockHandle> first = manager.tryAcquire("scanner", TTL);
        Optional<DistributedLockManager.LockHandle> second = manager.tryAcquire("scanner", TTL);

        assertThat(first).isPresent();
        assertThat(second).isPresent();
        assertThat(first.get().degraded()).isTrue();
        assertThat(second.get().degraded()).isTrue();
        first.get().close();
    }

    @Test
    void metadataFailureAfterAcquireStillReleasesLock() {
        lenient().doThrow(new RedisConnectionFailureException("down")).when(hashOps).putAll(anyString(), anyMap());
        DistributedLockManager manager = manager(START);

        DistributedLockManager.LockHandle first = manager.tryAcquire("scanner", TTL).orElseThrow();
        assertThat(first.degraded()).isFalse();
        assertThat(values.get("dms:lock:scanner")).isEqualTo(first.token());

        first.close();

        assertThat(values).doesNotContainKey("dms:lock:scanner");
        assertThat(manager.tryAcquire("scanner", TTL)).isPresent();
    }

    @Test
    void withLockSkipsActionWhenHeld() {
        DistributedLockManager manager = manager(START);
        manager.tryAcquire("scanner", TTL).orElseThrow();
        List<String> calls = new ArrayList<>();

        boolean ran = manager.withLock("scanner", TTL, () -> calls.add("run"));

        assertThat(ran).isFalse();
        assertThat(calls).isEmpty();
    }

    private DistributedLockManager manager(Instant now) {
        return new DistributedLockManager(redis, Clock.fixed(now, ZoneOffset.UTC));
    }

    private long remove(Collection<String> keys) {
        long removed = 0;
        for (String key : keys) {
            if (values.remove(key) != null) {
                removed++;
            }
            if (hashes.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }
}
