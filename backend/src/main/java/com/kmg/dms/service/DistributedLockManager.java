package com.kmg.dms.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis backed mutex for whole ingestion runs.
 * <p>
 * The lock key holds a per-attempt random token and expires after the TTL. A companion hash
 * ({@code <key>:meta}) records owner host, start time and TTL so that a lock older than 1.5x its TTL can be
 * recognised as orphaned and cleared. If Redis cannot be reached the lock fails open.
 */
@Service
public class DistributedLockManager {
    private static final Logger log = LoggerFactory.getLogger(DistributedLockManager.class);

    static final String KEY_PREFIX = "dms:lock:";
    static final double STALE_FACTOR = 1.5;

    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            """
            if redis.call('get', KEYS[1]) == ARGV[1] then
                return redis.call('del', KEYS[1])
            else
                return 0
            end
            """,
            Long.class
    );

    private final StringRedisTemplate redis;
    private final Clock clock;
    private final String hostname;

    public DistributedLockManager(StringRedisTemplate redis, Clock clock) {
        this.redis = redis;
        this.clock = clock;
        this.hostname = resolveHostname();
    }

    /**
     * Runs {@code action} while holding the named lock. Returns false without running it when another owner
     * holds the lock.
     */
    public boolean withLock(String name, Duration ttl, Runnable action) {
        Optional<LockHandle> handle = tryAcquire(name, ttl);
        if (handle.isEmpty()) {
            return false;
        }
        try (LockHandle ignored = handle.get()) {
            action.run();
        }
        return true;
    }

    public Optional<LockHandle> tryAcquire(String name, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Lock TTL must be positive");
        }
        String key = KEY_PREFIX + name;
        String token = UUID.randomUUID().toString();
        try {
            clearIfStale(key);
            Boolean acquired = redis.opsForValue().setIfAbsent(key, token, ttl);
            if (!Boolean.TRUE.equals(acquired)) {
                log.info("Lock {} is held by another worker", name);
                return Optional.empty();
            }
            try {
                writeMetadata(key, token, ttl);
            } catch (DataAccessException e) {
                log.warn("Lock {} acquired but its metadata could not be written: {}", name, e.getMessage());
            }
            log.debug("Acquired lock {} (token {})", name, token);
            return Optional.of(new LockHandle(name, key, token, false));
        } catch (DataAccessException e) {
            log.warn("Lock backend unavailable, continuing without lock {}: {}", name, e.getMessage());
            return Optional.of(new LockHandle(name, key, token, true));
        }
    }

    private void clearIfStale(String key) {
        Map<Object, Object> meta = redis.opsForHash().entries(metaKey(key));
        if (meta == null || meta.isEmpty() || !Boolean.TRUE.equals(redis.hasKey(key))) {
            return;
        }
        long startTime = parseLong(meta.get("start_time"));
        long ttlSeconds = parseLong(meta.get("ttl"));
        if (startTime <= 0 || ttlSeconds <= 0) {
            return;
        }
        long age = clock.instant().getEpochSecond() - startTime;
        if (age > ttlSeconds * STALE_FACTOR) {
            log.warn("Clearing stale lock {} held by {} for {}s (ttl {}s)", key, meta.get("hostname"), age, ttlSeconds);
            redis.delete(List.of(key, metaKey(key)));
        }
    }

    private void writeMetadata(String key, String token, Duration ttl) {
        Map<String, String> meta = new LinkedHashMap<>();
        meta.put("hostname", hostname);
        meta.put("start_time", Long.toString(clock.instant().getEpochSecond()));
        meta.put("ttl", Long.toString(ttl.toSeconds()));
        meta.put("token", token);
        redis.opsForHash().putAll(metaKey(key), meta);
        // Outlives the lock itself so a crashed owner can still be diagnosed.
        redis.expire(metaKey(key), ttl.multipliedBy(2));
    }

    private void release(LockHandle handle) {
        if (handle.degraded()) {
            return;
        }
        try {
            Long deleted = redis.execute(RELEASE_SCRIPT, List.of(handle.key), handle.token);
            if (deleted != null && deleted > 0) {
                redis.delete(metaKey(handle.key));
                log.debug("Released lock {}", handle.name);
            } else {
                log.warn("Lock {} was no longer owned by token {} on release", handle.name, handle.token);
            }
        } catch (DataAccessException e) {
            log.warn("Failed to release lock {}: {}", handle.name, e.getMessage());
        }
    }

    private static String metaKey(String key) {
        return key + ":meta";
    }

    private static long parseLong(Object value) {
        if (value == null) {
            return 0L;
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private static String resolveHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown";
        }
    }

    public final class LockHandle implements AutoCloseable {
        private final String name;
        private final String key;
        private final String token;
        private final boolean degraded;
        private boolean released;

        private LockHandle(String name, String key, String token, boolean degraded) {
            this.name = name;
            this.key = key;
            this.token = token;
            this.degraded = degraded;
        }

        public String name() {
            return name;
        }

        public String token() {
            return token;
        }

        /**
         * True when the lock backend was unreachable and the caller runs without mutual exclusion.
         */
        public boolean degraded() {
            return degraded;
        }

        @Override
        public synchronized void close() {
            if (released) {
                return;
            }
            released = true;
            release(this);
        }
    }
}
