package com.authbridge.bridge.infrastructure.cache;

import com.authbridge.credentials.CacheStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Policy;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;

/**
 * In-process credential cache backed by Caffeine with per-entry expiry.
 *
 * <p>Fast and dependency-free, but local to one replica: behind a load balancer each replica
 * issues its own password and the last upsert wins. Use {@link RedisCacheStore} when running
 * more than one instance.
 */
public class CaffeineCacheStore implements CacheStore {

    // Entries are written with an explicit TTL; this only applies if one ever is not.
    private static final Duration DEFAULT_EXPIRY = Duration.ofHours(1);

    private final Cache<String, String> cache;
    private final Policy.VarExpiration<String, String> expiration;

    public CaffeineCacheStore(long maxSize) {
        this(maxSize, Ticker.systemTicker());
    }

    public CaffeineCacheStore(long maxSize, Ticker ticker) {
        this.cache =
                Caffeine.newBuilder()
                        .maximumSize(maxSize)
                        .ticker(ticker)
                        .expireAfter(new ExplicitExpiry())
                        .build();
        this.expiration =
                cache.policy()
                        .expireVariably()
                        .orElseThrow(() -> new IllegalStateException("variable expiry not enabled"));
    }

    @Override
    public boolean exists(String key) {
        return cache.getIfPresent(key) != null;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        expiration.put(key, value, ttl);
    }

    @Override
    public Duration ttl(String key) {
        if (cache.getIfPresent(key) == null) {
            return Duration.ZERO;
        }
        return expiration.getExpiresAfter(key).filter(d -> !d.isNegative()).orElse(Duration.ZERO);
    }

    @Override
    public void refreshExpiry(String key, Duration ttl) {
        if (cache.getIfPresent(key) != null) {
            expiration.setExpiresAfter(key, ttl);
        }
    }

    @Override
    public boolean tryLock(String lockKey, String token, Duration ttl) {
        return expiration.putIfAbsent(lockKey, token, ttl) == null;
    }

    @Override
    public void unlock(String lockKey, String token) {
        cache.asMap().remove(lockKey, token);
    }

    /** Keeps whatever expiry the last explicit write set; reads never extend it. */
    private static final class ExplicitExpiry implements Expiry<String, String> {

        @Override
        public long expireAfterCreate(String key, String value, long currentTime) {
            return DEFAULT_EXPIRY.toNanos();
        }

        @Override
        public long expireAfterUpdate(
                String key, String value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        @Override
        public long expireAfterRead(
                String key, String value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
