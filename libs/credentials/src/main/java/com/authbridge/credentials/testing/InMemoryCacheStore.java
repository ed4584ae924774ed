package com.authbridge.credentials.testing;

import com.authbridge.credentials.CacheStore;
import com.authbridge.credentials.CacheUnavailableException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A controllable {@link CacheStore} for tests.
 * <p>
 * Expiry follows the supplied {@link Clock}. Tests can force an entry's TTL, simulate an
 * outage, and count writes. Placed in {@code src/main/java} for cross-module test use.
 * <p>
 * Unlike a real store, an entry whose TTL was forced to zero stays visible to
 * {@link #exists(String)} so the expired-entry path can be exercised.
 */
public final class InMemoryCacheStore implements CacheStore {

    private record Entry(String value, Instant expiresAt) {
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final AtomicBoolean unavailable = new AtomicBoolean(false);
    private final AtomicInteger setCount = new AtomicInteger();
    private final AtomicInteger refreshCount = new AtomicInteger();

    public InMemoryCacheStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean exists(String key) {
        checkAvailable();
        return entries.containsKey(key);
    }

    @Override
    public Optional<String> get(String key) {
        checkAvailable();
        Entry entry = entries.get(key);
        if (entry == null || !entry.expiresAt().isAfter(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        checkAvailable();
        setCount.incrementAndGet();
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public Duration ttl(String key) {
        checkAvailable();
        Entry entry = entries.get(key);
        if (entry == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), entry.expiresAt());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    @Override
    public void refreshExpiry(String key, Duration ttl) {
        checkAvailable();
        refreshCount.incrementAndGet();
        entries.computeIfPresent(key, (k, entry) -> new Entry(entry.value(), clock.instant().plus(ttl)));
    }

    @Override
    public boolean tryLock(String lockKey, String token, Duration ttl) {
        checkAvailable();
        Instant now = clock.instant();
        Entry fresh = new Entry(token, now.plus(ttl));
        Entry result = entries.compute(lockKey, (k, current) ->
                current == null || !current.expiresAt().isAfter(now) ? fresh : current);
        return result == fresh;
    }

    @Override
    public void unlock(String lockKey, String token) {
        checkAvailable();
        entries.computeIfPresent(lockKey, (k, entry) -> entry.value().equals(token) ? null : entry);
    }

    /**
     * Forces the remaining TTL of an existing entry.
     */
    public InMemoryCacheStore forceTtl(String key, Duration ttl) {
        entries.computeIfPresent(key, (k, entry) -> new Entry(entry.value(), clock.instant().plus(ttl)));
        return this;
    }

    /**
     * Makes every operation throw {@link CacheUnavailableException} until reset.
     */
    public InMemoryCacheStore setUnavailable(boolean value) {
        unavailable.set(value);
        return this;
    }

    /** Raw stored value, ignoring expiry. */
    public Optional<String> peek(String key) {
        return Optional.ofNullable(entries.get(key)).map(Entry::value);
    }

    /** Number of {@link #set} calls so far. */
    public int setCount() {
        return setCount.get();
    }

    /** Number of {@link #refreshExpiry} calls so far. */
    public int refreshCount() {
        return refreshCount.get();
    }

    private void checkAvailable() {
        if (unavailable.get()) {
            throw new CacheUnavailableException("in-memory cache marked unavailable", null);
        }
    }
}
