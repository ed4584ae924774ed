package com.authbridge.credentials;

import java.time.Duration;
import java.util.Optional;

/**
 * TTL-keyed store holding encrypted credentials and issuance locks.
 * <p>
 * Implementations are process-wide singletons shared by all requests and must be
 * thread-safe. Any failure to reach the backing store is reported as
 * {@link CacheUnavailableException}.
 */
public interface CacheStore {

    /**
     * Returns whether a live entry exists for the key.
     */
    boolean exists(String key);

    /**
     * Returns the stored value, or empty if the key is absent or expired.
     */
    Optional<String> get(String key);

    /**
     * Stores a value, replacing any previous one, expiring after {@code ttl}.
     */
    void set(String key, String value, Duration ttl);

    /**
     * Returns the remaining time to live of the entry, or {@link Duration#ZERO} if the key
     * is absent or expired. An entry without expiry reports a very large duration.
     */
    Duration ttl(String key);

    /**
     * Resets the expiry of an existing entry to {@code ttl} without touching its value.
     * Does nothing if the key is absent.
     */
    void refreshExpiry(String key, Duration ttl);

    /**
     * Atomically creates {@code lockKey} holding {@code token} if it does not exist yet.
     *
     * @return true if this caller now owns the lock
     */
    boolean tryLock(String lockKey, String token, Duration ttl);

    /**
     * Removes {@code lockKey} only if it still holds {@code token}.
     */
    void unlock(String lockKey, String token);
}
