package com.authbridge.credentials;

import java.time.Duration;

/**
 * Tuning of {@link CredentialIssuer}.
 *
 * @param ttl              full lifetime of a cached credential
 * @param extendTtl        whether a cache hit slides the entry's expiry back to {@code ttl}
 * @param cacheKeyPrefix   prefix of every cache key
 * @param dryRun           issue and cache passwords without writing to the directory
 * @param lockEnabled      guard issuance with a per-username lock in the cache store
 * @param lockTtl          lifetime of the issuance lock (bounds a crashed holder)
 * @param lockWait         how long a request waits for another request's issuance
 * @param lockPollInterval how often a waiting request re-checks the cache
 */
public record IssuerSettings(
        Duration ttl,
        boolean extendTtl,
        String cacheKeyPrefix,
        boolean dryRun,
        boolean lockEnabled,
        Duration lockTtl,
        Duration lockWait,
        Duration lockPollInterval
) {

    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    public IssuerSettings {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            ttl = DEFAULT_TTL;
        }
        if (cacheKeyPrefix == null || cacheKeyPrefix.isBlank()) {
            cacheKeyPrefix = CacheKeys.DEFAULT_PREFIX;
        }
        if (lockTtl == null || lockTtl.isZero() || lockTtl.isNegative()) {
            lockTtl = Duration.ofSeconds(30);
        }
        if (lockWait == null || lockWait.isNegative()) {
            lockWait = Duration.ofSeconds(5);
        }
        if (lockPollInterval == null || lockPollInterval.isZero() || lockPollInterval.isNegative()) {
            lockPollInterval = Duration.ofMillis(100);
        }
    }
}
