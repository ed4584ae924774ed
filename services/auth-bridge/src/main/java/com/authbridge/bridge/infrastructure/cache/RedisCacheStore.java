package com.authbridge.bridge.infrastructure.cache;

import com.authbridge.credentials.CacheStore;
import com.authbridge.credentials.CacheUnavailableException;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis-backed credential cache.
 *
 * <p>Shared by every bridge replica, so a password issued by one replica is served by all of
 * them. TTLs are native Redis expiries and the issuance lock is a {@code SET NX PX} key.
 *
 * <p>Connection settings come from the standard {@code spring.data.redis.*} properties; the
 * command timeout ({@code spring.data.redis.timeout}) bounds every call.
 */
public class RedisCacheStore implements CacheStore {

    /** Reported by {@link #ttl(String)} for keys that never expire. */
    static final Duration NO_EXPIRY = ChronoUnit.FOREVER.getDuration();

    // WHY: compare-and-delete must be atomic or a lock that expired and was re-taken by another
    // request could be deleted by its previous owner.
    private static final RedisScript<Long> UNLOCK_SCRIPT =
            RedisScript.of(
                    "if redis.call('get', KEYS[1]) == ARGV[1] then "
                            + "return redis.call('del', KEYS[1]) else return 0 end",
                    Long.class);

    private final StringRedisTemplate redis;

    public RedisCacheStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public boolean exists(String key) {
        return call("EXISTS", () -> Boolean.TRUE.equals(redis.hasKey(key)));
    }

    @Override
    public Optional<String> get(String key) {
        return call("GET", () -> Optional.ofNullable(redis.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        call("SET", () -> {
            redis.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public Duration ttl(String key) {
        Long millis = call("PTTL", () -> redis.getExpire(key, TimeUnit.MILLISECONDS));
        if (millis == null || millis == -2L) {
            return Duration.ZERO;
        }
        if (millis == -1L) {
            return NO_EXPIRY;
        }
        return millis <= 0 ? Duration.ZERO : Duration.ofMillis(millis);
    }

    @Override
    public void refreshExpiry(String key, Duration ttl) {
        call("PEXPIRE", () -> redis.expire(key, ttl));
    }

    @Override
    public boolean tryLock(String lockKey, String token, Duration ttl) {
        return call("SET NX", () -> Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(lockKey, token, ttl)));
    }

    @Override
    public void unlock(String lockKey, String token) {
        call("EVAL", () -> redis.execute(UNLOCK_SCRIPT, List.of(lockKey), token));
    }

    private static <T> T call(String command, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Redis " + command + " failed: " + e.getMessage(), e);
        }
    }
}
