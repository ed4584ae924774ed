package com.authbridge.credentials;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Derives cache keys from usernames.
 * <p>
 * Usernames are URL-encoded so that separator characters in a name can never make two
 * different users collide on the same key.
 */
public final class CacheKeys {

    /** Prefix used when none is configured. */
    public static final String DEFAULT_PREFIX = "auth-bridge-";

    private static final String LOCK_SUFFIX = ":lock";

    private CacheKeys() {
        // utility class
    }

    /**
     * Key under which the encrypted credential of {@code username} is stored.
     */
    public static String credentialKey(String prefix, String username) {
        if (username == null || username.isEmpty()) {
            throw new IllegalArgumentException("username must not be null or empty");
        }
        return (prefix == null ? DEFAULT_PREFIX : prefix)
                + URLEncoder.encode(username, StandardCharsets.UTF_8);
    }

    /**
     * Key of the advisory lock guarding issuance for {@code username}.
     */
    public static String lockKey(String prefix, String username) {
        return credentialKey(prefix, username) + LOCK_SUFFIX;
    }
}
