package com.authbridge.credentials;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Supplies the password for a new issuance.
 */
@FunctionalInterface
public interface PasswordSource {

    /** Bytes of entropy in a generated password. */
    int TOKEN_BYTES = 13;

    /**
     * Returns a password for the next issuance.
     */
    String next();

    /**
     * Random URL-safe token: {@value #TOKEN_BYTES} random bytes, base64url without padding.
     */
    static PasswordSource random() {
        SecureRandom random = new SecureRandom();
        Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
        return () -> {
            byte[] bytes = new byte[TOKEN_BYTES];
            random.nextBytes(bytes);
            return encoder.encodeToString(bytes);
        };
    }

    /**
     * Always returns the operator-supplied password.
     */
    static PasswordSource fixed(String password) {
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("fixed password must not be null or empty");
        }
        return () -> password;
    }
}
