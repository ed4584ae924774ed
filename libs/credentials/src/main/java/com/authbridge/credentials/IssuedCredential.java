package com.authbridge.credentials;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Password handed back to the HTTP layer for one request.
 * <p>
 * {@link #toString()} never includes the password.
 *
 * @param username    the user the password belongs to
 * @param password    plaintext password
 * @param state       {@link IssuanceState#CACHE_VALID} or {@link IssuanceState#ISSUED}
 * @param ttlExtended whether serving this credential slid the cache entry's expiry
 */
public record IssuedCredential(String username, String password, IssuanceState state, boolean ttlExtended) {

    /**
     * Value of an {@code Authorization} header for HTTP basic authentication.
     */
    public String basicAuthorization() {
        String pair = username + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(pair.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "IssuedCredential[username=" + username + ", state=" + state
                + ", ttlExtended=" + ttlExtended + ", password=***]";
    }
}
