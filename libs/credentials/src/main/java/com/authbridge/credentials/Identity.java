package com.authbridge.credentials;

import java.util.List;

/**
 * Identity asserted by the upstream proxy for one request.
 * <p>
 * Never persisted; discarded once the response has been written.
 *
 * @param username    login name, required and non-blank
 * @param email       optional email address
 * @param displayName optional human-readable name
 * @param groups      group membership in header order (may be empty, never null)
 */
public record Identity(
        String username,
        String email,
        String displayName,
        List<String> groups
) {

    public Identity {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username must not be null or blank");
        }
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    /** Creates an identity with only a username and groups. */
    public static Identity of(String username, List<String> groups) {
        return new Identity(username, null, null, groups);
    }
}
