package com.authbridge.credentials;

import java.util.List;
import java.util.Map;

/**
 * User record pushed to the remote directory on issuance.
 * <p>
 * {@link #toString()} never includes the password.
 *
 * @param username login name (also the record's id in the directory)
 * @param password plaintext password just issued
 * @param email    optional email
 * @param fullName optional display name
 * @param metadata free-form metadata, {@code {"groups": [...]}} for bridge-managed users
 * @param roles    roles computed by {@link RoleMapper}
 * @param enabled  whether the account may log in
 */
public record DirectoryUser(
        String username,
        String password,
        String email,
        String fullName,
        Map<String, Object> metadata,
        List<String> roles,
        boolean enabled
) {

    public DirectoryUser {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username must not be null or blank");
        }
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("password must not be null or empty");
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    /**
     * Builds the record for a bridge-managed user: enabled, groups kept as metadata.
     */
    public static DirectoryUser forIdentity(Identity identity, String password, List<String> roles) {
        return new DirectoryUser(
                identity.username(),
                password,
                identity.email(),
                identity.displayName(),
                Map.of("groups", identity.groups()),
                roles,
                true);
    }

    @Override
    public String toString() {
        return "DirectoryUser[username=" + username
                + ", email=" + email
                + ", fullName=" + fullName
                + ", metadata=" + metadata
                + ", roles=" + roles
                + ", enabled=" + enabled
                + ", password=***]";
    }
}
