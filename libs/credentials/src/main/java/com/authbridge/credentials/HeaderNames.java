package com.authbridge.credentials;

/**
 * Names of the trusted headers the proxy sets.
 *
 * @param username header carrying the login name (required for issuance)
 * @param groups   header carrying comma-separated groups
 * @param email    header carrying the email address
 * @param name     header carrying the display name
 */
public record HeaderNames(String username, String groups, String email, String name) {

    public static final HeaderNames DEFAULTS =
            new HeaderNames("Remote-User", "Remote-Groups", "Remote-Email", "Remote-Name");

    public HeaderNames {
        username = orDefault(username, "Remote-User");
        groups = orDefault(groups, "Remote-Groups");
        email = orDefault(email, "Remote-Email");
        name = orDefault(name, "Remote-Name");
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
