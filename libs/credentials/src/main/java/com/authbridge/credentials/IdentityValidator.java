package com.authbridge.credentials;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks the shape of identity values before they reach the cache key or the directory.
 * <p>
 * Collects every error instead of stopping at the first one.
 */
public final class IdentityValidator {

    public static final int MAX_USERNAME_LENGTH = 255;
    public static final int MAX_EMAIL_LENGTH = 320;
    public static final int MAX_NAME_LENGTH = 500;
    public static final int MAX_GROUP_LENGTH = 255;

    private static final Pattern USERNAME = Pattern.compile("^[a-zA-Z0-9._\\-@]+$");
    private static final Pattern EMAIL =
            Pattern.compile("^[a-zA-Z0-9._%+\\-]+@[a-zA-Z0-9.\\-]+\\.[a-zA-Z]{2,}$");

    private IdentityValidator() {
        // utility class
    }

    /**
     * Validates all fields of the identity. Email and display name are only checked when present.
     */
    public static IdentityValidationResult validate(Identity identity) {
        List<String> errors = new ArrayList<>();

        String username = identity.username();
        if (username.length() > MAX_USERNAME_LENGTH) {
            errors.add("username exceeds maximum length of " + MAX_USERNAME_LENGTH
                    + " characters (got " + username.length() + ")");
        } else if (!USERNAME.matcher(username).matches()) {
            errors.add("username contains invalid characters; allowed: alphanumeric, dot, underscore, hyphen, at-sign");
        }

        String email = identity.email();
        if (email != null && !email.isEmpty()) {
            if (email.length() > MAX_EMAIL_LENGTH) {
                errors.add("email exceeds maximum length of " + MAX_EMAIL_LENGTH
                        + " characters (got " + email.length() + ")");
            } else if (!EMAIL.matcher(email).matches()) {
                errors.add("email format is invalid");
            }
        }

        String name = identity.displayName();
        if (name != null) {
            if (name.length() > MAX_NAME_LENGTH) {
                errors.add("name exceeds maximum length of " + MAX_NAME_LENGTH
                        + " characters (got " + name.length() + ")");
            } else if (containsControl(name, true)) {
                errors.add("name contains invalid control characters");
            }
        }

        for (String group : identity.groups()) {
            validateGroup(group, errors);
        }

        return errors.isEmpty() ? IdentityValidationResult.ok() : IdentityValidationResult.fail(errors);
    }

    private static void validateGroup(String group, List<String> errors) {
        if (group.isEmpty()) {
            errors.add("group name cannot be empty");
        } else if (group.length() > MAX_GROUP_LENGTH) {
            errors.add("group name exceeds maximum length of " + MAX_GROUP_LENGTH
                    + " characters (got " + group.length() + ")");
        } else if (containsControl(group, false)) {
            errors.add("group name contains invalid control characters");
        }
    }

    private static boolean containsControl(String value, boolean allowWhitespaceControls) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < 32) {
                if (allowWhitespaceControls && (c == '\t' || c == '\n' || c == '\r')) {
                    continue;
                }
                return true;
            }
        }
        return false;
    }
}
