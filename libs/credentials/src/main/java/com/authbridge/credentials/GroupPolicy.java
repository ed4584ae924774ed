package com.authbridge.credentials;

import java.util.Set;

/**
 * How {@link HeaderAuthGate} treats the groups header.
 *
 * @param required         a request without the groups header is turned away
 * @param whitelistEnabled only groups listed in {@code whitelist} are accepted
 * @param whitelist        allowed group names (compared case-insensitively)
 */
public record GroupPolicy(boolean required, boolean whitelistEnabled, Set<String> whitelist) {

    public static final GroupPolicy PERMISSIVE = new GroupPolicy(false, false, Set.of());

    public GroupPolicy {
        whitelist = whitelist == null ? Set.of() : Set.copyOf(whitelist);
    }

    /** Whether {@code group} passes the whitelist (always true when it is disabled). */
    public boolean allows(String group) {
        if (!whitelistEnabled) {
            return true;
        }
        return whitelist.stream().anyMatch(allowed -> allowed.equalsIgnoreCase(group));
    }
}
