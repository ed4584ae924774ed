package com.authbridge.credentials;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps group membership onto cluster role names.
 * <p>
 * Roles are emitted in group order, then in the configured order of each group's mapping.
 * Duplicates are kept. Group names match exactly (case-sensitive).
 */
public final class RoleMapper {

    private RoleMapper() {
        // utility class
    }

    /**
     * Computes the role assignment for the given groups.
     *
     * @param groups the user's groups, in header order
     * @param config the mapping table
     * @return the mapped roles, or a single-element list holding the default role when
     *         nothing matched
     */
    public static List<String> mapRoles(List<String> groups, GroupRoleConfig config) {
        List<String> roles = new ArrayList<>();
        if (groups != null) {
            for (String group : groups) {
                List<String> mapped = config.groupMappings().get(group);
                if (mapped != null) {
                    roles.addAll(mapped);
                }
            }
        }
        if (roles.isEmpty()) {
            return List.of(config.defaultRole());
        }
        return List.copyOf(roles);
    }
}
