package com.authbridge.credentials;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Group-to-role mapping table, loaded once at startup and read-only afterwards.
 *
 * @param defaultRole   role assigned when no group maps to anything
 * @param groupMappings group name to the ordered roles it grants; iteration order is preserved
 */
public record GroupRoleConfig(String defaultRole, Map<String, List<String>> groupMappings) {

    public GroupRoleConfig {
        if (defaultRole == null || defaultRole.isBlank()) {
            throw new IllegalArgumentException("defaultRole must not be null or blank");
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (groupMappings != null) {
            groupMappings.forEach((group, roles) ->
                    copy.put(group, roles == null ? List.of() : List.copyOf(roles)));
        }
        groupMappings = Collections.unmodifiableMap(copy);
    }

    /** Creates a config without any group mappings. */
    public static GroupRoleConfig defaultOnly(String defaultRole) {
        return new GroupRoleConfig(defaultRole, Map.of());
    }
}
