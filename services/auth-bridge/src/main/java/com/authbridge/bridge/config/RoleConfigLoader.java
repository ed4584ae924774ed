package com.authbridge.bridge.config;

import com.authbridge.credentials.GroupRoleConfig;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the group to role table, from inline properties or from a role file.
 *
 * <p>A role file is YAML (JSON is accepted as well) with snake_case keys:
 *
 * <pre>
 * default_role: kibana_user
 * group_mappings:
 *   admins:
 *     - superuser
 *   eng:
 *     - editor
 * </pre>
 *
 * Read once at startup. A missing or malformed file fails the startup.
 */
public final class RoleConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(RoleConfigLoader.class);

    private final ObjectMapper mapper =
            new ObjectMapper(new YAMLFactory())
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public GroupRoleConfig load(AuthBridgeProperties.Roles roles) {
        if (roles.file() == null) {
            log.info(
                    "Loaded inline role config: defaultRole={} groups={}",
                    roles.defaultRole(),
                    roles.groupMappings().keySet());
            return new GroupRoleConfig(roles.defaultRole(), roles.groupMappings());
        }
        return loadFile(Path.of(roles.file()), roles.defaultRole());
    }

    /**
     * Reads a role file. {@code fallbackDefaultRole} applies when the file names no default role.
     */
    GroupRoleConfig loadFile(Path path, String fallbackDefaultRole) {
        if (!Files.isReadable(path)) {
            throw new IllegalStateException("Role file not readable: " + path);
        }
        RoleFile file;
        try {
            file = mapper.readValue(path.toFile(), RoleFile.class);
        } catch (IOException e) {
            throw new IllegalStateException(
                    "Failed to parse role file " + path + ": " + e.getMessage(), e);
        }
        if (file == null) {
            file = new RoleFile(null, null);
        }
        String defaultRole =
                file.defaultRole() == null || file.defaultRole().isBlank()
                        ? fallbackDefaultRole
                        : file.defaultRole();
        GroupRoleConfig config = new GroupRoleConfig(defaultRole, file.groupMappings());
        log.info(
                "Loaded role file {}: defaultRole={} groups={}",
                path,
                config.defaultRole(),
                config.groupMappings().keySet());
        return config;
    }

    record RoleFile(
            @JsonProperty("default_role") String defaultRole,
            @JsonProperty("group_mappings") Map<String, List<String>> groupMappings) {}
}
