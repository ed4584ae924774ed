package com.authbridge.bridge.api;

import com.authbridge.bridge.config.AuthBridgeProperties;
import com.authbridge.credentials.GroupRoleConfig;
import com.authbridge.credentials.HeaderNames;
import com.authbridge.observability.SensitiveDataRedactor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

/**
 * Shows the effective configuration with secrets masked.
 *
 * <p>The format follows the request's {@code Content-Type}, then its {@code Accept} header:
 * YAML for {@code application/yaml} or {@code text/yaml}, an HTML page for {@code text/html},
 * JSON otherwise.
 */
@RestController
public class ConfigController {

    static final MediaType APPLICATION_YAML = MediaType.valueOf("application/yaml");
    static final MediaType TEXT_YAML = MediaType.valueOf("text/yaml");

    private final AuthBridgeProperties properties;
    private final GroupRoleConfig roles;
    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();
    private final ObjectMapper yaml =
            new ObjectMapper(
                    new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));

    public ConfigController(AuthBridgeProperties properties, GroupRoleConfig roles) {
        this.properties = properties;
        this.roles = roles;
    }

    @GetMapping({"/config", BridgePaths.PREFIX + "/config"})
    public ResponseEntity<?> config(
            @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType,
            @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept)
            throws JsonProcessingException {
        Map<String, Object> config = effectiveConfig();
        String requested = contentType != null && !contentType.isBlank() ? contentType : accept;

        if (matches(requested, APPLICATION_YAML) || matches(requested, TEXT_YAML)) {
            return ResponseEntity.ok()
                    .contentType(APPLICATION_YAML)
                    .body(yaml.writeValueAsString(config));
        }
        if (matches(requested, MediaType.TEXT_HTML)) {
            return ResponseEntity.ok().contentType(MediaType.TEXT_HTML).body(html(config));
        }
        return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(config);
    }

    /** Effective settings; anything whose key looks like a secret is replaced by {@code ***}. */
    Map<String, Object> effectiveConfig() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("name", properties.name());
        settings.put("secret_key", properties.secretKey());
        if (properties.fixedPassword() != null) {
            settings.put("fixed_password", properties.fixedPassword());
        }
        settings.put("extend_cache", properties.extendCache());
        settings.put("dry_run", properties.dryRun());
        settings.put("cache_key_prefix", properties.cacheKeyPrefix());

        AuthBridgeProperties.Cache cache = properties.cache();
        Map<String, Object> cacheSettings = new LinkedHashMap<>();
        cacheSettings.put("type", cache.type().name().toLowerCase(Locale.ROOT));
        cacheSettings.put("ttl", cache.ttl().toString());
        cacheSettings.put("max_size", cache.maxSize());
        settings.put("cache", cacheSettings);

        AuthBridgeProperties.Lock lock = properties.lock();
        Map<String, Object> lockSettings = new LinkedHashMap<>();
        lockSettings.put("enabled", lock.enabled());
        lockSettings.put("ttl", lock.ttl().toString());
        lockSettings.put("max_wait", lock.maxWait().toString());
        lockSettings.put("poll_interval", lock.pollInterval().toString());
        settings.put("lock", lockSettings);

        AuthBridgeProperties.Directory directory = properties.directory();
        Map<String, Object> directorySettings = new LinkedHashMap<>();
        directorySettings.put("host", directory.host());
        directorySettings.put("username", directory.username());
        directorySettings.put("password", directory.password());
        directorySettings.put("verify_ssl", directory.verifySsl());
        directorySettings.put("connect_timeout", directory.connectTimeout().toString());
        directorySettings.put("read_timeout", directory.readTimeout().toString());
        settings.put("directory", directorySettings);

        AuthBridgeProperties.Proxy proxy = properties.proxy();
        Map<String, Object> proxySettings = new LinkedHashMap<>();
        proxySettings.put("enabled", proxy.enabled());
        proxySettings.put("target_url", proxy.targetUrl());
        proxySettings.put("connect_timeout", proxy.connectTimeout().toString());
        proxySettings.put("timeout", proxy.timeout().toString());
        proxySettings.put("max_connections", proxy.maxConnections());
        proxySettings.put("verify_ssl", proxy.verifySsl());
        settings.put("proxy", proxySettings);

        HeaderNames headerNames = properties.headers().toHeaderNames();
        Map<String, Object> headerSettings = new LinkedHashMap<>();
        headerSettings.put("username", headerNames.username());
        headerSettings.put("groups", headerNames.groups());
        headerSettings.put("email", headerNames.email());
        headerSettings.put("name", headerNames.name());
        headerSettings.put("groups_required", properties.headers().groupsRequired());
        settings.put("headers", headerSettings);

        Map<String, Object> whitelist = new LinkedHashMap<>();
        whitelist.put("enabled", properties.groupWhitelist().enabled());
        whitelist.put("groups", properties.groupWhitelist().groups());
        settings.put("group_whitelist", whitelist);

        Map<String, Object> redacted = redactor.redact(settings);
        // Group names are data, not setting names; they bypass the secret matcher.
        redacted.put("default_role", roles.defaultRole());
        redacted.put("group_mappings", roles.groupMappings());
        return redacted;
    }

    private String html(Map<String, Object> config) throws JsonProcessingException {
        String title = HtmlUtils.htmlEscape(properties.name());
        return "<!DOCTYPE html>\n<html><head><meta charset=\"utf-8\"><title>"
                + title
                + " configuration</title></head>\n<body><h1>"
                + title
                + "</h1>\n<pre>"
                + HtmlUtils.htmlEscape(yaml.writeValueAsString(config))
                + "</pre></body></html>\n";
    }

    private static boolean matches(String header, MediaType type) {
        if (header == null || header.isBlank()) {
            return false;
        }
        try {
            return MediaType.parseMediaTypes(header).stream()
                    .anyMatch(candidate -> type.equalsTypeAndSubtype(candidate));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
