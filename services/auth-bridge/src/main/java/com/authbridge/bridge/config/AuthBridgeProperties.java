package com.authbridge.bridge.config;

import com.authbridge.credentials.CacheKeys;
import com.authbridge.credentials.GroupPolicy;
import com.authbridge.credentials.HeaderNames;
import com.authbridge.credentials.IssuerSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration of the bridge, bound from the {@code auth-bridge.*} prefix.
 *
 * <p>WHY: Invalid config fails the startup with a clear message instead of surfacing on the first
 * request. Compact constructors apply defaults before Bean Validation runs, so a minimal
 * configuration only needs the secret key:
 *
 * <pre>
 * auth-bridge:
 *   secret-key: ${AUTH_BRIDGE_SECRET_KEY}
 *   directory:
 *     host: https://elasticsearch:9200
 *     username: elastic
 *     password: ${AUTH_BRIDGE_DIRECTORY_PASSWORD}
 *   roles:
 *     default-role: kibana_user
 *     group-mappings:
 *       admins: [superuser]
 * </pre>
 *
 * @param name service name shown to anonymous callers
 * @param secretKey passphrase for the cached password cipher. Required.
 * @param fixedPassword password handed to every user instead of a random one (testing aid)
 * @param extendCache slide a cached entry's expiry back to the full TTL on every hit
 * @param dryRun issue and cache passwords without writing users to the directory
 * @param cacheKeyPrefix prefix of every cache key
 * @param headers names of the trusted identity headers
 * @param groupWhitelist optional restriction on accepted group names
 * @param cache cache backend and TTL
 * @param lock per-username issuance lock
 * @param directory Elasticsearch connection
 * @param roles group to role mapping
 * @param proxy transparent proxy mode
 */
@ConfigurationProperties(prefix = "auth-bridge")
@Validated
public record AuthBridgeProperties(
        String name,
        @NotBlank String secretKey,
        String fixedPassword,
        boolean extendCache,
        boolean dryRun,
        String cacheKeyPrefix,
        @Valid Headers headers,
        @Valid GroupWhitelist groupWhitelist,
        @Valid Cache cache,
        @Valid Lock lock,
        @Valid Directory directory,
        @Valid Roles roles,
        @Valid Proxy proxy) {

    public static final String DEFAULT_NAME = "Auth Bridge";

    public AuthBridgeProperties {
        if (name == null || name.isBlank()) {
            name = DEFAULT_NAME;
        }
        if (fixedPassword != null && fixedPassword.isEmpty()) {
            fixedPassword = null;
        }
        if (cacheKeyPrefix == null || cacheKeyPrefix.isBlank()) {
            cacheKeyPrefix = CacheKeys.DEFAULT_PREFIX;
        }
        headers = headers != null ? headers : new Headers(null, null, null, null, false);
        groupWhitelist = groupWhitelist != null ? groupWhitelist : new GroupWhitelist(false, null);
        cache = cache != null ? cache : new Cache(null, null, 0);
        lock = lock != null ? lock : new Lock(null, null, null, null);
        directory = directory != null ? directory : new Directory(null, null, null, null, null, null);
        roles = roles != null ? roles : new Roles(null, null, null);
        proxy = proxy != null ? proxy : new Proxy(false, null, null, null, 0, null);
        if (proxy.targetUrl() == null) {
            proxy = proxy.withTargetUrl(directory.host());
        }
    }

    /** Issuer tuning derived from the cache and lock sections. */
    public IssuerSettings issuerSettings() {
        return new IssuerSettings(
                cache.ttl(),
                extendCache,
                cacheKeyPrefix,
                dryRun,
                lock.enabled(),
                lock.ttl(),
                lock.maxWait(),
                lock.pollInterval());
    }

    /** Group header policy derived from the headers and whitelist sections. */
    public GroupPolicy groupPolicy() {
        return new GroupPolicy(
                headers.groupsRequired(), groupWhitelist.enabled(), Set.copyOf(groupWhitelist.groups()));
    }

    /**
     * Names of the trusted headers. Blank values fall back to the {@code Remote-*} defaults.
     *
     * @param groupsRequired turn away requests that carry a username but no groups header
     */
    public record Headers(
            String username, String groups, String email, String name, boolean groupsRequired) {

        public HeaderNames toHeaderNames() {
            return new HeaderNames(username, groups, email, name);
        }
    }

    public record GroupWhitelist(boolean enabled, List<String> groups) {

        public GroupWhitelist {
            groups = groups == null ? List.of() : List.copyOf(groups);
        }
    }

    /**
     * @param type backend holding the encrypted passwords
     * @param ttl lifetime of a cached password (default 1h)
     * @param maxSize entry bound of the in-memory backend (default 10000)
     */
    public record Cache(CacheType type, Duration ttl, long maxSize) {

        public Cache {
            if (type == null) {
                type = CacheType.MEMORY;
            }
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                ttl = IssuerSettings.DEFAULT_TTL;
            }
            if (maxSize <= 0) {
                maxSize = 10_000;
            }
        }
    }

    public enum CacheType {
        REDIS,
        MEMORY
    }

    /**
     * @param enabled guard issuance with a per-username lock (default true)
     * @param ttl lifetime of a held lock (default 30s)
     * @param maxWait how long a request waits for a concurrent issuance (default 5s)
     * @param pollInterval how often a waiting request re-checks the cache (default 100ms)
     */
    public record Lock(Boolean enabled, Duration ttl, Duration maxWait, Duration pollInterval) {

        public Lock {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (ttl == null) {
                ttl = Duration.ofSeconds(30);
            }
            if (maxWait == null) {
                maxWait = Duration.ofSeconds(5);
            }
            if (pollInterval == null) {
                pollInterval = Duration.ofMillis(100);
            }
        }
    }

    /**
     * @param host base URL of the Elasticsearch cluster
     * @param username user allowed to manage security users
     * @param password password of {@code username}
     * @param verifySsl verify the cluster's TLS certificate (default true)
     * @param connectTimeout connect timeout (default 5s)
     * @param readTimeout response timeout (default 10s)
     */
    public record Directory(
            String host,
            String username,
            String password,
            Boolean verifySsl,
            Duration connectTimeout,
            Duration readTimeout) {

        public Directory {
            if (host == null || host.isBlank()) {
                host = "http://localhost:9200";
            }
            if (host.endsWith("/")) {
                host = host.substring(0, host.length() - 1);
            }
            if (verifySsl == null) {
                verifySsl = Boolean.TRUE;
            }
            if (connectTimeout == null) {
                connectTimeout = Duration.ofSeconds(5);
            }
            if (readTimeout == null) {
                readTimeout = Duration.ofSeconds(10);
            }
        }
    }

    /**
     * @param defaultRole role given to users none of whose groups are mapped
     * @param groupMappings group name to roles, in order
     * @param file YAML or JSON file with {@code default_role} and {@code group_mappings}; replaces
     *     the inline values when set
     */
    public record Roles(String defaultRole, Map<String, List<String>> groupMappings, String file) {

        public static final String DEFAULT_ROLE = "kibana_user";

        public Roles {
            if (defaultRole == null || defaultRole.isBlank()) {
                defaultRole = DEFAULT_ROLE;
            }
            groupMappings =
                    groupMappings == null
                            ? Map.of()
                            : Collections.unmodifiableMap(new LinkedHashMap<>(groupMappings));
            if (file != null && file.isBlank()) {
                file = null;
            }
        }
    }

    /**
     * Forwarding of every request outside {@code /auth-bridge/**} and {@code /actuator/**} to the
     * cluster, with the issued credential as {@code Authorization}.
     *
     * @param enabled run as a transparent proxy (default false)
     * @param targetUrl cluster to forward to (default the directory host)
     * @param connectTimeout connect timeout (default 5s)
     * @param timeout response timeout (default 30s)
     * @param maxConnections pooled connections to the cluster (default 100)
     * @param verifySsl verify the cluster's TLS certificate (default true)
     */
    public record Proxy(
            boolean enabled,
            @Pattern(regexp = "https?://.+", message = "must start with http:// or https://")
                    String targetUrl,
            Duration connectTimeout,
            Duration timeout,
            int maxConnections,
            Boolean verifySsl) {

        public Proxy {
            if (targetUrl != null && targetUrl.isBlank()) {
                targetUrl = null;
            }
            if (targetUrl != null && targetUrl.endsWith("/")) {
                targetUrl = targetUrl.substring(0, targetUrl.length() - 1);
            }
            if (connectTimeout == null) {
                connectTimeout = Duration.ofSeconds(5);
            }
            if (timeout == null) {
                timeout = Duration.ofSeconds(30);
            }
            if (maxConnections <= 0) {
                maxConnections = 100;
            }
            if (verifySsl == null) {
                verifySsl = Boolean.TRUE;
            }
        }

        Proxy withTargetUrl(String url) {
            return new Proxy(enabled, url, connectTimeout, timeout, maxConnections, verifySsl);
        }
    }
}
