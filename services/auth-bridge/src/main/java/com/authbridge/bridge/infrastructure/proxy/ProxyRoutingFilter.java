package com.authbridge.bridge.infrastructure.proxy;

import com.authbridge.bridge.api.BridgePaths;
import com.authbridge.bridge.infrastructure.metrics.IssuanceMetrics;
import com.authbridge.bridge.infrastructure.metrics.ProxyMetrics;
import com.authbridge.credentials.CredentialIssuer;
import com.authbridge.credentials.HeaderAuthGate;
import com.authbridge.credentials.Identity;
import com.authbridge.credentials.InvalidHeaderException;
import com.authbridge.credentials.IssuanceException;
import com.authbridge.credentials.IssuedCredential;
import com.authbridge.credentials.MissingHeaderException;
import com.authbridge.observability.CorrelationContextHolder;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Transparent proxy mode: every request outside the bridge's own paths is authenticated from
 * the trusted headers and forwarded to the cluster as the mapped native user.
 *
 * <p>Outcomes:
 *
 * <ul>
 *   <li>no username header, or a required groups header missing: {@code 401 {"error": ...}}
 *   <li>header values failing validation, or an unparseable path: {@code 400 {"error": ...}}
 *   <li>issuance failure: {@code 500 {"error": ...}}
 *   <li>cluster unreachable: {@code 502 {"error": ...}}
 *   <li>otherwise the cluster's answer, status and body unchanged
 * </ul>
 *
 * <p>Runs right after {@code CorrelationIdFilter} and never continues the chain for a proxied
 * request.
 */
public class ProxyRoutingFilter extends OncePerRequestFilter implements Ordered {

    private static final Logger log = LoggerFactory.getLogger(ProxyRoutingFilter.class);

    static final int ORDER = Ordered.HIGHEST_PRECEDENCE + 10;

    private final HeaderAuthGate gate;
    private final CredentialIssuer issuer;
    private final ProxyForwarder forwarder;
    private final IssuanceMetrics issuanceMetrics;
    private final ProxyMetrics proxyMetrics;
    private final ObjectMapper objectMapper;

    public ProxyRoutingFilter(
            HeaderAuthGate gate,
            CredentialIssuer issuer,
            ProxyForwarder forwarder,
            IssuanceMetrics issuanceMetrics,
            ProxyMetrics proxyMetrics,
            ObjectMapper objectMapper) {
        this.gate = gate;
        this.issuer = issuer;
        this.forwarder = forwarder;
        this.issuanceMetrics = issuanceMetrics;
        this.proxyMetrics = proxyMetrics;
        this.objectMapper = objectMapper;
    }

    @Override
    public int getOrder() {
        return ORDER;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return BridgePaths.isBridgePath(pathWithinApplication(request));
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws IOException {
        long started = System.nanoTime();

        Optional<Identity> identity;
        try {
            identity = gate.extractIdentity(request::getHeader);
        } catch (MissingHeaderException e) {
            reject(response, HttpStatus.UNAUTHORIZED, ProxyMetrics.AUTH_FAILED,
                    "Authentication failed: " + e.getMessage());
            return;
        } catch (InvalidHeaderException e) {
            reject(response, HttpStatus.BAD_REQUEST, ProxyMetrics.INVALID_REQUEST, e.getMessage());
            return;
        }
        if (identity.isEmpty()) {
            reject(response, HttpStatus.UNAUTHORIZED, ProxyMetrics.AUTH_FAILED,
                    "Authentication failed: missing header " + gate.headers().username());
            return;
        }

        String username = identity.get().username();
        CorrelationContextHolder.bindUser(username);

        IssuedCredential credential;
        try {
            credential = issuanceMetrics.record(() -> issuer.issue(identity.get()));
        } catch (IssuanceException e) {
            log.error("Credential issuance failed: user={} kind={} reason={}",
                    username, e.kind(), e.getMessage(), e);
            reject(response, HttpStatus.INTERNAL_SERVER_ERROR, ProxyMetrics.CREDENTIAL_FAILED,
                    e.getMessage());
            return;
        }

        UpstreamResponse upstream;
        try {
            upstream =
                    forwarder.forward(
                            HttpMethod.valueOf(request.getMethod()),
                            pathAndQuery(request),
                            requestHeaders(request),
                            StreamUtils.copyToByteArray(request.getInputStream()),
                            credential.basicAuthorization());
        } catch (IllegalArgumentException e) {
            reject(response, HttpStatus.BAD_REQUEST, ProxyMetrics.INVALID_REQUEST,
                    "Invalid request: " + e.getMessage());
            return;
        } catch (UpstreamUnavailableException e) {
            log.error("Forwarding failed: user={} method={} path={} reason={}",
                    username, request.getMethod(), request.getRequestURI(), e.getMessage());
            reject(response, HttpStatus.BAD_GATEWAY, ProxyMetrics.UPSTREAM_UNAVAILABLE, e.getMessage());
            return;
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        proxyMetrics.forwarded(request.getMethod(), upstream.status(), elapsed);
        log.info("Proxied request: user={} method={} path={} status={} durationMs={}",
                username, request.getMethod(), request.getRequestURI(), upstream.status(),
                elapsed.toMillis());

        response.setStatus(upstream.status());
        upstream.headers().forEach((name, values) -> values.forEach(value -> response.addHeader(name, value)));
        response.setContentLength(upstream.body().length);
        response.getOutputStream().write(upstream.body());
    }

    private void reject(HttpServletResponse response, HttpStatus status, String reason, String message)
            throws IOException {
        log.warn("Proxy request refused: status={} reason={} message={}", status.value(), reason, message);
        proxyMetrics.error(reason);
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(
                response.getOutputStream(), Map.of("error", message == null ? "unknown error" : message));
    }

    private static String pathWithinApplication(HttpServletRequest request) {
        String path = request.getRequestURI();
        String contextPath = request.getContextPath();
        return contextPath != null && !contextPath.isEmpty() && path.startsWith(contextPath)
                ? path.substring(contextPath.length())
                : path;
    }

    private static String pathAndQuery(HttpServletRequest request) {
        String query = request.getQueryString();
        String path = pathWithinApplication(request);
        return query == null ? path : path + "?" + query;
    }

    private static HttpHeaders requestHeaders(HttpServletRequest request) {
        HttpHeaders headers = new HttpHeaders();
        for (String name : Collections.list(request.getHeaderNames())) {
            List<String> values = Collections.list(request.getHeaders(name));
            headers.addAll(name, values);
        }
        return headers;
    }
}
