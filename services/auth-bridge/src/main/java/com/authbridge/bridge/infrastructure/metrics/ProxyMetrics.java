package com.authbridge.bridge.infrastructure.metrics;

import com.authbridge.observability.MetricFactory;
import java.time.Duration;

/**
 * Micrometer instruments for proxy mode.
 *
 * <ul>
 *   <li>{@code auth_bridge.proxy.requests{method,status}}: forwarded requests and their latency
 *   <li>{@code auth_bridge.proxy.errors{reason}}: requests the bridge answered itself
 * </ul>
 */
public class ProxyMetrics {

    static final String REQUESTS = "auth_bridge.proxy.requests";
    static final String ERRORS = "auth_bridge.proxy.errors";

    public static final String AUTH_FAILED = "auth_failed";
    public static final String INVALID_REQUEST = "invalid_request";
    public static final String CREDENTIAL_FAILED = "credential_generation_failed";
    public static final String UPSTREAM_UNAVAILABLE = "upstream_unavailable";

    private final MetricFactory metrics;

    public ProxyMetrics(MetricFactory metrics) {
        this.metrics = metrics;
    }

    public void forwarded(String method, int status, Duration elapsed) {
        metrics.timer(REQUESTS, "Requests forwarded to the cluster",
                        "method", method, "status", String.valueOf(status))
                .record(elapsed);
    }

    public void error(String reason) {
        metrics.counter(ERRORS, "Proxy requests not forwarded", "reason", reason).increment();
    }
}
