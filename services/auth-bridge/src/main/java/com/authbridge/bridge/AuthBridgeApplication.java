package com.authbridge.bridge;

import com.authbridge.bridge.config.AuthBridgeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Auth Bridge: turns identity headers set by a trusted reverse proxy into HTTP basic
 * credentials for an Elasticsearch/Kibana deployment.
 *
 * <p>The proxy authenticates the user and forwards {@code Remote-User} and friends. For each
 * request the bridge serves a short-lived password from its cache, or creates one, upserts the
 * matching Elasticsearch user and caches the password encrypted. The response carries the
 * request headers plus {@code Authorization: Basic ...}.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, metrics, Prometheus endpoints
 *   <li>Correlation ID propagation ({@code X-Correlation-ID})
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(AuthBridgeProperties.class)
public class AuthBridgeApplication {

    private static final Logger log = LoggerFactory.getLogger(AuthBridgeApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AuthBridgeApplication.class, args);
        log.info("Auth Bridge started successfully");
    }
}
