package com.authbridge.bridge.config;

import com.authbridge.bridge.infrastructure.metrics.IssuanceMetrics;
import com.authbridge.bridge.infrastructure.metrics.ProxyMetrics;
import com.authbridge.bridge.infrastructure.proxy.ProxyForwarder;
import com.authbridge.bridge.infrastructure.proxy.ProxyRoutingFilter;
import com.authbridge.credentials.CredentialIssuer;
import com.authbridge.credentials.HeaderAuthGate;
import com.authbridge.observability.MetricFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Transparent proxy mode, active with {@code auth-bridge.proxy.enabled=true}.
 *
 * <p>The bridge endpoints then move to {@code /auth-bridge/**}; everything else is forwarded to
 * {@code auth-bridge.proxy.target-url}.
 */
@Configuration
@ConditionalOnProperty(prefix = "auth-bridge.proxy", name = "enabled", havingValue = "true")
public class ProxyConfig {

    private static final Logger log = LoggerFactory.getLogger(ProxyConfig.class);

    @Bean
    public ProxyForwarder proxyForwarder(
            RestClient.Builder restClientBuilder, AuthBridgeProperties properties) {
        AuthBridgeProperties.Proxy proxy = properties.proxy();
        log.info("Proxy mode enabled: target={} timeout={} maxConnections={}",
                proxy.targetUrl(), proxy.timeout(), proxy.maxConnections());
        RestClient restClient =
                restClientBuilder
                        .requestFactory(
                                new HttpComponentsClientHttpRequestFactory(
                                        DirectoryClientConfig.httpClient(
                                                proxy.targetUrl(),
                                                proxy.verifySsl(),
                                                proxy.connectTimeout(),
                                                proxy.timeout(),
                                                proxy.maxConnections())))
                        .build();
        return new ProxyForwarder(restClient, proxy.targetUrl());
    }

    @Bean
    public ProxyMetrics proxyMetrics(MetricFactory metricFactory) {
        return new ProxyMetrics(metricFactory);
    }

    @Bean
    public ProxyRoutingFilter proxyRoutingFilter(
            HeaderAuthGate headerAuthGate,
            CredentialIssuer credentialIssuer,
            ProxyForwarder proxyForwarder,
            IssuanceMetrics issuanceMetrics,
            ProxyMetrics proxyMetrics,
            ObjectMapper objectMapper) {
        return new ProxyRoutingFilter(
                headerAuthGate,
                credentialIssuer,
                proxyForwarder,
                issuanceMetrics,
                proxyMetrics,
                objectMapper);
    }
}
