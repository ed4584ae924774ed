package com.authbridge.bridge.config;

import com.authbridge.bridge.infrastructure.directory.ElasticsearchDirectoryClient;
import com.authbridge.bridge.infrastructure.directory.VerifiedDirectoryClient;
import com.authbridge.credentials.DirectoryClient;
import java.security.GeneralSecurityException;
import java.time.Duration;
import javax.net.ssl.SSLContext;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.ssl.NoopHostnameVerifier;
import org.apache.hc.client5.http.ssl.SSLConnectionSocketFactoryBuilder;
import org.apache.hc.client5.http.ssl.TrustAllStrategy;
import org.apache.hc.core5.ssl.SSLContextBuilder;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Wires the Elasticsearch directory client.
 *
 * <p>The HTTP transport is Apache HttpClient 5 with explicit connect and response timeouts and
 * no automatic retries. Proxy mode builds its client here too. With {@code auth-bridge.directory.verify-ssl=false} any certificate and
 * host name is accepted, for clusters running on self-signed certificates.
 */
@Configuration
public class DirectoryClientConfig {

    private static final Logger log = LoggerFactory.getLogger(DirectoryClientConfig.class);

    @Bean
    public DirectoryClient directoryClient(
            RestClient.Builder restClientBuilder, AuthBridgeProperties properties) {
        AuthBridgeProperties.Directory directory = properties.directory();
        if (properties.dryRun()) {
            log.warn("Dry run enabled: users will not be written to {}", directory.host());
        }
        RestClient restClient =
                directoryRestClient(
                        restClientBuilder.requestFactory(
                                new HttpComponentsClientHttpRequestFactory(httpClient(directory))),
                        directory);
        return new VerifiedDirectoryClient(new ElasticsearchDirectoryClient(restClient));
    }

    /** Applies base URL and management credentials. Separate from the transport for tests. */
    static RestClient directoryRestClient(
            RestClient.Builder builder, AuthBridgeProperties.Directory directory) {
        builder.baseUrl(directory.host());
        if (directory.username() != null && !directory.username().isEmpty()) {
            String password = directory.password() == null ? "" : directory.password();
            builder.defaultHeaders(headers -> headers.setBasicAuth(directory.username(), password));
        }
        return builder.build();
    }

    static CloseableHttpClient httpClient(AuthBridgeProperties.Directory directory) {
        return httpClient(
                directory.host(),
                directory.verifySsl(),
                directory.connectTimeout(),
                directory.readTimeout(),
                0);
    }

    /**
     * Pooled HttpClient 5 for one cluster. Redirects are handed back to the caller and failed
     * requests are never retried.
     *
     * @param maxConnections pool bound; zero keeps the HttpClient defaults
     */
    static CloseableHttpClient httpClient(
            String target,
            boolean verifySsl,
            Duration connectTimeout,
            Duration responseTimeout,
            int maxConnections) {
        PoolingHttpClientConnectionManagerBuilder connectionManager =
                PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(
                                ConnectionConfig.custom()
                                        .setConnectTimeout(timeout(connectTimeout))
                                        .setSocketTimeout(timeout(responseTimeout))
                                        .build());
        if (maxConnections > 0) {
            connectionManager.setMaxConnTotal(maxConnections).setMaxConnPerRoute(maxConnections);
        }
        if (!verifySsl) {
            log.warn("TLS verification disabled for {}", target);
            connectionManager.setSSLSocketFactory(
                    SSLConnectionSocketFactoryBuilder.create()
                            .setSslContext(trustAllContext())
                            .setHostnameVerifier(NoopHostnameVerifier.INSTANCE)
                            .build());
        }
        return HttpClients.custom()
                .setConnectionManager(connectionManager.build())
                .setDefaultRequestConfig(
                        RequestConfig.custom()
                                .setResponseTimeout(timeout(responseTimeout))
                                .build())
                .disableAutomaticRetries()
                .disableRedirectHandling()
                .build();
    }

    private static Timeout timeout(Duration duration) {
        return Timeout.ofMilliseconds(duration.toMillis());
    }

    private static SSLContext trustAllContext() {
        try {
            return SSLContextBuilder.create().loadTrustMaterial(TrustAllStrategy.INSTANCE).build();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("could not create the trust-all ssl context", e);
        }
    }
}
