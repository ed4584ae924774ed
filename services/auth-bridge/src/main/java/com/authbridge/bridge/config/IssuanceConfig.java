package com.authbridge.bridge.config;

import com.authbridge.credentials.CacheStore;
import com.authbridge.credentials.CredentialCipher;
import com.authbridge.credentials.CredentialIssuer;
import com.authbridge.credentials.DirectoryClient;
import com.authbridge.credentials.GroupRoleConfig;
import com.authbridge.credentials.HeaderAuthGate;
import com.authbridge.credentials.PasswordSource;
import com.authbridge.observability.MetricFactory;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the credential issuance pipeline from {@link AuthBridgeProperties}.
 *
 * <p>Every bean here is a process-wide singleton shared by all requests.
 */
@Configuration
public class IssuanceConfig {

    private static final Logger log = LoggerFactory.getLogger(IssuanceConfig.class);

    static final String SERVICE_NAME = "auth-bridge";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CredentialCipher credentialCipher(AuthBridgeProperties properties) {
        return new CredentialCipher(properties.secretKey());
    }

    @Bean
    public PasswordSource passwordSource(AuthBridgeProperties properties) {
        if (properties.fixedPassword() != null) {
            log.warn("Fixed password configured: every user receives the same password");
            return PasswordSource.fixed(properties.fixedPassword());
        }
        return PasswordSource.random();
    }

    @Bean
    public GroupRoleConfig groupRoleConfig(AuthBridgeProperties properties) {
        return new RoleConfigLoader().load(properties.roles());
    }

    @Bean
    public HeaderAuthGate headerAuthGate(AuthBridgeProperties properties) {
        return new HeaderAuthGate(properties.headers().toHeaderNames(), properties.groupPolicy());
    }

    @Bean
    public CredentialIssuer credentialIssuer(
            CacheStore cacheStore,
            DirectoryClient directoryClient,
            CredentialCipher credentialCipher,
            PasswordSource passwordSource,
            GroupRoleConfig groupRoleConfig,
            AuthBridgeProperties properties,
            Clock clock) {
        return new CredentialIssuer(
                cacheStore,
                directoryClient,
                credentialCipher,
                passwordSource,
                groupRoleConfig,
                properties.issuerSettings(),
                clock);
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry) {
        return new MetricFactory(meterRegistry, SERVICE_NAME);
    }
}
