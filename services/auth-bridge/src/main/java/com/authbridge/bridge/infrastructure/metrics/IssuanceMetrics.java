package com.authbridge.bridge.infrastructure.metrics;

import com.authbridge.credentials.IssuanceState;
import com.authbridge.credentials.IssuedCredential;
import com.authbridge.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Micrometer instruments for credential issuance.
 *
 * <ul>
 *   <li>{@code auth_bridge.issuance{outcome=cache_hit|issued|failed}}
 *   <li>{@code auth_bridge.ttl.extended}
 *   <li>{@code auth_bridge.issuance.duration}
 * </ul>
 */
@Component
public class IssuanceMetrics {

    static final String ISSUANCE = "auth_bridge.issuance";
    static final String TTL_EXTENDED = "auth_bridge.ttl.extended";
    static final String DURATION = "auth_bridge.issuance.duration";

    private final Counter cacheHits;
    private final Counter issued;
    private final Counter failed;
    private final Counter ttlExtended;
    private final Timer duration;

    public IssuanceMetrics(MetricFactory metrics) {
        this.cacheHits = metrics.counter(ISSUANCE, "Credentials served from cache", "outcome", "cache_hit");
        this.issued = metrics.counter(ISSUANCE, "Credentials newly issued", "outcome", "issued");
        this.failed = metrics.counter(ISSUANCE, "Failed issuance attempts", "outcome", "failed");
        this.ttlExtended = metrics.counter(TTL_EXTENDED, "Cache entries whose expiry was extended");
        this.duration = metrics.timer(DURATION, "Time to serve or issue a credential");
    }

    /**
     * Runs one issuance, timing it and counting its outcome. Failures are counted and rethrown.
     */
    public IssuedCredential record(Supplier<IssuedCredential> issuance) {
        Timer.Sample sample = Timer.start();
        try {
            IssuedCredential credential = issuance.get();
            if (credential.state() == IssuanceState.ISSUED) {
                issued.increment();
            } else {
                cacheHits.increment();
            }
            if (credential.ttlExtended()) {
                ttlExtended.increment();
            }
            return credential;
        } catch (RuntimeException e) {
            failed.increment();
            throw e;
        } finally {
            sample.stop(duration);
        }
    }
}
