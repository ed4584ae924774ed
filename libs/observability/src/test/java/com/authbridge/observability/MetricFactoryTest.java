package com.authbridge.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link MetricFactory}: metric creation with the service tag.
 */
@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "auth-bridge-test");
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null registry")
        void shouldRejectNullRegistry() {
            assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("should reject blank service name")
        void shouldRejectBlankServiceName() {
            assertThatThrownBy(() -> new MetricFactory(registry, "  "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("serviceName");
        }
    }

    @Test
    @DisplayName("counter carries service and extra tags")
    void counterCarriesTags() {
        Counter counter = factory.counter("auth_bridge.issuance", "Issuance outcomes", "outcome", "issued");
        counter.increment();

        Counter found = registry.find("auth_bridge.issuance")
                .tag("service", "auth-bridge-test")
                .tag("outcome", "issued")
                .counter();
        assertThat(found).isNotNull();
        assertThat(found.count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("same name and tags resolve to the same counter")
    void sameCounterIsReused() {
        factory.counter("auth_bridge.issuance", "d", "outcome", "cache_hit").increment();
        factory.counter("auth_bridge.issuance", "d", "outcome", "cache_hit").increment();

        assertThat(registry.get("auth_bridge.issuance").tag("outcome", "cache_hit").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    @DisplayName("timer records durations")
    void timerRecordsDurations() {
        Timer timer = factory.timer("auth_bridge.issuance.duration", "Issuance latency");
        timer.record(Duration.ofMillis(15));

        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.getId().getTag("service")).isEqualTo("auth-bridge-test");
    }
}
