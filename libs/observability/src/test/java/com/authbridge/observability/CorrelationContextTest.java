package com.authbridge.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CorrelationContext")
class CorrelationContextTest {

    @Test
    @DisplayName("should reject blank correlation id")
    void shouldRejectBlankCorrelationId() {
        assertThatThrownBy(() -> new CorrelationContext("  ", null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("correlationId");
    }

    @Test
    @DisplayName("withUserId keeps the other fields")
    void withUserIdKeepsOtherFields() {
        var ctx = new CorrelationContext("corr-1", null, "req-1").withUserId("alice");

        assertThat(ctx).isEqualTo(new CorrelationContext("corr-1", "alice", "req-1"));
    }
}
