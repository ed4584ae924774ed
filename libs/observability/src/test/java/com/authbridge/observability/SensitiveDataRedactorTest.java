package com.authbridge.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SensitiveDataRedactor}: field redaction, case insensitivity,
 * nested structures and custom patterns.
 */
@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Nested
    @DisplayName("Default patterns")
    class DefaultPatterns {

        @Test
        @DisplayName("should redact 'password' field and keep the others")
        void shouldRedactPassword() {
            Map<String, Object> data = Map.of("username", "alice", "password", "s3cr3t");
            Map<String, Object> result = redactor.redact(data);

            assertThat(result.get("username")).isEqualTo("alice");
            assertThat(result.get("password")).isEqualTo(SensitiveDataRedactor.REDACTED);
        }

        @Test
        @DisplayName("should redact keys that merely contain a pattern")
        void shouldRedactContainedPatterns() {
            Map<String, Object> data = Map.of(
                    "secretKey", "k",
                    "fixed-password", "p",
                    "Authorization", "Basic abc");

            assertThat(redactor.redact(data).values()).containsOnly(SensitiveDataRedactor.REDACTED);
        }

        @Test
        @DisplayName("should match case-insensitively")
        void shouldMatchCaseInsensitively() {
            assertThat(redactor.isSensitive("PASSWORD")).isTrue();
            assertThat(redactor.isSensitive("ApiKey")).isTrue();
            assertThat(redactor.isSensitive("username")).isFalse();
        }
    }

    @Nested
    @DisplayName("Nested structures")
    class NestedStructures {

        @Test
        @DisplayName("should redact inside nested maps")
        void shouldRedactNestedMaps() {
            Map<String, Object> directory = new LinkedHashMap<>();
            directory.put("host", "https://es:9200");
            directory.put("password", "changeme");
            Map<String, Object> data = Map.of("directory", directory);

            @SuppressWarnings("unchecked")
            Map<String, Object> nested = (Map<String, Object>) redactor.redact(data).get("directory");

            assertThat(nested)
                    .containsEntry("host", "https://es:9200")
                    .containsEntry("password", SensitiveDataRedactor.REDACTED);
        }

        @Test
        @DisplayName("should walk collections of maps")
        void shouldWalkCollections() {
            Map<String, Object> data = Map.of("users", List.of(Map.of("name", "a", "token", "t")));

            assertThat(redactor.redact(data).get("users"))
                    .isEqualTo(List.of(Map.of("name", "a", "token", SensitiveDataRedactor.REDACTED)));
        }

        @Test
        @DisplayName("should replace a sensitive map value wholesale")
        void shouldReplaceSensitiveMapWholesale() {
            Map<String, Object> data = Map.of("credentials", Map.of("user", "elastic"));

            assertThat(redactor.redact(data).get("credentials")).isEqualTo(SensitiveDataRedactor.REDACTED);
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCases {

        @Test
        @DisplayName("should return empty map for null input")
        void shouldReturnEmptyForNull() {
            assertThat(redactor.redact(null)).isEmpty();
        }

        @Test
        @DisplayName("should treat null field name as not sensitive")
        void shouldHandleNullFieldName() {
            assertThat(redactor.isSensitive(null)).isFalse();
        }

        @Test
        @DisplayName("should preserve insertion order")
        void shouldPreserveOrder() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("b", 1);
            data.put("a", 2);
            data.put("secret", 3);

            assertThat(redactor.redact(data).keySet()).containsExactly("b", "a", "secret");
        }
    }

    @Nested
    @DisplayName("Custom patterns")
    class CustomPatterns {

        @Test
        @DisplayName("should only redact the configured patterns")
        void shouldUseCustomPatterns() {
            var custom = new SensitiveDataRedactor(Set.of("ssn"));

            assertThat(custom.isSensitive("user_ssn")).isTrue();
            assertThat(custom.isSensitive("password")).isFalse();
            assertThat(custom.sensitivePatterns()).containsExactly("ssn");
        }

        @Test
        @DisplayName("should reject empty pattern set")
        void shouldRejectEmptyPatterns() {
            assertThatThrownBy(() -> new SensitiveDataRedactor(Set.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
