package com.authbridge.credentials;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IdentityValidator")
class IdentityValidatorTest {

    @ParameterizedTest
    @ValueSource(strings = {"alice", "alice.smith", "a_b-c", "alice@corp.example", "007"})
    @DisplayName("accepts well-formed usernames")
    void acceptsUsernames(String username) {
        assertThat(IdentityValidator.validate(Identity.of(username, List.of())).valid()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"alice smith", "alice/../bob", "alice:x", "alïce", "a\nb"})
    @DisplayName("rejects usernames with characters outside the allowed set")
    void rejectsUsernames(String username) {
        IdentityValidationResult result = IdentityValidator.validate(Identity.of(username, List.of()));

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).singleElement().asString().contains("invalid characters");
    }

    @Test
    @DisplayName("rejects overlong usernames")
    void rejectsLongUsername() {
        IdentityValidationResult result = IdentityValidator.validate(Identity.of("a".repeat(256), List.of()));

        assertThat(result.errors()).singleElement().asString().contains("maximum length of 255");
    }

    @Test
    @DisplayName("checks email only when present")
    void emailOptional() {
        assertThat(IdentityValidator.validate(new Identity("alice", null, null, List.of())).valid()).isTrue();
        assertThat(IdentityValidator.validate(new Identity("alice", "alice@example.com", null, List.of())).valid())
                .isTrue();
        assertThat(IdentityValidator.validate(new Identity("alice", "alice@", null, List.of())).errors())
                .containsExactly("email format is invalid");
    }

    @Test
    @DisplayName("allows whitespace controls in display names but no other control characters")
    void displayNameControls() {
        assertThat(IdentityValidator.validate(new Identity("alice", null, "Alice\tLiddell", List.of())).valid())
                .isTrue();
        assertThat(IdentityValidator.validate(new Identity("alice", null, "Alice\u0000", List.of())).errors())
                .containsExactly("name contains invalid control characters");
    }

    @Test
    @DisplayName("validates every group")
    void validatesGroups() {
        IdentityValidationResult result = IdentityValidator.validate(
                Identity.of("alice", List.of("eng", "x".repeat(256), "bad\tgroup")));

        assertThat(result.errors()).hasSize(2);
    }

    @Test
    @DisplayName("collects errors from several fields")
    void collectsAllErrors() {
        IdentityValidationResult result = IdentityValidator.validate(
                new Identity("bad user", "nope", "n".repeat(501), List.of()));

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).hasSize(3);
    }
}
