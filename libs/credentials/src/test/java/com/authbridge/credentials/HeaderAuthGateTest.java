package com.authbridge.credentials;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HeaderAuthGate")
class HeaderAuthGateTest {

    private final HeaderAuthGate gate = new HeaderAuthGate(HeaderNames.DEFAULTS, GroupPolicy.PERMISSIVE);

    private static Map<String, String> headers(String... pairs) {
        Map<String, String> map = new HashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return map;
    }

    @Nested
    @DisplayName("anonymous requests")
    class Anonymous {

        @Test
        @DisplayName("no username header yields no identity")
        void absentUsername() {
            assertThat(gate.extractIdentity(headers("Remote-Groups", "eng")::get)).isEmpty();
        }

        @Test
        @DisplayName("a blank username header yields no identity")
        void blankUsername() {
            assertThat(gate.extractIdentity(headers("Remote-User", "   ")::get)).isEmpty();
        }
    }

    @Nested
    @DisplayName("identity extraction")
    class Extraction {

        @Test
        @DisplayName("reads every identity header")
        void readsAllHeaders() {
            Identity identity = gate.extractIdentity(headers(
                    "Remote-User", "alice",
                    "Remote-Groups", "eng,ops",
                    "Remote-Email", "alice@example.com",
                    "Remote-Name", "Alice Liddell")::get).orElseThrow();

            assertThat(identity.username()).isEqualTo("alice");
            assertThat(identity.groups()).containsExactly("eng", "ops");
            assertThat(identity.email()).isEqualTo("alice@example.com");
            assertThat(identity.displayName()).isEqualTo("Alice Liddell");
        }

        @Test
        @DisplayName("trims groups and drops empty entries")
        void normalizesGroups() {
            Identity identity = gate.extractIdentity(headers(
                    "Remote-User", "alice",
                    "Remote-Groups", " eng , ,ops,")::get).orElseThrow();

            assertThat(identity.groups()).containsExactly("eng", "ops");
        }

        @Test
        @DisplayName("a missing groups header means no groups when not required")
        void optionalGroups() {
            Identity identity = gate.extractIdentity(headers("Remote-User", "alice")::get).orElseThrow();

            assertThat(identity.groups()).isEmpty();
            assertThat(identity.email()).isNull();
            assertThat(identity.displayName()).isNull();
        }

        @Test
        @DisplayName("honours custom header names")
        void customHeaderNames() {
            HeaderAuthGate custom = new HeaderAuthGate(
                    new HeaderNames("X-Forwarded-User", "X-Forwarded-Groups", null, ""),
                    GroupPolicy.PERMISSIVE);

            Identity identity = custom.extractIdentity(headers(
                    "X-Forwarded-User", "bob",
                    "X-Forwarded-Groups", "admins",
                    "Remote-Email", "bob@example.com")::get).orElseThrow();

            assertThat(identity.username()).isEqualTo("bob");
            assertThat(identity.groups()).containsExactly("admins");
            assertThat(identity.email()).isEqualTo("bob@example.com");
            assertThat(custom.headers().name()).isEqualTo("Remote-Name");
        }
    }

    @Nested
    @DisplayName("group policy")
    class Policy {

        @Test
        @DisplayName("a required groups header must be present")
        void requiredGroups() {
            HeaderAuthGate strict = new HeaderAuthGate(HeaderNames.DEFAULTS, new GroupPolicy(true, false, Set.of()));

            assertThatThrownBy(() -> strict.extractIdentity(headers("Remote-User", "alice")::get))
                    .isInstanceOfSatisfying(MissingHeaderException.class, e ->
                            assertThat(e.header()).isEqualTo("Remote-Groups"))
                    .hasMessage("Header not provided: Remote-Groups");
        }

        @Test
        @DisplayName("a required but empty groups header is accepted")
        void requiredButEmpty() {
            HeaderAuthGate strict = new HeaderAuthGate(HeaderNames.DEFAULTS, new GroupPolicy(true, false, Set.of()));

            assertThat(strict.extractIdentity(headers("Remote-User", "alice", "Remote-Groups", "")::get))
                    .hasValueSatisfying(identity -> assertThat(identity.groups()).isEmpty());
        }

        @Test
        @DisplayName("whitelist matches case-insensitively")
        void whitelistCaseInsensitive() {
            HeaderAuthGate whitelisted = new HeaderAuthGate(HeaderNames.DEFAULTS,
                    new GroupPolicy(false, true, Set.of("Engineering")));

            Identity identity = whitelisted.extractIdentity(
                    headers("Remote-User", "alice", "Remote-Groups", "engineering")::get).orElseThrow();

            assertThat(identity.groups()).containsExactly("engineering");
        }

        @Test
        @DisplayName("a group outside the whitelist is rejected")
        void whitelistRejects() {
            HeaderAuthGate whitelisted = new HeaderAuthGate(HeaderNames.DEFAULTS,
                    new GroupPolicy(false, true, Set.of("eng")));

            assertThatThrownBy(() -> whitelisted.extractIdentity(
                    headers("Remote-User", "alice", "Remote-Groups", "eng,root")::get))
                    .isInstanceOfSatisfying(InvalidHeaderException.class, e ->
                            assertThat(e.errors()).containsExactly("group 'root' is not in whitelist"));
        }
    }

    @Test
    @DisplayName("reports every invalid value at once")
    void collectsValidationErrors() {
        assertThatThrownBy(() -> gate.extractIdentity(headers(
                "Remote-User", "alice smith",
                "Remote-Email", "not-an-email")::get))
                .isInstanceOfSatisfying(InvalidHeaderException.class, e -> {
                    assertThat(e.errors()).hasSize(2);
                    assertThat(e.getMessage()).contains("username").contains("email");
                });
    }
}
