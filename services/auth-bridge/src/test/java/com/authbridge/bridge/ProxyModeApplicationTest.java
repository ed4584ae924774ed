package com.authbridge.bridge;

import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.authbridge.bridge.infrastructure.proxy.ProxyForwarder;
import com.authbridge.credentials.testing.RecordingDirectoryClient;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;
import org.springframework.web.client.RestClient;

/**
 * End-to-end tests of transparent proxy mode: the bridge endpoints under {@code /auth-bridge},
 * every other path forwarded to a mocked cluster.
 */
@SpringBootTest(properties = "auth-bridge.proxy.enabled=true")
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Auth Bridge in proxy mode")
class ProxyModeApplicationTest {

    private static final String CLUSTER = "http://cluster.test:9200";

    @TestConfiguration
    static class MockedClusterConfig {

        private final RestClient.Builder builder = RestClient.builder();

        @Bean
        @Primary
        RecordingDirectoryClient recordingDirectoryClient() {
            return new RecordingDirectoryClient();
        }

        @Bean
        MockRestServiceServer cluster() {
            return MockRestServiceServer.bindTo(builder).build();
        }

        @Bean
        @Primary
        ProxyForwarder mockedClusterForwarder(MockRestServiceServer cluster) {
            return new ProxyForwarder(builder.build(), CLUSTER);
        }
    }

    @Autowired private MockMvc mockMvc;
    @Autowired private MockRestServiceServer cluster;

    @BeforeEach
    void resetCluster() {
        cluster.reset();
    }

    @Test
    @DisplayName("bridge endpoints answer under /auth-bridge")
    void bridgeEndpoints() throws Exception {
        mockMvc.perform(get("/auth-bridge/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OK"));
        mockMvc.perform(get("/auth-bridge/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.info").value("Please provide required headers"));
        mockMvc.perform(get("/auth-bridge/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.proxy.enabled").value(true));
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
        cluster.verify();
    }

    @Test
    @DisplayName("other paths are forwarded with the user's credential")
    void forwardsToCluster() throws Exception {
        cluster.expect(requestTo(CLUSTER + "/"))
                .andExpect(header(HttpHeaders.AUTHORIZATION, Matchers.startsWith("Basic ")))
                .andRespond(withSuccess("{\"tagline\":\"You Know, for Search\"}", MediaType.APPLICATION_JSON));
        cluster.expect(requestTo(CLUSTER + "/health"))
                .andRespond(withSuccess("{\"cluster\":\"green\"}", MediaType.APPLICATION_JSON));

        mockMvc.perform(get("/").header("Remote-User", "heidi").header("Remote-Groups", "eng"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tagline").value("You Know, for Search"))
                .andExpect(MockMvcResultMatchers.header().exists("X-Correlation-ID"));
        mockMvc.perform(get("/health").header("Remote-User", "heidi").header("Remote-Groups", "eng"))
                .andExpect(status().isOk())
                .andExpect(content().json("{\"cluster\":\"green\"}"));
        cluster.verify();
    }

    @Test
    @DisplayName("anonymous requests outside the bridge paths are refused with 401")
    void anonymousRefused() throws Exception {
        mockMvc.perform(get("/_search"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value(Matchers.containsString("Remote-User")));
        cluster.verify();
    }
}
