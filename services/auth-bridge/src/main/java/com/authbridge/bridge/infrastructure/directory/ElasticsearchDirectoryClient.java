package com.authbridge.bridge.infrastructure.directory;

import com.authbridge.credentials.DirectoryAuthenticationException;
import com.authbridge.credentials.DirectoryClient;
import com.authbridge.credentials.DirectoryConnectException;
import com.authbridge.credentials.DirectoryUser;
import com.authbridge.credentials.UpsertResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link DirectoryClient} speaking the Elasticsearch security API over HTTP.
 *
 * <ul>
 *   <li>{@code GET /_security/_authenticate} checks the management credentials
 *   <li>{@code POST /_security/user/{username}} creates or replaces a native-realm user
 * </ul>
 *
 * <p>The {@link RestClient} carries the base URL, the management credentials and the timeouts;
 * see {@code DirectoryClientConfig}. Any HTTP answer is a result; transport failures and answers
 * the client cannot process are thrown as {@link DirectoryConnectException}. A 200 whose body is
 * not the expected JSON still means the user was written and counts as an update.
 */
public class ElasticsearchDirectoryClient implements DirectoryClient {

    private static final Logger log = LoggerFactory.getLogger(ElasticsearchDirectoryClient.class);

    static final String AUTHENTICATE_PATH = "/_security/_authenticate";
    static final String USER_PATH = "/_security/user/{username}";

    private static final ObjectMapper JSON = new ObjectMapper();

    private final RestClient restClient;

    public ElasticsearchDirectoryClient(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public void authenticate() {
        try {
            restClient
                    .get()
                    .uri(AUTHENTICATE_PATH)
                    .exchange(
                            (request, response) -> {
                                int status = response.getStatusCode().value();
                                if (status != 200) {
                                    throw new DirectoryAuthenticationException(
                                            status,
                                            "Directory refused management credentials with status "
                                                    + status
                                                    + ": "
                                                    + bodyOf(response));
                                }
                                return null;
                            });
            log.info("Authenticated against directory");
        } catch (ResourceAccessException e) {
            throw new DirectoryConnectException("Cannot reach directory: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new DirectoryConnectException("Unexpected directory response: " + e.getMessage(), e);
        }
    }

    @Override
    public UpsertResult upsertUser(DirectoryUser user) {
        try {
            UpsertResult result =
                    restClient
                            .post()
                            .uri(USER_PATH, user.username())
                            .contentType(MediaType.APPLICATION_JSON)
                            .body(payload(user))
                            .exchange(
                                    (request, response) -> {
                                        int status = response.getStatusCode().value();
                                        if (status != 200) {
                                            return UpsertResult.rejected(status, bodyOf(response));
                                        }
                                        return created(user.username(), bodyOf(response))
                                                ? UpsertResult.created()
                                                : UpsertResult.updated();
                                    });
            log.debug("Upserted directory user: user={} result={}", user.username(), result);
            return result;
        } catch (ResourceAccessException e) {
            throw new DirectoryConnectException("Cannot reach directory: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new DirectoryConnectException("Unexpected directory response: " + e.getMessage(), e);
        }
    }

    /** Reads {@code created} from a put-user answer; anything unreadable counts as not created. */
    static boolean created(String username, String body) {
        if (body == null || body.isBlank()) {
            return false;
        }
        try {
            JsonNode created = JSON.readTree(body).path("created");
            return created.isBoolean() && created.booleanValue();
        } catch (JsonProcessingException e) {
            log.warn("Directory accepted user {} but answered with a non-JSON body", username);
            return false;
        }
    }

    /** Request body of the put-user API. Field names follow the Elasticsearch wire format. */
    static Map<String, Object> payload(DirectoryUser user) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("enabled", user.enabled());
        body.put("email", user.email());
        body.put("password", user.password());
        body.put("metadata", user.metadata());
        body.put("full_name", user.fullName());
        body.put("roles", user.roles());
        return body;
    }

    private static String bodyOf(ClientHttpResponse response) throws IOException {
        return StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
    }
}
