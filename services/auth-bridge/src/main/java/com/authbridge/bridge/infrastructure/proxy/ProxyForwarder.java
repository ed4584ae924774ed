package com.authbridge.bridge.infrastructure.proxy;

import com.authbridge.bridge.infrastructure.web.CorrelationIdFilter;
import java.net.URI;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Sends one client request on to the cluster and reads the answer back.
 *
 * <p>The caller's {@code Authorization} is replaced by the issued credential. Hop-by-hop headers
 * are dropped both ways, and the cluster's authentication challenges never reach the client.
 * Redirects and error statuses are returned as they are.
 */
public class ProxyForwarder {

    private static final Set<String> HOP_BY_HOP =
            Set.of(
                    "connection",
                    "keep-alive",
                    "proxy-authenticate",
                    "proxy-authorization",
                    "te",
                    "trailer",
                    "transfer-encoding",
                    "upgrade");

    static final Set<String> NOT_FORWARDED =
            union(HOP_BY_HOP, "host", "content-length", "authorization");

    static final Set<String> NOT_RETURNED =
            union(
                    HOP_BY_HOP,
                    "content-length",
                    "www-authenticate",
                    "x-elastic-product",
                    CorrelationIdFilter.CORRELATION_ID_HEADER.toLowerCase(Locale.ROOT));

    private final RestClient restClient;
    private final String targetUrl;

    public ProxyForwarder(RestClient restClient, String targetUrl) {
        this.restClient = restClient;
        this.targetUrl = targetUrl;
    }

    public String targetUrl() {
        return targetUrl;
    }

    /**
     * Forwards a request.
     *
     * @param pathAndQuery raw path and query string, as received
     * @param authorization value of the {@code Authorization} header sent to the cluster
     * @throws IllegalArgumentException if the path is not a valid URI
     * @throws UpstreamUnavailableException if the cluster cannot be reached or read
     */
    public UpstreamResponse forward(
            HttpMethod method,
            String pathAndQuery,
            HttpHeaders requestHeaders,
            byte[] body,
            String authorization) {
        URI uri = URI.create(targetUrl + pathAndQuery);
        try {
            RestClient.RequestBodySpec request =
                    restClient
                            .method(method)
                            .uri(uri)
                            .headers(
                                    headers -> {
                                        copy(requestHeaders, headers, NOT_FORWARDED);
                                        headers.set(HttpHeaders.AUTHORIZATION, authorization);
                                    });
            if (body != null && body.length > 0) {
                request.body(body);
            }
            return request.exchange(
                    (clientRequest, response) -> {
                        HttpHeaders returned = new HttpHeaders();
                        copy(response.getHeaders(), returned, NOT_RETURNED);
                        return new UpstreamResponse(
                                response.getStatusCode().value(),
                                returned,
                                StreamUtils.copyToByteArray(response.getBody()));
                    });
        } catch (RestClientException e) {
            throw new UpstreamUnavailableException(
                    "Cluster unavailable at " + targetUrl + ": " + e.getMessage(), e);
        }
    }

    private static void copy(HttpHeaders from, HttpHeaders to, Set<String> skipped) {
        for (Map.Entry<String, List<String>> header : from.entrySet()) {
            if (!skipped.contains(header.getKey().toLowerCase(Locale.ROOT))) {
                to.addAll(header.getKey(), header.getValue());
            }
        }
    }

    private static Set<String> union(Set<String> base, String... more) {
        Set<String> all = new HashSet<>(base);
        all.addAll(List.of(more));
        return Set.copyOf(all);
    }
}
