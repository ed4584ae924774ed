package com.authbridge.bridge.api;

import com.authbridge.bridge.config.AuthBridgeProperties;
import com.authbridge.bridge.infrastructure.metrics.IssuanceMetrics;
import com.authbridge.bridge.infrastructure.web.CorrelationIdFilter;
import com.authbridge.credentials.CredentialIssuer;
import com.authbridge.credentials.HeaderAuthGate;
import com.authbridge.credentials.Identity;
import com.authbridge.credentials.InvalidHeaderException;
import com.authbridge.credentials.IssuanceException;
import com.authbridge.credentials.IssuedCredential;
import com.authbridge.credentials.MissingHeaderException;
import com.authbridge.observability.CorrelationContextHolder;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * The bridge endpoint the reverse proxy calls for every authenticated request.
 *
 * <p>Outcomes of {@code GET /}:
 *
 * <ul>
 *   <li>no username header: {@code 200} with the service name and a hint; nothing is issued
 *   <li>required groups header missing: the same hint plus {@code missingHeader}
 *   <li>header values failing validation: {@code 400 {"error": ...}}
 *   <li>issuance failure: {@code 500 {"error": ...}}
 *   <li>success: {@code 200}, the request headers copied onto the response together with
 *       {@code Authorization: Basic base64(username:password)}
 * </ul>
 *
 * <p>The proxy forwards the {@code Authorization} header to Kibana/Elasticsearch. The endpoint
 * also answers under {@link BridgePaths#PREFIX}.
 */
@RestController
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    static final String INFO_MESSAGE = "Please provide required headers";

    // Hop-by-hop and framing headers describe the incoming request, not our response.
    private static final Set<String> NOT_COPIED =
            Set.of(
                    "connection",
                    "keep-alive",
                    "transfer-encoding",
                    "te",
                    "trailer",
                    "upgrade",
                    "content-length",
                    CorrelationIdFilter.CORRELATION_ID_HEADER.toLowerCase(Locale.ROOT));

    private final HeaderAuthGate gate;
    private final CredentialIssuer issuer;
    private final IssuanceMetrics metrics;
    private final AuthBridgeProperties properties;

    public AuthController(
            HeaderAuthGate gate,
            CredentialIssuer issuer,
            IssuanceMetrics metrics,
            AuthBridgeProperties properties) {
        this.gate = gate;
        this.issuer = issuer;
        this.metrics = metrics;
        this.properties = properties;
    }

    @GetMapping({"/", BridgePaths.PREFIX, BridgePaths.PREFIX + "/"})
    public ResponseEntity<Map<String, Object>> authenticate(HttpServletRequest request) {
        Optional<Identity> identity;
        try {
            identity = gate.extractIdentity(request::getHeader);
        } catch (MissingHeaderException e) {
            log.info("Turning request away: {}", e.getMessage());
            return ResponseEntity.ok(info(e.header()));
        } catch (InvalidHeaderException e) {
            log.warn("Invalid identity headers: {}", e.getMessage());
            return ResponseEntity.badRequest().body(error(e.getMessage()));
        }

        if (identity.isEmpty()) {
            log.debug("Anonymous request, no {} header", gate.headers().username());
            return ResponseEntity.ok(info(null));
        }

        String username = identity.get().username();
        CorrelationContextHolder.bindUser(username);

        IssuedCredential credential;
        try {
            credential = metrics.record(() -> issuer.issue(identity.get()));
        } catch (IssuanceException e) {
            log.error("Credential issuance failed: user={} kind={} reason={}",
                    username, e.kind(), e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
        }

        log.debug("Serving credential: user={} state={} ttlExtended={}",
                username, credential.state(), credential.ttlExtended());

        HttpHeaders headers = copyRequestHeaders(request);
        headers.set(HttpHeaders.AUTHORIZATION, credential.basicAuthorization());
        return ResponseEntity.ok().headers(headers).build();
    }

    private Map<String, Object> info(String missingHeader) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", properties.name());
        body.put("info", INFO_MESSAGE);
        if (missingHeader != null) {
            body.put("missingHeader", missingHeader);
        }
        return body;
    }

    private static Map<String, Object> error(String message) {
        return Map.of("error", message == null ? "unknown error" : message);
    }

    private static HttpHeaders copyRequestHeaders(HttpServletRequest request) {
        HttpHeaders headers = new HttpHeaders();
        for (String name : Collections.list(request.getHeaderNames())) {
            if (NOT_COPIED.contains(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            for (String value : Collections.list(request.getHeaders(name))) {
                headers.add(name, value);
            }
        }
        return headers;
    }
}
