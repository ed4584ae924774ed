package com.authbridge.bridge.api;

import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness probe for the proxy and container orchestrators.
 *
 * <p>Deliberately touches neither the cache nor the directory; {@code /actuator/health} reports
 * on those.
 */
@RestController
public class HealthController {

    @GetMapping({"/health", BridgePaths.PREFIX + "/health"})
    public Map<String, String> health() {
        return Map.of("status", "OK");
    }
}
