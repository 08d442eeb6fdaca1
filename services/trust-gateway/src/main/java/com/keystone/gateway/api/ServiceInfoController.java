package com.keystone.gateway.api;

import com.keystone.gateway.config.TrustLayerProperties;
import java.time.Clock;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Public service info; never encrypted, never authenticated. */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final TrustLayerProperties properties;
    private final Clock clock;

    public ServiceInfoController(TrustLayerProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.serviceName(),
                "environment", properties.environment(),
                "issuer", properties.issuer(),
                "status", "running",
                "timestamp", clock.instant().toString());
    }
}
