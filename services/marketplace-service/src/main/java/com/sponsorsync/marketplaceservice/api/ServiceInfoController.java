package com.sponsorsync.marketplaceservice.api;

import com.sponsorsync.marketplaceservice.config.MarketplaceServiceProperties;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight runtime information: name, environment and configured store. Needs no identity.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final MarketplaceServiceProperties properties;

    public ServiceInfoController(MarketplaceServiceProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "store", properties.store(),
                "status", "running",
                "timestamp", Instant.now().toString());
    }
}
