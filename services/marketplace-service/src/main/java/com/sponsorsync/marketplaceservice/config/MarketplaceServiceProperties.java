package com.sponsorsync.marketplaceservice.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service configuration bound from {@code sponsorsync.service.*}.
 *
 * <pre>
 * sponsorsync:
 *   service:
 *     name: marketplace-service
 *     environment: production
 *     store: jdbc
 * </pre>
 *
 * @param name        service name, used as the {@code service} metric tag. Required.
 * @param environment deployment environment (development, staging, production)
 * @param store       entity store backend: {@code memory} or {@code jdbc}
 */
@ConfigurationProperties(prefix = "sponsorsync.service")
@Validated
public record MarketplaceServiceProperties(
        @NotBlank String name,
        String environment,
        @Pattern(regexp = "memory|jdbc") String store) {

    public static final String STORE_MEMORY = "memory";
    public static final String STORE_JDBC = "jdbc";

    public MarketplaceServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (store == null || store.isBlank()) {
            store = STORE_MEMORY;
        }
    }

    public boolean usesJdbcStore() {
        return STORE_JDBC.equals(store);
    }
}
