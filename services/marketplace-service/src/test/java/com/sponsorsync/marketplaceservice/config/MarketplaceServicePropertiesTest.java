package com.sponsorsync.marketplaceservice.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MarketplaceServiceProperties")
class MarketplaceServicePropertiesTest {

    @Test
    @DisplayName("accepts valid properties")
    void acceptsValidProperties() {
        var props = new MarketplaceServiceProperties("marketplace-service", "production", "jdbc");
        assertThat(props.name()).isEqualTo("marketplace-service");
        assertThat(props.environment()).isEqualTo("production");
        assertThat(props.usesJdbcStore()).isTrue();
    }

    @Test
    @DisplayName("defaults environment to 'development' and store to 'memory'")
    void defaults() {
        var props = new MarketplaceServiceProperties("marketplace-service", null, " ");
        assertThat(props.environment()).isEqualTo("development");
        assertThat(props.store()).isEqualTo(MarketplaceServiceProperties.STORE_MEMORY);
        assertThat(props.usesJdbcStore()).isFalse();
    }
}
