package com.sponsorsync.marketplaceservice;

import com.sponsorsync.marketplaceservice.config.MarketplaceServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * SponsorSync marketplace service: the REST layer over the marketplace access-control core.
 *
 * <p>Resolves the caller's identity from the {@code X-Principal-Id} header, delegates every request
 * to the typed access facades, and maps denials, integrity violations and missing rows to
 * RFC 7807 problem responses.
 */
@SpringBootApplication
@EnableConfigurationProperties(MarketplaceServiceProperties.class)
public class MarketplaceServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(MarketplaceServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(MarketplaceServiceApplication.class, args);
        log.info("SponsorSync marketplace service started");
    }
}
