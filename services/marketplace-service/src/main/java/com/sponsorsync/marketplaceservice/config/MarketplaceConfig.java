package com.sponsorsync.marketplaceservice.config;

import com.sponsorsync.database.migration.FlywayMigrationConfig;
import com.sponsorsync.marketplace.access.EventAccess;
import com.sponsorsync.marketplace.access.MarketplaceAccess;
import com.sponsorsync.marketplace.access.ProfileAccess;
import com.sponsorsync.marketplace.access.ProfileProvisioner;
import com.sponsorsync.marketplace.access.SponsorEventTypeAccess;
import com.sponsorsync.marketplace.access.SponsorOfferAccess;
import com.sponsorsync.marketplace.integrity.IntegrityEnforcer;
import com.sponsorsync.marketplace.policy.PolicyEngine;
import com.sponsorsync.marketplace.policy.PolicyTable;
import com.sponsorsync.marketplace.store.EntityStore;
import com.sponsorsync.marketplace.store.InMemoryEntityStore;
import com.sponsorsync.marketplace.store.JdbcEntityStore;
import com.sponsorsync.observability.MetricFactory;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Wires the marketplace core: one store, the policy engine over it, the integrity enforcer, and
 * the facades the controllers call.
 */
@Configuration
@Import(FlywayMigrationConfig.class)
public class MarketplaceConfig {

    private static final Logger log = LoggerFactory.getLogger(MarketplaceConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, MarketplaceServiceProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    /**
     * The entity store named by {@code sponsorsync.service.store}. The relational store depends on
     * the Flyway bean, when there is one, so the schema is migrated before the first query.
     */
    @Bean
    public EntityStore entityStore(
            MarketplaceServiceProperties properties,
            ObjectProvider<JdbcClient> jdbcClient,
            ObjectProvider<TransactionTemplate> transactionTemplate,
            ObjectProvider<Flyway> flyway) {
        if (!properties.usesJdbcStore()) {
            log.info("Using in-memory entity store; data is lost on restart");
            return new InMemoryEntityStore();
        }
        flyway.ifAvailable(f -> log.info("Marketplace schema at version {}",
                f.info().current() == null ? "none" : f.info().current().getVersion()));
        log.info("Using JDBC entity store");
        return new JdbcEntityStore(jdbcClient.getObject(), transactionTemplate.getObject());
    }

    @Bean
    public PolicyEngine policyEngine(EntityStore store, MetricFactory metricFactory) {
        return new PolicyEngine(PolicyTable.marketplace(), store, metricFactory);
    }

    @Bean
    public IntegrityEnforcer integrityEnforcer(Clock clock) {
        return new IntegrityEnforcer(clock);
    }

    @Bean
    public MarketplaceAccess marketplaceAccess(
            EntityStore store, PolicyEngine policyEngine, IntegrityEnforcer integrityEnforcer) {
        return new MarketplaceAccess(store, policyEngine, integrityEnforcer);
    }

    @Bean
    public ProfileProvisioner profileProvisioner(EntityStore store, IntegrityEnforcer integrityEnforcer) {
        return new ProfileProvisioner(store, integrityEnforcer);
    }

    @Bean
    public ProfileAccess profileAccess(MarketplaceAccess access) {
        return new ProfileAccess(access);
    }

    @Bean
    public EventAccess eventAccess(MarketplaceAccess access) {
        return new EventAccess(access);
    }

    @Bean
    public SponsorOfferAccess sponsorOfferAccess(MarketplaceAccess access) {
        return new SponsorOfferAccess(access);
    }

    @Bean
    public SponsorEventTypeAccess sponsorEventTypeAccess(MarketplaceAccess access) {
        return new SponsorEventTypeAccess(access);
    }
}
