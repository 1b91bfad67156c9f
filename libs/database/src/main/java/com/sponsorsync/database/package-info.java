/**
 * Database schema management for the SponsorSync marketplace.
 *
 * <p>The four marketplace tables ({@code profiles}, {@code events}, {@code sponsor_offers},
 * {@code sponsor_event_types}) are created by versioned Flyway scripts under
 * {@code db/migration/sponsorsync}. Access rules are not stored in the database: row-level
 * authorization is evaluated in the application by the marketplace policy engine.
 *
 * @see com.sponsorsync.database.migration.FlywayMigrationConfig
 * @see com.sponsorsync.database.migration.FlywayConfigProperties
 */
package com.sponsorsync.database;
