/**
 * Flyway migration configuration.
 *
 * <ul>
 *   <li>{@link com.sponsorsync.database.migration.FlywayConfigProperties}: externalized
 *       connection and location settings
 *   <li>{@link com.sponsorsync.database.migration.FlywayMigrationConfig}: Spring
 *       {@code @Configuration} that creates and runs the Flyway instance
 * </ul>
 */
package com.sponsorsync.database.migration;
