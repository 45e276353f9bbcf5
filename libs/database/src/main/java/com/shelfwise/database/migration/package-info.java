/**
 * Flyway wiring for the inventory database.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.shelfwise.database.migration.FlywayConfigProperties}: connection settings and
 *       SQL migration locations
 *   <li>{@link com.shelfwise.database.migration.CategorizationProperties}: category seeds and
 *       backfill rules
 *   <li>{@link com.shelfwise.database.migration.FlywayMigrationConfig}: Spring
 *       {@code @Configuration} that creates the data source, runner and Flyway beans
 *   <li>{@link com.shelfwise.database.migration.V2__Categorize_stock_items}: the categorization
 *       step as a Flyway Java migration
 * </ul>
 */
package com.shelfwise.database.migration;
