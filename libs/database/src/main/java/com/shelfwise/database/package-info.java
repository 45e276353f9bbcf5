/**
 * Database support for the Shelfwise inventory platform.
 *
 * <p>This package provides Flyway-based migrations for the inventory database together with the
 * idempotent categorization engine that Flyway runs as a Java migration.
 *
 * <ul>
 *   <li>{@code V1__create_stock_items.sql}: the inventory table
 *   <li>{@link com.shelfwise.database.migration.V2__Categorize_stock_items}: categories table,
 *       foreign-key column, seed categories and backfill
 *   <li>{@link com.shelfwise.database.catalog}: read-side status and category lookups
 * </ul>
 *
 * @see com.shelfwise.database.migration.FlywayMigrationConfig
 * @see com.shelfwise.database.idempotent.MigrationRunner
 */
package com.shelfwise.database;
