package com.shelfwise.database.migration;

import com.shelfwise.database.idempotent.MigrationResult;
import com.shelfwise.database.idempotent.MigrationRunner;
import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flyway version 2: categories table, {@code stock_items.category_id}, seed categories, backfill.
 *
 * <p>Flyway records the version in its history table and owns the transaction; this class only
 * hands Flyway's connection to {@link MigrationRunner#apply(java.sql.Connection)}. The engine is
 * idempotent on its own, so a database that already received these changes by other means (a
 * hand-run script, a restored dump) migrates cleanly.
 */
public class V2__Categorize_stock_items extends BaseJavaMigration {

    private static final Logger log = LoggerFactory.getLogger(V2__Categorize_stock_items.class);

    private final MigrationRunner runner;

    public V2__Categorize_stock_items(MigrationRunner runner) {
        if (runner == null) {
            throw new IllegalArgumentException("runner must not be null");
        }
        this.runner = runner;
    }

    @Override
    public void migrate(Context context) {
        MigrationResult result = runner.apply(context.getConnection());
        log.info(
                "V2 categorization applied: {} column(s) added, {} categories seeded,"
                        + " {} rows backfilled",
                result.columnsAdded(),
                result.categoriesSeeded(),
                result.rowsBackfilled());
    }
}
