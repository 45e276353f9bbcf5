package com.shelfwise.database.idempotent;

/**
 * Aggregate outcome of one successful run.
 *
 * @param columnsAdded foreign-key columns this run added (0 on re-runs)
 * @param categoriesSeeded category rows this run inserted (0 on re-runs)
 * @param rowsBackfilled rows written by the backfill rules, re-runs included
 */
public record MigrationResult(int columnsAdded, int categoriesSeeded, int rowsBackfilled) {}
