package com.shelfwise.database.catalog;

/**
 * Snapshot of how far the categorization migration has progressed on a database.
 *
 * @param categoryTablePresent whether the reference table exists
 * @param categoryColumnPresent whether the stock item foreign-key column exists
 * @param categoryCount rows in the reference table (0 if it is absent)
 * @param uncategorizedItems stock items with no category (all items if the column is absent)
 */
public record CategorizationStatus(
        boolean categoryTablePresent,
        boolean categoryColumnPresent,
        long categoryCount,
        long uncategorizedItems) {

    /** Whether both structural changes are in place. */
    public boolean schemaApplied() {
        return categoryTablePresent && categoryColumnPresent;
    }
}
