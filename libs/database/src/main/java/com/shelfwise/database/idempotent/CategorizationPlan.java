package com.shelfwise.database.idempotent;

import java.util.List;

/**
 * Everything one migration run needs to know: where the data lives, which categories to seed, and
 * which rules to apply.
 *
 * @param categoryTable reference table created if absent
 * @param itemTable existing table whose rows are classified
 * @param itemNameColumn free-text column matched by rules
 * @param categoryColumn foreign-key column added if absent and set by rules
 * @param categories categories to seed, in order
 * @param rules backfill rules, in order
 */
public record CategorizationPlan(
        String categoryTable,
        String itemTable,
        String itemNameColumn,
        String categoryColumn,
        List<SeedRecord> categories,
        List<BackfillRule> rules) {

    public static final String DEFAULT_CATEGORY_TABLE = "categories";
    public static final String DEFAULT_ITEM_TABLE = "stock_items";
    public static final String DEFAULT_ITEM_NAME_COLUMN = "item_name";
    public static final String DEFAULT_CATEGORY_COLUMN = "category_id";

    public CategorizationPlan {
        SqlIdentifiers.require(categoryTable, "categoryTable");
        SqlIdentifiers.require(itemTable, "itemTable");
        SqlIdentifiers.require(itemNameColumn, "itemNameColumn");
        SqlIdentifiers.require(categoryColumn, "categoryColumn");
        categories = categories == null ? List.of() : List.copyOf(categories);
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    /** A plan over the default {@code categories} / {@code stock_items} layout. */
    public static CategorizationPlan of(List<SeedRecord> categories, List<BackfillRule> rules) {
        return new CategorizationPlan(
                DEFAULT_CATEGORY_TABLE,
                DEFAULT_ITEM_TABLE,
                DEFAULT_ITEM_NAME_COLUMN,
                DEFAULT_CATEGORY_COLUMN,
                categories,
                rules);
    }

    /** Column definitions of the reference table. */
    String categoryTableDefinition() {
        return "id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                + "name VARCHAR(50) NOT NULL UNIQUE, "
                + "description TEXT";
    }

    /** Constraint clause of the foreign-key column. */
    String categoryColumnConstraint() {
        return "REFERENCES " + categoryTable + "(id)";
    }
}
