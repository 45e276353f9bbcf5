package com.shelfwise.database.migration;

import com.shelfwise.database.catalog.CategoryAliases;
import com.shelfwise.database.idempotent.BackfillRule;
import com.shelfwise.database.idempotent.CategorizationPlan;
import com.shelfwise.database.idempotent.SeedRecord;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Which categories to seed and how to classify existing stock items.
 *
 * <p>Bound from the {@code shelfwise.categorization.*} prefix. Every field is optional; the compact
 * constructor fills in the inventory defaults before Bean Validation runs.
 *
 * <pre>
 * shelfwise:
 *   categorization:
 *     service-name: inventory-service
 *     categories:
 *       - name: Drinks
 *         description: Beverages and liquid refreshments
 *     rules:
 *       - item-name: coke
 *         category: drinks      # canonical name or a known alias
 * </pre>
 *
 * @param serviceName service tag for migration metrics
 * @param categoryTable reference table name
 * @param itemTable stock item table name
 * @param itemNameColumn column the rules match against
 * @param categoryColumn foreign-key column to add and backfill
 * @param categories categories to seed, in order
 * @param rules backfill rules, in order; later rules win on overlap
 */
@Validated
@ConfigurationProperties(prefix = "shelfwise.categorization")
public record CategorizationProperties(
        String serviceName,
        String categoryTable,
        String itemTable,
        String itemNameColumn,
        String categoryColumn,
        @Valid List<Category> categories,
        @Valid List<Rule> rules) {

    public static final String DEFAULT_SERVICE_NAME = "shelfwise-database";

    public static final List<Category> DEFAULT_CATEGORIES =
            List.of(
                    new Category(CategoryAliases.DRINKS, "Beverages and liquid refreshments"),
                    new Category(CategoryAliases.SNACKS, "Chips and savory snacks"),
                    new Category(CategoryAliases.BISCUITS, "Cookies and biscuits"));

    public static final List<Rule> DEFAULT_RULES =
            List.of(
                    new Rule("coke", CategoryAliases.DRINKS),
                    new Rule("lays", CategoryAliases.SNACKS),
                    new Rule("bisckets", CategoryAliases.BISCUITS));

    public CategorizationProperties {
        serviceName = orDefault(serviceName, DEFAULT_SERVICE_NAME);
        categoryTable = orDefault(categoryTable, CategorizationPlan.DEFAULT_CATEGORY_TABLE);
        itemTable = orDefault(itemTable, CategorizationPlan.DEFAULT_ITEM_TABLE);
        itemNameColumn = orDefault(itemNameColumn, CategorizationPlan.DEFAULT_ITEM_NAME_COLUMN);
        categoryColumn = orDefault(categoryColumn, CategorizationPlan.DEFAULT_CATEGORY_COLUMN);
        categories =
                categories == null || categories.isEmpty()
                        ? DEFAULT_CATEGORIES
                        : List.copyOf(categories);
        rules = rules == null ? DEFAULT_RULES : List.copyOf(rules);
    }

    /** Properties with every default applied. */
    public static CategorizationProperties defaults() {
        return new CategorizationProperties(null, null, null, null, null, null, null);
    }

    /**
     * Converts the bound configuration into an engine plan. Rule targets given as aliases (for
     * example {@code chips}) are resolved to canonical category names.
     */
    public CategorizationPlan toPlan() {
        List<SeedRecord> seeds =
                categories.stream().map(c -> new SeedRecord(c.name(), c.description())).toList();
        List<BackfillRule> backfillRules =
                rules.stream()
                        .map(
                                r ->
                                        new BackfillRule(
                                                r.itemName(),
                                                CategoryAliases.resolve(r.category())))
                        .toList();
        return new CategorizationPlan(
                categoryTable, itemTable, itemNameColumn, categoryColumn, seeds, backfillRules);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    /**
     * A category to seed.
     *
     * @param name unique category name (case-sensitive)
     * @param description optional description
     */
    public record Category(@NotBlank String name, String description) {}

    /**
     * A backfill rule.
     *
     * @param itemName stock item name to match, ignoring case
     * @param category target category name or alias
     */
    public record Rule(@NotBlank String itemName, @NotBlank String category) {}
}
