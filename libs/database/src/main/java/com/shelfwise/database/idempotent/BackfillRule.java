package com.shelfwise.database.idempotent;

import java.util.Locale;

/**
 * Classification rule: stock items whose name equals {@code itemName}, ignoring ASCII case, belong
 * to the category named {@code categoryName}.
 *
 * <p>The item name is stored trimmed and lower-cased with {@link Locale#ROOT}; no Unicode case
 * folding is applied. The category name is kept as given because category names are
 * case-sensitive.
 *
 * @param itemName normalized item-name predicate
 * @param categoryName target category name
 */
public record BackfillRule(String itemName, String categoryName) {

    public BackfillRule {
        if (itemName == null || itemName.isBlank()) {
            throw new IllegalArgumentException("itemName must not be null or blank");
        }
        if (categoryName == null || categoryName.isBlank()) {
            throw new IllegalArgumentException("categoryName must not be null or blank");
        }
        itemName = normalize(itemName);
    }

    /** Applies the same normalization the rule applies to its own predicate. */
    public static String normalize(String itemName) {
        return itemName.strip().toLowerCase(Locale.ROOT);
    }
}
