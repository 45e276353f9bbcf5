package com.shelfwise.database.catalog;

import java.util.Locale;
import java.util.Map;

/**
 * Maps the ways people name a category ("chips", "beverages", "cookie") to the canonical category
 * names stored in the reference table.
 */
public final class CategoryAliases {

    public static final String DRINKS = "Drinks";
    public static final String SNACKS = "Snacks";
    public static final String BISCUITS = "Biscuits";

    private static final Map<String, String> ALIASES =
            Map.ofEntries(
                    Map.entry("drink", DRINKS),
                    Map.entry("drinks", DRINKS),
                    Map.entry("beverage", DRINKS),
                    Map.entry("beverages", DRINKS),
                    Map.entry("snack", SNACKS),
                    Map.entry("snacks", SNACKS),
                    Map.entry("chips", SNACKS),
                    Map.entry("biscuit", BISCUITS),
                    Map.entry("biscuits", BISCUITS),
                    Map.entry("cookie", BISCUITS),
                    Map.entry("cookies", BISCUITS));

    private CategoryAliases() {
        // utility class
    }

    /**
     * Resolves an alias to its canonical category name.
     *
     * @param input user-facing spelling, any case
     * @return the canonical name, or the trimmed input unchanged if it is not a known alias
     */
    public static String resolve(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("category must not be null or blank");
        }
        String trimmed = input.strip();
        return ALIASES.getOrDefault(trimmed.toLowerCase(Locale.ROOT), trimmed);
    }
}
