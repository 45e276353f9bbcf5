package com.shelfwise.database.idempotent;

/**
 * One reference row to seed.
 *
 * @param name unique, case-sensitive name
 * @param description optional free text; may be null
 */
public record SeedRecord(String name, String description) {

    public SeedRecord {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
    }
}
