package com.shelfwise.database.idempotent;

import java.util.Locale;

/** Kinds of structural objects the {@link ExistenceProber} can look up. */
public enum SchemaObjectKind {
    TABLE,
    COLUMN,

    /** Primary key, foreign key, or unique constraint (matched by name). */
    CONSTRAINT;

    /** Whether a probe for this kind must name the table that contains the object. */
    public boolean requiresTable() {
        return this != TABLE;
    }

    String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
