package com.shelfwise.database.idempotent;

/** The ordered steps of a categorization migration run. */
public enum MigrationStep {

    /** Structural metadata lookups performed by the {@link ExistenceProber}. */
    PROBE,

    /** Conditional DDL: the category table and the item foreign-key column. */
    SCHEMA,

    /** Reference category rows. */
    SEED,

    /** Classification of existing stock items. */
    BACKFILL,

    /** Commit or rollback of the surrounding unit of work. */
    TRANSACTION
}
