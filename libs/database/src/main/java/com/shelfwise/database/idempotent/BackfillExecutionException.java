package com.shelfwise.database.idempotent;

/** Thrown when a backfill rule cannot be applied. */
public class BackfillExecutionException extends MigrationException {

    private final BackfillRule rule;

    public BackfillExecutionException(BackfillRule rule, String message) {
        super(MigrationStep.BACKFILL, message);
        this.rule = rule;
    }

    public BackfillExecutionException(BackfillRule rule, String message, Throwable cause) {
        super(MigrationStep.BACKFILL, message, cause);
        this.rule = rule;
    }

    public BackfillRule rule() {
        return rule;
    }
}
