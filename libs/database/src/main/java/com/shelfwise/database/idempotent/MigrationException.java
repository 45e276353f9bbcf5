package com.shelfwise.database.idempotent;

/**
 * Base failure of a categorization migration run.
 *
 * <p>Unchecked: every failure is fatal to the run, the surrounding transaction is rolled back and
 * the caller decides whether to re-invoke. Subclasses identify the kind of failure; {@link
 * #step()} identifies where it happened.
 */
public class MigrationException extends RuntimeException {

    private final MigrationStep step;

    public MigrationException(MigrationStep step, String message) {
        super(message);
        this.step = step;
    }

    public MigrationException(MigrationStep step, String message, Throwable cause) {
        super(message, cause);
        this.step = step;
    }

    public MigrationStep step() {
        return step;
    }
}
