package com.shelfwise.database.idempotent;

/**
 * Thrown when a reference row can be neither inserted nor found.
 *
 * <p>A uniqueness conflict on its own is never an error; it is resolved by looking the existing
 * row up. This exception means the lookup still came back empty after a reported conflict, or the
 * insert failed for an unrelated reason.
 */
public class SeedResolutionException extends MigrationException {

    private final String name;

    public SeedResolutionException(String name, String message) {
        super(MigrationStep.SEED, message);
        this.name = name;
    }

    public SeedResolutionException(String name, String message, Throwable cause) {
        super(MigrationStep.SEED, message, cause);
        this.name = name;
    }

    /** The reference name that could not be resolved to an identity. */
    public String name() {
        return name;
    }
}
