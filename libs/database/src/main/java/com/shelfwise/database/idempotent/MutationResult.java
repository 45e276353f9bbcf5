package com.shelfwise.database.idempotent;

/**
 * Outcome of a conditional schema change.
 *
 * @param applied {@code true} only if this call issued the DDL and the database accepted it
 */
public record MutationResult(boolean applied) {

    private static final MutationResult CREATED = new MutationResult(true);
    private static final MutationResult UNCHANGED = new MutationResult(false);

    /** This call changed the schema. */
    public static MutationResult created() {
        return CREATED;
    }

    /** The object was already there, or another session created it first. */
    public static MutationResult unchanged() {
        return UNCHANGED;
    }
}
