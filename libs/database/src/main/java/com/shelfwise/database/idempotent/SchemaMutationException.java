package com.shelfwise.database.idempotent;

/**
 * Thrown when a structural change fails for any reason other than the object already existing.
 * Duplicate-object errors never surface as this exception.
 */
public class SchemaMutationException extends MigrationException {

    private final String statement;

    public SchemaMutationException(String statement, Throwable cause) {
        super(
                MigrationStep.SCHEMA,
                "Schema change failed [%s]: %s".formatted(statement, cause.getMessage()),
                cause);
        this.statement = statement;
    }

    public String statement() {
        return statement;
    }
}
