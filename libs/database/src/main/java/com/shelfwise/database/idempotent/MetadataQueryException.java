package com.shelfwise.database.idempotent;

/** Thrown when structural metadata cannot be read (connectivity or permissions). */
public class MetadataQueryException extends MigrationException {

    private final SchemaObjectKind kind;
    private final String objectName;

    public MetadataQueryException(SchemaObjectKind kind, String objectName, Throwable cause) {
        super(
                MigrationStep.PROBE,
                "Cannot determine whether %s '%s' exists: %s"
                        .formatted(kind.label(), objectName, cause.getMessage()),
                cause);
        this.kind = kind;
        this.objectName = objectName;
    }

    public SchemaObjectKind kind() {
        return kind;
    }

    public String objectName() {
        return objectName;
    }
}
