package com.shelfwise.database.idempotent;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies additive structural changes only when the target object is missing.
 *
 * <p>The {@link ExistenceProber} is the fast path. Between the probe and the DDL another process
 * may create the same object; the database's duplicate-object error is then taken as the answer
 * and the call reports {@code applied=false}. Some stores report a lost race differently:
 * PostgreSQL fails the losing {@code CREATE TABLE} with a unique violation on its own catalog. Any
 * other DDL failure is therefore followed by a second probe, and an object that exists by then was
 * created by someone else. On stores with transactional DDL the statement runs under a savepoint
 * so the failed statement does not poison the caller's transaction.
 *
 * <p>The DDL always runs on the caller's connection and inside the caller's transaction.
 */
public class ConditionalSchemaMutator {

    private static final Logger log = LoggerFactory.getLogger(ConditionalSchemaMutator.class);

    private final Connection connection;
    private final ExistenceProber prober;

    public ConditionalSchemaMutator(Connection connection, ExistenceProber prober) {
        if (connection == null) {
            throw new IllegalArgumentException("connection must not be null");
        }
        if (prober == null) {
            throw new IllegalArgumentException("prober must not be null");
        }
        this.connection = connection;
        this.prober = prober;
    }

    /**
     * Adds {@code column} to {@code table} unless it is already there.
     *
     * @param table existing table to alter
     * @param column column to add
     * @param type SQL type, e.g. {@code INTEGER}
     * @param constraints column constraint clause, e.g. {@code REFERENCES categories(id)}; may be
     *     null or blank
     * @return whether this call added the column
     * @throws SchemaMutationException if the DDL fails for a reason other than a duplicate column
     */
    public MutationResult ensureColumn(
            String table, String column, String type, String constraints) {
        SqlIdentifiers.require(table, "table");
        SqlIdentifiers.require(column, "column");
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be null or blank");
        }

        if (prober.exists(SchemaObjectKind.COLUMN, column, table)) {
            log.debug("Column {}.{} already present, no change", table, column);
            return MutationResult.unchanged();
        }

        StringBuilder ddl =
                new StringBuilder("ALTER TABLE ")
                        .append(table)
                        .append(" ADD COLUMN ")
                        .append(column)
                        .append(' ')
                        .append(type.strip());
        if (constraints != null && !constraints.isBlank()) {
            ddl.append(' ').append(constraints.strip());
        }
        return execute(
                ddl.toString(),
                table + "." + column,
                () -> prober.exists(SchemaObjectKind.COLUMN, column, table));
    }

    /**
     * Creates {@code table} with the given column definitions unless it is already there.
     *
     * @param table table to create
     * @param columnDefinitions body of the {@code CREATE TABLE} parentheses
     * @return whether this call created the table
     * @throws SchemaMutationException if the DDL fails for a reason other than a duplicate table
     */
    public MutationResult ensureTable(String table, String columnDefinitions) {
        SqlIdentifiers.require(table, "table");
        if (columnDefinitions == null || columnDefinitions.isBlank()) {
            throw new IllegalArgumentException("columnDefinitions must not be null or blank");
        }

        if (prober.exists(SchemaObjectKind.TABLE, table, null)) {
            log.debug("Table {} already present, no change", table);
            return MutationResult.unchanged();
        }

        return execute(
                "CREATE TABLE " + table + " (" + columnDefinitions.strip() + ")",
                table,
                () -> prober.exists(SchemaObjectKind.TABLE, table, null));
    }

    // ── Private Helpers ──

    private MutationResult execute(String ddl, String objectName, BooleanSupplier present) {
        Savepoint savepoint = null;
        try {
            savepoint = savepointIfUseful();
            try (Statement statement = connection.createStatement()) {
                statement.execute(ddl);
            }
            release(savepoint);
            log.info("Applied schema change: {}", ddl);
            return MutationResult.created();
        } catch (SQLException e) {
            rollbackTo(savepoint, ddl, e);
            if (SqlStates.isDuplicateObject(e)) {
                log.warn(
                        "{} was created concurrently after the existence probe;"
                                + " treating as present",
                        objectName);
                return MutationResult.unchanged();
            }
            if (createdElsewhere(present, ddl, e)) {
                log.warn(
                        "{} failed ({}: {}) but {} now exists; treating as created concurrently",
                        ddl,
                        e.getSQLState(),
                        e.getMessage(),
                        objectName);
                return MutationResult.unchanged();
            }
            throw new SchemaMutationException(ddl, e);
        }
    }

    private static boolean createdElsewhere(
            BooleanSupplier present, String ddl, SQLException failure) {
        try {
            return present.getAsBoolean();
        } catch (MetadataQueryException probeFailure) {
            failure.addSuppressed(probeFailure);
            throw new SchemaMutationException(ddl, failure);
        }
    }

    /**
     * Savepoints only help where DDL is transactional; stores that commit around DDL discard them.
     */
    private Savepoint savepointIfUseful() throws SQLException {
        if (connection.getAutoCommit()) {
            return null;
        }
        var metaData = connection.getMetaData();
        if (!metaData.supportsSavepoints() || metaData.dataDefinitionCausesTransactionCommit()) {
            return null;
        }
        return connection.setSavepoint();
    }

    private void release(Savepoint savepoint) throws SQLException {
        if (savepoint != null) {
            connection.releaseSavepoint(savepoint);
        }
    }

    private void rollbackTo(Savepoint savepoint, String ddl, SQLException original) {
        if (savepoint == null) {
            return;
        }
        try {
            connection.rollback(savepoint);
        } catch (SQLException e) {
            original.addSuppressed(e);
            throw new SchemaMutationException(ddl, original);
        }
    }
}
