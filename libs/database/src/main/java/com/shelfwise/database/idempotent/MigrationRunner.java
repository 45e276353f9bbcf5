package com.shelfwise.database.idempotent;

import com.shelfwise.database.metrics.MigrationMetrics;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the categorization migration: ensure schema, seed categories, backfill stock items.
 *
 * <p>The steps are strictly sequential because the backfill needs the identities the seed step
 * resolves. All of them share one transaction: {@link #run()} commits once at the end and rolls
 * everything back on any failure, so a failed run leaves no partial seed or backfill behind (and,
 * on stores with transactional DDL, no partial schema change either).
 *
 * <p>Running again after a success changes nothing observable: the schema is already there, every
 * category resolves to its existing row, and the rules rewrite the same values.
 *
 * <pre>{@code
 * MigrationRunner runner = new MigrationRunner(dataSource, plan, metrics);
 * MigrationResult result = runner.run();
 * }</pre>
 */
public class MigrationRunner {

    private static final Logger log = LoggerFactory.getLogger(MigrationRunner.class);

    private final DataSource dataSource;
    private final CategorizationPlan plan;
    private final MigrationMetrics metrics;

    public MigrationRunner(
            DataSource dataSource, CategorizationPlan plan, MigrationMetrics metrics) {
        if (plan == null) {
            throw new IllegalArgumentException("plan must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.dataSource = dataSource;
        this.plan = plan;
        this.metrics = metrics;
    }

    /**
     * Runs the migration in its own transaction on a connection borrowed from the data source.
     *
     * @return counts of what this run changed
     * @throws MigrationException if any step fails; nothing from this run is committed
     */
    public MigrationResult run() {
        if (dataSource == null) {
            throw new IllegalStateException(
                    "run() needs a DataSource; use apply(Connection) instead");
        }
        long started = System.nanoTime();
        try (Connection connection = dataSource.getConnection()) {
            MigrationResult result = runInTransaction(connection);
            recordSuccess(result, started);
            return result;
        } catch (SQLException e) {
            metrics.recordFailure(elapsedSince(started));
            throw new MigrationException(
                    MigrationStep.TRANSACTION, "Database connection failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            metrics.recordFailure(elapsedSince(started));
            throw e;
        }
    }

    /**
     * Runs every step on {@code connection} without touching its transaction state.
     *
     * <p>For orchestrators that own the transaction, such as Flyway's Java migrations. The caller
     * commits or rolls back. Metrics are recorded when this call returns or throws, so a later
     * failed commit by the caller is not reflected in them.
     *
     * @param connection connection inside the caller's transaction
     * @return counts of what this call changed
     * @throws MigrationException if any step fails
     */
    public MigrationResult apply(Connection connection) {
        if (connection == null) {
            throw new IllegalArgumentException("connection must not be null");
        }
        long started = System.nanoTime();
        try {
            MigrationResult result = applySteps(connection);
            recordSuccess(result, started);
            return result;
        } catch (RuntimeException e) {
            metrics.recordFailure(elapsedSince(started));
            throw e;
        }
    }

    // ── Private Helpers ──

    private MigrationResult applySteps(Connection connection) {
        ExistenceProber prober = new ExistenceProber(connection);
        ConditionalSchemaMutator mutator = new ConditionalSchemaMutator(connection, prober);

        MutationResult table =
                mutator.ensureTable(plan.categoryTable(), plan.categoryTableDefinition());
        MutationResult column =
                mutator.ensureColumn(
                        plan.itemTable(),
                        plan.categoryColumn(),
                        "INTEGER",
                        plan.categoryColumnConstraint());
        log.info(
                "Schema: table {} {}, column {}.{} {}",
                plan.categoryTable(),
                table.applied() ? "created" : "present",
                plan.itemTable(),
                plan.categoryColumn(),
                column.applied() ? "added" : "present");

        List<SeededReference> seeded =
                new ReferenceDataSeeder(connection, plan.categoryTable()).seed(plan.categories());
        Map<String, Long> categoryIds = new LinkedHashMap<>();
        int inserted = 0;
        for (SeededReference reference : seeded) {
            categoryIds.put(reference.name(), reference.id());
            if (reference.wasInserted()) {
                inserted++;
            }
        }

        int rows =
                new BackfillRuleEngine(
                                connection,
                                plan.itemTable(),
                                plan.itemNameColumn(),
                                plan.categoryColumn())
                        .backfill(plan.rules(), categoryIds);

        return new MigrationResult(column.applied() ? 1 : 0, inserted, rows);
    }

    private void recordSuccess(MigrationResult result, long started) {
        metrics.recordSuccess(
                result.columnsAdded(),
                result.categoriesSeeded(),
                result.rowsBackfilled(),
                elapsedSince(started));
    }

    private MigrationResult runInTransaction(Connection connection) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        int isolation = connection.getTransactionIsolation();
        try {
            connection.setAutoCommit(false);
            if (isolation < Connection.TRANSACTION_READ_COMMITTED) {
                connection.setTransactionIsolation(Connection.TRANSACTION_READ_COMMITTED);
            }

            MigrationResult result;
            try {
                result = applySteps(connection);
                connection.commit();
            } catch (RuntimeException | SQLException e) {
                rollback(connection, e);
                throw e instanceof SQLException sql
                        ? new MigrationException(
                                MigrationStep.TRANSACTION,
                                "Commit failed: " + sql.getMessage(),
                                sql)
                        : (RuntimeException) e;
            }

            log.info(
                    "Categorization migration committed: {} column(s) added, {} categories seeded,"
                            + " {} rows backfilled",
                    result.columnsAdded(),
                    result.categoriesSeeded(),
                    result.rowsBackfilled());
            return result;
        } finally {
            restore(connection, autoCommit, isolation);
        }
    }

    private static void rollback(Connection connection, Exception cause) {
        log.error("Categorization migration failed, rolling back: {}", cause.getMessage());
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    /** Pooled connections must go back in the state they were borrowed in. */
    private static void restore(Connection connection, boolean autoCommit, int isolation) {
        try {
            if (connection.getTransactionIsolation() != isolation) {
                connection.setTransactionIsolation(isolation);
            }
            connection.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.warn("Could not restore connection state: {}", e.getMessage());
        }
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
