package com.shelfwise.database.catalog;

import com.shelfwise.database.idempotent.CategorizationPlan;
import com.shelfwise.database.idempotent.ExistenceProber;
import com.shelfwise.database.idempotent.MigrationException;
import com.shelfwise.database.idempotent.MigrationStep;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import javax.sql.DataSource;

/**
 * Reports categorization progress without changing anything, for status endpoints and operators.
 *
 * <p>This is a POJO (no Spring annotations) so it can be built in unit tests without a Spring
 * context.
 */
public class CategorizationStatusService {

    private final DataSource dataSource;
    private final CategorizationPlan plan;

    public CategorizationStatusService(DataSource dataSource, CategorizationPlan plan) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        if (plan == null) {
            throw new IllegalArgumentException("plan must not be null");
        }
        this.dataSource = dataSource;
        this.plan = plan;
    }

    /**
     * Reads the current status.
     *
     * @return the status snapshot
     * @throws MigrationException if the database cannot be queried
     */
    public CategorizationStatus inspect() {
        try (Connection connection = dataSource.getConnection()) {
            ExistenceProber prober = new ExistenceProber(connection);
            boolean tablePresent = prober.tableExists(plan.categoryTable());
            boolean itemsPresent = prober.tableExists(plan.itemTable());
            boolean columnPresent =
                    itemsPresent && prober.columnExists(plan.itemTable(), plan.categoryColumn());

            long categories =
                    tablePresent
                            ? count(connection, "SELECT COUNT(*) FROM " + plan.categoryTable())
                            : 0;
            long uncategorized = 0;
            if (columnPresent) {
                uncategorized =
                        count(
                                connection,
                                "SELECT COUNT(*) FROM %s WHERE %s IS NULL"
                                        .formatted(plan.itemTable(), plan.categoryColumn()));
            } else if (itemsPresent) {
                uncategorized = count(connection, "SELECT COUNT(*) FROM " + plan.itemTable());
            }
            return new CategorizationStatus(tablePresent, columnPresent, categories, uncategorized);
        } catch (SQLException e) {
            throw new MigrationException(
                    MigrationStep.PROBE, "Cannot read categorization status: " + e.getMessage(), e);
        }
    }

    private static long count(Connection connection, String sql) throws SQLException {
        try (Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }
}
