package com.shelfwise.database.catalog;

import com.shelfwise.database.idempotent.CategorizationPlan;
import com.shelfwise.database.idempotent.MigrationException;
import com.shelfwise.database.idempotent.MigrationStep;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import javax.sql.DataSource;

/** Lists the stock items filed under a category, after the backfill has run. */
public class CategoryItemsQuery {

    private final DataSource dataSource;
    private final String sql;

    public CategoryItemsQuery(DataSource dataSource, CategorizationPlan plan) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        if (plan == null) {
            throw new IllegalArgumentException("plan must not be null");
        }
        this.dataSource = dataSource;
        this.sql =
                ("SELECT DISTINCT s.%s FROM %s s JOIN %s c ON s.%s = c.id"
                                + " WHERE LOWER(c.name) = LOWER(?) ORDER BY s.%s")
                        .formatted(
                                plan.itemNameColumn(),
                                plan.itemTable(),
                                plan.categoryTable(),
                                plan.categoryColumn(),
                                plan.itemNameColumn());
    }

    /**
     * Returns the distinct item names in a category.
     *
     * @param category canonical name or alias, any case
     * @return item names in ascending order; empty if the category has no items or does not exist
     */
    public List<String> itemsIn(String category) {
        String canonical = CategoryAliases.resolve(category);
        try (Connection connection = dataSource.getConnection();
                PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, canonical);
            List<String> names = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    names.add(rs.getString(1));
                }
            }
            return List.copyOf(names);
        } catch (SQLException e) {
            throw new MigrationException(
                    MigrationStep.PROBE,
                    "Cannot list items in category '%s': %s".formatted(canonical, e.getMessage()),
                    e);
        }
    }
}
