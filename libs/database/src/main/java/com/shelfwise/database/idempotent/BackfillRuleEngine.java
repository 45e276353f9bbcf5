package com.shelfwise.database.idempotent;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Points existing stock items at their category by applying an ordered list of {@link
 * BackfillRule}s.
 *
 * <p>Rules run one {@code UPDATE} each, in list order, so when two rules match the same item the
 * later one wins. Matching rows are always rewritten, even if they already hold the right
 * category; rows that no rule matches keep whatever category they had.
 */
public class BackfillRuleEngine {

    private static final Logger log = LoggerFactory.getLogger(BackfillRuleEngine.class);

    private final Connection connection;
    private final String updateSql;

    /**
     * @param connection connection whose transaction the updates join
     * @param itemTable table holding the rows to classify
     * @param itemNameColumn free-text name column the rules match against
     * @param categoryColumn nullable foreign-key column to set
     */
    public BackfillRuleEngine(
            Connection connection, String itemTable, String itemNameColumn, String categoryColumn) {
        if (connection == null) {
            throw new IllegalArgumentException("connection must not be null");
        }
        SqlIdentifiers.require(itemTable, "itemTable");
        SqlIdentifiers.require(itemNameColumn, "itemNameColumn");
        SqlIdentifiers.require(categoryColumn, "categoryColumn");
        this.connection = connection;
        this.updateSql =
                "UPDATE %s SET %s = ? WHERE LOWER(%s) = ?"
                        .formatted(itemTable, categoryColumn, itemNameColumn);
    }

    /**
     * Applies every rule in order.
     *
     * @param rules ordered rules; later rules overwrite earlier ones on overlap
     * @param categoryIds identity of every category a rule may target, keyed by exact name
     * @return total rows written, summed over rules (a row matched twice counts twice)
     * @throws BackfillExecutionException if a rule targets an unknown category or an update fails
     */
    public int backfill(List<BackfillRule> rules, Map<String, Long> categoryIds) {
        if (rules == null) {
            throw new IllegalArgumentException("rules must not be null");
        }
        if (categoryIds == null) {
            throw new IllegalArgumentException("categoryIds must not be null");
        }
        warnOnOverlap(rules);

        int affected = 0;
        try (PreparedStatement ps = connection.prepareStatement(updateSql)) {
            for (BackfillRule rule : rules) {
                Long categoryId = categoryIds.get(rule.categoryName());
                if (categoryId == null) {
                    throw new BackfillExecutionException(
                            rule,
                            "Rule '%s' targets unknown category '%s'"
                                    .formatted(rule.itemName(), rule.categoryName()));
                }
                ps.setLong(1, categoryId);
                ps.setString(2, rule.itemName());
                int count = executeRule(ps, rule);
                log.debug(
                        "Rule '{}' -> '{}' (id {}) updated {} rows",
                        rule.itemName(),
                        rule.categoryName(),
                        categoryId,
                        count);
                affected += count;
            }
        } catch (SQLException e) {
            throw new BackfillExecutionException(
                    null, "Backfill statement could not be prepared: " + e.getMessage(), e);
        }
        log.info("Backfill applied {} rules, {} rows written", rules.size(), affected);
        return affected;
    }

    // ── Private Helpers ──

    private static int executeRule(PreparedStatement ps, BackfillRule rule) {
        try {
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new BackfillExecutionException(
                    rule,
                    "Rule '%s' -> '%s' failed: %s"
                            .formatted(rule.itemName(), rule.categoryName(), e.getMessage()),
                    e);
        }
    }

    /** Overlapping predicates are allowed but almost always a data-entry mistake. */
    private static void warnOnOverlap(List<BackfillRule> rules) {
        Map<String, BackfillRule> seen = new HashMap<>();
        for (BackfillRule rule : rules) {
            BackfillRule earlier = seen.put(rule.itemName(), rule);
            if (earlier != null && !earlier.categoryName().equals(rule.categoryName())) {
                log.warn(
                        "Rules overlap on item '{}': '{}' will be overwritten by later rule '{}'",
                        rule.itemName(),
                        earlier.categoryName(),
                        rule.categoryName());
            }
        }
    }
}
