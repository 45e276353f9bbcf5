package com.shelfwise.database.idempotent;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Classification of vendor error reports that the engine treats as benign outcomes.
 *
 * <p>Covers PostgreSQL, the SQL:2003 "42S" class used by H2 and MySQL, and H2's own error codes.
 * The whole cause chain is inspected because pools and drivers wrap the original report.
 */
final class SqlStates {

    /** PostgreSQL duplicate_table, duplicate_column, duplicate_object; ODBC 42S01 and 42S21. */
    private static final Set<String> DUPLICATE_OBJECT =
            Set.of("42P07", "42701", "42710", "42S01", "42S21");

    /** H2: TABLE_OR_VIEW_ALREADY_EXISTS_1, DUPLICATE_COLUMN_NAME_1, CONSTRAINT_ALREADY_EXISTS_1. */
    private static final Set<Integer> H2_DUPLICATE_OBJECT_CODES = Set.of(42101, 42121, 90045);

    private static final String UNIQUE_VIOLATION = "23505";

    /** MySQL reports unique violations as 23000 with vendor code 1062. */
    private static final String INTEGRITY_CONSTRAINT_CLASS = "23000";

    private static final int MYSQL_DUPLICATE_ENTRY = 1062;

    private SqlStates() {
        // utility class
    }

    static boolean isDuplicateObject(SQLException e) {
        for (SQLException current : chain(e)) {
            String state = current.getSQLState();
            if ((state != null && DUPLICATE_OBJECT.contains(state))
                    || H2_DUPLICATE_OBJECT_CODES.contains(current.getErrorCode())) {
                return true;
            }
        }
        return false;
    }

    static boolean isUniqueViolation(SQLException e) {
        for (SQLException current : chain(e)) {
            String state = current.getSQLState();
            if (UNIQUE_VIOLATION.equals(state)) {
                return true;
            }
            if (INTEGRITY_CONSTRAINT_CLASS.equals(state)
                    && current.getErrorCode() == MYSQL_DUPLICATE_ENTRY) {
                return true;
            }
        }
        return false;
    }

    private static List<SQLException> chain(SQLException root) {
        List<SQLException> all = new ArrayList<>();
        Throwable current = root;
        while (current != null && all.size() < 16) {
            if (current instanceof SQLException sql) {
                all.add(sql);
                if (sql.getNextException() != null && sql.getNextException() != sql.getCause()) {
                    all.add(sql.getNextException());
                }
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return all;
    }
}
