package com.shelfwise.database.idempotent;

import java.util.regex.Pattern;

/**
 * Validation for table and column names that are spliced into DDL and DML text.
 *
 * <p>JDBC cannot bind identifiers as parameters, so every name that reaches a statement is checked
 * against a plain unquoted-identifier pattern first.
 */
final class SqlIdentifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private SqlIdentifiers() {
        // utility class
    }

    /**
     * Returns {@code value} unchanged if it is a plain SQL identifier.
     *
     * @throws IllegalArgumentException if the value is null, blank, or contains anything other than
     *     letters, digits and underscores
     */
    static String require(String value, String parameter) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(parameter + " must not be null or blank");
        }
        if (!IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException(
                    "%s '%s' is not a plain SQL identifier".formatted(parameter, value));
        }
        return value;
    }
}
