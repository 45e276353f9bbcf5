package com.shelfwise.database.idempotent;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers whether a named table, column or constraint exists, using JDBC structural metadata only.
 *
 * <p>Nothing is cached: another process may change the schema between two probes, so every call
 * reads the catalog again. Absence is an ordinary {@code false}; only a failure to read the
 * metadata is an error.
 *
 * <p>Lookups are scoped to the connection's current catalog and schema. Names are matched
 * case-insensitively after trying the store's own identifier case, so {@code stock_items} finds
 * {@code STOCK_ITEMS} on stores that fold unquoted names to upper case.
 */
public class ExistenceProber {

    private static final Logger log = LoggerFactory.getLogger(ExistenceProber.class);

    private final Connection connection;

    public ExistenceProber(Connection connection) {
        if (connection == null) {
            throw new IllegalArgumentException("connection must not be null");
        }
        this.connection = connection;
    }

    /**
     * Reports whether the object exists.
     *
     * @param kind what to look for
     * @param name object name
     * @param containingTable owning table; required for {@link SchemaObjectKind#COLUMN} and {@link
     *     SchemaObjectKind#CONSTRAINT}, ignored for tables
     * @return {@code true} if the object is present
     * @throws MetadataQueryException if the metadata cannot be read
     */
    public boolean exists(SchemaObjectKind kind, String name, String containingTable) {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (kind.requiresTable() && (containingTable == null || containingTable.isBlank())) {
            throw new IllegalArgumentException(
                    "containingTable is required when probing a " + kind.label());
        }

        try {
            DatabaseMetaData metaData = connection.getMetaData();
            boolean found =
                    switch (kind) {
                        case TABLE -> tableExists(metaData, name);
                        case COLUMN -> columnExists(metaData, containingTable, name);
                        case CONSTRAINT -> constraintExists(metaData, containingTable, name);
                    };
            log.debug(
                    "Probe {} '{}'{} -> {}",
                    kind.label(),
                    name,
                    containingTable == null ? "" : " on '" + containingTable + "'",
                    found ? "present" : "absent");
            return found;
        } catch (SQLException e) {
            throw new MetadataQueryException(kind, qualified(containingTable, name), e);
        }
    }

    /** Shorthand for {@code exists(TABLE, table, null)}. */
    public boolean tableExists(String table) {
        return exists(SchemaObjectKind.TABLE, table, null);
    }

    /** Shorthand for {@code exists(COLUMN, column, table)}. */
    public boolean columnExists(String table, String column) {
        return exists(SchemaObjectKind.COLUMN, column, table);
    }

    // ── Private Helpers ──

    private boolean tableExists(DatabaseMetaData metaData, String table) throws SQLException {
        for (String candidate : candidates(metaData, table)) {
            try (ResultSet rs =
                    metaData.getTables(
                            connection.getCatalog(),
                            connection.getSchema(),
                            candidate,
                            new String[] {"TABLE"})) {
                if (anyMatch(rs, "TABLE_NAME", table)) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean columnExists(DatabaseMetaData metaData, String table, String column)
            throws SQLException {
        for (String tableCandidate : candidates(metaData, table)) {
            try (ResultSet rs =
                    metaData.getColumns(
                            connection.getCatalog(),
                            connection.getSchema(),
                            tableCandidate,
                            null)) {
                while (rs.next()) {
                    if (table.equalsIgnoreCase(rs.getString("TABLE_NAME"))
                            && column.equalsIgnoreCase(rs.getString("COLUMN_NAME"))) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private boolean constraintExists(DatabaseMetaData metaData, String table, String constraint)
            throws SQLException {
        String catalog = connection.getCatalog();
        String schema = connection.getSchema();
        for (String tableCandidate : candidates(metaData, table)) {
            try (ResultSet rs = metaData.getPrimaryKeys(catalog, schema, tableCandidate)) {
                if (anyMatch(rs, "PK_NAME", constraint)) {
                    return true;
                }
            }
            try (ResultSet rs = metaData.getImportedKeys(catalog, schema, tableCandidate)) {
                if (anyMatch(rs, "FK_NAME", constraint)) {
                    return true;
                }
            }
            try (ResultSet rs =
                    metaData.getIndexInfo(catalog, schema, tableCandidate, false, true)) {
                if (anyMatch(rs, "INDEX_NAME", constraint)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Metadata patterns are case-sensitive on most drivers. Try the store's folded case first,
     * then the name as given, then the other foldings.
     */
    private static Set<String> candidates(DatabaseMetaData metaData, String name)
            throws SQLException {
        Set<String> names = new LinkedHashSet<>();
        if (metaData.storesUpperCaseIdentifiers()) {
            names.add(name.toUpperCase(Locale.ROOT));
        } else if (metaData.storesLowerCaseIdentifiers()) {
            names.add(name.toLowerCase(Locale.ROOT));
        }
        names.add(name);
        names.add(name.toLowerCase(Locale.ROOT));
        names.add(name.toUpperCase(Locale.ROOT));
        return names;
    }

    /** '_' is a LIKE wildcard in metadata patterns, so results are re-checked by exact name. */
    private static boolean anyMatch(ResultSet rs, String column, String expected)
            throws SQLException {
        while (rs.next()) {
            if (expected.equalsIgnoreCase(rs.getString(column))) {
                return true;
            }
        }
        return false;
    }

    private static String qualified(String table, String name) {
        return table == null ? name : table + "." + name;
    }
}
