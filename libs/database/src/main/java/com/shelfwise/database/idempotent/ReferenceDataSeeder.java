package com.shelfwise.database.idempotent;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inserts reference rows keyed by a unique {@code name} column, never duplicating them.
 *
 * <p>Each record is an insert attempt first. A uniqueness violation means the row is already there
 * (from an earlier run, a concurrent run, or an earlier record in the same input), so the existing
 * identity is looked up and returned instead. Each insert runs under its own savepoint so a
 * conflict leaves the surrounding transaction usable.
 *
 * <p>The reference table must have an identity column {@code id}, a unique {@code name} column and
 * a nullable {@code description} column.
 */
public class ReferenceDataSeeder {

    private static final Logger log = LoggerFactory.getLogger(ReferenceDataSeeder.class);

    private final Connection connection;
    private final String insertSql;
    private final String lookupSql;

    public ReferenceDataSeeder(Connection connection, String referenceTable) {
        if (connection == null) {
            throw new IllegalArgumentException("connection must not be null");
        }
        SqlIdentifiers.require(referenceTable, "referenceTable");
        this.connection = connection;
        this.insertSql = "INSERT INTO " + referenceTable + " (name, description) VALUES (?, ?)";
        this.lookupSql = "SELECT id FROM " + referenceTable + " WHERE name = ?";
    }

    /**
     * Seeds every record, in input order.
     *
     * @param records rows to ensure
     * @return one resolved identity per input record, in input order
     * @throws SeedResolutionException if a record can be neither inserted nor found
     */
    public List<SeededReference> seed(List<SeedRecord> records) {
        if (records == null) {
            throw new IllegalArgumentException("records must not be null");
        }
        List<SeededReference> resolved = new ArrayList<>(records.size());
        for (SeedRecord record : records) {
            resolved.add(seedOne(record));
        }
        long inserted = resolved.stream().filter(SeededReference::wasInserted).count();
        log.info(
                "Seeded {} reference rows ({} new, {} already present)",
                resolved.size(),
                inserted,
                resolved.size() - inserted);
        return List.copyOf(resolved);
    }

    // ── Private Helpers ──

    private SeededReference seedOne(SeedRecord record) {
        Savepoint savepoint = null;
        try {
            savepoint = connection.getAutoCommit() ? null : connection.setSavepoint();
            long id = insert(record);
            if (savepoint != null) {
                connection.releaseSavepoint(savepoint);
            }
            log.debug("Inserted reference '{}' as id {}", record.name(), id);
            return new SeededReference(record.name(), id, true);
        } catch (SQLException e) {
            if (!SqlStates.isUniqueViolation(e)) {
                throw new SeedResolutionException(
                        record.name(),
                        "Insert of reference '%s' failed: %s"
                                .formatted(record.name(), e.getMessage()),
                        e);
            }
            rollbackTo(savepoint, record, e);
            return resolveExisting(record, e);
        }
    }

    private long insert(SeedRecord record) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(insertSql, new String[] {"id"})) {
            ps.setString(1, record.name());
            ps.setString(2, record.description());
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (keys.next()) {
                    return keys.getLong(1);
                }
            }
        }
        // Driver returned no generated key; the row is in this transaction, so read it back.
        return lookup(record.name())
                .orElseThrow(
                        () ->
                                new SQLException(
                                        "Inserted row for '" + record.name() + "' is not visible"));
    }

    private SeededReference resolveExisting(SeedRecord record, SQLException conflict) {
        Optional<Long> existing;
        try {
            existing = lookup(record.name());
        } catch (SQLException e) {
            e.addSuppressed(conflict);
            throw new SeedResolutionException(
                    record.name(),
                    "Lookup of existing reference '%s' failed: %s"
                            .formatted(record.name(), e.getMessage()),
                    e);
        }
        long id =
                existing.orElseThrow(
                        () ->
                                new SeedResolutionException(
                                        record.name(),
                                        ("Reference '%s' reported a uniqueness conflict but no"
                                                        + " existing row is visible")
                                                .formatted(record.name()),
                                        conflict));
        log.debug("Reference '{}' already present as id {}", record.name(), id);
        return new SeededReference(record.name(), id, false);
    }

    private Optional<Long> lookup(String name) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(lookupSql)) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
            }
        }
    }

    private void rollbackTo(Savepoint savepoint, SeedRecord record, SQLException conflict) {
        if (savepoint == null) {
            return;
        }
        try {
            connection.rollback(savepoint);
        } catch (SQLException e) {
            e.addSuppressed(conflict);
            throw new SeedResolutionException(
                    record.name(),
                    "Could not recover from conflict on reference '%s': %s"
                            .formatted(record.name(), e.getMessage()),
                    e);
        }
    }
}
