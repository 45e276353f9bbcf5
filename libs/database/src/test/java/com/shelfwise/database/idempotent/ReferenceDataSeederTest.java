package com.shelfwise.database.idempotent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.shelfwise.database.testing.InventoryDatabase;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link ReferenceDataSeeder}: conflict-to-lookup resolution. */
@DisplayName("ReferenceDataSeeder")
class ReferenceDataSeederTest {

    private static final List<SeedRecord> CATEGORIES =
            List.of(
                    new SeedRecord("Drinks", "Beverages and liquid refreshments"),
                    new SeedRecord("Snacks", "Chips and savory snacks"),
                    new SeedRecord("Biscuits", "Cookies and biscuits"));

    private InventoryDatabase db;
    private Connection connection;
    private ReferenceDataSeeder seeder;

    @BeforeEach
    void setUp() throws SQLException {
        db = InventoryDatabase.withStockItems().withCategorySchema();
        connection = db.connection();
        connection.setAutoCommit(false);
        seeder = new ReferenceDataSeeder(connection, "categories");
    }

    @AfterEach
    void tearDown() throws SQLException {
        connection.rollback();
        connection.close();
    }

    @Nested
    @DisplayName("Fresh table")
    class FreshTable {

        @Test
        @DisplayName("inserts every record in input order")
        void insertsAll() {
            List<SeededReference> seeded = seeder.seed(CATEGORIES);

            assertThat(seeded)
                    .extracting(SeededReference::name)
                    .containsExactly("Drinks", "Snacks", "Biscuits");
            assertThat(seeded).allMatch(SeededReference::wasInserted);
            assertThat(seeded).extracting(SeededReference::id).doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("returns an empty list for empty input")
        void emptyInput() {
            assertThat(seeder.seed(List.of())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Existing rows")
    class ExistingRows {

        @Test
        @DisplayName("a second seed resolves to the same identities without inserting")
        void secondSeedIsLookup() {
            List<SeededReference> first = seeder.seed(CATEGORIES);
            List<SeededReference> second = seeder.seed(CATEGORIES);

            assertThat(second).noneMatch(SeededReference::wasInserted);
            assertThat(second)
                    .extracting(SeededReference::id)
                    .containsExactlyElementsOf(first.stream().map(SeededReference::id).toList());
        }

        @Test
        @DisplayName("a committed pre-existing row is resolved, the rest inserted")
        void mixed() throws SQLException {
            long existing = db.insertCategory("Snacks");

            List<SeededReference> seeded = seeder.seed(CATEGORIES);

            assertThat(seeded.get(1)).isEqualTo(new SeededReference("Snacks", existing, false));
            assertThat(seeded.get(0).wasInserted()).isTrue();
            assertThat(seeded.get(2).wasInserted()).isTrue();
        }

        @Test
        @DisplayName("the transaction stays usable after a conflict")
        void transactionSurvivesConflict() throws SQLException {
            seeder.seed(List.of(new SeedRecord("Drinks", null)));
            seeder.seed(List.of(new SeedRecord("Drinks", null), new SeedRecord("Frozen", null)));

            try (PreparedStatement ps =
                            connection.prepareStatement("SELECT COUNT(*) FROM categories");
                    ResultSet rs = ps.executeQuery()) {
                rs.next();
                assertThat(rs.getLong(1)).isEqualTo(2);
            }
        }

        @Test
        @DisplayName("duplicate names in one input map to one identity")
        void duplicatesInInput() {
            List<SeededReference> seeded =
                    seeder.seed(
                            List.of(new SeedRecord("Drinks", "a"), new SeedRecord("Drinks", "b")));

            assertThat(seeded.get(0).wasInserted()).isTrue();
            assertThat(seeded.get(1).wasInserted()).isFalse();
            assertThat(seeded.get(1).id()).isEqualTo(seeded.get(0).id());
        }

        @Test
        @DisplayName("names are unique case-sensitively")
        void caseSensitiveNames() {
            List<SeededReference> seeded =
                    seeder.seed(
                            List.of(
                                    new SeedRecord("Drinks", null),
                                    new SeedRecord("drinks", null)));

            assertThat(seeded).allMatch(SeededReference::wasInserted);
        }

        @Test
        @DisplayName("works without an open transaction")
        void autoCommit() throws SQLException {
            try (Connection auto = db.connection()) {
                ReferenceDataSeeder autoSeeder = new ReferenceDataSeeder(auto, "categories");
                autoSeeder.seed(CATEGORIES);

                assertThat(autoSeeder.seed(CATEGORIES)).noneMatch(SeededReference::wasInserted);
            }
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("a conflict with no visible row is a SeedResolutionException")
        void invisibleConflict() throws SQLException {
            Connection conn = mock(Connection.class);
            PreparedStatement insert = mock(PreparedStatement.class);
            PreparedStatement lookup = mock(PreparedStatement.class);
            ResultSet empty = mock(ResultSet.class);
            when(conn.getAutoCommit()).thenReturn(true);
            when(conn.prepareStatement(anyString(), any(String[].class))).thenReturn(insert);
            when(conn.prepareStatement(anyString())).thenReturn(lookup);
            when(insert.executeUpdate()).thenThrow(new SQLException("duplicate key", "23505"));
            when(lookup.executeQuery()).thenReturn(empty);
            when(empty.next()).thenReturn(false);

            assertThatThrownBy(
                            () ->
                                    new ReferenceDataSeeder(conn, "categories")
                                            .seed(List.of(new SeedRecord("Drinks", null))))
                    .isInstanceOf(SeedResolutionException.class)
                    .hasMessageContaining("Drinks")
                    .satisfies(
                            e -> {
                                SeedResolutionException sre = (SeedResolutionException) e;
                                assertThat(sre.name()).isEqualTo("Drinks");
                                assertThat(sre.step()).isEqualTo(MigrationStep.SEED);
                                assertThat(sre.getCause()).hasMessage("duplicate key");
                            });
        }

        @Test
        @DisplayName("a non-conflict insert error is a SeedResolutionException")
        void otherInsertError() {
            db.execute("DROP TABLE stock_items");
            db.execute("DROP TABLE categories");

            assertThatThrownBy(() -> seeder.seed(CATEGORIES))
                    .isInstanceOf(SeedResolutionException.class)
                    .hasMessageContaining("Insert of reference 'Drinks' failed");
        }

        @Test
        @DisplayName("SeedRecord rejects blank names")
        void blankName() {
            assertThatThrownBy(() -> new SeedRecord("  ", "x"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("name");
        }
    }
}
