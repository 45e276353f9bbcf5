package com.shelfwise.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.shelfwise.database.idempotent.MigrationRunner;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Verifies the SQL migrations are packaged where Flyway looks for them. A missing resource would
 * only surface at deployment time otherwise.
 */
@DisplayName("Migration SQL Resource Verification")
class MigrationResourceTest {

    private static final String V1 = "db/migration/inventory/V1__create_stock_items.sql";

    @Test
    @DisplayName("V1__create_stock_items.sql is on the classpath")
    void stockItemsOnClasspath() throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(V1)) {
            assertThat(is).as("V1__create_stock_items.sql must be on the classpath").isNotNull();
        }
    }

    @Test
    @DisplayName("V1 creates stock_items without the category column")
    void stockItemsShape() throws IOException {
        String sql = readClasspathResource(V1);

        assertThat(sql).containsIgnoringCase("CREATE TABLE IF NOT EXISTS stock_items");
        assertThat(sql).contains("item_name");
        assertThat(sql).doesNotContain("category_id INTEGER");
    }

    @Test
    @DisplayName("version 2 is a Java migration, not a SQL file")
    void noSqlVersionTwo() {
        String sqlV2 = "db/migration/inventory/V2__Categorize_stock_items.sql";
        assertThat(getClass().getClassLoader().getResource(sqlV2)).isNull();

        var migration = new V2__Categorize_stock_items(mock(MigrationRunner.class));
        assertThat(migration.getVersion().getVersion()).isEqualTo("2");
        assertThat(migration.getDescription()).isEqualTo("Categorize stock items");
    }

    // ── Helpers ──

    private String readClasspathResource(String path) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            assertThat(is).as("Resource '%s' must be on the classpath", path).isNotNull();
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
