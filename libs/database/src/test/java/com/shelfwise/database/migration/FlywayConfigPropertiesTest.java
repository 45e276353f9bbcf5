package com.shelfwise.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link FlywayConfigProperties}: the externalized configuration record for the
 * inventory database. Binding-time validation is covered in {@link FlywayMigrationConfigTest}.
 */
@DisplayName("FlywayConfigProperties")
class FlywayConfigPropertiesTest {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("record exposes all fields")
        void fieldsAccessible() {
            var config =
                    new FlywayConfigProperties(
                            "jdbc:postgresql://localhost:5432/store_inventory",
                            "postgres",
                            "secret",
                            "classpath:db/migration/custom",
                            true);

            assertThat(config.url()).isEqualTo("jdbc:postgresql://localhost:5432/store_inventory");
            assertThat(config.username()).isEqualTo("postgres");
            assertThat(config.password()).isEqualTo("secret");
            assertThat(config.locations()).isEqualTo("classpath:db/migration/custom");
            assertThat(config.enabled()).isTrue();
        }

        @Test
        @DisplayName("disabled config is recognized")
        void disabledConfig() {
            var config =
                    new FlywayConfigProperties(
                            "jdbc:postgresql://localhost:5432/store_inventory",
                            "u",
                            "p",
                            null,
                            false);

            assertThat(config.enabled()).isFalse();
        }
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("blank locations fall back to the bundled migrations")
        void defaultLocations() {
            var config = new FlywayConfigProperties("jdbc:h2:mem:x", "sa", "", " ", true);

            assertThat(config.locations())
                    .isEqualTo(FlywayConfigProperties.DEFAULT_LOCATIONS)
                    .isEqualTo("classpath:db/migration/inventory");
        }

        @Test
        @DisplayName("null URL is accepted at record level (validated by Spring)")
        void nullUrlAccepted() {
            // Bean Validation runs at binding time, not record construction.
            var config = new FlywayConfigProperties(null, "sa", "", null, true);

            assertThat(config.url()).isNull();
        }
    }
}
