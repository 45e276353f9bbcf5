package com.shelfwise.database.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import com.shelfwise.database.idempotent.BackfillRule;
import com.shelfwise.database.idempotent.CategorizationPlan;
import com.shelfwise.database.idempotent.MigrationRunner;
import com.shelfwise.database.idempotent.SeedRecord;
import com.shelfwise.database.metrics.MigrationMetrics;
import com.shelfwise.database.testing.InventoryDatabase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CategorizationStatusService")
class CategorizationStatusServiceTest {

    private final CategorizationPlan plan =
            CategorizationPlan.of(
                    List.of(new SeedRecord("Drinks", null), new SeedRecord("Snacks", null)),
                    List.of(new BackfillRule("coke", "Drinks")));

    private InventoryDatabase db;
    private CategorizationStatusService service;

    @BeforeEach
    void setUp() {
        db = InventoryDatabase.withStockItems();
        service = new CategorizationStatusService(db.dataSource(), plan);
    }

    @Test
    @DisplayName("before migration every item counts as uncategorized")
    void beforeMigration() {
        db.insertItem("Coke");
        db.insertItem("Water");

        CategorizationStatus status = service.inspect();

        assertThat(status).isEqualTo(new CategorizationStatus(false, false, 0, 2));
        assertThat(status.schemaApplied()).isFalse();
    }

    @Test
    @DisplayName("after migration reports categories and remaining uncategorized items")
    void afterMigration() {
        db.insertItem("Coke");
        db.insertItem("Water");
        new MigrationRunner(
                        db.dataSource(),
                        plan,
                        new MigrationMetrics(new SimpleMeterRegistry(), "test-service"))
                .run();

        CategorizationStatus status = service.inspect();

        assertThat(status).isEqualTo(new CategorizationStatus(true, true, 2, 1));
        assertThat(status.schemaApplied()).isTrue();
    }

    @Test
    @DisplayName("an empty database reports nothing present")
    void emptyDatabase() {
        DataSource empty = InventoryDatabase.create().dataSource();

        CategorizationStatus status = new CategorizationStatusService(empty, plan).inspect();

        assertThat(status).isEqualTo(new CategorizationStatus(false, false, 0, 0));
    }
}
