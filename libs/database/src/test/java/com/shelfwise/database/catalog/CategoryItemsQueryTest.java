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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CategoryItemsQuery")
class CategoryItemsQueryTest {

    private CategoryItemsQuery query;

    @BeforeEach
    void setUp() {
        InventoryDatabase db = InventoryDatabase.withStockItems();
        db.insertItem("Coke");
        db.insertItem("coke");
        db.insertItem("Fanta");
        db.insertItem("Lays");
        db.insertItem("Water");
        CategorizationPlan plan =
                CategorizationPlan.of(
                        List.of(
                                new SeedRecord("Drinks", null),
                                new SeedRecord("Snacks", null),
                                new SeedRecord("Biscuits", null)),
                        List.of(
                                new BackfillRule("coke", "Drinks"),
                                new BackfillRule("fanta", "Drinks"),
                                new BackfillRule("lays", "Snacks")));
        new MigrationRunner(
                        db.dataSource(),
                        plan,
                        new MigrationMetrics(new SimpleMeterRegistry(), "test-service"))
                .run();
        query = new CategoryItemsQuery(db.dataSource(), plan);
    }

    @Test
    @DisplayName("lists distinct item names in a category")
    void listsItems() {
        assertThat(query.itemsIn("Drinks")).containsExactlyInAnyOrder("Coke", "Fanta", "coke");
    }

    @Test
    @DisplayName("accepts aliases and any case")
    void acceptsAliases() {
        assertThat(query.itemsIn("beverages")).containsExactlyInAnyOrder("Coke", "Fanta", "coke");
        assertThat(query.itemsIn("CHIPS")).containsExactly("Lays");
    }

    @Test
    @DisplayName("an empty or unknown category lists nothing")
    void emptyCategory() {
        assertThat(query.itemsIn("biscuits")).isEmpty();
        assertThat(query.itemsIn("Frozen")).isEmpty();
    }
}
