package com.shelfwise.database.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;

/**
 * Micrometer meters for categorization migration runs.
 *
 * <p>Every meter carries a {@code service} tag so several services migrating the same database can
 * be told apart on one dashboard.
 */
public final class MigrationMetrics {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    /** Tag key for run outcome. */
    public static final String TAG_OUTCOME = "outcome";

    public static final String COLUMNS_ADDED = "shelfwise.migration.columns.added";
    public static final String CATEGORIES_SEEDED = "shelfwise.migration.categories.seeded";
    public static final String ROWS_BACKFILLED = "shelfwise.migration.rows.backfilled";
    public static final String RUNS = "shelfwise.migration.runs";
    public static final String DURATION = "shelfwise.migration.duration";

    private final MeterRegistry registry;
    private final String serviceName;
    private final Counter columnsAdded;
    private final Counter categoriesSeeded;
    private final Counter rowsBackfilled;
    private final Timer duration;

    /**
     * @param registry the Micrometer meter registry
     * @param serviceName logical service name included as a tag on every meter
     */
    public MigrationMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
        this.columnsAdded = counter(COLUMNS_ADDED, "Foreign-key columns added by migration runs");
        this.categoriesSeeded =
                counter(CATEGORIES_SEEDED, "Category rows inserted by migration runs");
        this.rowsBackfilled = counter(ROWS_BACKFILLED, "Stock item rows written by backfill rules");
        this.duration =
                Timer.builder(DURATION)
                        .description("Wall-clock time of migration runs, commit included")
                        .tags(Tags.of(TAG_SERVICE, serviceName))
                        .register(registry);
    }

    /** Records a committed run. */
    public void recordSuccess(int columns, int categories, int rows, Duration elapsed) {
        columnsAdded.increment(columns);
        categoriesSeeded.increment(categories);
        rowsBackfilled.increment(rows);
        duration.record(elapsed);
        runs("success").increment();
    }

    /** Records a rolled-back run. */
    public void recordFailure(Duration elapsed) {
        duration.record(elapsed);
        runs("failure").increment();
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Counter runs(String outcome) {
        return Counter.builder(RUNS)
                .description("Migration runs by outcome")
                .tags(Tags.of(TAG_SERVICE, serviceName, TAG_OUTCOME, outcome))
                .register(registry);
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name)
                .description(description)
                .tags(Tags.of(TAG_SERVICE, serviceName))
                .register(registry);
    }
}
