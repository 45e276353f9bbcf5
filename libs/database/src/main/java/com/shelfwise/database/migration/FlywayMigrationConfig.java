package com.shelfwise.database.migration;

import com.shelfwise.database.catalog.CategorizationStatusService;
import com.shelfwise.database.catalog.CategoryItemsQuery;
import com.shelfwise.database.idempotent.CategorizationPlan;
import com.shelfwise.database.idempotent.MigrationRunner;
import com.shelfwise.database.metrics.MigrationMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Flyway configuration for the inventory database.
 *
 * <p>Builds a dedicated {@link DataSource} and a {@link Flyway} instance that runs the SQL
 * migrations under {@link FlywayConfigProperties#locations()} plus the Java migration {@link
 * V2__Categorize_stock_items}. Migration runs when the Flyway bean is initialised.
 *
 * <h2>Bean Names</h2>
 *
 * <ul>
 *   <li>{@link #INVENTORY_DATA_SOURCE_BEAN}: connection pool for the inventory database
 *   <li>{@link #INVENTORY_FLYWAY_BEAN}: the migrated Flyway instance
 * </ul>
 *
 * <h2>Excluding Spring Boot Auto-Configuration</h2>
 *
 * <p>Services using this module should exclude {@link FlywayAutoConfiguration} so the two do not
 * compete for the same history table:
 *
 * <pre>{@code
 * @SpringBootApplication(exclude = FlywayAutoConfiguration.class)
 * }</pre>
 *
 * @see FlywayConfigProperties
 * @see CategorizationProperties
 */
@Configuration
@EnableConfigurationProperties({FlywayConfigProperties.class, CategorizationProperties.class})
@ConditionalOnProperty(prefix = "shelfwise.flyway", name = "enabled", havingValue = "true")
public class FlywayMigrationConfig {

    /** Bean name for the inventory database connection pool. */
    public static final String INVENTORY_DATA_SOURCE_BEAN = "inventoryDataSource";

    /** Bean name for the inventory database Flyway instance. */
    public static final String INVENTORY_FLYWAY_BEAN = "inventoryFlyway";

    @Bean(name = INVENTORY_DATA_SOURCE_BEAN)
    public DataSource inventoryDataSource(FlywayConfigProperties properties) {
        return DataSourceBuilder.create()
                .url(properties.url())
                .username(properties.username())
                .password(properties.password())
                .build();
    }

    @Bean
    public CategorizationPlan categorizationPlan(CategorizationProperties properties) {
        return properties.toPlan();
    }

    /** Uses the application's registry when one exists (Actuator), a private one otherwise. */
    @Bean
    public MigrationMetrics migrationMetrics(
            ObjectProvider<MeterRegistry> registry, CategorizationProperties properties) {
        return new MigrationMetrics(
                registry.getIfAvailable(SimpleMeterRegistry::new), properties.serviceName());
    }

    @Bean
    public MigrationRunner categorizationRunner(
            @Qualifier(INVENTORY_DATA_SOURCE_BEAN) DataSource dataSource,
            CategorizationPlan plan,
            MigrationMetrics metrics) {
        return new MigrationRunner(dataSource, plan, metrics);
    }

    @Bean
    public CategorizationStatusService categorizationStatusService(
            @Qualifier(INVENTORY_DATA_SOURCE_BEAN) DataSource dataSource, CategorizationPlan plan) {
        return new CategorizationStatusService(dataSource, plan);
    }

    @Bean
    public CategoryItemsQuery categoryItemsQuery(
            @Qualifier(INVENTORY_DATA_SOURCE_BEAN) DataSource dataSource, CategorizationPlan plan) {
        return new CategoryItemsQuery(dataSource, plan);
    }

    /**
     * Creates the Flyway instance and migrates on initialisation.
     *
     * <p>{@code baselineOnMigrate} lets an existing inventory database, which already has {@code
     * stock_items} but no history table, start at version 1 and receive only the categorization
     * step.
     */
    @Bean(name = INVENTORY_FLYWAY_BEAN, initMethod = "migrate")
    public Flyway inventoryFlyway(
            @Qualifier(INVENTORY_DATA_SOURCE_BEAN) DataSource dataSource,
            FlywayConfigProperties properties,
            MigrationRunner runner) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations())
                .javaMigrations(new V2__Categorize_stock_items(runner))
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}
