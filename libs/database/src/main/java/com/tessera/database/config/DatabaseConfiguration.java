package com.tessera.database.config;

import com.tessera.database.adapter.DatabaseAdapter;
import com.tessera.database.adapter.DatabaseAdapterFactory;
import com.tessera.database.adapter.InstrumentedDatabaseAdapter;
import com.tessera.database.adapter.mongo.MongoExtensions;
import com.tessera.database.adapter.sql.PostgresExtensions;
import com.tessera.database.migration.Migration;
import com.tessera.database.migration.MigrationRegistry;
import com.tessera.database.migration.MigrationRunner;
import com.tessera.database.migration.MigrationSource;
import com.tessera.database.migration.SqlDirectoryMigrationSource;
import com.tessera.database.model.Database;
import com.tessera.database.query.MacroRegistry;
import com.tessera.database.schema.Schema;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires a connected adapter, the {@link Database} facade, the {@link Schema} builder and the {@link
 * MigrationRunner} from {@link DatabaseProperties}.
 *
 * <p>Active only with {@code tessera.database.enabled=true}. When a {@link MeterRegistry} bean is
 * present the adapter is wrapped in an {@link InstrumentedDatabaseAdapter}. The backend's macros
 * ({@code populate}/{@code aggregate}/{@code exec} on MongoDB, {@code search} on PostgreSQL) are
 * registered on the database's macro registry.
 */
@Configuration
@EnableConfigurationProperties(DatabaseProperties.class)
@ConditionalOnProperty(prefix = "tessera.database", name = "enabled", havingValue = "true")
public class DatabaseConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DatabaseConfiguration.class);

    public static final String ADAPTER_FACTORY_BEAN = "tesseraDatabaseAdapterFactory";
    public static final String ADAPTER_BEAN = "tesseraDatabaseAdapter";
    public static final String DATABASE_BEAN = "tesseraDatabase";
    public static final String SCHEMA_BEAN = "tesseraSchema";
    public static final String MIGRATION_RUNNER_BEAN = "tesseraMigrationRunner";

    @Bean(name = ADAPTER_FACTORY_BEAN)
    public DatabaseAdapterFactory databaseAdapterFactory() {
        return DatabaseAdapterFactory.withDefaults();
    }

    @Bean(name = ADAPTER_BEAN, destroyMethod = "disconnect")
    public DatabaseAdapter databaseAdapter(
            DatabaseAdapterFactory factory,
            DatabaseProperties properties,
            ObjectProvider<MeterRegistry> meterRegistry) {
        DatabaseConfig config = properties.toConfig();
        DatabaseAdapter adapter = factory.create(config.type());
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry != null) {
            adapter = new InstrumentedDatabaseAdapter(adapter, registry);
        }
        adapter.connect(config);
        return adapter;
    }

    @Bean(name = DATABASE_BEAN)
    public Database database(DatabaseAdapter adapter) {
        MacroRegistry macros = new MacroRegistry();
        switch (adapter.type()) {
            case MONGODB -> MongoExtensions.register(macros);
            case POSTGRES -> PostgresExtensions.register(macros);
            default -> {
                // no backend macros
            }
        }
        return new Database(adapter, macros);
    }

    @Bean(name = SCHEMA_BEAN)
    public Schema schema(DatabaseAdapter adapter) {
        return new Schema(adapter);
    }

    @Bean(name = MIGRATION_RUNNER_BEAN)
    public MigrationRunner migrationRunner(
            Schema schema, DatabaseProperties properties, ObjectProvider<Migration> migrations) {
        DatabaseProperties.Migrations settings = properties.migrations();
        MigrationSource source;
        if (settings.location() != null && !settings.location().isBlank()) {
            source = new SqlDirectoryMigrationSource(settings.location());
        } else {
            MigrationRegistry registry = new MigrationRegistry();
            migrations.orderedStream().forEach(registry::register);
            source = registry;
        }
        MigrationRunner runner = new MigrationRunner(schema, source, settings.table());
        if (settings.runOnStartup()) {
            log.info("Applying pending migrations on startup");
            runner.migrate();
        }
        return runner;
    }
}
