package com.tessera.database.adapter;

import com.tessera.database.adapter.mongo.MongoAdapter;
import com.tessera.database.adapter.sql.MySqlAdapter;
import com.tessera.database.adapter.sql.PostgresAdapter;
import com.tessera.database.config.DatabaseConfig;
import com.tessera.database.config.DatabaseType;
import com.tessera.database.exception.ConfigurationException;
import com.tessera.database.testing.InMemoryDatabaseAdapter;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Creates adapters by backend type from an explicit registry.
 *
 * <p>{@link #withDefaults()} registers the built-in MySQL, PostgreSQL, MongoDB and in-memory
 * adapters. Additional backends are added with {@link #register}.
 */
public final class DatabaseAdapterFactory {

    private final Map<DatabaseType, Supplier<? extends DatabaseAdapter>> suppliers =
            new EnumMap<>(DatabaseType.class);

    public static DatabaseAdapterFactory withDefaults() {
        return new DatabaseAdapterFactory()
                .register(DatabaseType.MYSQL, MySqlAdapter::new)
                .register(DatabaseType.POSTGRES, PostgresAdapter::new)
                .register(DatabaseType.MONGODB, MongoAdapter::new)
                .register(DatabaseType.MEMORY, InMemoryDatabaseAdapter::new);
    }

    public DatabaseAdapterFactory register(
            DatabaseType type, Supplier<? extends DatabaseAdapter> supplier) {
        if (type == null || supplier == null) {
            throw new IllegalArgumentException("type and supplier must not be null");
        }
        suppliers.put(type, supplier);
        return this;
    }

    public Set<DatabaseType> registeredTypes() {
        return Set.copyOf(suppliers.keySet());
    }

    /**
     * New, unconnected adapter for {@code type}.
     *
     * @throws ConfigurationException if no adapter is registered for the type
     */
    public DatabaseAdapter create(DatabaseType type) {
        Supplier<? extends DatabaseAdapter> supplier = type == null ? null : suppliers.get(type);
        if (supplier == null) {
            throw new ConfigurationException(
                    "No adapter registered for database type " + type,
                    Map.of("type", String.valueOf(type)));
        }
        return supplier.get();
    }

    /** Creates an adapter for {@code config.type()} and connects it. */
    public DatabaseAdapter connect(DatabaseConfig config) {
        DatabaseAdapter adapter = create(config.type());
        adapter.connect(config);
        return adapter;
    }
}
