package com.tessera.database.model;

import com.tessera.database.adapter.DatabaseAdapter;
import com.tessera.database.query.MacroRegistry;
import com.tessera.database.query.QueryBuilder;
import com.tessera.database.schema.Schema;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Entry point tying one connected adapter to its macro registry, table queries, model
 * repositories and schema builder.
 */
public class Database {

    private final DatabaseAdapter adapter;
    private final MacroRegistry macros;

    public Database(DatabaseAdapter adapter) {
        this(adapter, new MacroRegistry());
    }

    public Database(DatabaseAdapter adapter, MacroRegistry macros) {
        if (adapter == null) {
            throw new IllegalArgumentException("adapter must not be null");
        }
        if (macros == null) {
            throw new IllegalArgumentException("macros must not be null");
        }
        this.adapter = adapter;
        this.macros = macros;
    }

    /** Row query over a table or collection. */
    public QueryBuilder<Map<String, Object>> table(String name) {
        return QueryBuilder.rows(name, adapter, macros);
    }

    /**
     * Repository for the models {@code constructor} builds, typically a constructor reference such
     * as {@code User::new}.
     */
    public <T extends Model> ModelRepository<T> model(Supplier<T> constructor) {
        return new ModelRepository<>(this, constructor);
    }

    public Schema schema() {
        return new Schema(adapter);
    }

    /** Runs {@code work} in an adapter transaction; see {@link DatabaseAdapter#transaction}. */
    public <T> T transaction(Supplier<T> work) {
        return adapter.transaction(work);
    }

    public DatabaseAdapter adapter() {
        return adapter;
    }

    public MacroRegistry macros() {
        return macros;
    }
}
