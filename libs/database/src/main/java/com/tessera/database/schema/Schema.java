package com.tessera.database.schema;

import com.tessera.database.adapter.ColumnDefinition;
import com.tessera.database.adapter.DatabaseAdapter;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schema operations on the connected backend, driven by {@link Blueprint}s.
 *
 * <pre>{@code
 * schema.create("posts", table -> {
 *     table.id();
 *     table.foreignId("user_id").constrained().cascadeOnDelete();
 *     table.string("title");
 *     table.timestamps();
 * });
 * }</pre>
 */
public class Schema {

    private static final Logger log = LoggerFactory.getLogger(Schema.class);

    private final DatabaseAdapter adapter;

    public Schema(DatabaseAdapter adapter) {
        if (adapter == null) {
            throw new IllegalArgumentException("adapter must not be null");
        }
        this.adapter = adapter;
    }

    public void create(String table, Consumer<Blueprint> definition) {
        Blueprint blueprint = new Blueprint(table);
        definition.accept(blueprint);
        adapter.createTable(table, blueprint.columns());
        log.debug("Created table {}", table);
    }

    /** Alters an existing table: declared columns are added, then dropped columns removed. */
    public void table(String table, Consumer<Blueprint> definition) {
        Blueprint blueprint = new Blueprint(table);
        definition.accept(blueprint);
        for (ColumnDefinition column : blueprint.columns()) {
            adapter.addColumn(table, column);
        }
        for (String column : blueprint.droppedColumns()) {
            adapter.dropColumn(table, column);
        }
        log.debug("Altered table {}", table);
    }

    public void drop(String table) {
        adapter.dropTable(table);
        log.debug("Dropped table {}", table);
    }

    public void dropIfExists(String table) {
        if (adapter.hasTable(table)) {
            drop(table);
        }
    }

    public void rename(String from, String to) {
        adapter.renameTable(from, to);
    }

    public boolean hasTable(String table) {
        return adapter.hasTable(table);
    }

    public boolean hasColumn(String table, String column) {
        return adapter.hasColumn(table, column);
    }

    public boolean hasColumns(String table, String... columns) {
        for (String column : columns) {
            if (!adapter.hasColumn(table, column)) {
                return false;
            }
        }
        return true;
    }

    public DatabaseAdapter adapter() {
        return adapter;
    }
}
