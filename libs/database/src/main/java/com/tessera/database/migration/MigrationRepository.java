package com.tessera.database.migration;

import com.tessera.database.adapter.DatabaseAdapter;
import com.tessera.database.model.Casts;
import com.tessera.database.query.QueryBuilder;
import com.tessera.database.schema.Schema;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads and writes the migrations table ({@code id, migration, batch, executed_at}). */
public class MigrationRepository {

    public static final String DEFAULT_TABLE = "migrations";

    private final DatabaseAdapter adapter;
    private final String table;

    public MigrationRepository(DatabaseAdapter adapter, String table) {
        if (adapter == null) {
            throw new IllegalArgumentException("adapter must not be null");
        }
        this.adapter = adapter;
        this.table = table == null || table.isBlank() ? DEFAULT_TABLE : table;
    }

    public boolean exists() {
        return adapter.hasTable(table);
    }

    public void createIfMissing() {
        if (exists()) {
            return;
        }
        new Schema(adapter).create(table, blueprint -> {
            blueprint.increments("id");
            blueprint.string("migration").unique();
            blueprint.integer("batch");
            blueprint.dateTime("executed_at").nullable();
        });
    }

    /** All records, oldest batch first, by name within a batch. */
    public List<MigrationRecord> records() {
        if (!exists()) {
            return List.of();
        }
        List<MigrationRecord> records = new ArrayList<>();
        for (Map<String, Object> row : query().orderBy("batch").orderBy("migration").get()) {
            records.add(new MigrationRecord(
                    row.get("id"),
                    (String) row.get("migration"),
                    ((Number) row.get("batch")).intValue(),
                    (LocalDateTime) Casts.DATETIME.decode(row.get("executed_at"))));
        }
        return records;
    }

    public int lastBatch() {
        if (!exists()) {
            return 0;
        }
        Object max = query().max("batch");
        return max == null ? 0 : ((Number) max).intValue();
    }

    public void log(String migration, int batch) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("migration", migration);
        row.put("batch", batch);
        row.put("executed_at", LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS));
        query().insert(row);
    }

    public void delete(String migration) {
        query().where("migration", migration).delete();
    }

    public String table() {
        return table;
    }

    private QueryBuilder<Map<String, Object>> query() {
        return QueryBuilder.rows(table, adapter);
    }
}
