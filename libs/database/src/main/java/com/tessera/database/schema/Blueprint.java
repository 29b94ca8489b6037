package com.tessera.database.schema;

import com.tessera.database.adapter.ColumnDefinition;
import com.tessera.database.adapter.ColumnType;
import com.tessera.database.adapter.ForeignKeyDefinition;
import com.tessera.database.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Column and constraint declarations for one table, collected by {@link Schema#create} and {@link
 * Schema#table}.
 *
 * <p>Columns are NOT NULL unless marked {@link ColumnBuilder#nullable()}. A foreign key must name
 * a column declared on the same blueprint.
 */
public class Blueprint {

    public static final int DEFAULT_STRING_LENGTH = 255;

    private final String table;
    private final Map<String, ColumnBuilder> columns = new LinkedHashMap<>();
    private final Map<String, ForeignKeyBuilder> foreignKeys = new LinkedHashMap<>();
    private final List<String> dropColumns = new ArrayList<>();

    public Blueprint(String table) {
        this.table = table;
    }

    public String table() {
        return table;
    }

    // ---- keys ----

    /** Auto-incrementing big integer primary key named {@code id}. */
    public ColumnBuilder id() {
        return bigIncrements("id");
    }

    public ColumnBuilder increments(String name) {
        return add(name, ColumnType.INCREMENTS);
    }

    public ColumnBuilder bigIncrements(String name) {
        return add(name, ColumnType.BIG_INCREMENTS);
    }

    /** Unsigned big integer for referencing another table's {@code id}; chain {@code constrained()}. */
    public ColumnBuilder foreignId(String name) {
        return add(name, ColumnType.BIG_INTEGER).unsigned();
    }

    // ---- columns ----

    public ColumnBuilder string(String name) {
        return string(name, DEFAULT_STRING_LENGTH);
    }

    public ColumnBuilder string(String name, int length) {
        return add(name, ColumnType.STRING).length(length);
    }

    public ColumnBuilder text(String name) {
        return add(name, ColumnType.TEXT);
    }

    public ColumnBuilder integer(String name) {
        return add(name, ColumnType.INTEGER);
    }

    public ColumnBuilder bigInteger(String name) {
        return add(name, ColumnType.BIG_INTEGER);
    }

    public ColumnBuilder booleanColumn(String name) {
        return add(name, ColumnType.BOOLEAN);
    }

    public ColumnBuilder decimal(String name) {
        return decimal(name, 8, 2);
    }

    public ColumnBuilder decimal(String name, int precision, int scale) {
        return add(name, ColumnType.DECIMAL).precision(precision, scale);
    }

    public ColumnBuilder doubleColumn(String name) {
        return add(name, ColumnType.DOUBLE);
    }

    public ColumnBuilder date(String name) {
        return add(name, ColumnType.DATE);
    }

    public ColumnBuilder dateTime(String name) {
        return add(name, ColumnType.DATE_TIME);
    }

    public ColumnBuilder timestamp(String name) {
        return add(name, ColumnType.TIMESTAMP);
    }

    /** Nullable {@code created_at} and {@code updated_at}. */
    public void timestamps() {
        timestamp("created_at").nullable();
        timestamp("updated_at").nullable();
    }

    public ColumnBuilder json(String name) {
        return add(name, ColumnType.JSON);
    }

    public ColumnBuilder uuid(String name) {
        return add(name, ColumnType.UUID);
    }

    // ---- constraints / alterations ----

    public ForeignKeyBuilder foreign(String column) {
        ForeignKeyBuilder builder = new ForeignKeyBuilder(column);
        foreignKeys.put(column, builder);
        return builder;
    }

    public Blueprint dropColumn(String... names) {
        dropColumns.addAll(Arrays.asList(names));
        return this;
    }

    private ColumnBuilder add(String name, ColumnType type) {
        if (columns.containsKey(name)) {
            throw new ConfigurationException(
                    "Column '%s' is declared twice on '%s'".formatted(name, table), Map.of("table", table, "column", name));
        }
        ColumnBuilder builder = new ColumnBuilder(this, name, type);
        columns.put(name, builder);
        return builder;
    }

    /** Declared columns with their foreign keys attached. */
    public List<ColumnDefinition> columns() {
        for (String column : foreignKeys.keySet()) {
            if (!columns.containsKey(column)) {
                throw new ConfigurationException(
                        "Foreign key on '%s.%s' needs the column declared in the same blueprint".formatted(table, column),
                        Map.of("table", table, "column", column));
            }
        }
        List<ColumnDefinition> definitions = new ArrayList<>(columns.size());
        columns.forEach((name, builder) -> {
            ForeignKeyBuilder foreignKey = foreignKeys.get(name);
            ForeignKeyDefinition definition = foreignKey == null ? null : foreignKey.build();
            definitions.add(builder.build(definition));
        });
        return definitions;
    }

    public List<String> droppedColumns() {
        return List.copyOf(dropColumns);
    }
}
