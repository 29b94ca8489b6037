package com.tessera.database.schema;

import com.tessera.database.adapter.ColumnDefinition;
import com.tessera.database.adapter.ColumnType;
import com.tessera.database.adapter.DefaultExpression;
import com.tessera.database.adapter.ForeignKeyDefinition;

/** Fluent modifiers for one column declared on a {@link Blueprint}. */
public class ColumnBuilder {

    private final Blueprint blueprint;
    private final String name;
    private final ColumnType type;
    private Integer length;
    private Integer precision;
    private Integer scale;
    private boolean nullable;
    private Object defaultValue;
    private boolean hasDefault;
    private boolean unique;
    private boolean primary;
    private boolean autoIncrement;
    private boolean unsigned;

    ColumnBuilder(Blueprint blueprint, String name, ColumnType type) {
        this.blueprint = blueprint;
        this.name = name;
        this.type = type;
        boolean increments = type.autoIncrementing();
        this.primary = increments;
        this.autoIncrement = increments;
        this.unsigned = increments;
    }

    ColumnBuilder length(Integer length) {
        this.length = length;
        return this;
    }

    ColumnBuilder precision(Integer precision, Integer scale) {
        this.precision = precision;
        this.scale = scale;
        return this;
    }

    public ColumnBuilder nullable() {
        return nullable(true);
    }

    public ColumnBuilder nullable(boolean nullable) {
        this.nullable = nullable;
        return this;
    }

    /** Literal default; {@code null} means {@code DEFAULT NULL}. */
    public ColumnBuilder defaultValue(Object value) {
        this.defaultValue = value;
        this.hasDefault = true;
        return this;
    }

    /** {@code DEFAULT CURRENT_TIMESTAMP}. */
    public ColumnBuilder useCurrent() {
        return defaultValue(DefaultExpression.CURRENT_TIMESTAMP);
    }

    public ColumnBuilder unique() {
        this.unique = true;
        return this;
    }

    public ColumnBuilder primary() {
        this.primary = true;
        return this;
    }

    public ColumnBuilder autoIncrement() {
        this.autoIncrement = true;
        return this;
    }

    public ColumnBuilder unsigned() {
        this.unsigned = true;
        return this;
    }

    /**
     * Adds a foreign key on this column to {@code table.id}.
     *
     * @return the key builder, for referential actions
     */
    public ForeignKeyBuilder constrained(String table) {
        return blueprint.foreign(name).references("id").on(table);
    }

    /** {@link #constrained(String)} with the table guessed from the column: {@code user_id} → {@code users}. */
    public ForeignKeyBuilder constrained() {
        String base = name.endsWith("_id") ? name.substring(0, name.length() - 3) : name;
        return constrained(base + "s");
    }

    public String name() {
        return name;
    }

    ColumnDefinition build(ForeignKeyDefinition foreignKey) {
        return new ColumnDefinition(
                name, type, length, precision, scale, nullable, defaultValue, hasDefault, unique, primary,
                autoIncrement, unsigned, foreignKey);
    }
}
