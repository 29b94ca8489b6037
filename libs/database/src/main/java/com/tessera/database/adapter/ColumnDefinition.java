package com.tessera.database.adapter;

/**
 * Backend-neutral column description produced by the schema DSL.
 *
 * @param name column name
 * @param type logical type
 * @param length string length, null for the grammar default
 * @param precision decimal precision
 * @param scale decimal scale
 * @param nullable whether NULL is permitted
 * @param defaultValue default literal, or a {@link DefaultExpression}
 * @param hasDefault distinguishes "no default" from "default null"
 * @param unique single-column unique constraint
 * @param primary primary key column
 * @param autoIncrement auto-increment/serial
 * @param unsigned unsigned integer (MySQL only, ignored elsewhere)
 * @param foreignKey foreign key, may be null
 */
public record ColumnDefinition(
        String name,
        ColumnType type,
        Integer length,
        Integer precision,
        Integer scale,
        boolean nullable,
        Object defaultValue,
        boolean hasDefault,
        boolean unique,
        boolean primary,
        boolean autoIncrement,
        boolean unsigned,
        ForeignKeyDefinition foreignKey) {

    public ColumnDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("column name must not be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("column type must not be null");
        }
    }

    /** Plain NOT NULL column without default or constraints. */
    public static ColumnDefinition of(String name, ColumnType type) {
        boolean increments = type.autoIncrementing();
        return new ColumnDefinition(
                name, type, null, null, null, false, null, false, false, increments, increments, increments, null);
    }

    public ColumnDefinition withForeignKey(ForeignKeyDefinition foreignKey) {
        return new ColumnDefinition(
                name, type, length, precision, scale, nullable, defaultValue, hasDefault, unique, primary,
                autoIncrement, unsigned, foreignKey);
    }
}
