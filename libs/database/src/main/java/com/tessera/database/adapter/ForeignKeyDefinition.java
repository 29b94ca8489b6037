package com.tessera.database.adapter;

/**
 * Foreign key from a column to another table.
 *
 * @param column local column
 * @param referencedTable referenced table
 * @param referencedColumn referenced column, usually {@code id}
 * @param onDelete referential action ({@code cascade}, {@code set null}, ...), may be null
 * @param onUpdate referential action, may be null
 */
public record ForeignKeyDefinition(
        String column, String referencedTable, String referencedColumn, String onDelete, String onUpdate) {

    public ForeignKeyDefinition {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("column must not be null or blank");
        }
        if (referencedTable == null || referencedTable.isBlank()) {
            throw new IllegalArgumentException("referenced table must not be null or blank");
        }
        if (referencedColumn == null || referencedColumn.isBlank()) {
            referencedColumn = "id";
        }
    }

    /** Constraint name, {@code <table>_<column>_foreign}. */
    public String constraintName(String table) {
        return table + "_" + column + "_foreign";
    }
}
