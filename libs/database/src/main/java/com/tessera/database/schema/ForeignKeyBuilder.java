package com.tessera.database.schema;

import com.tessera.database.adapter.ForeignKeyDefinition;

/** {@code foreign(column).references(column).on(table).onDelete(action)}. */
public class ForeignKeyBuilder {

    private final String column;
    private String referencedColumn = "id";
    private String referencedTable;
    private String onDelete;
    private String onUpdate;

    ForeignKeyBuilder(String column) {
        this.column = column;
    }

    public ForeignKeyBuilder references(String column) {
        this.referencedColumn = column;
        return this;
    }

    public ForeignKeyBuilder on(String table) {
        this.referencedTable = table;
        return this;
    }

    public ForeignKeyBuilder onDelete(String action) {
        this.onDelete = action;
        return this;
    }

    public ForeignKeyBuilder onUpdate(String action) {
        this.onUpdate = action;
        return this;
    }

    public ForeignKeyBuilder cascadeOnDelete() {
        return onDelete("cascade");
    }

    public ForeignKeyBuilder nullOnDelete() {
        return onDelete("set null");
    }

    String column() {
        return column;
    }

    ForeignKeyDefinition build() {
        if (referencedTable == null) {
            throw new IllegalStateException("Foreign key on '" + column + "' has no referenced table; call on(table)");
        }
        return new ForeignKeyDefinition(column, referencedTable, referencedColumn, onDelete, onUpdate);
    }
}
