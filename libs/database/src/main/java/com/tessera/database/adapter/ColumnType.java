package com.tessera.database.adapter;

/** Logical column types; each grammar maps them to native types. */
public enum ColumnType {
    INCREMENTS,
    BIG_INCREMENTS,
    STRING,
    TEXT,
    INTEGER,
    BIG_INTEGER,
    BOOLEAN,
    DECIMAL,
    DOUBLE,
    DATE,
    DATE_TIME,
    TIMESTAMP,
    JSON,
    UUID;

    public boolean autoIncrementing() {
        return this == INCREMENTS || this == BIG_INCREMENTS;
    }
}
