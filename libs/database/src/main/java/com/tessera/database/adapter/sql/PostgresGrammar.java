package com.tessera.database.adapter.sql;

import com.tessera.database.adapter.ColumnDefinition;
import com.tessera.database.config.DatabaseType;
import java.util.List;
import java.util.stream.Collectors;

/** PostgreSQL dialect: double-quote quoting, serial columns, native {@code ILIKE}. */
public class PostgresGrammar extends SqlGrammar {

    @Override
    public DatabaseType type() {
        return DatabaseType.POSTGRES;
    }

    @Override
    protected String quoteIdentifier(String identifier) {
        return "\"" + identifier + "\"";
    }

    @Override
    protected String typeFor(ColumnDefinition column) {
        return switch (column.type()) {
            case INCREMENTS -> "SERIAL";
            case BIG_INCREMENTS -> "BIGSERIAL";
            case INTEGER -> column.autoIncrement() ? "SERIAL" : "INTEGER";
            case BIG_INTEGER -> column.autoIncrement() ? "BIGSERIAL" : "BIGINT";
            case STRING -> "VARCHAR(" + (column.length() == null ? 255 : column.length()) + ")";
            case TEXT -> "TEXT";
            case BOOLEAN -> "BOOLEAN";
            case DECIMAL -> "DECIMAL("
                    + (column.precision() == null ? 8 : column.precision()) + ", "
                    + (column.scale() == null ? 2 : column.scale()) + ")";
            case DOUBLE -> "DOUBLE PRECISION";
            case DATE -> "DATE";
            case DATE_TIME, TIMESTAMP -> "TIMESTAMP(0) WITHOUT TIME ZONE";
            case JSON -> "JSONB";
            case UUID -> "UUID";
        };
    }

    /** Serial types carry the sequence. */
    @Override
    protected String compileAutoIncrement(ColumnDefinition column) {
        return "";
    }

    @Override
    protected String compileLimit(Integer limit, Integer offset) {
        StringBuilder sql = new StringBuilder();
        if (limit != null) {
            sql.append("LIMIT ").append(limit);
        }
        if (offset != null) {
            if (sql.length() > 0) {
                sql.append(' ');
            }
            sql.append("OFFSET ").append(offset);
        }
        return sql.toString();
    }

    @Override
    protected String compileEmptyInsert(String table) {
        return "INSERT INTO " + wrap(table) + " DEFAULT VALUES";
    }

    @Override
    public SqlStatement compileRenameTable(String from, String to) {
        return SqlStatement.of("ALTER TABLE " + wrap(from) + " RENAME TO " + wrap(to));
    }

    @Override
    public List<SqlStatement> compileDropAllTables(List<String> tables) {
        if (tables.isEmpty()) {
            return List.of();
        }
        return List.of(SqlStatement.of(
                "DROP TABLE " + tables.stream().map(this::wrap).collect(Collectors.joining(", ")) + " CASCADE"));
    }
}
