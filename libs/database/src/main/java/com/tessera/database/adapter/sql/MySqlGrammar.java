package com.tessera.database.adapter.sql;

import com.tessera.database.adapter.ColumnDefinition;
import com.tessera.database.adapter.Operator;
import com.tessera.database.config.DatabaseType;
import com.tessera.database.exception.UnsupportedBackendOperationException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/** MySQL / MariaDB dialect: backtick quoting, {@code AUTO_INCREMENT}, no {@code ILIKE}. */
public class MySqlGrammar extends SqlGrammar {

    /** MySQL has no OFFSET without LIMIT; this is the documented "all rows" limit. */
    static final String MAX_LIMIT = "18446744073709551615";

    @Override
    public DatabaseType type() {
        return DatabaseType.MYSQL;
    }

    @Override
    protected String quoteIdentifier(String identifier) {
        return "`" + identifier + "`";
    }

    @Override
    protected void checkOperator(Operator operator) {
        if (operator == Operator.ILIKE) {
            throw new UnsupportedBackendOperationException(DatabaseType.MYSQL, "where", operator.symbol());
        }
    }

    @Override
    public Object prepareBinding(Object value) {
        if (value instanceof UUID uuid) {
            return uuid.toString();
        }
        return super.prepareBinding(value);
    }

    @Override
    protected String typeFor(ColumnDefinition column) {
        String type = switch (column.type()) {
            case INCREMENTS, INTEGER -> "INT";
            case BIG_INCREMENTS, BIG_INTEGER -> "BIGINT";
            case STRING -> "VARCHAR(" + (column.length() == null ? 255 : column.length()) + ")";
            case TEXT -> "TEXT";
            case BOOLEAN -> "TINYINT(1)";
            case DECIMAL -> "DECIMAL(" + precision(column) + ", " + scale(column) + ")";
            case DOUBLE -> "DOUBLE";
            case DATE -> "DATE";
            case DATE_TIME -> "DATETIME";
            case TIMESTAMP -> "TIMESTAMP";
            case JSON -> "JSON";
            case UUID -> "CHAR(36)";
        };
        boolean integral = switch (column.type()) {
            case INCREMENTS, BIG_INCREMENTS, INTEGER, BIG_INTEGER -> true;
            default -> false;
        };
        return integral && column.unsigned() ? type + " UNSIGNED" : type;
    }

    @Override
    protected String compileAutoIncrement(ColumnDefinition column) {
        return column.autoIncrement() ? " AUTO_INCREMENT" : "";
    }

    @Override
    protected String compileBoolean(boolean value) {
        return value ? "1" : "0";
    }

    @Override
    protected String compileLimit(Integer limit, Integer offset) {
        if (limit == null && offset == null) {
            return "";
        }
        String sql = "LIMIT " + (limit == null ? MAX_LIMIT : limit.toString());
        return offset == null ? sql : sql + " OFFSET " + offset;
    }

    @Override
    protected String compileEmptyInsert(String table) {
        return "INSERT INTO " + wrap(table) + " () VALUES ()";
    }

    @Override
    public SqlStatement compileRenameTable(String from, String to) {
        return SqlStatement.of("RENAME TABLE " + wrap(from) + " TO " + wrap(to));
    }

    @Override
    public List<SqlStatement> compileDropAllTables(List<String> tables) {
        if (tables.isEmpty()) {
            return List.of();
        }
        List<SqlStatement> statements = new ArrayList<>();
        statements.add(SqlStatement.of("SET FOREIGN_KEY_CHECKS = 0"));
        statements.add(SqlStatement.of(
                "DROP TABLE " + tables.stream().map(this::wrap).collect(Collectors.joining(", "))));
        statements.add(SqlStatement.of("SET FOREIGN_KEY_CHECKS = 1"));
        return statements;
    }

    private static int precision(ColumnDefinition column) {
        return column.precision() == null ? 8 : column.precision();
    }

    private static int scale(ColumnDefinition column) {
        return column.scale() == null ? 2 : column.scale();
    }
}
