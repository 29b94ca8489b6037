package com.tessera.database.adapter.sql;

import com.tessera.database.adapter.AggregateFunction;
import com.tessera.database.adapter.BooleanOperator;
import com.tessera.database.adapter.ColumnDefinition;
import com.tessera.database.adapter.DefaultExpression;
import com.tessera.database.adapter.ForeignKeyDefinition;
import com.tessera.database.adapter.JoinClause;
import com.tessera.database.adapter.Operator;
import com.tessera.database.adapter.OrderByClause;
import com.tessera.database.adapter.SelectOptions;
import com.tessera.database.adapter.WhereClause;
import com.tessera.database.config.DatabaseType;
import com.tessera.database.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Compiles backend-neutral descriptors into parameterized SQL for one dialect.
 *
 * <p>Values are always bound, never inlined. Identifiers are validated and quoted with the
 * dialect's quote character. Subclasses supply quoting, column types and the statements whose
 * syntax differs between engines.
 */
public abstract class SqlGrammar {

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_$]*$");
    private static final Pattern ALIAS = Pattern.compile("\\s+as\\s+", Pattern.CASE_INSENSITIVE);
    private static final Set<String> REFERENTIAL_ACTIONS =
            Set.of("CASCADE", "RESTRICT", "SET NULL", "SET DEFAULT", "NO ACTION");

    public abstract DatabaseType type();

    protected abstract String quoteIdentifier(String identifier);

    protected abstract String typeFor(ColumnDefinition column);

    protected abstract String compileAutoIncrement(ColumnDefinition column);

    protected abstract String compileLimit(Integer limit, Integer offset);

    protected abstract String compileEmptyInsert(String table);

    public abstract SqlStatement compileRenameTable(String from, String to);

    public abstract List<SqlStatement> compileDropAllTables(List<String> tables);

    /** Hook for operators the dialect cannot express. */
    protected void checkOperator(Operator operator) {}

    /** Converts a value into something the driver binds natively. */
    public Object prepareBinding(Object value) {
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        if (value instanceof Character c) {
            return c.toString();
        }
        return value;
    }

    // ---- identifiers ----

    /**
     * Quotes a single identifier.
     *
     * @throws ConfigurationException if the identifier is not a plain name
     */
    public String quote(String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new ConfigurationException(
                    "Invalid identifier '%s'".formatted(identifier), Map.of("identifier", String.valueOf(identifier)));
        }
        return quoteIdentifier(identifier);
    }

    /** Quotes a possibly qualified ({@code a.b}), aliased ({@code x as y}) or wildcard reference. */
    public String wrap(String value) {
        String trimmed = value == null ? null : value.trim();
        if ("*".equals(trimmed)) {
            return "*";
        }
        if (trimmed != null) {
            String[] aliased = ALIAS.split(trimmed);
            if (aliased.length == 2) {
                return wrap(aliased[0]) + " AS " + quote(aliased[1].trim());
            }
        }
        if (trimmed != null && trimmed.contains(".")) {
            String[] segments = trimmed.split("\\.");
            StringBuilder out = new StringBuilder();
            for (int i = 0; i < segments.length; i++) {
                if (i > 0) {
                    out.append('.');
                }
                out.append(i == segments.length - 1 && "*".equals(segments[i]) ? "*" : quote(segments[i]));
            }
            return out.toString();
        }
        return quote(trimmed);
    }

    // ---- DML ----

    public SqlStatement compileSelect(String table, SelectOptions options) {
        List<Object> bindings = new ArrayList<>();
        String columns = options.selectsAll()
                ? "*"
                : options.columns().stream().map(this::wrap).collect(Collectors.joining(", "));
        StringBuilder sql = new StringBuilder("SELECT ").append(columns).append(" FROM ").append(wrap(table));
        appendJoins(sql, options.joins());
        appendWheres(sql, options.where(), bindings);
        if (!options.orderBy().isEmpty()) {
            sql.append(" ORDER BY ")
                    .append(options.orderBy().stream()
                            .map(o -> wrap(o.column()) + (o.direction() == OrderByClause.Direction.DESC ? " DESC" : " ASC"))
                            .collect(Collectors.joining(", ")));
        }
        String limit = compileLimit(options.limit(), options.offset());
        if (!limit.isEmpty()) {
            sql.append(' ').append(limit);
        }
        return new SqlStatement(sql.toString(), bindings);
    }

    public SqlStatement compileAggregate(
            String table, AggregateFunction function, String column, SelectOptions options) {
        List<Object> bindings = new ArrayList<>();
        String target = function == AggregateFunction.COUNT || column == null || "*".equals(column)
                ? "*"
                : wrap(column);
        StringBuilder sql = new StringBuilder("SELECT ")
                .append(function.name())
                .append('(')
                .append(target)
                .append(") AS ")
                .append(quote("aggregate"))
                .append(" FROM ")
                .append(wrap(table));
        appendJoins(sql, options.joins());
        appendWheres(sql, options.where(), bindings);
        return new SqlStatement(sql.toString(), bindings);
    }

    public SqlStatement compileInsert(String table, Map<String, Object> data) {
        if (data.isEmpty()) {
            return SqlStatement.of(compileEmptyInsert(table));
        }
        List<Object> bindings = new ArrayList<>();
        List<String> columns = new ArrayList<>();
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            columns.add(wrap(entry.getKey()));
            bindings.add(prepareBinding(entry.getValue()));
        }
        String placeholders = String.join(", ", Collections.nCopies(columns.size(), "?"));
        return new SqlStatement(
                "INSERT INTO " + wrap(table) + " (" + String.join(", ", columns) + ") VALUES (" + placeholders + ")",
                bindings);
    }

    public SqlStatement compileUpdate(String table, List<WhereClause> where, Map<String, Object> data) {
        if (data.isEmpty()) {
            throw new IllegalArgumentException("update requires at least one column");
        }
        List<Object> bindings = new ArrayList<>();
        List<String> sets = new ArrayList<>();
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            sets.add(wrap(entry.getKey()) + " = ?");
            bindings.add(prepareBinding(entry.getValue()));
        }
        StringBuilder sql = new StringBuilder("UPDATE ").append(wrap(table)).append(" SET ").append(String.join(", ", sets));
        appendWheres(sql, where, bindings);
        return new SqlStatement(sql.toString(), bindings);
    }

    public SqlStatement compileDelete(String table, List<WhereClause> where) {
        List<Object> bindings = new ArrayList<>();
        StringBuilder sql = new StringBuilder("DELETE FROM ").append(wrap(table));
        appendWheres(sql, where, bindings);
        return new SqlStatement(sql.toString(), bindings);
    }

    private void appendJoins(StringBuilder sql, List<JoinClause> joins) {
        for (JoinClause join : joins) {
            sql.append(' ')
                    .append(join.type().name())
                    .append(" JOIN ")
                    .append(wrap(join.table()))
                    .append(" ON ")
                    .append(wrap(join.first()))
                    .append(' ')
                    .append(join.operator().symbol())
                    .append(' ')
                    .append(wrap(join.second()));
        }
    }

    private void appendWheres(StringBuilder sql, List<WhereClause> where, List<Object> bindings) {
        String compiled = compileWheres(where, bindings);
        if (!compiled.isEmpty()) {
            sql.append(" WHERE ").append(compiled);
        }
    }

    /** Predicate text without the {@code WHERE} keyword; empty when there is nothing to filter on. */
    public String compileWheres(List<WhereClause> where, List<Object> bindings) {
        StringBuilder sql = new StringBuilder();
        for (WhereClause clause : where) {
            String fragment = compileWhere(clause, bindings);
            if (fragment.isEmpty()) {
                continue;
            }
            if (sql.length() > 0) {
                sql.append(clause.bool() == BooleanOperator.OR ? " OR " : " AND ");
            }
            sql.append(fragment);
        }
        return sql.toString();
    }

    private String compileWhere(WhereClause clause, List<Object> bindings) {
        switch (clause.kind()) {
            case NESTED: {
                String inner = compileWheres(clause.nested(), bindings);
                return inner.isEmpty() ? "" : "(" + inner + ")";
            }
            case RAW:
                clause.values().forEach(v -> bindings.add(prepareBinding(v)));
                return "(" + clause.column() + ")";
            case COLUMN:
                return wrap(clause.column()) + " " + clause.operator().symbol() + " " + wrap((String) clause.value());
            default:
                return compileBasic(clause, bindings);
        }
    }

    private String compileBasic(WhereClause clause, List<Object> bindings) {
        Operator operator = clause.operator();
        checkOperator(operator);
        String column = wrap(clause.column());
        switch (operator) {
            case IS_NULL:
            case IS_NOT_NULL:
                return column + " " + operator.symbol();
            case IN:
            case NOT_IN: {
                List<Object> values = clause.values();
                if (values.isEmpty()) {
                    return operator == Operator.IN ? "0 = 1" : "1 = 1";
                }
                values.forEach(v -> bindings.add(prepareBinding(v)));
                return column + " " + operator.symbol() + " ("
                        + String.join(", ", Collections.nCopies(values.size(), "?")) + ")";
            }
            case BETWEEN:
            case NOT_BETWEEN:
                bindings.add(prepareBinding(clause.values().get(0)));
                bindings.add(prepareBinding(clause.values().get(1)));
                return column + " " + operator.symbol() + " ? AND ?";
            default:
                bindings.add(prepareBinding(clause.value()));
                return column + " " + operator.symbol() + " ?";
        }
    }

    // ---- DDL ----

    public SqlStatement compileCreateTable(String table, List<ColumnDefinition> columns) {
        if (columns.isEmpty()) {
            throw new ConfigurationException("Table '%s' needs at least one column".formatted(table));
        }
        List<String> parts = new ArrayList<>();
        for (ColumnDefinition column : columns) {
            parts.add(compileColumn(column));
        }
        for (ColumnDefinition column : columns) {
            if (column.foreignKey() != null) {
                parts.add(compileForeignKey(table, column.foreignKey()));
            }
        }
        return SqlStatement.of("CREATE TABLE " + wrap(table) + " (" + String.join(", ", parts) + ")");
    }

    public SqlStatement compileDropTable(String table) {
        return SqlStatement.of("DROP TABLE " + wrap(table));
    }

    public SqlStatement compileAddColumn(String table, ColumnDefinition column) {
        StringBuilder sql = new StringBuilder("ALTER TABLE ")
                .append(wrap(table))
                .append(" ADD COLUMN ")
                .append(compileColumn(column));
        if (column.foreignKey() != null) {
            sql.append(", ADD ").append(compileForeignKey(table, column.foreignKey()));
        }
        return SqlStatement.of(sql.toString());
    }

    public SqlStatement compileDropColumn(String table, String column) {
        return SqlStatement.of("ALTER TABLE " + wrap(table) + " DROP COLUMN " + quote(column));
    }

    protected String compileColumn(ColumnDefinition column) {
        StringBuilder sql = new StringBuilder(quote(column.name())).append(' ').append(typeFor(column));
        sql.append(column.nullable() ? " NULL" : " NOT NULL");
        if (column.hasDefault()) {
            sql.append(" DEFAULT ").append(compileDefault(column.defaultValue()));
        }
        sql.append(compileAutoIncrement(column));
        if (column.primary()) {
            sql.append(" PRIMARY KEY");
        }
        if (column.unique() && !column.primary()) {
            sql.append(" UNIQUE");
        }
        return sql.toString();
    }

    protected String compileDefault(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value == DefaultExpression.CURRENT_TIMESTAMP) {
            return "CURRENT_TIMESTAMP";
        }
        if (value instanceof Boolean b) {
            return compileBoolean(b);
        }
        if (value instanceof Number) {
            return value.toString();
        }
        return "'" + value.toString().replace("'", "''") + "'";
    }

    protected String compileBoolean(boolean value) {
        return value ? "TRUE" : "FALSE";
    }

    protected String compileForeignKey(String table, ForeignKeyDefinition foreignKey) {
        StringBuilder sql = new StringBuilder("CONSTRAINT ")
                .append(quote(foreignKey.constraintName(table)))
                .append(" FOREIGN KEY (")
                .append(quote(foreignKey.column()))
                .append(") REFERENCES ")
                .append(wrap(foreignKey.referencedTable()))
                .append(" (")
                .append(quote(foreignKey.referencedColumn()))
                .append(')');
        if (foreignKey.onDelete() != null) {
            sql.append(" ON DELETE ").append(referentialAction(foreignKey.onDelete()));
        }
        if (foreignKey.onUpdate() != null) {
            sql.append(" ON UPDATE ").append(referentialAction(foreignKey.onUpdate()));
        }
        return sql.toString();
    }

    private static String referentialAction(String action) {
        String normalized = action.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        if (!REFERENTIAL_ACTIONS.contains(normalized)) {
            throw new ConfigurationException(
                    "Unknown referential action '%s'".formatted(action), Map.of("action", action));
        }
        return normalized;
    }
}
