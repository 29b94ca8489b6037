package com.tessera.database.testing;

import com.tessera.database.adapter.AggregateFunction;
import com.tessera.database.adapter.BooleanOperator;
import com.tessera.database.adapter.ColumnDefinition;
import com.tessera.database.adapter.DatabaseAdapter;
import com.tessera.database.adapter.DatabaseConnection;
import com.tessera.database.adapter.DefaultExpression;
import com.tessera.database.adapter.LikePatterns;
import com.tessera.database.adapter.Operator;
import com.tessera.database.adapter.OrderByClause;
import com.tessera.database.adapter.SelectOptions;
import com.tessera.database.adapter.WhereClause;
import com.tessera.database.config.DatabaseConfig;
import com.tessera.database.config.DatabaseType;
import com.tessera.database.exception.ConnectionException;
import com.tessera.database.exception.DatabaseException;
import com.tessera.database.exception.QueryExecutionException;
import com.tessera.database.exception.UnsupportedBackendOperationException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.chrono.ChronoLocalDate;
import java.time.chrono.ChronoLocalDateTime;
import java.time.chrono.ChronoZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * In-process relational adapter for tests and local profiles.
 *
 * <p>Behaves like a strict SQL table store: columns must be declared before use, NOT NULL and
 * unique constraints are enforced (a duplicate raises {@link QueryExecutionException} with SQL
 * state {@code 23505}), auto-increment keys are generated, AND binds tighter than OR, and NULL
 * never compares equal. Transactions nest through snapshots. Joins and raw SQL are not supported.
 *
 * <p>Every data operation is recorded as {@code "<operation>:<table>"} in {@link #operations()},
 * so tests can assert how many queries a call issued. Placed in {@code src/main/java} for
 * cross-module test use.
 */
public final class InMemoryDatabaseAdapter implements DatabaseAdapter {

    private static final String UNIQUE_VIOLATION = "23505";
    private static final String NOT_NULL_VIOLATION = "23502";
    private static final String UNDEFINED_TABLE = "42S02";
    private static final String DUPLICATE_TABLE = "42S01";
    private static final String UNDEFINED_COLUMN = "42S22";
    private static final String DUPLICATE_COLUMN = "42S21";

    private Map<String, Table> tables = new LinkedHashMap<>();
    private final Deque<Map<String, Table>> snapshots = new ArrayDeque<>();
    private final List<String> operations = new ArrayList<>();
    private String database;
    private boolean connected;

    /** New adapter, already connected to a database named {@code memory}. */
    public static InMemoryDatabaseAdapter connected() {
        InMemoryDatabaseAdapter adapter = new InMemoryDatabaseAdapter();
        adapter.connect(DatabaseConfig.builder(DatabaseType.MEMORY).database("memory").build());
        return adapter;
    }

    @Override
    public DatabaseType type() {
        return DatabaseType.MEMORY;
    }

    @Override
    public synchronized DatabaseConnection connect(DatabaseConfig config) {
        if (config.type() != type()) {
            throw new ConnectionException(
                    type(), "connect", "Configuration is for %s, not %s".formatted(config.type().tag(), type().tag()));
        }
        if (connected) {
            throw new ConnectionException(type(), "connect", "Adapter is already connected");
        }
        database = config.database() == null ? "memory" : config.database();
        connected = true;
        return new DatabaseConnection(type(), database, this);
    }

    /** Discards all tables and open transactions. */
    @Override
    public synchronized void disconnect() {
        if (!connected) {
            return;
        }
        connected = false;
        tables = new LinkedHashMap<>();
        snapshots.clear();
    }

    @Override
    public synchronized boolean isConnected() {
        return connected;
    }

    // ---- test hooks ----

    /** Recorded data operations, oldest first. */
    public synchronized List<String> operations() {
        return List.copyOf(operations);
    }

    /** Number of recorded operations of one kind, e.g. {@code count("select")}. */
    public synchronized long operationCount(String operation) {
        return operations.stream().filter(entry -> entry.startsWith(operation + ":")).count();
    }

    public synchronized void resetOperations() {
        operations.clear();
    }

    /** Current transaction nesting depth. */
    public synchronized int transactionDepth() {
        return snapshots.size();
    }

    // ---- schema ----

    @Override
    public synchronized void createTable(String table, List<ColumnDefinition> columns) {
        requireConnected("createTable");
        if (tables.containsKey(table)) {
            throw failure("createTable", table, "table already exists", DUPLICATE_TABLE);
        }
        Table created = new Table();
        for (ColumnDefinition column : columns) {
            if (created.columns.putIfAbsent(column.name(), column) != null) {
                throw failure("createTable", table, "duplicate column " + column.name(), DUPLICATE_COLUMN);
            }
        }
        tables.put(table, created);
    }

    @Override
    public synchronized void dropTable(String table) {
        requireConnected("dropTable");
        if (tables.remove(table) == null) {
            throw failure("dropTable", table, "unknown table", UNDEFINED_TABLE);
        }
    }

    @Override
    public synchronized boolean hasTable(String table) {
        requireConnected("hasTable");
        return tables.containsKey(table);
    }

    @Override
    public synchronized boolean hasColumn(String table, String column) {
        requireConnected("hasColumn");
        Table existing = tables.get(table);
        return existing != null && existing.columns.containsKey(column);
    }

    @Override
    public synchronized void addColumn(String table, ColumnDefinition column) {
        requireConnected("addColumn");
        Table existing = requireTable("addColumn", table);
        if (existing.columns.containsKey(column.name())) {
            throw failure("addColumn", table, "duplicate column " + column.name(), DUPLICATE_COLUMN);
        }
        existing.columns.put(column.name(), column);
        for (Map<String, Object> row : existing.rows) {
            row.put(column.name(), defaultFor(column));
        }
    }

    @Override
    public synchronized void dropColumn(String table, String column) {
        requireConnected("dropColumn");
        Table existing = requireTable("dropColumn", table);
        if (existing.columns.remove(column) == null) {
            throw failure("dropColumn", table, "unknown column " + column, UNDEFINED_COLUMN);
        }
        existing.rows.forEach(row -> row.remove(column));
    }

    @Override
    public synchronized void renameTable(String from, String to) {
        requireConnected("renameTable");
        Table existing = requireTable("renameTable", from);
        if (tables.containsKey(to)) {
            throw failure("renameTable", to, "table already exists", DUPLICATE_TABLE);
        }
        tables.remove(from);
        tables.put(to, existing);
    }

    @Override
    public synchronized List<String> listTables() {
        requireConnected("listTables");
        return new ArrayList<>(tables.keySet());
    }

    @Override
    public synchronized void dropAllTables() {
        requireConnected("dropAllTables");
        tables.clear();
    }

    // ---- data ----

    @Override
    public synchronized List<Map<String, Object>> select(String table, SelectOptions options) {
        requireConnected("select");
        if (!options.joins().isEmpty()) {
            throw new UnsupportedBackendOperationException(type(), "select", "join");
        }
        Table existing = requireTable("select", table);
        List<Map<String, Object>> matched = matching("select", table, existing, options.where());
        operations.add("select:" + table);
        if (!options.orderBy().isEmpty()) {
            matched.sort(ordering("select", table, existing, options.orderBy()));
        }
        int from = options.offset() == null ? 0 : Math.min(options.offset(), matched.size());
        int to = options.limit() == null ? matched.size() : Math.min(matched.size(), from + options.limit());
        List<Map<String, Object>> rows = new ArrayList<>(to - from);
        for (Map<String, Object> row : matched.subList(from, to)) {
            rows.add(project("select", table, existing, row, options));
        }
        return rows;
    }

    @Override
    public synchronized Object insert(String table, Map<String, Object> data, String keyName) {
        requireConnected("insert");
        Table existing = requireTable("insert", table);
        Map<String, Object> row = new LinkedHashMap<>();
        for (ColumnDefinition column : existing.columns.values()) {
            row.put(column.name(), defaultFor(column));
        }
        data.forEach((column, value) -> {
            requireColumn("insert", table, existing, column);
            row.put(unqualified(column), normalize(value));
        });
        for (ColumnDefinition column : existing.columns.values()) {
            if (column.autoIncrement()) {
                Object supplied = row.get(column.name());
                if (supplied == null) {
                    row.put(column.name(), existing.nextId++);
                } else if (supplied instanceof Number number) {
                    existing.nextId = Math.max(existing.nextId, number.longValue() + 1);
                }
            }
        }
        checkConstraints("insert", table, existing, row, null);
        existing.rows.add(row);
        operations.add("insert:" + table);
        return keyName == null ? null : row.get(keyName);
    }

    @Override
    public synchronized int update(String table, List<WhereClause> where, Map<String, Object> data) {
        requireConnected("update");
        if (data.isEmpty()) {
            throw new IllegalArgumentException("update requires at least one column");
        }
        Table existing = requireTable("update", table);
        data.keySet().forEach(column -> requireColumn("update", table, existing, column));
        List<Map<String, Object>> matched = matching("update", table, existing, where);
        List<Map<String, Object>> updated = new ArrayList<>(matched.size());
        for (Map<String, Object> row : matched) {
            Map<String, Object> candidate = new LinkedHashMap<>(row);
            data.forEach((column, value) -> candidate.put(unqualified(column), normalize(value)));
            checkConstraints("update", table, existing, candidate, matched);
            updated.add(candidate);
        }
        for (int i = 0; i < matched.size(); i++) {
            matched.get(i).putAll(updated.get(i));
        }
        operations.add("update:" + table);
        return matched.size();
    }

    @Override
    public synchronized int delete(String table, List<WhereClause> where) {
        requireConnected("delete");
        Table existing = requireTable("delete", table);
        List<Map<String, Object>> matched = matching("delete", table, existing, where);
        existing.rows.removeIf(row -> matched.stream().anyMatch(m -> m == row));
        operations.add("delete:" + table);
        return matched.size();
    }

    @Override
    public synchronized Object aggregate(
            String table, AggregateFunction function, String column, SelectOptions options) {
        requireConnected("aggregate");
        if (!options.joins().isEmpty()) {
            throw new UnsupportedBackendOperationException(type(), "aggregate", "join");
        }
        Table existing = requireTable("aggregate", table);
        List<Map<String, Object>> matched = matching("aggregate", table, existing, options.where());
        operations.add("aggregate:" + table);
        if (function == AggregateFunction.COUNT) {
            return (long) matched.size();
        }
        requireColumn("aggregate", table, existing, column);
        String name = unqualified(column);
        List<Object> values = new ArrayList<>();
        matched.forEach(row -> {
            if (row.get(name) != null) {
                values.add(row.get(name));
            }
        });
        if (values.isEmpty()) {
            return null;
        }
        return switch (function) {
            case SUM -> sum(values);
            case AVG -> sum(values).doubleValue() / values.size();
            case MIN -> values.stream().min(InMemoryDatabaseAdapter::compare).orElse(null);
            case MAX -> values.stream().max(InMemoryDatabaseAdapter::compare).orElse(null);
            case COUNT -> throw new IllegalStateException("count handled above");
        };
    }

    // ---- transactions ----

    @Override
    public synchronized void beginTransaction() {
        requireConnected("beginTransaction");
        snapshots.push(copy(tables));
    }

    @Override
    public synchronized void commit() {
        requireConnected("commit");
        if (snapshots.isEmpty()) {
            throw new DatabaseException("No active transaction", type(), "commit");
        }
        snapshots.pop();
    }

    @Override
    public synchronized void rollback() {
        requireConnected("rollback");
        if (snapshots.isEmpty()) {
            throw new DatabaseException("No active transaction", type(), "rollback");
        }
        tables = snapshots.pop();
    }

    @Override
    public boolean supportsTransactions() {
        return true;
    }

    @Override
    public Object raw(String query, List<Object> params) {
        requireConnected("raw");
        throw new UnsupportedBackendOperationException(type(), "raw", "raw query");
    }

    // ---- predicate evaluation ----

    private List<Map<String, Object>> matching(
            String operation, String table, Table existing, List<WhereClause> where) {
        List<Map<String, Object>> matched = new ArrayList<>();
        for (Map<String, Object> row : existing.rows) {
            if (matches(operation, table, existing, row, where)) {
                matched.add(row);
            }
        }
        return matched;
    }

    /** OR-separated runs of AND-joined clauses; the first clause's connective is ignored. */
    private boolean matches(
            String operation, String table, Table existing, Map<String, Object> row, List<WhereClause> where) {
        boolean any = false;
        Boolean group = null;
        for (WhereClause clause : where) {
            if (clause.kind() == WhereClause.Kind.NESTED && clause.nested().isEmpty()) {
                continue;
            }
            if (group != null && clause.bool() == BooleanOperator.OR) {
                any |= group;
                group = null;
            }
            boolean result = evaluate(operation, table, existing, row, clause);
            group = group == null ? result : group && result;
        }
        // no predicates left after skipping empty groups
        return group == null || any || group;
    }

    private boolean evaluate(
            String operation, String table, Table existing, Map<String, Object> row, WhereClause clause) {
        switch (clause.kind()) {
            case NESTED:
                return matches(operation, table, existing, row, clause.nested());
            case RAW:
                throw new UnsupportedBackendOperationException(type(), operation, "raw where");
            case COLUMN: {
                Object left = read(operation, table, existing, row, clause.column());
                Object right = read(operation, table, existing, row, (String) clause.value());
                return compareWith(clause, left, right);
            }
            default:
                break;
        }
        Object value = read(operation, table, existing, row, clause.column());
        List<Object> operands = clause.values();
        switch (clause.operator()) {
            case IS_NULL:
                return value == null;
            case IS_NOT_NULL:
                return value != null;
            case LIKE:
            case NOT_LIKE:
            case ILIKE: {
                if (value == null || clause.value() == null) {
                    return false;
                }
                boolean found = LikePatterns.compile(clause.value().toString(), clause.operator() == Operator.ILIKE)
                        .matcher(value.toString())
                        .matches();
                return clause.operator() == Operator.NOT_LIKE ? !found : found;
            }
            case IN:
                return value != null && operands.stream().anyMatch(o -> o != null && compare(value, normalize(o)) == 0);
            case NOT_IN:
                if (operands.isEmpty()) {
                    return true;
                }
                return value != null
                        && operands.stream().noneMatch(Objects::isNull)
                        && operands.stream().noneMatch(o -> compare(value, normalize(o)) == 0);
            case BETWEEN:
            case NOT_BETWEEN: {
                Object low = normalize(operands.get(0));
                Object high = normalize(operands.get(1));
                if (value == null || low == null || high == null) {
                    return false;
                }
                boolean within = compare(value, low) >= 0 && compare(value, high) <= 0;
                return clause.operator() == Operator.BETWEEN ? within : !within;
            }
            default:
                return compareWith(clause, value, normalize(clause.value()));
        }
    }

    private static boolean compareWith(WhereClause clause, Object left, Object right) {
        if (left == null || right == null) {
            return false;
        }
        int result = compare(left, right);
        return switch (clause.operator()) {
            case EQUALS -> result == 0;
            case NOT_EQUALS -> result != 0;
            case GREATER_THAN -> result > 0;
            case GREATER_THAN_OR_EQUAL -> result >= 0;
            case LESS_THAN -> result < 0;
            case LESS_THAN_OR_EQUAL -> result <= 0;
            default -> throw new IllegalStateException("Not a comparison: " + clause.operator());
        };
    }

    /**
     * SQL-like ordering of two non-null values: numbers (and numeric strings against numbers)
     * numerically, temporal values and UUIDs of the same kind chronologically or naturally,
     * anything else by string form.
     */
    static int compare(Object left, Object right) {
        BigDecimal leftNumber = numeric(left, right);
        BigDecimal rightNumber = numeric(right, left);
        if (leftNumber != null && rightNumber != null) {
            return leftNumber.compareTo(rightNumber);
        }
        if (left instanceof Boolean || right instanceof Boolean) {
            return Boolean.compare(truthy(left), truthy(right));
        }
        if (left instanceof ChronoLocalDateTime<?> a && right instanceof ChronoLocalDateTime<?> b) {
            return a.compareTo(b);
        }
        if (left instanceof ChronoLocalDate a && right instanceof ChronoLocalDate b) {
            return a.compareTo(b);
        }
        if (left instanceof ChronoZonedDateTime<?> a && right instanceof ChronoZonedDateTime<?> b) {
            return a.compareTo(b);
        }
        if (left instanceof OffsetDateTime a && right instanceof OffsetDateTime b) {
            return a.compareTo(b);
        }
        if (left instanceof Instant a && right instanceof Instant b) {
            return a.compareTo(b);
        }
        if (left instanceof LocalTime a && right instanceof LocalTime b) {
            return a.compareTo(b);
        }
        if (left instanceof UUID a && right instanceof UUID b) {
            return a.compareTo(b);
        }
        return left.toString().compareTo(right.toString());
    }

    private static BigDecimal numeric(Object value, Object other) {
        if (value instanceof Number number) {
            return toDecimal(number);
        }
        if (value instanceof String text && other instanceof Number) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static boolean truthy(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        return Boolean.parseBoolean(value.toString());
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return BigDecimal.valueOf(number.longValue());
    }

    private static Number sum(List<Object> values) {
        boolean integral = true;
        BigDecimal total = BigDecimal.ZERO;
        for (Object value : values) {
            if (!(value instanceof Number number)) {
                throw new IllegalArgumentException("Cannot sum non-numeric value " + value);
            }
            integral &= number instanceof Integer || number instanceof Long || number instanceof Short
                    || number instanceof Byte || number instanceof BigInteger;
            total = total.add(toDecimal(number));
        }
        return integral ? (Number) total.longValueExact() : (Number) total.doubleValue();
    }

    private Comparator<Map<String, Object>> ordering(
            String operation, String table, Table existing, List<OrderByClause> orders) {
        Comparator<Map<String, Object>> comparator = null;
        for (OrderByClause order : orders) {
            requireColumn(operation, table, existing, order.column());
            String name = unqualified(order.column());
            // NULLs sort first ascending and last descending
            Comparator<Map<String, Object>> next = (a, b) -> {
                Object left = a.get(name);
                Object right = b.get(name);
                if (left == null || right == null) {
                    return left == null ? (right == null ? 0 : -1) : 1;
                }
                return compare(left, right);
            };
            if (order.direction() == OrderByClause.Direction.DESC) {
                next = next.reversed();
            }
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        return comparator;
    }

    private Map<String, Object> project(
            String operation, String table, Table existing, Map<String, Object> row, SelectOptions options) {
        if (options.selectsAll()) {
            return new LinkedHashMap<>(row);
        }
        Map<String, Object> projected = new LinkedHashMap<>();
        for (String column : options.columns()) {
            String source = column;
            String label = null;
            int alias = column.toLowerCase(Locale.ROOT).indexOf(" as ");
            if (alias > 0) {
                source = column.substring(0, alias).trim();
                label = column.substring(alias + 4).trim();
            }
            if (source.equals("*") || source.endsWith(".*")) {
                projected.putAll(row);
                continue;
            }
            requireColumn(operation, table, existing, source);
            String name = unqualified(source);
            projected.put(label != null ? label : name, row.get(name));
        }
        return projected;
    }

    // ---- constraints ----

    private void checkConstraints(
            String operation, String table, Table existing, Map<String, Object> candidate,
            List<Map<String, Object>> replacing) {
        for (ColumnDefinition column : existing.columns.values()) {
            Object value = candidate.get(column.name());
            if (value == null && !column.nullable()) {
                throw failure(operation, table, "column " + column.name() + " cannot be null", NOT_NULL_VIOLATION);
            }
            if (value == null || !(column.unique() || column.primary())) {
                continue;
            }
            for (Map<String, Object> other : existing.rows) {
                boolean self = replacing != null && replacing.stream().anyMatch(r -> r == other);
                if (!self && other.get(column.name()) != null && compare(other.get(column.name()), value) == 0) {
                    throw failure(
                            operation, table, "duplicate entry '%s' for %s".formatted(value, column.name()), UNIQUE_VIOLATION);
                }
            }
        }
    }

    private static Object defaultFor(ColumnDefinition column) {
        if (!column.hasDefault()) {
            return null;
        }
        if (column.defaultValue() == DefaultExpression.CURRENT_TIMESTAMP) {
            return LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);
        }
        return normalize(column.defaultValue());
    }

    /** Storage form: enums by name, JDBC and legacy dates as {@code java.time} values. */
    private static Object normalize(Object value) {
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (value instanceof Character character) {
            return character.toString();
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime();
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate();
        }
        if (value instanceof Date date) {
            return new Timestamp(date.getTime()).toLocalDateTime();
        }
        return value;
    }

    // ---- plumbing ----

    private Object read(String operation, String table, Table existing, Map<String, Object> row, String column) {
        requireColumn(operation, table, existing, column);
        return row.get(unqualified(column));
    }

    private void requireColumn(String operation, String table, Table existing, String column) {
        if (column == null || !existing.columns.containsKey(unqualified(column))) {
            throw failure(operation, table, "unknown column " + column, UNDEFINED_COLUMN);
        }
    }

    private static String unqualified(String column) {
        int dot = column.lastIndexOf('.');
        return dot < 0 ? column : column.substring(dot + 1);
    }

    private Table requireTable(String operation, String table) {
        Table existing = tables.get(table);
        if (existing == null) {
            throw failure(operation, table, "unknown table", UNDEFINED_TABLE);
        }
        return existing;
    }

    private void requireConnected(String operation) {
        if (!connected) {
            throw ConnectionException.notConnected(type(), operation);
        }
    }

    private QueryExecutionException failure(String operation, String table, String message, String sqlState) {
        return new QueryExecutionException(type(), operation, table, message, sqlState, 0, null);
    }

    private static Map<String, Table> copy(Map<String, Table> source) {
        Map<String, Table> copy = new LinkedHashMap<>();
        source.forEach((name, table) -> copy.put(name, table.copy()));
        return copy;
    }

    private static final class Table {
        private final Map<String, ColumnDefinition> columns = new LinkedHashMap<>();
        private final List<Map<String, Object>> rows = new ArrayList<>();
        private long nextId = 1;

        Table copy() {
            Table copy = new Table();
            copy.columns.putAll(columns);
            rows.forEach(row -> copy.rows.add(new LinkedHashMap<>(row)));
            copy.nextId = nextId;
            return copy;
        }
    }
}
