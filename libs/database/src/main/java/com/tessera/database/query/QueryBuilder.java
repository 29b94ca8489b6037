package com.tessera.database.query;

import com.tessera.database.adapter.AggregateFunction;
import com.tessera.database.adapter.BooleanOperator;
import com.tessera.database.adapter.DatabaseAdapter;
import com.tessera.database.adapter.JoinClause;
import com.tessera.database.adapter.Operator;
import com.tessera.database.adapter.OrderByClause;
import com.tessera.database.adapter.SelectOptions;
import com.tessera.database.adapter.WhereClause;
import com.tessera.database.exception.ConfigurationException;
import com.tessera.database.exception.ModelNotFoundException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Fluent, backend-neutral query over one table or collection.
 *
 * <p>Predicates keep the order in which they were added; AND binds tighter than OR. Builders are
 * mutable and meant for a single logical query; {@link #clone()} returns an independent deep copy.
 * A terminal with no predicates touches every row, including {@link #update} and {@link #delete}.
 *
 * @param <T> result type: a row map, or a model when created through a model repository
 */
public class QueryBuilder<T> {

    private final String table;
    private final DatabaseAdapter adapter;
    private final MacroRegistry macros;
    private final Function<Map<String, Object>, T> hydrator;
    private final EagerLoadHandler<T> eagerLoader;
    private final String keyName;
    private final String subject;

    private final List<WhereClause> wheres = new ArrayList<>();
    private final List<JoinClause> joins = new ArrayList<>();
    private final List<OrderByClause> orders = new ArrayList<>();
    private final List<String> columns = new ArrayList<>();
    private final Map<String, Consumer<QueryBuilder<?>>> eagerLoads = new LinkedHashMap<>();
    private Integer limit;
    private Integer offset;

    /**
     * @param table table or collection name
     * @param adapter connected adapter
     * @param macros macro registry, shared
     * @param hydrator converts a row into {@code T}
     * @param eagerLoader loads pending relations, null when results are plain rows
     * @param keyName primary key column used by {@link #find}
     * @param subject name used in not-found errors
     */
    public QueryBuilder(
            String table,
            DatabaseAdapter adapter,
            MacroRegistry macros,
            Function<Map<String, Object>, T> hydrator,
            EagerLoadHandler<T> eagerLoader,
            String keyName,
            String subject) {
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("table must not be null or blank");
        }
        if (adapter == null) {
            throw new IllegalArgumentException("adapter must not be null");
        }
        if (hydrator == null) {
            throw new IllegalArgumentException("hydrator must not be null");
        }
        this.table = table;
        this.adapter = adapter;
        this.macros = macros == null ? new MacroRegistry() : macros;
        this.hydrator = hydrator;
        this.eagerLoader = eagerLoader;
        this.keyName = keyName == null ? "id" : keyName;
        this.subject = subject == null ? table : subject;
    }

    /** Builder returning plain rows. */
    public static QueryBuilder<Map<String, Object>> rows(String table, DatabaseAdapter adapter, MacroRegistry macros) {
        return new QueryBuilder<>(table, adapter, macros, LinkedHashMap::new, null, "id", table);
    }

    /**
     * Row builder without macros.
     *
     * @param table table or collection name
     * @param adapter connected adapter
     * @return a builder whose results are row maps
     */
    public static QueryBuilder<Map<String, Object>> rows(String table, DatabaseAdapter adapter) {
        return rows(table, adapter, null);
    }

    /** Empty builder with the same target and result type; used for nested groups. */
    protected QueryBuilder<T> newQuery() {
        return new QueryBuilder<>(table, adapter, macros, hydrator, eagerLoader, keyName, subject);
    }

    // ---- where ----

    /**
     * AND-joined equality; a null value becomes {@code IS NULL}.
     *
     * @param column column or field name, optionally table-qualified
     * @param value operand
     * @return this builder
     */
    public QueryBuilder<T> where(String column, Object value) {
        return where(column, Operator.EQUALS, value);
    }

    /**
     * AND-joined comparison.
     *
     * @param column column or field name
     * @param operator operator symbol such as {@code >=}, {@code like} or {@code in}
     * @param value operand; a collection for list operators
     * @return this builder
     * @throws IllegalArgumentException if the symbol is not a known operator
     */
    public QueryBuilder<T> where(String column, String operator, Object value) {
        return where(column, Operator.fromSymbol(operator), value);
    }

    /**
     * @param column column or field name
     * @param operator comparison operator
     * @param value operand, ignored for unary operators
     * @return this builder
     */
    public QueryBuilder<T> where(String column, Operator operator, Object value) {
        return addBasic(column, operator, value, BooleanOperator.AND);
    }

    /**
     * OR-joined equality.
     *
     * @param column column or field name
     * @param value operand
     * @return this builder
     */
    public QueryBuilder<T> orWhere(String column, Object value) {
        return orWhere(column, Operator.EQUALS, value);
    }

    /**
     * OR-joined comparison.
     *
     * @param column column or field name
     * @param operator operator symbol
     * @param value operand
     * @return this builder
     */
    public QueryBuilder<T> orWhere(String column, String operator, Object value) {
        return orWhere(column, Operator.fromSymbol(operator), value);
    }

    public QueryBuilder<T> orWhere(String column, Operator operator, Object value) {
        return addBasic(column, operator, value, BooleanOperator.OR);
    }

    /** Equality on every entry, AND-joined. */
    public QueryBuilder<T> where(Map<String, ?> attributes) {
        attributes.forEach(this::where);
        return this;
    }

    /** Parenthesised group: {@code where(q -> q.where(a).orWhere(b))}. */
    public QueryBuilder<T> where(Consumer<QueryBuilder<T>> group) {
        return addNested(group, BooleanOperator.AND);
    }

    /**
     * OR-joined parenthesised group. An empty group adds nothing.
     *
     * @param group fills a fresh builder with the grouped predicates
     * @return this builder
     */
    public QueryBuilder<T> orWhere(Consumer<QueryBuilder<T>> group) {
        return addNested(group, BooleanOperator.OR);
    }

    /**
     * @param column column or field name
     * @param values accepted values; an empty collection matches nothing
     * @return this builder
     */
    public QueryBuilder<T> whereIn(String column, Collection<?> values) {
        return addBasic(column, Operator.IN, values, BooleanOperator.AND);
    }

    public QueryBuilder<T> whereNotIn(String column, Collection<?> values) {
        return addBasic(column, Operator.NOT_IN, values, BooleanOperator.AND);
    }

    public QueryBuilder<T> orWhereIn(String column, Collection<?> values) {
        return addBasic(column, Operator.IN, values, BooleanOperator.OR);
    }

    public QueryBuilder<T> orWhereNotIn(String column, Collection<?> values) {
        return addBasic(column, Operator.NOT_IN, values, BooleanOperator.OR);
    }

    /**
     * @param column column that must be null
     * @return this builder
     */
    public QueryBuilder<T> whereNull(String column) {
        return addBasic(column, Operator.IS_NULL, null, BooleanOperator.AND);
    }

    public QueryBuilder<T> whereNotNull(String column) {
        return addBasic(column, Operator.IS_NOT_NULL, null, BooleanOperator.AND);
    }

    public QueryBuilder<T> orWhereNull(String column) {
        return addBasic(column, Operator.IS_NULL, null, BooleanOperator.OR);
    }

    public QueryBuilder<T> orWhereNotNull(String column) {
        return addBasic(column, Operator.IS_NOT_NULL, null, BooleanOperator.OR);
    }

    /**
     * Inclusive range.
     *
     * @param column column or field name
     * @param low lower bound
     * @param high upper bound
     * @return this builder
     */
    public QueryBuilder<T> whereBetween(String column, Object low, Object high) {
        return addBasic(column, Operator.BETWEEN, Arrays.asList(low, high), BooleanOperator.AND);
    }

    public QueryBuilder<T> whereNotBetween(String column, Object low, Object high) {
        return addBasic(column, Operator.NOT_BETWEEN, Arrays.asList(low, high), BooleanOperator.AND);
    }

    /**
     * @param column column or field name
     * @param pattern SQL pattern with {@code %} and {@code _} wildcards
     * @return this builder
     */
    public QueryBuilder<T> whereLike(String column, String pattern) {
        return addBasic(column, Operator.LIKE, pattern, BooleanOperator.AND);
    }

    public QueryBuilder<T> orWhereLike(String column, String pattern) {
        return addBasic(column, Operator.LIKE, pattern, BooleanOperator.OR);
    }

    /** Column-to-column comparison. Relational backends only. */
    public QueryBuilder<T> whereColumn(String first, String operator, String second) {
        wheres.add(WhereClause.columns(first, Operator.fromSymbol(operator), second, BooleanOperator.AND));
        return this;
    }

    public QueryBuilder<T> whereColumn(String first, String second) {
        return whereColumn(first, "=", second);
    }

    /** Backend-native predicate with positional bindings. Relational backends only. */
    public QueryBuilder<T> whereRaw(String sql, List<?> bindings) {
        wheres.add(WhereClause.raw(sql, bindings, BooleanOperator.AND));
        return this;
    }

    public QueryBuilder<T> whereRaw(String sql) {
        return whereRaw(sql, List.of());
    }

    public QueryBuilder<T> orWhereRaw(String sql, List<?> bindings) {
        wheres.add(WhereClause.raw(sql, bindings, BooleanOperator.OR));
        return this;
    }

    /** Applies {@code callback} only when {@code condition} holds. */
    public QueryBuilder<T> when(boolean condition, Consumer<QueryBuilder<T>> callback) {
        if (condition) {
            callback.accept(this);
        }
        return this;
    }

    private QueryBuilder<T> addBasic(String column, Operator operator, Object value, BooleanOperator bool) {
        Operator effective = operator;
        if (value == null && operator == Operator.EQUALS) {
            effective = Operator.IS_NULL;
        } else if (value == null && operator == Operator.NOT_EQUALS) {
            effective = Operator.IS_NOT_NULL;
        }
        wheres.add(WhereClause.basic(column, effective, effective.unary() ? null : value, bool));
        return this;
    }

    private QueryBuilder<T> addNested(Consumer<QueryBuilder<T>> group, BooleanOperator bool) {
        QueryBuilder<T> nested = newQuery();
        group.accept(nested);
        if (!nested.wheres.isEmpty()) {
            wheres.add(WhereClause.nested(nested.wheres, bool));
        }
        return this;
    }

    // ---- joins, ordering, paging, projection ----

    /**
     * Inner join. Relational backends only.
     *
     * @param table joined table
     * @param first left column, usually qualified
     * @param operator comparison symbol
     * @param second right column
     * @return this builder
     */
    public QueryBuilder<T> join(String table, String first, String operator, String second) {
        joins.add(new JoinClause(JoinClause.JoinType.INNER, table, first, Operator.fromSymbol(operator), second));
        return this;
    }

    public QueryBuilder<T> leftJoin(String table, String first, String operator, String second) {
        joins.add(new JoinClause(JoinClause.JoinType.LEFT, table, first, Operator.fromSymbol(operator), second));
        return this;
    }

    public QueryBuilder<T> rightJoin(String table, String first, String operator, String second) {
        joins.add(new JoinClause(JoinClause.JoinType.RIGHT, table, first, Operator.fromSymbol(operator), second));
        return this;
    }

    public QueryBuilder<T> orderBy(String column) {
        return orderBy(column, "asc");
    }

    /**
     * Appends a sort key; earlier keys take precedence.
     *
     * @param column column or field name
     * @param direction {@code asc} or {@code desc}, case-insensitive
     * @return this builder
     */
    public QueryBuilder<T> orderBy(String column, String direction) {
        orders.add(new OrderByClause(column, OrderByClause.Direction.parse(direction)));
        return this;
    }

    public QueryBuilder<T> orderByDesc(String column) {
        return orderBy(column, "desc");
    }

    /** Newest first by {@code created_at}. */
    public QueryBuilder<T> latest() {
        return latest("created_at");
    }

    public QueryBuilder<T> latest(String column) {
        return orderByDesc(column);
    }

    public QueryBuilder<T> oldest() {
        return oldest("created_at");
    }

    public QueryBuilder<T> oldest(String column) {
        return orderBy(column, "asc");
    }

    /**
     * @param limit maximum number of results, at least 0
     * @return this builder
     */
    public QueryBuilder<T> limit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        this.limit = limit;
        return this;
    }

    public QueryBuilder<T> take(int count) {
        return limit(count);
    }

    /**
     * @param offset number of results to skip, at least 0
     * @return this builder
     */
    public QueryBuilder<T> offset(int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        this.offset = offset;
        return this;
    }

    public QueryBuilder<T> skip(int count) {
        return offset(count);
    }

    /** Replaces the projection. {@code "col as alias"} is accepted on relational backends. */
    public QueryBuilder<T> select(String... columns) {
        this.columns.clear();
        this.columns.addAll(Arrays.asList(columns));
        return this;
    }

    // ---- eager loading ----

    /**
     * Eager-loads relations on model queries; dotted names load nested relations.
     *
     * @param relations relation names declared on the model
     * @return this builder
     */
    public QueryBuilder<T> with(String... relations) {
        for (String relation : relations) {
            eagerLoads.put(relation, null);
        }
        return this;
    }

    /** Eager-loads {@code relation}, letting {@code constraint} narrow the related query. */
    public QueryBuilder<T> with(String relation, Consumer<QueryBuilder<?>> constraint) {
        eagerLoads.put(relation, constraint);
        return this;
    }

    // ---- terminals ----

    /**
     * Runs the query and hydrates each row, then eager-loads pending relations.
     *
     * @return matching results in backend order, never null
     * @throws ConfigurationException if relations are pending on a plain row query
     */
    public List<T> get() {
        if (!eagerLoads.isEmpty() && eagerLoader == null) {
            throw new ConfigurationException(
                    "Eager loading needs a model query; '%s' returns plain rows".formatted(table),
                    Map.of("table", table));
        }
        List<Map<String, Object>> rows = adapter.select(table, toSelectOptions());
        List<T> results = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            results.add(hydrator.apply(row));
        }
        if (!eagerLoads.isEmpty() && !results.isEmpty()) {
            eagerLoader.load(results, eagerLoads);
        }
        return results;
    }

    /** @return the first match, or null */
    public T first() {
        List<T> results = clone().limit(1).get();
        return results.isEmpty() ? null : results.get(0);
    }

    /**
     * @return the first match
     * @throws ModelNotFoundException when nothing matches
     */
    public T firstOrFail() {
        T result = first();
        if (result == null) {
            throw new ModelNotFoundException(subject, null);
        }
        return result;
    }

    /**
     * @param id primary key value
     * @return the row or model whose key equals {@code id}, or null
     */
    public T find(Object id) {
        return clone().where(keyName, id).first();
    }

    /** Matching row count. Ordering and paging are ignored; no rows are fetched. */
    public long count() {
        Object count = adapter.aggregate(table, AggregateFunction.COUNT, null, toSelectOptions().withoutPaging());
        return count == null ? 0L : ((Number) count).longValue();
    }

    /** @return true when at least one row matches */
    public boolean exists() {
        return count() > 0;
    }

    public boolean doesntExist() {
        return !exists();
    }

    /** Sum of {@code column}; zero when nothing matches. */
    public Number sum(String column) {
        Object sum = aggregate(AggregateFunction.SUM, column);
        return sum == null ? 0 : (Number) sum;
    }

    /** Average of {@code column}; null when nothing matches. */
    public Double avg(String column) {
        Object avg = aggregate(AggregateFunction.AVG, column);
        return avg == null ? null : ((Number) avg).doubleValue();
    }

    /**
     * @param column column to aggregate
     * @return the smallest value, or null when nothing matches
     */
    public Object min(String column) {
        return aggregate(AggregateFunction.MIN, column);
    }

    /**
     * @param column column to aggregate
     * @return the largest value, or null when nothing matches
     */
    public Object max(String column) {
        return aggregate(AggregateFunction.MAX, column);
    }

    private Object aggregate(AggregateFunction function, String column) {
        return adapter.aggregate(table, function, column, toSelectOptions().withoutPaging());
    }

    /** Values of a single column in result order. */
    public List<Object> pluck(String column) {
        SelectOptions options = SelectOptions.builder()
                .columns(List.of(column))
                .where(wheres)
                .joins(joins)
                .orderBy(orders)
                .limit(limit)
                .offset(offset)
                .build();
        List<Object> values = new ArrayList<>();
        String key = column.contains(".") ? column.substring(column.lastIndexOf('.') + 1) : column;
        for (Map<String, Object> row : adapter.select(table, options)) {
            values.add(row.get(key));
        }
        return values;
    }

    /**
     * Runs a count and one page query.
     *
     * @param perPage page size, at least 1
     * @param page 1-based page number
     * @return the page with the total match count
     */
    public Paginated<T> paginate(int perPage, int page) {
        if (perPage < 1) {
            throw new IllegalArgumentException("perPage must be >= 1");
        }
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        long total = count();
        List<T> items = clone().offset((page - 1) * perPage).limit(perPage).get();
        return new Paginated<>(items, total, perPage, page);
    }

    /**
     * Bulk update of every matching row.
     *
     * @param data column values to write, at least one
     * @return number of rows matched
     */
    public int update(Map<String, Object> data) {
        return adapter.update(table, List.copyOf(wheres), data);
    }

    /**
     * Bulk delete of every matching row.
     *
     * @return number of rows removed
     */
    public int delete() {
        return adapter.delete(table, List.copyOf(wheres));
    }

    /**
     * Inserts one row.
     *
     * @param data column values
     * @return the generated or supplied key, null when the backend reports none
     */
    public Object insert(Map<String, Object> data) {
        return adapter.insert(table, data, keyName);
    }

    /** Inserts each row in order and returns their keys. */
    public List<Object> insert(List<Map<String, Object>> rows) {
        List<Object> keys = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            keys.add(insert(row));
        }
        return keys;
    }

    /**
     * Invokes a registered macro on this builder.
     *
     * @param name macro name
     * @param args macro arguments
     * @return whatever the macro returns
     * @throws ConfigurationException if no macro named {@code name} is registered
     */
    public Object macro(String name, Object... args) {
        return macros.get(name).invoke(this, args);
    }

    public boolean hasMacro(String name) {
        return macros.has(name);
    }

    // ---- copy and state ----

    /** Independent deep copy; changes to either builder never affect the other. */
    @Override
    public QueryBuilder<T> clone() {
        QueryBuilder<T> copy = newQuery();
        copy.wheres.addAll(wheres);
        copy.joins.addAll(joins);
        copy.orders.addAll(orders);
        copy.columns.addAll(columns);
        copy.eagerLoads.putAll(eagerLoads);
        copy.limit = limit;
        copy.offset = offset;
        return copy;
    }

    /** @return the current projection, predicates, joins, ordering and paging as adapter options */
    public SelectOptions toSelectOptions() {
        return new SelectOptions(columns, wheres, orders, limit, offset, joins);
    }

    public String table() {
        return table;
    }

    public DatabaseAdapter adapter() {
        return adapter;
    }

    public MacroRegistry macros() {
        return macros;
    }

    public String keyName() {
        return keyName;
    }

    public List<WhereClause> wheres() {
        return List.copyOf(wheres);
    }

    public List<JoinClause> joins() {
        return List.copyOf(joins);
    }

    public List<OrderByClause> orders() {
        return List.copyOf(orders);
    }

    public List<String> columns() {
        return List.copyOf(columns);
    }

    public Integer limitValue() {
        return limit;
    }

    public Integer offsetValue() {
        return offset;
    }

    /** Pending eager loads in declaration order; values are optional constraints. */
    public Map<String, Consumer<QueryBuilder<?>>> eagerLoads() {
        return new LinkedHashMap<>(eagerLoads);
    }
}
