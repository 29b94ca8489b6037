package com.tessera.database.adapter;

import com.tessera.database.config.DatabaseConfig;
import com.tessera.database.config.DatabaseType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Decorator that times every adapter operation with Micrometer.
 *
 * <p>Each call is recorded on the {@value #METRIC_NAME} timer tagged with {@code backend}, {@code
 * operation} and {@code outcome} ({@code success} or {@code error}). Exceptions propagate unchanged.
 */
public final class InstrumentedDatabaseAdapter implements DatabaseAdapter {

    /** Timer name for adapter operations. */
    public static final String METRIC_NAME = "tessera.db.operation";

    public static final String TAG_BACKEND = "backend";
    public static final String TAG_OPERATION = "operation";
    public static final String TAG_OUTCOME = "outcome";

    private final DatabaseAdapter delegate;
    private final MeterRegistry registry;

    public InstrumentedDatabaseAdapter(DatabaseAdapter delegate, MeterRegistry registry) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.delegate = delegate;
        this.registry = registry;
    }

    /** The wrapped adapter. */
    public DatabaseAdapter delegate() {
        return delegate;
    }

    @Override
    public DatabaseType type() {
        return delegate.type();
    }

    @Override
    public DatabaseConnection connect(DatabaseConfig config) {
        DatabaseConnection connection = timed("connect", () -> delegate.connect(config));
        return new DatabaseConnection(connection.type(), connection.database(), this);
    }

    @Override
    public void disconnect() {
        timed("disconnect", delegate::disconnect);
    }

    @Override
    public boolean isConnected() {
        return delegate.isConnected();
    }

    @Override
    public void createTable(String table, List<ColumnDefinition> columns) {
        timed("createTable", () -> delegate.createTable(table, columns));
    }

    @Override
    public void dropTable(String table) {
        timed("dropTable", () -> delegate.dropTable(table));
    }

    @Override
    public boolean hasTable(String table) {
        return timed("hasTable", () -> delegate.hasTable(table));
    }

    @Override
    public boolean hasColumn(String table, String column) {
        return timed("hasColumn", () -> delegate.hasColumn(table, column));
    }

    @Override
    public void addColumn(String table, ColumnDefinition column) {
        timed("addColumn", () -> delegate.addColumn(table, column));
    }

    @Override
    public void dropColumn(String table, String column) {
        timed("dropColumn", () -> delegate.dropColumn(table, column));
    }

    @Override
    public void renameTable(String from, String to) {
        timed("renameTable", () -> delegate.renameTable(from, to));
    }

    @Override
    public List<String> listTables() {
        return timed("listTables", delegate::listTables);
    }

    @Override
    public void dropAllTables() {
        timed("dropAllTables", delegate::dropAllTables);
    }

    @Override
    public List<Map<String, Object>> select(String table, SelectOptions options) {
        return timed("select", () -> delegate.select(table, options));
    }

    @Override
    public Object insert(String table, Map<String, Object> data, String keyName) {
        return timed("insert", () -> delegate.insert(table, data, keyName));
    }

    @Override
    public int update(String table, List<WhereClause> where, Map<String, Object> data) {
        return timed("update", () -> delegate.update(table, where, data));
    }

    @Override
    public int delete(String table, List<WhereClause> where) {
        return timed("delete", () -> delegate.delete(table, where));
    }

    @Override
    public Object aggregate(
            String table, AggregateFunction function, String column, SelectOptions options) {
        return timed("aggregate", () -> delegate.aggregate(table, function, column, options));
    }

    @Override
    public void beginTransaction() {
        timed("beginTransaction", delegate::beginTransaction);
    }

    @Override
    public void commit() {
        timed("commit", delegate::commit);
    }

    @Override
    public void rollback() {
        timed("rollback", delegate::rollback);
    }

    @Override
    public boolean supportsTransactions() {
        return delegate.supportsTransactions();
    }

    @Override
    public Object raw(String query, List<Object> params) {
        return timed("raw", () -> delegate.raw(query, params));
    }

    private void timed(String operation, Runnable work) {
        timed(
                operation,
                () -> {
                    work.run();
                    return null;
                });
    }

    private <T> T timed(String operation, Supplier<T> work) {
        Timer.Sample sample = Timer.start(registry);
        String outcome = "error";
        try {
            T result = work.get();
            outcome = "success";
            return result;
        } finally {
            sample.stop(
                    Timer.builder(METRIC_NAME)
                            .description("Duration of database adapter operations")
                            .tags(
                                    TAG_BACKEND, delegate.type().tag(),
                                    TAG_OPERATION, operation,
                                    TAG_OUTCOME, outcome)
                            .register(registry));
        }
    }
}
