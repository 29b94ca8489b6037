package com.tessera.database.adapter;

import com.tessera.database.config.DatabaseConfig;
import com.tessera.database.config.DatabaseType;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Backend contract behind the query builder, models and migrations.
 *
 * <p>An adapter owns exactly one connection or pool. Rows cross this boundary as {@code
 * Map<String, Object>} in column order. After {@link #disconnect()} every operation fails with
 * {@link com.tessera.database.exception.ConnectionException}.
 *
 * <p>Operators or features a backend cannot express raise {@link
 * com.tessera.database.exception.UnsupportedBackendOperationException} before any I/O.
 */
public interface DatabaseAdapter {

    DatabaseType type();

    DatabaseConnection connect(DatabaseConfig config);

    /** Releases the connection or pool. Calling it twice is a no-op. */
    void disconnect();

    boolean isConnected();

    // ---- schema ----

    void createTable(String table, List<ColumnDefinition> columns);

    void dropTable(String table);

    boolean hasTable(String table);

    boolean hasColumn(String table, String column);

    void addColumn(String table, ColumnDefinition column);

    void dropColumn(String table, String column);

    void renameTable(String from, String to);

    List<String> listTables();

    void dropAllTables();

    // ---- data ----

    List<Map<String, Object>> select(String table, SelectOptions options);

    /** Inserts one row and returns the generated (or supplied) {@code id}. */
    default Object insert(String table, Map<String, Object> data) {
        return insert(table, data, "id");
    }

    /**
     * Inserts one row.
     *
     * @param keyName primary key column whose generated value is returned
     * @return the generated key, the supplied key when present in {@code data}, or null
     */
    Object insert(String table, Map<String, Object> data, String keyName);

    /** @return number of rows matched */
    int update(String table, List<WhereClause> where, Map<String, Object> data);

    /** @return number of rows removed */
    int delete(String table, List<WhereClause> where);

    /**
     * Computes an aggregate server-side. {@code column} is ignored for {@code COUNT}; ordering and
     * paging in {@code options} are ignored.
     *
     * @return a {@code Long} for COUNT, otherwise the backend's numeric value or null for no rows
     */
    Object aggregate(String table, AggregateFunction function, String column, SelectOptions options);

    // ---- transactions ----

    void beginTransaction();

    void commit();

    void rollback();

    boolean supportsTransactions();

    /**
     * Runs {@code work} in a transaction, committing on return and rolling back on any exception,
     * including a failed commit. A rollback failure is attached to the original exception as
     * suppressed.
     */
    default <T> T transaction(Supplier<T> work) {
        beginTransaction();
        T result;
        try {
            result = work.get();
        } catch (RuntimeException | Error e) {
            rollbackAfterFailure(e);
            throw e;
        }
        try {
            commit();
        } catch (RuntimeException e) {
            rollbackAfterFailure(e);
            throw e;
        }
        return result;
    }

    private void rollbackAfterFailure(Throwable failure) {
        try {
            rollback();
        } catch (RuntimeException rollbackFailure) {
            failure.addSuppressed(rollbackFailure);
        }
    }

    /** Backend-native escape hatch; the return type depends on the backend. */
    Object raw(String query, List<Object> params);
}
