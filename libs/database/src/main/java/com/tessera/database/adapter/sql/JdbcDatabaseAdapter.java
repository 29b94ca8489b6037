package com.tessera.database.adapter.sql;

import com.tessera.database.adapter.AggregateFunction;
import com.tessera.database.adapter.ColumnDefinition;
import com.tessera.database.adapter.DatabaseAdapter;
import com.tessera.database.adapter.DatabaseConnection;
import com.tessera.database.adapter.SelectOptions;
import com.tessera.database.adapter.WhereClause;
import com.tessera.database.config.DatabaseConfig;
import com.tessera.database.config.DatabaseType;
import com.tessera.database.exception.ConnectionException;
import com.tessera.database.exception.DatabaseException;
import com.tessera.database.exception.QueryExecutionException;
import com.zaxxer.hikari.HikariDataSource;
import java.math.BigInteger;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.jdbc.DataSourceBuilder;

/**
 * Shared JDBC plumbing for the relational adapters.
 *
 * <p>The adapter owns a HikariCP pool built through Spring Boot's {@link DataSourceBuilder}.
 * Outside a transaction every call borrows a pooled connection and returns it. Inside one, the
 * transaction's connection is confined to the thread that began it; nested {@link
 * #beginTransaction()} calls set savepoints on that connection.
 */
public abstract class JdbcDatabaseAdapter implements DatabaseAdapter {

    private static final Logger log = LoggerFactory.getLogger(JdbcDatabaseAdapter.class);

    private final SqlGrammar grammar;
    private final ThreadLocal<TransactionState> transaction = new ThreadLocal<>();
    private volatile HikariDataSource dataSource;
    private volatile String database;

    protected JdbcDatabaseAdapter(SqlGrammar grammar) {
        this.grammar = grammar;
    }

    /** Connection URL for discrete host/port/database settings. */
    protected abstract String buildUrl(DatabaseConfig config);

    /** True when a caller-supplied URL explicitly turns TLS off. */
    protected abstract boolean disablesSsl(String url);

    /** Adds driver options the adapter relies on to a caller-supplied URL. */
    protected String completeUrl(String url) {
        return url;
    }

    public SqlGrammar grammar() {
        return grammar;
    }

    @Override
    public DatabaseType type() {
        return grammar.type();
    }

    // ---- lifecycle ----

    @Override
    public DatabaseConnection connect(DatabaseConfig config) {
        if (config.type() != type()) {
            throw new ConnectionException(
                    type(), "connect", "Configuration is for %s, not %s".formatted(config.type().tag(), type().tag()));
        }
        if (isConnected()) {
            throw new ConnectionException(type(), "connect", "Adapter is already connected");
        }
        String url = resolveUrl(config);
        HikariDataSource pool = DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(url)
                .username(config.username())
                .password(config.password())
                .build();
        pool.setMinimumIdle(config.pool().min());
        pool.setMaximumPoolSize(config.pool().max());
        pool.setPoolName("tessera-" + type().tag());
        String name;
        try (Connection connection = pool.getConnection()) {
            name = config.database() != null ? config.database() : connection.getCatalog();
        } catch (SQLException | RuntimeException e) {
            pool.close();
            throw new ConnectionException(
                    type(), "connect", "Unable to connect to %s: %s".formatted(type().tag(), e.getMessage()), e);
        }
        this.database = name;
        this.dataSource = pool;
        log.info("Connected to {} database '{}' (pool {}..{})", type().tag(), name, config.pool().min(), config.pool().max());
        return new DatabaseConnection(type(), name, this);
    }

    private String resolveUrl(DatabaseConfig config) {
        if (config.hasUrl()) {
            String url = config.url().trim();
            if (!url.startsWith("jdbc:")) {
                throw new ConnectionException(type(), "connect", "Connection URL must start with 'jdbc:'");
            }
            if (config.ssl() && disablesSsl(url)) {
                throw new ConnectionException(
                        type(), "connect", "ssl=true contradicts the TLS setting of the connection URL");
            }
            return completeUrl(url);
        }
        if (config.database() == null || config.database().isBlank()) {
            throw new ConnectionException(type(), "connect", "A database name is required");
        }
        return buildUrl(config);
    }

    @Override
    public void disconnect() {
        HikariDataSource pool = dataSource;
        if (pool == null) {
            return;
        }
        TransactionState state = transaction.get();
        if (state != null) {
            log.warn("Disconnecting {} adapter with an open transaction; rolling back", type().tag());
            try {
                state.connection.rollback();
            } catch (SQLException e) {
                log.warn("Rollback on disconnect failed: {}", e.getMessage());
            } finally {
                release(state);
            }
        }
        dataSource = null;
        pool.close();
        log.info("Disconnected from {} database '{}'", type().tag(), database);
    }

    @Override
    public boolean isConnected() {
        HikariDataSource pool = dataSource;
        return pool != null && !pool.isClosed();
    }

    // ---- schema ----

    @Override
    public void createTable(String table, List<ColumnDefinition> columns) {
        execute("createTable", table, grammar.compileCreateTable(table, columns));
    }

    @Override
    public void dropTable(String table) {
        execute("dropTable", table, grammar.compileDropTable(table));
    }

    @Override
    public boolean hasTable(String table) {
        return listTables().stream().anyMatch(t -> t.equalsIgnoreCase(table));
    }

    @Override
    public boolean hasColumn(String table, String column) {
        return withConnection("hasColumn", table, connection -> {
            DatabaseMetaData meta = connection.getMetaData();
            try (ResultSet rs = meta.getColumns(connection.getCatalog(), connection.getSchema(), table, null)) {
                while (rs.next()) {
                    if (table.equalsIgnoreCase(rs.getString("TABLE_NAME"))
                            && column.equalsIgnoreCase(rs.getString("COLUMN_NAME"))) {
                        return true;
                    }
                }
                return false;
            }
        });
    }

    @Override
    public void addColumn(String table, ColumnDefinition column) {
        execute("addColumn", table, grammar.compileAddColumn(table, column));
    }

    @Override
    public void dropColumn(String table, String column) {
        execute("dropColumn", table, grammar.compileDropColumn(table, column));
    }

    @Override
    public void renameTable(String from, String to) {
        execute("renameTable", from, grammar.compileRenameTable(from, to));
    }

    @Override
    public List<String> listTables() {
        return withConnection("listTables", null, connection -> {
            DatabaseMetaData meta = connection.getMetaData();
            List<String> tables = new ArrayList<>();
            try (ResultSet rs = meta.getTables(connection.getCatalog(), connection.getSchema(), "%", null)) {
                while (rs.next()) {
                    String kind = rs.getString("TABLE_TYPE");
                    if (kind != null && (kind.equalsIgnoreCase("TABLE") || kind.equalsIgnoreCase("BASE TABLE"))) {
                        tables.add(rs.getString("TABLE_NAME"));
                    }
                }
            }
            return tables;
        });
    }

    @Override
    public void dropAllTables() {
        List<String> tables = listTables();
        for (SqlStatement statement : grammar.compileDropAllTables(tables)) {
            execute("dropAllTables", null, statement);
        }
        log.info("Dropped {} table(s) from {} database '{}'", tables.size(), type().tag(), database);
    }

    // ---- data ----

    @Override
    public List<Map<String, Object>> select(String table, SelectOptions options) {
        SqlStatement statement = grammar.compileSelect(table, options);
        return withConnection("select", table, connection -> {
            try (PreparedStatement ps = prepare(connection, statement, "select");
                    ResultSet rs = ps.executeQuery()) {
                return readRows(rs);
            }
        });
    }

    @Override
    public Object insert(String table, Map<String, Object> data, String keyName) {
        SqlStatement statement = grammar.compileInsert(table, data);
        return withConnection("insert", table, connection -> {
            logStatement("insert", statement);
            try (PreparedStatement ps = connection.prepareStatement(statement.sql(), Statement.RETURN_GENERATED_KEYS)) {
                bind(ps, statement.bindings());
                ps.executeUpdate();
                Object supplied = keyName == null ? null : data.get(keyName);
                if (supplied != null) {
                    return supplied;
                }
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    return readGeneratedKey(keys, keyName);
                }
            }
        });
    }

    @Override
    public int update(String table, List<WhereClause> where, Map<String, Object> data) {
        SqlStatement statement = grammar.compileUpdate(table, where, data);
        return withConnection("update", table, connection -> {
            try (PreparedStatement ps = prepare(connection, statement, "update")) {
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public int delete(String table, List<WhereClause> where) {
        SqlStatement statement = grammar.compileDelete(table, where);
        return withConnection("delete", table, connection -> {
            try (PreparedStatement ps = prepare(connection, statement, "delete")) {
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public Object aggregate(String table, AggregateFunction function, String column, SelectOptions options) {
        SqlStatement statement = grammar.compileAggregate(table, function, column, options);
        Object value = withConnection("aggregate", table, connection -> {
            try (PreparedStatement ps = prepare(connection, statement, "aggregate");
                    ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getObject(1) : null;
            }
        });
        if (function == AggregateFunction.COUNT) {
            return value == null ? 0L : ((Number) value).longValue();
        }
        return value;
    }

    @Override
    public Object raw(String query, List<Object> params) {
        SqlStatement statement = new SqlStatement(query, params);
        return withConnection("raw", null, connection -> {
            try (PreparedStatement ps = prepare(connection, statement, "raw")) {
                if (ps.execute()) {
                    try (ResultSet rs = ps.getResultSet()) {
                        return readRows(rs);
                    }
                }
                return ps.getUpdateCount();
            }
        });
    }

    // ---- transactions ----

    @Override
    public boolean supportsTransactions() {
        return true;
    }

    @Override
    public void beginTransaction() {
        HikariDataSource pool = requireConnected("beginTransaction");
        TransactionState state = transaction.get();
        try {
            if (state == null) {
                Connection connection = pool.getConnection();
                connection.setAutoCommit(false);
                transaction.set(new TransactionState(connection));
                log.debug("{} transaction started", type().tag());
            } else {
                Savepoint savepoint = state.connection.setSavepoint("tessera_sp_" + (state.savepoints.size() + 1));
                state.savepoints.push(savepoint);
                log.debug("{} savepoint {} set", type().tag(), savepoint.getSavepointName());
            }
        } catch (SQLException e) {
            throw wrap("beginTransaction", null, e);
        }
    }

    @Override
    public void commit() {
        requireConnected("commit");
        TransactionState state = requireTransaction("commit");
        if (!state.savepoints.isEmpty()) {
            try {
                state.connection.releaseSavepoint(state.savepoints.peek());
            } catch (SQLException e) {
                throw wrap("commit", null, e);
            }
            state.savepoints.pop();
            return;
        }
        try {
            state.connection.commit();
            log.debug("{} transaction committed", type().tag());
        } catch (SQLException e) {
            try {
                state.connection.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw wrap("commit", null, e);
        } finally {
            release(state);
        }
    }

    @Override
    public void rollback() {
        requireConnected("rollback");
        TransactionState state = requireTransaction("rollback");
        try {
            if (!state.savepoints.isEmpty()) {
                state.connection.rollback(state.savepoints.pop());
                return;
            }
            state.connection.rollback();
            log.debug("{} transaction rolled back", type().tag());
        } catch (SQLException e) {
            throw wrap("rollback", null, e);
        }
        release(state);
    }

    /** Depth of the calling thread's transaction: 0 outside one, 1 + savepoints inside. */
    public int transactionDepth() {
        TransactionState state = transaction.get();
        return state == null ? 0 : 1 + state.savepoints.size();
    }

    private TransactionState requireTransaction(String operation) {
        TransactionState state = transaction.get();
        if (state == null) {
            throw new DatabaseException("No active transaction", type(), operation);
        }
        return state;
    }

    private void release(TransactionState state) {
        transaction.remove();
        try (Connection connection = state.connection) {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            log.warn("Failed to release {} transaction connection: {}", type().tag(), e.getMessage());
        }
    }

    // ---- plumbing ----

    @FunctionalInterface
    protected interface ConnectionWork<T> {
        T apply(Connection connection) throws SQLException;
    }

    /**
     * Runs {@code work} on the thread's transaction connection, or on a pooled connection that is
     * returned afterwards. {@link SQLException} is wrapped in {@link QueryExecutionException}.
     */
    protected <T> T withConnection(String operation, String table, ConnectionWork<T> work) {
        HikariDataSource pool = requireConnected(operation);
        TransactionState state = transaction.get();
        try {
            if (state != null) {
                return work.apply(state.connection);
            }
            try (Connection connection = pool.getConnection()) {
                return work.apply(connection);
            }
        } catch (SQLException e) {
            throw wrap(operation, table, e);
        }
    }

    private void execute(String operation, String table, SqlStatement statement) {
        withConnection(operation, table, connection -> {
            try (PreparedStatement ps = prepare(connection, statement, operation)) {
                return ps.execute();
            }
        });
    }

    private HikariDataSource requireConnected(String operation) {
        HikariDataSource pool = dataSource;
        if (pool == null || pool.isClosed()) {
            throw ConnectionException.notConnected(type(), operation);
        }
        return pool;
    }

    private PreparedStatement prepare(Connection connection, SqlStatement statement, String operation)
            throws SQLException {
        logStatement(operation, statement);
        PreparedStatement ps = connection.prepareStatement(statement.sql());
        try {
            bind(ps, statement.bindings());
        } catch (SQLException e) {
            ps.close();
            throw e;
        }
        return ps;
    }

    private void bind(PreparedStatement ps, List<Object> bindings) throws SQLException {
        for (int i = 0; i < bindings.size(); i++) {
            ps.setObject(i + 1, grammar.prepareBinding(bindings.get(i)));
        }
    }

    private void logStatement(String operation, SqlStatement statement) {
        if (log.isDebugEnabled()) {
            log.debug("{} {}: {} {}", type().tag(), operation, statement.sql(), statement.bindings());
        }
    }

    private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int count = meta.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= count; i++) {
                row.put(meta.getColumnLabel(i), readValue(rs, meta, i));
            }
            rows.add(row);
        }
        return rows;
    }

    /** JSON columns come back as their text; drivers otherwise return wrapper objects or bytes. */
    private static Object readValue(ResultSet rs, ResultSetMetaData meta, int column) throws SQLException {
        String typeName = meta.getColumnTypeName(column);
        if (typeName != null && lower(typeName).startsWith("json")) {
            return rs.getString(column);
        }
        return rs.getObject(column);
    }

    private static Object readGeneratedKey(ResultSet keys, String keyName) throws SQLException {
        if (!keys.next()) {
            return null;
        }
        ResultSetMetaData meta = keys.getMetaData();
        int count = meta.getColumnCount();
        for (int i = 1; i <= count; i++) {
            if (keyName != null && meta.getColumnLabel(i).equalsIgnoreCase(keyName)) {
                return normalizeKey(keys.getObject(i));
            }
        }
        return count == 1 ? normalizeKey(keys.getObject(1)) : null;
    }

    private static Object normalizeKey(Object key) {
        return key instanceof BigInteger big ? big.longValueExact() : key;
    }

    private QueryExecutionException wrap(String operation, String table, SQLException e) {
        return new QueryExecutionException(
                type(), operation, table, e.getMessage(), e.getSQLState(), e.getErrorCode(), e);
    }

    /** Lower-cased URL, for option sniffing. */
    protected static String lower(String url) {
        return url.toLowerCase(Locale.ROOT);
    }

    private static final class TransactionState {
        private final Connection connection;
        private final Deque<Savepoint> savepoints = new ArrayDeque<>();

        private TransactionState(Connection connection) {
            this.connection = connection;
        }
    }
}
