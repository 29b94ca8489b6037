package com.tessera.database.adapter.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.MongoException;
import com.mongodb.MongoNamespace;
import com.mongodb.client.ClientSession;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Accumulators;
import com.mongodb.client.model.Aggregates;
import com.mongodb.client.model.BsonField;
import com.mongodb.client.model.CountOptions;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Projections;
import com.tessera.database.adapter.AggregateFunction;
import com.tessera.database.adapter.ColumnDefinition;
import com.tessera.database.adapter.DatabaseAdapter;
import com.tessera.database.adapter.DatabaseConnection;
import com.tessera.database.adapter.DefaultExpression;
import com.tessera.database.adapter.OrderByClause;
import com.tessera.database.adapter.SelectOptions;
import com.tessera.database.adapter.WhereClause;
import com.tessera.database.config.DatabaseConfig;
import com.tessera.database.config.DatabaseType;
import com.tessera.database.exception.ConnectionException;
import com.tessera.database.exception.DatabaseException;
import com.tessera.database.exception.QueryExecutionException;
import com.tessera.database.exception.UnsupportedBackendOperationException;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MongoDB adapter over the synchronous Java driver.
 *
 * <p>Tables map to collections. Every row returned carries {@code id} (the hex string of an
 * {@link ObjectId} {@code _id}) next to the native {@code _id}. Joins, column-to-column comparisons
 * and raw SQL predicates are rejected before any I/O.
 *
 * <p>Transactions need a replica set. They are single level and bound to the calling thread through
 * a {@link ClientSession}.
 */
public class MongoAdapter implements DatabaseAdapter {

    private static final Logger log = LoggerFactory.getLogger(MongoAdapter.class);

    private final MongoFilterTranslator translator = new MongoFilterTranslator();
    private final ThreadLocal<ClientSession> session = new ThreadLocal<>();
    private volatile MongoClient client;
    private volatile MongoDatabase database;
    private volatile boolean replicaSet;

    @Override
    public DatabaseType type() {
        return DatabaseType.MONGODB;
    }

    /** Client factory; tests substitute a stub. */
    protected MongoClient createClient(MongoClientSettings settings) {
        return MongoClients.create(settings);
    }

    // ---- lifecycle ----

    @Override
    public DatabaseConnection connect(DatabaseConfig config) {
        if (config.type() != DatabaseType.MONGODB) {
            throw new ConnectionException(
                    type(), "connect", "Configuration is for %s, not mongodb".formatted(config.type().tag()));
        }
        if (isConnected()) {
            throw new ConnectionException(type(), "connect", "Adapter is already connected");
        }
        ConnectionString connectionString = connectionString(config);
        String name = config.database() != null ? config.database() : connectionString.getDatabase();
        if (name == null || name.isBlank()) {
            throw new ConnectionException(type(), "connect", "A database name is required");
        }

        MongoClientSettings.Builder settings = MongoClientSettings.builder()
                .applyConnectionString(connectionString)
                .applyToConnectionPoolSettings(pool -> pool.minSize(config.pool().min()).maxSize(config.pool().max()));
        if (config.ssl()) {
            settings.applyToSslSettings(ssl -> ssl.enabled(true));
        }
        if (connectionString.getCredential() == null && config.username() != null) {
            char[] password = config.password() == null ? new char[0] : config.password().toCharArray();
            settings.credential(MongoCredential.createCredential(config.username(), "admin", password));
        }

        MongoClient created = createClient(settings.build());
        try {
            MongoDatabase db = created.getDatabase(name);
            Document hello = db.runCommand(new Document("hello", 1));
            this.replicaSet = hello != null && hello.containsKey("setName");
            this.database = db;
            this.client = created;
        } catch (MongoException e) {
            created.close();
            throw new ConnectionException(
                    type(), "connect", "Unable to connect to mongodb: " + e.getMessage(), e);
        }
        log.info("Connected to mongodb database '{}' (replica set: {})", name, replicaSet);
        return new DatabaseConnection(type(), name, this);
    }

    private ConnectionString connectionString(DatabaseConfig config) {
        String url;
        if (config.hasUrl()) {
            url = config.url().trim();
            if (!url.startsWith("mongodb://") && !url.startsWith("mongodb+srv://")) {
                throw new ConnectionException(
                        type(), "connect", "Connection URL must start with 'mongodb://' or 'mongodb+srv://'");
            }
            String lower = url.toLowerCase(Locale.ROOT);
            if (config.ssl() && (lower.contains("ssl=false") || lower.contains("tls=false"))) {
                throw new ConnectionException(
                        type(), "connect", "ssl=true contradicts the TLS setting of the connection URL");
            }
        } else {
            url = "mongodb://%s:%d/%s".formatted(
                    config.hostOrDefault(), config.portOrDefault(), config.database() == null ? "" : config.database());
        }
        try {
            return new ConnectionString(url);
        } catch (IllegalArgumentException e) {
            throw new ConnectionException(type(), "connect", "Invalid connection URL: " + e.getMessage(), e);
        }
    }

    @Override
    public void disconnect() {
        MongoClient current = client;
        if (current == null) {
            return;
        }
        ClientSession open = session.get();
        if (open != null) {
            log.warn("Disconnecting mongodb adapter with an open transaction; aborting");
            try {
                open.abortTransaction();
            } catch (MongoException e) {
                log.warn("Abort on disconnect failed: {}", e.getMessage());
            } finally {
                open.close();
                session.remove();
            }
        }
        client = null;
        database = null;
        current.close();
        log.info("Disconnected from mongodb");
    }

    @Override
    public boolean isConnected() {
        return client != null;
    }

    /** Native database handle. */
    public MongoDatabase database() {
        return requireConnected("database");
    }

    /** Filter document for a list of where clauses. */
    public Document buildFilter(List<WhereClause> where) {
        return translator.translate(where);
    }

    // ---- schema ----

    @Override
    public void createTable(String table, List<ColumnDefinition> columns) {
        rejectForeignKeys(columns, "createTable");
        MongoDatabase db = requireConnected("createTable");
        execute("createTable", table, () -> {
            db.createCollection(table);
            for (ColumnDefinition column : columns) {
                if (column.unique() && !column.primary()) {
                    createUniqueIndex(db.getCollection(table), table, column.name());
                }
            }
            return null;
        });
    }

    @Override
    public void dropTable(String table) {
        MongoDatabase db = requireConnected("dropTable");
        execute("dropTable", table, () -> {
            db.getCollection(table).drop();
            return null;
        });
    }

    @Override
    public boolean hasTable(String table) {
        return listTables().contains(table);
    }

    @Override
    public boolean hasColumn(String table, String column) {
        MongoDatabase db = requireConnected("hasColumn");
        String field = MongoFilterTranslator.field(column);
        return execute("hasColumn", table, () ->
                db.getCollection(table).countDocuments(Filters.exists(field), new CountOptions().limit(1)) > 0);
    }

    @Override
    public void addColumn(String table, ColumnDefinition column) {
        rejectForeignKeys(List.of(column), "addColumn");
        MongoDatabase db = requireConnected("addColumn");
        execute("addColumn", table, () -> {
            MongoCollection<Document> collection = db.getCollection(table);
            if (column.hasDefault()) {
                Object value = column.defaultValue() == DefaultExpression.CURRENT_TIMESTAMP
                        ? new Date()
                        : column.defaultValue();
                collection.updateMany(
                        Filters.exists(column.name(), false), new Document("$set", new Document(column.name(), value)));
            }
            if (column.unique()) {
                createUniqueIndex(collection, table, column.name());
            }
            return null;
        });
    }

    @Override
    public void dropColumn(String table, String column) {
        MongoDatabase db = requireConnected("dropColumn");
        execute("dropColumn", table, () -> {
            db.getCollection(table).updateMany(new Document(), new Document("$unset", new Document(column, "")));
            return null;
        });
    }

    @Override
    public void renameTable(String from, String to) {
        MongoDatabase db = requireConnected("renameTable");
        execute("renameTable", from, () -> {
            db.getCollection(from).renameCollection(new MongoNamespace(db.getName(), to));
            return null;
        });
    }

    @Override
    public List<String> listTables() {
        MongoDatabase db = requireConnected("listTables");
        return execute("listTables", null, () -> {
            List<String> names = db.listCollectionNames().into(new ArrayList<>());
            names.removeIf(name -> name.startsWith("system."));
            return names;
        });
    }

    @Override
    public void dropAllTables() {
        List<String> collections = listTables();
        MongoDatabase db = requireConnected("dropAllTables");
        execute("dropAllTables", null, () -> {
            collections.forEach(name -> db.getCollection(name).drop());
            return null;
        });
        log.info("Dropped {} collection(s) from mongodb database '{}'", collections.size(), db.getName());
    }

    // ---- data ----

    @Override
    public List<Map<String, Object>> select(String table, SelectOptions options) {
        if (!options.joins().isEmpty()) {
            throw new UnsupportedBackendOperationException(type(), "select", "join");
        }
        for (String column : options.columns()) {
            if (column.toLowerCase(Locale.ROOT).contains(" as ")) {
                throw new UnsupportedBackendOperationException(type(), "select", "column alias");
            }
        }
        Document filter = translator.translate(options.where());
        MongoDatabase db = requireConnected("select");
        log.debug("mongodb select {}: {}", table, filter.toJson());
        return execute("select", table, () -> {
            MongoCollection<Document> collection = db.getCollection(table);
            ClientSession current = session.get();
            FindIterable<Document> find = current != null ? collection.find(current, filter) : collection.find(filter);
            if (!options.selectsAll()) {
                List<String> fields = new ArrayList<>();
                options.columns().forEach(c -> fields.add(MongoFilterTranslator.field(c)));
                find = find.projection(Projections.include(fields));
            }
            if (!options.orderBy().isEmpty()) {
                Document sort = new Document();
                for (OrderByClause order : options.orderBy()) {
                    sort.append(
                            MongoFilterTranslator.field(order.column()),
                            order.direction() == OrderByClause.Direction.DESC ? -1 : 1);
                }
                find = find.sort(sort);
            }
            if (options.offset() != null) {
                find = find.skip(options.offset());
            }
            if (options.limit() != null) {
                find = find.limit(options.limit());
            }
            List<Document> documents = find.into(new ArrayList<>());
            List<Map<String, Object>> rows = new ArrayList<>(documents.size());
            documents.forEach(document -> rows.add(toRow(document)));
            return rows;
        });
    }

    @Override
    public Object insert(String table, Map<String, Object> data, String keyName) {
        MongoDatabase db = requireConnected("insert");
        Document document = toDocument(data);
        document.putIfAbsent("_id", new ObjectId());
        return execute("insert", table, () -> {
            MongoCollection<Document> collection = db.getCollection(table);
            ClientSession current = session.get();
            if (current != null) {
                collection.insertOne(current, document);
            } else {
                collection.insertOne(document);
            }
            return idOf(document.get("_id"));
        });
    }

    @Override
    public int update(String table, List<WhereClause> where, Map<String, Object> data) {
        Document filter = translator.translate(where);
        Document changes = toDocument(data);
        changes.remove("_id");
        MongoDatabase db = requireConnected("update");
        if (changes.isEmpty()) {
            throw new IllegalArgumentException("update requires at least one field");
        }
        log.debug("mongodb update {}: {}", table, filter.toJson());
        return execute("update", table, () -> {
            MongoCollection<Document> collection = db.getCollection(table);
            Document set = new Document("$set", changes);
            ClientSession current = session.get();
            long matched = current != null
                    ? collection.updateMany(current, filter, set).getMatchedCount()
                    : collection.updateMany(filter, set).getMatchedCount();
            return (int) matched;
        });
    }

    @Override
    public int delete(String table, List<WhereClause> where) {
        Document filter = translator.translate(where);
        MongoDatabase db = requireConnected("delete");
        log.debug("mongodb delete {}: {}", table, filter.toJson());
        return execute("delete", table, () -> {
            MongoCollection<Document> collection = db.getCollection(table);
            ClientSession current = session.get();
            long deleted = current != null
                    ? collection.deleteMany(current, filter).getDeletedCount()
                    : collection.deleteMany(filter).getDeletedCount();
            return (int) deleted;
        });
    }

    @Override
    public Object aggregate(String table, AggregateFunction function, String column, SelectOptions options) {
        if (!options.joins().isEmpty()) {
            throw new UnsupportedBackendOperationException(type(), "aggregate", "join");
        }
        Document filter = translator.translate(options.where());
        MongoDatabase db = requireConnected("aggregate");
        return execute("aggregate", table, () -> {
            MongoCollection<Document> collection = db.getCollection(table);
            ClientSession current = session.get();
            if (function == AggregateFunction.COUNT) {
                return current != null ? collection.countDocuments(current, filter) : collection.countDocuments(filter);
            }
            String expression = "$" + MongoFilterTranslator.field(column);
            BsonField accumulator = switch (function) {
                case SUM -> Accumulators.sum("aggregate", expression);
                case AVG -> Accumulators.avg("aggregate", expression);
                case MIN -> Accumulators.min("aggregate", expression);
                case MAX -> Accumulators.max("aggregate", expression);
                case COUNT -> throw new IllegalStateException("count handled above");
            };
            List<Bson> pipeline = List.of(Aggregates.match(filter), Aggregates.group(null, accumulator));
            Document result = current != null
                    ? collection.aggregate(current, pipeline).first()
                    : collection.aggregate(pipeline).first();
            return result == null ? null : result.get("aggregate");
        });
    }

    /**
     * Runs an aggregation pipeline against a collection; rows carry {@code id} like {@link #select}.
     */
    public List<Map<String, Object>> aggregatePipeline(String table, List<? extends Bson> pipeline) {
        MongoDatabase db = requireConnected("aggregate");
        return execute("aggregate", table, () -> {
            MongoCollection<Document> collection = db.getCollection(table);
            ClientSession current = session.get();
            List<Document> documents = current != null
                    ? collection.aggregate(current, pipeline).into(new ArrayList<>())
                    : collection.aggregate(pipeline).into(new ArrayList<>());
            List<Map<String, Object>> rows = new ArrayList<>(documents.size());
            documents.forEach(document -> rows.add(toRow(document)));
            return rows;
        });
    }

    /**
     * {@code "db"} returns the {@link MongoDatabase}; any other text is parsed as a JSON command
     * document and passed to {@code runCommand}.
     */
    @Override
    public Object raw(String query, List<Object> params) {
        MongoDatabase db = requireConnected("raw");
        if ("db".equals(query)) {
            return db;
        }
        if (params != null && !params.isEmpty()) {
            throw new UnsupportedBackendOperationException(type(), "raw", "positional parameters");
        }
        Document command = Document.parse(query);
        return execute("raw", null, () -> {
            ClientSession current = session.get();
            return current != null ? db.runCommand(current, command) : db.runCommand(command);
        });
    }

    // ---- transactions ----

    @Override
    public boolean supportsTransactions() {
        return replicaSet;
    }

    @Override
    public void beginTransaction() {
        requireConnected("beginTransaction");
        if (!replicaSet) {
            throw new UnsupportedBackendOperationException(type(), "beginTransaction", "transactions on a standalone server");
        }
        if (session.get() != null) {
            throw new UnsupportedBackendOperationException(type(), "beginTransaction", "nested transactions");
        }
        ClientSession started = execute("beginTransaction", null, () -> {
            ClientSession s = client.startSession();
            s.startTransaction();
            return s;
        });
        session.set(started);
    }

    @Override
    public void commit() {
        requireConnected("commit");
        ClientSession current = requireSession("commit");
        try {
            execute("commit", null, () -> {
                current.commitTransaction();
                return null;
            });
        } finally {
            current.close();
            session.remove();
        }
    }

    @Override
    public void rollback() {
        requireConnected("rollback");
        ClientSession current = requireSession("rollback");
        try {
            execute("rollback", null, () -> {
                current.abortTransaction();
                return null;
            });
        } finally {
            current.close();
            session.remove();
        }
    }

    private ClientSession requireSession(String operation) {
        ClientSession current = session.get();
        if (current == null) {
            throw new DatabaseException("No active transaction", type(), operation);
        }
        return current;
    }

    // ---- plumbing ----

    private MongoDatabase requireConnected(String operation) {
        MongoDatabase db = database;
        if (client == null || db == null) {
            throw ConnectionException.notConnected(type(), operation);
        }
        return db;
    }

    private <T> T execute(String operation, String table, Supplier<T> work) {
        try {
            return work.get();
        } catch (MongoException e) {
            throw new QueryExecutionException(type(), operation, table, e.getMessage(), null, e.getCode(), e);
        }
    }

    private void rejectForeignKeys(List<ColumnDefinition> columns, String operation) {
        for (ColumnDefinition column : columns) {
            if (column.foreignKey() != null) {
                throw new UnsupportedBackendOperationException(type(), operation, "foreign key");
            }
        }
    }

    private static void createUniqueIndex(MongoCollection<Document> collection, String table, String field) {
        collection.createIndex(
                Indexes.ascending(field), new IndexOptions().unique(true).name(table + "_" + field + "_unique"));
    }

    private static Document toDocument(Map<String, Object> data) {
        Document document = new Document();
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            String field = MongoFilterTranslator.field(entry.getKey());
            document.put(field, MongoFilterTranslator.value(field, entry.getValue()));
        }
        return document;
    }

    /** Result row: {@code id} first, then the document's own fields. */
    static Map<String, Object> toRow(Document document) {
        Map<String, Object> row = new LinkedHashMap<>();
        if (document.containsKey("_id")) {
            row.put("id", idOf(document.get("_id")));
        }
        row.putAll(document);
        return row;
    }

    private static Object idOf(Object id) {
        return id instanceof ObjectId objectId ? objectId.toHexString() : id;
    }
}
