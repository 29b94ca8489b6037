package com.tessera.database.adapter.sql;

import com.tessera.database.adapter.DatabaseAdapter;
import com.tessera.database.adapter.InstrumentedDatabaseAdapter;
import com.tessera.database.config.DatabaseType;
import com.tessera.database.exception.UnsupportedBackendOperationException;
import com.tessera.database.query.MacroRegistry;
import com.tessera.database.query.QueryBuilder;
import java.util.List;

/**
 * PostgreSQL macros. {@code search(column, term[, language])} adds a full-text predicate
 * {@code to_tsvector(language, column) @@ plainto_tsquery(language, term)}; the language defaults to
 * {@code english}.
 */
public final class PostgresExtensions {

    public static final String SEARCH = "search";
    public static final String DEFAULT_LANGUAGE = "english";

    private static final PostgresGrammar GRAMMAR = new PostgresGrammar();

    private PostgresExtensions() {
        // utility class
    }

    public static MacroRegistry register(MacroRegistry registry) {
        return registry.register(SEARCH, PostgresExtensions::search);
    }

    static QueryBuilder<?> search(QueryBuilder<?> builder, Object... args) {
        if (args.length < 2 || !(args[0] instanceof String column) || args[1] == null) {
            throw new IllegalArgumentException("search expects (column, term[, language])");
        }
        DatabaseAdapter adapter = builder.adapter();
        DatabaseAdapter target = adapter instanceof InstrumentedDatabaseAdapter instrumented
                ? instrumented.delegate()
                : adapter;
        if (target.type() != DatabaseType.POSTGRES) {
            throw new UnsupportedBackendOperationException(adapter.type(), SEARCH, "full-text search");
        }
        String language = args.length > 2 && args[2] != null ? args[2].toString() : DEFAULT_LANGUAGE;
        String sql = "to_tsvector(?::regconfig, " + GRAMMAR.wrap(column) + ") @@ plainto_tsquery(?::regconfig, ?)";
        return builder.whereRaw(sql, List.of(language, language, args[1].toString()));
    }
}
