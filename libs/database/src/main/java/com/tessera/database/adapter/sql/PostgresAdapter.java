package com.tessera.database.adapter.sql;

import com.tessera.database.config.DatabaseConfig;

/**
 * PostgreSQL adapter over pgJDBC.
 *
 * <p>Connections use {@code stringtype=unspecified} so string bindings reach {@code jsonb} and
 * {@code uuid} columns without explicit casts. Caller-supplied pgJDBC URLs get the option appended
 * unless they set {@code stringtype} themselves.
 */
public class PostgresAdapter extends JdbcDatabaseAdapter {

    public PostgresAdapter() {
        super(new PostgresGrammar());
    }

    @Override
    protected String buildUrl(DatabaseConfig config) {
        return "jdbc:postgresql://%s:%d/%s?sslmode=%s&stringtype=unspecified".formatted(
                config.hostOrDefault(),
                config.portOrDefault(),
                config.database(),
                config.ssl() ? "require" : "disable");
    }

    @Override
    protected String completeUrl(String url) {
        String lower = lower(url);
        if (!lower.startsWith("jdbc:postgresql:") || lower.contains("stringtype=")) {
            return url;
        }
        return url + (url.contains("?") ? "&" : "?") + "stringtype=unspecified";
    }

    @Override
    protected boolean disablesSsl(String url) {
        String lower = lower(url);
        return lower.contains("sslmode=disable") || lower.contains("ssl=false");
    }
}
