package com.tessera.database.adapter.sql;

import com.tessera.database.config.DatabaseConfig;

/** MySQL adapter over Connector/J. */
public class MySqlAdapter extends JdbcDatabaseAdapter {

    public MySqlAdapter() {
        super(new MySqlGrammar());
    }

    @Override
    protected String buildUrl(DatabaseConfig config) {
        return "jdbc:mysql://%s:%d/%s?sslMode=%s".formatted(
                config.hostOrDefault(),
                config.portOrDefault(),
                config.database(),
                config.ssl() ? "REQUIRED" : "DISABLED");
    }

    @Override
    protected boolean disablesSsl(String url) {
        String lower = lower(url);
        return lower.contains("sslmode=disabled") || lower.contains("usessl=false");
    }
}
