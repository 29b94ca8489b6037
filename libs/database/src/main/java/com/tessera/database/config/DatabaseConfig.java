package com.tessera.database.config;

/**
 * Backend-neutral adapter connection settings.
 *
 * <p>Either the discrete {@code host/port/database} fields or a full connection string in {@code
 * url} may be supplied. When {@code url} is set it takes precedence over host and port, but
 * {@code database} is still used to select the schema or document database.
 *
 * @param type backend to connect to
 * @param host server host, defaults to {@code localhost}
 * @param port server port, defaults to the backend's standard port
 * @param database database (schema) name
 * @param username login user, may be null
 * @param password login password, may be null
 * @param ssl whether to require TLS
 * @param url full connection string ({@code jdbc:...} or {@code mongodb://...}), may be null
 * @param pool pool bounds, defaults to {@link PoolConfig#defaults()}
 */
public record DatabaseConfig(
        DatabaseType type,
        String host,
        Integer port,
        String database,
        String username,
        String password,
        boolean ssl,
        String url,
        PoolConfig pool) {

    public DatabaseConfig {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (pool == null) {
            pool = PoolConfig.defaults();
        }
    }

    public String hostOrDefault() {
        return host == null || host.isBlank() ? "localhost" : host;
    }

    public int portOrDefault() {
        return port == null ? type.defaultPort() : port;
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }

    /** Password masked for log output. */
    @Override
    public String toString() {
        return "DatabaseConfig[type=%s, host=%s, port=%s, database=%s, username=%s, ssl=%s, url=%s, pool=%s]"
                .formatted(type, host, port, database, username, ssl, hasUrl() ? "<set>" : null, pool);
    }

    public static Builder builder(DatabaseType type) {
        return new Builder(type);
    }

    /** Fluent builder, mostly for tests and programmatic setup. */
    public static final class Builder {
        private final DatabaseType type;
        private String host;
        private Integer port;
        private String database;
        private String username;
        private String password;
        private boolean ssl;
        private String url;
        private PoolConfig pool;

        private Builder(DatabaseType type) {
            this.type = type;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder ssl(boolean ssl) {
            this.ssl = ssl;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder pool(int min, int max) {
            this.pool = new PoolConfig(min, max);
            return this;
        }

        public DatabaseConfig build() {
            return new DatabaseConfig(type, host, port, database, username, password, ssl, url, pool);
        }
    }
}
