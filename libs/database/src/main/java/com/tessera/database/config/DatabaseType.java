package com.tessera.database.config;

import com.tessera.database.exception.ConfigurationException;
import java.util.Locale;
import java.util.Map;

/**
 * Backends a {@link com.tessera.database.adapter.DatabaseAdapter} can target.
 *
 * <p>The {@code MEMORY} backend is the in-process adapter from the {@code testing} package. It is
 * registered with the default adapter factory so that local profiles and tests can run without a
 * database server.
 */
public enum DatabaseType {
    MYSQL("mysql", true, 3306),
    POSTGRES("postgres", true, 5432),
    MONGODB("mongodb", false, 27017),
    MEMORY("memory", false, 0);

    private static final Map<String, DatabaseType> ALIASES =
            Map.of(
                    "mysql", MYSQL,
                    "mariadb", MYSQL,
                    "postgres", POSTGRES,
                    "postgresql", POSTGRES,
                    "pgsql", POSTGRES,
                    "mongodb", MONGODB,
                    "mongo", MONGODB,
                    "memory", MEMORY);

    private final String tag;
    private final boolean relational;
    private final int defaultPort;

    DatabaseType(String tag, boolean relational, int defaultPort) {
        this.tag = tag;
        this.relational = relational;
        this.defaultPort = defaultPort;
    }

    /** Configuration tag, e.g. {@code "mysql"}. */
    public String tag() {
        return tag;
    }

    /** True for SQL engines. */
    public boolean relational() {
        return relational;
    }

    public int defaultPort() {
        return defaultPort;
    }

    /**
     * Resolves a configuration tag (case-insensitive, common aliases accepted).
     *
     * @throws ConfigurationException if the tag names no known backend
     */
    public static DatabaseType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new ConfigurationException("Database type must not be null or blank");
        }
        DatabaseType type = ALIASES.get(tag.trim().toLowerCase(Locale.ROOT));
        if (type == null) {
            throw new ConfigurationException(
                    "Unsupported database type '%s'".formatted(tag), Map.of("type", tag));
        }
        return type;
    }
}
