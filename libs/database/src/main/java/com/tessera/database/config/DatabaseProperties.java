package com.tessera.database.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized database settings bound from {@code tessera.database.*}.
 *
 * <pre>{@code
 * tessera:
 *   database:
 *     enabled: true
 *     type: postgres
 *     host: localhost
 *     database: app
 *     username: app
 *     password: secret
 *     pool:
 *       min: 2
 *       max: 20
 *     migrations:
 *       location: classpath:db/migrations
 *       table: migrations
 *       run-on-startup: false
 * }</pre>
 *
 * @param enabled whether {@link DatabaseConfiguration} wires the beans
 * @param type backend tag ({@code mysql}, {@code postgres}, {@code mongodb}, {@code memory})
 * @param host server host
 * @param port server port, the backend default when unset
 * @param database database name
 * @param username login user
 * @param password login password
 * @param ssl require TLS
 * @param url full connection string, overrides host and port
 * @param pool pool bounds
 * @param migrations migration runner settings
 */
@Validated
@ConfigurationProperties(prefix = "tessera.database")
public record DatabaseProperties(
        boolean enabled,
        @NotBlank String type,
        String host,
        @Min(1) @Max(65535) Integer port,
        String database,
        String username,
        String password,
        boolean ssl,
        String url,
        @Valid @DefaultValue Pool pool,
        @Valid @DefaultValue Migrations migrations) {

    /**
     * @param min minimum idle connections
     * @param max maximum pool size
     */
    public record Pool(
            @Min(0) @DefaultValue("0") int min,
            @Min(1) @DefaultValue("10") int max) {}

    /**
     * @param location SQL migration directory (Spring resource location); when unset, {@code
     *     Migration} beans are used
     * @param table migrations table name
     * @param runOnStartup apply pending migrations when the runner bean is created
     */
    public record Migrations(
            String location,
            @NotBlank @DefaultValue("migrations") String table,
            boolean runOnStartup) {}

    /** Adapter configuration; fails on an unknown backend tag. */
    public DatabaseConfig toConfig() {
        return new DatabaseConfig(
                DatabaseType.fromTag(type),
                host,
                port,
                database,
                username,
                password,
                ssl,
                url,
                new PoolConfig(pool.min(), pool.max()));
    }
}
