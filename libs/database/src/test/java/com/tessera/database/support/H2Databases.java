package com.tessera.database.support;

import com.tessera.database.adapter.sql.JdbcDatabaseAdapter;
import com.tessera.database.adapter.sql.MySqlAdapter;
import com.tessera.database.adapter.sql.PostgresAdapter;
import com.tessera.database.config.DatabaseConfig;
import com.tessera.database.config.DatabaseType;
import java.util.UUID;

/** Connected relational adapters over private in-memory H2 databases in the matching compatibility mode. */
public final class H2Databases {

    private H2Databases() {
        // utility class
    }

    public static MySqlAdapter mysql() {
        MySqlAdapter adapter = new MySqlAdapter();
        connect(adapter, DatabaseType.MYSQL, "MySQL");
        return adapter;
    }

    public static PostgresAdapter postgres() {
        PostgresAdapter adapter = new PostgresAdapter();
        connect(adapter, DatabaseType.POSTGRES, "PostgreSQL");
        return adapter;
    }

    private static void connect(JdbcDatabaseAdapter adapter, DatabaseType type, String mode) {
        String name = "tessera_" + UUID.randomUUID().toString().replace("-", "");
        adapter.connect(DatabaseConfig.builder(type)
                .url("jdbc:h2:mem:%s;MODE=%s;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1".formatted(name, mode))
                .database(name)
                .username("sa")
                .password("")
                .pool(0, 4)
                .build());
    }
}
