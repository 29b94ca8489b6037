package com.tessera.database.adapter;

import com.tessera.database.config.DatabaseType;

/**
 * Handle returned by {@link DatabaseAdapter#connect}.
 *
 * @param type connected backend
 * @param database database (schema) name in use
 * @param adapter owning adapter
 */
public record DatabaseConnection(DatabaseType type, String database, DatabaseAdapter adapter) {

    public boolean isOpen() {
        return adapter.isConnected();
    }
}
