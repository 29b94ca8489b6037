package com.tessera.database.exception;

import java.util.Map;

/** A migration could not be loaded, or its {@code up}/{@code down} step failed. */
public class MigrationException extends DatabaseException {

    private final String migration;

    public MigrationException(String migration, String operation, String message, Throwable cause) {
        super(
                "Migration '%s' failed during %s: %s".formatted(migration, operation, message),
                null,
                operation,
                Map.of("migration", migration),
                cause);
        this.migration = migration;
    }

    public MigrationException(String migration, String operation, String message) {
        this(migration, operation, message, null);
    }

    public String migration() {
        return migration;
    }
}
