package com.tessera.database.exception;

import java.util.Map;

/**
 * Programming or configuration error: unknown backend type, unknown query macro, access to an
 * undeclared relation, invalid identifier or migration name.
 */
public class ConfigurationException extends DatabaseException {

    public ConfigurationException(String message) {
        this(message, Map.of());
    }

    public ConfigurationException(String message, Map<String, ?> details) {
        super(message, null, "configure", details, null);
    }
}
