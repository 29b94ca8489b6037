package com.tessera.database.exception;

import com.tessera.database.config.DatabaseType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the data-access exception hierarchy.
 *
 * <p>Every subclass carries the backend and the operation that failed, plus a detail map (table,
 * operator, migration name, ...) so that callers can build actionable messages without re-deriving
 * context. All exceptions are unchecked; nothing in this library retries on its own.
 */
public class DatabaseException extends RuntimeException {

    private final DatabaseType backend;
    private final String operation;
    private final Map<String, Object> details;

    public DatabaseException(
            String message,
            DatabaseType backend,
            String operation,
            Map<String, ?> details,
            Throwable cause) {
        super(message, cause);
        this.backend = backend;
        this.operation = operation;
        this.details = details == null ? Map.of() : copy(details);
    }

    public DatabaseException(String message, DatabaseType backend, String operation) {
        this(message, backend, operation, Map.of(), null);
    }

    /** Backend that raised the error, or null when the error is not backend-specific. */
    public DatabaseType backend() {
        return backend;
    }

    /** Operation being attempted, e.g. {@code "select"} or {@code "connect"}. */
    public String operation() {
        return operation;
    }

    /** Structured context; values may be null. */
    public Map<String, Object> details() {
        return details;
    }

    private static Map<String, Object> copy(Map<String, ?> details) {
        // null values are legal here, so Map.copyOf is not an option
        return Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
