package com.tessera.database.exception;

import com.tessera.database.config.DatabaseType;
import java.util.Map;

/**
 * Raised when a backend cannot be reached, rejects the credentials, or the configuration asks for
 * a combination the adapter cannot honour. Also raised by any operation issued after {@code
 * disconnect()}.
 *
 * <p>Fatal to the operation; never retried automatically.
 */
public class ConnectionException extends DatabaseException {

    public ConnectionException(DatabaseType backend, String operation, String message) {
        this(backend, operation, message, null);
    }

    public ConnectionException(
            DatabaseType backend, String operation, String message, Throwable cause) {
        super(message, backend, operation, Map.of(), cause);
    }

    /** The adapter has no live connection (never connected, or disconnected). */
    public static ConnectionException notConnected(DatabaseType backend, String operation) {
        return new ConnectionException(
                backend,
                operation,
                "%s adapter is not connected; cannot run '%s'".formatted(backend.tag(), operation));
    }
}
