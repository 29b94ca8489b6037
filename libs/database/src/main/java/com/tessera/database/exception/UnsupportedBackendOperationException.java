package com.tessera.database.exception;

import com.tessera.database.config.DatabaseType;
import java.util.Map;

/**
 * An operator or feature cannot be expressed on the target backend.
 *
 * <p>Raised before any I/O takes place: a predicate or clause that a backend cannot translate is
 * rejected rather than approximated.
 */
public class UnsupportedBackendOperationException extends DatabaseException {

    private final String feature;

    public UnsupportedBackendOperationException(
            DatabaseType backend, String operation, String feature) {
        super(
                "Unsupported operator for %s backend: %s (operation '%s')"
                        .formatted(backend.tag(), feature, operation),
                backend,
                operation,
                Map.of("feature", feature),
                null);
        this.feature = feature;
    }

    /** Offending operator or feature, e.g. {@code "ILIKE"} or {@code "join"}. */
    public String feature() {
        return feature;
    }
}
