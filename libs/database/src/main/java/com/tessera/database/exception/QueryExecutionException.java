package com.tessera.database.exception;

import com.tessera.database.config.DatabaseType;
import java.util.HashMap;
import java.util.Map;

/**
 * Wraps a driver failure ({@code SQLException}, {@code MongoException}) unchanged as its cause.
 *
 * <p>The driver's SQL state and vendor code are surfaced so callers can tell constraint
 * violations from other failures without unwrapping.
 */
public class QueryExecutionException extends DatabaseException {

    private static final String SQL_STATE_UNIQUE_VIOLATION = "23505";
    private static final int MYSQL_DUPLICATE_ENTRY = 1062;
    private static final int MONGO_DUPLICATE_KEY = 11000;

    private final String sqlState;
    private final int errorCode;

    public QueryExecutionException(
            DatabaseType backend,
            String operation,
            String table,
            String message,
            String sqlState,
            int errorCode,
            Throwable cause) {
        super(
                "%s %s failed on '%s': %s".formatted(backend.tag(), operation, table, message),
                backend,
                operation,
                details(table, sqlState, errorCode),
                cause);
        this.sqlState = sqlState;
        this.errorCode = errorCode;
    }

    /** SQLSTATE reported by the driver, null for document backends. */
    public String sqlState() {
        return sqlState;
    }

    /** Vendor-specific error code, 0 when unknown. */
    public int errorCode() {
        return errorCode;
    }

    /** True when the failure is a unique / duplicate-key violation on any backend. */
    public boolean isUniqueViolation() {
        if (SQL_STATE_UNIQUE_VIOLATION.equals(sqlState)) {
            return true;
        }
        return switch (backend()) {
            case MYSQL -> errorCode == MYSQL_DUPLICATE_ENTRY;
            case MONGODB -> errorCode == MONGO_DUPLICATE_KEY;
            default -> false;
        };
    }

    private static Map<String, Object> details(String table, String sqlState, int errorCode) {
        Map<String, Object> details = new HashMap<>();
        details.put("table", table);
        details.put("sqlState", sqlState);
        details.put("errorCode", errorCode);
        return details;
    }
}
