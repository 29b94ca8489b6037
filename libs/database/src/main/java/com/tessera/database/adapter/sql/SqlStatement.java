package com.tessera.database.adapter.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Compiled SQL text plus its positional bindings.
 *
 * @param sql statement text with {@code ?} placeholders
 * @param bindings values in placeholder order; may contain nulls
 */
public record SqlStatement(String sql, List<Object> bindings) {

    public SqlStatement {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("sql must not be null or blank");
        }
        bindings = bindings == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(bindings));
    }

    public static SqlStatement of(String sql) {
        return new SqlStatement(sql, List.of());
    }
}
