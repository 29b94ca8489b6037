package com.tessera.database.query;

/**
 * Named extension invoked through {@link QueryBuilder#macro(String, Object...)}.
 *
 * <p>A macro receives the builder it was called on and can reach the bound adapter via {@link
 * QueryBuilder#adapter()}. It may return a result, the builder for further chaining, or null.
 */
@FunctionalInterface
public interface QueryMacro {

    Object invoke(QueryBuilder<?> builder, Object... args);
}
