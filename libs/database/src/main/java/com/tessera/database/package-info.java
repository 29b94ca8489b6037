/**
 * Data-access layer for the Tessera platform.
 *
 * <p>One {@link com.tessera.database.adapter.DatabaseAdapter} per backend (MySQL, PostgreSQL,
 * MongoDB, plus an in-process store for tests) sits under a fluent {@link
 * com.tessera.database.query.QueryBuilder}, active-record {@link com.tessera.database.model.Model}s
 * with relations and eager loading, and a schema builder with versioned migrations.
 *
 * <ul>
 *   <li>{@code adapter}: backend contract, predicates and the SQL/document implementations
 *   <li>{@code query}: query builder and macros
 *   <li>{@code model}, {@code relation}: models, casts, factories, seeders and relations
 *   <li>{@code schema}, {@code migration}: blueprint DSL and the migration runner
 *   <li>{@code config}: Spring Boot wiring from {@code tessera.database.*}
 * </ul>
 *
 * @see com.tessera.database.config.DatabaseConfiguration
 */
package com.tessera.database;
