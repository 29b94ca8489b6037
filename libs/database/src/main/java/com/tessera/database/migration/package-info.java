/**
 * Versioned schema migrations.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.tessera.database.migration.MigrationRunner}: applies, rolls back and reports
 *       migrations in batches
 *   <li>{@link com.tessera.database.migration.MigrationRepository}: the bookkeeping table
 *   <li>{@link com.tessera.database.migration.MigrationRegistry} and {@link
 *       com.tessera.database.migration.SqlDirectoryMigrationSource}: code and SQL-file sources
 * </ul>
 */
package com.tessera.database.migration;
