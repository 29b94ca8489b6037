package com.tessera.database.migration;

/**
 * Per-migration status line.
 *
 * @param migration migration name
 * @param applied whether the migration has run
 * @param batch batch it ran in, null when pending
 */
public record MigrationStatus(String migration, boolean applied, Integer batch) {}
