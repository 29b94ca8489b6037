package com.tessera.database.migration;

import java.time.LocalDateTime;

/**
 * Row of the migrations table.
 *
 * @param id row key
 * @param migration migration name
 * @param batch batch the migration ran in; rollback unit
 * @param executedAt when it ran, null if not recorded
 */
public record MigrationRecord(Object id, String migration, int batch, LocalDateTime executedAt) {}
