package com.tessera.database.migration;

import java.util.List;

/** Supplies the known migrations, sorted by name. */
@FunctionalInterface
public interface MigrationSource {

    List<Migration> migrations();
}
