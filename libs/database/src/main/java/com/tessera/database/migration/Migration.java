package com.tessera.database.migration;

import com.tessera.database.schema.Schema;

/**
 * One reversible schema change. Names follow {@code <14-digit timestamp>_<snake_name>}, e.g. {@code
 * 20240101000000_create_users_table}, and order migrations lexicographically.
 */
public interface Migration {

    String name();

    void up(Schema schema);

    void down(Schema schema);
}
