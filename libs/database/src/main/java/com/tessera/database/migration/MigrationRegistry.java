package com.tessera.database.migration;

import com.tessera.database.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/** Explicitly registered {@link Migration} instances. */
public final class MigrationRegistry implements MigrationSource {

    public static final Pattern NAME_PATTERN = Pattern.compile("^\\d{14}_\\w+$");

    private final Map<String, Migration> migrations = new TreeMap<>();

    public static MigrationRegistry of(Migration... migrations) {
        MigrationRegistry registry = new MigrationRegistry();
        for (Migration migration : migrations) {
            registry.register(migration);
        }
        return registry;
    }

    /**
     * @throws ConfigurationException if the name is malformed or already registered
     */
    public MigrationRegistry register(Migration migration) {
        if (migration == null) {
            throw new IllegalArgumentException("migration must not be null");
        }
        String name = validateName(migration.name());
        if (migrations.putIfAbsent(name, migration) != null) {
            throw new ConfigurationException(
                    "Duplicate migration name '%s'".formatted(name), Map.of("migration", name));
        }
        return this;
    }

    @Override
    public List<Migration> migrations() {
        return new ArrayList<>(migrations.values());
    }

    static String validateName(String name) {
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new ConfigurationException(
                    "Invalid migration name '%s'; expected <14-digit timestamp>_<name>".formatted(name),
                    Map.of("migration", String.valueOf(name)));
        }
        return name;
    }
}
