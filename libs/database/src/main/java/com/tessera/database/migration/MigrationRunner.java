package com.tessera.database.migration;

import com.tessera.database.exception.MigrationException;
import com.tessera.database.schema.Schema;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies and reverts migrations, recording each run in the migrations table.
 *
 * <p>Every {@link #migrate()} call that applies anything opens a new batch; {@link #rollback()}
 * reverts the most recent batch in reverse name order. Runs are strictly sequential and stop at the
 * first failing migration, leaving earlier ones of the batch recorded.
 */
public class MigrationRunner {

    private static final Logger log = LoggerFactory.getLogger(MigrationRunner.class);

    private final Schema schema;
    private final MigrationSource source;
    private final MigrationRepository repository;

    public MigrationRunner(Schema schema, MigrationSource source) {
        this(schema, source, MigrationRepository.DEFAULT_TABLE);
    }

    public MigrationRunner(Schema schema, MigrationSource source, String table) {
        if (schema == null) {
            throw new IllegalArgumentException("schema must not be null");
        }
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        this.schema = schema;
        this.source = source;
        this.repository = new MigrationRepository(schema.adapter(), table);
    }

    /** Runs pending migrations as one new batch. Returns the names applied. */
    public List<String> migrate() {
        repository.createIfMissing();
        Set<String> ran = new HashSet<>();
        repository.records().forEach(record -> ran.add(record.migration()));
        List<Migration> pending = new ArrayList<>();
        for (Migration migration : sorted()) {
            if (!ran.contains(migration.name())) {
                pending.add(migration);
            }
        }
        if (pending.isEmpty()) {
            log.info("Nothing to migrate");
            return List.of();
        }
        int batch = repository.lastBatch() + 1;
        List<String> applied = new ArrayList<>();
        for (Migration migration : pending) {
            run(migration, "up");
            repository.log(migration.name(), batch);
            applied.add(migration.name());
            log.info("Migrated {} (batch {})", migration.name(), batch);
        }
        return applied;
    }

    /** Reverts the most recent batch. */
    public List<String> rollback() {
        return rollback(1);
    }

    /** Reverts the {@code steps} most recent batches. Returns the names reverted. */
    public List<String> rollback(int steps) {
        if (steps < 1) {
            throw new IllegalArgumentException("steps must be >= 1");
        }
        List<MigrationRecord> records = repository.records();
        TreeSet<Integer> batches = new TreeSet<>(Comparator.reverseOrder());
        records.forEach(record -> batches.add(record.batch()));
        Set<Integer> targets = new HashSet<>();
        for (Integer batch : batches) {
            if (targets.size() == steps) {
                break;
            }
            targets.add(batch);
        }
        List<MigrationRecord> selected = new ArrayList<>();
        for (MigrationRecord record : records) {
            if (targets.contains(record.batch())) {
                selected.add(record);
            }
        }
        return revert(selected);
    }

    /** Reverts every applied migration. */
    public List<String> reset() {
        return revert(repository.records());
    }

    /** Drops every table, including the migrations table, then migrates from scratch. */
    public List<String> fresh() {
        schema.adapter().dropAllTables();
        log.info("Dropped all tables");
        return migrate();
    }

    /** One line per known migration, in name order. */
    public List<MigrationStatus> status() {
        Map<String, Integer> batches = new LinkedHashMap<>();
        repository.records().forEach(record -> batches.put(record.migration(), record.batch()));
        List<MigrationStatus> statuses = new ArrayList<>();
        for (Migration migration : sorted()) {
            Integer batch = batches.get(migration.name());
            statuses.add(new MigrationStatus(migration.name(), batch != null, batch));
        }
        return statuses;
    }

    public MigrationRepository repository() {
        return repository;
    }

    private List<String> revert(List<MigrationRecord> records) {
        if (records.isEmpty()) {
            log.info("Nothing to roll back");
            return List.of();
        }
        Map<String, Migration> known = new LinkedHashMap<>();
        sorted().forEach(migration -> known.put(migration.name(), migration));
        List<MigrationRecord> ordered = new ArrayList<>(records);
        ordered.sort(Comparator.comparingInt(MigrationRecord::batch)
                .thenComparing(MigrationRecord::migration)
                .reversed());
        List<String> reverted = new ArrayList<>();
        for (MigrationRecord record : ordered) {
            Migration migration = known.get(record.migration());
            if (migration == null) {
                throw new MigrationException(record.migration(), "down", "migration is recorded but no longer available");
            }
            run(migration, "down");
            repository.delete(record.migration());
            reverted.add(record.migration());
            log.info("Rolled back {} (batch {})", record.migration(), record.batch());
        }
        return reverted;
    }

    private List<Migration> sorted() {
        List<Migration> migrations = new ArrayList<>(source.migrations());
        migrations.sort(Comparator.comparing(Migration::name));
        return migrations;
    }

    private void run(Migration migration, String operation) {
        try {
            if ("up".equals(operation)) {
                migration.up(schema);
            } else {
                migration.down(schema);
            }
        } catch (MigrationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MigrationException(migration.name(), operation, e.getMessage(), e);
        }
    }
}
