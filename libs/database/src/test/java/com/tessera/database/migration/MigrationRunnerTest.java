package com.tessera.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tessera.database.exception.ConfigurationException;
import com.tessera.database.exception.MigrationException;
import com.tessera.database.schema.Schema;
import com.tessera.database.testing.InMemoryDatabaseAdapter;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MigrationRunner")
class MigrationRunnerTest {

    private static final String USERS = "20240101000000_create_users_table";
    private static final String POSTS = "20240102000000_create_posts_table";
    private static final String TAGS = "20240103000000_create_tags_table";

    private InMemoryDatabaseAdapter adapter;
    private Schema schema;
    private List<Migration> available;
    private MigrationRunner runner;

    @BeforeEach
    void setUp() {
        adapter = InMemoryDatabaseAdapter.connected();
        schema = new Schema(adapter);
        available = new ArrayList<>(List.of(
                new CreateTable(POSTS, "posts"),
                new CreateTable(USERS, "users")));
        runner = new MigrationRunner(schema, () -> available);
    }

    @Nested
    @DisplayName("migrate")
    class Migrate {

        @Test
        @DisplayName("applies pending migrations in name order as one batch")
        void appliesInOrder() {
            assertThat(runner.migrate()).containsExactly(USERS, POSTS);

            assertThat(schema.hasTable("users")).isTrue();
            assertThat(schema.hasTable("posts")).isTrue();
            assertThat(runner.repository().records())
                    .extracting(MigrationRecord::batch)
                    .containsOnly(1);
        }

        @Test
        @DisplayName("is idempotent and opens a new batch for new migrations only")
        void newBatch() {
            runner.migrate();

            assertThat(runner.migrate()).isEmpty();

            available.add(new CreateTable(TAGS, "tags"));
            assertThat(runner.migrate()).containsExactly(TAGS);
            assertThat(runner.repository().lastBatch()).isEqualTo(2);
        }

        @Test
        @DisplayName("status reports applied and pending migrations with their batch")
        void status() {
            runner.migrate();
            available.add(new CreateTable(TAGS, "tags"));

            assertThat(runner.status()).containsExactly(
                    new MigrationStatus(USERS, true, 1),
                    new MigrationStatus(POSTS, true, 1),
                    new MigrationStatus(TAGS, false, null));
        }

        @Test
        @DisplayName("wraps failures and keeps earlier migrations of the batch recorded")
        void failure() {
            available.add(new Failing("20240104000000_broken"));
            available.add(new CreateTable("20240105000000_create_audit_table", "audit"));

            assertThatThrownBy(runner::migrate)
                    .isInstanceOfSatisfying(MigrationException.class, e -> {
                        assertThat(e.migration()).isEqualTo("20240104000000_broken");
                        assertThat(e.getCause()).isInstanceOf(IllegalStateException.class);
                    });
            assertThat(runner.repository().records())
                    .extracting(MigrationRecord::migration)
                    .containsExactly(USERS, POSTS);
            assertThat(schema.hasTable("audit")).isFalse();
        }

        @Test
        @DisplayName("uses a custom migrations table")
        void customTable() {
            var custom = new MigrationRunner(schema, () -> available, "schema_history");

            custom.migrate();

            assertThat(schema.hasTable("schema_history")).isTrue();
            assertThat(schema.hasTable(MigrationRepository.DEFAULT_TABLE)).isFalse();
        }
    }

    @Nested
    @DisplayName("rollback")
    class Rollback {

        @BeforeEach
        void twoBatches() {
            runner.migrate();
            available.add(new CreateTable(TAGS, "tags"));
            runner.migrate();
        }

        @Test
        @DisplayName("reverts only the latest batch")
        void latestBatch() {
            assertThat(runner.rollback()).containsExactly(TAGS);

            assertThat(schema.hasTable("tags")).isFalse();
            assertThat(schema.hasTable("posts")).isTrue();
        }

        @Test
        @DisplayName("reverts several batches newest first, reverse name order within a batch")
        void steps() {
            assertThat(runner.rollback(2)).containsExactly(TAGS, POSTS, USERS);
            assertThat(runner.repository().records()).isEmpty();
        }

        @Test
        @DisplayName("rejects a non-positive step count")
        void invalidSteps() {
            assertThatThrownBy(() -> runner.rollback(0)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("reset reverts everything and fresh rebuilds from scratch")
        void resetAndFresh() {
            assertThat(runner.reset()).containsExactly(TAGS, POSTS, USERS);
            assertThat(runner.rollback()).isEmpty();

            runner.migrate();
            adapter.createTable("stray", List.of());

            assertThat(runner.fresh()).containsExactly(USERS, POSTS, TAGS);
            assertThat(schema.hasTable("stray")).isFalse();
            assertThat(runner.repository().lastBatch()).isEqualTo(1);
        }

        @Test
        @DisplayName("fails when a recorded migration is no longer available")
        void missingMigration() {
            available.removeIf(migration -> migration.name().equals(TAGS));

            assertThatThrownBy(runner::rollback)
                    .isInstanceOf(MigrationException.class)
                    .hasMessageContaining(TAGS);
        }
    }

    @Nested
    @DisplayName("MigrationRegistry")
    class Registry {

        @Test
        @DisplayName("returns migrations sorted by name")
        void sorted() {
            var registry = MigrationRegistry.of(new CreateTable(POSTS, "posts"), new CreateTable(USERS, "users"));

            assertThat(registry.migrations()).extracting(Migration::name).containsExactly(USERS, POSTS);
        }

        @Test
        @DisplayName("rejects malformed and duplicate names")
        void rejectsBadNames() {
            var registry = MigrationRegistry.of(new CreateTable(USERS, "users"));

            assertThatThrownBy(() -> registry.register(new CreateTable("create_users", "users")))
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> registry.register(new CreateTable("2024_create_users", "users")))
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> registry.register(new CreateTable(USERS, "people")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Duplicate");
        }
    }

    private record CreateTable(String name, String table) implements Migration {

        @Override
        public void up(Schema schema) {
            schema.create(table, blueprint -> {
                blueprint.id();
                blueprint.string("name");
            });
        }

        @Override
        public void down(Schema schema) {
            schema.drop(table);
        }
    }

    private record Failing(String name) implements Migration {

        @Override
        public void up(Schema schema) {
            throw new IllegalStateException("boom");
        }

        @Override
        public void down(Schema schema) {
            // nothing to undo
        }
    }
}
