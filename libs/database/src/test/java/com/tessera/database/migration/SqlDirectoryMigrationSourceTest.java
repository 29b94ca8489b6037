package com.tessera.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tessera.database.adapter.sql.MySqlAdapter;
import com.tessera.database.exception.ConfigurationException;
import com.tessera.database.exception.MigrationException;
import com.tessera.database.exception.QueryExecutionException;
import com.tessera.database.model.Database;
import com.tessera.database.schema.Schema;
import com.tessera.database.support.H2Databases;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("SqlDirectoryMigrationSource")
class SqlDirectoryMigrationSourceTest {

    private static final String LOCATION = "classpath:db/migrations";
    private static final String AUTHORS = "20240101000000_create_authors_table";
    private static final String BOOKS = "20240102000000_create_books_table";

    @Nested
    @DisplayName("Statement splitting")
    class Splitting {

        @Test
        @DisplayName("splits on semicolons and drops blank statements")
        void splits() {
            assertThat(SqlDirectoryMigrationSource.splitStatements("CREATE TABLE a (id INT);\n\nDROP TABLE b;;"))
                    .containsExactly("CREATE TABLE a (id INT)", "DROP TABLE b");
        }

        @Test
        @DisplayName("keeps separators inside quoted literals and identifiers")
        void quoted() {
            assertThat(SqlDirectoryMigrationSource.splitStatements(
                            "INSERT INTO t VALUES ('a;b', 'it''s; fine'); SELECT `x;y` FROM \"t;u\""))
                    .containsExactly("INSERT INTO t VALUES ('a;b', 'it''s; fine')", "SELECT `x;y` FROM \"t;u\"");
        }

        @Test
        @DisplayName("strips comments, including ones holding separators")
        void comments() {
            assertThat(SqlDirectoryMigrationSource.splitStatements(
                            "-- first; comment\nSELECT 1; /* block; comment */ SELECT 2"))
                    .containsExactly("SELECT 1", "SELECT 2");
        }

        @Test
        @DisplayName("keeps dollar-quoted function bodies in one statement")
        void dollarQuoted() {
            var script = """
                    CREATE FUNCTION touch() RETURNS trigger AS $$
                    BEGIN
                        NEW.updated_at := now();
                        RETURN NEW;
                    END;
                    $$ LANGUAGE plpgsql;
                    CREATE TRIGGER touch_posts BEFORE UPDATE ON posts
                        FOR EACH ROW EXECUTE FUNCTION touch();
                    """;

            var statements = SqlDirectoryMigrationSource.splitStatements(script);

            assertThat(statements).hasSize(2);
            assertThat(statements.get(0))
                    .startsWith("CREATE FUNCTION touch()")
                    .contains("NEW.updated_at := now();\n    RETURN NEW;\nEND;\n$$")
                    .endsWith("LANGUAGE plpgsql");
            assertThat(statements.get(1)).startsWith("CREATE TRIGGER touch_posts");
        }

        @Test
        @DisplayName("honours tagged dollar quotes holding plain ones")
        void taggedDollarQuotes() {
            assertThat(SqlDirectoryMigrationSource.splitStatements(
                            "DO $body$ BEGIN PERFORM $$a;b$$; END $body$; SELECT 1"))
                    .containsExactly("DO $body$ BEGIN PERFORM $$a;b$$; END $body$", "SELECT 1");
        }

        @Test
        @DisplayName("a script without statements yields nothing")
        void empty() {
            assertThat(SqlDirectoryMigrationSource.splitStatements("  -- nothing here\n")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Discovery")
    class Discovery {

        @Test
        @DisplayName("lists up scripts from the classpath in name order")
        void classpath() {
            var source = new SqlDirectoryMigrationSource(LOCATION);

            assertThat(source.migrations()).extracting(Migration::name).containsExactly(AUTHORS, BOOKS);
        }

        @Test
        @DisplayName("treats a bare path as a filesystem location")
        void barePath(@TempDir Path dir) throws Exception {
            Files.writeString(dir.resolve("20240301000000_create_tags_table.up.sql"), "CREATE TABLE tags (id INT);");

            var source = new SqlDirectoryMigrationSource(dir.toString());

            assertThat(source.location()).startsWith("file:");
            assertThat(source.migrations()).extracting(Migration::name).containsExactly("20240301000000_create_tags_table");
        }

        @Test
        @DisplayName("rejects malformed file names")
        void malformedName(@TempDir Path dir) throws Exception {
            Files.writeString(dir.resolve("create_tags_table.up.sql"), "CREATE TABLE tags (id INT);");

            assertThatThrownBy(() -> new SqlDirectoryMigrationSource(dir.toString()).migrations())
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("requires a location")
        void requiresLocation() {
            assertThatThrownBy(() -> new SqlDirectoryMigrationSource(" ")).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Against H2 in MySQL mode")
    class AgainstH2 {

        private MySqlAdapter adapter;
        private Schema schema;
        private MigrationRunner runner;

        @BeforeEach
        void setUp() {
            adapter = H2Databases.mysql();
            schema = new Schema(adapter);
            runner = new MigrationRunner(schema, new SqlDirectoryMigrationSource(LOCATION));
        }

        @AfterEach
        void tearDown() {
            adapter.disconnect();
        }

        @Test
        @DisplayName("migrate runs every statement of each script")
        void migrate() {
            assertThat(runner.migrate()).containsExactly(AUTHORS, BOOKS);

            var db = new Database(adapter);
            Object author = db.table("authors").insert(Map.of("name", "Le Guin"));
            db.table("books").insert(Map.of("author_id", author, "title", "The Dispossessed"));

            assertThat(db.table("authors").first()).containsEntry("motto", "write; then rewrite");
            assertThatThrownBy(() -> db.table("authors").insert(Map.of("name", "Le Guin")))
                    .isInstanceOfSatisfying(QueryExecutionException.class,
                            e -> assertThat(e.isUniqueViolation()).isTrue());

            db.table("authors").where("id", author).delete();
            assertThat(db.table("books").count()).isZero();
        }

        @Test
        @DisplayName("rollback runs the down scripts in reverse order")
        void rollback() {
            runner.migrate();

            assertThat(runner.rollback()).containsExactly(BOOKS, AUTHORS);
            assertThat(schema.hasTable("books")).isFalse();
            assertThat(schema.hasTable("authors")).isFalse();
            assertThat(schema.hasTable(MigrationRepository.DEFAULT_TABLE)).isTrue();
        }

        @Test
        @DisplayName("a missing down script fails only on rollback")
        void missingDown(@TempDir Path dir) throws Exception {
            Files.writeString(dir.resolve("20240301000000_create_tags_table.up.sql"), "CREATE TABLE tags (id INT);");
            var tagsRunner = new MigrationRunner(schema, new SqlDirectoryMigrationSource(dir.toString()));

            assertThat(tagsRunner.migrate()).hasSize(1);
            assertThatThrownBy(tagsRunner::rollback)
                    .isInstanceOf(MigrationException.class)
                    .hasMessageContaining(".down.sql");
        }
    }
}
