package com.tessera.database.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tessera.database.support.BlogSchema;
import com.tessera.database.support.Role;
import com.tessera.database.support.User;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Seeder")
class SeederTest {

    @Test
    @DisplayName("a seeder can call other seeders against the same database")
    void callsNestedSeeders() {
        Database db = BlogSchema.create();

        new DatabaseSeeder().seed(db);

        assertThat(db.model(Role::new).count()).isEqualTo(2);
        assertThat(db.model(User::new).count()).isEqualTo(1);
    }

    @Test
    @DisplayName("call is unavailable outside seed")
    void callOutsideSeed() {
        assertThatThrownBy(() -> new DatabaseSeeder().call(new RoleSeeder()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("seed requires a database")
    void seedRequiresDatabase() {
        assertThatThrownBy(() -> new RoleSeeder().seed(null)).isInstanceOf(IllegalArgumentException.class);
    }

    static class RoleSeeder extends Seeder {
        @Override
        public void run(Database database) {
            database.model(Role::new).create(Map.of("name", "admin"));
            database.model(Role::new).create(Map.of("name", "editor"));
        }
    }

    static class DatabaseSeeder extends Seeder {
        @Override
        public void run(Database database) {
            call(new RoleSeeder());
            database.model(User::new).create(Map.of("name", "Ada", "email", "ada@example.test"));
        }
    }
}
