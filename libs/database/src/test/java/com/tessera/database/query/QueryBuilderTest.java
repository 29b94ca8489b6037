package com.tessera.database.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tessera.database.adapter.BooleanOperator;
import com.tessera.database.adapter.Operator;
import com.tessera.database.adapter.WhereClause;
import com.tessera.database.config.DatabaseType;
import com.tessera.database.exception.ConfigurationException;
import com.tessera.database.exception.ModelNotFoundException;
import com.tessera.database.exception.UnsupportedBackendOperationException;
import com.tessera.database.model.Database;
import com.tessera.database.support.BlogSchema;
import com.tessera.database.testing.InMemoryDatabaseAdapter;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("QueryBuilder")
class QueryBuilderTest {

    private Database db;

    @BeforeEach
    void setUp() {
        db = BlogSchema.create();
        db.table("users").insert(Map.of("name", "Ada", "email", "ada@example.test"));
        db.table("posts").insert(List.of(
                Map.of("user_id", 1, "title", "Alpha", "status", "published", "views", 10),
                Map.of("user_id", 1, "title", "Beta", "status", "draft", "views", 5),
                Map.of("user_id", 1, "title", "Gamma", "status", "published", "views", 30),
                Map.of("user_id", 1, "title", "Delta", "status", "archived", "views", 0)));
    }

    private QueryBuilder<Map<String, Object>> posts() {
        return db.table("posts");
    }

    private static List<Object> titles(List<Map<String, Object>> rows) {
        return rows.stream().map(row -> row.get("title")).toList();
    }

    @Nested
    @DisplayName("Predicates")
    class Predicates {

        @Test
        @DisplayName("where with an implicit equals operator")
        void whereEquals() {
            assertThat(titles(posts().where("status", "published").orderBy("title").get()))
                    .containsExactly("Alpha", "Gamma");
        }

        @Test
        @DisplayName("AND binds tighter than OR")
        void andBindsTighterThanOr() {
            // status = draft OR (status = published AND views > 20)
            var rows = posts()
                    .where("status", "draft")
                    .orWhere("status", "published")
                    .where("views", ">", 20)
                    .orderBy("title")
                    .get();

            assertThat(titles(rows)).containsExactly("Beta", "Gamma");
        }

        @Test
        @DisplayName("nested groups are parenthesised")
        void nestedGroups() {
            Consumer<QueryBuilder<Map<String, Object>>> draftOrArchived =
                    q -> q.where("status", "draft").orWhere("status", "archived");
            var rows = posts().where("views", "<", 10).where(draftOrArchived).orderBy("title").get();

            assertThat(titles(rows)).containsExactly("Beta", "Delta");
        }

        @Test
        @DisplayName("whereIn, whereNotIn and whereBetween")
        void listOperators() {
            assertThat(posts().whereIn("title", List.of("Alpha", "Delta")).count()).isEqualTo(2);
            assertThat(posts().whereNotIn("status", List.of("draft", "archived")).count()).isEqualTo(2);
            assertThat(posts().whereBetween("views", 5, 10).count()).isEqualTo(2);
            assertThat(posts().whereNotBetween("views", 5, 10).count()).isEqualTo(2);
        }

        @Test
        @DisplayName("an empty whereIn matches nothing and an empty whereNotIn matches everything")
        void emptyLists() {
            assertThat(posts().whereIn("id", List.of()).count()).isZero();
            assertThat(posts().whereNotIn("id", List.of()).count()).isEqualTo(4);
        }

        @Test
        @DisplayName("where with a null value becomes IS NULL")
        void nullValueBecomesIsNull() {
            var query = db.table("users").where("password", null);

            assertThat(query.wheres()).singleElement()
                    .extracting(WhereClause::operator).isEqualTo(Operator.IS_NULL);
            assertThat(query.count()).isEqualTo(1);
            assertThat(db.table("users").whereNotNull("password").count()).isZero();
        }

        @Test
        @DisplayName("whereLike uses SQL wildcards")
        void whereLike() {
            assertThat(titles(posts().whereLike("title", "%a").orderBy("title").get()))
                    .containsExactly("Alpha", "Beta", "Delta", "Gamma");
            assertThat(titles(posts().whereLike("title", "_eta").get())).containsExactly("Beta");
        }

        @Test
        @DisplayName("when applies the callback only for a true condition")
        void conditionalComposition() {
            assertThat(posts().when(false, q -> q.where("status", "draft")).count()).isEqualTo(4);
            assertThat(posts().when(true, q -> q.where("status", "draft")).count()).isEqualTo(1);
        }

        @Test
        @DisplayName("operator symbols are parsed case-insensitively and unknown ones rejected")
        void operatorSymbols() {
            var query = posts().where("title", "not like", "A%");

            assertThat(query.wheres().get(0).operator()).isEqualTo(Operator.NOT_LIKE);
            assertThatThrownBy(() -> posts().where("views", "~~", 1))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("~~");
        }

        @Test
        @DisplayName("whereColumn compares two columns of the same row")
        void whereColumn() {
            assertThat(posts().whereColumn("views", ">", "user_id").count()).isEqualTo(3);
        }

        @Test
        @DisplayName("raw predicates are rejected by backends without SQL before any rows are read")
        void rawPredicatesRejected() {
            InMemoryDatabaseAdapter adapter = BlogSchema.adapter(db);
            adapter.resetOperations();

            assertThatThrownBy(() -> posts().whereRaw("views > ?", List.of(1)).get())
                    .isInstanceOf(UnsupportedBackendOperationException.class);
            assertThat(adapter.operations()).isEmpty();
        }

        @Test
        @DisplayName("count matches the size of get for the same predicates")
        void countMatchesGet() {
            List<Consumer<QueryBuilder<Map<String, Object>>>> predicates = List.of(
                    q -> {},
                    q -> q.where("status", "published"),
                    q -> q.where("views", ">=", 5).orWhere("title", "Delta"),
                    q -> q.whereIn("status", List.of("draft", "archived")).where("views", 0),
                    q -> q.where(inner -> inner.where("views", 10).orWhere("views", 30)).whereNotNull("title"));

            for (var predicate : predicates) {
                var query = posts();
                predicate.accept(query);
                assertThat(query.count()).isEqualTo(query.clone().get().size());
            }
        }
    }

    @Nested
    @DisplayName("Ordering, paging and projection")
    class OrderingAndPaging {

        @Test
        @DisplayName("published posts by views descending, at most two")
        void orderedAndLimited() {
            var rows = posts().where("status", "published").orderByDesc("views").limit(2).get();

            assertThat(rows).hasSizeLessThanOrEqualTo(2);
            assertThat(titles(rows)).containsExactly("Gamma", "Alpha");
            assertThat(rows).allSatisfy(row -> assertThat(row.get("status")).isEqualTo("published"));
        }

        @Test
        @DisplayName("skip and take page through ordered rows")
        void skipAndTake() {
            assertThat(titles(posts().orderBy("title").skip(1).take(2).get())).containsExactly("Beta", "Delta");
        }

        @Test
        @DisplayName("select projects and aliases columns")
        void selectProjects() {
            var row = posts().select("title", "views as hits").where("title", "Alpha").first();

            assertThat(row).containsOnlyKeys("title", "hits").containsEntry("hits", 10);
        }

        @Test
        @DisplayName("paginate reports totals and pages")
        void paginate() {
            Paginated<Map<String, Object>> page = posts().orderBy("title").paginate(3, 2);

            assertThat(page.total()).isEqualTo(4);
            assertThat(page.lastPage()).isEqualTo(2);
            assertThat(page.hasMorePages()).isFalse();
            assertThat(titles(page.items())).containsExactly("Gamma");
        }

        @Test
        @DisplayName("pluck returns one column in order")
        void pluck() {
            assertThat(posts().orderBy("views").pluck("posts.views")).containsExactly(0, 5, 10, 30);
        }
    }

    @Nested
    @DisplayName("Terminals")
    class Terminals {

        @Test
        @DisplayName("aggregates run without fetching rows")
        void aggregates() {
            InMemoryDatabaseAdapter adapter = BlogSchema.adapter(db);
            adapter.resetOperations();

            assertThat(posts().sum("views").longValue()).isEqualTo(45L);
            assertThat(posts().avg("views")).isEqualTo(11.25);
            assertThat(posts().min("views")).isEqualTo(0);
            assertThat(posts().max("views")).isEqualTo(30);
            assertThat(posts().where("status", "missing").sum("views").intValue()).isZero();
            assertThat(posts().where("status", "missing").avg("views")).isNull();
            assertThat(posts().exists()).isTrue();
            assertThat(posts().where("views", ">", 100).doesntExist()).isTrue();
            assertThat(adapter.operationCount("select")).isZero();
        }

        @Test
        @DisplayName("find and firstOrFail")
        void findAndFirstOrFail() {
            assertThat(posts().find(3)).containsEntry("title", "Gamma");
            assertThat(posts().find(99)).isNull();
            assertThatThrownBy(() -> posts().where("title", "Nope").firstOrFail())
                    .isInstanceOf(ModelNotFoundException.class)
                    .hasMessageContaining("posts");
        }

        @Test
        @DisplayName("bulk update and delete touch every matching row")
        void bulkUpdateAndDelete() {
            assertThat(posts().where("status", "published").update(Map.of("status", "featured"))).isEqualTo(2);
            assertThat(posts().where("status", "featured").count()).isEqualTo(2);

            assertThat(posts().where("views", "<", 10).delete()).isEqualTo(2);
            assertThat(posts().delete()).isEqualTo(2);
            assertThat(posts().count()).isZero();
        }

        @Test
        @DisplayName("eager loading needs a model query")
        void eagerLoadingNeedsModels() {
            assertThatThrownBy(() -> posts().with("author").get())
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Cloning")
    class Cloning {

        @Test
        @DisplayName("clones are isolated from the original")
        void clonesAreIsolated() {
            var original = posts().where("status", "published").orderBy("title").limit(1);
            var copy = original.clone().where("views", ">", 20).limit(5);

            assertThat(original.wheres()).hasSize(1);
            assertThat(original.limitValue()).isEqualTo(1);
            assertThat(copy.wheres()).hasSize(2);
            assertThat(titles(original.get())).containsExactly("Alpha");
            assertThat(titles(copy.get())).containsExactly("Gamma");
        }

        @Test
        @DisplayName("first does not limit the builder it is called on")
        void firstLeavesBuilderUntouched() {
            var query = posts().orderBy("title");
            query.first();

            assertThat(query.limitValue()).isNull();
            assertThat(query.get()).hasSize(4);
        }
    }

    @Nested
    @DisplayName("Macros")
    class Macros {

        @Test
        @DisplayName("registered macros receive the builder and its adapter")
        void macrosReceiveBuilder() {
            db.macros().register("published", (builder, args) -> builder.where("status", "published"));
            db.macros().register("backend", (builder, args) -> builder.adapter().type());

            var query = posts();
            query.macro("published");

            assertThat(query.count()).isEqualTo(2);
            assertThat(query.macro("backend")).isEqualTo(DatabaseType.MEMORY);
            assertThat(query.hasMacro("published")).isTrue();
        }

        @Test
        @DisplayName("unknown macros fail with a configuration error")
        void unknownMacro() {
            assertThatThrownBy(() -> posts().macro("nope"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("nope");
        }

        @Test
        @DisplayName("registry lists names sorted and supports mixins")
        void registryMixin() {
            var registry = new MacroRegistry()
                    .register("b", (builder, args) -> null)
                    .mixin(Map.of("a", (builder, args) -> null));

            assertThat(registry.names()).containsExactly("a", "b");
            assertThatThrownBy(() -> registry.register(" ", (builder, args) -> null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("nested where clauses carry their connective")
    void nestedClauseConnective() {
        var query = posts().where("views", 1).orWhere(q -> q.where("views", 2));

        assertThat(query.wheres().get(1).kind()).isEqualTo(WhereClause.Kind.NESTED);
        assertThat(query.wheres().get(1).bool()).isEqualTo(BooleanOperator.OR);
    }
}
