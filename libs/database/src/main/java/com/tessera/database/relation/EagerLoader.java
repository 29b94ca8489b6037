package com.tessera.database.relation;

import com.tessera.database.model.Model;
import com.tessera.database.query.QueryBuilder;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Batch loader behind {@code with(...)} and {@link Model#load}.
 *
 * <p>Each top-level relation costs one query for the whole batch of parents (two for
 * many-to-many), whatever the batch size. Dotted names ({@code posts.comments}) load the first
 * segment and then recurse into its results with the remainder.
 */
public final class EagerLoader {

    private static final Logger log = LoggerFactory.getLogger(EagerLoader.class);

    private EagerLoader() {
        // utility class
    }

    /**
     * Loads {@code relations} onto {@code models}. A null constraint means "no extra constraint".
     * All models must be of the same class.
     */
    public static <M extends Model> void load(List<M> models, Map<String, Consumer<QueryBuilder<?>>> relations) {
        if (models.isEmpty() || relations.isEmpty()) {
            return;
        }
        Map<String, Consumer<QueryBuilder<?>>> constraints = new LinkedHashMap<>();
        Map<String, Map<String, Consumer<QueryBuilder<?>>>> nested = new LinkedHashMap<>();
        relations.forEach((name, constraint) -> {
            int dot = name.indexOf('.');
            if (dot < 0) {
                constraints.put(name, constraint);
                nested.computeIfAbsent(name, k -> new LinkedHashMap<>());
            } else {
                String head = name.substring(0, dot);
                constraints.putIfAbsent(head, null);
                nested.computeIfAbsent(head, k -> new LinkedHashMap<>()).put(name.substring(dot + 1), constraint);
            }
        });
        Model first = models.get(0);
        for (Map.Entry<String, Consumer<QueryBuilder<?>>> entry : constraints.entrySet()) {
            String name = entry.getKey();
            loadRelation(first.relation(name), models, name, entry.getValue(), nested.get(name));
        }
    }

    private static <R extends Model> void loadRelation(
            Relation<R> relation,
            List<? extends Model> models,
            String name,
            Consumer<QueryBuilder<?>> constraint,
            Map<String, Consumer<QueryBuilder<?>>> nested) {
        relation.addEagerConstraints(models);
        if (constraint != null) {
            constraint.accept(relation.getQuery());
        }
        List<R> results = relation.getEager();
        log.debug("Eager-loaded {} {} row(s) for {} parent(s)", results.size(), name, models.size());
        if (!nested.isEmpty()) {
            load(results, nested);
        }
        relation.match(models, results, name);
    }
}
