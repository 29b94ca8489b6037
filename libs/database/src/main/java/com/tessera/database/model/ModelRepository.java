package com.tessera.database.model;

import com.tessera.database.exception.ModelNotFoundException;
import com.tessera.database.query.QueryBuilder;
import com.tessera.database.relation.EagerLoader;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Class-level operations for one model type: lookups, creation and query entry points.
 *
 * <p>Obtained from {@link Database#model(Supplier)}. Every model it returns is bound to that database.
 */
public class ModelRepository<T extends Model> {

    private final Database database;
    private final Supplier<T> constructor;
    private final String modelName;
    private final String table;
    private final String primaryKey;

    ModelRepository(Database database, Supplier<T> constructor) {
        this.database = database;
        this.constructor = constructor;
        T prototype = ModelFactory.newInstance(constructor);
        this.modelName = prototype.getClass().getSimpleName();
        this.table = prototype.table();
        this.primaryKey = prototype.primaryKey();
    }

    /** Simple class name of the model, as used in error messages. */
    public String modelName() {
        return modelName;
    }

    public String table() {
        return table;
    }

    public String primaryKey() {
        return primaryKey;
    }

    /** New model query; results are hydrated models and {@code with(...)} eager-loads relations. */
    public QueryBuilder<T> query() {
        return new QueryBuilder<>(
                table,
                database.adapter(),
                database.macros(),
                row -> ModelFactory.hydrate(constructor, row, database),
                EagerLoader::load,
                primaryKey,
                modelName);
    }

    public List<T> all() {
        return query().get();
    }

    /** Model with the given key, or null. */
    public T find(Object id) {
        return query().find(id);
    }

    /**
     * @throws ModelNotFoundException if no model has the given key
     */
    public T findOrFail(Object id) {
        T model = find(id);
        if (model == null) {
            throw new ModelNotFoundException(modelName, id);
        }
        return model;
    }

    public List<T> findMany(Collection<?> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return query().whereIn(primaryKey, ids).get();
    }

    public QueryBuilder<T> where(String column, Object value) {
        return query().where(column, value);
    }

    public QueryBuilder<T> where(String column, String operator, Object value) {
        return query().where(column, operator, value);
    }

    public QueryBuilder<T> with(String... relations) {
        return query().with(relations);
    }

    public long count() {
        return query().count();
    }

    /** Unsaved, bound instance with fillable attributes assigned. */
    public T make(Map<String, ?> attributes) {
        T model = ModelFactory.newInstance(constructor);
        model.bind(database);
        model.fill(attributes);
        return model;
    }

    /** Fills, saves and returns a new model. */
    public T create(Map<String, ?> attributes) {
        T model = make(attributes);
        model.save();
        return model;
    }

    /** First model matching {@code search}, or a new one created from {@code search + values}. */
    public T firstOrCreate(Map<String, ?> search, Map<String, ?> values) {
        T existing = query().where(search).first();
        if (existing != null) {
            return existing;
        }
        return create(merge(search, values));
    }

    public T firstOrCreate(Map<String, ?> search) {
        return firstOrCreate(search, Map.of());
    }

    /** Updates the first model matching {@code search} with {@code values}, or creates one. */
    public T updateOrCreate(Map<String, ?> search, Map<String, ?> values) {
        T existing = query().where(search).first();
        if (existing == null) {
            return create(merge(search, values));
        }
        existing.update(values);
        return existing;
    }

    /** Deletes the models with the given keys one by one; returns how many were deleted. */
    public int destroy(Object... ids) {
        int deleted = 0;
        for (T model : findMany(List.of(ids))) {
            if (model.delete()) {
                deleted++;
            }
        }
        return deleted;
    }

    private static Map<String, Object> merge(Map<String, ?> first, Map<String, ?> second) {
        Map<String, Object> merged = new LinkedHashMap<>(first);
        merged.putAll(second);
        return merged;
    }
}
