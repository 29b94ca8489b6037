package com.tessera.database.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Builds model instances from default attributes, for tests and seeders.
 *
 * <pre>{@code
 * class UserFactory extends Factory<User> {
 *     UserFactory(Database db) { super(db, User::new); }
 *
 *     protected Map<String, Object> definition() {
 *         long n = sequence();
 *         return Map.of("name", "User " + n, "email", "user" + n + "@example.test");
 *     }
 * }
 * }</pre>
 *
 * <p>Attributes are force-filled, so factories are not limited by the model's fillable list.
 */
public abstract class Factory<T extends Model> {

    private final Database database;
    private final Supplier<T> constructor;
    private final AtomicLong sequence = new AtomicLong();

    protected Factory(Database database, Supplier<T> constructor) {
        if (database == null) {
            throw new IllegalArgumentException("database must not be null");
        }
        if (constructor == null) {
            throw new IllegalArgumentException("constructor must not be null");
        }
        this.database = database;
        this.constructor = constructor;
    }

    /** Default attributes for one instance. Called once per instance. */
    protected abstract Map<String, Object> definition();

    /** 1, 2, 3, ... per factory instance; handy for unique values. */
    protected long sequence() {
        return sequence.incrementAndGet();
    }

    public T make() {
        return make(Map.of());
    }

    /** Unsaved instance: defaults overridden by {@code attributes}. */
    public T make(Map<String, ?> attributes) {
        Map<String, Object> data = new LinkedHashMap<>(definition());
        data.putAll(attributes);
        T model = ModelFactory.newInstance(constructor);
        model.bind(database);
        model.forceFill(data);
        return model;
    }

    public T create() {
        return create(Map.of());
    }

    public T create(Map<String, ?> attributes) {
        T model = make(attributes);
        model.save();
        return model;
    }

    public List<T> createMany(int count) {
        return createMany(count, Map.of());
    }

    public List<T> createMany(int count, Map<String, ?> attributes) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
        List<T> models = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            models.add(create(attributes));
        }
        return models;
    }

    public Database database() {
        return database;
    }
}
