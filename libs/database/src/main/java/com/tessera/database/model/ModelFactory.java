package com.tessera.database.model;

import com.tessera.database.exception.ConfigurationException;
import java.util.Map;
import java.util.function.Supplier;

/** Creates, hydrates and copies model instances through their constructors. */
public final class ModelFactory {

    private ModelFactory() {
        // utility class
    }

    /**
     * New, unbound instance.
     *
     * @throws ConfigurationException if the constructor yields null
     */
    public static <T extends Model> T newInstance(Supplier<T> constructor) {
        if (constructor == null) {
            throw new IllegalArgumentException("constructor must not be null");
        }
        T model = constructor.get();
        if (model == null) {
            throw new ConfigurationException("Model constructor returned null", Map.of());
        }
        return model;
    }

    /** Stored instance built from a fetched row. */
    public static <T extends Model> T hydrate(Supplier<T> constructor, Map<String, Object> row, Database database) {
        T model = newInstance(constructor);
        model.setRawAttributes(row, true);
        model.markExists(true);
        model.bind(database);
        return model;
    }

    /** Copy carrying the same stored attributes and state, but no loaded relations. */
    public static <T extends Model> T duplicate(T source, Supplier<T> constructor) {
        T copy = newInstance(constructor);
        copy.setRawAttributes(source.getOriginal(), true);
        copy.setRawAttributes(source.getAttributes(), false);
        copy.markExists(source.exists());
        if (source.isBound()) {
            copy.bind(source.database());
        }
        return copy;
    }
}
