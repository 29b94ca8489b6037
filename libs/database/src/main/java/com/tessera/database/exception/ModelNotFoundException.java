package com.tessera.database.exception;

import java.util.HashMap;
import java.util.Map;

/** A {@code findOrFail}/{@code firstOrFail} lookup matched nothing. */
public class ModelNotFoundException extends DatabaseException {

    private final String model;
    private final Object id;

    public ModelNotFoundException(String model, Object id) {
        super(
                id == null
                        ? "No query results for model [%s]".formatted(model)
                        : "No query results for model [%s] with id %s".formatted(model, id),
                null,
                "find",
                details(model, id),
                null);
        this.model = model;
        this.id = id;
    }

    /** Model class simple name, or table name for untyped queries. */
    public String model() {
        return model;
    }

    /** Requested id, null when the lookup was not by key. */
    public Object id() {
        return id;
    }

    private static Map<String, Object> details(String model, Object id) {
        Map<String, Object> details = new HashMap<>();
        details.put("model", model);
        details.put("id", id);
        return details;
    }
}
