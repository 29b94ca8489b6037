package com.tessera.database.query;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/** Loads the pending {@code with(...)} relations onto a freshly fetched result list. */
@FunctionalInterface
public interface EagerLoadHandler<T> {

    void load(List<T> results, Map<String, Consumer<QueryBuilder<?>>> relations);
}
