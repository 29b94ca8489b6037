package com.tessera.database.relation;

import com.tessera.database.adapter.DatabaseAdapter;
import com.tessera.database.model.Model;
import com.tessera.database.model.ModelFactory;
import com.tessera.database.query.QueryBuilder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Many-to-many association through a pivot table.
 *
 * <p>Loading runs two queries on every backend: one on the pivot table for the parents' keys, then
 * one on the related table for the referenced keys. Each pivot row yields its own copy of the
 * related model carrying the row as the {@code pivot} relation, so a model linked to two parents
 * appears once under each.
 */
public class BelongsToMany<R extends Model> extends Relation<R> {

    public static final String PIVOT = "pivot";

    private final String pivotTable;
    private final String foreignPivotKey;
    private final String relatedPivotKey;
    private final String parentKey;
    private final String relatedKey;
    private final List<String> pivotColumns = new ArrayList<>();
    private List<Object> parentKeys = List.of();

    public BelongsToMany(
            Model parent,
            Supplier<R> related,
            String pivotTable,
            String foreignPivotKey,
            String relatedPivotKey,
            String parentKey,
            String relatedKey) {
        super(parent, related);
        this.pivotTable = pivotTable;
        this.foreignPivotKey = foreignPivotKey;
        this.relatedPivotKey = relatedPivotKey;
        this.parentKey = parentKey;
        this.relatedKey = relatedKey;
    }

    /** Extra pivot columns to expose on the {@code pivot} relation. */
    public BelongsToMany<R> withPivot(String... columns) {
        pivotColumns.addAll(Arrays.asList(columns));
        return this;
    }

    @Override
    protected void applyLazyConstraints() {
        parentKeys = keys(List.of(parent), parentKey);
    }

    @Override
    protected void applyEagerConstraints(List<? extends Model> parents) {
        parentKeys = keys(parents, parentKey);
    }

    @Override
    public List<R> getEager() {
        requireMode(Mode.EAGER);
        return load();
    }

    @Override
    public Object getResults() {
        return get();
    }

    @Override
    public List<R> get() {
        addConstraints();
        return load();
    }

    @Override
    public R first() {
        List<R> results = get();
        return results.isEmpty() ? null : results.get(0);
    }

    @Override
    public long count() {
        addConstraints();
        if (parentKeys.isEmpty()) {
            return 0;
        }
        return pivotQuery().whereIn(foreignPivotKey, parentKeys).count();
    }

    private List<R> load() {
        if (parentKeys.isEmpty()) {
            return new ArrayList<>();
        }
        List<Map<String, Object>> pivotRows = pivotQuery().whereIn(foreignPivotKey, parentKeys).get();
        if (pivotRows.isEmpty()) {
            return new ArrayList<>();
        }
        Map<String, List<Map<String, Object>>> rowsByRelated = new LinkedHashMap<>();
        Map<String, Object> relatedIds = new LinkedHashMap<>();
        for (Map<String, Object> row : pivotRows) {
            String key = RelationKeys.normalize(row.get(relatedPivotKey));
            if (key != null) {
                rowsByRelated.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
                relatedIds.putIfAbsent(key, row.get(relatedPivotKey));
            }
        }
        List<R> models = query.clone().whereIn(relatedKey, new ArrayList<>(relatedIds.values())).get();
        List<R> results = new ArrayList<>();
        for (R model : models) {
            List<Map<String, Object>> rows = rowsByRelated.get(RelationKeys.normalize(model.getRawAttribute(relatedKey)));
            if (rows == null) {
                continue;
            }
            for (Map<String, Object> row : rows) {
                R copy = ModelFactory.duplicate(model, related);
                copy.setRelation(PIVOT, pivotFor(row));
                results.add(copy);
            }
        }
        return results;
    }

    private Pivot pivotFor(Map<String, Object> row) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(foreignPivotKey, row.get(foreignPivotKey));
        attributes.put(relatedPivotKey, row.get(relatedPivotKey));
        for (String column : pivotColumns) {
            attributes.put(column, row.get(column));
        }
        Pivot pivot = new Pivot(pivotTable, attributes);
        pivot.bind(parent.database());
        return pivot;
    }

    @Override
    public void match(List<? extends Model> parents, List<R> results, String name) {
        Map<String, List<R>> dictionary = new LinkedHashMap<>();
        for (R result : results) {
            Model pivot = (Model) result.getRelation(PIVOT);
            String key = RelationKeys.normalize(pivot.getRawAttribute(foreignPivotKey));
            dictionary.computeIfAbsent(key, k -> new ArrayList<>()).add(result);
        }
        for (Model model : parents) {
            List<R> matches = dictionary.get(RelationKeys.normalize(model.getRawAttribute(parentKey)));
            model.setRelation(name, matches == null ? new ArrayList<R>() : new ArrayList<>(matches));
        }
    }

    // ---- pivot maintenance ----

    public void attach(Object id) {
        attach(id, Map.of());
    }

    /** Inserts one pivot row linking the parent to {@code id} (a key or a related model). */
    public void attach(Object id, Map<String, ?> attributes) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(foreignPivotKey, ownKey());
        row.put(relatedPivotKey, relatedKeyOf(id));
        row.putAll(attributes);
        adapter().insert(pivotTable, row, null);
    }

    public void attach(Collection<?> ids) {
        ids.forEach(this::attach);
    }

    /** Removes every pivot row of the parent. */
    public int detach() {
        return pivotQuery().where(foreignPivotKey, ownKey()).delete();
    }

    /** Removes the pivot rows linking the parent to {@code ids}. */
    public int detach(Collection<?> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        List<Object> keys = new ArrayList<>();
        ids.forEach(id -> keys.add(relatedKeyOf(id)));
        return pivotQuery().where(foreignPivotKey, ownKey()).whereIn(relatedPivotKey, keys).delete();
    }

    /** Makes the parent's links exactly {@code ids}: missing ones are attached, extra ones detached. */
    public SyncResult sync(Collection<?> ids) {
        Map<String, Object> wanted = new LinkedHashMap<>();
        ids.forEach(id -> {
            Object key = relatedKeyOf(id);
            wanted.putIfAbsent(RelationKeys.normalize(key), key);
        });
        Map<String, Object> current = new LinkedHashMap<>();
        for (Object key : pivotQuery().where(foreignPivotKey, ownKey()).pluck(relatedPivotKey)) {
            current.putIfAbsent(RelationKeys.normalize(key), key);
        }
        List<Object> detached = new ArrayList<>();
        current.forEach((normalized, key) -> {
            if (!wanted.containsKey(normalized)) {
                detached.add(key);
            }
        });
        List<Object> attached = new ArrayList<>();
        wanted.forEach((normalized, key) -> {
            if (!current.containsKey(normalized)) {
                attached.add(key);
            }
        });
        detach(detached);
        attached.forEach(this::attach);
        return new SyncResult(attached, detached);
    }

    /** Related keys currently linked to the parent. */
    public Set<Object> relatedIds() {
        return new LinkedHashSet<>(pivotQuery().where(foreignPivotKey, ownKey()).pluck(relatedPivotKey));
    }

    private Object ownKey() {
        Object key = parent.getRawAttribute(parentKey);
        if (key == null) {
            throw new IllegalStateException("Parent model has no value for '" + parentKey + "'");
        }
        return key;
    }

    private Object relatedKeyOf(Object id) {
        return id instanceof Model model ? model.getRawAttribute(relatedKey) : id;
    }

    private QueryBuilder<Map<String, Object>> pivotQuery() {
        return QueryBuilder.rows(pivotTable, adapter(), parent.database().macros());
    }

    private DatabaseAdapter adapter() {
        return parent.database().adapter();
    }

    public String pivotTable() {
        return pivotTable;
    }

    public String foreignPivotKey() {
        return foreignPivotKey;
    }

    public String relatedPivotKey() {
        return relatedPivotKey;
    }
}
