package com.tessera.database.relation;

import com.tessera.database.model.Model;
import com.tessera.database.query.QueryBuilder;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A declared association between a parent model and a related model type.
 *
 * <p>A relation instance is used in exactly one mode. In lazy mode its query is constrained to the
 * single parent it was created from; in eager mode it is constrained to a batch of parents and the
 * results are distributed with {@link #match}. Constraints are never removed, and switching an
 * instance from one mode to the other raises {@link IllegalStateException}.
 *
 * @param <R> related model type
 */
public abstract class Relation<R extends Model> {

    enum Mode {
        UNCONSTRAINED,
        LAZY,
        EAGER
    }

    protected final Model parent;
    protected final Supplier<R> related;
    protected final QueryBuilder<R> query;
    private Mode mode = Mode.UNCONSTRAINED;

    protected Relation(Model parent, Supplier<R> related) {
        this.parent = Objects.requireNonNull(parent, "parent");
        this.related = Objects.requireNonNull(related, "related");
        this.query = parent.database().model(related).query();
    }

    /**
     * Constrains the query to {@link #parent}. Idempotent.
     *
     * @throws IllegalStateException if the relation is already eager-constrained
     */
    public final void addConstraints() {
        if (mode == Mode.LAZY) {
            return;
        }
        enter(Mode.LAZY);
        applyLazyConstraints();
    }

    /**
     * Constrains the query to a batch of parents.
     *
     * @param parents models of the parent type, all of the same class
     * @throws IllegalStateException if the relation is already lazily constrained
     */
    public final void addEagerConstraints(List<? extends Model> parents) {
        enter(Mode.EAGER);
        applyEagerConstraints(parents);
    }

    protected abstract void applyLazyConstraints();

    protected abstract void applyEagerConstraints(List<? extends Model> parents);

    /**
     * Assigns {@code results} to each parent under {@code name}. Parents without a match get null
     * or an empty list.
     *
     * @param parents models the eager constraints were built from
     * @param results rows returned by {@link #getEager()}
     * @param name relation name to set on each parent
     */
    public abstract void match(List<? extends Model> parents, List<R> results, String name);

    /**
     * Lazy result for {@link Model#getRelation}.
     *
     * @return a model or null for to-one relations, a list for to-many relations
     */
    public abstract Object getResults();

    /**
     * Runs the eagerly constrained query.
     *
     * @return related models for the whole batch of parents
     * @throws IllegalStateException unless {@link #addEagerConstraints} ran first
     */
    public List<R> getEager() {
        requireMode(Mode.EAGER);
        return query.get();
    }

    private void enter(Mode target) {
        if (mode != Mode.UNCONSTRAINED && mode != target) {
            throw new IllegalStateException(
                    "Relation is already %s-constrained and cannot switch to %s".formatted(
                            mode.name().toLowerCase(Locale.ROOT), target.name().toLowerCase(Locale.ROOT)));
        }
        mode = target;
    }

    void requireMode(Mode expected) {
        if (mode != expected) {
            throw new IllegalStateException("Relation is not " + expected.name().toLowerCase(Locale.ROOT) + "-constrained");
        }
    }

    Mode mode() {
        return mode;
    }

    // ---- query passthroughs (lazy) ----

    /** @return the underlying query, for constraints the passthroughs do not cover */
    public QueryBuilder<R> getQuery() {
        return query;
    }

    /**
     * @param column related column
     * @param value operand
     * @return this relation
     */
    public Relation<R> where(String column, Object value) {
        query.where(column, value);
        return this;
    }

    /**
     * @param column related column
     * @param operator operator symbol
     * @param value operand
     * @return this relation
     */
    public Relation<R> where(String column, String operator, Object value) {
        query.where(column, operator, value);
        return this;
    }

    /**
     * @param column related column
     * @param direction {@code asc} or {@code desc}
     * @return this relation
     */
    public Relation<R> orderBy(String column, String direction) {
        query.orderBy(column, direction);
        return this;
    }

    /**
     * @param limit maximum number of related models
     * @return this relation
     */
    public Relation<R> limit(int limit) {
        query.limit(limit);
        return this;
    }

    /** @return related models of {@link #parent}, applying the lazy constraint first */
    public List<R> get() {
        addConstraints();
        return query.get();
    }

    /** @return the first related model, or null */
    public R first() {
        addConstraints();
        return query.first();
    }

    /** @return number of related models */
    public long count() {
        addConstraints();
        return query.count();
    }

    /** @return true when at least one related model exists */
    public boolean exists() {
        return count() > 0;
    }

    public Model parent() {
        return parent;
    }

    /** @return constructor of the related model */
    public Supplier<R> related() {
        return related;
    }

    // ---- helpers ----

    /** Distinct non-null raw values of {@code key} across {@code models}, in first-seen order. */
    protected static List<Object> keys(Collection<? extends Model> models, String key) {
        Map<String, Object> distinct = new LinkedHashMap<>();
        for (Model model : models) {
            Object value = model.getRawAttribute(key);
            String normalized = RelationKeys.normalize(value);
            if (normalized != null) {
                distinct.putIfAbsent(normalized, value);
            }
        }
        return new ArrayList<>(distinct.values());
    }

    /** Groups {@code models} by the normalized value of {@code key}; null keys are dropped. */
    protected static <M extends Model> Map<String, List<M>> dictionary(List<M> models, String key) {
        Map<String, List<M>> dictionary = new LinkedHashMap<>();
        for (M model : models) {
            String normalized = RelationKeys.normalize(model.getRawAttribute(key));
            if (normalized != null) {
                dictionary.computeIfAbsent(normalized, k -> new ArrayList<>()).add(model);
            }
        }
        return dictionary;
    }
}
