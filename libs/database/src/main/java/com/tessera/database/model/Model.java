package com.tessera.database.model;

import com.tessera.database.adapter.BooleanOperator;
import com.tessera.database.adapter.DatabaseAdapter;
import com.tessera.database.adapter.Operator;
import com.tessera.database.adapter.SelectOptions;
import com.tessera.database.adapter.WhereClause;
import com.tessera.database.config.DatabaseType;
import com.tessera.database.exception.ConfigurationException;
import com.tessera.database.exception.ModelNotFoundException;
import com.tessera.database.query.QueryBuilder;
import com.tessera.database.relation.BelongsTo;
import com.tessera.database.relation.BelongsToMany;
import com.tessera.database.relation.EagerLoader;
import com.tessera.database.relation.HasMany;
import com.tessera.database.relation.HasOne;
import com.tessera.database.relation.Relation;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.bson.types.ObjectId;

/**
 * Active-record style base class for table-backed entities.
 *
 * <p>Subclasses configure themselves in their no-arg constructor:
 *
 * <pre>{@code
 * public class User extends Model {
 *     public User() {
 *         fillable("name", "email");
 *         hidden("password");
 *         cast("is_admin", "boolean");
 *         relation("posts", () -> hasMany(Post::new));
 *     }
 * }
 * }</pre>
 *
 * <p>Attributes are held in their stored form; {@link #getAttribute} and {@link #toMap()} apply the
 * declared casts, {@link #setAttribute} encodes through them. A snapshot of the stored attributes
 * taken at load or save time drives dirty tracking.
 *
 * <p>Instances are not thread-safe.
 */
public abstract class Model {

    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";

    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final Map<String, Object> original = new LinkedHashMap<>();
    private final Map<String, Object> relations = new LinkedHashMap<>();
    private final Map<String, Supplier<? extends Relation<?>>> relationDefinitions = new LinkedHashMap<>();
    private final Set<String> fillable = new LinkedHashSet<>();
    private final Set<String> hidden = new LinkedHashSet<>();
    private final Map<String, AttributeCast> casts = new LinkedHashMap<>();
    private String table;
    private String primaryKey = "id";
    private boolean timestamps;
    private boolean exists;
    private Database database;

    // ---- configuration (called from subclass constructors) ----

    protected void table(String table) {
        this.table = table;
    }

    protected void primaryKey(String primaryKey) {
        this.primaryKey = primaryKey;
    }

    /** Attributes {@link #fill} may assign. An empty list makes nothing mass-assignable. */
    protected void fillable(String... attributes) {
        fillable.addAll(Arrays.asList(attributes));
    }

    /** Attributes left out of {@link #toMap()} and {@link #toJson()}. */
    protected void hidden(String... attributes) {
        hidden.addAll(Arrays.asList(attributes));
    }

    protected void cast(String attribute, String castName) {
        casts.put(attribute, Casts.named(castName));
    }

    protected void cast(String attribute, AttributeCast cast) {
        casts.put(attribute, Objects.requireNonNull(cast, "cast"));
    }

    /** Maintain {@value #CREATED_AT} and {@value #UPDATED_AT} on save. */
    protected void timestamps(boolean enabled) {
        this.timestamps = enabled;
    }

    /** Registers a named relation; resolved lazily on first access. */
    protected void relation(String name, Supplier<? extends Relation<?>> definition) {
        relationDefinitions.put(name, definition);
    }

    public String table() {
        return table != null ? table : defaultTable(getClass());
    }

    public String primaryKey() {
        return primaryKey;
    }

    public List<String> fillable() {
        return List.copyOf(fillable);
    }

    public List<String> hidden() {
        return List.copyOf(hidden);
    }

    public Map<String, AttributeCast> casts() {
        return Collections.unmodifiableMap(casts);
    }

    public boolean usesTimestamps() {
        return timestamps;
    }

    public Set<String> relationNames() {
        return Collections.unmodifiableSet(relationDefinitions.keySet());
    }

    /** Snake-case plural of the class name: {@code BlogPost -> blog_posts}. */
    static String defaultTable(Class<?> type) {
        return pluralize(snake(type.getSimpleName()));
    }

    /** Snake-case singular of the class name, the prefix of default foreign keys. */
    public static String snakeName(Class<?> type) {
        return snake(type.getSimpleName());
    }

    private static String snake(String name) {
        return name.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase(Locale.ROOT);
    }

    private static String pluralize(String word) {
        if (word.matches(".*[^aeiou]y$")) {
            return word.substring(0, word.length() - 1) + "ies";
        }
        if (word.matches(".*(s|x|z|ch|sh)$")) {
            return word + "es";
        }
        return word + "s";
    }

    // ---- binding ----

    /** Binds this instance to a database; models loaded through a repository are bound already. */
    public Model bind(Database database) {
        this.database = database;
        return this;
    }

    public Database database() {
        if (database == null) {
            throw new ConfigurationException(
                    "%s is not bound to a Database".formatted(getClass().getSimpleName()),
                    Map.of("model", getClass().getSimpleName()));
        }
        return database;
    }

    public boolean isBound() {
        return database != null;
    }

    // ---- attributes ----

    /**
     * Assigns fillable attributes; keys not on the fillable list are dropped silently.
     */
    public Model fill(Map<String, ?> values) {
        values.forEach((key, value) -> {
            if (fillable.contains(key)) {
                setAttribute(key, value);
            }
        });
        return this;
    }

    /** Assigns every attribute, ignoring the fillable list. */
    public Model forceFill(Map<String, ?> values) {
        values.forEach(this::setAttribute);
        return this;
    }

    /** Cast-aware value of an attribute, or null. */
    public Object getAttribute(String key) {
        Object raw = attributes.get(key);
        AttributeCast cast = casts.get(key);
        return cast == null ? raw : cast.decode(raw);
    }

    @SuppressWarnings("unchecked")
    public <V> V get(String key) {
        return (V) getAttribute(key);
    }

    /** Stored value of an attribute, without casting. */
    public Object getRawAttribute(String key) {
        return attributes.get(key);
    }

    public Model setAttribute(String key, Object value) {
        AttributeCast cast = casts.get(key);
        attributes.put(key, cast == null ? value : cast.encode(value));
        return this;
    }

    public boolean hasAttribute(String key) {
        return attributes.containsKey(key);
    }

    /** Stored attributes, read-only. */
    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * Replaces all attributes with stored values as read from the backend.
     *
     * @param sync also reset the dirty-tracking snapshot
     */
    public Model setRawAttributes(Map<String, ?> values, boolean sync) {
        attributes.clear();
        attributes.putAll(values);
        if (sync) {
            syncOriginal();
        }
        return this;
    }

    public Object getKey() {
        return getRawAttribute(primaryKey);
    }

    public boolean exists() {
        return exists;
    }

    /** Marks whether this instance corresponds to a stored row. */
    public Model markExists(boolean exists) {
        this.exists = exists;
        return this;
    }

    // ---- dirty tracking ----

    public boolean isDirty() {
        return !getDirty().isEmpty();
    }

    public boolean isDirty(String key) {
        return getDirty().containsKey(key);
    }

    /** Attributes whose stored value differs from the last load or save. */
    public Map<String, Object> getDirty() {
        Map<String, Object> dirty = new LinkedHashMap<>();
        attributes.forEach((key, value) -> {
            if (!original.containsKey(key) || !Objects.equals(original.get(key), value)) {
                dirty.put(key, value);
            }
        });
        return dirty;
    }

    public Map<String, Object> getOriginal() {
        return Collections.unmodifiableMap(original);
    }

    public Model syncOriginal() {
        original.clear();
        original.putAll(attributes);
        return this;
    }

    // ---- persistence ----

    /**
     * Inserts the model when it has no primary key and writes the dirty attributes of a loaded one.
     * A model built with a key but not loaded updates the row holding that key, or inserts it when
     * there is none. Returns true when a write happened or nothing needed writing.
     */
    public boolean save() {
        DatabaseAdapter adapter = database().adapter();
        if (getKey() == null) {
            return performInsert(adapter);
        }
        if (exists) {
            return performUpdate(adapter);
        }
        return performKeyedSave(adapter);
    }

    private boolean performKeyedSave(DatabaseAdapter adapter) {
        Map<String, Object> data = new LinkedHashMap<>(attributes);
        data.remove(primaryKey);
        data.remove("_id");
        if (timestamps && !data.isEmpty()) {
            data.put(UPDATED_AT, now());
        }
        boolean stored = data.isEmpty()
                ? !adapter.select(table(), SelectOptions.builder().where(keyConstraint()).limit(1).build()).isEmpty()
                : adapter.update(table(), keyConstraint(), data) > 0;
        if (!stored) {
            return performInsert(adapter);
        }
        if (data.containsKey(UPDATED_AT)) {
            attributes.put(UPDATED_AT, data.get(UPDATED_AT));
        }
        exists = true;
        syncOriginal();
        return true;
    }

    private boolean performInsert(DatabaseAdapter adapter) {
        if (timestamps) {
            LocalDateTime now = now();
            attributes.putIfAbsent(CREATED_AT, now);
            attributes.put(UPDATED_AT, now);
        }
        Map<String, Object> data = new LinkedHashMap<>(attributes);
        if (data.get(primaryKey) == null) {
            data.remove(primaryKey);
        }
        Object key = adapter.insert(table(), data, primaryKey);
        if (key != null) {
            attributes.put(primaryKey, key);
            if (adapter.type() == DatabaseType.MONGODB && key instanceof String hex && ObjectId.isValid(hex)) {
                attributes.put("_id", new ObjectId(hex));
            }
        }
        exists = true;
        syncOriginal();
        return true;
    }

    private boolean performUpdate(DatabaseAdapter adapter) {
        Map<String, Object> dirty = getDirty();
        if (dirty.isEmpty()) {
            return true;
        }
        if (timestamps && !dirty.containsKey(UPDATED_AT)) {
            attributes.put(UPDATED_AT, now());
            dirty.put(UPDATED_AT, attributes.get(UPDATED_AT));
        }
        adapter.update(table(), keyConstraint(), dirty);
        syncOriginal();
        return true;
    }

    /** Fills then saves. */
    public boolean update(Map<String, ?> values) {
        fill(values);
        return save();
    }

    /** Deletes the stored row. Returns false when the model was never stored. */
    public boolean delete() {
        if (!exists || getKey() == null) {
            return false;
        }
        database().adapter().delete(table(), keyConstraint());
        exists = false;
        return true;
    }

    /**
     * Reloads attributes from storage and clears loaded relations.
     *
     * @throws ModelNotFoundException if the row no longer exists
     */
    public Model refresh() {
        if (getKey() == null) {
            throw new ModelNotFoundException(getClass().getSimpleName(), null);
        }
        List<Map<String, Object>> rows = database().adapter().select(
                table(), SelectOptions.builder().where(keyConstraint()).limit(1).build());
        if (rows.isEmpty()) {
            throw new ModelNotFoundException(getClass().getSimpleName(), getKey());
        }
        setRawAttributes(rows.get(0), true);
        relations.clear();
        return this;
    }

    /**
     * Unsaved copy without primary key and timestamps.
     *
     * @param constructor builds the copy, normally this model's own constructor reference
     */
    public <T extends Model> T replicate(Supplier<T> constructor) {
        T copy = ModelFactory.newInstance(constructor);
        Map<String, Object> values = new LinkedHashMap<>(attributes);
        values.remove(primaryKey);
        values.remove("_id");
        values.remove(CREATED_AT);
        values.remove(UPDATED_AT);
        copy.setRawAttributes(values, false);
        copy.bind(database);
        return copy;
    }

    private List<WhereClause> keyConstraint() {
        return List.of(WhereClause.basic(primaryKey, Operator.EQUALS, getKey(), BooleanOperator.AND));
    }

    private static LocalDateTime now() {
        return LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);
    }

    // ---- relations ----

    /**
     * Fresh, unconstrained instance of a declared relation, for building a custom query.
     *
     * @throws ConfigurationException if no relation named {@code name} is declared
     */
    public Relation<?> relation(String name) {
        Supplier<? extends Relation<?>> definition = relationDefinitions.get(name);
        if (definition == null) {
            throw new ConfigurationException(
                    "Relation '%s' is not declared on %s".formatted(name, getClass().getSimpleName()),
                    Map.of("relation", name, "model", getClass().getSimpleName()));
        }
        return definition.get();
    }

    /** Loaded value of a relation, loading it lazily on first access. */
    public Object getRelation(String name) {
        if (relations.containsKey(name)) {
            return relations.get(name);
        }
        Object value = relation(name).getResults();
        relations.put(name, value);
        return value;
    }

    @SuppressWarnings("unchecked")
    public <R extends Model> List<R> getMany(String name) {
        return (List<R>) getRelation(name);
    }

    @SuppressWarnings("unchecked")
    public <R extends Model> R getOne(String name) {
        return (R) getRelation(name);
    }

    public Model setRelation(String name, Object value) {
        relations.put(name, value);
        return this;
    }

    public boolean relationLoaded(String name) {
        return relations.containsKey(name);
    }

    public Model unsetRelation(String name) {
        relations.remove(name);
        return this;
    }

    /** Drops the cached value and loads the relation again. */
    public Object refreshRelation(String name) {
        unsetRelation(name);
        return getRelation(name);
    }

    public Map<String, Object> getRelations() {
        return Collections.unmodifiableMap(relations);
    }

    /** Eager-loads relations onto this already-fetched model; dotted names load nested relations. */
    public Model load(String... names) {
        Map<String, Consumer<QueryBuilder<?>>> pending = new LinkedHashMap<>();
        for (String name : names) {
            pending.put(name, null);
        }
        EagerLoader.load(List.of(this), pending);
        return this;
    }

    protected <R extends Model> HasOne<R> hasOne(Supplier<R> related) {
        return hasOne(related, snakeName(getClass()) + "_id", primaryKey);
    }

    protected <R extends Model> HasOne<R> hasOne(Supplier<R> related, String foreignKey, String localKey) {
        return new HasOne<>(this, related, foreignKey, localKey);
    }

    protected <R extends Model> HasMany<R> hasMany(Supplier<R> related) {
        return hasMany(related, snakeName(getClass()) + "_id", primaryKey);
    }

    protected <R extends Model> HasMany<R> hasMany(Supplier<R> related, String foreignKey, String localKey) {
        return new HasMany<>(this, related, foreignKey, localKey);
    }

    protected <R extends Model> BelongsTo<R> belongsTo(Supplier<R> related) {
        R owner = ModelFactory.newInstance(related);
        return belongsTo(related, snakeName(owner.getClass()) + "_id", owner.primaryKey());
    }

    protected <R extends Model> BelongsTo<R> belongsTo(Supplier<R> related, String foreignKey, String ownerKey) {
        return new BelongsTo<>(this, related, foreignKey, ownerKey);
    }

    /**
     * Many-to-many through a pivot table. Defaults: pivot table is the two singular snake names in
     * alphabetical order ({@code role_user}), keys are {@code <name>_id}.
     */
    protected <R extends Model> BelongsToMany<R> belongsToMany(Supplier<R> related) {
        String self = snakeName(getClass());
        String other = snakeName(ModelFactory.newInstance(related).getClass());
        String pivot = self.compareTo(other) < 0 ? self + "_" + other : other + "_" + self;
        return belongsToMany(related, pivot, self + "_id", other + "_id");
    }

    protected <R extends Model> BelongsToMany<R> belongsToMany(
            Supplier<R> related, String pivotTable, String foreignPivotKey, String relatedPivotKey) {
        return new BelongsToMany<>(
                this, related, pivotTable, foreignPivotKey, relatedPivotKey, primaryKey,
                ModelFactory.newInstance(related).primaryKey());
    }

    // ---- output ----

    /** Visible attributes with casts applied, plus loaded relations. */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String key : attributes.keySet()) {
            if (!hidden.contains(key)) {
                out.put(key, getAttribute(key));
            }
        }
        relations.forEach((name, value) -> {
            if (!hidden.contains(name)) {
                out.put(name, relationToMap(value));
            }
        });
        return out;
    }

    private static Object relationToMap(Object value) {
        if (value instanceof Model model) {
            return model.toMap();
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(item instanceof Model model ? model.toMap() : item);
            }
            return out;
        }
        return value;
    }

    public String toJson() {
        return ModelJson.write(toMap());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + toMap();
    }
}
