package com.tessera.database.relation;

import com.tessera.database.model.Model;
import com.tessera.database.model.ModelFactory;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Shared behaviour of relations whose foreign key lives on the related table.
 *
 * @param <R> related model type
 */
public abstract class HasOneOrMany<R extends Model> extends Relation<R> {

    protected final String foreignKey;
    protected final String localKey;

    protected HasOneOrMany(Model parent, Supplier<R> related, String foreignKey, String localKey) {
        super(parent, related);
        this.foreignKey = foreignKey;
        this.localKey = localKey;
    }

    @Override
    protected void applyLazyConstraints() {
        query.where(foreignKey, parentKey());
    }

    @Override
    protected void applyEagerConstraints(List<? extends Model> parents) {
        query.whereIn(foreignKey, keys(parents, localKey));
    }

    /** Parent's local key value, raw. */
    protected Object parentKey() {
        return parent.getRawAttribute(localKey);
    }

    protected Map<String, List<R>> resultsByForeignKey(List<R> results) {
        return dictionary(results, foreignKey);
    }

    /** Sets the foreign key on {@code model} to this parent and saves it. */
    public R save(R model) {
        model.setAttribute(foreignKey, parentKey());
        model.save();
        return model;
    }

    /** Creates and saves a related model linked to this parent. */
    public R create(Map<String, ?> attributes) {
        return save(make(attributes));
    }

    /** Unsaved related model linked to this parent. */
    public R make(Map<String, ?> attributes) {
        R model = ModelFactory.newInstance(related);
        model.bind(parent.database());
        model.fill(attributes);
        model.setAttribute(foreignKey, parentKey());
        return model;
    }

    public String foreignKey() {
        return foreignKey;
    }

    public String localKey() {
        return localKey;
    }
}
