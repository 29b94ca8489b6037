package com.tessera.database.relation;

import com.tessera.database.model.Model;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/** Inverse side: the parent's foreign key points at the related model. */
public class BelongsTo<R extends Model> extends Relation<R> {

    private final String foreignKey;
    private final String ownerKey;

    public BelongsTo(Model parent, Supplier<R> related, String foreignKey, String ownerKey) {
        super(parent, related);
        this.foreignKey = foreignKey;
        this.ownerKey = ownerKey;
    }

    @Override
    protected void applyLazyConstraints() {
        query.where(ownerKey, parent.getRawAttribute(foreignKey));
    }

    @Override
    protected void applyEagerConstraints(List<? extends Model> parents) {
        query.whereIn(ownerKey, keys(parents, foreignKey));
    }

    @Override
    public Object getResults() {
        if (parent.getRawAttribute(foreignKey) == null) {
            return null;
        }
        return first();
    }

    @Override
    public void match(List<? extends Model> parents, List<R> results, String name) {
        Map<String, List<R>> dictionary = dictionary(results, ownerKey);
        for (Model model : parents) {
            List<R> matches = dictionary.get(RelationKeys.normalize(model.getRawAttribute(foreignKey)));
            model.setRelation(name, matches == null ? null : matches.get(0));
        }
    }

    /** Points the parent's foreign key at {@code owner}. The parent is not saved. */
    public Model associate(R owner) {
        parent.setAttribute(foreignKey, owner.getRawAttribute(ownerKey));
        return parent;
    }

    /** Clears the parent's foreign key. The parent is not saved. */
    public Model dissociate() {
        parent.setAttribute(foreignKey, null);
        return parent;
    }

    public String foreignKey() {
        return foreignKey;
    }

    public String ownerKey() {
        return ownerKey;
    }
}
