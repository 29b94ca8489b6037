package com.tessera.database.relation;

import com.tessera.database.model.Model;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/** Related models whose foreign key points at the parent. */
public class HasMany<R extends Model> extends HasOneOrMany<R> {

    public HasMany(Model parent, Supplier<R> related, String foreignKey, String localKey) {
        super(parent, related, foreignKey, localKey);
    }

    @Override
    public Object getResults() {
        if (parentKey() == null) {
            return new ArrayList<R>();
        }
        return get();
    }

    @Override
    public void match(List<? extends Model> parents, List<R> results, String name) {
        Map<String, List<R>> dictionary = resultsByForeignKey(results);
        for (Model model : parents) {
            List<R> matches = dictionary.get(RelationKeys.normalize(model.getRawAttribute(localKey)));
            model.setRelation(name, matches == null ? new ArrayList<R>() : new ArrayList<>(matches));
        }
    }

    /** Saves each model with its foreign key pointing at this parent. */
    public List<R> saveMany(List<R> models) {
        models.forEach(this::save);
        return models;
    }
}
