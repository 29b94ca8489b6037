package com.tessera.database.relation;

import com.tessera.database.model.Model;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/** One related model whose foreign key points at the parent. */
public class HasOne<R extends Model> extends HasOneOrMany<R> {

    public HasOne(Model parent, Supplier<R> related, String foreignKey, String localKey) {
        super(parent, related, foreignKey, localKey);
    }

    @Override
    public Object getResults() {
        if (parentKey() == null) {
            return null;
        }
        return first();
    }

    @Override
    public void match(List<? extends Model> parents, List<R> results, String name) {
        Map<String, List<R>> dictionary = resultsByForeignKey(results);
        for (Model model : parents) {
            List<R> matches = dictionary.get(RelationKeys.normalize(model.getRawAttribute(localKey)));
            model.setRelation(name, matches == null ? null : matches.get(0));
        }
    }
}
