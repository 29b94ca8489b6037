package com.tessera.database.relation;

import com.tessera.database.model.Model;
import java.util.Map;

/** Row of a many-to-many pivot table, attached to related models as the {@code pivot} relation. */
public class Pivot extends Model {

    public Pivot() {
    }

    Pivot(String table, Map<String, Object> attributes) {
        table(table);
        setRawAttributes(attributes, true);
        markExists(true);
    }
}
