package com.tessera.database.adapter.mongo;

import com.tessera.database.adapter.BooleanOperator;
import com.tessera.database.adapter.LikePatterns;
import com.tessera.database.adapter.WhereClause;
import com.tessera.database.config.DatabaseType;
import com.tessera.database.exception.UnsupportedBackendOperationException;
import java.util.ArrayList;
import java.util.List;
import org.bson.BsonRegularExpression;
import org.bson.Document;
import org.bson.types.ObjectId;

/**
 * Translates where clauses into MongoDB filter documents.
 *
 * <p>Consecutive AND-joined clauses form a group; every OR starts a new group, and the groups are
 * combined with {@code $or}. This gives AND its SQL precedence over OR. The {@code id} column maps
 * to {@code _id}, and 24-digit hex strings compared against {@code _id} become {@link ObjectId}s.
 */
public final class MongoFilterTranslator {

    public Document translate(List<WhereClause> where) {
        List<List<Document>> groups = new ArrayList<>();
        List<Document> current = new ArrayList<>();
        for (WhereClause clause : where) {
            Document filter = translate(clause);
            if (filter.isEmpty()) {
                continue;
            }
            if (clause.bool() == BooleanOperator.OR && !current.isEmpty()) {
                groups.add(current);
                current = new ArrayList<>();
            }
            current.add(filter);
        }
        if (!current.isEmpty()) {
            groups.add(current);
        }
        if (groups.isEmpty()) {
            return new Document();
        }
        if (groups.size() == 1) {
            return and(groups.get(0));
        }
        List<Document> alternatives = new ArrayList<>();
        for (List<Document> group : groups) {
            alternatives.add(and(group));
        }
        return new Document("$or", alternatives);
    }

    private static Document and(List<Document> group) {
        return group.size() == 1 ? group.get(0) : new Document("$and", group);
    }

    private Document translate(WhereClause clause) {
        switch (clause.kind()) {
            case NESTED:
                return translate(clause.nested());
            case COLUMN:
                throw new UnsupportedBackendOperationException(DatabaseType.MONGODB, "where", "column comparison");
            case RAW:
                throw new UnsupportedBackendOperationException(DatabaseType.MONGODB, "where", "raw where");
            default:
                return translateBasic(clause);
        }
    }

    private Document translateBasic(WhereClause clause) {
        String field = field(clause.column());
        switch (clause.operator()) {
            case EQUALS:
                return new Document(field, new Document("$eq", value(field, clause.value())));
            case NOT_EQUALS:
                return new Document(field, new Document("$ne", value(field, clause.value())));
            case GREATER_THAN:
                return new Document(field, new Document("$gt", value(field, clause.value())));
            case GREATER_THAN_OR_EQUAL:
                return new Document(field, new Document("$gte", value(field, clause.value())));
            case LESS_THAN:
                return new Document(field, new Document("$lt", value(field, clause.value())));
            case LESS_THAN_OR_EQUAL:
                return new Document(field, new Document("$lte", value(field, clause.value())));
            case IN:
                return new Document(field, new Document("$in", values(field, clause.values())));
            case NOT_IN:
                return new Document(field, new Document("$nin", values(field, clause.values())));
            case BETWEEN:
                return new Document(field, range(field, clause.values()));
            case NOT_BETWEEN:
                return new Document(field, new Document("$not", range(field, clause.values())));
            case LIKE:
                return new Document(field, new Document("$regex", regex(clause)));
            case ILIKE:
                return new Document(field, new Document("$regex", regex(clause)).append("$options", "i"));
            case NOT_LIKE:
                return new Document(field, new Document("$not", new BsonRegularExpression(regex(clause))));
            case IS_NULL:
                return new Document(field, new Document("$eq", null));
            case IS_NOT_NULL:
                return new Document(field, new Document("$ne", null));
            default:
                throw new UnsupportedBackendOperationException(
                        DatabaseType.MONGODB, "where", clause.operator().symbol());
        }
    }

    private Document range(String field, List<Object> bounds) {
        return new Document("$gte", value(field, bounds.get(0))).append("$lte", value(field, bounds.get(1)));
    }

    private static String regex(WhereClause clause) {
        if (!(clause.value() instanceof String pattern)) {
            throw new IllegalArgumentException(clause.operator().symbol() + " requires a string pattern");
        }
        return LikePatterns.toRegex(pattern);
    }

    private List<Object> values(String field, List<Object> values) {
        List<Object> converted = new ArrayList<>(values.size());
        for (Object value : values) {
            converted.add(value(field, value));
        }
        return converted;
    }

    /** Maps the model-facing {@code id} column onto {@code _id}. */
    static String field(String column) {
        return "id".equals(column) ? "_id" : column;
    }

    static Object value(String field, Object value) {
        if ("_id".equals(field) && value instanceof String hex && ObjectId.isValid(hex)) {
            return new ObjectId(hex);
        }
        return value;
    }
}
