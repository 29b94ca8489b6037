package com.tessera.database.adapter.mongo;

import com.mongodb.client.model.Aggregates;
import com.mongodb.client.model.UnwindOptions;
import com.tessera.database.adapter.DatabaseAdapter;
import com.tessera.database.adapter.InstrumentedDatabaseAdapter;
import com.tessera.database.exception.UnsupportedBackendOperationException;
import com.tessera.database.query.MacroRegistry;
import com.tessera.database.query.QueryBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.bson.conversions.Bson;

/**
 * Document-store macros:
 *
 * <ul>
 *   <li>{@code populate(field[, PopulateOptions])} embeds the referenced document with a {@code
 *       $lookup} and returns rows
 *   <li>{@code aggregate(List<Bson>)} runs a raw pipeline on the builder's collection
 *   <li>{@code exec()} is {@code get()}
 * </ul>
 */
public final class MongoExtensions {

    public static final String POPULATE = "populate";
    public static final String AGGREGATE = "aggregate";
    public static final String EXEC = "exec";

    private MongoExtensions() {
        // utility class
    }

    public static MacroRegistry register(MacroRegistry registry) {
        return registry
                .register(POPULATE, MongoExtensions::populate)
                .register(AGGREGATE, MongoExtensions::aggregate)
                .register(EXEC, (builder, args) -> builder.get());
    }

    static List<Map<String, Object>> populate(QueryBuilder<?> builder, Object... args) {
        if (args.length == 0 || !(args[0] instanceof String field)) {
            throw new IllegalArgumentException("populate expects the field name as first argument");
        }
        PopulateOptions options = args.length > 1 && args[1] instanceof PopulateOptions given
                ? given
                : PopulateOptions.defaults();
        MongoAdapter adapter = mongo(builder.adapter(), POPULATE);
        return adapter.aggregatePipeline(builder.table(), populatePipeline(adapter, builder, options.resolve(field)));
    }

    static List<Bson> populatePipeline(MongoAdapter adapter, QueryBuilder<?> builder, PopulateOptions options) {
        List<Bson> pipeline = new ArrayList<>();
        Document filter = adapter.buildFilter(builder.wheres());
        if (!filter.isEmpty()) {
            pipeline.add(Aggregates.match(filter));
        }
        if (options.select().isEmpty()) {
            pipeline.add(Aggregates.lookup(options.from(), options.localField(), options.foreignField(), options.as()));
        } else {
            Document projection = new Document();
            options.select().forEach(column -> projection.append(MongoFilterTranslator.field(column), 1));
            List<Document> inner = List.of(
                    new Document("$match", new Document(
                            "$expr", new Document("$eq", List.of("$" + options.foreignField(), "$$localId")))),
                    new Document("$project", projection));
            pipeline.add(new Document(
                    "$lookup",
                    new Document("from", options.from())
                            .append("let", new Document("localId", "$" + options.localField()))
                            .append("pipeline", inner)
                            .append("as", options.as())));
        }
        pipeline.add(Aggregates.unwind("$" + options.as(), new UnwindOptions().preserveNullAndEmptyArrays(true)));
        if (builder.limitValue() != null) {
            pipeline.add(Aggregates.limit(builder.limitValue()));
        }
        return pipeline;
    }

    static List<Map<String, Object>> aggregate(QueryBuilder<?> builder, Object... args) {
        if (args.length != 1 || !(args[0] instanceof List<?> stages)) {
            throw new IllegalArgumentException("aggregate expects a pipeline list");
        }
        MongoAdapter mongo = mongo(builder.adapter(), AGGREGATE);
        List<Bson> pipeline = new ArrayList<>(stages.size());
        for (Object stage : stages) {
            if (!(stage instanceof Bson bson)) {
                throw new IllegalArgumentException("aggregate stages must be Bson documents");
            }
            pipeline.add(bson);
        }
        return mongo.aggregatePipeline(builder.table(), pipeline);
    }

    private static MongoAdapter mongo(DatabaseAdapter adapter, String macro) {
        DatabaseAdapter target = adapter instanceof InstrumentedDatabaseAdapter instrumented
                ? instrumented.delegate()
                : adapter;
        if (target instanceof MongoAdapter mongo) {
            return mongo;
        }
        throw new UnsupportedBackendOperationException(adapter.type(), macro, macro + " macro");
    }
}
