package com.example.catalog.query;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Maps query kinds to translators producing MongoDB filters on the run start collection.
 * Nothing is registered implicitly: use {@link #withDefaults()} or call {@link #register} at startup.
 */
public class QueryRegistry {
    private static final Logger log = LoggerFactory.getLogger(QueryRegistry.class);

    private final Map<String, Registration<?>> translators = new ConcurrentHashMap<>();

    public static QueryRegistry withDefaults() {
        return new QueryRegistry()
                .register(FullText.KIND, FullText.class,
                        q -> new Document("$text", new Document("$search", q.text())))
                .register(KeyLookup.KIND, KeyLookup.class, q -> new Document("uid", q.uid()))
                .register(RawMongo.KIND, RawMongo.class, RawMongo::start);
    }

    /**
     * Registers (or replaces) the translator for {@code kind}.
     */
    public <Q extends CatalogQuery> QueryRegistry register(String kind,
                                                          Class<Q> type,
                                                          Function<? super Q, Document> translator) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(translator, "translator");
        Registration<?> previous = translators.put(kind, new Registration<>(type, translator));
        if (previous != null) {
            log.debug("query kind {} re-registered: {} -> {}", kind, previous.type().getName(), type.getName());
        }
        return this;
    }

    public boolean supports(String kind) {
        return translators.containsKey(kind);
    }

    public Document translate(CatalogQuery query) {
        Registration<?> registration = translators.get(query.kind());
        if (registration == null) {
            throw new UnsupportedQueryKindException(query.kind());
        }
        return registration.apply(query);
    }

    public List<Document> translateAll(List<? extends CatalogQuery> queries) {
        List<Document> out = new ArrayList<>(queries.size());
        for (CatalogQuery q : queries) {
            out.add(translate(q));
        }
        return out;
    }

    /**
     * AND-composition; no predicates means match everything.
     */
    public static Document combine(List<Document> predicates) {
        if (predicates.isEmpty()) {
            return new Document();
        }
        return new Document("$and", new ArrayList<>(predicates));
    }

    private record Registration<Q extends CatalogQuery>(Class<Q> type, Function<? super Q, Document> translator) {

        Document apply(CatalogQuery query) {
            if (!type.isInstance(query)) {
                throw new UnsupportedQueryKindException(query.kind(), type, query.getClass());
            }
            return translator.apply(type.cast(query));
        }
    }
}
