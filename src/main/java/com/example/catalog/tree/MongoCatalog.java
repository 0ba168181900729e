package com.example.catalog.tree;

import com.example.catalog.CatalogConfigurationException;
import com.example.catalog.IndexOutOfRangeException;
import com.example.catalog.NotFoundException;
import com.example.catalog.access.AccessPolicy;
import com.example.catalog.access.AlreadyAuthenticatedException;
import com.example.catalog.access.AuthenticationRequiredException;
import com.example.catalog.access.Identity;
import com.example.catalog.persistence.dao.CatalogCollections;
import com.example.catalog.persistence.dao.ChunkedCursor;
import com.example.catalog.query.CatalogQuery;
import com.example.catalog.query.QueryRegistry;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root of the catalog: maps run uids to {@link Run}s, reading the run start collection of a MongoDB
 * metadata store.
 * <p>
 * Instances are immutable. {@link #search(CatalogQuery)} and {@link #authenticatedAs(Identity)} return
 * new catalogs sharing the same collections. Every read applies the access policy to the stored queries
 * for the current identity, translates them and ANDs them together; nothing of that is cached.
 */
public final class MongoCatalog implements CatalogTree<Run> {
    private static final Logger log = LoggerFactory.getLogger(MongoCatalog.class);

    private final CatalogCollections collections;
    private final QueryRegistry queryRegistry;
    private final List<CatalogQuery> queries;
    private final AccessPolicy accessPolicy;
    private final Identity identity;
    private final Map<String, Object> metadata;
    private final CatalogSettings settings;
    private final RunLoader runs;

    private MongoCatalog(Builder b) {
        this.collections = Objects.requireNonNull(b.collections, "collections");
        this.queryRegistry = Objects.requireNonNull(b.queryRegistry, "queryRegistry");
        this.queries = List.copyOf(b.queries);
        this.accessPolicy = b.accessPolicy;
        this.identity = b.identity;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
        this.settings = Objects.requireNonNull(b.settings, "settings");
        this.runs = new RunLoader(collections, settings);
        if (accessPolicy != null && !accessPolicy.checkCompatibility(this)) {
            throw new CatalogConfigurationException(
                    "Access policy " + accessPolicy + " is not compatible with this catalog");
        }
    }

    public static Builder builder(CatalogCollections collections) {
        return new Builder(collections);
    }

    /**
     * A builder pre-filled with this catalog's state; {@code build()} yields a new catalog and leaves
     * this one untouched.
     */
    public Builder withChanges() {
        return new Builder(collections)
                .queryRegistry(queryRegistry)
                .queries(queries)
                .accessPolicy(accessPolicy)
                .identity(identity)
                .metadata(metadata)
                .settings(settings);
    }

    public CatalogCollections collections() {
        return collections;
    }

    public List<CatalogQuery> queries() {
        return queries;
    }

    public AccessPolicy accessPolicy() {
        return accessPolicy;
    }

    public Identity identity() {
        return identity;
    }

    public CatalogSettings settings() {
        return settings;
    }

    @Override
    public Map<String, Object> metadata() {
        return metadata;
    }

    /**
     * Catalog restricted to entries that also match {@code query}.
     */
    public MongoCatalog search(CatalogQuery query) {
        requireAuthentication();
        queryRegistry.translate(query);
        List<CatalogQuery> extended = new ArrayList<>(queries);
        extended.add(query);
        return withChanges().queries(extended).build();
    }

    public MongoCatalog authenticatedAs(Identity identity) {
        Objects.requireNonNull(identity, "identity");
        if (this.identity != null) {
            throw new AlreadyAuthenticatedException(this.identity);
        }
        if (accessPolicy != null) {
            return accessPolicy.filterResults(this, identity);
        }
        return withChanges().identity(identity).build();
    }

    @Override
    public Mono<Run> lookup(String uid) {
        return filter(new Document("uid", uid))
                .flatMap(f -> collections.runStart().findOne(f))
                .switchIfEmpty(Mono.error(() -> new NotFoundException(uid)))
                .flatMap(runs::run);
    }

    @Override
    public Flux<String> keys() {
        return page(0, null).map(doc -> doc.getString("uid"));
    }

    @Override
    public Mono<Long> length() {
        return filter().flatMap(f -> collections.runStart().countDocuments(f));
    }

    /**
     * Estimated size of the whole run start collection; ignores queries and access restrictions.
     */
    @Override
    public Mono<Long> lengthHint() {
        return collections.runStart().estimatedDocumentCount();
    }

    @Override
    public Flux<String> keys(Slice slice) {
        return pageOf(slice).map(doc -> doc.getString("uid"));
    }

    @Override
    public Flux<Map.Entry<String, Run>> items(Slice slice) {
        return pageOf(slice).concatMap(this::entry);
    }

    @Override
    public Mono<Map.Entry<String, Run>> itemAt(long index) {
        return documentAt(index).flatMap(this::entry);
    }

    @Override
    public Mono<String> keyAt(long index) {
        return documentAt(index).map(doc -> doc.getString("uid"));
    }

    private Mono<Document> documentAt(long index) {
        return length().flatMap(len -> {
            long i = Slice.index(index, len);
            return page(i, 1L).next()
                    .switchIfEmpty(Mono.error(() -> new IndexOutOfRangeException(index, len)));
        });
    }

    private Mono<Map.Entry<String, Run>> entry(Document runStart) {
        return runs.run(runStart).map(run -> Map.entry(run.uid(), run));
    }

    private Flux<Document> pageOf(Slice slice) {
        if (slice.isRelativeToEnd()) {
            return length().flatMapMany(len -> {
                Slice.Bounds b = slice.resolve(len);
                return page(b.start(), b.length());
            });
        }
        return page(slice.skip(), slice.limit());
    }

    private Flux<Document> page(long skip, Long limit) {
        return filter().flatMapMany(f ->
                new ChunkedCursor(collections.runStart(), settings.batchSize()).find(f, skip, limit));
    }

    private Mono<Document> filter(Document... extra) {
        return Mono.fromCallable(() -> {
            requireAuthentication();
            List<CatalogQuery> effective = accessPolicy == null
                    ? queries
                    : accessPolicy.modifyQueries(queries, identity);
            List<Document> predicates = new ArrayList<>(queryRegistry.translateAll(effective));
            predicates.addAll(List.of(extra));
            Document combined = QueryRegistry.combine(predicates);
            log.debug("identity={} filter={}", identity, combined);
            return combined;
        });
    }

    private void requireAuthentication() {
        if (accessPolicy != null && identity == null) {
            throw new AuthenticationRequiredException();
        }
    }

    @Override
    public String toString() {
        return "MongoCatalog{queries=" + queries.size() + ", identity=" + identity + "}";
    }

    public static final class Builder {
        private final CatalogCollections collections;
        private QueryRegistry queryRegistry = QueryRegistry.withDefaults();
        private List<CatalogQuery> queries = List.of();
        private AccessPolicy accessPolicy;
        private Identity identity;
        private Map<String, Object> metadata = Map.of();
        private CatalogSettings settings = CatalogSettings.DEFAULTS;

        private Builder(CatalogCollections collections) {
            this.collections = collections;
        }

        public Builder queryRegistry(QueryRegistry queryRegistry) {
            this.queryRegistry = queryRegistry;
            return this;
        }

        public Builder queries(List<? extends CatalogQuery> queries) {
            this.queries = List.copyOf(queries);
            return this;
        }

        public Builder accessPolicy(AccessPolicy accessPolicy) {
            this.accessPolicy = accessPolicy;
            return this;
        }

        public Builder identity(Identity identity) {
            this.identity = identity;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder settings(CatalogSettings settings) {
            this.settings = settings;
            return this;
        }

        public MongoCatalog build() {
            return new MongoCatalog(this);
        }
    }
}
