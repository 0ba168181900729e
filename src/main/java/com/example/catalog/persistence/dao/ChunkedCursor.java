package com.example.catalog.persistence.dao;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Streams the documents matching a filter in rounds of at most {@code batchSize}, each round picking up
 * after the last {@code _id} seen instead of holding one long-lived server cursor.
 * <p>
 * Documents come out in ascending {@code _id} order, each at most once, with {@code _id} removed.
 * Documents inserted behind the last id seen are never returned; documents inserted ahead of it may or
 * may not show up in the current pass.
 */
public class ChunkedCursor {
    private static final Logger log = LoggerFactory.getLogger(ChunkedCursor.class);

    public static final int DEFAULT_BATCH_SIZE = 100;

    private static final Document ID_ASCENDING = new Document("_id", 1);
    private static final long UNBOUNDED = -1;

    private final DocumentCollection collection;
    private final int batchSize;

    public ChunkedCursor(DocumentCollection collection) {
        this(collection, DEFAULT_BATCH_SIZE);
    }

    public ChunkedCursor(DocumentCollection collection, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        this.collection = collection;
        this.batchSize = batchSize;
    }

    public int batchSize() {
        return batchSize;
    }

    public Flux<Document> find(Document filter) {
        return find(filter, 0, null);
    }

    /**
     * @param skip  documents to skip, applied by the store on the first round only
     * @param limit maximum number of documents overall, {@code null} for no limit
     */
    public Flux<Document> find(Document filter, long skip, Long limit) {
        if (skip < 0) {
            return Flux.error(new IllegalArgumentException("skip must be >= 0"));
        }
        if (limit != null && limit <= 0) {
            return Flux.empty();
        }
        long remaining = limit == null ? UNBOUNDED : limit;
        return round(filter, null, skip, remaining)
                .expand(page -> page.last() ? Mono.empty() : round(filter, page.lastId(), 0, page.remaining()))
                // one page in flight at a time keeps memory at O(batchSize)
                .concatMapIterable(Page::documents, 1);
    }

    private Mono<Page> round(Document filter, Object lastId, long skip, long remaining) {
        int size = remaining != UNBOUNDED && remaining < batchSize ? (int) remaining : batchSize;
        Document query = lastId == null ? filter : after(filter, lastId);
        return Mono.defer(() -> collection.find(query, ID_ASCENDING, skip, size).collectList())
                .map(docs -> {
                    if (docs.isEmpty()) {
                        log.debug("{}: round after {} returned nothing, done", collection.name(), lastId);
                        return Page.EXHAUSTED;
                    }
                    Object newLastId = docs.get(docs.size() - 1).get("_id");
                    if (newLastId == null) {
                        throw new IllegalStateException(
                                "document without _id in collection " + collection.name());
                    }
                    docs.forEach(doc -> doc.remove("_id"));
                    long left = remaining == UNBOUNDED ? UNBOUNDED : remaining - docs.size();
                    log.debug("{}: round after {} returned {} documents, last={}",
                            collection.name(), lastId, docs.size(), newLastId);
                    return new Page(docs, newLastId, left, left == 0);
                });
    }

    private static Document after(Document filter, Object lastId) {
        Document idFilter = new Document("_id", new Document("$gt", lastId));
        if (filter.isEmpty()) {
            return idFilter;
        }
        return new Document("$and", List.of(filter, idFilter));
    }

    private record Page(List<Document> documents, Object lastId, long remaining, boolean last) {
        static final Page EXHAUSTED = new Page(List.of(), null, 0, true);
    }
}
