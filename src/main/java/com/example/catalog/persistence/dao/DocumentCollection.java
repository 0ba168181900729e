package com.example.catalog.persistence.dao;

import org.bson.Document;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * The slice of a document store collection the catalog reads through. Every document carries a
 * store-assigned, strictly increasing {@code _id}.
 */
public interface DocumentCollection {

    String name();

    /**
     * @param sort  sort specification, empty for natural order
     * @param limit maximum number of documents, 0 for no limit
     */
    Flux<Document> find(Document filter, Document sort, long skip, int limit);

    /**
     * First match, with {@code _id} already removed.
     */
    Mono<Document> findOne(Document filter);

    Mono<Long> countDocuments(Document filter);

    /**
     * Cheap, approximate size of the whole collection, ignoring any filter.
     */
    Mono<Long> estimatedDocumentCount();

    Flux<Document> aggregate(List<Document> pipeline);

    Flux<String> distinct(String field, Document filter);
}
