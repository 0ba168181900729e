package com.example.catalog.persistence.dao;

import org.springframework.data.mongodb.core.ReactiveMongoOperations;

import java.util.Objects;

/**
 * The collections of a metadata store that a catalog reads.
 */
public record CatalogCollections(
        DocumentCollection runStart,
        DocumentCollection runStop,
        DocumentCollection eventDescriptor,
        DocumentCollection event
) {
    public static final String RUN_START = "run_start";
    public static final String RUN_STOP = "run_stop";
    public static final String EVENT_DESCRIPTOR = "event_descriptor";
    public static final String EVENT = "event";

    public CatalogCollections {
        Objects.requireNonNull(runStart, "runStart");
        Objects.requireNonNull(runStop, "runStop");
        Objects.requireNonNull(eventDescriptor, "eventDescriptor");
        Objects.requireNonNull(event, "event");
    }

    public static CatalogCollections of(ReactiveMongoOperations metadatastore) {
        return new CatalogCollections(
                new MongoDocumentCollection(metadatastore, RUN_START),
                new MongoDocumentCollection(metadatastore, RUN_STOP),
                new MongoDocumentCollection(metadatastore, EVENT_DESCRIPTOR),
                new MongoDocumentCollection(metadatastore, EVENT)
        );
    }
}
