package com.example.catalog.query;

import org.bson.Document;

import java.util.Objects;

/**
 * A MongoDB filter applied as-is to the run start collection.
 */
public record RawMongo(Document start) implements CatalogQuery {
    public static final String KIND = "raw_mongo";

    public RawMongo {
        Objects.requireNonNull(start, "start");
        start = new Document(start);
    }

    @Override
    public Document start() {
        return new Document(start);
    }

    @Override
    public String kind() {
        return KIND;
    }
}
