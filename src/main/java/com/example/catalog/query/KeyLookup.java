package com.example.catalog.query;

import java.util.Objects;

public record KeyLookup(String uid) implements CatalogQuery {
    public static final String KIND = "key_lookup";

    public KeyLookup {
        Objects.requireNonNull(uid, "uid");
    }

    @Override
    public String kind() {
        return KIND;
    }
}
