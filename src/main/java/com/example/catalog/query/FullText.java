package com.example.catalog.query;

import java.util.Objects;

public record FullText(String text) implements CatalogQuery {
    public static final String KIND = "full_text";

    public FullText {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String kind() {
        return KIND;
    }
}
