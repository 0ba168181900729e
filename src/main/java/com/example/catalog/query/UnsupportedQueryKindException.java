package com.example.catalog.query;

import com.example.catalog.CatalogException;

public class UnsupportedQueryKindException extends CatalogException {
    private final String kind;

    public UnsupportedQueryKindException(String kind) {
        super("No translator registered for query kind " + kind);
        this.kind = kind;
    }

    public UnsupportedQueryKindException(String kind, Class<?> registeredType, Class<?> actualType) {
        super("Query kind " + kind + " is registered for " + registeredType.getName()
                + " but got " + actualType.getName());
        this.kind = kind;
    }

    public String kind() {
        return kind;
    }
}
