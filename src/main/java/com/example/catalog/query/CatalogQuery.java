package com.example.catalog.query;

/**
 * Backend-agnostic search intent. The built-in variants are closed; anything else goes through
 * {@link CustomQuery} and must be registered with a {@link QueryRegistry} before use.
 */
public sealed interface CatalogQuery permits FullText, KeyLookup, RawMongo, CustomQuery {

    /**
     * Tag the {@link QueryRegistry} dispatches on.
     */
    String kind();
}
