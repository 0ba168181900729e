package com.example.catalog.access;

import com.example.catalog.query.CatalogQuery;
import com.example.catalog.tree.CatalogTree;
import com.example.catalog.tree.MongoCatalog;

import java.util.List;

/**
 * Decides what an identity may see. Implementations are immutable and may be shared between any number
 * of catalog views.
 */
public interface AccessPolicy {

    /**
     * Whether this policy knows how to restrict {@code catalog}.
     */
    boolean checkCompatibility(CatalogTree<?> catalog);

    /**
     * Queries to run on behalf of {@code identity}, derived from the catalog's stored queries. Called on
     * every read; the input list is never modified.
     */
    List<CatalogQuery> modifyQueries(List<CatalogQuery> queries, Identity identity);

    /**
     * A new catalog with the same queries as {@code catalog}, bound to {@code identity}.
     */
    MongoCatalog filterResults(MongoCatalog catalog, Identity identity);
}
