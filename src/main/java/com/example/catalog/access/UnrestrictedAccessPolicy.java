package com.example.catalog.access;

import com.example.catalog.query.CatalogQuery;
import com.example.catalog.tree.CatalogTree;
import com.example.catalog.tree.MongoCatalog;

import java.util.List;

/**
 * Imposes no restrictions; only binds identities.
 */
public final class UnrestrictedAccessPolicy implements AccessPolicy {

    @Override
    public boolean checkCompatibility(CatalogTree<?> catalog) {
        return catalog instanceof MongoCatalog;
    }

    @Override
    public List<CatalogQuery> modifyQueries(List<CatalogQuery> queries, Identity identity) {
        return queries;
    }

    @Override
    public MongoCatalog filterResults(MongoCatalog catalog, Identity identity) {
        return catalog.withChanges().identity(identity).build();
    }

    @Override
    public String toString() {
        return "UnrestrictedAccessPolicy";
    }
}
