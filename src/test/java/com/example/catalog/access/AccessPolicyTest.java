package com.example.catalog.access;

import com.example.catalog.persistence.dao.CatalogCollections;
import com.example.catalog.persistence.dao.InMemoryDocumentCollection;
import com.example.catalog.query.CatalogQuery;
import com.example.catalog.query.FullText;
import com.example.catalog.query.RawMongo;
import com.example.catalog.tree.MongoCatalog;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AccessPolicyTest {

    private final AllowListAccessPolicy policy = new AllowListAccessPolicy(Map.of(
            "alice", List.of("B", "A"),
            "bob", List.of("B"),
            "carol", List.of(AllowListAccessPolicy.ALL)));

    private final List<CatalogQuery> queries = List.of(new FullText("dark"));

    @Test
    void restrictedIdentityGetsUidFilterAppended() {
        List<CatalogQuery> modified = policy.modifyQueries(queries, Identity.of("alice"));

        assertThat(modified).hasSize(2).startsWith(new FullText("dark"));
        assertThat(((RawMongo) modified.get(1)).start())
                .isEqualTo(new Document("uid", new Document("$in", List.of("A", "B"))));
        assertThat(queries).hasSize(1);
    }

    @Test
    void unknownIdentitySeesNothing() {
        List<CatalogQuery> modified = policy.modifyQueries(List.of(), Identity.of("mallory"));

        assertThat(((RawMongo) modified.get(0)).start())
                .isEqualTo(new Document("uid", new Document("$in", List.of())));
    }

    @Test
    void adminAndWildcardIdentitiesAreUnrestricted() {
        assertThat(policy.modifyQueries(queries, Identity.ADMIN)).isSameAs(queries);
        assertThat(policy.modifyQueries(queries, Identity.of("carol"))).isSameAs(queries);
    }

    @Test
    void adminIsNotARegularIdentityNamedAdmin() {
        assertThat(Identity.of("admin")).isNotEqualTo(Identity.ADMIN);
        assertThat(policy.modifyQueries(queries, Identity.of("admin"))).hasSize(2);
    }

    @Test
    void exposesAllowedUids() {
        assertThat(policy.allowed("alice")).containsExactly("A", "B");
        assertThat(policy.allowed("nobody")).isEmpty();
    }

    @Test
    void filterResultsBindsIdentityAndKeepsQueries() {
        MongoCatalog catalog = MongoCatalog.builder(collections()).queries(queries).build();

        MongoCatalog bound = policy.filterResults(catalog, Identity.of("bob"));

        assertThat(bound).isNotSameAs(catalog);
        assertThat(bound.identity()).isEqualTo(Identity.of("bob"));
        assertThat(bound.queries()).isEqualTo(queries);
        assertThat(catalog.identity()).isNull();
    }

    @Test
    void unrestrictedPolicyOnlyBindsIdentity() {
        UnrestrictedAccessPolicy unrestricted = new UnrestrictedAccessPolicy();
        MongoCatalog catalog = MongoCatalog.builder(collections()).build();

        assertThat(unrestricted.modifyQueries(queries, Identity.of("bob"))).isSameAs(queries);
        assertThat(unrestricted.checkCompatibility(catalog)).isTrue();
        assertThat(unrestricted.filterResults(catalog, Identity.of("bob")).identity()).isEqualTo(Identity.of("bob"));
    }

    private static CatalogCollections collections() {
        return new CatalogCollections(
                new InMemoryDocumentCollection(CatalogCollections.RUN_START),
                new InMemoryDocumentCollection(CatalogCollections.RUN_STOP),
                new InMemoryDocumentCollection(CatalogCollections.EVENT_DESCRIPTOR),
                new InMemoryDocumentCollection(CatalogCollections.EVENT));
    }
}
