package com.example.catalog.access;

import com.example.catalog.query.CatalogQuery;
import com.example.catalog.query.RawMongo;
import com.example.catalog.tree.CatalogTree;
import com.example.catalog.tree.MongoCatalog;
import org.bson.Document;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps identity names to the run uids they may see. {@link Identity#ADMIN} sees everything; an identity
 * whose list contains {@link #ALL} sees everything too; an identity with no entry sees nothing.
 *
 * <pre>
 * new AllowListAccessPolicy(Map.of("alice", List.of("A", "B"), "bob", List.of("B")))
 * </pre>
 */
public final class AllowListAccessPolicy implements AccessPolicy {
    public static final String ALL = "*";

    private final Map<String, Set<String>> accessLists;
    private final Set<String> unrestricted;

    public AllowListAccessPolicy(Map<String, ? extends Collection<String>> accessLists) {
        Map<String, Set<String>> lists = new HashMap<>();
        Set<String> all = new HashSet<>();
        accessLists.forEach((name, uids) -> {
            if (uids.contains(ALL)) {
                all.add(name);
            } else {
                // sorted so the generated filter is stable
                lists.put(name, Collections.unmodifiableSet(new TreeSet<>(uids)));
            }
        });
        this.accessLists = Collections.unmodifiableMap(lists);
        this.unrestricted = Collections.unmodifiableSet(all);
    }

    @Override
    public boolean checkCompatibility(CatalogTree<?> catalog) {
        return catalog instanceof MongoCatalog;
    }

    @Override
    public List<CatalogQuery> modifyQueries(List<CatalogQuery> queries, Identity identity) {
        if (identity != null && (identity.administrative() || unrestricted.contains(identity.name()))) {
            return queries;
        }
        Set<String> allowed = identity == null ? Set.of() : accessLists.getOrDefault(identity.name(), Set.of());
        List<CatalogQuery> modified = new ArrayList<>(queries);
        modified.add(new RawMongo(new Document("uid", new Document("$in", new ArrayList<>(allowed)))));
        return modified;
    }

    @Override
    public MongoCatalog filterResults(MongoCatalog catalog, Identity identity) {
        return catalog.withChanges().identity(identity).build();
    }

    public Set<String> allowed(String name) {
        return accessLists.getOrDefault(name, Set.of());
    }

    @Override
    public String toString() {
        return "AllowListAccessPolicy{identities=" + (accessLists.size() + unrestricted.size()) + "}";
    }
}
