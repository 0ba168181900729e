package com.example.catalog.tree;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * A read-only, ordered mapping from string keys to lazily built values. Every level of the catalog
 * (the root catalog, a run, an event stream) implements it.
 */
public interface CatalogTree<V> {

    Map<String, Object> metadata();

    /**
     * Fails with {@link com.example.catalog.NotFoundException} if {@code key} is not present.
     */
    Mono<V> lookup(String key);

    Flux<String> keys();

    /**
     * Exact number of entries.
     */
    Mono<Long> length();

    /**
     * Approximate number of entries, possibly cheaper than {@link #length()}.
     */
    default Mono<Long> lengthHint() {
        return length();
    }

    Flux<String> keys(Slice slice);

    Flux<Map.Entry<String, V>> items(Slice slice);

    default Flux<V> values(Slice slice) {
        return items(slice).map(Map.Entry::getValue);
    }

    /**
     * Entry at {@code index}; negative indexes count from the end. Fails with
     * {@link com.example.catalog.IndexOutOfRangeException} when out of range.
     */
    Mono<Map.Entry<String, V>> itemAt(long index);

    default Mono<String> keyAt(long index) {
        return itemAt(index).map(Map.Entry::getKey);
    }

    default Mono<V> valueAt(long index) {
        return itemAt(index).map(Map.Entry::getValue);
    }
}
