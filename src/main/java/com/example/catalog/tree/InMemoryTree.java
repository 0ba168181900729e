package com.example.catalog.tree;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link CatalogTree} over a {@link LazyNode} whose keys are all known up front.
 */
public abstract class InMemoryTree<V> implements CatalogTree<V> {
    private final LazyNode<V> node;
    private final Map<String, Object> metadata;

    protected InMemoryTree(LazyNode<V> node, Map<String, Object> metadata) {
        this.node = node;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    protected LazyNode<V> node() {
        return node;
    }

    @Override
    public Map<String, Object> metadata() {
        return metadata;
    }

    @Override
    public Mono<V> lookup(String key) {
        return node.get(key);
    }

    @Override
    public Flux<String> keys() {
        return Flux.fromIterable(node.keys());
    }

    @Override
    public Mono<Long> length() {
        return Mono.just((long) node.size());
    }

    @Override
    public Flux<String> keys(Slice slice) {
        return Flux.fromIterable(sliceKeys(slice));
    }

    @Override
    public Flux<Map.Entry<String, V>> items(Slice slice) {
        return Flux.fromIterable(sliceKeys(slice))
                .concatMap(k -> node.get(k).map(v -> Map.entry(k, v)));
    }

    @Override
    public Mono<Map.Entry<String, V>> itemAt(long index) {
        return Mono.fromCallable(() -> node.keys().get((int) Slice.index(index, node.size())))
                .flatMap(k -> node.get(k).map(v -> Map.entry(k, v)));
    }

    private List<String> sliceKeys(Slice slice) {
        Slice.Bounds b = slice.resolve(node.size());
        return node.keys().subList((int) b.start(), (int) b.stop());
    }
}
