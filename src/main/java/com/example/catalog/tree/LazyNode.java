package com.example.catalog.tree;

import com.example.catalog.NotFoundException;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Ordered key to value container whose values are computed on first access and kept afterwards.
 * Listing keys never evaluates anything. A successful evaluation is never repeated; a failed one is
 * attempted again on the next access. Callers that ask for the same key while it is being evaluated
 * share that single evaluation.
 */
public final class LazyNode<V> {
    private final Map<String, Slot<V>> slots;

    public LazyNode(Map<String, ? extends Supplier<Mono<V>>> thunks) {
        Map<String, Slot<V>> m = new LinkedHashMap<>();
        thunks.forEach((k, thunk) -> m.put(k, new Slot<>(k, thunk)));
        this.slots = Collections.unmodifiableMap(m);
    }

    public List<String> keys() {
        return List.copyOf(slots.keySet());
    }

    public int size() {
        return slots.size();
    }

    public boolean containsKey(String key) {
        return slots.containsKey(key);
    }

    public boolean isEvaluated(String key) {
        Slot<V> slot = slots.get(key);
        return slot != null && slot.evaluated;
    }

    public Mono<V> get(String key) {
        Slot<V> slot = slots.get(key);
        if (slot == null) {
            return Mono.error(new NotFoundException(key));
        }
        return slot.get();
    }

    private static final class Slot<V> {
        private final String key;
        private final Supplier<Mono<V>> thunk;
        private final AtomicReference<Mono<V>> memo = new AtomicReference<>();
        private volatile boolean evaluated;

        Slot(String key, Supplier<Mono<V>> thunk) {
            this.key = key;
            this.thunk = thunk;
        }

        Mono<V> get() {
            return Mono.defer(() -> {
                Mono<V> current = memo.get();
                if (current == null) {
                    Mono<V> fresh = Mono.defer(thunk)
                            .switchIfEmpty(Mono.error(() -> new IllegalStateException("no value for " + key)))
                            .doOnNext(v -> evaluated = true)
                            .cache();
                    current = memo.compareAndSet(null, fresh) ? fresh : memo.get();
                }
                Mono<V> mine = current;
                // drop a failed evaluation so the next access retries
                return mine.doOnError(e -> memo.compareAndSet(mine, null));
            });
        }
    }
}
