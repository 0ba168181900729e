package com.example.catalog.tree;

import com.example.catalog.NotFoundException;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

class LazyNodeTest {

    @Test
    void listingKeysEvaluatesNothing() {
        AtomicInteger calls = new AtomicInteger();
        Map<String, Supplier<Mono<String>>> thunks = new LinkedHashMap<>();
        thunks.put("b", () -> Mono.fromCallable(() -> "B" + calls.incrementAndGet()));
        thunks.put("a", () -> Mono.fromCallable(() -> "A" + calls.incrementAndGet()));
        LazyNode<String> node = new LazyNode<>(thunks);

        assertThat(node.keys()).containsExactly("b", "a");
        assertThat(node.size()).isEqualTo(2);
        assertThat(node.containsKey("a")).isTrue();
        assertThat(node.isEvaluated("a")).isFalse();
        assertThat(calls).hasValue(0);
    }

    @Test
    void valueIsComputedOnce() {
        AtomicInteger calls = new AtomicInteger();
        LazyNode<Integer> node = new LazyNode<>(Map.of("x", () -> Mono.fromCallable(calls::incrementAndGet)));

        StepVerifier.create(node.get("x")).expectNext(1).verifyComplete();
        StepVerifier.create(node.get("x")).expectNext(1).verifyComplete();
        assertThat(calls).hasValue(1);
        assertThat(node.isEvaluated("x")).isTrue();
    }

    @Test
    void concurrentCallersShareOneEvaluation() {
        AtomicInteger calls = new AtomicInteger();
        LazyNode<Integer> node = new LazyNode<>(Map.of("x", () -> Mono.fromCallable(calls::incrementAndGet)
                .delayElement(Duration.ofMillis(50))));

        StepVerifier.create(Mono.zip(
                        node.get("x").subscribeOn(Schedulers.parallel()),
                        node.get("x").subscribeOn(Schedulers.parallel())))
                .assertNext(t -> assertThat(t.getT1()).isEqualTo(t.getT2()).isEqualTo(1))
                .verifyComplete();
        assertThat(calls).hasValue(1);
    }

    @Test
    void failureIsRetriedOnNextAccess() {
        AtomicInteger calls = new AtomicInteger();
        LazyNode<String> node = new LazyNode<>(Map.of("x", () -> Mono.fromCallable(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("store unavailable");
            }
            return "ok";
        })));

        StepVerifier.create(node.get("x")).expectErrorMessage("store unavailable").verify();
        assertThat(node.isEvaluated("x")).isFalse();
        StepVerifier.create(node.get("x")).expectNext("ok").verifyComplete();
        assertThat(calls).hasValue(2);
    }

    @Test
    void emptyThunkIsAnError() {
        LazyNode<String> node = new LazyNode<>(Map.of("x", Mono::empty));

        StepVerifier.create(node.get("x")).expectError(IllegalStateException.class).verify();
    }

    @Test
    void missingKeyFails() {
        LazyNode<String> node = new LazyNode<>(Map.of());

        StepVerifier.create(node.get("nope")).expectError(NotFoundException.class).verify();
    }
}
