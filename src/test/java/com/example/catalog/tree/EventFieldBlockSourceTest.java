package com.example.catalog.tree;

import com.example.catalog.array.DataType;
import com.example.catalog.persistence.dao.InMemoryDocumentCollection;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventFieldBlockSourceTest {

    private final InMemoryDocumentCollection events = new InMemoryDocumentCollection("event");

    private EventFieldBlockSource source(String field, DataType dtype) {
        return new EventFieldBlockSource("R/primary/" + field, events, List.of("d1"), field, dtype, 4, 10);
    }

    private void event(long seq, Document data) {
        events.insert(new Document("descriptor", "d1").append("seq_num", seq).append("data", data));
    }

    @Test
    void integerFlagsAreStoredAsBooleans() {
        event(1, new Document("shutter", 1));
        event(2, new Document("shutter", 0));
        event(3, new Document("shutter", true));

        StepVerifier.create(source("shutter", DataType.BOOL).fetch(new int[]{0}, new int[]{4}))
                .assertNext(bytes -> assertThat(bytes).containsExactly(1, 0, 1, 0))
                .verifyComplete();
    }

    @Test
    void oversizedBlockFailsOnSubscribe() {
        event(1, new Document("img", 1.0));

        StepVerifier.create(source("img", DataType.FLOAT64).fetch(new int[]{0}, new int[]{4, 1 << 16, 1 << 16}))
                .expectError(ArithmeticException.class)
                .verify();
        assertThat(events.findCalls()).isZero();
    }
}
