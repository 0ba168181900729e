package com.example.catalog.remote;

import com.example.catalog.array.ArrayData;
import com.example.catalog.array.BlockFetchException;
import com.example.catalog.array.DataType;
import com.example.catalog.array.RemoteBlockArray;
import com.example.catalog.config.CatalogProperties;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class RemoteArrayClientTest {

    private static final String METADATA = """
            {"shape": [4], "chunks": [[2, 2]], "dtype": "<f8", "extra": "ignored"}
            """;

    private final List<String> requests = new CopyOnWriteArrayList<>();

    private RemoteArrayClient client(Function<ClientRequest, ClientResponse> handler) {
        ExchangeFunction exchange = request -> {
            String query = request.url().getRawQuery();
            requests.add(request.url().getRawPath() + (query == null ? "" : "?" + query));
            return Mono.just(handler.apply(request));
        };
        WebClient wc = WebClient.builder()
                .baseUrl("http://arrays.test")
                .exchangeFunction(exchange)
                .build();
        return new RemoteArrayClient(wc, properties());
    }

    private static CatalogProperties properties() {
        return new CatalogProperties(
                null,
                new CatalogProperties.Cursor(100),
                new CatalogProperties.ArrayOptions(100, 2),
                new CatalogProperties.Access(CatalogProperties.PolicyKind.NONE, Map.of()),
                new CatalogProperties.Remote("http://arrays.test", 2000));
    }

    private static ClientResponse json(String body) {
        return ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    private static ClientResponse bytes(byte[] body) {
        DataBuffer buffer = DefaultDataBufferFactory.sharedInstance.wrap(body);
        return ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_OCTET_STREAM_VALUE)
                .body(Flux.just(buffer))
                .build();
    }

    private static ClientResponse status(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_PLAIN_VALUE)
                .body(body)
                .build();
    }

    private static byte[] doubles(double... values) {
        ByteBuffer buf = ByteBuffer.allocate(values.length * 8).order(ByteOrder.LITTLE_ENDIAN);
        for (double v : values) {
            buf.putDouble(v);
        }
        return buf.array();
    }

    @Test
    void opensArrayFromMetadataAndReadsBlocks() {
        RemoteArrayClient client = client(req -> {
            String path = req.url().getRawPath();
            if (path.startsWith("/metadata/")) {
                return json(METADATA);
            }
            String block = req.url().getRawQuery();
            return block.equals("block=0") ? bytes(doubles(1, 2)) : bytes(doubles(3, 4));
        });

        RemoteBlockArray array = client.open(List.of("raw", "scan 1", "det")).block();

        assertThat(array.shape()).containsExactly(4);
        assertThat(array.dtype()).isEqualTo(DataType.FLOAT64);
        assertThat(array.key()).isEqualTo("raw/scan 1/det");
        assertThat(requests).containsExactly("/metadata/raw/scan%201/det");

        ArrayData data = array.materialize().block();
        assertThat(data.toDoubleArray()).containsExactly(1, 2, 3, 4);
        assertThat(requests).contains("/array/block/raw/scan%201/det?block=0", "/array/block/raw/scan%201/det?block=1");
    }

    @Test
    void clientErrorIsFinal() {
        AtomicInteger calls = new AtomicInteger();
        RemoteArrayClient client = client(req -> {
            calls.incrementAndGet();
            return status(HttpStatus.NOT_FOUND, "no such array");
        });

        StepVerifier.create(client.structure(List.of("missing")))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(RemoteApiException.class).hasMessageContaining("no such array");
                    assertThat(((RemoteApiException) e).status()).isEqualTo(404);
                    assertThat(((RemoteApiException) e).path()).isEqualTo("/metadata/missing");
                    assertThat(e).hasMessage("/metadata/missing answered 404: no such array");
                })
                .verify();
        assertThat(calls).hasValue(1);
    }

    @Test
    void serverErrorIsRetried() {
        AtomicInteger calls = new AtomicInteger();
        RemoteArrayClient client = client(req -> calls.incrementAndGet() == 1
                ? status(HttpStatus.SERVICE_UNAVAILABLE, "busy")
                : bytes(doubles(7, 8)));

        StepVerifier.create(client.block(List.of("a"), new int[]{0}))
                .assertNext(b -> assertThat(b).hasSize(16))
                .verifyComplete();
        assertThat(calls).hasValue(2);
    }

    @Test
    void failingBlockFailsTheArrayRead() {
        RemoteArrayClient client = client(req -> {
            if (req.url().getRawPath().startsWith("/metadata/")) {
                return json(METADATA);
            }
            return req.url().getRawQuery().equals("block=1")
                    ? status(HttpStatus.FORBIDDEN, "denied")
                    : bytes(doubles(1, 2));
        });

        StepVerifier.create(client.open(List.of("a")).flatMap(RemoteBlockArray::materialize))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(BlockFetchException.class)
                        .hasCauseInstanceOf(RemoteApiException.class))
                .verify();
    }

    @Test
    void transientStatuses() {
        assertThat(RetryUtil.isTransient(new RemoteApiException(429, "/array/block/a", ""))).isTrue();
        assertThat(RetryUtil.isTransient(new RemoteApiException(502, "/array/block/a", ""))).isTrue();
        assertThat(RetryUtil.isTransient(new RemoteApiException(400, "/array/block/a", ""))).isFalse();
        assertThat(RetryUtil.isTransient(new IllegalStateException())).isFalse();
    }
}
