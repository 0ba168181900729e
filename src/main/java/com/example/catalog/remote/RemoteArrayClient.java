package com.example.catalog.remote;

import com.example.catalog.array.ArrayStructure;
import com.example.catalog.array.BlockSource;
import com.example.catalog.array.RemoteBlockArray;
import com.example.catalog.config.CatalogProperties;
import com.example.catalog.remote.dto.ArrayStructureResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Client of a remote array service: {@code GET /metadata/{path}} describes an array,
 * {@code GET /array/block/{path}?block=i,j,...} returns the raw bytes of one block.
 */
public class RemoteArrayClient {
    private static final Logger log = LoggerFactory.getLogger(RemoteArrayClient.class);

    private final WebClient wc;
    private final CatalogProperties props;

    public RemoteArrayClient(WebClient remoteArrayWebClient, CatalogProperties props) {
        this.wc = remoteArrayWebClient;
        this.props = props;
    }

    private Duration timeout() {
        return Duration.ofMillis(props.remote().timeoutMs());
    }

    /**
     * Array at {@code path}, described by one metadata request; no block is fetched.
     */
    public Mono<RemoteBlockArray> open(List<String> path) {
        List<String> segments = List.copyOf(path);
        return structure(segments)
                .map(structure -> new RemoteBlockArray(structure, new HttpBlockSource(segments),
                        props.arrays().fetchConcurrency()));
    }

    public Mono<ArrayStructure> structure(List<String> path) {
        return RetryUtil.withRemoteRetry(wc.get()
                        .uri(b -> b.pathSegment("metadata").pathSegment(path.toArray(String[]::new)).build())
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .onStatus(HttpStatusCode::isError, this::toRemoteError)
                        .bodyToMono(ArrayStructureResponse.class)
                        .timeout(timeout()))
                .map(ArrayStructureResponse::toStructure);
    }

    public Mono<byte[]> block(List<String> path, int[] blockIndex) {
        String block = Arrays.stream(blockIndex).mapToObj(Integer::toString).collect(Collectors.joining(","));
        return RetryUtil.withRemoteRetry(wc.get()
                .uri(b -> b.pathSegment("array", "block")
                        .pathSegment(path.toArray(String[]::new))
                        .queryParam("block", block)
                        .build())
                .accept(MediaType.APPLICATION_OCTET_STREAM)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toRemoteError)
                .bodyToMono(byte[].class)
                .timeout(timeout()));
    }

    private Mono<? extends Throwable> toRemoteError(ClientResponse resp) {
        return resp.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.error(new RemoteApiException(
                        resp.statusCode().value(), resp.request().getURI().getRawPath(), body)));
    }

    private final class HttpBlockSource implements BlockSource {
        private final List<String> path;

        HttpBlockSource(List<String> path) {
            this.path = path;
        }

        @Override
        public String key() {
            return String.join("/", path);
        }

        @Override
        public Mono<byte[]> fetch(int[] blockIndex, int[] blockShape) {
            log.debug("fetching block {} of {}", Arrays.toString(blockIndex), key());
            return block(path, blockIndex);
        }
    }
}
