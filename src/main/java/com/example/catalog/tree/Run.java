package com.example.catalog.tree;

import org.bson.Document;
import reactor.core.publisher.Flux;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One run: its start document, its stop document once it ended, and its event streams by name.
 */
public class Run extends InMemoryTree<EventStream> {
    private final String uid;
    private final Document start;
    private final Document stop;

    Run(Document start, Document stop, LazyNode<EventStream> streams) {
        super(streams, metadata(start, stop));
        this.uid = start.getString("uid");
        this.start = start;
        this.stop = stop;
    }

    public String uid() {
        return uid;
    }

    public Document start() {
        return start;
    }

    /**
     * Empty while the run is in progress.
     */
    public Optional<Document> stop() {
        return Optional.ofNullable(stop);
    }

    public boolean isComplete() {
        return stop != null;
    }

    /**
     * The run's documents in order, as (type, document) pairs.
     */
    public Flux<Map.Entry<String, Document>> documents() {
        Flux<Map.Entry<String, Document>> startDoc = Flux.just(Map.entry("start", start));
        if (stop == null) {
            return startDoc;
        }
        return startDoc.concatWith(Flux.just(Map.entry("stop", stop)));
    }

    private static Map<String, Object> metadata(Document start, Document stop) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("start", start);
        m.put("stop", stop);
        return m;
    }

    @Override
    public String toString() {
        return "Run{uid=" + uid + "}";
    }
}
