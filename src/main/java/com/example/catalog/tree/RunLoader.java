package com.example.catalog.tree;

import com.example.catalog.array.ArrayStructure;
import com.example.catalog.array.DataType;
import com.example.catalog.array.RemoteBlockArray;
import com.example.catalog.persistence.dao.CatalogCollections;
import com.example.catalog.persistence.dao.ChunkedCursor;
import com.example.catalog.persistence.entity.DescriptorDoc;
import com.example.catalog.persistence.entity.FieldSpec;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Builds runs and their event streams from the metadata store.
 */
class RunLoader {
    private static final Logger log = LoggerFactory.getLogger(RunLoader.class);

    private final CatalogCollections collections;
    private final CatalogSettings settings;

    RunLoader(CatalogCollections collections, CatalogSettings settings) {
        this.collections = collections;
        this.settings = settings;
    }

    Mono<Run> run(Document runStart) {
        String uid = runStart.getString("uid");
        Mono<Optional<Document>> stop = collections.runStop()
                .findOne(new Document("run_start", uid))
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
        Mono<List<String>> streamNames = collections.eventDescriptor()
                .distinct("name", new Document("run_start", uid))
                .collectList();
        return Mono.zip(stop, streamNames)
                .map(t -> {
                    Map<String, Supplier<Mono<EventStream>>> thunks = new LinkedHashMap<>();
                    for (String name : t.getT2()) {
                        thunks.put(name, () -> eventStream(uid, name));
                    }
                    log.debug("run {}: streams={} complete={}", uid, t.getT2(), t.getT1().isPresent());
                    return new Run(runStart, t.getT1().orElse(null), new LazyNode<>(thunks));
                });
    }

    Mono<EventStream> eventStream(String runStartUid, String streamName) {
        Document filter = new Document("run_start", runStartUid).append("name", streamName);
        return new ChunkedCursor(collections.eventDescriptor(), settings.batchSize())
                .find(filter)
                .map(DescriptorDoc::from)
                .collectList()
                .flatMap(descriptors -> {
                    if (descriptors.isEmpty()) {
                        return Mono.error(new EmptyStreamException(runStartUid, streamName));
                    }
                    List<String> uids = descriptors.stream().map(DescriptorDoc::uid).toList();
                    return cutoffSeqNum(uids).map(cutoff -> EventStream.construct(
                            runStartUid, streamName, descriptors, cutoff,
                            (field, spec) -> fieldArray(runStartUid, streamName, uids, cutoff, field, spec)));
                });
    }

    /**
     * Highest seq_num over the events of these descriptors, fixed once so that every field of the stream
     * has the same length even while events keep arriving. seq_num may repeat, so this is not the
     * number of events.
     */
    private Mono<Long> cutoffSeqNum(List<String> descriptorUids) {
        List<Document> pipeline = List.of(
                new Document("$match", new Document("descriptor", new Document("$in", descriptorUids))),
                new Document("$group", new Document("_id", null)
                        .append("highest_seq_num", new Document("$max", "$seq_num")))
        );
        return collections.event().aggregate(pipeline)
                .next()
                .map(doc -> {
                    Object highest = doc.get("highest_seq_num");
                    return highest == null ? 0L : ((Number) highest).longValue();
                })
                .defaultIfEmpty(0L);
    }

    private RemoteBlockArray fieldArray(String runStartUid,
                                        String streamName,
                                        List<String> descriptorUids,
                                        long cutoff,
                                        String field,
                                        FieldSpec spec) {
        DataType dtype = DataType.parse(spec.dtype());
        List<Integer> shape = new ArrayList<>();
        List<Integer> blockShape = new ArrayList<>();
        shape.add(Math.toIntExact(cutoff));
        blockShape.add(settings.rowsPerBlock());
        for (int d : spec.shape()) {
            shape.add(d);
            blockShape.add(Math.max(1, d));
        }
        String key = runStartUid + "/" + streamName + "/" + field;
        EventFieldBlockSource source = new EventFieldBlockSource(key, collections.event(), descriptorUids,
                field, dtype, settings.rowsPerBlock(), settings.batchSize());
        return new RemoteBlockArray(ArrayStructure.regular(shape, blockShape, dtype), source,
                settings.fetchConcurrency());
    }
}
