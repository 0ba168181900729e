package com.example.catalog.tree;

import com.example.catalog.array.RemoteBlockArray;
import com.example.catalog.persistence.entity.DescriptorDoc;
import com.example.catalog.persistence.entity.FieldSpec;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * A named stream of events within a run. Maps each field of the stream to a lazily built array whose
 * first axis runs over {@code seq_num} up to {@link #cutoffSeqNum()}.
 * <p>
 * The descriptors of one stream are assumed to declare the same fields; only the first one is read.
 */
public class EventStream extends InMemoryTree<RemoteBlockArray> {
    private final String runStartUid;
    private final String streamName;
    private final List<DescriptorDoc> descriptors;
    private final long cutoffSeqNum;

    private EventStream(String runStartUid,
                        String streamName,
                        List<DescriptorDoc> descriptors,
                        long cutoffSeqNum,
                        LazyNode<RemoteBlockArray> fields) {
        super(fields, metadata(streamName, descriptors));
        this.runStartUid = runStartUid;
        this.streamName = streamName;
        this.descriptors = descriptors;
        this.cutoffSeqNum = cutoffSeqNum;
    }

    /**
     * @param arrays builds the array of one field; called at most once per field, on first access
     */
    public static EventStream construct(String runStartUid,
                                        String streamName,
                                        List<DescriptorDoc> descriptors,
                                        long cutoffSeqNum,
                                        BiFunction<String, FieldSpec, RemoteBlockArray> arrays) {
        if (descriptors.isEmpty()) {
            throw new EmptyStreamException(runStartUid, streamName);
        }
        Map<String, Supplier<Mono<RemoteBlockArray>>> thunks = new LinkedHashMap<>();
        descriptors.get(0).dataKeys().forEach((field, spec) ->
                thunks.put(field, () -> Mono.fromCallable(() -> arrays.apply(field, spec))));
        return new EventStream(runStartUid, streamName, List.copyOf(descriptors), cutoffSeqNum,
                new LazyNode<>(thunks));
    }

    public String runStartUid() {
        return runStartUid;
    }

    public String streamName() {
        return streamName;
    }

    public List<DescriptorDoc> descriptors() {
        return descriptors;
    }

    /**
     * Highest {@code seq_num} seen when the stream was opened. Events appended later are not visible.
     */
    public long cutoffSeqNum() {
        return cutoffSeqNum;
    }

    private static Map<String, Object> metadata(String streamName, List<DescriptorDoc> descriptors) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("stream_name", streamName);
        m.put("descriptors", descriptors.stream().map(DescriptorDoc::raw).toList());
        return m;
    }

    @Override
    public String toString() {
        return "EventStream{run=" + runStartUid + ", name=" + streamName + "}";
    }
}
