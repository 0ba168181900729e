package com.example.catalog.tree;

import com.example.catalog.array.BlockSource;
import com.example.catalog.array.DataType;
import com.example.catalog.persistence.dao.ChunkedCursor;
import com.example.catalog.persistence.dao.DocumentCollection;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;

/**
 * Serves the blocks of one field of an event stream straight from the event collection. Row {@code r}
 * of the array holds {@code data.<field>} of the event with {@code seq_num == r + 1}; only the first
 * axis is split into blocks.
 * <p>
 * When a {@code seq_num} repeats, the most recently inserted event wins. Rows without an event are zero.
 */
class EventFieldBlockSource implements BlockSource {
    private static final Logger log = LoggerFactory.getLogger(EventFieldBlockSource.class);

    private final String key;
    private final DocumentCollection events;
    private final List<String> descriptorUids;
    private final String field;
    private final DataType dtype;
    private final int rowsPerBlock;
    private final int batchSize;

    EventFieldBlockSource(String key,
                          DocumentCollection events,
                          List<String> descriptorUids,
                          String field,
                          DataType dtype,
                          int rowsPerBlock,
                          int batchSize) {
        this.key = key;
        this.events = events;
        this.descriptorUids = List.copyOf(descriptorUids);
        this.field = field;
        this.dtype = dtype;
        this.rowsPerBlock = rowsPerBlock;
        this.batchSize = batchSize;
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public Mono<byte[]> fetch(int[] blockIndex, int[] blockShape) {
        long firstSeq = (long) blockIndex[0] * rowsPerBlock + 1;
        int rows = blockShape[0];
        Document filter = new Document("descriptor", new Document("$in", descriptorUids))
                .append("seq_num", new Document("$gte", firstSeq).append("$lte", firstSeq + rows - 1));
        log.debug("{}: fetching seq_num {}..{}", key, firstSeq, firstSeq + rows - 1);
        return Mono.defer(() -> {
            int rowElements = 1;
            for (int a = 1; a < blockShape.length; a++) {
                rowElements = Math.multiplyExact(rowElements, blockShape[a]);
            }
            int perRow = rowElements;
            ByteBuffer buf = ByteBuffer.allocate(Math.multiplyExact(Math.multiplyExact(rows, perRow), dtype.itemSize()))
                    .order(ByteOrder.LITTLE_ENDIAN);
            return new ChunkedCursor(events, batchSize).find(filter)
                    .doOnNext(event -> writeRow(buf, event, firstSeq, perRow))
                    .then(Mono.fromSupplier(buf::array));
        });
    }

    private void writeRow(ByteBuffer buf, Document event, long firstSeq, int rowElements) {
        int row = (int) (((Number) event.get("seq_num")).longValue() - firstSeq);
        Document data = event.get("data", Document.class);
        Object value = data == null ? null : data.get(field);
        if (value == null) {
            return;
        }
        int count = count(value);
        if (count != rowElements) {
            throw new IllegalArgumentException("event seq_num=" + event.get("seq_num") + " has " + count
                    + " elements for field " + field + ", expected " + rowElements);
        }
        buf.position(row * rowElements * dtype.itemSize());
        write(buf, value);
    }

    private static int count(Object value) {
        if (value instanceof List<?> list) {
            int n = 0;
            for (Object v : list) {
                n += count(v);
            }
            return n;
        }
        return 1;
    }

    private void write(ByteBuffer buf, Object value) {
        if (value instanceof List<?> list) {
            for (Object v : list) {
                write(buf, v);
            }
            return;
        }
        dtype.write(buf, value);
    }
}
