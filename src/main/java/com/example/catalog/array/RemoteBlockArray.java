package com.example.catalog.array;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * N-dimensional array whose blocks are fetched on demand from a {@link BlockSource}. Nothing is fetched
 * until {@link #materialize()}, {@link #slice(Region)} or {@link #block(int...)} is subscribed to.
 * <p>
 * A read fans out one fetch per needed block, at most {@code concurrency} at a time, and assembles the
 * result only once every fetch succeeded. The first failure cancels the outstanding fetches and the read
 * fails with {@link BlockFetchException}; a partially filled array is never emitted.
 */
public class RemoteBlockArray {
    private static final Logger log = LoggerFactory.getLogger(RemoteBlockArray.class);

    public static final int DEFAULT_CONCURRENCY = 4;

    private final ArrayStructure structure;
    private final BlockSource source;
    private final int concurrency;

    public RemoteBlockArray(ArrayStructure structure, BlockSource source) {
        this(structure, source, DEFAULT_CONCURRENCY);
    }

    public RemoteBlockArray(ArrayStructure structure, BlockSource source, int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        this.structure = Objects.requireNonNull(structure, "structure");
        this.source = Objects.requireNonNull(source, "source");
        this.concurrency = concurrency;
    }

    public ArrayStructure structure() {
        return structure;
    }

    public List<Integer> shape() {
        return structure.shape();
    }

    public List<List<Integer>> chunks() {
        return structure.chunks();
    }

    public DataType dtype() {
        return structure.dtype();
    }

    public String key() {
        return source.key();
    }

    public int blockCount() {
        return structure.blockCount();
    }

    /**
     * Every block index, row-major.
     */
    public List<int[]> blockIndices() {
        return Indexing.collect(new int[structure.ndim()], structure.blockCounts());
    }

    public Mono<ArrayData> block(int... blockIndex) {
        int[] index = blockIndex.clone();
        structure.checkBlockIndex(index);
        return fetch(index).map(b -> new ArrayData(structure.blockShape(index), dtype(), b.data()));
    }

    public Mono<ArrayData> materialize() {
        return slice(Region.all());
    }

    /**
     * Fetches only the blocks that intersect {@code region} and assembles the selected sub-array.
     */
    public Mono<ArrayData> slice(Region region) {
        int[][] bounds = region.resolve(structure.shapeArray());
        int[] start = bounds[0];
        int[] stop = bounds[1];
        int[] outShape = new int[start.length];
        for (int a = 0; a < start.length; a++) {
            outShape[a] = stop[a] - start[a];
        }
        if (Indexing.product(outShape) == 0) {
            return Mono.just(new ArrayData(outShape, dtype(), new byte[0]));
        }
        List<int[]> needed = coveringBlocks(start, stop);
        log.debug("{}: reading {} of {} blocks", key(), needed.size(), blockCount());
        return Flux.fromIterable(needed)
                .flatMapSequential(this::fetch, concurrency)
                .collectList()
                .map(blocks -> assemble(blocks, start, stop, outShape));
    }

    private List<int[]> coveringBlocks(int[] start, int[] stop) {
        int n = start.length;
        int[] lo = new int[n];
        int[] hi = new int[n];
        for (int a = 0; a < n; a++) {
            List<Integer> lengths = structure.chunks().get(a);
            int off = 0;
            lo[a] = -1;
            for (int i = 0; i < lengths.size(); i++) {
                int end = off + lengths.get(i);
                if (lo[a] < 0 && end > start[a]) {
                    lo[a] = i;
                }
                if (off < stop[a]) {
                    hi[a] = i + 1;
                }
                off = end;
            }
        }
        return Indexing.collect(lo, hi);
    }

    private Mono<Block> fetch(int[] index) {
        int[] blockShape = structure.blockShape(index);
        return Mono.defer(() -> {
                    int expected = Math.multiplyExact(Indexing.product(blockShape), dtype().itemSize());
                    return source.fetch(index.clone(), blockShape.clone())
                            .switchIfEmpty(Mono.error(() -> new BlockFetchException(key(), index, "no data returned")))
                            .map(bytes -> checked(index, expected, bytes));
                })
                .onErrorMap(e -> !(e instanceof BlockFetchException), e -> new BlockFetchException(key(), index, e))
                .doOnError(e -> log.warn("{}", e.getMessage()));
    }

    private Block checked(int[] index, int expected, byte[] bytes) {
        if (bytes.length != expected) {
            throw new BlockFetchException(key(), index, "expected " + expected + " bytes, got " + bytes.length);
        }
        return new Block(index, bytes);
    }

    private ArrayData assemble(List<Block> blocks, int[] start, int[] stop, int[] outShape) {
        int n = start.length;
        int item = dtype().itemSize();
        byte[] out = new byte[Math.multiplyExact(Indexing.product(outShape), item)];
        int[] outStrides = Indexing.strides(outShape);
        for (Block block : blocks) {
            int[] blockShape = structure.blockShape(block.index());
            int[] blockStrides = Indexing.strides(blockShape);
            int[] origin = new int[n];
            int[] lo = new int[n];
            int[] hi = new int[n];
            for (int a = 0; a < n; a++) {
                origin[a] = structure.blockOffset(a, block.index()[a]);
                lo[a] = Math.max(start[a], origin[a]);
                hi[a] = Math.min(stop[a], origin[a] + blockShape[a]);
            }
            if (n == 0) {
                System.arraycopy(block.data(), 0, out, 0, item);
                continue;
            }
            // copy contiguous runs along the last axis
            int last = n - 1;
            int run = (hi[last] - lo[last]) * item;
            int[] rowHi = hi.clone();
            rowHi[last] = lo[last] + 1;
            Indexing.forEach(lo, rowHi, idx -> {
                int src = 0;
                int dst = 0;
                for (int a = 0; a < n; a++) {
                    src += (idx[a] - origin[a]) * blockStrides[a];
                    dst += (idx[a] - start[a]) * outStrides[a];
                }
                System.arraycopy(block.data(), src * item, out, dst * item, run);
            });
        }
        return new ArrayData(outShape, dtype(), out);
    }

    @Override
    public String toString() {
        return "RemoteBlockArray{key=" + key() + ", shape=" + shape() + ", dtype=" + dtype() + "}";
    }

    private record Block(int[] index, byte[] data) {
    }
}
