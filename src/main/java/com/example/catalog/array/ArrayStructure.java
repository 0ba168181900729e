package com.example.catalog.array;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Shape, per-axis block lengths and element type of a chunked array. {@code chunks.get(a)} lists the
 * lengths of the blocks along axis {@code a}; they add up to {@code shape.get(a)}.
 */
public record ArrayStructure(List<Integer> shape, List<List<Integer>> chunks, DataType dtype) {

    public ArrayStructure {
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(chunks, "chunks");
        Objects.requireNonNull(dtype, "dtype");
        shape = List.copyOf(shape);
        chunks = chunks.stream().map(List::copyOf).toList();
        if (shape.size() != chunks.size()) {
            throw new IllegalArgumentException(
                    "shape has " + shape.size() + " axes but chunks has " + chunks.size());
        }
        for (int a = 0; a < shape.size(); a++) {
            List<Integer> axis = chunks.get(a);
            if (axis.isEmpty()) {
                throw new IllegalArgumentException("no blocks along axis " + a);
            }
            long sum = 0;
            for (int len : axis) {
                if (len < 0) {
                    throw new IllegalArgumentException("negative block length along axis " + a);
                }
                sum += len;
            }
            if (sum != shape.get(a)) {
                throw new IllegalArgumentException(
                        "blocks along axis " + a + " cover " + sum + " elements, shape says " + shape.get(a));
            }
        }
    }

    /**
     * Splits every axis into blocks of {@code blockShape}, the last block of an axis taking the remainder.
     */
    public static ArrayStructure regular(List<Integer> shape, List<Integer> blockShape, DataType dtype) {
        if (shape.size() != blockShape.size()) {
            throw new IllegalArgumentException("shape and blockShape differ in rank");
        }
        List<List<Integer>> chunks = new ArrayList<>(shape.size());
        for (int a = 0; a < shape.size(); a++) {
            int len = shape.get(a);
            int step = blockShape.get(a);
            if (step < 1) {
                throw new IllegalArgumentException("block length along axis " + a + " must be >= 1");
            }
            List<Integer> axis = new ArrayList<>();
            for (int off = 0; off < len; off += step) {
                axis.add(Math.min(step, len - off));
            }
            if (axis.isEmpty()) {
                axis.add(0);
            }
            chunks.add(axis);
        }
        return new ArrayStructure(shape, chunks, dtype);
    }

    public int ndim() {
        return shape.size();
    }

    public int[] shapeArray() {
        return shape.stream().mapToInt(Integer::intValue).toArray();
    }

    public int[] blockCounts() {
        return chunks.stream().mapToInt(List::size).toArray();
    }

    public int blockCount() {
        return Indexing.product(blockCounts());
    }

    public long elementCount() {
        long n = 1;
        for (int d : shape) {
            n *= d;
        }
        return n;
    }

    public int[] blockShape(int[] blockIndex) {
        checkBlockIndex(blockIndex);
        int[] out = new int[blockIndex.length];
        for (int a = 0; a < blockIndex.length; a++) {
            out[a] = chunks.get(a).get(blockIndex[a]);
        }
        return out;
    }

    /**
     * Position of the first element of block {@code i} along {@code axis}.
     */
    public int blockOffset(int axis, int i) {
        List<Integer> lengths = chunks.get(axis);
        int off = 0;
        for (int k = 0; k < i; k++) {
            off += lengths.get(k);
        }
        return off;
    }

    void checkBlockIndex(int[] blockIndex) {
        if (blockIndex.length != ndim()) {
            throw new IllegalArgumentException(
                    "block index has " + blockIndex.length + " axes, array has " + ndim());
        }
        for (int a = 0; a < blockIndex.length; a++) {
            if (blockIndex[a] < 0 || blockIndex[a] >= chunks.get(a).size()) {
                throw new IllegalArgumentException(
                        "block index " + blockIndex[a] + " out of range along axis " + a);
            }
        }
    }
}
