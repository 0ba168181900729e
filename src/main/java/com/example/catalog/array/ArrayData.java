package com.example.catalog.array;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A dense, fully fetched array: row-major little-endian element bytes.
 */
public final class ArrayData {
    private final int[] shape;
    private final DataType dtype;
    private final byte[] data;

    public ArrayData(int[] shape, DataType dtype, byte[] data) {
        this.shape = shape.clone();
        this.dtype = Objects.requireNonNull(dtype, "dtype");
        long expected = (long) Indexing.product(this.shape) * dtype.itemSize();
        if (data.length != expected) {
            throw new IllegalArgumentException(
                    "expected " + expected + " bytes for shape " + Arrays.toString(shape) + ", got " + data.length);
        }
        this.data = data;
    }

    public List<Integer> shape() {
        return Arrays.stream(shape).boxed().toList();
    }

    public DataType dtype() {
        return dtype;
    }

    public int size() {
        return Indexing.product(shape);
    }

    public byte[] bytes() {
        return data.clone();
    }

    public double getDouble(int... index) {
        return dtype.getDouble(buffer(), offset(index));
    }

    public long getLong(int... index) {
        return dtype.getLong(buffer(), offset(index));
    }

    public double[] toDoubleArray() {
        ByteBuffer buf = buffer();
        double[] out = new double[size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = dtype.getDouble(buf, i * dtype.itemSize());
        }
        return out;
    }

    private ByteBuffer buffer() {
        return ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    }

    private int offset(int[] index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException(
                    "index has " + index.length + " axes, array has " + shape.length);
        }
        int[] strides = Indexing.strides(shape);
        int flat = 0;
        for (int a = 0; a < index.length; a++) {
            if (index[a] < 0 || index[a] >= shape[a]) {
                throw new IndexOutOfBoundsException(
                        "index " + index[a] + " out of bounds for axis " + a + " with length " + shape[a]);
            }
            flat += index[a] * strides[a];
        }
        return flat * dtype.itemSize();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayData other)) return false;
        return dtype == other.dtype && Arrays.equals(shape, other.shape) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(dtype);
        h = 31 * h + Arrays.hashCode(shape);
        return 31 * h + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "ArrayData{shape=" + Arrays.toString(shape) + ", dtype=" + dtype + "}";
    }
}
