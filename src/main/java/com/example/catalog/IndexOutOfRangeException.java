package com.example.catalog;

public class IndexOutOfRangeException extends CatalogException {
    private final long index;
    private final long length;

    public IndexOutOfRangeException(long index, long length) {
        super("index " + index + " out of range for length " + length);
        this.index = index;
        this.length = length;
    }

    public long index() {
        return index;
    }

    public long length() {
        return length;
    }
}
