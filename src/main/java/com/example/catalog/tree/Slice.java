package com.example.catalog.tree;

import com.example.catalog.IndexOutOfRangeException;

/**
 * Half-open positional range. A {@code null} start means 0, a {@code null} stop means "to the end";
 * negative bounds count from the end.
 */
public record Slice(Long start, Long stop) {
    private static final Slice ALL = new Slice(null, null);

    public static Slice all() {
        return ALL;
    }

    public static Slice of(long start, long stop) {
        return new Slice(start, stop);
    }

    public static Slice from(long start) {
        return new Slice(start, null);
    }

    public static Slice to(long stop) {
        return new Slice(null, stop);
    }

    /**
     * Whether resolving this slice needs the length of the sequence.
     */
    public boolean isRelativeToEnd() {
        return (start != null && start < 0) || (stop != null && stop < 0);
    }

    /**
     * Skip implied by a slice that is not relative to the end.
     */
    long skip() {
        return start == null ? 0 : start;
    }

    /**
     * Limit implied by a slice that is not relative to the end; {@code null} when unbounded.
     */
    Long limit() {
        if (stop == null) {
            return null;
        }
        return Math.max(0, stop - skip());
    }

    public Bounds resolve(long length) {
        long s = clamp(start, 0, length);
        long e = clamp(stop, length, length);
        return new Bounds(s, Math.max(s, e));
    }

    private static long clamp(Long bound, long absent, long length) {
        if (bound == null) {
            return absent;
        }
        if (bound < 0) {
            return Math.max(0, length + bound);
        }
        return Math.min(bound, length);
    }

    /**
     * Resolves a single (possibly negative) index against {@code length}.
     */
    public static long index(long index, long length) {
        long i = index < 0 ? length + index : index;
        if (i < 0 || i >= length) {
            throw new IndexOutOfRangeException(index, length);
        }
        return i;
    }

    public record Bounds(long start, long stop) {
        public long length() {
            return stop - start;
        }
    }
}
