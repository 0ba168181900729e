package com.example.catalog.array;

import java.util.List;

/**
 * A rectangular selection: one half-open interval per leading axis. Axes past the listed intervals are
 * selected whole.
 */
public record Region(List<Interval> intervals) {
    private static final Region ALL = new Region(List.of());

    public Region {
        intervals = List.copyOf(intervals);
    }

    public static Region all() {
        return ALL;
    }

    public static Region of(Interval... intervals) {
        return new Region(List.of(intervals));
    }

    int[][] resolve(int[] shape) {
        if (intervals.size() > shape.length) {
            throw new IllegalArgumentException(
                    "region has " + intervals.size() + " axes, array has " + shape.length);
        }
        int[] start = new int[shape.length];
        int[] stop = shape.clone();
        for (int a = 0; a < intervals.size(); a++) {
            Interval iv = intervals.get(a);
            if (iv.stop() > shape[a]) {
                throw new IllegalArgumentException(
                        "interval " + iv + " exceeds length " + shape[a] + " of axis " + a);
            }
            start[a] = iv.start();
            stop[a] = iv.stop();
        }
        return new int[][]{start, stop};
    }

    public record Interval(int start, int stop) {
        public Interval {
            if (start < 0 || stop < start) {
                throw new IllegalArgumentException("invalid interval [" + start + ", " + stop + ")");
            }
        }

        public static Interval of(int start, int stop) {
            return new Interval(start, stop);
        }

        public int length() {
            return stop - start;
        }
    }
}
