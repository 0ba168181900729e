package com.example.catalog.array;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

final class Indexing {
    private Indexing() {}

    static int product(int[] dims) {
        int n = 1;
        for (int d : dims) {
            n = Math.multiplyExact(n, d);
        }
        return n;
    }

    static int[] strides(int[] shape) {
        int[] strides = new int[shape.length];
        int s = 1;
        for (int a = shape.length - 1; a >= 0; a--) {
            strides[a] = s;
            s *= shape[a];
        }
        return strides;
    }

    /**
     * Visits every index in {@code [lo, hi)} in row-major order. The array handed to the consumer is
     * reused between calls.
     */
    static void forEach(int[] lo, int[] hi, Consumer<int[]> consumer) {
        int n = lo.length;
        for (int a = 0; a < n; a++) {
            if (lo[a] >= hi[a]) {
                return;
            }
        }
        int[] idx = lo.clone();
        while (true) {
            consumer.accept(idx);
            int a = n - 1;
            while (a >= 0) {
                idx[a]++;
                if (idx[a] < hi[a]) {
                    break;
                }
                idx[a] = lo[a];
                a--;
            }
            if (a < 0) {
                return;
            }
        }
    }

    static List<int[]> collect(int[] lo, int[] hi) {
        List<int[]> out = new ArrayList<>();
        forEach(lo, hi, idx -> out.add(idx.clone()));
        return out;
    }
}
