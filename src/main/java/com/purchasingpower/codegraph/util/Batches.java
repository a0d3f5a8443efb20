package com.purchasingpower.codegraph.util;

import java.util.ArrayList;
import java.util.List;

public final class Batches {

    private Batches() {
    }

    /**
     * Consecutive sublists of at most {@code size} elements, in order.
     */
    public static <T> List<List<T>> partition(List<T> items, int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + size);
        }
        List<List<T>> batches = new ArrayList<>();
        int start = 0;
        while (start < items.size()) {
            // long arithmetic, size may be close to Integer.MAX_VALUE
            int end = (int) Math.min((long) start + size, items.size());
            batches.add(items.subList(start, end));
            start = end;
        }
        return batches;
    }
}
