package com.caredirectory.providers.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Half-open index range {@code [start, end)} of one persistence batch.
 */
public record BatchRange(int index, int start, int end) {

    public int size() {
        return end - start;
    }

    /**
     * Splits {@code total} records into {@code ceil(total / batchSize)} contiguous, non-empty
     * ranges. Every full batch holds {@code batchSize} records; only the last may be shorter,
     * and there is no trailing empty range when {@code total} is a multiple of {@code batchSize}.
     */
    public static List<BatchRange> partition(int total, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        if (total < 0) {
            throw new IllegalArgumentException("total must not be negative: " + total);
        }
        int fullBatches = total / batchSize;
        int remainder = total % batchSize;

        List<BatchRange> ranges = new ArrayList<>(fullBatches + (remainder == 0 ? 0 : 1));
        for (int i = 0; i < fullBatches; i++) {
            int start = i * batchSize;
            ranges.add(new BatchRange(i, start, start + batchSize));
        }
        if (remainder != 0) {
            int start = fullBatches * batchSize;
            ranges.add(new BatchRange(fullBatches, start, start + remainder));
        }
        return ranges;
    }
}
