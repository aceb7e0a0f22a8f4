package pl.marcinmilkowski.subword_bpe.learn;

import java.util.Arrays;

/**
 * Per-pair index: word position -> number of times the pair occurs in that word.
 *
 * Small open-addressing map; most pairs occur in only a handful of words.
 * Counts may drop to zero or below and are then simply skipped by readers.
 */
final class WordOccurrences {

    private static final int EMPTY = -1;

    private int[] keys;
    private int[] counts;
    private int size;
    private int mask;
    private int resizeAt;

    WordOccurrences() {
        init(4);
    }

    private void init(int capacity) {
        keys = new int[capacity];
        counts = new int[capacity];
        Arrays.fill(keys, EMPTY);
        size = 0;
        mask = capacity - 1;
        resizeAt = (int) (capacity * 0.65);
    }

    int size() {
        return size;
    }

    int get(int wordIndex) {
        int slot = mix32(wordIndex) & mask;
        while (keys[slot] != EMPTY) {
            if (keys[slot] == wordIndex) {
                return counts[slot];
            }
            slot = (slot + 1) & mask;
        }
        return 0;
    }

    void addTo(int wordIndex, int delta) {
        if (wordIndex < 0) {
            throw new IllegalArgumentException("Word index cannot be negative: " + wordIndex);
        }
        if (size >= resizeAt) {
            rehash(keys.length * 2);
        }
        int slot = mix32(wordIndex) & mask;
        while (true) {
            int k = keys[slot];
            if (k == EMPTY) {
                keys[slot] = wordIndex;
                counts[slot] = delta;
                size++;
                return;
            }
            if (k == wordIndex) {
                counts[slot] += delta;
                return;
            }
            slot = (slot + 1) & mask;
        }
    }

    /**
     * Word positions with a positive count, in ascending order.
     */
    int[] positiveWordIndices() {
        int[] result = new int[size];
        int n = 0;
        for (int i = 0; i < keys.length; i++) {
            if (keys[i] != EMPTY && counts[i] > 0) {
                result[n++] = keys[i];
            }
        }
        int[] trimmed = Arrays.copyOf(result, n);
        Arrays.sort(trimmed);
        return trimmed;
    }

    private void rehash(int newCapacity) {
        int[] oldKeys = keys;
        int[] oldCounts = counts;
        init(newCapacity);
        for (int i = 0; i < oldKeys.length; i++) {
            int k = oldKeys[i];
            if (k == EMPTY) continue;
            int slot = mix32(k) & mask;
            while (keys[slot] != EMPTY) {
                slot = (slot + 1) & mask;
            }
            keys[slot] = k;
            counts[slot] = oldCounts[i];
            size++;
        }
    }

    private static int mix32(int h) {
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        return h;
    }
}
