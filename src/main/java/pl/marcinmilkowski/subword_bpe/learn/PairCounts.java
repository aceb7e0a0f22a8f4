package pl.marcinmilkowski.subword_bpe.learn;

import java.util.Arrays;

/**
 * Primitive hash map from packed pair key (long) to frequency (long) using open addressing.
 *
 * Values may go negative while statistics are patched incrementally. Missing
 * keys read as 0. Entries are only dropped in bulk by {@link #retainAtLeast}.
 */
public final class PairCounts {

    private static final long EMPTY = Long.MIN_VALUE;
    private static final double LOAD_FACTOR = 0.65;

    private long[] keys;
    private long[] values;
    private int size;
    private int mask;
    private int resizeAt;

    public PairCounts(int expectedSize) {
        init(capacityFor(expectedSize));
    }

    public PairCounts() {
        this(1024);
    }

    private static int capacityFor(int expectedSize) {
        int cap = 1;
        int need = Math.max(4, (int) (expectedSize / LOAD_FACTOR) + 1);
        while (cap < need) cap <<= 1;
        return cap;
    }

    private void init(int capacity) {
        keys = new long[capacity];
        values = new long[capacity];
        Arrays.fill(keys, EMPTY);
        size = 0;
        mask = capacity - 1;
        resizeAt = (int) (capacity * LOAD_FACTOR);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean containsKey(long key) {
        return keys[findSlot(key)] != EMPTY;
    }

    public long get(long key) {
        int slot = findSlot(key);
        return keys[slot] == EMPTY ? 0L : values[slot];
    }

    public void put(long key, long value) {
        int slot = slotForInsert(key);
        values[slot] = value;
    }

    public void addTo(long key, long delta) {
        int slot = slotForInsert(key);
        values[slot] += delta;
    }

    public void forEach(EntryConsumer consumer) {
        for (int i = 0; i < keys.length; i++) {
            long k = keys[i];
            if (k != EMPTY) {
                consumer.accept(k, values[i]);
            }
        }
    }

    public PairCounts copy() {
        PairCounts copy = new PairCounts(0);
        copy.keys = keys.clone();
        copy.values = values.clone();
        copy.size = size;
        copy.mask = mask;
        copy.resizeAt = resizeAt;
        return copy;
    }

    /**
     * Drops every entry whose value is below {@code threshold}, reporting each
     * dropped entry to {@code removed}.
     */
    public void retainAtLeast(double threshold, EntryConsumer removed) {
        long[] oldKeys = keys;
        long[] oldValues = values;
        init(oldKeys.length);
        for (int i = 0; i < oldKeys.length; i++) {
            long k = oldKeys[i];
            if (k == EMPTY) continue;
            long v = oldValues[i];
            if (v < threshold) {
                removed.accept(k, v);
            } else {
                insertFresh(k, v);
            }
        }
    }

    private int findSlot(long key) {
        int slot = mix64(key) & mask;
        while (keys[slot] != EMPTY && keys[slot] != key) {
            slot = (slot + 1) & mask;
        }
        return slot;
    }

    private int slotForInsert(long key) {
        if (key == EMPTY) {
            throw new IllegalArgumentException("Key cannot be Long.MIN_VALUE");
        }
        if (size >= resizeAt) {
            rehash(keys.length * 2);
        }
        int slot = findSlot(key);
        if (keys[slot] == EMPTY) {
            keys[slot] = key;
            values[slot] = 0L;
            size++;
        }
        return slot;
    }

    private void insertFresh(long key, long value) {
        int slot = mix64(key) & mask;
        while (keys[slot] != EMPTY) {
            slot = (slot + 1) & mask;
        }
        keys[slot] = key;
        values[slot] = value;
        size++;
    }

    private void rehash(int newCapacity) {
        long[] oldKeys = keys;
        long[] oldValues = values;
        init(newCapacity);
        for (int i = 0; i < oldKeys.length; i++) {
            if (oldKeys[i] != EMPTY) {
                insertFresh(oldKeys[i], oldValues[i]);
            }
        }
    }

    // Murmur3 finalizer
    private static int mix64(long z) {
        z ^= (z >>> 33);
        z *= 0xff51afd7ed558ccdL;
        z ^= (z >>> 33);
        z *= 0xc4ceb9fe1a85ec53L;
        z ^= (z >>> 33);
        return (int) z;
    }

    @FunctionalInterface
    public interface EntryConsumer {
        void accept(long key, long value);
    }
}
