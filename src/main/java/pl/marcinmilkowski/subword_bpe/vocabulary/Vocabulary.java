package pl.marcinmilkowski.subword_bpe.vocabulary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Word -> frequency table.
 *
 * Keeps first-insertion order, which is the tie-break order when entries are
 * sorted by frequency. Zero counts are never stored.
 */
public final class Vocabulary {

    private final Map<String, Long> counts = new LinkedHashMap<>();

    public Vocabulary() {
    }

    public static Vocabulary of(Map<String, ? extends Number> counts) {
        Vocabulary vocabulary = new Vocabulary();
        counts.forEach((word, count) -> vocabulary.add(word, count.longValue()));
        return vocabulary;
    }

    /**
     * Adds {@code count} to the frequency of {@code word}.
     */
    public Vocabulary add(String word, long count) {
        Objects.requireNonNull(word, "word");
        if (count < 0) {
            throw new IllegalArgumentException("Negative count for '" + word + "': " + count);
        }
        if (count > 0) {
            counts.merge(word, count, Long::sum);
        }
        return this;
    }

    public Vocabulary increment(String word) {
        return add(word, 1);
    }

    /**
     * Adds every entry of {@code other} to this vocabulary.
     */
    public Vocabulary addAll(Vocabulary other) {
        other.counts.forEach(this::add);
        return this;
    }

    public long frequency(String word) {
        return counts.getOrDefault(word, 0L);
    }

    public boolean contains(String word) {
        return counts.containsKey(word);
    }

    public int size() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public Set<String> words() {
        return Collections.unmodifiableSet(counts.keySet());
    }

    public Map<String, Long> asMap() {
        return Collections.unmodifiableMap(counts);
    }

    /**
     * A copy without the words whose frequency is below {@code minCount}.
     */
    public Vocabulary withMinCount(long minCount) {
        Vocabulary filtered = new Vocabulary();
        counts.forEach((word, count) -> {
            if (count >= minCount) {
                filtered.counts.put(word, count);
            }
        });
        return filtered;
    }

    /**
     * Entries by descending frequency; equal frequencies keep insertion order.
     */
    public List<Map.Entry<String, Long>> sortedByFrequency() {
        List<Map.Entry<String, Long>> sorted = new ArrayList<>(counts.entrySet());
        sorted.sort((a, b) -> Long.compare(b.getValue(), a.getValue()));
        return sorted;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Vocabulary)) return false;
        return counts.equals(((Vocabulary) o).counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return "Vocabulary{" + counts.size() + " words}";
    }
}
