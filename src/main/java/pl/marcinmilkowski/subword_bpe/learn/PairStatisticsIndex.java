package pl.marcinmilkowski.subword_bpe.learn;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Adjacent-pair statistics over the current segmentation of every word.
 *
 * Holds the words themselves (as symbol-ID arrays) and an index from each
 * pair to the words containing it, with per-word occurrence counts. Pair
 * frequencies live in {@link PairCounts} tables owned by the caller, because
 * the learner keeps two of them (a pruned working table and a complete one)
 * and patches whichever it is currently selecting from.
 *
 * After a merge only words that contained the merged pair are rescanned, and
 * only the pairs overlapping each merge site are adjusted. All adjustments are
 * weighted by word frequency.
 */
public final class PairStatisticsIndex {

    private final SymbolTable symbols;
    private final int[][] words;
    private final long[] frequencies;
    private final Map<Long, WordOccurrences> occurrences = new HashMap<>();

    public PairStatisticsIndex(SymbolTable symbols, List<int[]> words, long[] frequencies) {
        if (words.size() != frequencies.length) {
            throw new IllegalArgumentException("Expected one frequency per word: "
                + words.size() + " words, " + frequencies.length + " frequencies");
        }
        this.symbols = symbols;
        this.words = words.toArray(new int[0][]);
        this.frequencies = frequencies.clone();
    }

    public int wordCount() {
        return words.length;
    }

    public int[] word(int wordIndex) {
        return words[wordIndex];
    }

    public long frequency(int wordIndex) {
        return frequencies[wordIndex];
    }

    /**
     * Number of times the pair occurs in the given word according to the index.
     */
    public int occurrences(long pairKey, int wordIndex) {
        WordOccurrences index = occurrences.get(pairKey);
        return index != null ? index.get(wordIndex) : 0;
    }

    /**
     * Full scan: rebuilds the pair index and returns the frequency of every
     * adjacent pair.
     */
    public PairCounts buildStatistics() {
        occurrences.clear();
        PairCounts stats = new PairCounts(Math.max(1024, words.length * 4));
        for (int j = 0; j < words.length; j++) {
            int[] word = words[j];
            long freq = frequencies[j];
            for (int i = 1; i < word.length; i++) {
                long key = SymbolTable.pairKey(word[i - 1], word[i]);
                stats.addTo(key, freq);
                indexFor(key).addTo(j, 1);
            }
        }
        return stats;
    }

    /**
     * Fuses the pair in every word containing it, then patches {@code stats}
     * and the index. Returns the words that changed.
     */
    public List<WordChange> merge(int first, int second, PairCounts stats) {
        int merged = symbols.intern(symbols.symbol(first) + symbols.symbol(second));
        List<WordChange> changes = replacePair(first, second, merged);
        updateStatistics(first, second, merged, changes, stats);
        return changes;
    }

    /**
     * Replaces every non-overlapping occurrence of (first, second), scanning
     * left to right, with {@code merged}.
     */
    List<WordChange> replacePair(int first, int second, int merged) {
        WordOccurrences index = occurrences.get(SymbolTable.pairKey(first, second));
        if (index == null) {
            return List.of();
        }
        List<WordChange> changes = new ArrayList<>();
        for (int j : index.positiveWordIndices()) {
            int[] oldWord = words[j];
            int[] newWord = fuse(oldWord, first, second, merged);
            words[j] = newWord;
            changes.add(new WordChange(j, newWord, oldWord, frequencies[j]));
        }
        return changes;
    }

    static int[] fuse(int[] word, int first, int second, int merged) {
        int[] out = new int[word.length];
        int n = 0;
        int i = 0;
        while (i < word.length) {
            if (word[i] == first && i < word.length - 1 && word[i + 1] == second) {
                out[n++] = merged;
                i += 2;
            } else {
                out[n++] = word[i];
                i++;
            }
        }
        return n == out.length ? out : Arrays.copyOf(out, n);
    }

    /**
     * Adjusts statistics for the pairs touched by merging (first, second) into
     * {@code merged}, using only the words listed in {@code changes}.
     */
    void updateStatistics(int first, int second, int merged, List<WordChange> changes, PairCounts stats) {
        long pairKey = SymbolTable.pairKey(first, second);
        stats.put(pairKey, 0L);
        occurrences.put(pairKey, new WordOccurrences());

        for (WordChange change : changes) {
            int j = change.wordIndex();
            long freq = change.frequency();

            // Pairs that overlapped an occurrence of A B lose this word's frequency.
            int[] oldWord = change.oldSymbols();
            int i = 0;
            while ((i = indexOf(oldWord, first, i)) >= 0) {
                if (i < oldWord.length - 1 && oldWord[i + 1] == second) {
                    // X A B: (X, A) disappears
                    if (i > 0) {
                        adjust(oldWord[i - 1], oldWord[i], -freq, j, stats);
                    }
                    // A B Y: (B, Y) disappears, unless the window is A B A B, where
                    // the next occurrence's (X, A) step already removes (B, A)
                    if (i < oldWord.length - 2) {
                        if (oldWord[i + 2] != first || i >= oldWord.length - 3 || oldWord[i + 3] != second) {
                            adjust(oldWord[i + 1], oldWord[i + 2], -freq, j, stats);
                        }
                    }
                    i += 2;
                } else {
                    i += 1;
                }
            }

            // Pairs around each new symbol gain this word's frequency.
            int[] newWord = change.newSymbols();
            i = 0;
            while ((i = indexOf(newWord, merged, i)) >= 0) {
                // X AB
                if (i > 0) {
                    adjust(newWord[i - 1], newWord[i], freq, j, stats);
                }
                // AB Y, skipped for AB AB: counted once by the X AB step of the next one
                if (i < newWord.length - 1 && newWord[i + 1] != merged) {
                    adjust(newWord[i], newWord[i + 1], freq, j, stats);
                }
                i += 1;
            }
        }
    }

    private void adjust(int left, int right, long delta, int wordIndex, PairCounts stats) {
        long key = SymbolTable.pairKey(left, right);
        stats.addTo(key, delta);
        indexFor(key).addTo(wordIndex, delta < 0 ? -1 : 1);
    }

    private WordOccurrences indexFor(long key) {
        return occurrences.computeIfAbsent(key, k -> new WordOccurrences());
    }

    private static int indexOf(int[] word, int symbol, int from) {
        for (int i = from; i < word.length; i++) {
            if (word[i] == symbol) {
                return i;
            }
        }
        return -1;
    }
}
