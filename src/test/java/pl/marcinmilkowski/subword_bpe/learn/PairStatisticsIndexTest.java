package pl.marcinmilkowski.subword_bpe.learn;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class PairStatisticsIndexTest {

    private SymbolTable symbols;

    private PairStatisticsIndex index(String... wordsAndFrequencies) {
        symbols = new SymbolTable();
        List<int[]> words = new ArrayList<>();
        long[] frequencies = new long[wordsAndFrequencies.length / 2];
        for (int i = 0; i < wordsAndFrequencies.length; i += 2) {
            List<String> chars = new ArrayList<>();
            wordsAndFrequencies[i].codePoints().forEach(cp -> chars.add(new String(Character.toChars(cp))));
            words.add(symbols.internAll(chars));
            frequencies[i / 2] = Long.parseLong(wordsAndFrequencies[i + 1]);
        }
        return new PairStatisticsIndex(symbols, words, frequencies);
    }

    private Map<String, Long> nonZero(PairCounts counts) {
        Map<String, Long> out = new TreeMap<>();
        counts.forEach((key, value) -> {
            if (value != 0) {
                out.put(symbols.symbol(SymbolTable.first(key)) + " " + symbols.symbol(SymbolTable.second(key)), value);
            }
        });
        return out;
    }

    /** Applies a merge the way the learner does and checks the result against a full rescan. */
    private Map<String, Long> mergeAndCompare(PairStatisticsIndex index, PairCounts stats, String first, String second) {
        int a = symbols.intern(first);
        int b = symbols.intern(second);
        index.merge(a, b, stats);
        stats.put(SymbolTable.pairKey(a, b), 0L);

        List<int[]> current = new ArrayList<>();
        long[] frequencies = new long[index.wordCount()];
        for (int i = 0; i < index.wordCount(); i++) {
            current.add(index.word(i));
            frequencies[i] = index.frequency(i);
        }
        PairCounts rebuilt = new PairStatisticsIndex(symbols, current, frequencies).buildStatistics();

        Map<String, Long> incremental = nonZero(stats);
        assertEquals(nonZero(rebuilt), incremental, "after merging " + first + " " + second);
        return incremental;
    }

    @Test
    @DisplayName("Initial statistics sum word frequencies per adjacency")
    void buildStatistics() {
        PairStatisticsIndex index = index("low", "5", "lower", "2");
        PairCounts stats = index.buildStatistics();
        assertEquals(Map.of("l o", 7L, "o w", 7L, "w e", 2L, "e r", 2L), nonZero(stats));
        long lo = SymbolTable.pairKey(symbols.idOf("l"), symbols.idOf("o"));
        assertEquals(1, index.occurrences(lo, 0));
        assertEquals(1, index.occurrences(lo, 1));
    }

    @Test
    @DisplayName("Overlapping occurrences count once per position")
    void overlappingOccurrences() {
        PairStatisticsIndex index = index("aaaa", "1");
        PairCounts stats = index.buildStatistics();
        assertEquals(Map.of("a a", 3L), nonZero(stats));
        assertEquals(3, index.occurrences(SymbolTable.pairKey(symbols.idOf("a"), symbols.idOf("a")), 0));
    }

    @Test
    @DisplayName("A B C B C: merging B C matches a rescan")
    void repeatedPairAfterMerge() {
        PairStatisticsIndex index = index("abcbc", "1");
        PairCounts stats = index.buildStatistics();

        Map<String, Long> result = mergeAndCompare(index, stats, "b", "c");

        assertEquals(Map.of("a bc", 1L, "bc bc", 1L), result);
        assertEquals(0L, stats.get(SymbolTable.pairKey(symbols.idOf("c"), symbols.idOf("b"))));
        assertEquals(0L, stats.get(SymbolTable.pairKey(symbols.idOf("a"), symbols.idOf("b"))));
        int bc = symbols.idOf("bc");
        assertEquals(1, index.occurrences(SymbolTable.pairKey(bc, bc), 0));
        assertEquals(1, index.occurrences(SymbolTable.pairKey(symbols.idOf("a"), bc), 0));
    }

    @Test
    @DisplayName("A A A A: merging A A matches a rescan")
    void runOfIdenticalSymbols() {
        PairStatisticsIndex index = index("aaaa", "1");
        PairCounts stats = index.buildStatistics();

        assertEquals(Map.of("aa aa", 1L), mergeAndCompare(index, stats, "a", "a"));
    }

    @Test
    @DisplayName("Odd runs leave the trailing symbol unmerged")
    void oddRuns() {
        PairStatisticsIndex index = index("aaa", "2", "aaaaa", "1", "aaab", "3");
        PairCounts stats = index.buildStatistics();

        Map<String, Long> result = mergeAndCompare(index, stats, "a", "a");

        assertEquals(Map.of("aa a", 6L, "aa aa", 1L, "a b", 3L), result);
    }

    @Test
    @DisplayName("Updates are scaled by word frequency")
    void scaledByFrequency() {
        PairStatisticsIndex index = index("low", "5", "lower", "2", "newest", "6");
        PairCounts stats = index.buildStatistics();

        Map<String, Long> result = mergeAndCompare(index, stats, "l", "o");

        assertEquals(7L, result.get("lo w"));
        assertNull(result.get("o w"));
        assertEquals(8L, result.get("w e"));
    }

    @Test
    @DisplayName("A sequence of merges stays equal to a rescan after every step")
    void sequenceOfMerges() {
        PairStatisticsIndex index = index("abababa", "3", "aab", "2", "baaa", "1", "abcbcbc", "4");
        PairCounts stats = index.buildStatistics();

        mergeAndCompare(index, stats, "a", "b");
        mergeAndCompare(index, stats, "a", "a");
        mergeAndCompare(index, stats, "ab", "ab");
        mergeAndCompare(index, stats, "c", "b");
        Map<String, Long> last = mergeAndCompare(index, stats, "ab", "cb");

        assertEquals(4L, last.get("abcb cb"));
    }

    @Test
    @DisplayName("Merging a pair no word contains changes nothing")
    void mergeAbsentPair() {
        PairStatisticsIndex index = index("low", "5");
        PairCounts stats = index.buildStatistics();
        int x = symbols.intern("x");
        int y = symbols.intern("y");

        assertTrue(index.merge(x, y, stats).isEmpty());
        assertEquals(Map.of("l o", 5L, "o w", 5L), nonZero(stats));
    }

    @Test
    @DisplayName("fuse replaces non-overlapping occurrences left to right")
    void fuse() {
        assertArrayEquals(new int[] {9, 9, 1}, PairStatisticsIndex.fuse(new int[] {1, 1, 1, 1, 1}, 1, 1, 9));
        assertArrayEquals(new int[] {0, 9, 2}, PairStatisticsIndex.fuse(new int[] {0, 1, 2, 2}, 1, 2, 9));
    }
}
