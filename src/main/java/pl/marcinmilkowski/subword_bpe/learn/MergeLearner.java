package pl.marcinmilkowski.subword_bpe.learn;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.subword_bpe.codes.BpeVersion;
import pl.marcinmilkowski.subword_bpe.codes.MergeTable;
import pl.marcinmilkowski.subword_bpe.codes.SymbolPair;
import pl.marcinmilkowski.subword_bpe.vocabulary.Vocabulary;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Learns a BPE merge table from a word-frequency vocabulary.
 *
 * Each step picks the most frequent adjacent pair (ties broken by the larger
 * pair in code-point order), fuses it in every word, and patches the pair
 * statistics for the words that changed only.
 *
 * Selection runs on a pruned working table holding only pairs above a
 * threshold. A second, complete table keeps the true counts of pruned pairs;
 * when the working table runs dry, or its best pair falls below the
 * threshold, it is refilled from the complete table and the threshold is
 * recomputed as {@code best * i / (i + 10000)}.
 *
 * Not thread-safe; use one instance per learning run.
 */
public class MergeLearner {

    private static final int PRUNE_INTERVAL = 100;
    private static final double THRESHOLD_DAMPING = 10000.0;
    private static final long NO_PAIR = Long.MIN_VALUE;

    private final LearnerOptions options;
    private final Logger logger;

    public MergeLearner(LearnerOptions options) {
        this(options, LoggerFactory.getLogger(MergeLearner.class));
    }

    public MergeLearner(LearnerOptions options, Logger logger) {
        this.options = Objects.requireNonNull(options, "options");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public LearnerOptions options() {
        return options;
    }

    /**
     * Learns up to {@code options.symbols()} merges, plus any forced merges.
     * Returns fewer merges if no pair reaches the minimum frequency first.
     */
    public MergeTable learn(Vocabulary vocabulary) {
        BpeVersion version = options.version();
        Vocabulary filtered = options.minCount() > 1 ? vocabulary.withMinCount(options.minCount()) : vocabulary;

        SymbolTable symbols = new SymbolTable();
        List<int[]> words = new ArrayList<>(filtered.size());
        List<Long> frequencies = new ArrayList<>(filtered.size());
        for (Map.Entry<String, Long> entry : filtered.sortedByFrequency()) {
            if (entry.getKey().isEmpty()) {
                continue;
            }
            words.add(symbols.internAll(version.initialSymbols(entry.getKey())));
            frequencies.add(entry.getValue());
        }
        long[] freqArray = frequencies.stream().mapToLong(Long::longValue).toArray();

        PairStatisticsIndex index = new PairStatisticsIndex(symbols, words, freqArray);
        PairCounts bigStats = index.buildStatistics();
        PairCounts stats = bigStats.copy();
        logger.info("Learning BPE (version {}): {} words, {} distinct pairs, {} symbols requested",
            version, words.size(), bigStats.size(), options.symbols());

        // Zipfian guess; only affects speed
        double threshold = maxValue(stats) / 10.0;

        List<SymbolPair> merges = new ArrayList<>();

        if (!options.forcedMerges().isEmpty()) {
            int forced = applyForcedMerges(symbols, index, bigStats, merges);
            logger.info("Forced merges: added {} (in addition to {} requested symbols)", forced, options.symbols());
            stats = new PairCounts();
        }

        int learned = 0;
        for (int i = 0; i < options.symbols(); i++) {
            long best = NO_PAIR;
            if (!stats.isEmpty()) {
                best = selectBest(stats, symbols);
            }

            // The best pair may have been pruned; go back to the complete statistics.
            if (stats.isEmpty() || (i > 0 && stats.get(best) < threshold)) {
                prune(stats, bigStats, threshold);
                stats = bigStats.copy();
                if (stats.isEmpty()) {
                    logger.info("No symbol pairs left. Stopping");
                    break;
                }
                best = selectBest(stats, symbols);
                threshold = stats.get(best) * i / (i + THRESHOLD_DAMPING);
                prune(stats, bigStats, threshold);
            }

            long frequency = stats.get(best);
            if (frequency < options.minFrequency()) {
                logger.info("No pair has frequency >= {}. Stopping", options.minFrequency());
                break;
            }

            int first = SymbolTable.first(best);
            int second = SymbolTable.second(best);
            SymbolPair pair = new SymbolPair(symbols.symbol(first), symbols.symbol(second));
            if (options.verbose()) {
                logger.info("pair {}: {} {} -> {} (frequency {})", i, pair.first(), pair.second(), pair.merged(), frequency);
            } else if (logger.isDebugEnabled()) {
                logger.debug("pair {}: {} {} -> {} (frequency {})", i, pair.first(), pair.second(), pair.merged(), frequency);
            }

            merges.add(pair);
            index.merge(first, second, stats);
            stats.put(best, 0L);
            learned++;

            if (i % PRUNE_INTERVAL == 0) {
                prune(stats, bigStats, threshold);
            }
        }

        logger.info("Merge table has {} pairs ({} learned)", merges.size(), learned);
        return new MergeTable(version, merges);
    }

    private int applyForcedMerges(SymbolTable symbols, PairStatisticsIndex index, PairCounts bigStats,
                                  List<SymbolPair> merges) {
        Pattern filter = compileForcedMergeFilter(options.forcedMergeFilter());
        if (filter != null) {
            logger.info("Using only forced merges matching '{}'", filter.pattern());
        }
        int count = 0;
        for (SymbolPair pair : options.forcedMerges()) {
            if (filter != null) {
                if (!filter.matcher(pair.first()).matches() || !filter.matcher(pair.second()).matches()) {
                    continue;
                }
                if (options.verbose()) {
                    logger.info("Forced merge accepted by filter: {}", pair);
                }
            }
            int first = symbols.intern(pair.first());
            int second = symbols.intern(pair.second());
            merges.add(pair);
            index.merge(first, second, bigStats);
            bigStats.put(SymbolTable.pairKey(first, second), 0L);
            count++;
        }
        return count;
    }

    /**
     * Anchors the user regex and lets a trailing end-of-word marker through.
     */
    static Pattern compileForcedMergeFilter(String regex) {
        if (regex == null || regex.isEmpty()) {
            return null;
        }
        String body = regex;
        if (body.startsWith("^")) {
            body = body.substring(1);
        }
        if (body.endsWith("$") && !body.endsWith("\\$")) {
            body = body.substring(0, body.length() - 1);
        }
        return Pattern.compile("(?:" + body + ")(?:" + Pattern.quote(BpeVersion.END_OF_WORD) + ")?");
    }

    /**
     * Moves every entry below {@code threshold} out of the working table. Complete
     * counts are overwritten with the working value, except for negative working
     * values: those are deltas accumulated for a pair that had already been pruned.
     */
    private static void prune(PairCounts stats, PairCounts bigStats, double threshold) {
        stats.retainAtLeast(threshold, (key, value) -> {
            if (value < 0) {
                bigStats.addTo(key, value);
            } else {
                bigStats.put(key, value);
            }
        });
    }

    private static double maxValue(PairCounts stats) {
        long[] max = {0L};
        stats.forEach((key, value) -> max[0] = Math.max(max[0], value));
        return max[0];
    }

    private static long selectBest(PairCounts stats, SymbolTable symbols) {
        BestPair best = new BestPair(symbols);
        stats.forEach(best);
        return best.key;
    }

    /**
     * Keeps the entry with the highest frequency; on equal frequency, the larger pair.
     */
    private static final class BestPair implements PairCounts.EntryConsumer {
        private final SymbolTable symbols;
        private long key = NO_PAIR;
        private long frequency;

        BestPair(SymbolTable symbols) {
            this.symbols = symbols;
        }

        @Override
        public void accept(long candidate, long value) {
            if (key == NO_PAIR || value > frequency
                    || (value == frequency && comparePairs(candidate, key) > 0)) {
                key = candidate;
                frequency = value;
            }
        }

        private int comparePairs(long a, long b) {
            int cmp = SymbolPair.compareSymbols(
                symbols.symbol(SymbolTable.first(a)), symbols.symbol(SymbolTable.first(b)));
            if (cmp != 0) {
                return cmp;
            }
            return SymbolPair.compareSymbols(
                symbols.symbol(SymbolTable.second(a)), symbols.symbol(SymbolTable.second(b)));
        }
    }
}
