package pl.marcinmilkowski.subword_bpe.codes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Extracts the merges needed to produce a given subword vocabulary.
 *
 * A merge is kept when its fused symbol, written the way it appears in
 * segmented output, is in the vocabulary, or when it builds one of the
 * constituents of such a symbol (transitively). Rank order is preserved.
 */
public final class MergeTableSubset {

    private static final Logger logger = LoggerFactory.getLogger(MergeTableSubset.class);

    private MergeTableSubset() {
    }

    /**
     * @param table       full merge table
     * @param vocabulary  subwords as they appear in segmented output
     *                    (non-final pieces carry the separator)
     * @param separator   continuation separator used in {@code vocabulary}
     */
    public static MergeTable extract(MergeTable table, Collection<String> vocabulary, String separator) {
        Set<String> vocab = new HashSet<>(vocabulary);
        Set<String> required = prerequisites(table, vocab, separator);

        List<SymbolPair> kept = new ArrayList<>();
        for (SymbolPair pair : table.orderedMerges()) {
            String merged = pair.merged();
            if (vocab.contains(written(merged, separator)) || required.contains(merged)) {
                kept.add(pair);
            }
        }
        logger.info("Merge table subset: kept {} of {} merges", kept.size(), table.size());
        return new MergeTable(table.version(), kept);
    }

    /**
     * Returns every fused symbol that some in-vocabulary symbol is built from,
     * including the in-vocabulary symbols themselves.
     * Constituents always have a lower rank than the symbol they build, so the
     * traversal terminates.
     */
    static Set<String> prerequisites(MergeTable table, Set<String> vocab, String separator) {
        Set<String> seen = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();

        for (Map.Entry<String, SymbolPair> entry : table.reverseMap().entrySet()) {
            if (vocab.contains(written(entry.getKey(), separator))) {
                seen.add(entry.getKey());
                pending.push(entry.getValue().first());
                pending.push(entry.getValue().second());
            }
        }

        while (!pending.isEmpty()) {
            String symbol = pending.pop();
            if (symbol.codePointCount(0, symbol.length()) <= 1 || !seen.add(symbol)) {
                continue;
            }
            SymbolPair source = table.sourcePair(symbol);
            if (source != null) {
                pending.push(source.first());
                pending.push(source.second());
            }
        }
        return seen;
    }

    /**
     * The form a fused symbol takes in segmented output: word-final symbols lose
     * the end-of-word marker, all others gain the separator.
     */
    public static String written(String symbol, String separator) {
        if (symbol.endsWith(BpeVersion.END_OF_WORD)) {
            return symbol.substring(0, symbol.length() - BpeVersion.END_OF_WORD.length());
        }
        return symbol + separator;
    }
}
