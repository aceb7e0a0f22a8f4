package pl.marcinmilkowski.subword_bpe.apply;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.subword_bpe.codes.BpeVersion;
import pl.marcinmilkowski.subword_bpe.codes.MergeTable;
import pl.marcinmilkowski.subword_bpe.codes.SymbolPair;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Segments words and sentences into subwords by replaying a merge table.
 *
 * Within a word, the present pair with the lowest rank is merged first (all of
 * its non-overlapping occurrences, left to right), until no present pair is in
 * the table. Results are cached per input word for the lifetime of the encoder.
 *
 * Not thread-safe: the cache is a plain map.
 */
public class BpeEncoder {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final MergeTable table;
    private final SegmentationConfig config;
    private final GlossaryIsolator glossaries;
    private final VocabularyRestriction restriction;
    private final Map<String, List<String>> cache = new HashMap<>();
    private final Logger logger;

    public BpeEncoder(MergeTable table) {
        this(table, SegmentationConfig.defaults(), null);
    }

    public BpeEncoder(MergeTable table, SegmentationConfig config) {
        this(table, config, null);
    }

    /**
     * @param vocabulary target vocabulary in written form, or null for no restriction
     */
    public BpeEncoder(MergeTable table, SegmentationConfig config, Set<String> vocabulary) {
        this(table, config, vocabulary, LoggerFactory.getLogger(BpeEncoder.class));
    }

    public BpeEncoder(MergeTable table, SegmentationConfig config, Set<String> vocabulary, Logger logger) {
        this.table = Objects.requireNonNull(table, "table");
        this.config = Objects.requireNonNull(config, "config");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.glossaries = new GlossaryIsolator(config.glossaries(), config.regexGlossaries());
        this.restriction = vocabulary != null && !vocabulary.isEmpty()
            ? new VocabularyRestriction(table, vocabulary, config.separator())
            : null;
        if (!glossaries.isEmpty()) {
            logger.info("Glossary pattern: {}", glossaries.pattern().pattern());
        }
    }

    public MergeTable table() {
        return table;
    }

    public SegmentationConfig config() {
        return config;
    }

    /**
     * Segments a whitespace-tokenized sentence. Subwords are joined by single
     * spaces; every non-final subword of a word carries the separator.
     */
    public String segment(String sentence) {
        List<String> output = new ArrayList<>();
        for (String word : WHITESPACE.split(sentence.strip())) {
            if (!word.isEmpty()) {
                pieces(word, output);
            }
        }
        return String.join(" ", output);
    }

    /**
     * Segments one word, glossary matches kept whole, separators applied.
     */
    public List<String> pieces(String word) {
        return pieces(word, new ArrayList<>());
    }

    private List<String> pieces(String word, List<String> output) {
        List<String> subwords = new ArrayList<>();
        for (GlossaryIsolator.Segment segment : glossaries.isolate(word)) {
            if (segment.isolated()) {
                logger.debug("Glossary segment left alone: \"{}\"", segment.text());
                subwords.add(segment.text());
            } else {
                subwords.addAll(encode(segment.text()));
            }
        }
        String separator = config.separator();
        int last = subwords.size() - 1;
        for (int i = 0; i <= last; i++) {
            output.add(i < last ? subwords.get(i) + separator : subwords.get(i));
        }
        return output;
    }

    /**
     * Encodes one word (no whitespace, no glossary handling) into subwords
     * without separators. Concatenating the result gives back the word, except
     * when the unknown marker is replaced by its tag.
     */
    public List<String> encode(String word) {
        List<String> cached = cache.get(word);
        if (cached != null) {
            return cached;
        }
        if (word.isEmpty()) {
            return List.of(word);
        }

        List<String> symbols = applyMerges(table.version().initialSymbols(word));
        stripEndOfWord(symbols);

        List<String> result;
        if (config.unknownTag() != null && config.unknownChar() != null
                && symbols.size() == 1 && symbols.get(0).equals(config.unknownChar())) {
            result = List.of(config.unknownTag());
        } else if (restriction != null) {
            result = List.copyOf(restriction.apply(symbols));
        } else {
            result = List.copyOf(symbols);
        }

        cache.put(word, result);
        return result;
    }

    List<String> applyMerges(List<String> word) {
        while (word.size() > 1) {
            SymbolPair best = null;
            int bestRank = Integer.MAX_VALUE;
            for (int i = 0; i < word.size() - 1; i++) {
                SymbolPair pair = new SymbolPair(word.get(i), word.get(i + 1));
                int rank = table.rank(pair);
                if (rank >= 0 && rank < bestRank) {
                    bestRank = rank;
                    best = pair;
                }
            }
            if (best == null) {
                break;
            }
            word = fuse(word, best);
        }
        return word;
    }

    private static List<String> fuse(List<String> word, SymbolPair pair) {
        List<String> fused = new ArrayList<>(word.size());
        int i = 0;
        while (i < word.size()) {
            if (i < word.size() - 1 && word.get(i).equals(pair.first()) && word.get(i + 1).equals(pair.second())) {
                fused.add(pair.merged());
                i += 2;
            } else {
                fused.add(word.get(i));
                i++;
            }
        }
        return fused;
    }

    private static void stripEndOfWord(List<String> symbols) {
        int last = symbols.size() - 1;
        String symbol = symbols.get(last);
        if (symbol.equals(BpeVersion.END_OF_WORD)) {
            symbols.remove(last);
        } else if (symbol.endsWith(BpeVersion.END_OF_WORD)) {
            symbols.set(last, symbol.substring(0, symbol.length() - BpeVersion.END_OF_WORD.length()));
        }
    }

    public int cacheSize() {
        return cache.size();
    }

    public void clearCache() {
        cache.clear();
    }
}
