package pl.marcinmilkowski.subword_bpe.apply;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.subword_bpe.codes.BpeVersion;
import pl.marcinmilkowski.subword_bpe.codes.MergeTable;
import pl.marcinmilkowski.subword_bpe.codes.SymbolPair;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Splits out-of-vocabulary subwords back into the pieces they were merged from,
 * until every piece is in the target vocabulary or cannot be split further.
 *
 * Vocabulary membership is checked on the written form: non-final pieces with
 * the separator appended, the final piece without it. The final piece is
 * looked up in the merge table with the end-of-word marker restored.
 */
public final class VocabularyRestriction {

    private static final Logger logger = LoggerFactory.getLogger(VocabularyRestriction.class);

    private final MergeTable table;
    private final Set<String> vocabulary;
    private final String separator;

    public VocabularyRestriction(MergeTable table, Set<String> vocabulary, String separator) {
        this.table = table;
        this.vocabulary = vocabulary;
        this.separator = separator;
    }

    /**
     * @param symbols a word's subwords, end-of-word marker already removed
     */
    public List<String> apply(List<String> symbols) {
        List<String> out = new ArrayList<>(symbols.size() + 4);
        int last = symbols.size() - 1;
        for (int i = 0; i < last; i++) {
            String segment = symbols.get(i);
            if (vocabulary.contains(segment + separator)) {
                out.add(segment);
            } else {
                logger.debug("OOV: {}{}", segment, separator);
                split(segment, false, out);
            }
        }
        if (last >= 0) {
            String segment = symbols.get(last);
            if (vocabulary.contains(segment)) {
                out.add(segment);
            } else {
                logger.debug("final OOV: {}", segment);
                split(segment, true, out);
            }
        }
        return out;
    }

    /**
     * Reverses merges for {@code segment}, left piece before right piece.
     * Constituents were always merged earlier than the symbol they form, so the
     * walk follows a finite, acyclic chain.
     */
    void split(String segment, boolean isFinal, List<String> out) {
        Deque<Step> pending = new ArrayDeque<>();
        pending.push(new Step(segment, isFinal, false));

        while (!pending.isEmpty()) {
            Step step = pending.pop();
            if (step.emit) {
                emit(step.segment, out);
                continue;
            }

            SymbolPair source = step.isFinal
                ? table.sourcePair(step.segment + BpeVersion.END_OF_WORD)
                : table.sourcePair(step.segment);
            if (source == null) {
                emit(step.segment, out);
                continue;
            }

            String left = source.first();
            String right = step.isFinal ? stripEndOfWord(source.second()) : source.second();

            boolean rightKnown = step.isFinal
                ? vocabulary.contains(right)
                : vocabulary.contains(right + separator);
            pending.push(new Step(right, step.isFinal, rightKnown));
            pending.push(new Step(left, false, vocabulary.contains(left + separator)));
        }
    }

    // A detached marker (version 0.1) leaves nothing to emit.
    private static void emit(String segment, List<String> out) {
        if (!segment.isEmpty()) {
            out.add(segment);
        }
    }

    private static String stripEndOfWord(String symbol) {
        return symbol.endsWith(BpeVersion.END_OF_WORD)
            ? symbol.substring(0, symbol.length() - BpeVersion.END_OF_WORD.length())
            : symbol;
    }

    private record Step(String segment, boolean isFinal, boolean emit) {
    }
}
