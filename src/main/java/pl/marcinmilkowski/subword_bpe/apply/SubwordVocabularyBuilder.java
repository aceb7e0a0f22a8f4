package pl.marcinmilkowski.subword_bpe.apply;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.subword_bpe.vocabulary.Vocabulary;

import java.util.Map;

/**
 * Builds the vocabulary of subwords a corpus is segmented into.
 *
 * Every word is segmented once and each resulting piece (separator included)
 * is credited with the word's frequency. The result serves as target
 * vocabulary for {@link VocabularyRestriction} and as input to merge-table
 * subset extraction.
 */
public final class SubwordVocabularyBuilder {

    private static final Logger logger = LoggerFactory.getLogger(SubwordVocabularyBuilder.class);

    private SubwordVocabularyBuilder() {
    }

    public static Vocabulary build(BpeEncoder encoder, Vocabulary words) {
        Vocabulary subwords = new Vocabulary();
        for (Map.Entry<String, Long> entry : words.asMap().entrySet()) {
            for (String piece : encoder.pieces(entry.getKey())) {
                subwords.add(piece, entry.getValue());
            }
        }
        logger.info("Subword vocabulary: {} subwords from {} words", subwords.size(), words.size());
        return subwords;
    }
}
