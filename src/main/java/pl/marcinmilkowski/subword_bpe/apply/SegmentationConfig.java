package pl.marcinmilkowski.subword_bpe.apply;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable settings for applying a merge table.
 *
 * @param separator           appended to every non-final subword of a word
 * @param glossaries          literal strings that are never split or merged
 * @param regexGlossaries     regular expressions whose matches are never split or merged
 * @param unknownChar         reserved marker replaced by {@code unknownTag} when a word
 *                            encodes to exactly that marker; null disables it
 * @param unknownTag          replacement for {@code unknownChar}; null disables it
 * @param vocabularyThreshold minimum frequency for a target-vocabulary entry to count
 */
public record SegmentationConfig(
    String separator,
    List<String> glossaries,
    List<String> regexGlossaries,
    String unknownChar,
    String unknownTag,
    long vocabularyThreshold
) {
    public static final String DEFAULT_SEPARATOR = "@@";
    public static final String DEFAULT_UNKNOWN_CHAR = "\uFDEA";
    public static final String DEFAULT_UNKNOWN_TAG = "<unk>";

    public SegmentationConfig {
        Objects.requireNonNull(separator, "separator");
        if (separator.isEmpty() || separator.codePoints().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("separator must be non-empty and contain no whitespace: '"
                + separator + "'");
        }
        glossaries = glossaries != null ? List.copyOf(glossaries) : List.of();
        regexGlossaries = regexGlossaries != null ? List.copyOf(regexGlossaries) : List.of();
    }

    public static SegmentationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .separator(separator)
            .glossaries(glossaries)
            .regexGlossaries(regexGlossaries)
            .unknownChar(unknownChar)
            .unknownTag(unknownTag)
            .vocabularyThreshold(vocabularyThreshold);
    }

    /**
     * Builder for SegmentationConfig.
     */
    public static class Builder {
        private String separator = DEFAULT_SEPARATOR;
        private final List<String> glossaries = new ArrayList<>();
        private final List<String> regexGlossaries = new ArrayList<>();
        private String unknownChar = DEFAULT_UNKNOWN_CHAR;
        private String unknownTag = DEFAULT_UNKNOWN_TAG;
        private long vocabularyThreshold = 1;

        public Builder separator(String separator) {
            this.separator = separator;
            return this;
        }

        public Builder glossaries(List<String> glossaries) {
            this.glossaries.clear();
            this.glossaries.addAll(glossaries);
            return this;
        }

        public Builder regexGlossaries(List<String> regexGlossaries) {
            this.regexGlossaries.clear();
            this.regexGlossaries.addAll(regexGlossaries);
            return this;
        }

        public Builder unknownChar(String unknownChar) {
            this.unknownChar = unknownChar;
            return this;
        }

        public Builder unknownTag(String unknownTag) {
            this.unknownTag = unknownTag;
            return this;
        }

        public Builder vocabularyThreshold(long threshold) {
            this.vocabularyThreshold = threshold;
            return this;
        }

        public SegmentationConfig build() {
            return new SegmentationConfig(separator, glossaries, regexGlossaries,
                unknownChar, unknownTag, vocabularyThreshold);
        }
    }
}
