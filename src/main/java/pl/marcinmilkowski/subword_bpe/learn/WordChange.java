package pl.marcinmilkowski.subword_bpe.learn;

/**
 * A word rewritten by one merge step.
 *
 * @param wordIndex  position of the word in the learner's word list
 * @param newSymbols symbol IDs after the merge
 * @param oldSymbols symbol IDs before the merge
 * @param frequency  corpus frequency of the word
 */
public record WordChange(int wordIndex, int[] newSymbols, int[] oldSymbols, long frequency) {
}
