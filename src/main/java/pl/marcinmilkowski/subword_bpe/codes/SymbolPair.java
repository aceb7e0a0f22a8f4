package pl.marcinmilkowski.subword_bpe.codes;

import java.util.Objects;

/**
 * An ordered pair of adjacent symbols, i.e. one merge operation.
 *
 * Pairs are ordered lexicographically by code point over (first, second);
 * the learner uses that order to break frequency ties.
 */
public record SymbolPair(String first, String second) implements Comparable<SymbolPair> {

    public SymbolPair {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
    }

    public static SymbolPair of(String first, String second) {
        return new SymbolPair(first, second);
    }

    /**
     * The symbol produced by fusing this pair.
     */
    public String merged() {
        return first + second;
    }

    @Override
    public int compareTo(SymbolPair other) {
        int cmp = compareSymbols(first, other.first);
        return cmp != 0 ? cmp : compareSymbols(second, other.second);
    }

    /**
     * Compares by Unicode code point rather than UTF-16 unit, so symbols outside
     * the BMP sort after every BMP character.
     */
    public static int compareSymbols(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }

    @Override
    public String toString() {
        return first + " " + second;
    }
}
