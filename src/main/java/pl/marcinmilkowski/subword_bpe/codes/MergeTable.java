package pl.marcinmilkowski.subword_bpe.codes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered list of learned merges. The position of a merge is its rank:
 * rank 0 was learned first and is applied with the highest priority.
 *
 * The table is immutable. When the same pair is listed more than once, only
 * the first occurrence defines its rank; {@link #merges()} still returns every
 * line as it was learned or read, so a table can be written back unchanged.
 */
public final class MergeTable {

    private final BpeVersion version;
    private final List<SymbolPair> merges;
    private final Map<SymbolPair, Integer> ranks;
    private final Map<String, SymbolPair> reverse;

    public MergeTable(BpeVersion version, List<SymbolPair> merges) {
        this.version = Objects.requireNonNull(version, "version");
        this.merges = List.copyOf(merges);

        Map<SymbolPair, Integer> rankMap = new LinkedHashMap<>();
        for (int i = 0; i < this.merges.size(); i++) {
            rankMap.putIfAbsent(this.merges.get(i), i);
        }
        this.ranks = Collections.unmodifiableMap(rankMap);

        // Several pairs may fuse into the same string; the lowest-ranked one owns it.
        Map<String, SymbolPair> reverseMap = new HashMap<>();
        for (SymbolPair pair : rankMap.keySet()) {
            reverseMap.putIfAbsent(pair.merged(), pair);
        }
        this.reverse = Collections.unmodifiableMap(reverseMap);
    }

    public static MergeTable empty(BpeVersion version) {
        return new MergeTable(version, List.of());
    }

    public BpeVersion version() {
        return version;
    }

    /**
     * All merges in line order, duplicates included.
     */
    public List<SymbolPair> merges() {
        return merges;
    }

    /**
     * Distinct merges in rank order.
     */
    public List<SymbolPair> orderedMerges() {
        return new ArrayList<>(ranks.keySet());
    }

    public int size() {
        return merges.size();
    }

    public boolean isEmpty() {
        return merges.isEmpty();
    }

    public boolean contains(SymbolPair pair) {
        return ranks.containsKey(pair);
    }

    /**
     * Returns the rank of the pair, or -1 if the table does not contain it.
     */
    public int rank(SymbolPair pair) {
        Integer rank = ranks.get(pair);
        return rank != null ? rank : -1;
    }

    /**
     * Returns the pair whose fusion produced {@code merged}, or null if the
     * symbol was never produced by a merge in this table.
     */
    public SymbolPair sourcePair(String merged) {
        return reverse.get(merged);
    }

    Map<String, SymbolPair> reverseMap() {
        return reverse;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MergeTable)) return false;
        MergeTable other = (MergeTable) o;
        return version == other.version && merges.equals(other.merges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, merges);
    }

    @Override
    public String toString() {
        return "MergeTable{version=" + version + ", merges=" + merges.size() + "}";
    }
}
