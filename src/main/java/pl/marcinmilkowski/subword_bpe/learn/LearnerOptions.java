package pl.marcinmilkowski.subword_bpe.learn;

import pl.marcinmilkowski.subword_bpe.codes.BpeVersion;
import pl.marcinmilkowski.subword_bpe.codes.SymbolPair;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable settings for one learning run.
 *
 * @param symbols           maximum number of merges to learn (forced merges not included)
 * @param minFrequency      stop once no pair occurs at least this often
 * @param minCount          drop vocabulary words rarer than this before learning
 * @param version           end-of-word convention of the resulting table
 * @param verbose           log every learned pair at INFO instead of DEBUG
 * @param forcedMerges      merges applied, in order, before greedy learning
 * @param forcedMergeFilter regex both symbols of a forced merge must match
 *                          (a trailing end-of-word marker is always allowed); null keeps all
 */
public record LearnerOptions(
    int symbols,
    long minFrequency,
    long minCount,
    BpeVersion version,
    boolean verbose,
    List<SymbolPair> forcedMerges,
    String forcedMergeFilter
) {
    public static final int DEFAULT_SYMBOLS = 10000;
    public static final long DEFAULT_MIN_FREQUENCY = 2;

    public LearnerOptions {
        if (symbols < 0) {
            throw new IllegalArgumentException("symbols must be >= 0, got " + symbols);
        }
        Objects.requireNonNull(version, "version");
        forcedMerges = forcedMerges != null ? List.copyOf(forcedMerges) : List.of();
    }

    public static LearnerOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .symbols(symbols)
            .minFrequency(minFrequency)
            .minCount(minCount)
            .version(version)
            .verbose(verbose)
            .forcedMerges(forcedMerges)
            .forcedMergeFilter(forcedMergeFilter);
    }

    /**
     * Builder for LearnerOptions.
     */
    public static class Builder {
        private int symbols = DEFAULT_SYMBOLS;
        private long minFrequency = DEFAULT_MIN_FREQUENCY;
        private long minCount = 1;
        private BpeVersion version = BpeVersion.V0_2;
        private boolean verbose = false;
        private final List<SymbolPair> forcedMerges = new ArrayList<>();
        private String forcedMergeFilter;

        public Builder symbols(int symbols) {
            this.symbols = symbols;
            return this;
        }

        public Builder minFrequency(long minFrequency) {
            this.minFrequency = minFrequency;
            return this;
        }

        public Builder minCount(long minCount) {
            this.minCount = minCount;
            return this;
        }

        public Builder version(BpeVersion version) {
            this.version = version;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder forcedMerges(List<SymbolPair> merges) {
            this.forcedMerges.clear();
            this.forcedMerges.addAll(merges);
            return this;
        }

        public Builder addForcedMerge(SymbolPair pair) {
            this.forcedMerges.add(pair);
            return this;
        }

        public Builder forcedMergeFilter(String regex) {
            this.forcedMergeFilter = regex;
            return this;
        }

        public LearnerOptions build() {
            return new LearnerOptions(symbols, minFrequency, minCount, version, verbose,
                forcedMerges, forcedMergeFilter);
        }
    }
}
