package pl.marcinmilkowski.proof_text.filter;

import pl.marcinmilkowski.proof_text.vocab.WordCount;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Words that passed a filter, with their counts, in vocabulary order
 * (most frequent first for frequency-sorted vocabularies).
 *
 * Never empty: filters signal "nothing matched" with {@link NoMatchException}.
 * Immutable; cumulative sampling weights are memoized per randomness value.
 */
public final class FilteredCollection {

    private final List<WordCount> entries;
    private final long maxCount;
    private final Map<Double, double[]> cumulativeWeights = new ConcurrentHashMap<>();

    public FilteredCollection(List<WordCount> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("Filtered collection must not be empty");
        }
        this.entries = List.copyOf(entries);
        this.maxCount = this.entries.stream().mapToLong(WordCount::count).max().orElse(1);
    }

    public List<WordCount> getEntries() {
        return entries;
    }

    /**
     * Get the words without counts.
     */
    public List<String> getWords() {
        return entries.stream().map(WordCount::word).toList();
    }

    public WordCount get(int index) {
        return entries.get(index);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Get the highest count in the collection.
     */
    public long getMaxCount() {
        return maxCount;
    }

    /**
     * Restrict to the k most frequent entries (k <= 0 or k >= size keeps everything).
     */
    public FilteredCollection topK(int k) {
        if (k <= 0 || k >= entries.size()) {
            return this;
        }
        return new FilteredCollection(entries.subList(0, k));
    }

    /**
     * Running totals of the interpolated weights {@code (1-r)*count + r*max}.
     * Only the endpoints 0 and 1 are memoized, so the memo holds at most two arrays;
     * other values are computed per call. Callers must not modify the array.
     */
    public double[] cumulativeWeights(double randomness) {
        if (randomness == 0.0 || randomness == 1.0) {
            return cumulativeWeights.computeIfAbsent(randomness == 0.0 ? 0.0 : 1.0, this::computeCumulativeWeights);
        }
        return computeCumulativeWeights(randomness);
    }

    int memoizedWeightCount() {
        return cumulativeWeights.size();
    }

    private double[] computeCumulativeWeights(double r) {
        double[] cumulative = new double[entries.size()];
        double total = 0;
        for (int i = 0; i < cumulative.length; i++) {
            total += (1 - r) * entries.get(i).count() + r * maxCount;
            cumulative[i] = total;
        }
        return cumulative;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilteredCollection)) return false;
        return entries.equals(((FilteredCollection) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "FilteredCollection" + entries;
    }
}
