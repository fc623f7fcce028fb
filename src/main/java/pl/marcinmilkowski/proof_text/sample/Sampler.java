package pl.marcinmilkowski.proof_text.sample;

import pl.marcinmilkowski.proof_text.filter.CriteriaValidationException;
import pl.marcinmilkowski.proof_text.filter.FilteredCollection;
import pl.marcinmilkowski.proof_text.filter.NoWordAtIndexException;

import java.util.Random;

/**
 * Picks words from a filtered collection.
 *
 * Weighted sampling interpolates each count toward the collection maximum:
 * <pre>
 *   w = (1 - randomness) * count + randomness * max
 * </pre>
 * so randomness 0 follows corpus frequency and randomness 1 is uniform.
 * The caller supplies the {@link Random}; the sampler itself is stateless.
 */
public class Sampler {

    /**
     * Draw one word by inverse-CDF sampling over the cumulative weights.
     *
     * @param collection Candidate words
     * @param random     Random source (same seed and collection give the same word)
     * @param randomness Interpolation toward uniform, in [0, 1]
     * @throws CriteriaValidationException if randomness is outside [0, 1]
     */
    public String sample(FilteredCollection collection, Random random, double randomness) {
        CriteriaValidationException.requireUnitInterval(randomness, "randomness");

        double[] cumulative = collection.cumulativeWeights(randomness);
        double target = random.nextDouble() * cumulative[cumulative.length - 1];
        return collection.get(firstAbove(cumulative, target)).word();
    }

    /**
     * Sample after restricting to the k most frequent words (k <= 0 for no limit).
     */
    public String sample(FilteredCollection collection, Random random, double randomness, int topK) {
        return sample(collection.topK(topK), random, randomness);
    }

    /**
     * Get the word at a position in frequency order (0 is the most frequent).
     *
     * @throws NoWordAtIndexException if the index is outside the collection
     */
    public String nth(FilteredCollection collection, int index) {
        if (index < 0 || index >= collection.size()) {
            throw new NoWordAtIndexException(index, collection.size());
        }
        return collection.get(index).word();
    }

    public String nth(FilteredCollection collection, int index, int topK) {
        return nth(collection.topK(topK), index);
    }

    /**
     * Index of the first cumulative weight strictly greater than the target.
     */
    static int firstAbove(double[] cumulative, double target) {
        int low = 0;
        int high = cumulative.length - 1;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (cumulative[mid] > target) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low;
    }
}
