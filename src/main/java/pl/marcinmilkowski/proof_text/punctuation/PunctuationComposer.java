package pl.marcinmilkowski.proof_text.punctuation;

import pl.marcinmilkowski.proof_text.filter.CriteriaValidationException;
import pl.marcinmilkowski.proof_text.filter.GlyphSet;
import pl.marcinmilkowski.proof_text.punctuation.PunctuationProfile.Wrap;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;

/**
 * Joins words into a punctuated sentence.
 *
 * One option is drawn from each table of the {@link PunctuationProfile},
 * considering only options whose characters exist in the glyph set (spaces are
 * always allowed). Option weights are interpolated toward uniform:
 * {@code (1 - randomness) * probability + randomness}. A table with no usable
 * option falls back to a plain space or an empty wrap, so missing punctuation
 * glyphs never make composition fail.
 *
 * For more than two words an inner wrap (parentheses, quotes) is placed around
 * a random span and one space is replaced by the insert separator; shorter
 * sentences only get the sentence wrap.
 */
public class PunctuationComposer {

    private static final String SPACE = " ";

    /**
     * Compose a sentence.
     *
     * @param words      Words in order (not modified)
     * @param glyphs     Available glyphs
     * @param profile    Punctuation probabilities
     * @param randomness Interpolation toward uniform choice, in [0, 1]
     * @param random     Random source shared with word sampling
     * @throws CriteriaValidationException if randomness is outside [0, 1]
     */
    public String compose(List<String> words, GlyphSet glyphs, PunctuationProfile profile,
                          double randomness, Random random) {
        CriteriaValidationException.requireUnitInterval(randomness, "punctuationRandomness");
        if (glyphs == null) {
            glyphs = GlyphSet.UNCONSTRAINED;
        }

        String insert = pick(profile.insert(), String::toString, glyphs, randomness, random);
        Wrap wrapSentence = pick(profile.wrapSentence(), Wrap::text, glyphs, randomness, random);
        Wrap wrapInner = pick(profile.wrapInner(), Wrap::text, glyphs, randomness, random);
        if (insert == null) insert = SPACE;
        if (wrapSentence == null) wrapSentence = Wrap.NONE;
        if (wrapInner == null) wrapInner = Wrap.NONE;

        String sentence;
        if (words.size() > 2) {
            sentence = punctuateInside(new ArrayList<>(words), insert, wrapInner, random);
        } else {
            sentence = String.join(SPACE, words);
        }
        return wrapSentence.prefix() + sentence + wrapSentence.suffix();
    }

    private static String punctuateInside(List<String> words, String insert, Wrap wrapInner, Random random) {
        int n = words.size();

        // inner wrap spans words [left, right], never reaching the last word
        int left = random.nextInt(n - 1);
        int right = left + random.nextInt(n - 1 - left);
        words.set(left, wrapInner.prefix() + words.get(left));
        words.set(right, words.get(right) + wrapInner.suffix());

        // separator k sits before word k; the last gap keeps its space
        List<Integer> candidates = new ArrayList<>();
        for (int k = 1; k < n - 1; k++) {
            if (k != left && k != right) {
                candidates.add(k);
            }
        }
        if (candidates.isEmpty()) {
            for (int k = 1; k < n - 1; k++) {
                candidates.add(k);
            }
        }
        int insertAt = candidates.get(random.nextInt(candidates.size()));

        StringBuilder sb = new StringBuilder(words.get(0));
        for (int k = 1; k < n; k++) {
            sb.append(k == insertAt ? insert : SPACE).append(words.get(k));
        }
        return sb.toString();
    }

    /**
     * Weighted choice among the glyph-compatible options, or null if there are none.
     */
    static <T> T pick(Map<T, Double> options, Function<T, String> text, GlyphSet glyphs,
                      double randomness, Random random) {
        List<T> available = new ArrayList<>();
        List<Double> weights = new ArrayList<>();
        double total = 0;
        for (Map.Entry<T, Double> option : options.entrySet()) {
            if (!glyphs.canSpellIgnoringSpaces(text.apply(option.getKey()))) {
                continue;
            }
            double weight = (1 - randomness) * option.getValue() + randomness;
            available.add(option.getKey());
            weights.add(weight);
            total += weight;
        }
        if (available.isEmpty()) {
            return null;
        }

        double target = random.nextDouble() * total;
        double cumulative = 0;
        for (int i = 0; i < available.size(); i++) {
            cumulative += weights.get(i);
            if (cumulative > target) {
                return available.get(i);
            }
        }
        return available.get(available.size() - 1);
    }
}
