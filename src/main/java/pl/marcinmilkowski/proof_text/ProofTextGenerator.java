package pl.marcinmilkowski.proof_text;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.proof_text.filter.CaseMode;
import pl.marcinmilkowski.proof_text.filter.CriteriaValidationException;
import pl.marcinmilkowski.proof_text.filter.FilteredCollection;
import pl.marcinmilkowski.proof_text.filter.GlyphSet;
import pl.marcinmilkowski.proof_text.filter.NoMatchException;
import pl.marcinmilkowski.proof_text.filter.NoWordAtIndexException;
import pl.marcinmilkowski.proof_text.filter.WordFilter;
import pl.marcinmilkowski.proof_text.punctuation.DefaultPunctuation;
import pl.marcinmilkowski.proof_text.punctuation.PunctuationComposer;
import pl.marcinmilkowski.proof_text.punctuation.PunctuationProfile;
import pl.marcinmilkowski.proof_text.sample.Sampler;
import pl.marcinmilkowski.proof_text.vocab.WordTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Generates proofing text: words, sentences, paragraphs and whole texts
 * spelled only with the glyphs a typeface has.
 *
 * Holds the vocabularies, the default glyph set and vocabulary, and the
 * random source shared by word sampling and punctuation. A seed in the
 * options reseeds that source before the call; without one, the state carries
 * over from the previous call.
 *
 * When nothing matches, a call either throws ({@code raiseErrors}) or logs a
 * warning and yields an empty result, so a proof simply gets shorter. Invalid
 * parameters always throw.
 *
 * Not thread-safe: use one generator per proofing session.
 */
public class ProofTextGenerator {
    private static final Logger logger = LoggerFactory.getLogger(ProofTextGenerator.class);

    /** Default minimum word length for sampled words. */
    public static final int WORD_MIN_LENGTH = 1;

    /** Default minimum word length for top-word lookups. */
    public static final int TOP_WORD_MIN_LENGTH = 2;

    private final Map<String, WordTable> vocabularies = new LinkedHashMap<>();
    private String defaultVocabulary;
    private GlyphSet defaultGlyphs;
    private boolean raiseErrors;

    private final Random random;
    private final WordFilter wordFilter;
    private final Sampler sampler = new Sampler();
    private final PunctuationComposer composer = new PunctuationComposer();
    private final NumberGenerator numberGenerator = new NumberGenerator();
    private final DefaultPunctuation defaultPunctuation;

    public ProofTextGenerator() {
        this(new Random(), new WordFilter(), DefaultPunctuation.getInstance());
    }

    ProofTextGenerator(Random random, WordFilter wordFilter, DefaultPunctuation defaultPunctuation) {
        this.random = random;
        this.wordFilter = wordFilter;
        this.defaultPunctuation = defaultPunctuation;
        this.defaultGlyphs = GlyphSet.UNCONSTRAINED;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== Configuration ====================

    /**
     * Register a vocabulary under a name.
     */
    public void addVocabulary(String name, WordTable table) {
        vocabularies.put(name, table);
        logger.info("Added vocabulary '{}': {}", name, table);
    }

    /**
     * Get a vocabulary by name, or the default vocabulary for null.
     *
     * @throws IllegalArgumentException if the name is unknown or no default is set
     */
    public WordTable getVocabulary(String name) {
        String key = name != null ? name : defaultVocabulary;
        if (key == null) {
            throw new IllegalArgumentException("No vocabulary specified and no default vocabulary set");
        }
        WordTable table = vocabularies.get(key);
        if (table == null) {
            throw new IllegalArgumentException("Unknown vocabulary: " + key + " (available: " + vocabularies.keySet() + ")");
        }
        return table;
    }

    public List<String> listVocabularies() {
        return List.copyOf(vocabularies.keySet());
    }

    /**
     * Remove a vocabulary; the default is cleared when it named this one.
     *
     * @return the removed table, or null when none was registered
     */
    public WordTable removeVocabulary(String name) {
        WordTable removed = vocabularies.remove(name);
        if (name != null && name.equals(defaultVocabulary)) {
            defaultVocabulary = null;
        }
        return removed;
    }

    public void setDefaultVocabulary(String name) {
        this.defaultVocabulary = name;
    }

    public String getDefaultVocabulary() {
        return defaultVocabulary;
    }

    /**
     * Set the glyphs used when a call does not name its own (null for unconstrained).
     */
    public void setGlyphs(String glyphs) {
        this.defaultGlyphs = GlyphSet.of(glyphs);
    }

    public GlyphSet getGlyphs() {
        return defaultGlyphs;
    }

    public void setRaiseErrors(boolean raiseErrors) {
        this.raiseErrors = raiseErrors;
    }

    public boolean isRaiseErrors() {
        return raiseErrors;
    }

    /**
     * Reseed the shared random source.
     */
    public void seed(long seed) {
        random.setSeed(seed);
    }

    /**
     * Reseed from text, e.g. a proof name, via its hash code.
     */
    public void seed(String seed) {
        seed((long) seed.hashCode());
    }

    public WordFilter getWordFilter() {
        return wordFilter;
    }

    // ==================== Words ====================

    public String number(ProofOptions options) {
        reseed(options);
        return number(glyphsFor(options), raiseErrorsFor(options),
            options.getMinLength(), options.getMaxLength(), options.getExactLength());
    }

    private String number(GlyphSet glyphs, boolean raise, Integer minLength, Integer maxLength, Integer exactLength) {
        try {
            return numberGenerator.number(glyphs, minLength, maxLength, exactLength, random);
        } catch (NoMatchException e) {
            return failGently(e, raise);
        }
    }

    public String word() {
        return word(ProofOptions.DEFAULTS);
    }

    /**
     * Sample one word, weighted by frequency and interpolated toward uniform by the randomness option.
     *
     * @return The word, or "" if nothing matches and errors are not raised
     */
    public String word(ProofOptions options) {
        WordTable table = getVocabulary(options.getVocabulary());
        CriteriaValidationException.requireUnitInterval(options.getRandomness(), "randomness");
        reseed(options);

        try {
            FilteredCollection words = wordFilter.filter(table, glyphsFor(options), options.getCaseMode(),
                options.criteria(WORD_MIN_LENGTH));
            return sampler.sample(words, random, options.getRandomness(), options.getTopK());
        } catch (NoMatchException e) {
            return failGently(e, raiseErrorsFor(options));
        }
    }

    /**
     * Get the most frequent matching word, or the one at the index option (0 = most frequent).
     *
     * @return The word, or "" if nothing matches and errors are not raised
     */
    public String topWord(ProofOptions options) {
        WordTable table = getVocabulary(options.getVocabulary());
        boolean raise = raiseErrorsFor(options);

        FilteredCollection words;
        try {
            words = wordFilter.filter(table, glyphsFor(options), options.getCaseMode(),
                options.criteria(TOP_WORD_MIN_LENGTH));
        } catch (NoMatchException e) {
            return failGently(e, raise);
        }

        try {
            return sampler.nth(words, options.getIndex(), options.getTopK());
        } catch (NoWordAtIndexException e) {
            if (raise) {
                throw e;
            }
            logger.warn("{}", e.getMessage());
            return "";
        }
    }

    /**
     * Get consecutive top words, starting at the index option.
     * Indices past the end of the matching words are left out.
     */
    public List<String> topWords(ProofOptions options) {
        int count = options.getNumWords() != null ? options.getNumWords() : ProofOptions.DEFAULT_TOP_NUM_WORDS;
        int start = options.getIndex();

        List<String> result = new ArrayList<>(count);
        for (int i = start; i < start + count; i++) {
            String w = topWord(options.toBuilder().withIndex(i).build());
            if (!w.isEmpty()) {
                result.add(w);
            }
        }
        return result;
    }

    /**
     * Generate a list of words, optionally mixed with numbers.
     *
     * The first word is capitalized when capFirst applies (by default: unless the
     * glyphs lack uppercase letters) and the case option is {@code any}. A word
     * equal to the one before it is redrawn once.
     */
    public List<String> words(ProofOptions options) {
        WordTable table = getVocabulary(options.getVocabulary());
        GlyphSet glyphs = glyphsFor(options);
        CriteriaValidationException.requireUnitInterval(options.getNumberProbability(), "numberProbability");
        reseed(options);
        ProofOptions wordOptions = options.withoutSeed();

        int count = options.getNumWords() != null && options.getNumWords() > 0
            ? options.getNumWords()
            : between(options.getMinNumWords(), options.getMaxNumWords(), "numWords");

        boolean capFirst = options.getCapFirst() != null
            ? options.getCapFirst()
            : !glyphs.isConstrained() || glyphs.hasUppercase();
        ProofOptions firstWordOptions = wordOptions;
        if (capFirst && options.getCaseMode() == CaseMode.ANY) {
            if (canCapitalize(table, glyphs)) {
                firstWordOptions = wordOptions.toBuilder().withCase(CaseMode.CAP).build();
            } else if (options.getCapFirst() != null) {
                logger.debug("Not capitalizing the first word: vocabulary is {} and glyphs '{}' lack a letter case",
                    table.isBicameral() ? "bicameral" : "unicameral", glyphs);
            }
        }

        boolean raise = raiseErrorsFor(options);
        List<String> result = new ArrayList<>(count);
        String last = null;
        for (int i = 0; i < count; i++) {
            ProofOptions current = i == 0 ? firstWordOptions : wordOptions;
            boolean isNumber = random.nextDouble() < options.getNumberProbability();

            String w;
            if (isNumber) {
                w = number(glyphs, raise, null, null, null);
            } else {
                w = word(current);
                if (w.equals(last)) {
                    w = word(current);
                }
            }

            // empty when nothing matched and errors are not raised
            if (!w.isEmpty()) {
                result.add(w);
                last = w;
            }
        }
        return result;
    }

    // ==================== Sentences and beyond ====================

    public String sentence() {
        return sentence(ProofOptions.DEFAULTS);
    }

    /**
     * Generate a sentence: words joined with punctuation from the vocabulary's profile,
     * or the bundled profile for its language, or plain spaces if neither exists.
     */
    public String sentence(ProofOptions options) {
        WordTable table = getVocabulary(options.getVocabulary());
        GlyphSet glyphs = glyphsFor(options);
        if (options.isPunctuate()) {
            CriteriaValidationException.requireUnitInterval(options.getPunctuationRandomness(), "punctuationRandomness");
        }
        reseed(options);

        List<String> wordList = words(options.withoutSeed());
        if (!options.isPunctuate()) {
            return String.join(" ", wordList);
        }

        Optional<PunctuationProfile> profile = table.getPunctuation()
            .or(() -> defaultPunctuation.forLanguage(table.getLanguage()));
        if (profile.isEmpty()) {
            return String.join(" ", wordList);
        }
        return composer.compose(wordList, glyphs, profile.get(), options.getPunctuationRandomness(), random);
    }

    public List<String> sentences(ProofOptions options) {
        reseed(options);
        ProofOptions sentenceOptions = options.withoutSeed();

        int count = options.getNumSentences() != null && options.getNumSentences() > 0
            ? options.getNumSentences()
            : between(options.getMinNumSentences(), options.getMaxNumSentences(), "numSentences");

        List<String> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add(sentence(sentenceOptions));
        }
        return result;
    }

    public String paragraph() {
        return paragraph(ProofOptions.DEFAULTS);
    }

    public String paragraph(ProofOptions options) {
        reseed(options);
        return String.join(options.getSentenceSeparator(), sentences(options.withoutSeed()));
    }

    public List<String> paragraphs(ProofOptions options) {
        reseed(options);
        ProofOptions paragraphOptions = options.withoutSeed();

        List<String> result = new ArrayList<>(options.getNumParagraphs());
        for (int i = 0; i < options.getNumParagraphs(); i++) {
            result.add(paragraph(paragraphOptions));
        }
        return result;
    }

    public String text() {
        return text(ProofOptions.DEFAULTS);
    }

    public String text(ProofOptions options) {
        reseed(options);
        return String.join(options.getParagraphSeparator(), paragraphs(options.withoutSeed()));
    }

    // ==================== Helpers ====================

    private void reseed(ProofOptions options) {
        if (options.getSeed() != null) {
            random.setSeed(options.getSeed());
        }
    }

    private GlyphSet glyphsFor(ProofOptions options) {
        String glyphs = options.getGlyphs();
        return glyphs != null && !glyphs.isEmpty() ? GlyphSet.of(glyphs) : defaultGlyphs;
    }

    /**
     * A per-call true wins; otherwise the generator setting applies.
     */
    private boolean raiseErrorsFor(ProofOptions options) {
        return Boolean.TRUE.equals(options.getRaiseErrors()) || raiseErrors;
    }

    /**
     * Capitalizing needs both letter classes in a bicameral script.
     */
    private static boolean canCapitalize(WordTable table, GlyphSet glyphs) {
        return table.isBicameral() && glyphs.hasUppercase() && glyphs.hasLowercase();
    }

    private int between(int min, int max, String name) {
        if (min < 0 || min > max) {
            throw new CriteriaValidationException("Invalid range for " + name + ": " + min + ".." + max);
        }
        return min + random.nextInt(max - min + 1);
    }

    private static String failGently(NoMatchException e, boolean raise) {
        if (raise) {
            throw e;
        }
        logger.warn("{}", e.getMessage());
        return "";
    }

    /**
     * Builder for a configured generator. The first vocabulary added becomes the
     * default unless another is named.
     */
    public static class Builder {
        private final Map<String, WordTable> vocabularies = new LinkedHashMap<>();
        private String defaultVocabulary;
        private String glyphs;
        private boolean raiseErrors = false;
        private Long seed;
        private WordFilter wordFilter;

        public Builder withVocabulary(String name, WordTable table) {
            vocabularies.put(name, table);
            return this;
        }

        public Builder withDefaultVocabulary(String name) {
            this.defaultVocabulary = name;
            return this;
        }

        public Builder withGlyphs(String glyphs) {
            this.glyphs = glyphs;
            return this;
        }

        public Builder withRaiseErrors(boolean raiseErrors) {
            this.raiseErrors = raiseErrors;
            return this;
        }

        public Builder withSeed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder withWordFilter(WordFilter wordFilter) {
            this.wordFilter = wordFilter;
            return this;
        }

        public ProofTextGenerator build() {
            Random random = seed != null ? new Random(seed) : new Random();
            ProofTextGenerator generator = new ProofTextGenerator(random,
                wordFilter != null ? wordFilter : new WordFilter(), DefaultPunctuation.getInstance());
            vocabularies.forEach(generator::addVocabulary);
            String fallback = vocabularies.isEmpty() ? null : vocabularies.keySet().iterator().next();
            generator.setDefaultVocabulary(defaultVocabulary != null ? defaultVocabulary : fallback);
            generator.setGlyphs(glyphs);
            generator.setRaiseErrors(raiseErrors);
            return generator;
        }
    }
}
