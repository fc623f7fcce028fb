package pl.marcinmilkowski.proof_text;

import pl.marcinmilkowski.proof_text.filter.CaseMode;
import pl.marcinmilkowski.proof_text.filter.StructuralCriteria;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Named parameters for {@link ProofTextGenerator} calls.
 *
 * One options object flows from {@code text} down to {@code word}: each level
 * reads the fields it understands and passes the rest on. Unset fields fall
 * back to the generator defaults.
 */
public final class ProofOptions {

    public static final int DEFAULT_MIN_NUM_WORDS = 10;
    public static final int DEFAULT_MAX_NUM_WORDS = 20;
    public static final int DEFAULT_TOP_NUM_WORDS = 10;
    public static final int DEFAULT_MIN_NUM_SENTENCES = 4;
    public static final int DEFAULT_MAX_NUM_SENTENCES = 7;
    public static final int DEFAULT_NUM_PARAGRAPHS = 3;

    public static final ProofOptions DEFAULTS = builder().build();

    private final String vocabulary;
    private final String glyphs;
    private final Long seed;
    private final CaseMode caseMode;
    private final double randomness;
    private final int topK;
    private final int index;
    private final Integer minLength;
    private final Integer maxLength;
    private final Integer exactLength;
    private final String startsWith;
    private final String endsWith;
    private final List<String> contains;
    private final List<String> inner;
    private final String regex;
    private final Boolean raiseErrors;
    private final Integer numWords;
    private final int minNumWords;
    private final int maxNumWords;
    private final double numberProbability;
    private final Boolean capFirst;
    private final boolean punctuate;
    private final double punctuationRandomness;
    private final Integer numSentences;
    private final int minNumSentences;
    private final int maxNumSentences;
    private final String sentenceSeparator;
    private final int numParagraphs;
    private final String paragraphSeparator;

    private ProofOptions(Builder b) {
        this.vocabulary = b.vocabulary;
        this.glyphs = b.glyphs;
        this.seed = b.seed;
        this.caseMode = b.caseMode;
        this.randomness = b.randomness;
        this.topK = b.topK;
        this.index = b.index;
        this.minLength = b.minLength;
        this.maxLength = b.maxLength;
        this.exactLength = b.exactLength;
        this.startsWith = b.startsWith;
        this.endsWith = b.endsWith;
        this.contains = List.copyOf(b.contains);
        this.inner = List.copyOf(b.inner);
        this.regex = b.regex;
        this.raiseErrors = b.raiseErrors;
        this.numWords = b.numWords;
        this.minNumWords = b.minNumWords;
        this.maxNumWords = b.maxNumWords;
        this.numberProbability = b.numberProbability;
        this.capFirst = b.capFirst;
        this.punctuate = b.punctuate;
        this.punctuationRandomness = b.punctuationRandomness;
        this.numSentences = b.numSentences;
        this.minNumSentences = b.minNumSentences;
        this.maxNumSentences = b.maxNumSentences;
        this.sentenceSeparator = b.sentenceSeparator;
        this.numParagraphs = b.numParagraphs;
        this.paragraphSeparator = b.paragraphSeparator;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.vocabulary = vocabulary;
        b.glyphs = glyphs;
        b.seed = seed;
        b.caseMode = caseMode;
        b.randomness = randomness;
        b.topK = topK;
        b.index = index;
        b.minLength = minLength;
        b.maxLength = maxLength;
        b.exactLength = exactLength;
        b.startsWith = startsWith;
        b.endsWith = endsWith;
        b.contains.addAll(contains);
        b.inner.addAll(inner);
        b.regex = regex;
        b.raiseErrors = raiseErrors;
        b.numWords = numWords;
        b.minNumWords = minNumWords;
        b.maxNumWords = maxNumWords;
        b.numberProbability = numberProbability;
        b.capFirst = capFirst;
        b.punctuate = punctuate;
        b.punctuationRandomness = punctuationRandomness;
        b.numSentences = numSentences;
        b.minNumSentences = minNumSentences;
        b.maxNumSentences = maxNumSentences;
        b.sentenceSeparator = sentenceSeparator;
        b.numParagraphs = numParagraphs;
        b.paragraphSeparator = paragraphSeparator;
        return b;
    }

    /**
     * Same options with the seed cleared, for passing down after reseeding.
     */
    ProofOptions withoutSeed() {
        if (seed == null) {
            return this;
        }
        Builder b = toBuilder();
        b.seed = null;
        return b.build();
    }

    /**
     * Structural criteria for word filtering.
     *
     * @param defaultMinLength Minimum length used when none is set
     */
    StructuralCriteria criteria(int defaultMinLength) {
        return new StructuralCriteria(
            minLength != null ? minLength : defaultMinLength,
            maxLength, exactLength, startsWith, endsWith, contains, inner, regex);
    }

    public String getVocabulary() {
        return vocabulary;
    }

    public String getGlyphs() {
        return glyphs;
    }

    public Long getSeed() {
        return seed;
    }

    public CaseMode getCaseMode() {
        return caseMode;
    }

    public double getRandomness() {
        return randomness;
    }

    public int getTopK() {
        return topK;
    }

    public int getIndex() {
        return index;
    }

    public Integer getMinLength() {
        return minLength;
    }

    public Integer getMaxLength() {
        return maxLength;
    }

    public Integer getExactLength() {
        return exactLength;
    }

    public Boolean getRaiseErrors() {
        return raiseErrors;
    }

    public Integer getNumWords() {
        return numWords;
    }

    public int getMinNumWords() {
        return minNumWords;
    }

    public int getMaxNumWords() {
        return maxNumWords;
    }

    public double getNumberProbability() {
        return numberProbability;
    }

    public Boolean getCapFirst() {
        return capFirst;
    }

    public boolean isPunctuate() {
        return punctuate;
    }

    public double getPunctuationRandomness() {
        return punctuationRandomness;
    }

    public Integer getNumSentences() {
        return numSentences;
    }

    public int getMinNumSentences() {
        return minNumSentences;
    }

    public int getMaxNumSentences() {
        return maxNumSentences;
    }

    public String getSentenceSeparator() {
        return sentenceSeparator;
    }

    public int getNumParagraphs() {
        return numParagraphs;
    }

    public String getParagraphSeparator() {
        return paragraphSeparator;
    }

    /**
     * Builder for proof options.
     */
    public static class Builder {
        private String vocabulary;
        private String glyphs;
        private Long seed;
        private CaseMode caseMode = CaseMode.ANY;
        private double randomness = 0;
        private int topK = 0;
        private int index = 0;
        private Integer minLength;
        private Integer maxLength;
        private Integer exactLength;
        private String startsWith;
        private String endsWith;
        private final List<String> contains = new ArrayList<>();
        private final List<String> inner = new ArrayList<>();
        private String regex;
        private Boolean raiseErrors;
        private Integer numWords;
        private int minNumWords = DEFAULT_MIN_NUM_WORDS;
        private int maxNumWords = DEFAULT_MAX_NUM_WORDS;
        private double numberProbability = 0;
        private Boolean capFirst;
        private boolean punctuate = true;
        private double punctuationRandomness = 0;
        private Integer numSentences;
        private int minNumSentences = DEFAULT_MIN_NUM_SENTENCES;
        private int maxNumSentences = DEFAULT_MAX_NUM_SENTENCES;
        private String sentenceSeparator = " ";
        private int numParagraphs = DEFAULT_NUM_PARAGRAPHS;
        private String paragraphSeparator = "\n\n";

        public Builder withVocabulary(String vocabulary) {
            this.vocabulary = vocabulary;
            return this;
        }

        public Builder withGlyphs(String glyphs) {
            this.glyphs = glyphs;
            return this;
        }

        public Builder withSeed(long seed) {
            this.seed = seed;
            return this;
        }

        /**
         * Seed from text, e.g. a proof name.
         */
        public Builder withSeed(String seed) {
            this.seed = seed == null ? null : (long) seed.hashCode();
            return this;
        }

        public Builder withCase(CaseMode caseMode) {
            this.caseMode = caseMode == null ? CaseMode.ANY : caseMode;
            return this;
        }

        public Builder withRandomness(double randomness) {
            this.randomness = randomness;
            return this;
        }

        public Builder withTopK(int topK) {
            this.topK = topK;
            return this;
        }

        public Builder withIndex(int index) {
            this.index = index;
            return this;
        }

        public Builder withMinLength(Integer minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder withMaxLength(Integer maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder withExactLength(Integer exactLength) {
            this.exactLength = exactLength;
            return this;
        }

        public Builder withStartsWith(String startsWith) {
            this.startsWith = startsWith;
            return this;
        }

        public Builder withEndsWith(String endsWith) {
            this.endsWith = endsWith;
            return this;
        }

        public Builder withContains(String... substrings) {
            contains.addAll(Arrays.asList(substrings));
            return this;
        }

        public Builder withInner(String... substrings) {
            inner.addAll(Arrays.asList(substrings));
            return this;
        }

        public Builder withRegex(String regex) {
            this.regex = regex;
            return this;
        }

        public Builder withRaiseErrors(Boolean raiseErrors) {
            this.raiseErrors = raiseErrors;
            return this;
        }

        public Builder withNumWords(Integer numWords) {
            this.numWords = numWords;
            return this;
        }

        public Builder withNumWordsRange(int min, int max) {
            this.minNumWords = min;
            this.maxNumWords = max;
            return this;
        }

        public Builder withNumberProbability(double numberProbability) {
            this.numberProbability = numberProbability;
            return this;
        }

        public Builder withCapFirst(Boolean capFirst) {
            this.capFirst = capFirst;
            return this;
        }

        public Builder withPunctuation(boolean punctuate) {
            this.punctuate = punctuate;
            return this;
        }

        public Builder withPunctuationRandomness(double punctuationRandomness) {
            this.punctuationRandomness = punctuationRandomness;
            return this;
        }

        public Builder withNumSentences(Integer numSentences) {
            this.numSentences = numSentences;
            return this;
        }

        public Builder withNumSentencesRange(int min, int max) {
            this.minNumSentences = min;
            this.maxNumSentences = max;
            return this;
        }

        public Builder withSentenceSeparator(String sentenceSeparator) {
            this.sentenceSeparator = sentenceSeparator;
            return this;
        }

        public Builder withNumParagraphs(int numParagraphs) {
            this.numParagraphs = numParagraphs;
            return this;
        }

        public Builder withParagraphSeparator(String paragraphSeparator) {
            this.paragraphSeparator = paragraphSeparator;
            return this;
        }

        public ProofOptions build() {
            return new ProofOptions(this);
        }
    }
}
