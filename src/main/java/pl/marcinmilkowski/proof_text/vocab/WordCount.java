package pl.marcinmilkowski.proof_text.vocab;

/**
 * A single vocabulary entry: a word and how often it occurs in the source corpus.
 *
 * A count of zero means "no frequency information" and is stored as 1, so a
 * plain word list behaves as a uniform corpus.
 */
public record WordCount(
    String word,    // Word as spelled in the vocabulary (case preserved)
    long count      // Occurrence count, always >= 1
) {

    public WordCount {
        if (word == null || word.isEmpty()) {
            throw new IllegalArgumentException("Word must not be empty");
        }
        if (count < 0) {
            throw new IllegalArgumentException("Negative count for word '" + word + "': " + count);
        }
        if (count == 0) {
            count = 1;
        }
    }

    /**
     * Create an entry without frequency information.
     */
    public static WordCount of(String word) {
        return new WordCount(word, 1);
    }

    /**
     * Same count, different spelling (used by case transforms).
     */
    public WordCount withWord(String newWord) {
        return new WordCount(newWord, count);
    }

    @Override
    public String toString() {
        return word + "\t" + count;
    }
}
