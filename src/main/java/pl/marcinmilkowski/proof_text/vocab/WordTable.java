package pl.marcinmilkowski.proof_text.vocab;

import pl.marcinmilkowski.proof_text.punctuation.PunctuationProfile;

import java.util.List;
import java.util.Optional;

/**
 * Immutable vocabulary of words with occurrence counts.
 *
 * Entries keep the order of the source data, which is normally descending
 * frequency. The table also records the language and whether the script is
 * bicameral (has separate uppercase and lowercase letterforms); both drive
 * case handling and punctuation defaults.
 *
 * Tables are compared by identity, so two tables loaded from the same data
 * are cached separately.
 */
public final class WordTable {

    private final String language;
    private final boolean bicameral;
    private final List<WordCount> entries;
    private final PunctuationProfile punctuation;

    public WordTable(String language, boolean bicameral, List<WordCount> entries) {
        this(language, bicameral, entries, null);
    }

    /**
     * @param language    Language tag (e.g. "en"), used to pick default punctuation
     * @param bicameral   Whether the script distinguishes upper and lower case
     * @param entries     Word counts in source order
     * @param punctuation Table-specific punctuation profile, or null for the language default
     * @throws IllegalArgumentException if entries is empty
     */
    public WordTable(String language, boolean bicameral, List<WordCount> entries,
                     PunctuationProfile punctuation) {
        if (language == null || language.isBlank()) {
            throw new IllegalArgumentException("Language tag must not be blank");
        }
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("Word table for '" + language + "' has no entries");
        }
        this.language = language;
        this.bicameral = bicameral;
        this.entries = List.copyOf(entries);
        this.punctuation = punctuation;
    }

    public String getLanguage() {
        return language;
    }

    public boolean isBicameral() {
        return bicameral;
    }

    /**
     * Get all entries in source order.
     */
    public List<WordCount> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Get the table's own punctuation profile, if it has one.
     */
    public Optional<PunctuationProfile> getPunctuation() {
        return Optional.ofNullable(punctuation);
    }

    @Override
    public String toString() {
        return String.format("WordTable[%s bicameral=%s, %d words]", language, bicameral, entries.size());
    }
}
