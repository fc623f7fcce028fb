package pl.marcinmilkowski.proof_text.vocab;

/**
 * Thrown when vocabulary data is empty or is neither a word/count TSV nor a plain word list.
 */
public class VocabularyFormatException extends IllegalArgumentException {

    public VocabularyFormatException(String message) {
        super(message);
    }

    public VocabularyFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
