package pl.marcinmilkowski.proof_text.filter;

/**
 * Thrown when a filter stage leaves no words.
 *
 * This is the recoverable "ran out of matching words" condition: generators
 * may log it and continue with shorter output.
 */
public class NoMatchException extends RuntimeException {

    private final String stage;
    private final String criteria;

    /**
     * @param stage    Filter stage that produced no words (e.g. "case", "startsWith")
     * @param criteria Human-readable description of the failing constraint
     */
    public NoMatchException(String stage, String criteria) {
        super("No words available after " + stage + " filter (" + criteria + ")");
        this.stage = stage;
        this.criteria = criteria;
    }

    /**
     * Get the name of the stage that produced no words.
     */
    public String getStage() {
        return stage;
    }

    public String getCriteria() {
        return criteria;
    }
}
