package pl.marcinmilkowski.proof_text.filter;

/**
 * Thrown for malformed filter or generation parameters: non-alphabetic substring
 * constraints, inverted length ranges, invalid regular expressions, or
 * probabilities outside [0, 1].
 *
 * Signals caller misuse and is never swallowed.
 */
public class CriteriaValidationException extends IllegalArgumentException {

    public CriteriaValidationException(String message) {
        super(message);
    }

    public CriteriaValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Check that a probability-like parameter lies in [0, 1].
     */
    public static double requireUnitInterval(double value, String name) {
        if (Double.isNaN(value) || value < 0 || value > 1) {
            throw new CriteriaValidationException("'" + name + "' must be between 0 and 1, got " + value);
        }
        return value;
    }
}
