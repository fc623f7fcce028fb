package pl.marcinmilkowski.proof_text.filter;

/**
 * Thrown when a case mode cannot work with the glyph set at all,
 * e.g. {@code cap} requested while the glyph set has no uppercase letters.
 *
 * Signals caller misuse and is never swallowed.
 */
public class CaseConfigurationException extends IllegalArgumentException {

    private final CaseMode mode;

    public CaseConfigurationException(CaseMode mode, String message) {
        super("case='" + mode.label() + "' but " + message);
        this.mode = mode;
    }

    public CaseMode getMode() {
        return mode;
    }
}
