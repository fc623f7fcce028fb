package pl.marcinmilkowski.proof_text;

import pl.marcinmilkowski.proof_text.filter.CriteriaValidationException;
import pl.marcinmilkowski.proof_text.filter.GlyphSet;
import pl.marcinmilkowski.proof_text.filter.NoMatchException;

import java.util.Random;

/**
 * Random numerals built from the digits a glyph set has.
 */
public class NumberGenerator {

    public static final int DEFAULT_MIN_LENGTH = 1;
    public static final int DEFAULT_MAX_LENGTH = 4;

    /**
     * Generate a numeral.
     *
     * @param glyphs      Available glyphs
     * @param minLength   Shortest length (null for {@value #DEFAULT_MIN_LENGTH})
     * @param maxLength   Longest length (null for {@value #DEFAULT_MAX_LENGTH})
     * @param exactLength Overrides min/max when set
     * @param random      Random source
     * @throws CriteriaValidationException if minLength > maxLength or a length is not positive
     * @throws NoMatchException if the glyph set has no digits
     */
    public String number(GlyphSet glyphs, Integer minLength, Integer maxLength, Integer exactLength, Random random) {
        int min;
        int max;
        if (exactLength != null) {
            min = exactLength;
            max = exactLength;
        } else {
            min = minLength != null ? minLength : DEFAULT_MIN_LENGTH;
            max = maxLength != null ? maxLength : DEFAULT_MAX_LENGTH;
        }
        if (min < 1) {
            throw new CriteriaValidationException("Number length must be at least 1, got " + min);
        }
        if (min > max) {
            throw new CriteriaValidationException("'minLength' must be less than or equal to 'maxLength' ("
                + min + " > " + max + ")");
        }

        String digits = (glyphs == null ? GlyphSet.UNCONSTRAINED : glyphs).digits();
        if (digits.isEmpty()) {
            throw new NoMatchException("number", "no numerals available in glyphs='" + glyphs + "'");
        }

        int length = min + random.nextInt(max - min + 1);
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(digits.charAt(random.nextInt(digits.length())));
        }
        return sb.toString();
    }
}
