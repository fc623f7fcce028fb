package pl.marcinmilkowski.proof_text;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.proof_text.filter.CriteriaValidationException;
import pl.marcinmilkowski.proof_text.filter.GlyphSet;
import pl.marcinmilkowski.proof_text.filter.NoMatchException;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for NumberGenerator.
 */
class NumberGeneratorTest {

    private final NumberGenerator generator = new NumberGenerator();

    @Test
    @DisplayName("Numbers use only available digits and default lengths")
    void testDigitsAndLength() {
        Random random = new Random(3);
        for (int i = 0; i < 200; i++) {
            String n = generator.number(GlyphSet.of("abc017"), null, null, null, random);
            assertTrue(n.matches("[017]{1,4}"), n);
        }
    }

    @Test
    @DisplayName("Exact length overrides the range")
    void testExactLength() {
        String n = generator.number(GlyphSet.UNCONSTRAINED, 1, 2, 6, new Random(1));
        assertEquals(6, n.length());
    }

    @Test
    @DisplayName("No digits means no numbers")
    void testNoDigits() {
        NoMatchException e = assertThrows(NoMatchException.class,
            () -> generator.number(GlyphSet.of("abc"), null, null, null, new Random()));
        assertEquals("number", e.getStage());
    }

    @Test
    @DisplayName("Invalid lengths are rejected")
    void testInvalidLengths() {
        assertThrows(CriteriaValidationException.class,
            () -> generator.number(GlyphSet.UNCONSTRAINED, 5, 2, null, new Random()));
        assertThrows(CriteriaValidationException.class,
            () -> generator.number(GlyphSet.UNCONSTRAINED, 0, 2, null, new Random()));
    }
}
