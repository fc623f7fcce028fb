package pl.marcinmilkowski.proof_text.filter;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CaseMode parsing and its dispatch rows.
 */
class CaseModeTest {

    @Test
    @DisplayName("parse() accepts command-line names")
    void testParse() {
        assertEquals(CaseMode.CAP_OG, CaseMode.parse("cap_og"));
        assertEquals(CaseMode.UC_FORCE, CaseMode.parse(" UC_FORCE "));
        assertEquals("lc_force", CaseMode.LC_FORCE.label());
        assertThrows(IllegalArgumentException.class, () -> CaseMode.parse("title"));
    }

    @Test
    @DisplayName("Only ANY cascades")
    void testCascading() {
        for (CaseMode mode : CaseMode.values()) {
            assertEquals(mode == CaseMode.ANY, mode.isCascading(), mode.label());
        }
    }

    @Test
    @DisplayName("Capitalizing lowercases the tail")
    void testCapitalize() {
        assertEquals("Ddos", CaseMode.Transform.CAPITALIZE.apply("DDoS"));
        assertEquals("Éclair", CaseMode.Transform.CAPITALIZE.apply("éclair"));
    }

    @Test
    @DisplayName("Bare uc skips mixed-case source words")
    void testNotMixed() {
        CaseMode.SourceCase notMixed = CaseMode.UC.sourceCase();
        assertTrue(notMixed.test("apple"));
        assertTrue(notMixed.test("Apple"));
        assertTrue(notMixed.test("BART"));
        assertFalse(notMixed.test("DDoS"));
        assertFalse(notMixed.test("iPhone"));
    }
}
