package pl.marcinmilkowski.proof_text.filter;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.proof_text.vocab.VocabularyLoader;
import pl.marcinmilkowski.proof_text.vocab.WordCount;
import pl.marcinmilkowski.proof_text.vocab.WordTable;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CaseResolver: explicit modes and the any-case cascade.
 */
class CaseResolverTest {

    private CaseResolver resolver;
    private WordTable ascending;
    private WordTable descending;

    @BeforeEach
    void setUp() {
        resolver = new CaseResolver();
        ascending = VocabularyLoader.parse("en", true, "grape\t1\napple\t2\nApple\t3\nBart\t4\nBART\t5\nDDoS\t6");
        descending = VocabularyLoader.parse("en", true, "grape\t6\napple\t5\nApple\t4\nBart\t3\nBART\t2\nDDoS\t1");
    }

    private static List<WordCount> entries(String... wordCounts) {
        return Arrays.stream(wordCounts)
            .map(s -> s.split(":"))
            .map(p -> new WordCount(p[0], Long.parseLong(p[1])))
            .toList();
    }

    private List<WordCount> resolve(WordTable table, String glyphs, CaseMode mode) {
        return resolver.resolve(table, GlyphSet.of(glyphs), mode).getEntries();
    }

    @Test
    @DisplayName("lc keeps lowercase words")
    void testLc() {
        assertEquals(entries("grape:1", "apple:2"), resolve(ascending, null, CaseMode.LC));
    }

    @Test
    @DisplayName("lc_force lowercases every word")
    void testLcForce() {
        assertEquals(entries("grape:1", "apple:2", "apple:3", "bart:4", "bart:5", "ddos:6"),
            resolve(ascending, null, CaseMode.LC_FORCE));
    }

    @Test
    @DisplayName("cap capitalizes lowercase and title-case words")
    void testCap() {
        assertEquals(entries("Grape:1", "Apple:2", "Apple:3", "Bart:4"),
            resolve(ascending, null, CaseMode.CAP));
    }

    @Test
    @DisplayName("cap_og keeps title-case words only")
    void testCapOg() {
        assertEquals(entries("Apple:3", "Bart:4"), resolve(ascending, null, CaseMode.CAP_OG));
    }

    @Test
    @DisplayName("cap_force capitalizes every word")
    void testCapForce() {
        assertEquals(entries("Grape:1", "Apple:2", "Apple:3", "Bart:4", "Bart:5", "Ddos:6"),
            resolve(ascending, null, CaseMode.CAP_FORCE));
    }

    @Test
    @DisplayName("uc uppercases everything except mixed-case words")
    void testUc() {
        assertEquals(entries("GRAPE:1", "APPLE:2", "APPLE:3", "BART:4", "BART:5"),
            resolve(ascending, null, CaseMode.UC));
    }

    @Test
    @DisplayName("uc_og and uc_force")
    void testUcVariants() {
        assertEquals(entries("BART:5"), resolve(ascending, null, CaseMode.UC_OG));
        assertEquals(entries("GRAPE:1", "APPLE:2", "APPLE:3", "BART:4", "BART:5", "DDOS:6"),
            resolve(ascending, null, CaseMode.UC_FORCE));
    }

    @Test
    @DisplayName("Explicit modes respect the glyph set")
    void testExplicitWithGlyphs() {
        assertEquals(entries("apple:2"), resolve(ascending, "aple", CaseMode.LC));
        assertEquals(entries("Apple:2", "Apple:3"), resolve(ascending, "Aple", CaseMode.CAP));
        assertEquals(entries("APPLE:2", "APPLE:3"), resolve(ascending, "APPLE", CaseMode.UC));
        assertEquals(entries("BART:4", "BART:5"), resolve(ascending, "BART", CaseMode.UC));
        assertEquals(entries("bart:4", "bart:5"), resolve(ascending, "bart", CaseMode.LC_FORCE));
        assertEquals(entries("Ddos:6"), resolve(ascending, "Ddos", CaseMode.CAP_FORCE));
    }

    @Test
    @DisplayName("No match in an explicit mode throws")
    void testExplicitNoMatch() {
        NoMatchException e = assertThrows(NoMatchException.class,
            () -> resolve(ascending, "bart", CaseMode.LC));
        assertEquals("case", e.getStage());
        assertThrows(NoMatchException.class, () -> resolve(ascending, "Ddos", CaseMode.CAP));
    }

    @Test
    @DisplayName("A mode needing a missing glyph class is a configuration error")
    void testConfigurationError() {
        CaseConfigurationException e = assertThrows(CaseConfigurationException.class,
            () -> resolve(ascending, "ABC", CaseMode.LC));
        assertEquals(CaseMode.LC, e.getMode());
        assertThrows(CaseConfigurationException.class, () -> resolve(ascending, "abc", CaseMode.CAP));
        assertThrows(CaseConfigurationException.class, () -> resolve(ascending, "abc", CaseMode.UC_FORCE));
    }

    @Test
    @DisplayName("any cascades from original spellings to capitalized to uppercase")
    void testAnyCascade() {
        assertEquals(entries("apple:5"), resolve(descending, "aple", CaseMode.ANY));
        assertEquals(entries("BART:2", "DDoS:1"), resolve(descending, "BARTDoS", CaseMode.ANY));
        assertEquals(entries("grape:6"), resolve(descending, "GRAPEgrape", CaseMode.ANY));
        assertEquals(entries("Grape:6"), resolve(descending, "Grape", CaseMode.ANY));
        assertEquals(entries("GRAPE:6"), resolve(descending, "GRAPE", CaseMode.ANY));
        assertEquals(entries("APPLE:5", "APPLE:4"), resolve(descending, "APLE", CaseMode.ANY));
    }

    @Test
    @DisplayName("any with no matching stage throws")
    void testAnyNoMatch() {
        assertThrows(NoMatchException.class, () -> resolve(descending, "bartdos", CaseMode.ANY));
    }

    @Test
    @DisplayName("any without glyph constraints returns the table unchanged")
    void testAnyUnconstrained() {
        assertEquals(descending.getEntries(), resolve(descending, null, CaseMode.ANY));
    }

    @Test
    @DisplayName("any result is a superset of any_og when the latter matches")
    void testAnySuperset() {
        List<WordCount> og = resolve(descending, "BARTDoSapple", CaseMode.ANY_OG);
        List<WordCount> any = resolver.resolve(descending, GlyphSet.of("BARTDoSapple"), CaseMode.ANY, 100)
            .getEntries();
        assertTrue(any.containsAll(og));
        assertTrue(any.size() >= og.size());
    }

    @Test
    @DisplayName("Cascade with a larger minimum merges stages by count without duplicates")
    void testCascadeMerge() {
        WordTable table = VocabularyLoader.parse("en", true, "paris\t9\nParis\t8\nPA\t5");
        List<WordCount> result = resolver.resolve(table, GlyphSet.of("PARISparis"), CaseMode.ANY, 10)
            .getEntries();

        // cap turns paris into a second Paris; uc adds PARIS for both and re-derives PA
        assertEquals(entries("paris:9", "Paris:9", "PARIS:9", "Paris:8", "PARIS:8", "PA:5"), result);
    }

    @Test
    @DisplayName("Unicameral scripts ignore the case mode")
    void testUnicameral() {
        WordTable arabic = VocabularyLoader.parse("ar", false, "كتاب\t10\nباب\t5");
        assertEquals(2, resolve(arabic, null, CaseMode.UC).size());
        assertEquals(entries("باب:5"), resolve(arabic, "باب", CaseMode.CAP));
    }

    @Test
    @DisplayName("Refinement runs inside every cascade stage")
    void testRefinementInCascade() {
        WordTable table = VocabularyLoader.parse("en", true, "Paris\t6\nPA\t5");
        StructuralFilter structural = new StructuralFilter();
        StructuralCriteria minFive = StructuralCriteria.builder().withMinLength(5).build();

        FilteredCollection result = resolver.resolve(table, GlyphSet.of("PARIS"), CaseMode.ANY, 1,
            words -> structural.apply(words, minFive));
        assertEquals(entries("PARIS:6"), result.getEntries());
    }
}
