package pl.marcinmilkowski.proof_text.filter;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.proof_text.vocab.VocabularyLoader;
import pl.marcinmilkowski.proof_text.vocab.WordTable;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WordFilter: case resolution combined with structural criteria.
 */
class WordFilterTest {

    private WordFilter wordFilter;
    private WordTable table;

    @BeforeEach
    void setUp() {
        wordFilter = new WordFilter();
        table = VocabularyLoader.parse("en", true, "zoo\t10\nzebra\t4\nPA\t3\nParis\t2");
    }

    @Test
    @DisplayName("Uppercase fallback combines with length criteria")
    void testUppercaseWithLength() {
        FilteredCollection result = wordFilter.filter(table, GlyphSet.of("ZO"), CaseMode.ANY,
            StructuralCriteria.builder().withMinLength(3).build());
        assertEquals(List.of("ZOO"), result.getWords());
    }

    @Test
    @DisplayName("Structural rejection of an early stage lets the cascade continue")
    void testCascadeAfterStructuralRejection() {
        FilteredCollection result = wordFilter.filter(table, GlyphSet.of("PARIS"), CaseMode.ANY,
            StructuralCriteria.builder().withMinLength(5).build());
        assertEquals(List.of("PARIS"), result.getWords());
    }

    @Test
    @DisplayName("Repeated calls are served from the cache")
    void testCache() {
        StructuralCriteria criteria = StructuralCriteria.builder().withStartsWith("z").build();
        FilteredCollection first = wordFilter.filter(table, null, CaseMode.ANY, criteria);
        FilteredCollection second = wordFilter.filter(table, GlyphSet.UNCONSTRAINED, null,
            StructuralCriteria.builder().withStartsWith("z").build());

        assertSame(first, second);
        assertEquals(1, wordFilter.getCache().size());
        assertEquals(1, wordFilter.getCache().getHits());
        assertEquals(1, wordFilter.getCache().getMisses());
    }

    @Test
    @DisplayName("Failures are not cached")
    void testFailureNotCached() {
        StructuralCriteria criteria = StructuralCriteria.builder().withStartsWith("q").build();
        assertThrows(NoMatchException.class, () -> wordFilter.filter(table, null, CaseMode.ANY, criteria));
        assertEquals(0, wordFilter.getCache().size());
    }

    @Test
    @DisplayName("Invalid criteria fail before case resolution")
    void testValidationFirst() {
        assertThrows(CriteriaValidationException.class, () -> wordFilter.filter(table, GlyphSet.of("xyz"),
            CaseMode.LC, StructuralCriteria.builder().withMinLength(4).withMaxLength(2).build()));
    }

    @Test
    @DisplayName("Separate tables with the same data are cached separately")
    void testTableIdentity() {
        WordTable copy = VocabularyLoader.parse("en", true, "zoo\t10\nzebra\t4\nPA\t3\nParis\t2");
        wordFilter.filter(table, null, CaseMode.LC, null);
        wordFilter.filter(copy, null, CaseMode.LC, null);
        assertEquals(2, wordFilter.getCache().size());
    }
}
