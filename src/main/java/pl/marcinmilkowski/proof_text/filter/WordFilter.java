package pl.marcinmilkowski.proof_text.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.proof_text.vocab.WordTable;

/**
 * Entry point for word filtering: case resolution plus structural criteria, memoized.
 *
 * Criteria are validated before any word is looked at, so malformed criteria
 * fail the same way whether or not words would have matched.
 * Safe for concurrent use.
 */
public class WordFilter {
    private static final Logger logger = LoggerFactory.getLogger(WordFilter.class);

    private final CaseResolver caseResolver;
    private final StructuralFilter structuralFilter;
    private final FilterCache cache;

    public WordFilter() {
        this(new CaseResolver(), new StructuralFilter(), new FilterCache());
    }

    public WordFilter(CaseResolver caseResolver, StructuralFilter structuralFilter, FilterCache cache) {
        this.caseResolver = caseResolver;
        this.structuralFilter = structuralFilter;
        this.cache = cache;
    }

    /**
     * Filter a vocabulary.
     *
     * @param table    Vocabulary
     * @param glyphs   Available glyphs (null for unconstrained)
     * @param mode     Requested case
     * @param criteria Structural constraints (null for none)
     * @return Non-empty collection of matching, possibly recased, words
     * @throws NoMatchException if no word matches
     * @throws CaseConfigurationException if the case mode is impossible with the glyphs
     * @throws CriteriaValidationException if the criteria are malformed
     */
    public FilteredCollection filter(WordTable table, GlyphSet glyphs, CaseMode mode, StructuralCriteria criteria) {
        return filter(table, glyphs, mode, criteria, 1);
    }

    public FilteredCollection filter(WordTable table, GlyphSet glyphs, CaseMode mode, StructuralCriteria criteria,
                                     int minimumResults) {
        GlyphSet effectiveGlyphs = glyphs == null ? GlyphSet.UNCONSTRAINED : glyphs;
        StructuralCriteria effectiveCriteria = criteria == null ? StructuralCriteria.NONE : criteria;
        CaseMode effectiveMode = mode == null ? CaseMode.ANY : mode;

        FilterCache.FilterKey key = new FilterCache.FilterKey(
            table, effectiveGlyphs, effectiveMode, minimumResults, effectiveCriteria);
        FilteredCollection cached = cache.get(key);
        if (cached != null) {
            return cached;
        }

        structuralFilter.validate(effectiveCriteria);
        FilteredCollection result = caseResolver.resolve(table, effectiveGlyphs, effectiveMode, minimumResults,
            words -> structuralFilter.apply(words, effectiveCriteria));
        cache.put(key, result);
        logger.debug("Filtered {} with case={}, glyphs='{}', {}: {} words",
            table, effectiveMode.label(), effectiveGlyphs, effectiveCriteria, result.size());
        return result;
    }

    public FilterCache getCache() {
        return cache;
    }
}
