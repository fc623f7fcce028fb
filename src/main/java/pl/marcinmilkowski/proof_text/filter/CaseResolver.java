package pl.marcinmilkowski.proof_text.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.proof_text.vocab.WordCount;
import pl.marcinmilkowski.proof_text.vocab.WordTable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Selects (and recases) the vocabulary words that can be displayed with a glyph set.
 *
 * For explicit modes the {@link CaseMode} dispatch table decides which source
 * spellings qualify, how they are transformed and which glyph classes the result
 * must come from. For {@link CaseMode#ANY} with a constrained glyph set the
 * resolver cascades, extending the result until it holds enough words:
 * <ol>
 *   <li>unmodified words ({@code any_og})</li>
 *   <li>lowercase and capitalized words, capitalized ({@code cap})</li>
 *   <li>words without mixed case, uppercased ({@code uc})</li>
 * </ol>
 * Unmodified spellings are tried first so proper nouns and acronyms are not
 * recased when they can be shown as they are.
 */
public class CaseResolver {
    private static final Logger logger = LoggerFactory.getLogger(CaseResolver.class);

    private static final List<CaseMode> CASCADE = List.of(CaseMode.ANY_OG, CaseMode.CAP, CaseMode.UC);

    /**
     * Resolve with at least one result required.
     */
    public FilteredCollection resolve(WordTable table, GlyphSet glyphs, CaseMode mode) {
        return resolve(table, glyphs, mode, 1);
    }

    public FilteredCollection resolve(WordTable table, GlyphSet glyphs, CaseMode mode, int minimumResults) {
        return resolve(table, glyphs, mode, minimumResults, UnaryOperator.identity());
    }

    /**
     * Resolve case, refining each cascade stage before counting its results.
     *
     * The refinement (typically the structural filter) runs inside every stage,
     * so a stage whose words are all rejected by it does not stop the cascade.
     *
     * @param table          Vocabulary
     * @param glyphs         Available glyphs ({@link GlyphSet#UNCONSTRAINED} for all)
     * @param mode           Requested case
     * @param minimumResults Cascade continues while fewer words than this are found
     * @param refinement     Applied to each stage's words; may throw {@link NoMatchException}
     * @return Matching words; stage results are appended and the union is ordered by descending count
     * @throws CaseConfigurationException if an explicit mode needs a glyph class the set lacks
     * @throws NoMatchException if no words qualify
     */
    public FilteredCollection resolve(WordTable table, GlyphSet glyphs, CaseMode mode, int minimumResults,
                                      UnaryOperator<FilteredCollection> refinement) {
        if (glyphs == null) {
            glyphs = GlyphSet.UNCONSTRAINED;
        }

        if (!table.isBicameral()) {
            // case is meaningless, only glyph membership counts
            return refinement.apply(select(table, glyphs, CaseMode.ANY_OG));
        }

        if (!mode.isCascading()) {
            return refinement.apply(select(table, glyphs, mode));
        }

        if (!glyphs.isConstrained()) {
            // nothing to fall back from: every word is displayable as it is
            return refinement.apply(select(table, glyphs, CaseMode.ANY_OG));
        }

        return cascade(table, glyphs, Math.max(1, minimumResults), refinement);
    }

    private FilteredCollection cascade(WordTable table, GlyphSet glyphs, int minimumResults,
                                       UnaryOperator<FilteredCollection> refinement) {
        List<WordCount> union = new ArrayList<>();
        int stagesUsed = 0;

        for (CaseMode stage : CASCADE) {
            if (union.size() >= minimumResults) {
                break;
            }
            List<WordCount> found;
            try {
                found = refinement.apply(select(table, glyphs, stage)).getEntries();
            } catch (CaseConfigurationException e) {
                logger.debug("Skipping case stage {}: {}", stage.label(), e.getMessage());
                continue;
            } catch (NoMatchException e) {
                logger.debug("Case stage {} found no words: {}", stage.label(), e.getMessage());
                continue;
            }

            if (stagesUsed == 0) {
                union.addAll(found);
            } else {
                appendNew(union, found);
            }
            stagesUsed++;
            logger.debug("Case stage {} contributed; {} words so far", stage.label(), union.size());
        }

        if (union.isEmpty()) {
            throw new NoMatchException("case", "case='any', glyphs='" + glyphs + "'");
        }
        if (stagesUsed > 1) {
            // stable: ties keep stage order
            union.sort(Comparator.comparingLong(WordCount::count).reversed());
        }
        return new FilteredCollection(union);
    }

    /**
     * Add entries not already present. Equal entries are matched one for one,
     * so a later stage re-deriving a word the first stage kept is not doubled.
     */
    private static void appendNew(List<WordCount> union, List<WordCount> found) {
        List<WordCount> unmatched = new ArrayList<>(union);
        for (WordCount entry : found) {
            if (!unmatched.remove(entry)) {
                union.add(entry);
            }
        }
    }

    /**
     * Apply one explicit mode of the dispatch table.
     */
    FilteredCollection select(WordTable table, GlyphSet glyphs, CaseMode mode) {
        if (mode.isCascading()) {
            throw new IllegalArgumentException("Cascading mode has no single selection: " + mode);
        }

        CaseMode.GlyphRequirement requirement = mode.glyphRequirement();
        GlyphSet lowercase = glyphs.lowercase();
        GlyphSet uppercase = glyphs.uppercase();
        if (table.isBicameral() && glyphs.isConstrained()) {
            if (requirement.needsLowercase() && lowercase.isEmpty()) {
                throw new CaseConfigurationException(mode, "no lowercase glyphs found");
            }
            if (requirement.needsUppercase() && uppercase.isEmpty()) {
                throw new CaseConfigurationException(mode, "no uppercase glyphs found");
            }
        }

        List<WordCount> selected = new ArrayList<>();
        for (WordCount entry : table.getEntries()) {
            String word = entry.word();
            if (!mode.sourceCase().test(word)) {
                continue;
            }
            String recased = mode.transform().apply(word);
            if (requirement.canSpell(recased, glyphs, lowercase, uppercase)) {
                selected.add(recased.equals(word) ? entry : entry.withWord(recased));
            }
        }

        if (selected.isEmpty()) {
            throw new NoMatchException("case", "case='" + mode.label() + "', glyphs='" + glyphs + "'");
        }
        return new FilteredCollection(selected);
    }
}
