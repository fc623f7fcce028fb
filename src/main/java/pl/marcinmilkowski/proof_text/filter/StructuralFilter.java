package pl.marcinmilkowski.proof_text.filter;

import org.apache.lucene.util.automaton.Automata;
import org.apache.lucene.util.automaton.Automaton;
import org.apache.lucene.util.automaton.CharacterRunAutomaton;
import org.apache.lucene.util.automaton.Operations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.proof_text.vocab.WordCount;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Applies {@link StructuralCriteria} to a filtered collection.
 *
 * Stages run in a fixed order and each one stops the pipeline as soon as it
 * leaves no words:
 * <pre>
 * startsWith -> endsWith -> contains -> inner -> length -> regex
 * </pre>
 * The prefix, suffix and substring stages are compiled into Lucene automata
 * over code points, one automaton per substring; lengths are counted in code
 * points; the regex stage uses {@link Pattern} with Unicode character
 * classes, so {@code \p{Lu}}, {@code \p{IsArabic}} and the like work.
 * Compiled stages are memoized per criteria and never invalidated.
 */
public class StructuralFilter {
    private static final Logger logger = LoggerFactory.getLogger(StructuralFilter.class);

    private final Map<StructuralCriteria, List<Stage>> compiled = new ConcurrentHashMap<>();

    /**
     * One named filter step.
     */
    record Stage(String name, String description, Predicate<String> matcher) {
    }

    /**
     * Filter a collection.
     *
     * @param collection Input words (not modified)
     * @param criteria   Constraints; {@link StructuralCriteria#NONE} returns the input unchanged
     * @return Words satisfying every constraint, in input order
     * @throws CriteriaValidationException if the criteria are malformed
     * @throws NoMatchException naming the first stage that left no words
     */
    public FilteredCollection apply(FilteredCollection collection, StructuralCriteria criteria) {
        if (criteria == null || criteria.isEmpty()) {
            return collection;
        }

        List<WordCount> current = collection.getEntries();
        for (Stage stage : stagesFor(criteria)) {
            List<WordCount> next = new ArrayList<>();
            for (WordCount entry : current) {
                if (stage.matcher().test(entry.word())) {
                    next.add(entry);
                }
            }
            if (next.isEmpty()) {
                throw new NoMatchException(stage.name(), stage.description());
            }
            current = next;
        }
        return current.size() == collection.size() ? collection : new FilteredCollection(current);
    }

    /**
     * Validate criteria without filtering anything.
     *
     * @throws CriteriaValidationException if the criteria are malformed
     */
    public void validate(StructuralCriteria criteria) {
        if (criteria != null && !criteria.isEmpty()) {
            stagesFor(criteria);
        }
    }

    List<Stage> stagesFor(StructuralCriteria criteria) {
        List<Stage> stages = compiled.get(criteria);
        if (stages == null) {
            stages = compile(criteria);
            compiled.put(criteria, stages);
            logger.debug("Compiled {} filter stages for {}", stages.size(), criteria);
        }
        return stages;
    }

    private static List<Stage> compile(StructuralCriteria criteria) {
        List<Stage> stages = new ArrayList<>();

        if (criteria.startsWith() != null) {
            String prefix = requireAlphabetic(criteria.startsWith(), "startsWith");
            stages.add(automatonStage("startsWith", "startsWith='" + prefix + "'",
                Operations.concatenate(List.of(Automata.makeString(prefix), Automata.makeAnyString()))));
        }

        if (criteria.endsWith() != null) {
            String suffix = requireAlphabetic(criteria.endsWith(), "endsWith");
            stages.add(automatonStage("endsWith", "endsWith='" + suffix + "'",
                Operations.concatenate(List.of(Automata.makeAnyString(), Automata.makeString(suffix)))));
        }

        // one stage per substring; chaining stages gives the AND
        for (String substring : criteria.contains()) {
            requireAlphabetic(substring, "contains");
            stages.add(automatonStage("contains", "contains='" + substring + "'",
                Operations.concatenate(List.of(
                    Automata.makeAnyString(), Automata.makeString(substring), Automata.makeAnyString()))));
        }

        for (String substring : criteria.inner()) {
            requireAlphabetic(substring, "inner");
            // at least one character on each side of the substring
            stages.add(automatonStage("inner", "inner='" + substring + "'",
                Operations.concatenate(List.of(
                    Automata.makeAnyChar(), Automata.makeAnyString(),
                    Automata.makeString(substring),
                    Automata.makeAnyString(), Automata.makeAnyChar()))));
        }

        Stage length = lengthStage(criteria);
        if (length != null) {
            stages.add(length);
        }

        if (criteria.regex() != null) {
            Pattern pattern;
            try {
                pattern = Pattern.compile(criteria.regex(), Pattern.UNICODE_CHARACTER_CLASS);
            } catch (PatternSyntaxException e) {
                throw new CriteriaValidationException("Invalid regex '" + criteria.regex() + "': " + e.getDescription(), e);
            }
            stages.add(new Stage("regex", "regex='" + criteria.regex() + "'",
                word -> pattern.matcher(word).matches()));
        }

        return List.copyOf(stages);
    }

    private static Stage lengthStage(StructuralCriteria criteria) {
        Integer exact = criteria.exactLength();
        if (exact != null) {
            requireNonNegative(exact, "exactLength");
            return new Stage("length", "exactLength=" + exact, word -> codePointLength(word) == exact);
        }

        Integer min = criteria.minLength();
        Integer max = criteria.maxLength();
        if (min != null) requireNonNegative(min, "minLength");
        if (max != null) requireNonNegative(max, "maxLength");
        if (min != null && max != null && min > max) {
            throw new CriteriaValidationException("'minLength' must be less than or equal to 'maxLength' ("
                + min + " > " + max + ")");
        }
        if ((min == null || min == 0) && max == null) {
            return null;
        }

        int lower = min == null ? 0 : min;
        int upper = max == null ? Integer.MAX_VALUE : max;
        return new Stage("length", "minLength=" + lower + ", maxLength=" + max, word -> {
            int length = codePointLength(word);
            return length >= lower && length <= upper;
        });
    }

    private static int codePointLength(String word) {
        return word.codePointCount(0, word.length());
    }

    private static Stage automatonStage(String name, String description, Automaton automaton) {
        CharacterRunAutomaton run = new CharacterRunAutomaton(determinize(automaton));
        return new Stage(name, description, run::run);
    }

    private static Automaton determinize(Automaton a) {
        return Operations.determinize(a, Operations.DEFAULT_DETERMINIZE_WORK_LIMIT);
    }

    private static String requireAlphabetic(String value, String name) {
        if (value.isEmpty() || !value.codePoints().allMatch(Character::isLetter)) {
            throw new CriteriaValidationException("'" + name + "' must be a string of alphabetic characters, got '"
                + value + "'");
        }
        return value;
    }

    private static void requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new CriteriaValidationException("'" + name + "' must not be negative, got " + value);
        }
    }
}
