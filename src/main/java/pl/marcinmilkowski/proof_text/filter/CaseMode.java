package pl.marcinmilkowski.proof_text.filter;

import java.util.Locale;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Letter case requested for generated words.
 *
 * Each explicit mode is a row of a dispatch table:
 * <ul>
 *   <li>source predicate: which vocabulary spellings may be used</li>
 *   <li>transform: how the spelling is changed</li>
 *   <li>glyph requirement: which glyph classes the result must be spelled from</li>
 * </ul>
 * "_OG" modes keep words that already have the case; "_FORCE" modes transform
 * every word; bare modes transform only words whose source case is compatible
 * (camel-case words and acronyms like "DDoS" are never recased by them).
 * {@link #ANY} is a cascading policy handled by {@link CaseResolver}, not a row.
 */
public enum CaseMode {

    /** Unmodified words, then capitalized, then uppercased if too few match. */
    ANY(null, null, null),

    /** Unmodified words only. */
    ANY_OG(SourceCase.ANY, Transform.NONE, GlyphRequirement.ALL),

    /** Words already lowercase in the vocabulary. */
    LC(SourceCase.LOWER, Transform.NONE, GlyphRequirement.LOWER),

    /** Every word, lowercased. */
    LC_FORCE(SourceCase.ANY, Transform.LOWER, GlyphRequirement.LOWER),

    /** Lowercase or capitalized words, capitalized. */
    CAP(SourceCase.LOWER_TAIL, Transform.CAPITALIZE, GlyphRequirement.TITLE),

    /** Words already capitalized in the vocabulary. */
    CAP_OG(SourceCase.TITLE, Transform.NONE, GlyphRequirement.TITLE),

    /** Every word, capitalized. */
    CAP_FORCE(SourceCase.ANY, Transform.CAPITALIZE, GlyphRequirement.TITLE),

    /** Words without mixed case, uppercased. */
    UC(SourceCase.NOT_MIXED, Transform.UPPER, GlyphRequirement.UPPER),

    /** Words already uppercase in the vocabulary. */
    UC_OG(SourceCase.UPPER, Transform.NONE, GlyphRequirement.UPPER),

    /** Every word, uppercased. */
    UC_FORCE(SourceCase.ANY, Transform.UPPER, GlyphRequirement.UPPER);

    private final SourceCase sourceCase;
    private final Transform transform;
    private final GlyphRequirement glyphRequirement;

    CaseMode(SourceCase sourceCase, Transform transform, GlyphRequirement glyphRequirement) {
        this.sourceCase = sourceCase;
        this.transform = transform;
        this.glyphRequirement = glyphRequirement;
    }

    public boolean isCascading() {
        return this == ANY;
    }

    SourceCase sourceCase() {
        return sourceCase;
    }

    Transform transform() {
        return transform;
    }

    GlyphRequirement glyphRequirement() {
        return glyphRequirement;
    }

    /**
     * Parse a mode name such as "cap_og" (case-insensitive).
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static CaseMode parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Case mode must not be null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid case option: " + name, e);
        }
    }

    /**
     * Lower-case name as used on the command line.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Which vocabulary spellings a mode accepts, judged by Unicode case categories.
     */
    enum SourceCase implements Predicate<String> {
        ANY(word -> true),
        LOWER(Pattern.compile("\\p{Ll}+")),
        // any first character, lowercase rest: "apple", "Apple" but not "BART"
        LOWER_TAIL(Pattern.compile(".\\p{Ll}*")),
        TITLE(Pattern.compile("\\p{Lu}\\p{Ll}*")),
        UPPER(Pattern.compile("\\p{Lu}+")),
        // rejects camel case ("iPhone") and acronyms with a lowercase tail ("DDoS", "PCIe")
        NOT_MIXED(word -> !MIXED_CASE.matcher(word).find());

        private final Predicate<String> predicate;

        SourceCase(Pattern pattern) {
            this(word -> pattern.matcher(word).matches());
        }

        SourceCase(Predicate<String> predicate) {
            this.predicate = predicate;
        }

        @Override
        public boolean test(String word) {
            return predicate.test(word);
        }
    }

    private static final Pattern MIXED_CASE = Pattern.compile("\\p{Ll}\\p{Lu}|\\p{Lu}{2,}\\p{Ll}");

    /**
     * Spelling change applied to accepted words.
     */
    enum Transform implements UnaryOperator<String> {
        NONE {
            @Override
            public String apply(String word) {
                return word;
            }
        },
        LOWER {
            @Override
            public String apply(String word) {
                return word.toLowerCase(Locale.ROOT);
            }
        },
        UPPER {
            @Override
            public String apply(String word) {
                return word.toUpperCase(Locale.ROOT);
            }
        },
        CAPITALIZE {
            @Override
            public String apply(String word) {
                int first = word.codePointAt(0);
                int rest = Character.charCount(first);
                return new StringBuilder(word.length())
                    .appendCodePoint(Character.toTitleCase(first))
                    .append(word.substring(rest).toLowerCase(Locale.ROOT))
                    .toString();
            }
        }
    }

    /**
     * Which glyph classes a transformed word must be spelled from.
     */
    enum GlyphRequirement {
        ALL(false, false),
        LOWER(true, false),
        UPPER(false, true),
        // first character uppercase glyph, rest lowercase glyphs
        TITLE(true, true);

        private final boolean needsLowercase;
        private final boolean needsUppercase;

        GlyphRequirement(boolean needsLowercase, boolean needsUppercase) {
            this.needsLowercase = needsLowercase;
            this.needsUppercase = needsUppercase;
        }

        boolean needsLowercase() {
            return needsLowercase;
        }

        boolean needsUppercase() {
            return needsUppercase;
        }

        /**
         * Check a transformed word against the glyph classes.
         */
        boolean canSpell(String word, GlyphSet all, GlyphSet lowercase, GlyphSet uppercase) {
            return switch (this) {
                case LOWER -> lowercase.canSpell(word);
                case UPPER -> uppercase.canSpell(word);
                case TITLE -> {
                    int first = word.codePointAt(0);
                    yield uppercase.contains(first)
                        && lowercase.canSpell(word.substring(Character.charCount(first)));
                }
                case ALL -> all.canSpell(word);
            };
        }
    }
}
