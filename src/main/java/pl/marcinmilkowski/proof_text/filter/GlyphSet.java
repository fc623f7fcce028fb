package pl.marcinmilkowski.proof_text.filter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.IntPredicate;
import java.util.stream.Collectors;

/**
 * The characters a typeface currently supports.
 *
 * Works on Unicode code points. {@link #UNCONSTRAINED} permits every character;
 * it is what a null or empty glyph string maps to.
 */
public final class GlyphSet {

    public static final GlyphSet UNCONSTRAINED = new GlyphSet(Set.of(), false);

    private final Set<Integer> codePoints;
    private final boolean constrained;

    private GlyphSet(Set<Integer> codePoints, boolean constrained) {
        this.codePoints = codePoints;
        this.constrained = constrained;
    }

    /**
     * Build a glyph set from the characters of a string.
     *
     * @param glyphs Available characters; null or empty means unconstrained
     */
    public static GlyphSet of(String glyphs) {
        if (glyphs == null || glyphs.isEmpty()) {
            return UNCONSTRAINED;
        }
        Set<Integer> set = glyphs.codePoints()
            .boxed()
            .collect(Collectors.toCollection(LinkedHashSet::new));
        return new GlyphSet(Collections.unmodifiableSet(set), true);
    }

    public boolean isConstrained() {
        return constrained;
    }

    public boolean contains(int codePoint) {
        return !constrained || codePoints.contains(codePoint);
    }

    /**
     * Check that every character of the text is available.
     */
    public boolean canSpell(CharSequence text) {
        if (!constrained) return true;
        return text.codePoints().allMatch(codePoints::contains);
    }

    /**
     * Like {@link #canSpell} but spaces are always allowed.
     * Punctuation options carry spaces that a glyph string rarely lists.
     */
    public boolean canSpellIgnoringSpaces(CharSequence text) {
        if (!constrained) return true;
        return text.codePoints().allMatch(cp -> cp == ' ' || codePoints.contains(cp));
    }

    /**
     * Uppercase letters of this set (unconstrained stays unconstrained).
     */
    public GlyphSet uppercase() {
        return subset(Character::isUpperCase);
    }

    /**
     * Lowercase letters of this set (unconstrained stays unconstrained).
     */
    public GlyphSet lowercase() {
        return subset(Character::isLowerCase);
    }

    /**
     * ASCII digits of this set, in ascending order.
     */
    public String digits() {
        StringBuilder sb = new StringBuilder();
        for (char c = '0'; c <= '9'; c++) {
            if (contains(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public boolean hasUppercase() {
        return !constrained || codePoints.stream().anyMatch(Character::isUpperCase);
    }

    public boolean hasLowercase() {
        return !constrained || codePoints.stream().anyMatch(Character::isLowerCase);
    }

    public boolean isEmpty() {
        return constrained && codePoints.isEmpty();
    }

    private GlyphSet subset(IntPredicate predicate) {
        if (!constrained) return this;
        Set<Integer> set = codePoints.stream()
            .filter(predicate::test)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        return new GlyphSet(Collections.unmodifiableSet(set), true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GlyphSet)) return false;
        GlyphSet other = (GlyphSet) o;
        return constrained == other.constrained && codePoints.equals(other.codePoints);
    }

    @Override
    public int hashCode() {
        return 31 * codePoints.hashCode() + (constrained ? 1 : 0);
    }

    @Override
    public String toString() {
        if (!constrained) return "<any>";
        StringBuilder sb = new StringBuilder();
        codePoints.forEach(sb::appendCodePoint);
        return sb.toString();
    }
}
