package pl.marcinmilkowski.proof_text.filter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Spelling constraints on words: length, prefix/suffix, substrings and a regular expression.
 *
 * All fields are optional; {@link #NONE} has none set. Substring lists are
 * AND-combined. Values are immutable so criteria can be part of a cache key.
 */
public record StructuralCriteria(
    Integer minLength,         // Inclusive lower bound on code points
    Integer maxLength,         // Inclusive upper bound on code points
    Integer exactLength,       // Overrides min/max when set
    String startsWith,
    String endsWith,
    List<String> contains,     // Every substring must occur
    List<String> inner,        // Every substring must occur away from the first/last character
    String regex               // Whole-word pattern
) {

    public static final StructuralCriteria NONE = builder().build();

    public StructuralCriteria {
        contains = contains == null ? List.of() : List.copyOf(contains);
        inner = inner == null ? List.of() : List.copyOf(inner);
        startsWith = emptyToNull(startsWith);
        endsWith = emptyToNull(endsWith);
        regex = emptyToNull(regex);
    }

    /**
     * Check whether no constraint is set.
     */
    public boolean isEmpty() {
        return minLength == null && maxLength == null && exactLength == null
            && startsWith == null && endsWith == null
            && contains.isEmpty() && inner.isEmpty() && regex == null;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.minLength = minLength;
        b.maxLength = maxLength;
        b.exactLength = exactLength;
        b.startsWith = startsWith;
        b.endsWith = endsWith;
        b.contains.addAll(contains);
        b.inner.addAll(inner);
        b.regex = regex;
        return b;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        append(sb, "minLength", minLength);
        append(sb, "maxLength", maxLength);
        append(sb, "exactLength", exactLength);
        append(sb, "startsWith", startsWith);
        append(sb, "endsWith", endsWith);
        if (!contains.isEmpty()) append(sb, "contains", contains);
        if (!inner.isEmpty()) append(sb, "inner", inner);
        append(sb, "regex", regex);
        return sb.length() == 0 ? "no criteria" : sb.toString();
    }

    private static void append(StringBuilder sb, String name, Object value) {
        if (value == null) return;
        if (sb.length() > 0) sb.append(", ");
        sb.append(name).append("='").append(value).append('\'');
    }

    /**
     * Builder for structural criteria.
     */
    public static class Builder {
        private Integer minLength;
        private Integer maxLength;
        private Integer exactLength;
        private String startsWith;
        private String endsWith;
        private final List<String> contains = new ArrayList<>();
        private final List<String> inner = new ArrayList<>();
        private String regex;

        public Builder withMinLength(Integer minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder withMaxLength(Integer maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder withExactLength(Integer exactLength) {
            this.exactLength = exactLength;
            return this;
        }

        public Builder withStartsWith(String startsWith) {
            this.startsWith = startsWith;
            return this;
        }

        public Builder withEndsWith(String endsWith) {
            this.endsWith = endsWith;
            return this;
        }

        public Builder withContains(String... substrings) {
            contains.addAll(Arrays.asList(substrings));
            return this;
        }

        public Builder withInner(String... substrings) {
            inner.addAll(Arrays.asList(substrings));
            return this;
        }

        public Builder withRegex(String regex) {
            this.regex = regex;
            return this;
        }

        public StructuralCriteria build() {
            return new StructuralCriteria(minLength, maxLength, exactLength, startsWith, endsWith,
                contains, inner, regex);
        }
    }
}
