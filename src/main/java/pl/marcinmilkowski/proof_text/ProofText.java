package pl.marcinmilkowski.proof_text;

import pl.marcinmilkowski.proof_text.vocab.WordTable;

import java.util.List;

/**
 * Static shortcuts over a shared {@link ProofTextGenerator}, for scripts that
 * only ever use one generator.
 */
public final class ProofText {

    private ProofText() {
    }

    private static final class Holder {
        private static final ProofTextGenerator GENERATOR = new ProofTextGenerator();
    }

    public static ProofTextGenerator getGenerator() {
        return Holder.GENERATOR;
    }

    public static void addVocabulary(String name, WordTable table) {
        getGenerator().addVocabulary(name, table);
        if (getGenerator().getDefaultVocabulary() == null) {
            getGenerator().setDefaultVocabulary(name);
        }
    }

    public static WordTable removeVocabulary(String name) {
        return getGenerator().removeVocabulary(name);
    }

    public static void setDefaultVocabulary(String name) {
        getGenerator().setDefaultVocabulary(name);
    }

    public static void setGlyphs(String glyphs) {
        getGenerator().setGlyphs(glyphs);
    }

    public static void seed(long seed) {
        getGenerator().seed(seed);
    }

    public static String number(ProofOptions options) {
        return getGenerator().number(options);
    }

    public static String word(ProofOptions options) {
        return getGenerator().word(options);
    }

    public static String topWord(ProofOptions options) {
        return getGenerator().topWord(options);
    }

    public static List<String> words(ProofOptions options) {
        return getGenerator().words(options);
    }

    public static List<String> topWords(ProofOptions options) {
        return getGenerator().topWords(options);
    }

    public static String sentence(ProofOptions options) {
        return getGenerator().sentence(options);
    }

    public static String paragraph(ProofOptions options) {
        return getGenerator().paragraph(options);
    }

    public static String text(ProofOptions options) {
        return getGenerator().text(options);
    }
}
