package pl.marcinmilkowski.proof_text;

import org.junit.jupiter.api.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the command-line entry point.
 */
class MainTest {

    private String vocab;
    private String meta;

    @BeforeEach
    void setUp() throws Exception {
        vocab = Path.of(getClass().getResource("/vocab/en-sample.tsv").toURI()).toString();
        meta = Path.of(getClass().getResource("/vocab/en-sample.json").toURI()).toString();
    }

    private static String run(String... args) throws Exception {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            Main.run(args, out);
        }
        return buffer.toString(StandardCharsets.UTF_8).trim();
    }

    @Test
    @DisplayName("top-words prints the most frequent words")
    void testTopWords() throws Exception {
        assertEquals("the and", run("top-words", "--vocab", vocab, "--num-words", "2"));
        assertEquals("proof Paris", run("top-words", "--vocab", vocab, "-n", "2", "--index", "2"));
    }

    @Test
    @DisplayName("Filtering options reach the generator")
    void testFiltering() throws Exception {
        assertEquals("NASA", run("top-word", "--vocab", vocab, "--case", "uc_og"));
        assertEquals("jumps", run("word", "--vocab", vocab, "--starts-with", "j"));
        assertEquals("THE", run("word", "--vocab", vocab, "--glyphs", "THE"));
    }

    @Test
    @DisplayName("Seeded sentences are repeatable and use metadata punctuation")
    void testSentence() throws Exception {
        String first = run("sentence", "--vocab", vocab, "--meta", meta, "--seed", "proof");
        String second = run("sentence", "--vocab", vocab, "--meta", meta, "--seed", "proof");
        assertEquals(first, second);
        assertTrue(first.endsWith("."), first);
    }

    @Test
    @DisplayName("help prints usage without a vocabulary")
    void testHelp() throws Exception {
        assertTrue(run("help").startsWith("Usage:"));
    }

    @Test
    @DisplayName("Missing vocabulary and unknown commands are errors")
    void testErrors() {
        assertThrows(IllegalArgumentException.class, () -> run("word"));
        assertThrows(IllegalArgumentException.class, () -> run("frobnicate", "--vocab", vocab));
    }
}
