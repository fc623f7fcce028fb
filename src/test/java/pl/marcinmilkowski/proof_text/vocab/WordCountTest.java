package pl.marcinmilkowski.proof_text.vocab;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WordCount record.
 */
class WordCountTest {

    @Test
    @DisplayName("Zero count is stored as 1")
    void testZeroCount() {
        assertEquals(1, new WordCount("apple", 0).count());
        assertEquals(1, WordCount.of("apple").count());
    }

    @Test
    @DisplayName("Negative count and empty word are rejected")
    void testInvalid() {
        assertThrows(IllegalArgumentException.class, () -> new WordCount("apple", -1));
        assertThrows(IllegalArgumentException.class, () -> new WordCount("", 3));
        assertThrows(IllegalArgumentException.class, () -> new WordCount(null, 3));
    }

    @Test
    @DisplayName("withWord() keeps the count")
    void testWithWord() {
        WordCount recased = new WordCount("apple", 7).withWord("APPLE");
        assertEquals("APPLE", recased.word());
        assertEquals(7, recased.count());
    }
}
