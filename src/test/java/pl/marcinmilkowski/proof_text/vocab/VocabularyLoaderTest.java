package pl.marcinmilkowski.proof_text.vocab;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.proof_text.punctuation.PunctuationProfile;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for VocabularyLoader.
 */
class VocabularyLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("TSV data keeps order, case and counts")
    void testParseTsv() {
        WordTable table = VocabularyLoader.parse("en", true, "grape\t1\napple\t2\nApple\t3\nBart\t4\nBART\t5\nDDoS\t6");

        assertEquals(6, table.size());
        assertEquals(new WordCount("grape", 1), table.getEntries().get(0));
        assertEquals(new WordCount("DDoS", 6), table.getEntries().get(5));
        assertEquals("en", table.getLanguage());
        assertTrue(table.isBicameral());
        assertTrue(table.getPunctuation().isEmpty());
    }

    @Test
    @DisplayName("Word list data gets count 1 for every word")
    void testParseWordList() {
        WordTable table = VocabularyLoader.parse("en", true, "apple\nbanana\ncherry\n");

        assertEquals(List.of(WordCount.of("apple"), WordCount.of("banana"), WordCount.of("cherry")),
            table.getEntries());
    }

    @Test
    @DisplayName("Non-Latin words are accepted")
    void testParseArabic() {
        WordTable table = VocabularyLoader.parse("ar", false, "مرحبا\t10\nكتاب\t4");
        assertEquals(2, table.size());
        assertFalse(table.isBicameral());
    }

    @Test
    @DisplayName("Malformed data is rejected with a format error")
    void testMalformed() {
        assertThrows(VocabularyFormatException.class, () -> VocabularyLoader.parse("en", true, "123\t123"));
        assertThrows(VocabularyFormatException.class, () -> VocabularyLoader.parse("en", true, ""));
        assertThrows(VocabularyFormatException.class, () -> VocabularyLoader.parse("en", true, "   \n"));

        VocabularyFormatException e = assertThrows(VocabularyFormatException.class,
            () -> VocabularyLoader.parse("en", true, "apple\t5\nbanana\tmany"));
        assertTrue(e.getMessage().startsWith("Line 2"), e.getMessage());
    }

    @Test
    @DisplayName("load() reads a file written to disk")
    void testLoadFile() throws IOException {
        Path file = tempDir.resolve("words.tsv");
        Files.writeString(file, "zoo\t10\nzebra\t3\n");

        WordTable table = VocabularyLoader.load(file, "en", true);
        assertEquals(2, table.size());
        assertEquals("zoo", table.getEntries().get(0).word());
    }

    @Test
    @DisplayName("load() fails for a missing file")
    void testLoadMissing() {
        assertThrows(IOException.class, () -> VocabularyLoader.load(tempDir.resolve("nope.tsv"), "en", true));
    }

    @Test
    @DisplayName("Metadata supplies language, case and punctuation")
    void testLoadWithMetadata() throws IOException, URISyntaxException {
        Path meta = Path.of(getClass().getResource("/vocab/en-sample.json").toURI());
        Path data = Path.of(getClass().getResource("/vocab/en-sample.tsv").toURI());

        WordTable table = VocabularyLoader.load(meta, data);

        assertEquals("en", table.getLanguage());
        assertTrue(table.isBicameral());
        assertEquals(new WordCount("the", 500), table.getEntries().get(0));
        PunctuationProfile profile = table.getPunctuation().orElseThrow();
        assertEquals(1.0, profile.insert().get(", "));
        assertTrue(profile.wrapSentence().containsKey(new PunctuationProfile.Wrap("", ".")));
    }

    @Test
    @DisplayName("Metadata without a language is rejected")
    void testMetadataMissingLang() throws IOException {
        Path meta = tempDir.resolve("meta.json");
        Path data = tempDir.resolve("data.tsv");
        Files.writeString(meta, "{\"bicameral\": true}");
        Files.writeString(data, "apple\t1\n");

        assertThrows(VocabularyFormatException.class, () -> VocabularyLoader.load(meta, data));
    }

    @Test
    @DisplayName("Broken metadata JSON is rejected")
    void testMetadataInvalidJson() throws IOException {
        Path meta = tempDir.resolve("meta.json");
        Path data = tempDir.resolve("data.tsv");
        Files.writeString(meta, "{\"lang\": ");
        Files.writeString(data, "apple\t1\n");

        assertThrows(VocabularyFormatException.class, () -> VocabularyLoader.load(meta, data));
    }
}
