package pl.marcinmilkowski.proof_text.vocab;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.proof_text.punctuation.PunctuationProfile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds {@link WordTable}s from vocabulary data.
 *
 * Two data formats are accepted, detected from the first line:
 * <pre>
 * apple	5        word/count TSV
 * apple            plain word list (every count is 1)
 * </pre>
 *
 * A vocabulary may come with a metadata JSON file:
 * <pre>
 * {
 *   "lang": "en",
 *   "bicameral": true,
 *   "punctuation": { "insert": [...], "wrap_sentence": [...], "wrap_inner": [...] }
 * }
 * </pre>
 */
public class VocabularyLoader {
    private static final Logger logger = LoggerFactory.getLogger(VocabularyLoader.class);

    private static final Pattern TSV_LINE = Pattern.compile("\\p{IsAlphabetic}+\\t\\d+");
    private static final Pattern WORD_LINE = Pattern.compile("\\p{IsAlphabetic}+");

    private VocabularyLoader() {
    }

    /**
     * Parse vocabulary data held in memory.
     *
     * @throws VocabularyFormatException if the data is empty or malformed
     */
    public static WordTable parse(String language, boolean bicameral, String data) {
        return parse(language, bicameral, data, null);
    }

    public static WordTable parse(String language, boolean bicameral, String data,
                                  PunctuationProfile punctuation) {
        return new WordTable(language, bicameral, parseEntries(data), punctuation);
    }

    /**
     * Load a TSV or word-list file.
     */
    public static WordTable load(Path dataFile, String language, boolean bicameral) throws IOException {
        if (!Files.exists(dataFile)) {
            throw new IOException("Vocabulary file not found: " + dataFile);
        }
        String data = Files.readString(dataFile, StandardCharsets.UTF_8);
        WordTable table = parse(language, bicameral, data);
        logger.info("Loaded vocabulary '{}' with {} words from {}", language, table.size(), dataFile);
        return table;
    }

    /**
     * Load a vocabulary file together with its metadata JSON.
     *
     * @param metaFile JSON with "lang", "bicameral" and optional "punctuation"
     * @param dataFile TSV or word-list file
     * @throws IOException if either file cannot be read
     * @throws VocabularyFormatException if the metadata or data is invalid
     */
    public static WordTable load(Path metaFile, Path dataFile) throws IOException {
        if (!Files.exists(metaFile)) {
            throw new IOException("Vocabulary metadata file not found: " + metaFile);
        }
        if (!Files.exists(dataFile)) {
            throw new IOException("Vocabulary file not found: " + dataFile);
        }

        JSONObject meta;
        try {
            meta = JSON.parseObject(Files.readString(metaFile, StandardCharsets.UTF_8));
        } catch (JSONException e) {
            throw new VocabularyFormatException("Invalid vocabulary metadata in " + metaFile, e);
        }
        if (meta == null) {
            throw new VocabularyFormatException("Empty vocabulary metadata in " + metaFile);
        }

        String language = meta.getString("lang");
        if (language == null || language.isBlank()) {
            throw new VocabularyFormatException("Missing 'lang' field in " + metaFile);
        }
        Boolean bicameral = meta.getBoolean("bicameral");
        if (bicameral == null) {
            throw new VocabularyFormatException("Missing 'bicameral' field in " + metaFile);
        }
        JSONObject punctuationJson = meta.getJSONObject("punctuation");
        PunctuationProfile punctuation = punctuationJson != null
            ? PunctuationProfile.fromJson(punctuationJson)
            : null;

        String data = Files.readString(dataFile, StandardCharsets.UTF_8);
        WordTable table = parse(language, bicameral, data, punctuation);
        logger.info("Loaded vocabulary '{}' (bicameral={}, punctuation={}) with {} words from {}",
            language, bicameral, punctuation != null, table.size(), dataFile);
        return table;
    }

    /**
     * Split raw vocabulary data into entries, keeping source order.
     */
    static List<WordCount> parseEntries(String data) {
        if (data == null || data.isBlank()) {
            throw new VocabularyFormatException("No vocabulary data found");
        }

        String[] lines = data.split("\\R");
        String firstLine = lines[0];
        boolean withCounts;
        if (TSV_LINE.matcher(firstLine).matches()) {
            withCounts = true;
        } else if (WORD_LINE.matcher(firstLine).matches()) {
            withCounts = false;
        } else {
            throw new VocabularyFormatException(
                "The vocabulary is formatted incorrectly. Expected a TSV with words and counts "
                    + "as columns, or a newline-delimited list of words. First line: '" + firstLine + "'");
        }

        List<WordCount> entries = new ArrayList<>(lines.length);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            if (!withCounts) {
                entries.add(WordCount.of(line.strip()));
                continue;
            }
            String[] parts = line.split("\t");
            if (parts.length != 2) {
                throw new VocabularyFormatException("Line " + (i + 1) + ": expected 'word<TAB>count', got '" + line + "'");
            }
            try {
                entries.add(new WordCount(parts[0], Long.parseLong(parts[1].strip())));
            } catch (IllegalArgumentException e) {
                // NumberFormatException or a negative count
                throw new VocabularyFormatException("Line " + (i + 1) + ": invalid count '" + parts[1] + "'", e);
            }
        }
        return entries;
    }
}
