package pl.marcinmilkowski.proof_text.punctuation;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Punctuation probabilities for one language.
 *
 * Three option tables, each mapping an option to its probability:
 * <ul>
 *   <li>insert: separators placed between two words (including a plain space)</li>
 *   <li>wrapSentence: prefix/suffix around the whole sentence, e.g. ("", ".") or ("¡", "!")</li>
 *   <li>wrapInner: prefix/suffix around a span of words, e.g. ("(", ")")</li>
 * </ul>
 * Iteration order of each table is the order the options were declared in,
 * which keeps seeded output reproducible.
 *
 * JSON shape:
 * <pre>
 * {
 *   "insert":        [{"text": ", ", "weight": 0.403}, ...],
 *   "wrap_sentence": [{"prefix": "", "suffix": ".", "weight": 0.923}, ...],
 *   "wrap_inner":    [{"prefix": "(", "suffix": ")", "weight": 0.133}, ...]
 * }
 * </pre>
 */
public record PunctuationProfile(
    Map<String, Double> insert,
    Map<Wrap, Double> wrapSentence,
    Map<Wrap, Double> wrapInner
) {

    public PunctuationProfile {
        insert = Collections.unmodifiableMap(new LinkedHashMap<>(insert));
        wrapSentence = Collections.unmodifiableMap(new LinkedHashMap<>(wrapSentence));
        wrapInner = Collections.unmodifiableMap(new LinkedHashMap<>(wrapInner));
    }

    /**
     * A prefix/suffix pair placed around a sentence or a span of words.
     */
    public record Wrap(String prefix, String suffix) {

        public static final Wrap NONE = new Wrap("", "");

        public Wrap {
            if (prefix == null || suffix == null) {
                throw new IllegalArgumentException("Wrap prefix and suffix must not be null");
            }
        }

        /**
         * All characters of both halves, for glyph checks.
         */
        public String text() {
            return prefix + suffix;
        }
    }

    /**
     * Parse a profile from its JSON form.
     *
     * @throws IllegalArgumentException if a table is missing or an option is malformed
     */
    public static PunctuationProfile fromJson(JSONObject json) {
        Map<String, Double> insert = new LinkedHashMap<>();
        for (JSONObject option : options(json, "insert")) {
            String text = option.getString("text");
            if (text == null) {
                throw new IllegalArgumentException("Missing 'text' in insert option: " + option);
            }
            insert.put(text, weight(option));
        }

        return new PunctuationProfile(insert, wraps(json, "wrap_sentence"), wraps(json, "wrap_inner"));
    }

    /**
     * Export as JSON (same shape as {@link #fromJson}).
     */
    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        JSONArray insertArray = new JSONArray();
        insert.forEach((text, weight) -> {
            JSONObject obj = new JSONObject();
            obj.put("text", text);
            obj.put("weight", weight);
            insertArray.add(obj);
        });
        root.put("insert", insertArray);
        root.put("wrap_sentence", wrapsToJson(wrapSentence));
        root.put("wrap_inner", wrapsToJson(wrapInner));
        return root;
    }

    private static Map<Wrap, Double> wraps(JSONObject json, String key) {
        Map<Wrap, Double> wraps = new LinkedHashMap<>();
        for (JSONObject option : options(json, key)) {
            String prefix = option.getString("prefix");
            String suffix = option.getString("suffix");
            if (prefix == null || suffix == null) {
                throw new IllegalArgumentException("Missing 'prefix' or 'suffix' in " + key + " option: " + option);
            }
            wraps.put(new Wrap(prefix, suffix), weight(option));
        }
        return wraps;
    }

    private static List<JSONObject> options(JSONObject json, String key) {
        JSONArray array = json.getJSONArray(key);
        if (array == null) {
            throw new IllegalArgumentException("Missing '" + key + "' array in punctuation profile");
        }
        List<JSONObject> options = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JSONObject option = array.getJSONObject(i);
            if (option == null) {
                throw new IllegalArgumentException("Invalid " + key + " option at index " + i);
            }
            options.add(option);
        }
        return options;
    }

    private static double weight(JSONObject option) {
        Double weight = option.getDouble("weight");
        if (weight == null || weight < 0) {
            throw new IllegalArgumentException("Missing or negative 'weight' in punctuation option: " + option);
        }
        return weight;
    }

    private static JSONArray wrapsToJson(Map<Wrap, Double> wraps) {
        JSONArray array = new JSONArray();
        wraps.forEach((wrap, weight) -> {
            JSONObject obj = new JSONObject();
            obj.put("prefix", wrap.prefix());
            obj.put("suffix", wrap.suffix());
            obj.put("weight", weight);
            array.add(obj);
        });
        return array;
    }
}
