package pl.marcinmilkowski.proof_text.punctuation;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Punctuation profiles bundled with the library, keyed by language tag.
 *
 * Loaded once from {@code /punctuation/default-punctuation.json} on the classpath.
 */
public final class DefaultPunctuation {
    private static final Logger logger = LoggerFactory.getLogger(DefaultPunctuation.class);

    static final String RESOURCE = "/punctuation/default-punctuation.json";

    private final Map<String, PunctuationProfile> profiles;

    private DefaultPunctuation(Map<String, PunctuationProfile> profiles) {
        this.profiles = Collections.unmodifiableMap(profiles);
    }

    private static final class Holder {
        static final DefaultPunctuation INSTANCE = load();
    }

    /**
     * Get the shared instance, loading the resource on first use.
     */
    public static DefaultPunctuation getInstance() {
        return Holder.INSTANCE;
    }

    /**
     * Get the profile for a language tag.
     */
    public Optional<PunctuationProfile> forLanguage(String language) {
        if (language == null) return Optional.empty();
        return Optional.ofNullable(profiles.get(language));
    }

    /**
     * Languages with a bundled profile.
     */
    public Set<String> getLanguages() {
        return profiles.keySet();
    }

    private static DefaultPunctuation load() {
        try (InputStream in = DefaultPunctuation.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing punctuation resource: " + RESOURCE);
            }
            JSONObject root = JSON.parseObject(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            Map<String, PunctuationProfile> profiles = new LinkedHashMap<>();
            for (String language : root.keySet()) {
                profiles.put(language, PunctuationProfile.fromJson(root.getJSONObject(language)));
            }
            logger.info("Loaded default punctuation for languages {}", profiles.keySet());
            return new DefaultPunctuation(profiles);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read punctuation resource: " + RESOURCE, e);
        }
    }
}
