package pl.marcinmilkowski.proof_text.filter;

import pl.marcinmilkowski.proof_text.vocab.WordTable;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Memoizes filter results by the exact tuple of inputs.
 *
 * Inputs are immutable, so entries are never invalidated for the lifetime of
 * the cache. Reads are lock-free; two threads computing the same key store
 * equal values, so a lost write is harmless. Failed filters are not cached.
 */
public class FilterCache {

    /**
     * Cache key. Word tables compare by identity.
     */
    public record FilterKey(
        WordTable table,
        GlyphSet glyphs,
        CaseMode mode,
        int minimumResults,
        StructuralCriteria criteria
    ) {
    }

    private final Map<FilterKey, FilteredCollection> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public FilteredCollection get(FilterKey key) {
        FilteredCollection cached = entries.get(key);
        if (cached != null) {
            hits.incrementAndGet();
        } else {
            misses.incrementAndGet();
        }
        return cached;
    }

    public void put(FilterKey key, FilteredCollection value) {
        entries.put(key, value);
    }

    public int size() {
        return entries.size();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }
}
