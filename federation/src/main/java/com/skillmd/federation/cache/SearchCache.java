package com.skillmd.federation.cache;

import com.skillmd.federation.source.SearchOptions;
import com.skillmd.federation.source.SearchResult;
import com.skillmd.federation.source.SourceType;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Search results keyed by source and request.
 *
 * Keys are structured records, not joined strings, so a query containing any
 * delimiter character cannot collide with a different (query, page) pair.
 */
public class SearchCache implements AutoCloseable {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(10);

    /** Cache key: everything that changes what a source returns. */
    record Key(SourceType source, String query, int page, int perPage, List<String> tags) {}

    private final TtlCache<Key, SearchResult> cache;

    public SearchCache(Duration ttl, Duration sweepInterval, Clock clock) {
        this.cache = new TtlCache<>("search-cache", ttl, sweepInterval, clock);
    }

    public SearchCache(Duration ttl, Duration sweepInterval) {
        this(ttl, sweepInterval, Clock.systemUTC());
    }

    public Optional<SearchResult> get(SourceType source, SearchOptions options) {
        return cache.get(keyFor(source, options));
    }

    public void put(SourceType source, SearchOptions options, SearchResult result) {
        cache.put(keyFor(source, options), result);
    }

    public void clear() {
        cache.clear();
    }

    public int size() {
        return cache.size();
    }

    @Override
    public void close() {
        cache.close();
    }

    static Key keyFor(SourceType source, SearchOptions options) {
        return new Key(source, options.query(), options.page(), options.perPage(), options.tags());
    }
}
