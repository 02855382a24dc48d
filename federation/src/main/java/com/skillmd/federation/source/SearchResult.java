package com.skillmd.federation.source;

import java.time.Duration;
import java.util.List;

/**
 * One source's answer to a search.
 *
 * @param skills     the page of skills returned
 * @param total      total matches as reported by the source (may exceed skills.size())
 * @param page       page echoed back
 * @param perPage    page size echoed back
 * @param searchTime time spent in the source's search call
 * @param source     the source that produced this result
 */
public record SearchResult(
        List<ExternalSkill> skills,
        int                 total,
        int                 page,
        int                 perPage,
        Duration            searchTime,
        SourceType          source) {

    public SearchResult {
        skills     = skills == null ? List.of() : List.copyOf(skills);
        searchTime = searchTime == null ? Duration.ZERO : searchTime;
    }

    /** Zero-total result, used for soft failures and unknown sources. */
    public static SearchResult empty(SourceType source, SearchOptions options) {
        return new SearchResult(List.of(), 0, options.page(), options.perPage(), Duration.ZERO, source);
    }

    public static SearchResult of(SourceType source, SearchOptions options,
                                  List<ExternalSkill> skills, int total) {
        return new SearchResult(skills, total, options.page(), options.perPage(), Duration.ZERO, source);
    }

    /** Copy carrying the measured call time and the producing source. */
    public SearchResult stamped(Duration elapsed, SourceType producer) {
        return new SearchResult(skills, total, page, perPage, elapsed, producer);
    }
}
