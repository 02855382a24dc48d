package com.skillmd.federation.source;

import java.util.List;

/**
 * A search request as handed to every source.
 *
 * @param query   free text; empty means "list everything"
 * @param tags    optional tag filter; never null
 * @param page    1-based page number
 * @param perPage page size
 */
public record SearchOptions(String query, List<String> tags, int page, int perPage) {

    public static final int DEFAULT_PAGE     = 1;
    public static final int DEFAULT_PER_PAGE = 20;

    public SearchOptions {
        query = query == null ? "" : query;
        tags  = tags == null ? List.of() : List.copyOf(tags);
    }

    public static SearchOptions of(String query) {
        return new SearchOptions(query, List.of(), DEFAULT_PAGE, DEFAULT_PER_PAGE);
    }

    /** page &le; 0 becomes 1, perPage &le; 0 becomes 20. */
    public SearchOptions normalized() {
        int p  = page    <= 0 ? DEFAULT_PAGE     : page;
        int pp = perPage <= 0 ? DEFAULT_PER_PAGE : perPage;
        if (p == page && pp == perPage) {
            return this;
        }
        return new SearchOptions(query, tags, p, pp);
    }
}
