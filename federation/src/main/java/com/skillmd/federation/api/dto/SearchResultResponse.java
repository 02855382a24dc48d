package com.skillmd.federation.api.dto;

import com.skillmd.federation.source.ExternalSkill;
import com.skillmd.federation.source.SearchResult;

import java.util.List;

/** Response body for GET /api/sources/{source}/search. */
public record SearchResultResponse(
        String              source,
        List<ExternalSkill> skills,
        int                 total,
        int                 page,
        int                 perPage,
        long                searchTimeMs
) {
    public static SearchResultResponse from(SearchResult result) {
        return new SearchResultResponse(
                result.source().id(),
                result.skills(),
                result.total(),
                result.page(),
                result.perPage(),
                result.searchTime().toMillis()
        );
    }
}
