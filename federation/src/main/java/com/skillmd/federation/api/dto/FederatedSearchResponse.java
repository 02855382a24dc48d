package com.skillmd.federation.api.dto;

import com.skillmd.federation.service.FederatedResult;
import com.skillmd.federation.source.ExternalSkill;
import com.skillmd.federation.source.SearchOptions;
import com.skillmd.federation.source.SourceType;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Response body for GET /api/skills/search.
 *
 * Per-source maps are keyed by source id, in id order. {@code errors} only lists sources
 * whose search failed; a caller can show partial results alongside them.
 */
public record FederatedSearchResponse(
        List<ExternalSkill>  skills,
        int                  total,
        int                  page,
        int                  perPage,
        Map<String, Integer> bySource,
        Map<String, String>  errors,
        Map<String, Long>    sourceTimesMs,
        long                 searchTimeMs
) {
    public static FederatedSearchResponse from(FederatedResult result, SearchOptions options) {
        return new FederatedSearchResponse(
                result.skills(),
                result.total(),
                options.page(),
                options.perPage(),
                byId(result.bySource(), Function.identity()),
                byId(result.errors(), Function.identity()),
                byId(result.sourceTimes(), Duration::toMillis),
                result.searchTime().toMillis()
        );
    }

    private static <V, R> Map<String, R> byId(Map<SourceType, V> values, Function<V, R> mapper) {
        Map<String, R> out = new TreeMap<>();
        values.forEach((type, value) -> out.put(type.id(), mapper.apply(value)));
        return out;
    }
}
