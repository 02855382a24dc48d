package com.skillmd.federation.service;

import com.skillmd.federation.source.ExternalSkill;
import com.skillmd.federation.source.SourceType;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * The federation's combined answer to one search.
 *
 * @param skills      merged skills in presentation order
 * @param total       sum of each source's self-reported total (matches
 *                    available upstream, not the number returned here)
 * @param bySource    each contributing source's own total
 * @param errors      failure message per source; only failed sources appear
 * @param sourceTimes time spent in each contributing source's call
 *                    (zero for cache hits recorded at the time of caching)
 * @param searchTime  wall-clock time for the whole federated operation
 */
public record FederatedResult(
        List<ExternalSkill>        skills,
        int                        total,
        Map<SourceType, Integer>   bySource,
        Map<SourceType, String>    errors,
        Map<SourceType, Duration>  sourceTimes,
        Duration                   searchTime) {

    public FederatedResult {
        skills      = List.copyOf(skills);
        bySource    = Map.copyOf(bySource);
        errors      = Map.copyOf(errors);
        sourceTimes = Map.copyOf(sourceTimes);
    }

    public static FederatedResult empty() {
        return new FederatedResult(List.of(), 0, Map.of(), Map.of(), Map.of(), Duration.ZERO);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    FederatedResult withSearchTime(Duration elapsed) {
        return new FederatedResult(skills, total, bySource, errors, sourceTimes, elapsed);
    }
}
