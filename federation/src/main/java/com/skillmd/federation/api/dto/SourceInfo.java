package com.skillmd.federation.api.dto;

import com.skillmd.federation.source.SourceType;

/**
 * One entry of GET /api/sources.
 * {@code availableTokens} is -1 for sources without a rate limit.
 */
public record SourceInfo(
        String id,
        String label,
        String badgeColor,
        double availableTokens
) {
    public static SourceInfo from(SourceType type, double availableTokens) {
        return new SourceInfo(type.id(), type.label(), type.badgeColor(), availableTokens);
    }
}
