package com.skillmd.federation.ratelimit;

import com.skillmd.federation.source.SourceType;

import java.util.Map;

/**
 * Per-source admission policy.
 *
 * @param requestsPerMinute sustained rate; 0 means unlimited
 * @param burstSize         bucket capacity; 0 means requestsPerMinute / 6
 *                          (about ten seconds of traffic), but at least 1
 */
public record RateLimit(int requestsPerMinute, int burstSize) {

    /** Applied to sources with no configured policy. */
    public static final RateLimit FALLBACK = new RateLimit(10, 5);

    public RateLimit {
        if (requestsPerMinute < 0 || burstSize < 0) {
            throw new IllegalArgumentException(
                    "rate limit values must be >= 0: rpm=" + requestsPerMinute + " burst=" + burstSize);
        }
    }

    public static RateLimit unlimited() {
        return new RateLimit(0, 0);
    }

    public boolean isUnlimited() {
        return requestsPerMinute == 0;
    }

    /**
     * Built-in policies. External hosts are limited to what their anonymous
     * search APIs tolerate; the local registry is never limited.
     */
    public static Map<SourceType, RateLimit> defaults() {
        return Map.of(
                SourceType.LOCAL,     unlimited(),
                SourceType.SKILLS_SH, new RateLimit(60, 10),
                SourceType.GITHUB,    new RateLimit(10, 5),
                SourceType.GITLAB,    new RateLimit(10, 5),
                SourceType.BITBUCKET, new RateLimit(10, 5),
                SourceType.CODEBERG,  new RateLimit(20, 5));
    }
}
