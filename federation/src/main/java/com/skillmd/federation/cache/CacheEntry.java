package com.skillmd.federation.cache;

import java.time.Instant;

/**
 * A cached value and the instant it stops being served.
 */
public record CacheEntry<V>(V value, Instant expiresAt) {

    /** Expired at or after {@code expiresAt}; a hit requires now &lt; expiresAt. */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
