package com.skillmd.federation.ratelimit;

import com.skillmd.federation.source.CallContext;
import com.skillmd.federation.source.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * One independent token bucket per source.
 *
 * Buckets are created on first use from the source's policy. The registry
 * (which sources have buckets, and their policies) has its own lock, separate
 * from each bucket's, so a caller sleeping on one source's bucket never
 * blocks callers of another source.
 */
public class SourceRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SourceRateLimiter.class);

    private final Object registryLock = new Object();

    // A present key with a null value means "unlimited": there is no bucket.
    private final Map<SourceType, TokenBucket> buckets = new HashMap<>();
    private final Map<SourceType, RateLimit>   limits;

    /** Limiter using {@link RateLimit#defaults()}. */
    public SourceRateLimiter() {
        this(RateLimit.defaults());
    }

    public SourceRateLimiter(Map<SourceType, RateLimit> limits) {
        this.limits = new HashMap<>(limits);
    }

    /**
     * Wait until {@code source} may be called, bounded by {@code ctx}.
     *
     * @throws com.skillmd.federation.source.SourceException with kind
     *         CANCELLED or DEADLINE_EXCEEDED if the context ends first
     */
    public void acquire(SourceType source, CallContext ctx) {
        TokenBucket bucket = bucketFor(source);
        if (bucket == null) {
            return;
        }
        bucket.take(ctx, source);
    }

    /**
     * Replace the policy for one source. Its bucket is discarded and rebuilt
     * on next use; other sources are unaffected.
     */
    public void setLimit(SourceType source, RateLimit limit) {
        synchronized (registryLock) {
            limits.put(source, limit);
            buckets.remove(source);
        }
        log.info("Rate limit for '{}' set to {}/min (burst {})",
                source, limit.requestsPerMinute(), limit.burstSize());
    }

    /** The policy that applies to {@code source}, falling back to {@link RateLimit#FALLBACK}. */
    public RateLimit limitFor(SourceType source) {
        synchronized (registryLock) {
            return limits.getOrDefault(source, RateLimit.FALLBACK);
        }
    }

    /** Tokens currently available, or -1 when the source is unlimited. */
    public double availableTokens(SourceType source) {
        TokenBucket bucket = bucketFor(source);
        return bucket == null ? -1 : bucket.availableTokens();
    }

    TokenBucket bucketFor(SourceType source) {
        synchronized (registryLock) {
            if (buckets.containsKey(source)) {
                return buckets.get(source);
            }
            TokenBucket bucket = TokenBucket.create(limits.getOrDefault(source, RateLimit.FALLBACK));
            buckets.put(source, bucket);
            return bucket;
        }
    }
}
