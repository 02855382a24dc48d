package com.skillmd.federation.ratelimit;

import com.skillmd.federation.source.CallContext;
import com.skillmd.federation.source.SourceType;

import java.time.Duration;

/**
 * Continuously refilled token bucket.
 *
 * Tokens are credited lazily on every admission attempt from the real time
 * elapsed since the previous one, so there is no refill thread. State is
 * guarded by the bucket's own monitor, which is never held while sleeping.
 */
final class TokenBucket {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final double maxTokens;
    private final double refillRate;   // tokens per second

    private double tokens;
    private long   lastRefillNanos;

    private TokenBucket(double maxTokens, double refillRate) {
        this.maxTokens       = maxTokens;
        this.refillRate      = refillRate;
        this.tokens          = maxTokens;
        this.lastRefillNanos = System.nanoTime();
    }

    /** Returns null for an unlimited policy: no bucket, no waiting. */
    static TokenBucket create(RateLimit limit) {
        if (limit.isUnlimited()) {
            return null;
        }
        // below one token nothing could ever be admitted
        double max = limit.burstSize() > 0
                ? limit.burstSize()
                : Math.max(1, limit.requestsPerMinute() / 6.0);
        return new TokenBucket(max, limit.requestsPerMinute() / 60.0);
    }

    /**
     * Block until a token is available, then consume it.
     *
     * After each sleep the bucket is re-evaluated rather than assumed full:
     * concurrent takers may have drained it in the meantime.
     *
     * @throws com.skillmd.federation.source.SourceException if {@code ctx}
     *         ends while waiting
     */
    void take(CallContext ctx, SourceType source) {
        while (true) {
            Duration wait;
            synchronized (this) {
                refill();
                if (tokens >= 1) {
                    tokens -= 1;
                    return;
                }
                wait = Duration.ofNanos((long) Math.ceil((1 - tokens) / refillRate * NANOS_PER_SECOND));
            }
            if (!ctx.await(wait)) {
                throw ctx.endedException(source);
            }
        }
    }

    synchronized double availableTokens() {
        refill();
        return tokens;
    }

    double maxTokens()  { return maxTokens; }
    double refillRate() { return refillRate; }

    private void refill() {
        long now = System.nanoTime();
        double elapsedSeconds = (now - lastRefillNanos) / NANOS_PER_SECOND;
        tokens = Math.min(maxTokens, tokens + elapsedSeconds * refillRate);
        lastRefillNanos = now;
    }
}
